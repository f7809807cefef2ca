package io.skywatch.bus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.skywatch.bus.transport.InMemoryStreamTransport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StreamBusTest {

    private MutableClock clock;
    private InMemoryStreamTransport transport;
    private List<Duration> sleeps;
    private StreamBus bus;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        transport = new InMemoryStreamTransport(clock);
        sleeps = new ArrayList<>();
        bus = new StreamBus(transport, BusSettings.DEFAULTS, sleeps::add);
        assertThat(bus.open().isOk()).isTrue();
    }

    @Test
    void assignsStrictlyIncreasingIdsWithinAStream() {
        EntryId first = bus.publish("ctrl:panda", Map.of("op", "switch")).value();
        EntryId second = bus.publish("ctrl:panda", Map.of("op", "vna")).value();
        clock.advance(Duration.ofMillis(5));
        EntryId third = bus.publish("ctrl:panda", Map.of("op", "sensor")).value();

        assertThat(second).isGreaterThan(first);
        assertThat(third).isGreaterThan(second);
    }

    @Test
    void readResumesAfterCursorWithoutSkippingOrRepeating() {
        EntryId first = bus.publish("status:panda", Map.of("sequence", "1")).value();
        bus.publish("status:panda", Map.of("sequence", "2"));
        bus.publish("status:panda", Map.of("sequence", "3"));

        List<StreamEntry> afterFirst = bus.read("status:panda", first, Duration.ZERO).value();

        assertThat(afterFirst).extracting(entry -> entry.field("sequence")).containsExactly("2", "3");
        EntryId last = afterFirst.get(afterFirst.size() - 1).id();
        assertThat(bus.read("status:panda", last, Duration.ZERO).value()).isEmpty();
    }

    @Test
    void blockingReadTimesOutWithEmptySuccess() {
        BusResult<List<StreamEntry>> result = bus.read("status:panda", EntryId.ZERO, Duration.ofMillis(20));

        assertThat(result.isOk()).isTrue();
        assertThat(result.value()).isEmpty();
    }

    @Test
    void heartbeatExpiresAfterTtl() {
        bus.refreshHeartbeat("heartbeat:panda", Duration.ofSeconds(5));
        assertThat(bus.isAlive("heartbeat:panda").value()).isTrue();

        clock.advance(Duration.ofSeconds(5));

        assertThat(bus.isAlive("heartbeat:panda").value()).isFalse();
    }

    @Test
    void markDeadOverridesLiveHeartbeat() {
        bus.refreshHeartbeat("heartbeat:panda", Duration.ofSeconds(60));
        bus.markDead("heartbeat:panda");

        assertThat(bus.isAlive("heartbeat:panda").value()).isFalse();
    }

    @Test
    void outageIsReportedAsUnavailableAfterRetries() {
        transport.setAvailable(false);

        BusResult<EntryId> result = bus.publish("ctrl:panda", Map.of("op", "switch"));

        assertThat(result.isOk()).isFalse();
        assertThat(result.error().cause()).isEqualTo(BusErrorCause.UNAVAILABLE);
        assertThat(result.error().attempts()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(200), Duration.ofMillis(400));
        assertThat(transport.size("ctrl:panda")).isZero();
    }

    @Test
    void heartbeatAndReadFailuresAreWrappedToo() {
        transport.setAvailable(false);

        assertThat(bus.refreshHeartbeat("heartbeat:panda", Duration.ofSeconds(5)).error().cause())
            .isEqualTo(BusErrorCause.UNAVAILABLE);
        assertThat(bus.isAlive("heartbeat:panda").error().cause()).isEqualTo(BusErrorCause.UNAVAILABLE);
        assertThat(bus.read("status:panda", EntryId.ZERO, Duration.ZERO).error().cause())
            .isEqualTo(BusErrorCause.UNAVAILABLE);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void unexpectedTransportExceptionBecomesTypedResult() {
        StreamTransport failing = mock(StreamTransport.class);
        when(failing.append(eq("ctrl:panda"), any(), anyLong())).thenThrow(new IllegalStateException("boom"));
        when(failing.classify(any())).thenReturn(BusErrorCause.PROTOCOL);
        StreamBus flaky = new StreamBus(failing, BusSettings.DEFAULTS, sleeps::add);

        BusResult<EntryId> result = flaky.publish("ctrl:panda", Map.of("op", "switch"));

        assertThat(result.error().cause()).isEqualTo(BusErrorCause.PROTOCOL);
        assertThat(result.error().message()).isEqualTo("boom");
        verify(failing, times(3)).append(eq("ctrl:panda"), any(), anyLong());
    }

    @Test
    void invalidArgumentsAreRejectedWithoutTouchingTransport() {
        StreamTransport untouched = mock(StreamTransport.class);
        StreamBus guarded = new StreamBus(untouched, BusSettings.DEFAULTS, sleeps::add);

        assertThat(guarded.publish(" ", Map.of("a", "b")).error().cause()).isEqualTo(BusErrorCause.INVALID_REQUEST);
        assertThat(guarded.publish("ctrl:panda", Map.of()).error().cause()).isEqualTo(BusErrorCause.INVALID_REQUEST);
        assertThat(guarded.refreshHeartbeat("heartbeat:panda", Duration.ZERO).error().cause())
            .isEqualTo(BusErrorCause.INVALID_REQUEST);
        verify(untouched, times(0)).append(any(), any(), anyLong());
    }

    @Test
    void closedHandleFailsFast() {
        bus.close();

        BusResult<EntryId> result = bus.publish("ctrl:panda", Map.of("op", "switch"));

        assertThat(result.error().cause()).isEqualTo(BusErrorCause.CLOSED);
        assertThatThrownBy(result::orElseThrow).isInstanceOf(BusUnavailableException.class);
    }

    @Test
    void retentionCapsDataStreamsOnly() {
        StreamBus capped = new StreamBus(transport,
            new BusSettings(1, ExponentialBackoff.DEFAULT, new StreamRetention(Map.of("data:", 2L))), sleeps::add);
        for (int i = 0; i < 5; i++) {
            capped.publish("data:therm", Map.of("value", Integer.toString(i)));
            capped.publish("ctrl:panda", Map.of("value", Integer.toString(i)));
        }

        assertThat(transport.size("data:therm")).isEqualTo(2);
        assertThat(transport.size("ctrl:panda")).isEqualTo(5);
        assertThat(capped.readLatest("data:therm", 1).value())
            .singleElement()
            .extracting(entry -> entry.field("value"))
            .isEqualTo("4");
    }

    private static final class MutableClock extends Clock {
        private Instant current;

        private MutableClock(Instant current) {
            this.current = current;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return current;
        }

        void advance(Duration duration) {
            current = current.plus(duration);
        }
    }
}
