package io.skywatch.orchestrator.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.skywatch.bus.BusSettings;
import io.skywatch.bus.EntryId;
import io.skywatch.bus.ExponentialBackoff;
import io.skywatch.bus.StreamBus;
import io.skywatch.bus.transport.InMemoryStreamTransport;
import io.skywatch.checkpoint.InMemoryCheckpointStore;
import io.skywatch.orchestrator.domain.OrchestratorCheckpoint;
import io.skywatch.orchestrator.domain.OrchestratorState;
import io.skywatch.orchestrator.domain.StateCommandPlanner;
import io.skywatch.protocol.Command;
import io.skywatch.protocol.CommandOp;
import io.skywatch.protocol.ProtocolCodec;
import io.skywatch.protocol.StatusRecord;
import io.skywatch.schedule.CalibrationState;
import io.skywatch.schedule.ObservationSchedule;
import io.skywatch.schedule.ScheduleSpec;
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

class ObservationOrchestratorTest {

    private static final String TARGET = "panda";
    private static final Duration TTL = Duration.ofSeconds(5);

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
    private final ProtocolCodec codec = ProtocolCodec.withDefaults();
    private final List<Duration> sleeps = new ArrayList<>();
    private final ObservationSchedule schedule = ScheduleSpec.of(
        Map.of(CalibrationState.SKY, 2, CalibrationState.LOAD, 1, CalibrationState.NOISE, 1),
        Map.of(CalibrationState.SKY, Duration.ofSeconds(10),
            CalibrationState.LOAD, Duration.ofSeconds(5),
            CalibrationState.NOISE, Duration.ofSeconds(5)),
        List.of(CalibrationState.SKY, CalibrationState.LOAD, CalibrationState.NOISE)).toSchedule();

    private InMemoryStreamTransport transport;
    private StreamBus bus;
    private LivenessMonitor liveness;
    private SimpleMeterRegistry registry;
    private InMemoryCheckpointStore<OrchestratorCheckpoint> store;

    @BeforeEach
    void setUp() {
        transport = new InMemoryStreamTransport(clock);
        bus = new StreamBus(transport, BusSettings.DEFAULTS, sleeps::add);
        bus.open().orElseThrow();
        liveness = new LivenessMonitor(bus, TARGET, Duration.ofSeconds(5), 3, clock);
        registry = new SimpleMeterRegistry();
        store = new InMemoryCheckpointStore<>();
    }

    @Test
    void startsDisconnectedWithoutHeartbeatAndRunsOnceExecutorAppears() {
        ObservationOrchestrator orchestrator = orchestrator();

        orchestrator.initialize();
        assertThat(orchestrator.state()).isEqualTo(OrchestratorState.DISCONNECTED);
        orchestrator.step();
        assertThat(commands()).isEmpty();

        heartbeat();
        liveness.poll();
        assertThat(orchestrator.step()).isEqualTo(OrchestratorState.RUNNING);
        orchestrator.step();

        assertThat(commands()).singleElement().satisfies(command -> {
            assertThat(command.sequence()).isEqualTo(1L);
            assertThat(command.op()).isEqualTo("switch");
            assertThat(command.args()).containsEntry("path", "RFANT").containsEntry("state", "sky");
        });
    }

    @Test
    void advancesOnlyForMatchingSequenceThenDwells() {
        ObservationOrchestrator orchestrator = running();
        orchestrator.step();

        reply(StatusRecord.ok(99, Map.of(), clock.instant()));
        reply(StatusRecord.ok(StatusRecord.UNSOLICITED, Map.of("event", "executor-started"), clock.instant()));
        orchestrator.step();
        assertThat(orchestrator.snapshot().index()).isZero();
        assertThat(orchestrator.snapshot().outstanding().sequence()).isEqualTo(1L);

        reply(StatusRecord.ok(1, Map.of("kind", "switch"), clock.instant()));
        orchestrator.step();
        assertThat(orchestrator.snapshot().index()).isEqualTo(1);
        assertThat(orchestrator.snapshot().outstanding()).isNull();
        assertThat(orchestrator.snapshot().dwellUntil()).isEqualTo(clock.instant().plusSeconds(10));

        orchestrator.step();
        assertThat(commands()).hasSize(1);

        clock.advance(Duration.ofSeconds(10));
        orchestrator.step();
        assertThat(commands()).extracting(Command::sequence).containsExactly(1L, 2L);
    }

    @Test
    void walksTheWholeCycleInOrder() {
        ObservationOrchestrator orchestrator = running();
        for (long sequence = 1; sequence <= 5; sequence++) {
            orchestrator.step();
            reply(StatusRecord.ok(sequence, Map.of(), clock.instant()));
            orchestrator.step();
            clock.advance(Duration.ofSeconds(10));
            heartbeat();
        }

        assertThat(commands()).extracting(command -> command.args().get("path"))
            .containsExactly("RFANT", "RFANT", "RFLOAD", "RFNON", "RFANT");
        assertThat(orchestrator.snapshot().cycle()).isEqualTo(1L);
        assertThat(orchestrator.snapshot().index()).isEqualTo(1);
    }

    @Test
    void errorStatusRetriesWithNewSequenceThenSkipsTheStep() {
        ObservationOrchestrator orchestrator = running();
        orchestrator.step();

        for (long sequence = 1; sequence <= 3; sequence++) {
            reply(StatusRecord.error(sequence, "switch timeout", Map.of("kind", "switch"), clock.instant()));
            orchestrator.step();
        }

        List<Command> sent = commands();
        assertThat(sent).extracting(Command::sequence).containsExactly(1L, 2L, 3L);
        assertThat(sent).extracting(Command::args).containsOnly(sent.get(0).args());
        assertThat(orchestrator.snapshot().index()).isEqualTo(1);
        assertThat(orchestrator.snapshot().outstanding()).isNull();
        assertThat(registry.get(ObservationMetrics.SKIPPED).counter().count()).isEqualTo(1.0);
        assertThat(registry.get(ObservationMetrics.RETRIED).tag("reason", "error").counter().count()).isEqualTo(2.0);

        orchestrator.step();
        assertThat(commands()).extracting(Command::sequence).containsExactly(1L, 2L, 3L, 4L);
        assertThat(registry.get(ObservationMetrics.ISSUED).counter().count()).isEqualTo(4.0);
    }

    @Test
    void missingStatusIsRedeliveredWithSameSequenceThenDisconnects() {
        ObservationOrchestrator orchestrator = running();
        orchestrator.step();

        for (int delivery = 2; delivery <= 3; delivery++) {
            clock.advance(Duration.ofSeconds(30));
            orchestrator.step();
            assertThat(orchestrator.snapshot().outstanding().deliveries()).isEqualTo(delivery);
        }
        clock.advance(Duration.ofSeconds(30));
        assertThat(orchestrator.step()).isEqualTo(OrchestratorState.DISCONNECTED);
        assertThat(commands()).extracting(Command::sequence).containsExactly(1L, 1L, 1L);

        orchestrator.step();
        assertThat(orchestrator.state()).isEqualTo(OrchestratorState.DISCONNECTED);

        heartbeat();
        liveness.poll();
        assertThat(orchestrator.step()).isEqualTo(OrchestratorState.RUNNING);
        assertThat(commands()).extracting(Command::sequence).containsExactly(1L, 1L, 1L, 1L);
    }

    @Test
    void heartbeatLossDisconnectsWithinThresholdAndResumesWithSameSequence() {
        ObservationOrchestrator orchestrator = running();
        orchestrator.step();

        for (int poll = 1; poll <= 3; poll++) {
            clock.advance(TTL);
            liveness.poll();
            orchestrator.step();
            if (poll < 3) {
                assertThat(orchestrator.state()).isEqualTo(OrchestratorState.RUNNING);
            }
        }
        assertThat(orchestrator.state()).isEqualTo(OrchestratorState.DISCONNECTED);
        assertThat(orchestrator.snapshot().outstanding().sequence()).isEqualTo(1L);

        heartbeat();
        liveness.poll();
        assertThat(orchestrator.step()).isEqualTo(OrchestratorState.RUNNING);
        reply(StatusRecord.ok(1, Map.of(), clock.instant()));
        orchestrator.step();
        clock.advance(Duration.ofSeconds(10));
        heartbeat();
        orchestrator.step();

        assertThat(commands()).extracting(Command::sequence).containsExactly(1L, 1L, 2L);
    }

    @Test
    void errorArrivingWhileDisconnectedHoldsRetryUntilExecutorIsBack() {
        ObservationOrchestrator orchestrator = running();
        orchestrator.step();
        for (int poll = 1; poll <= 3; poll++) {
            clock.advance(TTL);
            liveness.poll();
            orchestrator.step();
        }
        assertThat(orchestrator.state()).isEqualTo(OrchestratorState.DISCONNECTED);

        reply(StatusRecord.error(1, "switch timeout", Map.of("kind", "switch"), clock.instant()));
        assertThat(orchestrator.step()).isEqualTo(OrchestratorState.DISCONNECTED);

        assertThat(commands()).extracting(Command::sequence).containsExactly(1L);
        assertThat(orchestrator.snapshot().outstanding().sequence()).isEqualTo(2L);
        assertThat(orchestrator.snapshot().outstanding().published()).isFalse();
        assertThat(store.load()).hasValueSatisfying(checkpoint -> {
            assertThat(checkpoint.outstanding().sequence()).isEqualTo(2L);
            assertThat(checkpoint.nextSequence()).isEqualTo(3L);
        });

        heartbeat();
        liveness.poll();
        assertThat(orchestrator.step()).isEqualTo(OrchestratorState.RUNNING);
        assertThat(commands()).extracting(Command::sequence).containsExactly(1L, 2L);
        assertThat(orchestrator.snapshot().outstanding().deliveries()).isEqualTo(1);
    }

    @Test
    void pauseWaitsForOutstandingCommandAndResumeContinues() {
        ObservationOrchestrator orchestrator = running();
        orchestrator.step();

        assertThat(orchestrator.requestPause()).isTrue();
        orchestrator.step();
        assertThat(orchestrator.state()).isEqualTo(OrchestratorState.RUNNING);

        reply(StatusRecord.ok(1, Map.of(), clock.instant()));
        orchestrator.step();
        clock.advance(Duration.ofSeconds(10));
        assertThat(orchestrator.step()).isEqualTo(OrchestratorState.PAUSED);
        orchestrator.step();
        assertThat(commands()).hasSize(1);

        orchestrator.requestResume();
        assertThat(orchestrator.step()).isEqualTo(OrchestratorState.RUNNING);
        orchestrator.step();
        assertThat(commands()).extracting(Command::sequence).containsExactly(1L, 2L);
    }

    @Test
    void stopIsTerminalAndIssuesNothingFurther() {
        ObservationOrchestrator orchestrator = running();
        orchestrator.step();

        assertThat(orchestrator.requestStop()).isTrue();
        assertThat(orchestrator.step()).isEqualTo(OrchestratorState.STOPPED);

        reply(StatusRecord.ok(1, Map.of(), clock.instant()));
        clock.advance(Duration.ofMinutes(5));
        orchestrator.step();
        assertThat(orchestrator.requestPause()).isFalse();
        assertThat(orchestrator.requestResume()).isFalse();
        assertThat(commands()).hasSize(1);
    }

    @Test
    void restartResumesCursorAndSequenceFromCheckpoint() {
        ObservationOrchestrator first = running();
        first.step();
        reply(StatusRecord.ok(1, Map.of(), clock.instant()));
        first.step();
        first.step();

        ObservationOrchestrator second = orchestrator();
        second.initialize();

        assertThat(second.snapshot().index()).isEqualTo(1);
        assertThat(second.snapshot().nextSequence()).isEqualTo(2L);

        second.step();
        assertThat(commands()).extracting(Command::sequence).containsExactly(1L, 2L);
    }

    @Test
    void restartReissuesOutstandingCommandWithSameSequence() {
        ObservationOrchestrator first = running();
        first.step();

        ObservationOrchestrator second = orchestrator();
        second.initialize();

        assertThat(second.state()).isEqualTo(OrchestratorState.RUNNING);
        assertThat(commands()).extracting(Command::sequence).containsExactly(1L, 1L);
        assertThat(second.snapshot().nextSequence()).isEqualTo(2L);
    }

    @Test
    void freshStartContinuesAfterHighestSequenceOnControlStream() {
        bus.publish("ctrl:" + TARGET, codec.encodeCommand(
            Command.of(41, CommandOp.SWITCH, Map.of("path", "RFLOAD"), clock.instant()))).orElseThrow();
        heartbeat();

        ObservationOrchestrator orchestrator = orchestrator();
        orchestrator.initialize();
        orchestrator.step();

        assertThat(commands()).extracting(Command::sequence).containsExactly(41L, 42L);
    }

    @Test
    void changedScheduleRestartsCycleButKeepsSequences() {
        store = new InMemoryCheckpointStore<>(new OrchestratorCheckpoint(3, 2, 10, null, "(sky,99)",
            EntryId.ZERO.toString(), false, clock.instant()));
        heartbeat();

        ObservationOrchestrator orchestrator = orchestrator();
        orchestrator.initialize();

        assertThat(orchestrator.snapshot().cycle()).isZero();
        assertThat(orchestrator.snapshot().index()).isZero();
        assertThat(orchestrator.snapshot().nextSequence()).isEqualTo(10L);
    }

    @Test
    void commandIsPersistedBeforePublishAndSentOnceBusReturns() {
        ObservationOrchestrator orchestrator = running();
        transport.setAvailable(false);

        orchestrator.step();

        assertThat(store.load()).hasValueSatisfying(checkpoint -> {
            assertThat(checkpoint.outstanding().sequence()).isEqualTo(1L);
            assertThat(checkpoint.outstanding().publishedAt()).isNull();
            assertThat(checkpoint.nextSequence()).isEqualTo(2L);
        });
        assertThat(orchestrator.snapshot().lastBusError()).isNotNull();

        transport.setAvailable(true);
        orchestrator.step();

        assertThat(commands()).extracting(Command::sequence).containsExactly(1L);
        assertThat(orchestrator.snapshot().outstanding().published()).isTrue();
    }

    @Test
    void checkpointFailureHoldsCommandsUntilItSucceeds() {
        ObservationOrchestrator orchestrator = running();
        store.setFailing(true);

        orchestrator.step();
        assertThat(commands()).isEmpty();

        store.setFailing(false);
        orchestrator.step();
        assertThat(commands()).extracting(Command::sequence).containsExactly(1L);
    }

    private ObservationOrchestrator running() {
        heartbeat();
        ObservationOrchestrator orchestrator = orchestrator();
        orchestrator.initialize();
        assertThat(orchestrator.state()).isEqualTo(OrchestratorState.RUNNING);
        return orchestrator;
    }

    private ObservationOrchestrator orchestrator() {
        ObservationOrchestrator.Settings settings = new ObservationOrchestrator.Settings(TARGET,
            Duration.ofSeconds(30), 3, Duration.ZERO, new ExponentialBackoff(Duration.ofMillis(10), Duration.ofMillis(100), 2.0));
        return new ObservationOrchestrator(bus, codec, schedule,
            new StateCommandPlanner(Map.of("npoints", 11), Map.of()), liveness, store,
            new ObservationMetrics(registry, TARGET), settings, sleeps::add, clock);
    }

    private void heartbeat() {
        bus.refreshHeartbeat("heartbeat:" + TARGET, TTL).orElseThrow();
    }

    private void reply(StatusRecord status) {
        bus.publish("status:" + TARGET, codec.encodeStatus(status)).orElseThrow();
    }

    private List<Command> commands() {
        return bus.read("ctrl:" + TARGET, EntryId.ZERO, Duration.ZERO).orElseThrow()
            .stream().map(codec::decodeCommand).toList();
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
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
            return now;
        }
    }
}
