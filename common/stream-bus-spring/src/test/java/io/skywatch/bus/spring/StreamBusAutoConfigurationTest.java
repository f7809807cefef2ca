package io.skywatch.bus.spring;

import static org.assertj.core.api.Assertions.assertThat;

import io.skywatch.bus.BusSettings;
import io.skywatch.bus.StreamBus;
import io.skywatch.bus.transport.InMemoryStreamTransport;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class StreamBusAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(StreamBusAutoConfiguration.class));

    @Test
    void memoryModeProvidesAnOpenBus() {
        contextRunner
            .withPropertyValues("skywatch.bus.mode=memory")
            .run(context -> {
                assertThat(context).hasSingleBean(StreamBus.class);
                assertThat(context.getBean(StreamBus.class).isOpen()).isTrue();
                assertThat(context).getBean("streamTransport").isInstanceOf(InMemoryStreamTransport.class);
            });
    }

    @Test
    void bindsRetryAndRetentionSettings() {
        contextRunner
            .withPropertyValues(
                "skywatch.bus.mode=memory",
                "skywatch.bus.publish-attempts=5",
                "skywatch.bus.backoff.initial=50ms",
                "skywatch.bus.retention.data=500",
                "skywatch.bus.retention.status=100")
            .run(context -> {
                BusSettings settings = context.getBean(StreamBusProperties.class).toBusSettings();
                assertThat(settings.publishAttempts()).isEqualTo(5);
                assertThat(settings.backoff().initial()).isEqualTo(Duration.ofMillis(50));
                assertThat(settings.retention().maxLengthFor("data:therm")).isEqualTo(500L);
                assertThat(settings.retention().maxLengthFor("status:panda")).isEqualTo(100L);
                assertThat(settings.retention().maxLengthFor("ctrl:panda")).isZero();
            });
    }

    @Test
    void invalidPortFailsStartup() {
        contextRunner
            .withPropertyValues("skywatch.bus.mode=memory", "skywatch.bus.port=0")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void defaultRetentionCapsDataStreams() {
        StreamBusProperties properties = new StreamBusProperties();

        assertThat(properties.getRetention()).isEqualTo(Map.of("data", 10_000L));
        assertThat(properties.toBusSettings().retention().maxLengthFor("data:vna")).isEqualTo(10_000L);
    }
}
