package io.skywatch.orchestrator.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.skywatch.schedule.InvalidScheduleException;
import io.skywatch.schedule.ObservationSchedule;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class OrchestratorPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
        .withUserConfiguration(PropertiesConfig.class);

    @Test
    void defaultsDescribeThirtySecondCycle() {
        ObservationSchedule schedule = new OrchestratorProperties().getSchedule().toScheduleSpec().toSchedule();

        assertThat(schedule.size()).isEqualTo(4);
        assertThat(schedule.cycleLength()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void bindsScheduleAndCorrelatorParams() {
        runner.withPropertyValues(
                "skywatch.orchestrator.target= rig2 ",
                "skywatch.orchestrator.schedule.counts.sky=3",
                "skywatch.orchestrator.schedule.order=sky,load",
                "skywatch.orchestrator.schedule.vna-count=1",
                "skywatch.orchestrator.correlator.params[acc_bins]=4",
                "skywatch.orchestrator.liveness.missed-threshold=5")
            .run(context -> {
                OrchestratorProperties properties = context.getBean(OrchestratorProperties.class);
                assertThat(properties.getTarget()).isEqualTo("rig2");
                assertThat(properties.getSchedule().getCounts()).containsEntry("sky", 3);
                assertThat(properties.getSchedule().getOrder()).containsExactly("sky", "load");
                assertThat(properties.getCorrelator().getParams()).containsEntry("acc_bins", "4");
                assertThat(properties.getLiveness().getMissedThreshold()).isEqualTo(5);
                assertThat(properties.getSchedule().toScheduleSpec().vnaCount()).isEqualTo(1);
            });
    }

    @Test
    void unknownStateNameIsRejected() {
        OrchestratorProperties.Schedule schedule = new OrchestratorProperties().getSchedule();
        schedule.setOrder(List.of("sky", "moon"));

        assertThatThrownBy(schedule::toScheduleSpec).isInstanceOf(InvalidScheduleException.class);
    }

    @Test
    void invalidMaxAttemptsFailsStartup() {
        runner.withPropertyValues("skywatch.orchestrator.max-attempts=0")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void vnaArgsCarryPerModePower() {
        Map<String, Object> args = new OrchestratorProperties().getVna().toArgs();

        assertThat(args).containsEntry("modes", List.of("ant", "rec"))
            .containsEntry("power_dbm", Map.of("ant", 0.0, "rec", -40.0))
            .containsEntry("npoints", 1000);
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(OrchestratorProperties.class)
    static class PropertiesConfig {
    }
}
