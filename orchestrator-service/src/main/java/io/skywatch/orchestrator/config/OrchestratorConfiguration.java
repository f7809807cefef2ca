package io.skywatch.orchestrator.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.skywatch.bus.ExponentialBackoff;
import io.skywatch.bus.Sleeper;
import io.skywatch.bus.StreamBus;
import io.skywatch.checkpoint.CheckpointStore;
import io.skywatch.checkpoint.JsonFileCheckpointStore;
import io.skywatch.orchestrator.app.DashboardService;
import io.skywatch.orchestrator.app.LivenessMonitor;
import io.skywatch.orchestrator.app.ObservationMetrics;
import io.skywatch.orchestrator.app.ObservationOrchestrator;
import io.skywatch.orchestrator.app.OrchestratorLifecycle;
import io.skywatch.orchestrator.domain.OrchestratorCheckpoint;
import io.skywatch.orchestrator.domain.StateCommandPlanner;
import io.skywatch.protocol.ProtocolCodec;
import io.skywatch.schedule.ObservationSchedule;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class OrchestratorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfiguration.class);

    @Bean
    Clock orchestratorClock() {
        return Clock.systemUTC();
    }

    @Bean
    ProtocolCodec protocolCodec() {
        return ProtocolCodec.withDefaults();
    }

    @Bean
    ObservationSchedule observationSchedule(OrchestratorProperties properties) {
        ObservationSchedule schedule = properties.getSchedule().toScheduleSpec().toSchedule();
        log.info("Observation schedule: {} steps, cycle {}s: {}", schedule.size(),
            schedule.cycleLength().toSeconds(), schedule.fingerprint());
        return schedule;
    }

    @Bean
    StateCommandPlanner stateCommandPlanner(OrchestratorProperties properties) {
        Map<String, Object> params = new LinkedHashMap<>(properties.getCorrelator().getParams());
        return new StateCommandPlanner(properties.getVna().toArgs(), params);
    }

    @Bean
    CheckpointStore<OrchestratorCheckpoint> orchestratorCheckpointStore(OrchestratorProperties properties) {
        return new JsonFileCheckpointStore<>(ProtocolCodec.defaultObjectMapper(), properties.getCheckpointFile(),
            OrchestratorCheckpoint.class);
    }

    @Bean
    LivenessMonitor livenessMonitor(StreamBus bus, OrchestratorProperties properties, Clock orchestratorClock) {
        return new LivenessMonitor(bus, properties.getTarget(), properties.getLiveness().getPollInterval(),
            properties.getLiveness().getMissedThreshold(), orchestratorClock);
    }

    @Bean
    ObservationMetrics observationMetrics(MeterRegistry meterRegistry, OrchestratorProperties properties) {
        return new ObservationMetrics(meterRegistry, properties.getTarget());
    }

    @Bean
    ObservationOrchestrator observationOrchestrator(StreamBus bus,
                                                    ProtocolCodec codec,
                                                    ObservationSchedule schedule,
                                                    StateCommandPlanner planner,
                                                    LivenessMonitor liveness,
                                                    CheckpointStore<OrchestratorCheckpoint> orchestratorCheckpointStore,
                                                    ObservationMetrics metrics,
                                                    OrchestratorProperties properties,
                                                    Clock orchestratorClock) {
        OrchestratorProperties.Loop loop = properties.getLoop();
        ObservationOrchestrator.Settings settings = new ObservationOrchestrator.Settings(
            properties.getTarget(),
            properties.getCommandTimeout(),
            properties.getMaxAttempts(),
            loop.getBlockTimeout(),
            new ExponentialBackoff(loop.getBackoffInitial(), loop.getBackoffMax(), 2.0));
        return new ObservationOrchestrator(bus, codec, schedule, planner, liveness, orchestratorCheckpointStore,
            metrics, settings, Sleeper.SYSTEM, orchestratorClock);
    }

    @Bean
    DashboardService dashboardService(StreamBus bus,
                                      ProtocolCodec codec,
                                      ObservationOrchestrator orchestrator,
                                      LivenessMonitor liveness,
                                      OrchestratorProperties properties,
                                      Clock orchestratorClock) {
        return new DashboardService(bus, codec, orchestrator, liveness, properties.getTarget(),
            properties.getDashboard().getSensors(), orchestratorClock);
    }

    @Bean
    OrchestratorLifecycle orchestratorLifecycle(ObservationOrchestrator orchestrator, LivenessMonitor liveness) {
        return new OrchestratorLifecycle(orchestrator, liveness);
    }
}
