package io.skywatch.orchestrator.app;

import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.skywatch.bus.BusSettings;
import io.skywatch.bus.ExponentialBackoff;
import io.skywatch.bus.StreamBus;
import io.skywatch.bus.transport.InMemoryStreamTransport;
import io.skywatch.checkpoint.InMemoryCheckpointStore;
import io.skywatch.orchestrator.domain.StateCommandPlanner;
import io.skywatch.protocol.DataRecord;
import io.skywatch.protocol.ProtocolCodec;
import io.skywatch.schedule.CalibrationState;
import io.skywatch.schedule.ScheduleSpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class DashboardControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final ProtocolCodec codec = ProtocolCodec.withDefaults();

    private InMemoryStreamTransport transport;
    private StreamBus bus;
    private LivenessMonitor liveness;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        transport = new InMemoryStreamTransport(clock);
        bus = new StreamBus(transport, BusSettings.DEFAULTS, delay -> { });
        bus.open().orElseThrow();
        bus.refreshHeartbeat("heartbeat:panda", Duration.ofSeconds(5)).orElseThrow();
        liveness = new LivenessMonitor(bus, "panda", Duration.ofSeconds(5), 3, clock);
        ObservationOrchestrator orchestrator = new ObservationOrchestrator(bus, codec,
            ScheduleSpec.of(Map.of(CalibrationState.SKY, 1), Map.of(CalibrationState.SKY, Duration.ofSeconds(10)),
                List.of(CalibrationState.SKY)).toSchedule(),
            new StateCommandPlanner(Map.of(), Map.of()), liveness, new InMemoryCheckpointStore<>(),
            new ObservationMetrics(new SimpleMeterRegistry(), "panda"),
            new ObservationOrchestrator.Settings("panda", Duration.ofSeconds(30), 3, Duration.ZERO, ExponentialBackoff.DEFAULT),
            delay -> { }, clock);
        orchestrator.initialize();
        DashboardService dashboard = new DashboardService(bus, codec, orchestrator, liveness, "panda",
            List.of("therm", "imu"), clock);
        mvc = MockMvcBuilders.standaloneSetup(new DashboardController(dashboard, clock))
            .setMessageConverters(new MappingJackson2HttpMessageConverter(new ObjectMapper()))
            .build();
    }

    @Test
    void statusReportsStateMachinePosition() throws Exception {
        mvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.timestamp").value(NOW.toString()))
            .andExpect(jsonPath("$.state").value("running"))
            .andExpect(jsonPath("$.executor_connected").value(true))
            .andExpect(jsonPath("$.cursor.step").value("sky"))
            .andExpect(jsonPath("$.next_sequence").value(1))
            .andExpect(jsonPath("$.outstanding").value(nullValue()));
    }

    @Test
    void statusFlagsLostExecutor() throws Exception {
        for (int poll = 0; poll < 3; poll++) {
            bus.markDead("heartbeat:panda").orElseThrow();
            liveness.poll();
        }

        mvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.executor_connected").value(false));
    }

    @Test
    void healthShowsExecutorHeartbeat() throws Exception {
        mvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("up"))
            .andExpect(jsonPath("$.components.bus.status").value("up"))
            .andExpect(jsonPath("$.components.executor.status").value("up"))
            .andExpect(jsonPath("$.components.executor.connected").value(true));
    }

    @Test
    void sensorsReturnLatestReadingPerSensor() throws Exception {
        bus.publish("data:therm", codec.encodeData(new DataRecord("therm", Map.of("temp_c", 24.0), NOW))).orElseThrow();
        bus.publish("data:therm", codec.encodeData(new DataRecord("therm", Map.of("temp_c", 25.5), NOW))).orElseThrow();

        mvc.perform(get("/api/sensors"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sensors.therm.temp_c").value(25.5))
            .andExpect(jsonPath("$.sensors.therm.recorded_at").value(NOW.toString()))
            .andExpect(jsonPath("$.sensors.imu").value(nullValue()));
    }

    @Test
    void correlatorReturnsStoredConfiguration() throws Exception {
        mvc.perform(get("/api/correlator"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.configured").value(false));

        bus.putValue("correlator:config", "{\"corr_acc_len\":\"134217728\"}").orElseThrow();

        mvc.perform(get("/api/correlator"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.configured").value(true))
            .andExpect(jsonPath("$.config.corr_acc_len").value("134217728"));
    }

    @Test
    void unreachableBusAnswers503WithErrorPayload() throws Exception {
        transport.setAvailable(false);

        for (String path : List.of("/api/status", "/api/health", "/api/sensors", "/api/correlator")) {
            mvc.perform(get(path))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.timestamp").value(NOW.toString()))
                .andExpect(jsonPath("$.error").value("bus unavailable"))
                .andExpect(jsonPath("$.code").value("unavailable"));
        }
    }
}
