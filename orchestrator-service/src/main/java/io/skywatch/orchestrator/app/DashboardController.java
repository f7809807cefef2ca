package io.skywatch.orchestrator.app;

import io.skywatch.bus.BusUnavailableException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Polled JSON snapshots for the monitoring dashboard. Answers {@code 503} with an error payload
 * while the bus is unreachable.
 */
@RestController
@RequestMapping("/api")
public class DashboardController {

    private static final Logger log = LoggerFactory.getLogger(DashboardController.class);

    private final DashboardService dashboard;
    private final Clock clock;

    public DashboardController(DashboardService dashboard, Clock clock) {
        this.dashboard = Objects.requireNonNull(dashboard, "dashboard");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        log.debug("[REST] GET /api/status");
        return ResponseEntity.ok(dashboard.status());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        log.debug("[REST] GET /api/health");
        return ResponseEntity.ok(dashboard.health());
    }

    @GetMapping("/sensors")
    public ResponseEntity<Map<String, Object>> sensors() {
        log.debug("[REST] GET /api/sensors");
        return ResponseEntity.ok(dashboard.sensors());
    }

    @GetMapping("/correlator")
    public ResponseEntity<Map<String, Object>> correlator() {
        log.debug("[REST] GET /api/correlator");
        return ResponseEntity.ok(dashboard.correlator());
    }

    @ExceptionHandler(BusUnavailableException.class)
    public ResponseEntity<Map<String, Object>> busUnavailable(BusUnavailableException ex) {
        log.warn("[REST] bus unavailable: {}", ex.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", clock.instant().toString());
        body.put("error", "bus unavailable");
        body.put("code", ex.error().code());
        body.put("detail", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
