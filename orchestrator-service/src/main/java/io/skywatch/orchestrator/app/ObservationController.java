package io.skywatch.orchestrator.app;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator requests. Each is accepted immediately and applied by the state machine at its next
 * loop boundary.
 */
@RestController
@RequestMapping("/api/observation")
public class ObservationController {

    private static final Logger log = LoggerFactory.getLogger(ObservationController.class);

    private final ObservationOrchestrator orchestrator;
    private final Clock clock;

    public ObservationController(ObservationOrchestrator orchestrator, Clock clock) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @PostMapping("/pause")
    public ResponseEntity<Map<String, Object>> pause() {
        return request("pause", orchestrator::requestPause);
    }

    @PostMapping("/resume")
    public ResponseEntity<Map<String, Object>> resume() {
        return request("resume", orchestrator::requestResume);
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        return request("stop", orchestrator::requestStop);
    }

    private ResponseEntity<Map<String, Object>> request(String action, BooleanSupplier call) {
        log.info("[REST] POST /api/observation/{}", action);
        boolean accepted = call.getAsBoolean();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", clock.instant().toString());
        body.put("action", action);
        body.put("accepted", accepted);
        body.put("state", orchestrator.state().wireName());
        return ResponseEntity.status(accepted ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT).body(body);
    }
}
