package io.skywatch.orchestrator.domain;

import io.skywatch.protocol.CommandOp;
import io.skywatch.schedule.ScheduleStep;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps schedule steps to executor commands. Sky, load and noise select a switch path; VNA runs
 * the configured scan; correlator pushes the configured parameters with the step's dwell as the
 * integration window.
 */
public class StateCommandPlanner {

    private final Map<String, Object> vnaArgs;
    private final Map<String, Object> correlatorParams;

    public StateCommandPlanner(Map<String, Object> vnaArgs, Map<String, Object> correlatorParams) {
        this.vnaArgs = Map.copyOf(Objects.requireNonNull(vnaArgs, "vnaArgs"));
        this.correlatorParams = Map.copyOf(Objects.requireNonNull(correlatorParams, "correlatorParams"));
    }

    public PlannedCommand plan(ScheduleStep step) {
        Objects.requireNonNull(step, "step");
        return switch (step.state()) {
            case SKY -> switchTo("RFANT", step);
            case LOAD -> switchTo("RFLOAD", step);
            case NOISE -> switchTo("RFNON", step);
            case VNA -> new PlannedCommand(CommandOp.VNA, vnaArgs);
            case CORRELATOR -> {
                Map<String, Object> args = new LinkedHashMap<>();
                args.put("params", correlatorParams);
                args.put("integration_seconds", step.duration().toSeconds());
                yield new PlannedCommand(CommandOp.CORRELATOR, args);
            }
        };
    }

    private static PlannedCommand switchTo(String path, ScheduleStep step) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("path", path);
        args.put("state", step.state().wireName());
        return new PlannedCommand(CommandOp.SWITCH, args);
    }
}
