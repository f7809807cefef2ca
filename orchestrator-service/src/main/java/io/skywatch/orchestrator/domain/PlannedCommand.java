package io.skywatch.orchestrator.domain;

import io.skywatch.protocol.CommandOp;
import java.util.Map;
import java.util.Objects;

public record PlannedCommand(CommandOp op, Map<String, Object> args) {

    public PlannedCommand {
        Objects.requireNonNull(op, "op");
        args = args == null ? Map.of() : Map.copyOf(args);
    }
}
