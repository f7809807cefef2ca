package io.skywatch.orchestrator.app;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.skywatch.orchestrator.domain.OrchestratorState;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer meters for command traffic and the state machine position.
 */
public class ObservationMetrics {

    static final String ISSUED = "skywatch.commands.issued";
    static final String RETRIED = "skywatch.commands.retried";
    static final String SKIPPED = "skywatch.states.skipped";
    static final String STATE = "skywatch.orchestrator.state";

    private final MeterRegistry registry;
    private final Tags tags;
    private final Counter issued;
    private final Counter skipped;
    private final AtomicInteger stateCode = new AtomicInteger(OrchestratorState.INIT.code());

    public ObservationMetrics(MeterRegistry registry, String target) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.tags = Tags.of("target", Objects.requireNonNull(target, "target"));
        this.issued = Counter.builder(ISSUED)
            .description("Commands published with a newly assigned sequence")
            .tags(tags)
            .register(registry);
        this.skipped = Counter.builder(SKIPPED)
            .description("Schedule steps abandoned after exhausting their attempts")
            .tags(tags)
            .register(registry);
        Gauge.builder(STATE, stateCode, AtomicInteger::doubleValue)
            .description("Orchestrator state code (0=init,1=running,2=paused,3=disconnected,4=stopped)")
            .tags(tags)
            .register(registry);
    }

    public void commandIssued() {
        issued.increment();
    }

    /**
     * @param reason {@code error} for a new sequence after an error status, {@code timeout} for a
     *     re-delivery of the same sequence
     */
    public void commandRetried(String reason) {
        Counter.builder(RETRIED)
            .description("Command retries by reason")
            .tags(tags.and("reason", reason))
            .register(registry)
            .increment();
    }

    public void stateSkipped() {
        skipped.increment();
    }

    public void stateChanged(OrchestratorState state) {
        stateCode.set(state.code());
    }
}
