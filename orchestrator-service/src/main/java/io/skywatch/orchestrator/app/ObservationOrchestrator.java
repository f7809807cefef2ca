package io.skywatch.orchestrator.app;

import io.skywatch.bus.BusResult;
import io.skywatch.bus.EntryId;
import io.skywatch.bus.ExponentialBackoff;
import io.skywatch.bus.Sleeper;
import io.skywatch.bus.StreamBus;
import io.skywatch.bus.StreamEntry;
import io.skywatch.checkpoint.CheckpointException;
import io.skywatch.checkpoint.CheckpointStore;
import io.skywatch.orchestrator.domain.OrchestratorCheckpoint;
import io.skywatch.orchestrator.domain.OrchestratorSnapshot;
import io.skywatch.orchestrator.domain.OrchestratorState;
import io.skywatch.orchestrator.domain.OutstandingCommand;
import io.skywatch.orchestrator.domain.PlannedCommand;
import io.skywatch.orchestrator.domain.StateCommandPlanner;
import io.skywatch.protocol.MalformedEntryException;
import io.skywatch.protocol.ProtocolCodec;
import io.skywatch.protocol.StatusRecord;
import io.skywatch.protocol.StreamNames;
import io.skywatch.schedule.ObservationSchedule;
import io.skywatch.schedule.ScheduleCursor;
import io.skywatch.schedule.ScheduleStep;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ground-side state machine driving one target through the observation schedule.
 * <p>
 * All mutable state is owned by the loop thread; {@link #step()} is one cooperative iteration.
 * Operator requests only flip volatile flags that the loop honours at its next iteration, and
 * readers on other threads see the {@link OrchestratorSnapshot} published after each iteration.
 * <p>
 * At most one command is outstanding. A status is only acted upon when its sequence matches the
 * outstanding command; anything else is discarded.
 * <p>
 * A timed-out command is re-delivered under its own sequence. An error status is retried under a
 * fresh sequence, since the executor answers a sequence it already applied with the recorded status.
 */
public class ObservationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ObservationOrchestrator.class);
    private static final int STATUS_READ_COUNT = 64;

    private final StreamBus bus;
    private final ProtocolCodec codec;
    private final ObservationSchedule schedule;
    private final StateCommandPlanner planner;
    private final LivenessMonitor liveness;
    private final CheckpointStore<OrchestratorCheckpoint> checkpointStore;
    private final ObservationMetrics metrics;
    private final Settings settings;
    private final Sleeper sleeper;
    private final Clock clock;
    private final String controlStream;
    private final String statusStream;

    private volatile OrchestratorState state = OrchestratorState.INIT;
    private volatile boolean pauseRequested;
    private volatile boolean stopRequested;
    private volatile OrchestratorSnapshot snapshot;
    private volatile boolean running;
    private volatile ExecutorService loopExecutor;

    private ScheduleCursor cursor = ScheduleCursor.START;
    private long nextSequence = 1L;
    private OutstandingCommand outstanding;
    private EntryId statusCursor = EntryId.ZERO;
    private Instant dwellUntil;
    private StatusRecord lastStatus;
    private long alivePollsAtDisconnect;
    private int consecutiveBusFailures;
    private String lastBusError;
    private boolean checkpointDirty;

    /**
     * Loop tuning.
     *
     * @param commandTimeout how long to wait for a status before re-delivering
     * @param maxAttempts deliveries per sequence, and attempts per schedule step after error statuses
     * @param blockTimeout longest wait on the status stream per iteration
     * @param backoff delay after failed bus calls
     */
    public record Settings(String target, Duration commandTimeout, int maxAttempts, Duration blockTimeout,
                           ExponentialBackoff backoff) {

        public Settings {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(commandTimeout, "commandTimeout");
            Objects.requireNonNull(blockTimeout, "blockTimeout");
            Objects.requireNonNull(backoff, "backoff");
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
        }
    }

    public ObservationOrchestrator(StreamBus bus,
                                   ProtocolCodec codec,
                                   ObservationSchedule schedule,
                                   StateCommandPlanner planner,
                                   LivenessMonitor liveness,
                                   CheckpointStore<OrchestratorCheckpoint> checkpointStore,
                                   ObservationMetrics metrics,
                                   Settings settings,
                                   Sleeper sleeper,
                                   Clock clock) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.planner = Objects.requireNonNull(planner, "planner");
        this.liveness = Objects.requireNonNull(liveness, "liveness");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.controlStream = StreamNames.control(settings.target());
        this.statusStream = StreamNames.status(settings.target());
        publishSnapshot();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        if (state == OrchestratorState.INIT) {
            initialize();
        }
        running = true;
        loopExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "orchestrator-loop-" + settings.target());
            thread.setDaemon(true);
            return thread;
        });
        loopExecutor.execute(this::runLoop);
        log.info("Orchestrator started for {} with {}", settings.target(), schedule);
    }

    /**
     * Requests a stop and waits for the loop to reach {@link OrchestratorState#STOPPED}.
     */
    public void stop() {
        requestStop();
        ExecutorService executor;
        synchronized (this) {
            executor = loopExecutor;
            loopExecutor = null;
        }
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            long waitMillis = settings.blockTimeout().toMillis() + 5_000L;
            if (!executor.awaitTermination(waitMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Orchestrator loop did not finish within {}ms; interrupting", waitMillis);
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return {@code false} when the orchestrator is already stopped
     */
    public boolean requestPause() {
        if (state.isTerminal()) {
            return false;
        }
        pauseRequested = true;
        log.info("Pause requested (state={})", state);
        return true;
    }

    public boolean requestResume() {
        if (state.isTerminal()) {
            return false;
        }
        pauseRequested = false;
        log.info("Resume requested (state={})", state);
        return true;
    }

    public boolean requestStop() {
        if (state.isTerminal()) {
            return false;
        }
        stopRequested = true;
        log.info("Stop requested (state={})", state);
        return true;
    }

    public OrchestratorState state() {
        return state;
    }

    public OrchestratorSnapshot snapshot() {
        return snapshot;
    }

    public ObservationSchedule schedule() {
        return schedule;
    }

    /**
     * Loads the checkpoint and decides the first state from the executor's liveness.
     *
     * @throws CheckpointException when an existing checkpoint cannot be read
     */
    public synchronized void initialize() {
        if (state != OrchestratorState.INIT) {
            return;
        }
        Optional<OrchestratorCheckpoint> checkpoint = checkpointStore.load();
        if (checkpoint.isPresent()) {
            restoreFrom(checkpoint.get());
        } else {
            nextSequence = highestIssuedSequence() + 1;
            statusCursor = newestStatusId();
            log.info("No orchestrator checkpoint; starting schedule at {} with sequence {}", cursor, nextSequence);
        }
        dwellUntil = clock.instant();
        if (liveness.poll()) {
            if (outstanding != null) {
                outstanding = outstanding.rearmed();
                transition(OrchestratorState.RUNNING, "executor alive, re-issuing outstanding seq=" + outstanding.sequence());
                publishOutstanding();
            } else {
                transition(pauseRequested ? OrchestratorState.PAUSED : OrchestratorState.RUNNING, "executor alive");
            }
        } else {
            enterDisconnected("executor heartbeat not seen at startup");
        }
        saveCheckpoint();
        publishSnapshot();
    }

    /**
     * One loop iteration.
     *
     * @return the state after the iteration
     */
    public synchronized OrchestratorState step() {
        if (state == OrchestratorState.INIT) {
            initialize();
            return state;
        }
        if (state.isTerminal()) {
            return state;
        }
        if (stopRequested) {
            transition(OrchestratorState.STOPPED, outstanding == null
                ? "stop requested"
                : "stop requested; seq=" + outstanding.sequence() + " left to the executor");
            saveCheckpoint();
            publishSnapshot();
            return state;
        }
        if (checkpointDirty) {
            saveCheckpoint();
        }
        switch (state) {
            case RUNNING -> runningStep();
            case PAUSED -> pausedStep();
            case DISCONNECTED -> disconnectedStep();
            default -> {
            }
        }
        if (!state.isTerminal()) {
            readStatuses();
        }
        publishSnapshot();
        return state;
    }

    private void runLoop() {
        while (running && !state.isTerminal() && !Thread.currentThread().isInterrupted()) {
            try {
                step();
            } catch (RuntimeException ex) {
                log.error("Unexpected error in orchestrator loop; continuing", ex);
                backoff();
            }
        }
        running = false;
        log.info("Orchestrator loop for {} finished in state {}", settings.target(), state);
    }

    private void runningStep() {
        if (!liveness.isConnected()) {
            enterDisconnected("executor heartbeat lost"
                + (outstanding == null ? "" : "; seq=" + outstanding.sequence() + " stays outstanding"));
            return;
        }
        Instant now = clock.instant();
        if (outstanding != null) {
            if (!outstanding.published()) {
                publishOutstanding();
                return;
            }
            if (now.isBefore(outstanding.publishedAt().plus(settings.commandTimeout()))) {
                return;
            }
            if (outstanding.deliveries() < settings.maxAttempts()) {
                log.warn("No status for seq={} within {}ms; re-delivering (delivery {}/{})", outstanding.sequence(),
                    settings.commandTimeout().toMillis(), outstanding.deliveries() + 1, settings.maxAttempts());
                metrics.commandRetried("timeout");
                publishOutstanding();
            } else {
                enterDisconnected("no status for seq=" + outstanding.sequence() + " after "
                    + outstanding.deliveries() + " deliveries");
            }
            return;
        }
        if (pauseRequested) {
            transition(OrchestratorState.PAUSED, "operator pause");
            saveCheckpoint();
            return;
        }
        if (dwellUntil != null && now.isBefore(dwellUntil)) {
            return;
        }
        issue(0);
    }

    private void pausedStep() {
        if (!pauseRequested) {
            transition(OrchestratorState.RUNNING, "operator resume");
            dwellUntil = clock.instant();
            saveCheckpoint();
        }
    }

    private void disconnectedStep() {
        if (!liveness.isConnected() || liveness.alivePolls() <= alivePollsAtDisconnect) {
            return;
        }
        if (outstanding != null) {
            outstanding = outstanding.rearmed();
            transition(OrchestratorState.RUNNING, "executor back; re-issuing seq=" + outstanding.sequence());
            publishOutstanding();
            return;
        }
        transition(pauseRequested ? OrchestratorState.PAUSED : OrchestratorState.RUNNING, "executor back");
        saveCheckpoint();
    }

    private void issue(int errorAttempts) {
        cursor = schedule.normalize(cursor);
        ScheduleStep step = schedule.stepAt(cursor);
        PlannedCommand planned = planner.plan(step);
        long sequence = nextSequence++;
        outstanding = OutstandingCommand.issue(sequence, planned, step.state().wireName(), errorAttempts, clock.instant());
        metrics.commandIssued();
        log.info("Issuing seq={} op={} for step {} at {}", sequence, outstanding.op(), step, cursor);
        if (!saveCheckpoint()) {
            return;
        }
        if (state != OrchestratorState.RUNNING) {
            log.info("Holding seq={} while {}; it is published once the executor is back", sequence,
                state.wireName());
            return;
        }
        publishOutstanding();
    }

    private void publishOutstanding() {
        if (checkpointDirty && !saveCheckpoint()) {
            return;
        }
        BusResult<EntryId> published = bus.publish(controlStream, codec.encodeCommand(outstanding.toCommand()));
        if (!published.isOk()) {
            lastBusError = published.error().describe();
            log.warn("[CTRL] SEND failed seq={}: {}", outstanding.sequence(), lastBusError);
            backoff();
            return;
        }
        outstanding = outstanding.delivered(clock.instant());
        log.info("[CTRL] SEND seq={} op={} delivery={} id={}", outstanding.sequence(), outstanding.op(),
            outstanding.deliveries(), published.value());
        saveCheckpoint();
    }

    private void readStatuses() {
        BusResult<List<StreamEntry>> read = bus.read(statusStream, statusCursor, settings.blockTimeout(), STATUS_READ_COUNT);
        if (!read.isOk()) {
            lastBusError = read.error().describe();
            log.warn("[STATUS] RECV failed on {}: {}", statusStream, lastBusError);
            backoff();
            return;
        }
        consecutiveBusFailures = 0;
        lastBusError = null;
        for (StreamEntry entry : read.value()) {
            statusCursor = entry.id();
            StatusRecord status;
            try {
                status = codec.decodeStatus(entry);
            } catch (MalformedEntryException ex) {
                log.warn("[STATUS] RECV malformed entry {}: {}", entry.id(), ex.getMessage());
                continue;
            }
            if (status.isUnsolicited()) {
                log.info("[STATUS] RECV unsolicited result={} detail={}", status.result().wireName(), status.detail());
                continue;
            }
            if (outstanding == null || status.sequence() != outstanding.sequence()) {
                log.debug("[STATUS] RECV seq={} does not match outstanding {}; discarded", status.sequence(),
                    outstanding == null ? "none" : outstanding.sequence());
                continue;
            }
            resolve(status);
        }
    }

    private void resolve(StatusRecord status) {
        lastStatus = status;
        ScheduleStep step = schedule.stepAt(cursor);
        if (status.isOk()) {
            log.info("[STATUS] RECV seq={} ok; step {} done, dwelling {}s", status.sequence(), step,
                step.duration().toSeconds());
            outstanding = null;
            cursor = schedule.advance(cursor);
            dwellUntil = clock.instant().plus(step.duration());
            saveCheckpoint();
            return;
        }
        int errors = outstanding.errorAttempts() + 1;
        if (errors < settings.maxAttempts()) {
            log.warn("[STATUS] RECV seq={} error cause={}; retrying step {} ({}/{})", status.sequence(), status.cause(),
                step, errors + 1, settings.maxAttempts());
            metrics.commandRetried("error");
            issue(errors);
            return;
        }
        log.warn("[STATUS] RECV seq={} error cause={}; step {} failed {} times, skipping", status.sequence(),
            status.cause(), step, errors);
        metrics.stateSkipped();
        outstanding = null;
        cursor = schedule.advance(cursor);
        dwellUntil = clock.instant();
        saveCheckpoint();
    }

    private void enterDisconnected(String reason) {
        alivePollsAtDisconnect = liveness.alivePolls();
        transition(OrchestratorState.DISCONNECTED, reason);
        saveCheckpoint();
    }

    private void transition(OrchestratorState next, String reason) {
        OrchestratorState previous = state;
        if (previous == next) {
            return;
        }
        if (!previous.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal orchestrator transition " + previous + " -> " + next);
        }
        state = next;
        metrics.stateChanged(next);
        if (next == OrchestratorState.DISCONNECTED) {
            log.warn("State {} -> {}: {}", previous, next, reason);
        } else {
            log.info("State {} -> {}: {}", previous, next, reason);
        }
    }

    private void restoreFrom(OrchestratorCheckpoint checkpoint) {
        nextSequence = Math.max(1L, checkpoint.nextSequence());
        statusCursor = checkpoint.statusCursor() == null ? EntryId.ZERO : EntryId.parse(checkpoint.statusCursor());
        pauseRequested = pauseRequested || checkpoint.pauseRequested();
        if (schedule.fingerprint().equals(checkpoint.scheduleFingerprint())) {
            cursor = schedule.normalize(new ScheduleCursor(checkpoint.cycle(), checkpoint.index()));
            outstanding = checkpoint.outstanding();
            log.info("Resuming schedule at {} (next sequence {}, outstanding {})", cursor, nextSequence,
                outstanding == null ? "none" : outstanding.sequence());
        } else {
            cursor = ScheduleCursor.START;
            outstanding = null;
            log.warn("Schedule changed since the last checkpoint ({} -> {}); restarting the cycle with sequence {}",
                checkpoint.scheduleFingerprint(), schedule.fingerprint(), nextSequence);
        }
    }

    private long highestIssuedSequence() {
        BusResult<List<StreamEntry>> latest = bus.readLatest(controlStream, 1);
        if (!latest.isOk()) {
            log.warn("Could not read {} to seed sequences: {}", controlStream, latest.error().describe());
            return 0L;
        }
        if (latest.value().isEmpty()) {
            return 0L;
        }
        StreamEntry entry = latest.value().get(0);
        try {
            return codec.decodeCommand(entry).sequence();
        } catch (MalformedEntryException ex) {
            log.warn("Newest entry {} on {} is malformed; sequences start at 1: {}", entry.id(), controlStream, ex.getMessage());
            return 0L;
        }
    }

    private EntryId newestStatusId() {
        BusResult<List<StreamEntry>> latest = bus.readLatest(statusStream, 1);
        if (latest.isOk() && !latest.value().isEmpty()) {
            return latest.value().get(0).id();
        }
        latest.onFailure(error -> log.warn("Could not read {}: {}", statusStream, error.describe()));
        return EntryId.ZERO;
    }

    private boolean saveCheckpoint() {
        OrchestratorCheckpoint checkpoint = new OrchestratorCheckpoint(cursor.cycle(), cursor.index(), nextSequence,
            outstanding, schedule.fingerprint(), statusCursor.toString(), pauseRequested, clock.instant());
        try {
            checkpointStore.save(checkpoint);
            checkpointDirty = false;
            return true;
        } catch (CheckpointException ex) {
            checkpointDirty = true;
            log.error("Failed to persist orchestrator checkpoint; holding commands until it succeeds: {}", ex.getMessage());
            return false;
        }
    }

    private void backoff() {
        consecutiveBusFailures++;
        try {
            sleeper.sleep(settings.backoff().delayFor(consecutiveBusFailures));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    private void publishSnapshot() {
        ScheduleCursor position = schedule.normalize(cursor);
        ScheduleStep step = schedule.stepAt(position);
        snapshot = new OrchestratorSnapshot(settings.target(), state, position.cycle(), position.index(),
            step.state().wireName(), step.duration(), nextSequence, outstanding, lastStatus, pauseRequested, dwellUntil,
            schedule.fingerprint(), schedule.cycleLength(), lastBusError, clock.instant());
    }
}
