package io.skywatch.executor.loop;

import io.skywatch.bus.BusResult;
import io.skywatch.bus.EntryId;
import io.skywatch.bus.ExponentialBackoff;
import io.skywatch.bus.Sleeper;
import io.skywatch.bus.StreamBus;
import io.skywatch.bus.StreamEntry;
import io.skywatch.checkpoint.CheckpointException;
import io.skywatch.checkpoint.CheckpointStore;
import io.skywatch.protocol.Command;
import io.skywatch.protocol.MalformedEntryException;
import io.skywatch.protocol.ProtocolCodec;
import io.skywatch.protocol.StatusRecord;
import io.skywatch.protocol.StreamNames;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single consumer of {@code ctrl:{target}}.
 * <p>
 * Each command is applied at most once: a sequence at or below the last applied one is answered by
 * re-publishing the recorded status. The checkpoint is written before the status is published, so
 * after a crash the command is replayed from history instead of hitting the hardware again.
 */
public class CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

    private final StreamBus bus;
    private final ProtocolCodec codec;
    private final CommandDispatcher dispatcher;
    private final SensorSampler sampler;
    private final CheckpointStore<ExecutorCheckpoint> checkpointStore;
    private final Settings settings;
    private final Sleeper sleeper;
    private final Clock clock;
    private final String controlStream;
    private final String statusStream;
    private final StatusHistory history;
    private final Deque<StatusRecord> pendingStatuses = new ArrayDeque<>();
    private final AtomicLong processed = new AtomicLong();

    private EntryId cursor = EntryId.ZERO;
    private long lastApplied;
    private int consecutiveBusFailures;
    private boolean checkpointDirty;
    private volatile boolean running;
    private volatile ExecutorService loopExecutor;

    /**
     * Loop tuning.
     *
     * @param blockTimeout longest wait for new commands per read
     * @param readCount max entries per read
     * @param backoff delay after failed bus calls
     * @param historySize statuses kept for replay
     */
    public record Settings(String target, Duration blockTimeout, int readCount, ExponentialBackoff backoff, int historySize) {

        public Settings {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(blockTimeout, "blockTimeout");
            Objects.requireNonNull(backoff, "backoff");
        }
    }

    public CommandExecutor(StreamBus bus,
                           ProtocolCodec codec,
                           CommandDispatcher dispatcher,
                           SensorSampler sampler,
                           CheckpointStore<ExecutorCheckpoint> checkpointStore,
                           Settings settings,
                           Sleeper sleeper,
                           Clock clock) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.sampler = sampler;
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.controlStream = StreamNames.control(settings.target());
        this.statusStream = StreamNames.status(settings.target());
        this.history = new StatusHistory(settings.historySize());
    }

    /**
     * Loads the checkpoint. Without one, consumption starts after the newest command already on
     * the stream; anything older is stale and the orchestrator re-publishes what it still awaits.
     *
     * @throws CheckpointException when an existing checkpoint cannot be read
     */
    public synchronized void restore() {
        Optional<ExecutorCheckpoint> checkpoint = checkpointStore.load();
        if (checkpoint.isPresent()) {
            ExecutorCheckpoint state = checkpoint.get();
            cursor = state.lastEntryId() == null ? EntryId.ZERO : EntryId.parse(state.lastEntryId());
            lastApplied = state.lastApplied();
            state.history().forEach(recorded -> history.record(recorded.toStatus()));
            log.info("Resuming {} after entry {} (lastApplied={}, history={})",
                controlStream, cursor, lastApplied, history.describeRange());
            return;
        }
        BusResult<List<StreamEntry>> latest = bus.readLatest(controlStream, 1);
        if (latest.isOk() && !latest.value().isEmpty()) {
            cursor = latest.value().get(0).id();
        } else {
            latest.onFailure(error -> log.warn("Could not look up newest command: {}", error.describe()));
            cursor = EntryId.ZERO;
        }
        log.info("No executor checkpoint; consuming {} after entry {}", controlStream, cursor);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        restore();
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("event", "executor-started");
        detail.put("last_applied", lastApplied);
        enqueue(StatusRecord.ok(StatusRecord.UNSOLICITED, detail, clock.instant()));
        running = true;
        loopExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "executor-loop-" + settings.target());
            thread.setDaemon(true);
            return thread;
        });
        loopExecutor.execute(this::runLoop);
        log.info("Command executor started on {}", controlStream);
    }

    public void stop() {
        ExecutorService executor;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            executor = loopExecutor;
            loopExecutor = null;
        }
        executor.shutdown();
        try {
            long waitMillis = settings.blockTimeout().toMillis() + 5_000L;
            if (!executor.awaitTermination(waitMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Command loop did not finish within {}ms; interrupting", waitMillis);
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("Command executor stopped (processed={}, lastApplied={})", processed.get(), lastApplied());
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized long lastApplied() {
        return lastApplied;
    }

    public synchronized EntryId cursor() {
        return cursor;
    }

    public long processed() {
        return processed.get();
    }

    private void runLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                pollOnce();
            } catch (RuntimeException ex) {
                log.error("Unexpected error in command loop; continuing", ex);
                backoff();
            }
        }
    }

    /**
     * One loop iteration: flush unsent statuses, read the next batch and process it, or sample
     * sensors when there is nothing to do.
     *
     * @return the number of control entries handled
     */
    public synchronized int pollOnce() {
        if (checkpointDirty) {
            saveCheckpoint();
        }
        if (!flushPending()) {
            backoff();
            return 0;
        }
        BusResult<List<StreamEntry>> read = bus.read(controlStream, cursor, settings.blockTimeout(), settings.readCount());
        if (!read.isOk()) {
            log.warn("[CTRL] RECV failed on {}: {}", controlStream, read.error().describe());
            backoff();
            return 0;
        }
        consecutiveBusFailures = 0;
        List<StreamEntry> entries = read.value();
        if (entries.isEmpty()) {
            if (sampler != null) {
                sampler.sampleIfDue();
            }
            return 0;
        }
        int handled = 0;
        for (StreamEntry entry : entries) {
            handle(entry);
            handled++;
        }
        return handled;
    }

    private void handle(StreamEntry entry) {
        Command command;
        try {
            command = codec.decodeCommand(entry);
        } catch (MalformedEntryException ex) {
            log.warn("[CTRL] RECV malformed entry {}: {}", entry.id(), ex.getMessage());
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("entry_id", entry.id().toString());
            detail.put("reason", ex.getMessage());
            enqueue(StatusRecord.error(StatusRecord.UNSOLICITED, "malformed command", detail, clock.instant()));
            advance(entry.id());
            return;
        }
        log.info("[CTRL] RECV seq={} op={} id={}", command.sequence(), command.op(), entry.id());
        if (command.sequence() <= lastApplied) {
            Optional<StatusRecord> recorded = history.find(command.sequence());
            if (recorded.isPresent()) {
                log.info("Replaying recorded status for already applied seq={}", command.sequence());
                enqueue(recorded.get());
            } else {
                log.warn("No recorded status for already applied seq={} (history {}); ignoring",
                    command.sequence(), history.describeRange());
            }
            advance(entry.id());
            return;
        }
        StatusRecord status = dispatcher.dispatch(command);
        lastApplied = command.sequence();
        history.record(status);
        processed.incrementAndGet();
        enqueue(status);
        advance(entry.id());
    }

    private void advance(EntryId id) {
        cursor = id;
        saveCheckpoint();
        flushPending();
    }

    private void enqueue(StatusRecord status) {
        pendingStatuses.addLast(status);
    }

    private boolean flushPending() {
        while (!pendingStatuses.isEmpty()) {
            StatusRecord status = pendingStatuses.peekFirst();
            BusResult<EntryId> published = bus.publish(statusStream, codec.encodeStatus(status));
            if (!published.isOk()) {
                log.warn("[STATUS] SEND failed seq={} ({} pending): {}",
                    status.sequence(), pendingStatuses.size(), published.error().describe());
                return false;
            }
            pendingStatuses.pollFirst();
            log.info("[STATUS] SEND seq={} result={} id={}", status.sequence(), status.result().wireName(), published.value());
        }
        return true;
    }

    private void saveCheckpoint() {
        List<ExecutorCheckpoint.RecordedStatus> recorded = new ArrayList<>();
        for (StatusRecord status : history.snapshot()) {
            recorded.add(ExecutorCheckpoint.RecordedStatus.from(status));
        }
        try {
            checkpointStore.save(new ExecutorCheckpoint(cursor.toString(), lastApplied, recorded, clock.instant()));
            checkpointDirty = false;
        } catch (CheckpointException ex) {
            checkpointDirty = true;
            log.error("Failed to persist executor checkpoint; will retry: {}", ex.getMessage());
        }
    }

    private void backoff() {
        consecutiveBusFailures++;
        Duration delay = settings.backoff().delayFor(consecutiveBusFailures);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
