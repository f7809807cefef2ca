package io.skywatch.orchestrator.domain;

import static org.assertj.core.api.Assertions.assertThat;

import io.skywatch.checkpoint.JsonFileCheckpointStore;
import io.skywatch.protocol.CommandOp;
import io.skywatch.protocol.ProtocolCodec;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OrchestratorCheckpointTest {

    @TempDir
    Path tempDir;

    @Test
    void outstandingCommandSurvivesCheckpointFile() {
        Instant now = Instant.parse("2024-05-01T00:00:00Z");
        OutstandingCommand outstanding = OutstandingCommand.issue(7,
                new PlannedCommand(CommandOp.SWITCH, Map.of("path", "RFLOAD", "state", "load")), "load", 1, now)
            .delivered(now.plusSeconds(1));
        JsonFileCheckpointStore<OrchestratorCheckpoint> store = new JsonFileCheckpointStore<>(
            ProtocolCodec.defaultObjectMapper(), tempDir.resolve("orchestrator.json"), OrchestratorCheckpoint.class);

        store.save(new OrchestratorCheckpoint(2, 3, 8, outstanding, "(sky,10)(load,5)", "1714521600000-0", true, now));

        assertThat(store.load()).hasValueSatisfying(checkpoint -> {
            assertThat(checkpoint.outstanding()).isEqualTo(outstanding);
            assertThat(checkpoint.outstanding().toCommand().args()).containsEntry("path", "RFLOAD");
            assertThat(checkpoint.pauseRequested()).isTrue();
            assertThat(checkpoint.nextSequence()).isEqualTo(8L);
        });
    }

    @Test
    void rearmingKeepsSequenceAndErrorBudget() {
        Instant now = Instant.parse("2024-05-01T00:00:00Z");
        OutstandingCommand delivered = OutstandingCommand.issue(3,
            new PlannedCommand(CommandOp.VNA, Map.of()), "vna", 2, now).delivered(now).delivered(now);

        OutstandingCommand rearmed = delivered.rearmed();

        assertThat(rearmed.sequence()).isEqualTo(3L);
        assertThat(rearmed.deliveries()).isZero();
        assertThat(rearmed.errorAttempts()).isEqualTo(2);
        assertThat(rearmed.published()).isFalse();
    }
}
