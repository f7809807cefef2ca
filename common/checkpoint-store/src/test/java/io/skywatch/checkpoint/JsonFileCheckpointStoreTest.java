package io.skywatch.checkpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileCheckpointStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileLoadsAsEmpty() {
        JsonFileCheckpointStore<Sample> store = store(tempDir.resolve("state/orchestrator.json"));

        assertThat(store.load()).isEmpty();
    }

    @Test
    void savedValueSurvivesANewStoreInstance() {
        Path file = tempDir.resolve("state/orchestrator.json");
        Sample sample = new Sample(42L, "sky", Instant.parse("2024-03-01T12:00:00Z"));

        store(file).save(sample);

        assertThat(store(file).load()).contains(sample);
    }

    @Test
    void saveReplacesWholeDocumentAndLeavesNoTempFiles() throws IOException {
        Path file = tempDir.resolve("executor.json");
        JsonFileCheckpointStore<Sample> store = store(file);

        store.save(new Sample(1L, "a-much-longer-state-name", Instant.EPOCH));
        store.save(new Sample(2L, "b", Instant.EPOCH));

        assertThat(store.load()).contains(new Sample(2L, "b", Instant.EPOCH));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(path -> path.getFileName().toString()).toList()).isEqualTo(List.of("executor.json"));
        }
    }

    @Test
    void unreadableCheckpointIsReported() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{not json", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> store(file).load())
            .isInstanceOf(CheckpointException.class)
            .hasMessageContaining("broken.json");
    }

    private static JsonFileCheckpointStore<Sample> store(Path file) {
        return new JsonFileCheckpointStore<>(new ObjectMapper(), file, Sample.class);
    }

    record Sample(long sequence, String state, Instant updatedAt) {
    }
}
