package io.skywatch.checkpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class InMemoryCheckpointStoreTest {

    @Test
    void failingStoreKeepsPreviousValue() {
        InMemoryCheckpointStore<String> store = new InMemoryCheckpointStore<>("first");
        store.setFailing(true);

        assertThatThrownBy(() -> store.save("second")).isInstanceOf(CheckpointException.class);
        assertThat(store.load()).contains("first");
        assertThat(store.saveCount()).isZero();
    }
}
