package com.auditchain.core.store;

import com.auditchain.core.domain.Checkpoint;
import com.auditchain.core.exception.CheckpointNotFoundException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class InMemoryCheckpointStoreTest {

    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore();
    private final Instant now = Instant.parse("2024-05-01T00:00:00Z");

    @Test
    void sequencesMustIncrease() {
        store.save(Checkpoint.create("a", 5, "aa".repeat(32), now));

        assertThatThrownBy(() -> store.save(Checkpoint.create("a", 5, "bb".repeat(32), now)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.save(Checkpoint.create("a", 3, "bb".repeat(32), now)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(store.save(Checkpoint.create("a", 9, "cc".repeat(32), now)).sequence()).isEqualTo(9);
        assertThat(store.latest("a")).map(Checkpoint::sequence).contains(9L);
    }

    @Test
    void exportBookkeepingIsTracked() {
        Checkpoint saved = store.save(Checkpoint.create("a", 1, "aa".repeat(32), now));

        Checkpoint failed = store.recordExportFailure(saved, "disk full");
        assertThat(store.unexported()).containsExactly(failed);
        assertThat(failed.exportAttempts()).isEqualTo(1);
        assertThat(failed.lastExportError()).isEqualTo("disk full");

        Checkpoint exported = store.markExported(saved, now.plusSeconds(5), "file:/tmp/x");
        assertThat(exported.exportAttempts()).isEqualTo(2);
        assertThat(exported.isExported()).isTrue();
        assertThat(exported.lastExportError()).isNull();
        assertThat(store.unexported()).isEmpty();
        assertThat(store.list("a")).containsExactly(exported);
    }

    @Test
    void updatingUnknownCheckpointFails() {
        assertThatThrownBy(() -> store.recordExportFailure(Checkpoint.create("a", 1, "aa".repeat(32), now), "x"))
                .isInstanceOf(CheckpointNotFoundException.class);
    }
}
