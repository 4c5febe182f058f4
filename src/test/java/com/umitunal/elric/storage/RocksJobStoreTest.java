package com.umitunal.elric.storage;

import com.umitunal.elric.config.StorageConfig;
import com.umitunal.elric.core.JobStore;
import com.umitunal.elric.core.StoredJob;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rocksdb.RocksDBException;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class RocksJobStoreTest extends JobStoreContract {

    @TempDir
    Path tempDir;

    @Override
    protected JobStore createStore() throws RocksDBException {
        return open();
    }

    private RocksJobStore open() throws RocksDBException {
        StorageConfig config = StorageConfig.newBuilder(tempDir.resolve("jobs").toString())
                .withDurableWrites(false)
                .withMemoryBufferSize(4)
                .withBlockCacheSize(8)
                .build();
        return new RocksJobStore(config);
    }

    @Test
    @DisplayName("Should keep jobs and their order across a reopen")
    void testReopen() throws Exception {
        // Given
        store.add("b", "reports", 200, payload("b"));
        store.add("a", "reports", 200, payload("a"));
        store.add("c", "mail", 50, payload("c"));
        store.remove("c");

        // When
        store.close();
        store = open();

        // Then
        assertThat(store.size()).isEqualTo(2);
        assertThat(ids(store.dueBefore(200))).containsExactly("b", "a");
        StoredJob a = store.get("a").orElseThrow();
        assertThat(a.getRoutingKey()).isEqualTo("reports");
        assertThat(a.getPayload()).isEqualTo(payload("a"));
        assertThat(store.closestUpcoming()).hasValue(200);
    }

    @Test
    @DisplayName("Should continue the insertion sequence after a reopen")
    void testSequenceRecovery() throws Exception {
        // Given
        store.add("first", "q", 100, payload("1"));
        store.close();
        store = open();

        // When
        store.add("second", "q", 100, payload("2"));

        // Then
        assertThat(ids(store.dueBefore(100))).containsExactly("first", "second");
    }

    @Test
    @DisplayName("Should keep the original tie position when a job is replaced")
    void testReplaceKeepsSequence() throws Exception {
        store.add("x", "q", 100, payload("x"));
        store.add("y", "q", 100, payload("y"));
        store.replace("x", "q", 100, payload("x2"));

        store.close();
        store = open();

        assertThat(ids(store.dueBefore(100))).containsExactly("x", "y");
        assertThat(store.get("x").orElseThrow().getPayload()).isEqualTo(payload("x2"));
    }
}
