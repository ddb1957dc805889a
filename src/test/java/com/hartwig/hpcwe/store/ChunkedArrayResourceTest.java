package com.hartwig.hpcwe.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;

import com.fasterxml.jackson.databind.node.IntNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ChunkedArrayResourceTest {
    @TempDir
    Path tempDir;

    private ChunkedArrayResource array;

    @BeforeEach
    void setUp() {
        array = new ChunkedArrayResource("values", tempDir.resolve("values"), 2, WorkflowStores.objectMapper());
        array.initialise();
    }

    @Test
    void recordsAreSplitOverChunkFiles() {
        array.open(ResourceAction.UPDATE);
        for (int i = 0; i < 5; i++) {
            array.append(IntNode.valueOf(i * 10));
        }
        array.close(ResourceAction.UPDATE, true);

        assertThat(tempDir.resolve("values").resolve("chunk-00000.cbor")).exists();
        assertThat(tempDir.resolve("values").resolve("chunk-00002.cbor")).exists();
        assertThat(tempDir.resolve("values").resolve("chunk-00003.cbor")).doesNotExist();

        array.open(ResourceAction.READ);
        assertThat(array.size()).isEqualTo(5);
        assertThat(array.get(3).asInt()).isEqualTo(30);
        array.close(ResourceAction.READ, true);
    }

    @Test
    void replacedRecordIsPersisted() {
        array.open(ResourceAction.UPDATE);
        array.append(IntNode.valueOf(1));
        array.append(IntNode.valueOf(2));
        array.close(ResourceAction.UPDATE, true);

        array.open(ResourceAction.UPDATE);
        array.set(1, IntNode.valueOf(20));
        array.close(ResourceAction.UPDATE, true);

        array.open(ResourceAction.READ);
        assertThat(array.get(1).asInt()).isEqualTo(20);
        array.close(ResourceAction.READ, true);
    }

    @Test
    void failedScopeDiscardsChanges() {
        array.open(ResourceAction.UPDATE);
        array.append(IntNode.valueOf(1));
        array.close(ResourceAction.UPDATE, false);

        array.open(ResourceAction.READ);
        assertThat(array.size()).isZero();
        array.close(ResourceAction.READ, true);
    }

    @Test
    void accessOutsideAScopeOrRangeFails() {
        assertThrows(IllegalStateException.class, () -> array.size());

        array.open(ResourceAction.READ);
        assertThrows(IndexOutOfBoundsException.class, () -> array.get(0));
        assertThrows(IllegalStateException.class, () -> array.append(IntNode.valueOf(1)));
        array.close(ResourceAction.READ, true);
    }

    @Test
    void chunkSizeMustMatchTheStoredIndex() {
        var other = new ChunkedArrayResource("values", tempDir.resolve("values"), 3, WorkflowStores.objectMapper());
        assertThrows(IllegalStateException.class, () -> other.open(ResourceAction.READ));
    }
}
