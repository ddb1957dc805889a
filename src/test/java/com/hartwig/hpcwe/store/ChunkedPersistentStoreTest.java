package com.hartwig.hpcwe.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.hartwig.hpcwe.TestWorkflows;
import com.hartwig.hpcwe.config.StoreConfig;
import com.hartwig.hpcwe.model.DataIndex;
import com.hartwig.hpcwe.model.EntityKind;
import com.hartwig.hpcwe.model.StoreRun;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ChunkedPersistentStoreTest {
    @TempDir
    Path tempDir;

    private JsonPersistentStore store;
    private int iterationId;

    @BeforeEach
    void setUp() throws IOException {
        store = TestWorkflows.create(tempDir, StoreConfig.builder().format(StoreFormat.CHUNKED).chunkSize(2).build());
        var taskId = store.addTask(0, TestWorkflows.taskTemplate("t1"));
        iterationId = store.addElementIteration(store.addElement(taskId, 0, Map.of(), Map.of()), DataIndex.empty(), List.of(), Map.of());
    }

    @Test
    void openedStoreKeepsChunkedFormat() throws IOException {
        store.save();
        assertThat(store).isInstanceOf(ChunkedPersistentStore.class);
        assertThat(WorkflowStores.open(store.workflowPath())).isInstanceOf(ChunkedPersistentStore.class);
        assertThat(store.workflowPath().resolve(ChunkedPersistentStore.RUNS).resolve("index.json")).exists();
    }

    @Test
    void runsAndParametersRoundTripAcrossChunks() throws IOException {
        var runIds = new ArrayList<Integer>();
        for (int i = 0; i < 5; i++) {
            var parameterId = store.addSetParameter(List.of(i, i + 1), Map.of("type", "EAR_output", "EAR_ID", i));
            runIds.add(store.addRun(iterationId, 0, List.of(0), DataIndex.of(Map.of("outputs.p" + i, parameterId)),
                    JsonNodeFactory.instance.objectNode()));
        }
        store.save();

        var reopened = WorkflowStores.open(store.workflowPath());
        assertThat(reopened.count(EntityKind.RUN)).isEqualTo(5);
        assertThat(reopened.count(EntityKind.PARAMETER)).isEqualTo(5);
        assertThat(reopened.getRuns(runIds)).extracting(StoreRun::id).containsExactlyElementsOf(runIds);
        assertThat(reopened.getParameter(4).data()).contains(List.of(4, 5));
        assertThat(reopened.getParameter(4).source()).containsEntry("EAR_ID", 4);
        assertThat(reopened.getElementIteration(iterationId).runIds()).isEqualTo(Map.of(0, runIds));
        assertThat(store.workflowPath().resolve(ChunkedPersistentStore.RUNS).resolve("chunk-00002.cbor")).exists();
    }

    @Test
    void durableRunUpdatesRewriteTheirChunk() throws IOException {
        var runIds = new ArrayList<Integer>();
        for (int i = 0; i < 3; i++) {
            runIds.add(store.addRun(iterationId, 0, List.of(), DataIndex.empty(), JsonNodeFactory.instance.objectNode()));
        }
        store.save();

        store.setRunSkip(runIds.get(2));
        store.setRunSubmissionIndices(Map.of(runIds.get(0), 0));
        store.save();

        var reopened = WorkflowStores.open(store.workflowPath());
        assertThat(reopened.getRun(runIds.get(2)).skip()).isTrue();
        assertThat(reopened.getRun(runIds.get(0)).submissionIndex()).contains(0);
        assertThat(reopened.getRun(runIds.get(1)).skip()).isFalse();
    }
}
