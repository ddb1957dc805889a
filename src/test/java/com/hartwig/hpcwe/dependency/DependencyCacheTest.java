package com.hartwig.hpcwe.dependency;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.hartwig.hpcwe.TestWorkflows;
import com.hartwig.hpcwe.model.DataIndex;
import com.hartwig.hpcwe.model.StoreElement;
import com.hartwig.hpcwe.model.StoreElementIteration;
import com.hartwig.hpcwe.model.StoreRun;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DependencyCacheTest {
    @TempDir
    Path tempDir;

    /**
     * One element, iteration and run per entry; run i writes parameter i and reads the parameters of the runs it
     * depends on.
     */
    private static DependencyCache chain(List<List<Integer>> inputsPerRun) {
        var runs = new ArrayList<StoreRun>();
        var iterations = new ArrayList<StoreElementIteration>();
        var elements = new ArrayList<StoreElement>();
        var sources = new ArrayList<Map<String, Object>>();
        for (int i = 0; i < inputsPerRun.size(); i++) {
            var dataIndex = DataIndex.empty().with("outputs.p" + i, i);
            for (Integer input : inputsPerRun.get(i)) {
                dataIndex = dataIndex.with("inputs.p" + input, input);
            }
            runs.add(StoreRun.builder().id(i).iterationId(i).actionIndex(0).dataIndex(dataIndex).build());
            iterations.add(StoreElementIteration.builder().id(i).elementId(i).dataIndex(dataIndex).putRunIds(0, List.of(i)).build());
            elements.add(StoreElement.builder().id(i).taskId(i).index(0).elementSetIndex(0).addIterationIds(i).build());
            sources.add(Map.of("type", "EAR_output", "EAR_ID", i));
        }
        return DependencyCache.build(runs, iterations, elements, sources);
    }

    @Test
    void fullyConnectedChain() {
        var cache = chain(List.of(List.of(), List.of(0), List.of(0, 1), List.of(0, 1, 2)));

        assertThat(cache.runDependencies(0)).isEmpty();
        assertThat(cache.runDependencies(3)).containsExactly(0, 1, 2);
        assertThat(cache.runDependents(0)).containsExactly(1, 2, 3);
        assertThat(cache.iterationDependencies(2)).containsExactly(0, 1);
        assertThat(cache.elementDependencies(3)).containsExactly(0, 1, 2);

        assertThat(cache.elementDependents(0)).containsExactly(1, 2, 3);
        assertThat(cache.elementDependents(1)).containsExactly(2, 3);
        assertThat(cache.elementDependents(2)).containsExactly(3);
        assertThat(cache.elementDependents(3)).isEmpty();
        assertThat(cache.elementDependentsRecursive(1)).containsExactly(2, 3);
    }

    @Test
    void recursiveDependentsFollowTheWholeChain() {
        var cache = chain(List.of(List.of(), List.of(0), List.of(1), List.of(2)));

        assertThat(cache.elementDependents(0)).containsExactly(1);
        assertThat(cache.elementDependentsRecursive(0)).containsExactly(1, 2, 3);
        assertThat(cache.elementDependentsRecursive(List.of(2, 3))).containsExactly(3);
    }

    @Test
    void runsDoNotDependOnThemselves() {
        var cache = chain(List.of(List.of(0)));
        assertThat(cache.runDependencies(0)).isEmpty();
        assertThat(cache.elementDependentsRecursive(0)).isEmpty();
    }

    @Test
    void unknownIdsAreRejected() {
        var cache = chain(List.of(List.of()));
        var e = assertThrows(IllegalArgumentException.class, () -> cache.elementDependents(5));
        assertThat(e.getMessage()).isEqualTo("No element with ID 5 in dependency cache");
    }

    @Test
    void dotExportLabelsElements() {
        var dot = chain(List.of(List.of(), List.of(0))).toDotFormat();
        assertThat(dot).contains("element 0").contains("element 1").contains("->");
    }

    @Test
    void buildsFromStore() throws IOException {
        var store = TestWorkflows.create(tempDir);
        var taskId = store.addTask(0, TestWorkflows.taskTemplate("t1"));
        var producerIteration = store.addElementIteration(store.addElement(taskId, 0, Map.of(), Map.of()), DataIndex.empty(), List.of(), Map.of());
        var output = store.addUnsetParameter(Map.of("type", "EAR_output", "EAR_ID", 0));
        var producer = store.addRun(producerIteration, 0, List.of(), DataIndex.of(Map.of("outputs.p1", output)), JsonNodeFactory.instance.objectNode());
        var consumerTask = store.addTask(1, TestWorkflows.taskTemplate("t2"));
        var consumerElement = store.addElement(consumerTask, 0, Map.of(), Map.of());
        var consumerIteration = store.addElementIteration(consumerElement, DataIndex.empty(), List.of(), Map.of());
        var consumer = store.addRun(consumerIteration, 0, List.of(), DataIndex.of(Map.of("inputs.p1", output)), JsonNodeFactory.instance.objectNode());
        store.save();

        var cache = DependencyCache.build(store);
        assertThat(cache.runDependencies(consumer)).containsExactly(producer);
        assertThat(cache.elementDependents(0)).containsExactly(consumerElement);
    }
}
