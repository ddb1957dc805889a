package com.hartwig.hpcwe.loop;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.hartwig.hpcwe.TestWorkflows;
import com.hartwig.hpcwe.model.DataIndex;
import com.hartwig.hpcwe.store.JsonPersistentStore;
import com.hartwig.hpcwe.store.WorkflowStores;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkflowLoopTest {
    private static final IterationSource CARRY_OVER = (loop, previous, loopIndex, dependencies) -> previous.dataIndex();
    private static final List<TaskParameterTypes> TYPES = List.of(TaskParameterTypes.of(0, List.of("p1"), List.of("p2")),
            TaskParameterTypes.of(1, List.of("p2"), List.of("p1")),
            TaskParameterTypes.of(2, List.of("p3"), List.of()));

    @TempDir
    Path tempDir;

    private JsonPersistentStore store;
    private final int[] iterationIds = new int[3];

    @BeforeEach
    void setUp() throws IOException {
        store = TestWorkflows.create(tempDir);
        for (int i = 0; i < 3; i++) {
            var taskId = store.addTask(i, TestWorkflows.taskTemplate("t" + i));
            var elementId = store.addElement(taskId, 0, Map.of(), Map.of());
            iterationIds[i] = store.addElementIteration(elementId, DataIndex.empty(), List.of(), Map.of());
        }
        store.save();
    }

    @Test
    void iterableParametersAreConsumedBeforeTheyAreProduced() {
        var iterable = WorkflowLoop.findIterableParameters("loop", List.of(0, 1), TYPES);

        assertThat(iterable).containsOnlyKeys("p1");
        assertThat(iterable.get("p1").inputTask()).isZero();
        assertThat(iterable.get("p1").outputTasks()).containsExactly(1);
    }

    @Test
    void existingIterationsBecomeTheFirstIteration() {
        var loop = WorkflowLoop.create(store, "loop", List.of(1, 0), JsonNodeFactory.instance.objectNode(), TYPES);

        assertThat(loop.definition().taskInsertIds()).containsExactly(0, 1);
        assertThat(loop.numIterations(List.of())).isEqualTo(1);
        assertThat(store.getElementIteration(iterationIds[0]).loopIndex()).isEqualTo(Map.of("loop", 0));
        assertThat(store.getElementIteration(iterationIds[2]).loopIndex()).isEmpty();
    }

    @Test
    void invalidLoopsAreRejected() {
        var template = JsonNodeFactory.instance.objectNode();
        assertThrows(LoopValidationException.class, () -> WorkflowLoop.create(store, "empty", List.of(), template, TYPES));
        assertThrows(LoopValidationException.class, () -> WorkflowLoop.create(store, "gap", List.of(0, 2), template, TYPES));

        WorkflowLoop.create(store, "loop", List.of(1), template, TYPES);
        var e = assertThrows(LoopValidationException.class, () -> WorkflowLoop.create(store, "loop", List.of(2), template, TYPES));
        assertThat(e.getMessage()).isEqualTo("A loop with the name 'loop' already exists in the workflow");
    }

    @Test
    void enclosingLoopBecomesParentOfExistingLoop() throws IOException {
        var template = JsonNodeFactory.instance.objectNode();
        var inner = WorkflowLoop.create(store, "inner", List.of(1), template, TYPES);
        store.save();
        inner.addIteration(List.of(), CARRY_OVER);

        var outer = WorkflowLoop.create(store, "outer", List.of(0, 1), template, TYPES);
        assertThat(outer.definition().parents()).isEmpty();
        assertThat(inner.definition().parents()).containsExactly("outer");
        assertThat(inner.definition().numAddedIterations()).isEqualTo(Map.of(List.of(0), 2));
        store.save();

        var reopened = WorkflowStores.open(store.workflowPath());
        var reloaded = WorkflowLoop.load(reopened, inner.id());
        assertThat(reloaded.definition().parents()).containsExactly("outer");
        assertThat(reloaded.numIterations(List.of(0))).isEqualTo(2);

        var added = outer.addIteration(List.of(), CARRY_OVER);
        assertThat(store.getElementIteration(added.get(1)).loopIndex()).isEqualTo(Map.of("outer", 1, "inner", 0));
        assertThat(inner.numIterations(List.of(1))).isEqualTo(1);
        assertThat(inner.numIterations(List.of(0))).isEqualTo(2);
    }

    @Test
    void failedIterationLeavesTheWorkflowUnchanged() throws IOException {
        var loop = WorkflowLoop.create(store, "loop", List.of(0, 1), JsonNodeFactory.instance.objectNode(), TYPES);
        store.save();
        var calls = new int[1];
        IterationSource failing = (definition, previous, loopIndex, dependencies) -> {
            if (++calls[0] == 2) {
                throw new IllegalStateException("source failed");
            }
            return previous.dataIndex();
        };

        assertThrows(IllegalStateException.class, () -> loop.addIteration(List.of(), failing));

        assertThat(store.hasPendingChanges()).isFalse();
        assertThat(loop.numIterations(List.of())).isEqualTo(1);
        var reopened = WorkflowStores.open(store.workflowPath());
        assertThat(WorkflowLoop.load(reopened, loop.id()).numIterations(List.of())).isEqualTo(1);
        assertThat(reopened.getElementIterations(reopened.getElement(0).iterationIds())).hasSize(1);
    }

    @Test
    void addIterationStagesOneIterationPerElementAndSaves() throws IOException {
        var loop = WorkflowLoop.create(store, "loop", List.of(0, 1), JsonNodeFactory.instance.objectNode(), TYPES);
        store.save();

        var added = loop.addIteration(List.of(), CARRY_OVER);

        assertThat(added).hasSize(2);
        assertThat(store.hasPendingChanges()).isFalse();
        var reopened = WorkflowStores.open(store.workflowPath());
        assertThat(reopened.getElementIteration(added.get(0)).loopIndex()).isEqualTo(Map.of("loop", 1));
        assertThat(WorkflowLoop.load(reopened, loop.id()).numIterations(List.of())).isEqualTo(2);

        var second = loop.addIteration(List.of(), CARRY_OVER);
        assertThat(store.getElementIteration(second.get(1)).loopIndex()).isEqualTo(Map.of("loop", 2));
        assertThat(loop.numIterations(List.of())).isEqualTo(3);
    }

    @Test
    void iteratingAnOuterLoopStartsTheInnerLoopAgain() {
        var template = JsonNodeFactory.instance.objectNode();
        var outer = WorkflowLoop.create(store, "outer", List.of(0, 1), template, TYPES);
        var inner = WorkflowLoop.create(store, "inner", List.of(1), template, TYPES);
        assertThat(inner.definition().parents()).containsExactly("outer");
        assertThat(inner.numIterations(List.of(0))).isEqualTo(1);

        inner.addIteration(List.of(0), CARRY_OVER);
        assertThat(inner.numIterations(List.of(0))).isEqualTo(2);

        var added = outer.addIteration(List.of(), CARRY_OVER);
        var innerElementIteration = store.getElementIteration(added.get(1));
        assertThat(innerElementIteration.loopIndex()).isEqualTo(Map.of("outer", 1, "inner", 0));
        assertThat(inner.numIterations(List.of(1))).isEqualTo(1);
    }

    @Test
    void wrongNumberOfParentIndicesIsRejected() {
        var loop = WorkflowLoop.create(store, "loop", List.of(0), JsonNodeFactory.instance.objectNode(), TYPES);
        assertThrows(IllegalArgumentException.class, () -> loop.addIteration(List.of(0), CARRY_OVER));
    }

    @Test
    void loopWithConsumersOutsideCannotBeIterated() {
        var output = store.addUnsetParameter(Map.of("type", "EAR_output", "EAR_ID", 0));
        store.addRun(iterationIds[0], 0, List.of(), DataIndex.of(Map.of("outputs.p2", output)), JsonNodeFactory.instance.objectNode());
        store.addRun(iterationIds[1], 0, List.of(), DataIndex.of(Map.of("inputs.p2", output)), JsonNodeFactory.instance.objectNode());
        store.save();
        var types = List.of(TaskParameterTypes.of(0, List.of("p1"), List.of("p1", "p2")));
        var loop = WorkflowLoop.create(store, "loop", List.of(0), JsonNodeFactory.instance.objectNode(), types);

        assertThrows(LoopValidationException.class, () -> loop.addIteration(List.of(), CARRY_OVER));
        assertThat(loop.numIterations(List.of())).isEqualTo(1);
    }
}
