package com.hartwig.hpcwe.store;

import static com.hartwig.hpcwe.store.CommitStep.ELEMENTS;
import static com.hartwig.hpcwe.store.CommitStep.ELEMENT_IDS;
import static com.hartwig.hpcwe.store.CommitStep.ELEMENT_SETS;
import static com.hartwig.hpcwe.store.CommitStep.FILES;
import static com.hartwig.hpcwe.store.CommitStep.ITERATIONS;
import static com.hartwig.hpcwe.store.CommitStep.ITERATION_IDS;
import static com.hartwig.hpcwe.store.CommitStep.JOBSCRIPT_METADATA;
import static com.hartwig.hpcwe.store.CommitStep.LOOPS;
import static com.hartwig.hpcwe.store.CommitStep.LOOP_INDICES;
import static com.hartwig.hpcwe.store.CommitStep.LOOP_NUM_ITERATIONS;
import static com.hartwig.hpcwe.store.CommitStep.LOOP_PARENTS;
import static com.hartwig.hpcwe.store.CommitStep.PARAMETERS;
import static com.hartwig.hpcwe.store.CommitStep.PARAMETER_SOURCES;
import static com.hartwig.hpcwe.store.CommitStep.RUNS;
import static com.hartwig.hpcwe.store.CommitStep.RUNS_INITIALISED;
import static com.hartwig.hpcwe.store.CommitStep.RUN_ENDS;
import static com.hartwig.hpcwe.store.CommitStep.RUN_IDS;
import static com.hartwig.hpcwe.store.CommitStep.RUN_SKIPS;
import static com.hartwig.hpcwe.store.CommitStep.RUN_STARTS;
import static com.hartwig.hpcwe.store.CommitStep.RUN_SUBMISSION_INDICES;
import static com.hartwig.hpcwe.store.CommitStep.SUBMISSIONS;
import static com.hartwig.hpcwe.store.CommitStep.SUBMISSION_PARTS;
import static com.hartwig.hpcwe.store.CommitStep.TASKS;
import static com.hartwig.hpcwe.store.CommitStep.TEMPLATE_COMPONENTS;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.EnumMap;
import java.util.List;

import org.junit.jupiter.api.Test;

class CommitResourceMapTest {

    @Test
    void jsonStoreCommitsEachDocumentOnce() {
        var groups = new CommitResourceMap(JsonPersistentStore.resourceTable()).groups();

        assertThat(groups).containsExactly(CommitGroup.builder()
                        .addResources(JsonPersistentStore.METADATA)
                        .addSteps(TASKS, LOOPS, ELEMENT_IDS, ELEMENTS, ELEMENT_SETS, ITERATION_IDS, ITERATIONS, RUN_IDS, RUNS_INITIALISED)
                        .addSteps(RUNS, RUN_SUBMISSION_INDICES, RUN_SKIPS, RUN_STARTS, RUN_ENDS)
                        .addSteps(TEMPLATE_COMPONENTS, LOOP_INDICES, LOOP_NUM_ITERATIONS, LOOP_PARENTS)
                        .build(),
                CommitGroup.builder()
                        .addResources(JsonPersistentStore.SUBMISSIONS)
                        .addSteps(SUBMISSIONS, SUBMISSION_PARTS, JOBSCRIPT_METADATA)
                        .build(),
                CommitGroup.builder()
                        .addResources(JsonPersistentStore.PARAMETERS)
                        .addSteps(PARAMETERS, FILES, PARAMETER_SOURCES)
                        .build());
    }

    @Test
    void chunkedStoreCommitsRunsSeparately() {
        var groups = new CommitResourceMap(ChunkedPersistentStore.chunkedResourceTable()).groups();

        assertThat(groups).extracting(CommitGroup::resources)
                .containsExactly(List.of(JsonPersistentStore.METADATA),
                        List.of(JsonPersistentStore.SUBMISSIONS),
                        List.of(ChunkedPersistentStore.RUNS),
                        List.of(JsonPersistentStore.PARAMETERS));
        assertThat(groups.get(2).steps()).containsExactly(RUNS, RUN_SUBMISSION_INDICES, RUN_SKIPS, RUN_STARTS, RUN_ENDS);
        assertThat(groups.get(0).steps()).doesNotContain(RUNS).contains(RUN_IDS, LOOP_PARENTS);
    }

    @Test
    void stepsSharingAResourceJoinTheOpenGroup() {
        var table = new EnumMap<CommitStep, List<String>>(CommitStep.class);
        table.put(TASKS, List.of("a"));
        table.put(LOOPS, List.of("a", "b"));
        table.put(SUBMISSIONS, List.of("b"));
        table.put(SUBMISSION_PARTS, List.of("c"));

        var groups = new CommitResourceMap(table).groups();

        assertThat(groups).hasSize(2);
        assertThat(groups.get(0).resources()).containsExactly("a", "b");
        assertThat(groups.get(0).steps()).containsExactly(TASKS, LOOPS, SUBMISSIONS);
        // steps without resources join whichever group is open
        assertThat(groups.get(1).resources()).containsExactly("c");
        assertThat(groups.get(1).steps()).startsWith(SUBMISSION_PARTS).contains(LOOP_PARENTS);
    }
}
