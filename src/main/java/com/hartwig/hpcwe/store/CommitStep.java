package com.hartwig.hpcwe.store;

import java.util.Optional;

import com.hartwig.hpcwe.model.EntityKind;

/**
 * The kinds of pending change, in the order they are committed. Later steps may rely on IDs written by earlier ones.
 */
public enum CommitStep {
    TASKS(EntityKind.TASK),
    LOOPS(EntityKind.LOOP),
    SUBMISSIONS(EntityKind.SUBMISSION),
    SUBMISSION_PARTS(EntityKind.SUBMISSION),
    ELEMENT_IDS(EntityKind.TASK),
    ELEMENTS(EntityKind.ELEMENT),
    ELEMENT_SETS(null),
    ITERATION_IDS(EntityKind.ELEMENT),
    ITERATIONS(EntityKind.ITERATION),
    RUN_IDS(EntityKind.ITERATION),
    RUNS_INITIALISED(EntityKind.ITERATION),
    RUNS(EntityKind.RUN),
    RUN_SUBMISSION_INDICES(EntityKind.RUN),
    RUN_SKIPS(EntityKind.RUN),
    RUN_STARTS(EntityKind.RUN),
    RUN_ENDS(EntityKind.RUN),
    JOBSCRIPT_METADATA(EntityKind.SUBMISSION),
    PARAMETERS(EntityKind.PARAMETER),
    FILES(null),
    TEMPLATE_COMPONENTS(null),
    PARAMETER_SOURCES(EntityKind.PARAMETER),
    LOOP_INDICES(EntityKind.ITERATION),
    LOOP_NUM_ITERATIONS(EntityKind.LOOP),
    LOOP_PARENTS(EntityKind.LOOP);

    private final EntityKind cachedKind;

    CommitStep(final EntityKind cachedKind) {
        this.cachedKind = cachedKind;
    }

    /**
     * The entity kind whose cached reads become stale once this step is committed.
     */
    public Optional<EntityKind> invalidates() {
        return Optional.ofNullable(cachedKind);
    }
}
