package com.hartwig.hpcwe.store;

import java.util.List;

/**
 * Applying one or more resource groups of pending changes failed. The changes of the failed groups are still pending;
 * changes of other groups were committed.
 */
public class CommitFailedException extends RuntimeException {
    private final List<CommitStep> failedSteps;

    public CommitFailedException(final List<CommitStep> failedSteps, final Throwable cause) {
        super(String.format("Could not commit pending changes for steps %s: %s", failedSteps, cause.getMessage()), cause);
        this.failedSteps = List.copyOf(failedSteps);
    }

    public List<CommitStep> getFailedSteps() {
        return failedSteps;
    }
}
