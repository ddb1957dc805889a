package com.hartwig.hpcwe.submission;

import com.hartwig.hpcwe.model.Resources;
import com.hartwig.hpcwe.model.StoreElement;
import com.hartwig.hpcwe.model.StoreRun;
import com.hartwig.hpcwe.model.StoreTask;

/**
 * Template knowledge the jobscript pipeline needs about a task's schema actions.
 */
public interface TaskActionResolver {
    int numActions(StoreTask task);

    /**
     * Resolves the resource requirements of one run of the given element.
     */
    Resources resources(StoreTask task, StoreElement element, StoreRun run);
}
