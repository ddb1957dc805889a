package com.hartwig.hpcwe.submission;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import com.hartwig.hpcwe.model.Resources;
import com.hartwig.hpcwe.model.StoreElement;
import com.hartwig.hpcwe.model.StoreElementIteration;
import com.hartwig.hpcwe.model.StoreRun;
import com.hartwig.hpcwe.model.StoreTask;
import com.hartwig.hpcwe.store.PersistentStore;

public class ResourceMapGenerator {
    private final PersistentStore store;
    private final TaskActionResolver actionResolver;

    public ResourceMapGenerator(final PersistentStore store, final TaskActionResolver actionResolver) {
        this.store = store;
        this.actionResolver = actionResolver;
    }

    /**
     * Maps the pending runs of the task's element iterations at the given loop index. Iterations whose runs are not
     * initialised yet are left out.
     */
    public ResourceMap generate(StoreTask task, Map<String, Integer> loopIndex) {
        var numActions = actionResolver.numActions(task);
        var elements = store.getElements(task.elementIds());
        var resourceIndices = filled(numActions, elements.size());
        var runIds = filled(numActions, elements.size());
        var resources = new ArrayList<Resources>();

        for (StoreElement element : elements) {
            for (StoreElementIteration iteration : store.getElementIterations(element.iterationIds())) {
                if (!iteration.runsInitialised() || !iteration.loopIndex().equals(loopIndex)) {
                    continue;
                }
                for (var entry : iteration.runIds().entrySet()) {
                    int actionIdx = entry.getKey();
                    if (actionIdx < 0 || actionIdx >= numActions) {
                        throw new IllegalStateException(String.format("Iteration %s has runs for action %s but task %s has %s action(s)",
                                iteration.id(),
                                actionIdx,
                                task.id(),
                                numActions));
                    }
                    for (StoreRun run : store.getRuns(entry.getValue())) {
                        if (!isPending(run)) {
                            continue;
                        }
                        var required = actionResolver.resources(task, element, run);
                        var resourceIdx = resources.indexOf(required);
                        if (resourceIdx < 0) {
                            resourceIdx = resources.size();
                            resources.add(required);
                        }
                        resourceIndices[actionIdx][element.index()] = resourceIdx;
                        runIds[actionIdx][element.index()] = run.id();
                    }
                }
            }
        }
        return new ResourceMap(resources, resourceIndices, runIds);
    }

    static boolean isPending(StoreRun run) {
        return run.submissionIndex().isEmpty() && !run.skip() && run.startTime().isEmpty();
    }

    private static int[][] filled(int rows, int columns) {
        var array = new int[rows][columns];
        for (int[] row : array) {
            Arrays.fill(row, ResourceMap.NO_RUN);
        }
        return array;
    }
}
