package com.hartwig.hpcwe.loop;

import java.util.Map;

import com.hartwig.hpcwe.dependency.DependencyCache;
import com.hartwig.hpcwe.model.DataIndex;
import com.hartwig.hpcwe.model.StoreElementIteration;
import com.hartwig.hpcwe.model.StoreLoop;

/**
 * Decides where the inputs of a new loop iteration come from. Typically iterable parameters are sourced from the
 * outputs of the previous iteration and everything else is carried over.
 */
public interface IterationSource {
    /**
     * @param loop the loop being iterated
     * @param previous the element's iteration that the new one follows
     * @param loopIndex the loop index of the new iteration
     * @param dependencies dependencies as they were before any iteration of this request was staged
     * @return the complete data index of the new iteration
     */
    DataIndex nextDataIndex(StoreLoop loop, StoreElementIteration previous, Map<String, Integer> loopIndex,
            DependencyCache dependencies);
}
