package com.hartwig.hpcwe.model;

import java.util.List;
import java.util.Map;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StoreElement {
    int id();

    int taskId();

    /**
     * Index of the element within its task.
     */
    int index();

    int elementSetIndex();

    Map<String, Integer> sequenceIndices();

    Map<String, Integer> sourceIndices();

    List<Integer> iterationIds();

    default StoreElement appendIterationIds(List<Integer> ids) {
        return builder().from(this).addAllIterationIds(ids).build();
    }

    static ImmutableStoreElement.Builder builder() {
        return ImmutableStoreElement.builder();
    }
}
