package com.hartwig.hpcwe.model;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StoreTask {
    /**
     * Task insert ID, never reused even when tasks are inserted out of order.
     */
    int id();

    /**
     * Position of the task in the workflow template task list.
     */
    int index();

    List<Integer> elementIds();

    JsonNode template();

    default StoreTask appendElementIds(List<Integer> ids) {
        return builder().from(this).addAllElementIds(ids).build();
    }

    static ImmutableStoreTask.Builder builder() {
        return ImmutableStoreTask.builder();
    }
}
