package com.hartwig.hpcwe.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StoreElementIteration {
    int id();

    int elementId();

    DataIndex dataIndex();

    List<String> schemaParameters();

    /**
     * Loop name to the iteration index of that loop this iteration belongs to.
     */
    Map<String, Integer> loopIndex();

    @Value.Default
    default boolean runsInitialised() {
        return false;
    }

    /**
     * Schema action index to the IDs of the runs of that action, in creation order.
     */
    Map<Integer, List<Integer>> runIds();

    default StoreElementIteration appendRunIds(int actionIndex, List<Integer> ids) {
        var updated = new LinkedHashMap<>(runIds());
        var existing = new ArrayList<>(updated.getOrDefault(actionIndex, List.of()));
        existing.addAll(ids);
        updated.put(actionIndex, List.copyOf(existing));
        return ImmutableStoreElementIteration.copyOf(this).withRunIds(updated);
    }

    default StoreElementIteration withLoopIndexUpdate(Map<String, Integer> update) {
        var merged = new LinkedHashMap<>(loopIndex());
        merged.putAll(update);
        return ImmutableStoreElementIteration.copyOf(this).withLoopIndex(merged);
    }

    default StoreElementIteration markRunsInitialised() {
        return ImmutableStoreElementIteration.copyOf(this).withRunsInitialised(true);
    }

    static ImmutableStoreElementIteration.Builder builder() {
        return ImmutableStoreElementIteration.builder();
    }
}
