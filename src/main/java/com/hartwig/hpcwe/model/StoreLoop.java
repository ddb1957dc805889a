package com.hartwig.hpcwe.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StoreLoop {
    int id();

    String name();

    /**
     * Insert IDs of the looped tasks.
     */
    List<Integer> taskInsertIds();

    JsonNode template();

    Map<String, IterableParameter> iterableParameters();

    /**
     * Names of the enclosing loops, outermost first.
     */
    List<String> parents();

    /**
     * Number of iterations added so far, keyed by the iteration indices of all parent loops.
     */
    Map<List<Integer>, Integer> numAddedIterations();

    default int numIterations(List<Integer> parentKey) {
        return numAddedIterations().getOrDefault(parentKey, 0);
    }

    default StoreLoop withNumIterations(List<Integer> parentKey, int count) {
        var updated = new LinkedHashMap<>(numAddedIterations());
        updated.put(List.copyOf(parentKey), count);
        return ImmutableStoreLoop.copyOf(this).withNumAddedIterations(updated);
    }

    /**
     * Replaces the parent loops. Iteration counts keyed by the old parents are re-keyed, with index 0 for every newly
     * added parent, since all existing iterations belong to the first iteration of an enclosing loop added later.
     */
    default StoreLoop withParentsUpdate(List<String> updatedParents) {
        var rekeyed = new LinkedHashMap<List<Integer>, Integer>();
        for (var entry : numAddedIterations().entrySet()) {
            var key = entry.getKey();
            if (key.size() == parents().size() && !updatedParents.equals(parents())) {
                var newKey = new ArrayList<Integer>();
                for (String parent : updatedParents) {
                    var position = parents().indexOf(parent);
                    newKey.add(position >= 0 ? key.get(position) : 0);
                }
                key = List.copyOf(newKey);
            }
            rekeyed.merge(key, entry.getValue(), Math::max);
        }
        return ImmutableStoreLoop.copyOf(this).withParents(updatedParents).withNumAddedIterations(rekeyed);
    }

    static ImmutableStoreLoop.Builder builder() {
        return ImmutableStoreLoop.builder();
    }
}
