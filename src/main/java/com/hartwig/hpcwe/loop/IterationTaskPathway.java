package com.hartwig.hpcwe.loop;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import com.hartwig.hpcwe.model.StoreLoop;
import com.hartwig.hpcwe.model.StoreTask;
import com.hartwig.hpcwe.store.PersistentStore;

import org.apache.commons.lang3.tuple.Pair;

/**
 * The order in which task iterations execute: every task once, in task order, with the tasks of each loop repeated
 * once per added iteration. Entries are task insert IDs paired with the loop index of that pass.
 */
public final class IterationTaskPathway {
    private IterationTaskPathway() {
    }

    public static List<Pair<Integer, Map<String, Integer>>> of(PersistentStore store) {
        return of(store.getTasks(), store.getLoops());
    }

    public static List<Pair<Integer, Map<String, Integer>>> of(List<StoreTask> tasks, List<StoreLoop> loops) {
        List<Pair<Integer, Map<String, Integer>>> pathway = tasks.stream()
                .sorted(Comparator.comparingInt(StoreTask::index))
                .map(task -> Pair.<Integer, Map<String, Integer>>of(task.id(), Map.of()))
                .collect(Collectors.toList());

        var added = new HashSet<String>();
        for (int round = 0; round < loops.size(); round++) {
            var next = loops.stream()
                    .filter(loop -> !added.contains(loop.name()) && added.containsAll(loop.parents()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException(String.format(
                            "No loop left whose parents are all on the pathway, added so far: %s",
                            added)));
            pathway = expand(pathway, next);
            added.add(next.name());
        }
        return pathway;
    }

    private static List<Pair<Integer, Map<String, Integer>>> expand(List<Pair<Integer, Map<String, Integer>>> pathway, StoreLoop loop) {
        var result = pathway;
        for (var entry : loop.numAddedIterations().entrySet()) {
            var parentIndex = new LinkedHashMap<String, Integer>();
            for (int i = 0; i < entry.getKey().size(); i++) {
                parentIndex.put(loop.parents().get(i), entry.getKey().get(i));
            }

            var replacement = new ArrayList<Pair<Integer, Map<String, Integer>>>();
            var first = -1;
            var last = -1;
            for (int iteration = 0; iteration < entry.getValue(); iteration++) {
                for (int position = 0; position < result.size(); position++) {
                    var step = result.get(position);
                    if (!loop.taskInsertIds().contains(step.getLeft()) || !matches(step.getRight(), parentIndex)) {
                        continue;
                    }
                    var loopIndex = new LinkedHashMap<>(step.getRight());
                    loopIndex.put(loop.name(), iteration);
                    replacement.add(Pair.of(step.getLeft(), loopIndex));
                    first = first < 0 ? position : Math.min(first, position);
                    last = Math.max(last, position);
                }
            }
            if (!replacement.isEmpty()) {
                var replaced = new ArrayList<>(result.subList(0, first));
                replaced.addAll(replacement);
                replaced.addAll(result.subList(last + 1, result.size()));
                result = replaced;
            }
        }
        return result;
    }

    private static boolean matches(Map<String, Integer> loopIndex, Map<String, Integer> parentIndex) {
        for (var entry : parentIndex.entrySet()) {
            if (!Objects.equals(loopIndex.get(entry.getKey()), entry.getValue())) {
                return false;
            }
        }
        return true;
    }
}
