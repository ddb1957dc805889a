package com.hartwig.hpcwe.submission;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Splits an action-by-element resource map into jobscripts.
 * <p>
 * Rows are visited top to bottom. In each row, every resource index still present starts a jobscript that claims the
 * unallocated cells of the row with that index (or with the {@link #NONE} sentinel) and then, per claimed column,
 * continues down the column while the value stays the same. Sentinel cells extend a column without being claimed.
 */
public final class JobscriptGrouper {
    public static final int NONE = -1;

    private JobscriptGrouper() {
    }

    public static JobscriptAllocation group(int[][] resourceMap) {
        var numElements = validate(resourceMap);
        var jobscriptMap = new int[resourceMap.length][numElements];
        for (int[] row : jobscriptMap) {
            Arrays.fill(row, NONE);
        }
        var remaining = 0;
        for (int[] row : resourceMap) {
            for (int value : row) {
                if (value != NONE) {
                    remaining++;
                }
            }
        }

        var groups = new ArrayList<JobscriptGroup>();
        for (int actionIdx = 0; actionIdx < resourceMap.length && remaining > 0; actionIdx++) {
            var row = resourceMap[actionIdx];
            for (int resourceIdx : new TreeSet<>(valuesOf(row))) {
                var elements = new TreeMap<Integer, TreeSet<Integer>>();
                for (int elementIdx = 0; elementIdx < numElements; elementIdx++) {
                    var value = row[elementIdx];
                    if (jobscriptMap[actionIdx][elementIdx] != NONE || (value != resourceIdx && value != NONE)) {
                        continue;
                    }
                    var actions = new TreeSet<Integer>();
                    if (value != NONE) {
                        actions.add(actionIdx);
                    }
                    for (int below = actionIdx + 1; below < resourceMap.length; below++) {
                        var downstream = resourceMap[below][elementIdx];
                        if (downstream == NONE) {
                            continue;
                        }
                        if (downstream != resourceIdx) {
                            break;
                        }
                        if (jobscriptMap[below][elementIdx] == NONE) {
                            actions.add(below);
                        }
                    }
                    if (!actions.isEmpty()) {
                        elements.put(elementIdx, actions);
                    }
                }
                if (elements.isEmpty()) {
                    continue;
                }

                var groupIdx = groups.size();
                var builder = JobscriptGroup.builder().resourceIndex(resourceIdx);
                for (Map.Entry<Integer, TreeSet<Integer>> entry : elements.entrySet()) {
                    for (Integer claimed : entry.getValue()) {
                        jobscriptMap[claimed][entry.getKey()] = groupIdx;
                        remaining--;
                    }
                    builder.putElements(entry.getKey(), List.copyOf(entry.getValue()));
                }
                groups.add(builder.build());
            }
        }
        return new JobscriptAllocation(groups, jobscriptMap);
    }

    private static int validate(int[][] resourceMap) {
        var numElements = resourceMap.length == 0 ? 0 : resourceMap[0].length;
        for (int[] row : resourceMap) {
            if (row.length != numElements) {
                throw new IllegalArgumentException(String.format("Resource map rows must have %s elements, found a row with %s",
                        numElements,
                        row.length));
            }
            for (int value : row) {
                if (value < NONE) {
                    throw new IllegalArgumentException(String.format("Invalid resource index %s in resource map", value));
                }
            }
        }
        return numElements;
    }

    private static List<Integer> valuesOf(int[] row) {
        var values = new ArrayList<Integer>();
        for (int value : row) {
            if (value != NONE) {
                values.add(value);
            }
        }
        return values;
    }
}
