package com.hartwig.hpcwe.submission;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.hartwig.hpcwe.model.JobscriptDependency;
import com.hartwig.hpcwe.model.JobscriptDescriptor;

/**
 * Turns run-level dependencies of jobscript elements into dependencies between jobscripts.
 */
public final class JobscriptDependencyResolver {

    private JobscriptDependencyResolver() {
    }

    /**
     * @param jobscripts          jobscripts by index, in creation order
     * @param elementDependencies jobscript index to jobscript element index to the IDs of runs, outside the
     *                            jobscript, that the element's runs depend on
     * @return jobscript index to dependency jobscript index to the dependency; only earlier jobscripts are considered
     */
    public static Map<Integer, Map<Integer, JobscriptDependency>> resolve(Map<Integer, JobscriptDescriptor> jobscripts,
            Map<Integer, Map<Integer, List<Integer>>> elementDependencies) {
        var resolved = new LinkedHashMap<Integer, Map<Integer, JobscriptDependency>>();
        for (var entry : elementDependencies.entrySet()) {
            int jobscriptIdx = entry.getKey();
            var mappings = new LinkedHashMap<Integer, Map<Integer, List<Integer>>>();
            for (var elementEntry : entry.getValue().entrySet()) {
                for (Integer runId : elementEntry.getValue()) {
                    for (var candidate : jobscripts.entrySet()) {
                        if (candidate.getKey() == jobscriptIdx) {
                            break;
                        }
                        var column = columnOf(candidate.getValue(), runId);
                        if (column < 0) {
                            continue;
                        }
                        var targets = mappings.computeIfAbsent(candidate.getKey(), k -> new LinkedHashMap<>())
                                .computeIfAbsent(elementEntry.getKey(), k -> new ArrayList<>());
                        if (!targets.contains(column)) {
                            targets.add(column);
                        }
                    }
                }
            }
            var dependent = jobscripts.get(jobscriptIdx);
            var dependencies = new LinkedHashMap<Integer, JobscriptDependency>();
            for (var mapping : mappings.entrySet()) {
                dependencies.put(mapping.getKey(),
                        JobscriptDependency.builder()
                                .elementMapping(mapping.getValue())
                                .isArray(isArray(mapping.getValue(), dependent, jobscripts.get(mapping.getKey())))
                                .build());
            }
            resolved.put(jobscriptIdx, dependencies);
        }
        return resolved;
    }

    static boolean isArray(Map<Integer, List<Integer>> mapping, JobscriptDescriptor dependent, JobscriptDescriptor dependency) {
        var keys = mapping.keySet().stream().sorted().collect(Collectors.toList());
        if (!keys.equals(range(dependent.numElements()))) {
            return false;
        }
        if (mapping.values().stream().anyMatch(targets -> targets.size() != 1)) {
            return false;
        }
        var targets = mapping.values().stream().map(t -> t.get(0)).sorted().collect(Collectors.toList());
        return targets.equals(range(dependency.numElements()));
    }

    private static List<Integer> range(int n) {
        return IntStream.range(0, n).boxed().collect(Collectors.toList());
    }

    private static int columnOf(JobscriptDescriptor jobscript, int runId) {
        for (List<Integer> row : jobscript.runIds()) {
            var column = row.indexOf(runId);
            if (column >= 0) {
                return column;
            }
        }
        return -1;
    }
}
