package com.hartwig.hpcwe.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups commit steps by the store resources they need, so that each resource is opened as few times as possible
 * during a commit. Steps are scanned in commit order: a step joins the current group when it needs no resource or
 * shares one with the group, otherwise the group is closed and a new one started. Closed groups needing the same
 * resources are merged, in order of first appearance.
 */
public final class CommitResourceMap {
    private final Map<CommitStep, List<String>> resourcesByStep;
    private final List<CommitGroup> groups;

    public CommitResourceMap(final Map<CommitStep, List<String>> resourcesByStep) {
        var copy = new EnumMap<CommitStep, List<String>>(CommitStep.class);
        for (CommitStep step : CommitStep.values()) {
            copy.put(step, List.copyOf(resourcesByStep.getOrDefault(step, List.of())));
        }
        this.resourcesByStep = Collections.unmodifiableMap(copy);
        this.groups = groupByResource(this.resourcesByStep);
    }

    public List<CommitGroup> groups() {
        return groups;
    }

    public List<String> resourcesOf(CommitStep step) {
        return resourcesByStep.get(step);
    }

    private static List<CommitGroup> groupByResource(Map<CommitStep, List<String>> resourcesByStep) {
        var merged = new LinkedHashMap<List<String>, List<CommitStep>>();
        Set<String> currentResources = null;
        List<CommitStep> currentSteps = null;
        for (var entry : resourcesByStep.entrySet()) {
            var resources = entry.getValue();
            if (currentResources == null) {
                currentResources = new LinkedHashSet<>(resources);
                currentSteps = new ArrayList<>(List.of(entry.getKey()));
            } else if (resources.isEmpty() || !Collections.disjoint(resources, currentResources)) {
                currentResources.addAll(resources);
                currentSteps.add(entry.getKey());
            } else {
                merged.computeIfAbsent(List.copyOf(currentResources), key -> new ArrayList<>()).addAll(currentSteps);
                currentResources = new LinkedHashSet<>(resources);
                currentSteps = new ArrayList<>(List.of(entry.getKey()));
            }
        }
        if (currentResources != null) {
            merged.computeIfAbsent(List.copyOf(currentResources), key -> new ArrayList<>()).addAll(currentSteps);
        }
        var result = new ArrayList<CommitGroup>();
        for (var entry : merged.entrySet()) {
            result.add(CommitGroup.builder().resources(entry.getKey()).steps(entry.getValue()).build());
        }
        return List.copyOf(result);
    }
}
