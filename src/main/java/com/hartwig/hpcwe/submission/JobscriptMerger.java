package com.hartwig.hpcwe.submission;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.hartwig.hpcwe.model.ImmutableJobscriptDescriptor;
import com.hartwig.hpcwe.model.JobscriptDependency;
import com.hartwig.hpcwe.model.JobscriptDescriptor;
import com.hartwig.hpcwe.model.TaskAction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class JobscriptMerger {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobscriptMerger.class);

    private JobscriptMerger() {
    }

    /**
     * Folds a jobscript into the jobscript it depends on when that is its only dependency, the dependency is an array
     * dependency and both need the same resources. Later jobscripts that depended on a folded jobscript depend on the
     * jobscript it was folded into instead.
     */
    public static Map<Integer, JobscriptDescriptor> mergeAcrossTasks(Map<Integer, JobscriptDescriptor> jobscripts) {
        var working = new LinkedHashMap<>(jobscripts);
        var merged = new HashSet<Integer>();
        for (Integer index : List.copyOf(working.keySet())) {
            var jobscript = working.get(index);
            if (jobscript.dependencies().size() != 1) {
                continue;
            }
            var dependency = jobscript.dependencies().entrySet().iterator().next();
            var target = working.get(dependency.getKey());
            if (target == null) {
                throw new IllegalStateException(String.format("Jobscript %s depends on unknown jobscript %s", index, dependency.getKey()));
            }
            if (!dependency.getValue().isArray() || !jobscript.resources().equals(target.resources())) {
                continue;
            }
            working.put(dependency.getKey(), absorb(target, jobscript));
            merged.add(index);
            reindexDependencies(working, index, dependency.getKey());
            LOGGER.debug("Merged jobscript {} into jobscript {}", index, dependency.getKey());
        }
        working.keySet().removeAll(merged);
        return working;
    }

    /**
     * Numbers the jobscripts consecutively from zero in iteration order, rewriting dependency keys to match.
     */
    public static List<JobscriptDescriptor> toList(Map<Integer, JobscriptDescriptor> jobscripts) {
        var working = new LinkedHashMap<>(jobscripts);
        var list = new ArrayList<JobscriptDescriptor>();
        for (Integer index : List.copyOf(working.keySet())) {
            var newIndex = list.size();
            if (index != newIndex) {
                reindexDependencies(working, index, newIndex);
            }
            list.add(ImmutableJobscriptDescriptor.copyOf(working.get(index)).withIndex(newIndex));
        }
        return list;
    }

    /**
     * Points dependencies on {@code from} at {@code to}, for the jobscripts after {@code from}.
     */
    static void reindexDependencies(Map<Integer, JobscriptDescriptor> jobscripts, int from, int to) {
        for (var entry : jobscripts.entrySet()) {
            var dependencies = entry.getValue().dependencies();
            if (entry.getKey() <= from || !dependencies.containsKey(from)) {
                continue;
            }
            var updated = new LinkedHashMap<>(dependencies);
            JobscriptDependency moved = updated.remove(from);
            updated.put(to, moved);
            entry.setValue(ImmutableJobscriptDescriptor.copyOf(entry.getValue()).withDependencies(updated));
        }
    }

    private static JobscriptDescriptor absorb(JobscriptDescriptor target, JobscriptDescriptor source) {
        var loopIndexPosition = target.taskLoopIndex().size();
        var taskInsertIds = new ArrayList<>(target.taskInsertIds());
        taskInsertIds.add(source.taskInsertIds().get(0));
        var taskLoopIndex = new ArrayList<>(target.taskLoopIndex());
        taskLoopIndex.add(source.taskLoopIndex().get(0));

        var taskActions = new ArrayList<>(target.taskActions());
        taskActions.addAll(source.taskActions()
                .stream()
                .map(action -> TaskAction.of(action.taskInsertId(), action.actionIndex(), loopIndexPosition))
                .collect(Collectors.toList()));

        var taskElements = new LinkedHashMap<Integer, List<Integer>>();
        target.taskElements().forEach((element, taskElementIds) -> taskElements.put(element, new ArrayList<>(taskElementIds)));
        for (var entry : source.taskElements().entrySet()) {
            var elements = taskElements.get(entry.getKey());
            if (elements == null) {
                throw new IllegalStateException(String.format("Jobscript %s has no element %s to merge into",
                        target.index(),
                        entry.getKey()));
            }
            elements.addAll(entry.getValue());
        }

        var runIds = new ArrayList<>(target.runIds());
        runIds.addAll(source.runIds());

        return ImmutableJobscriptDescriptor.copyOf(target)
                .withTaskInsertIds(taskInsertIds)
                .withTaskLoopIndex(taskLoopIndex)
                .withTaskActions(taskActions)
                .withTaskElements(taskElements)
                .withRunIds(runIds);
    }
}
