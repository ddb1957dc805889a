package com.hartwig.hpcwe.submission;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import com.hartwig.hpcwe.dependency.DependencyCache;
import com.hartwig.hpcwe.loop.IterationTaskPathway;
import com.hartwig.hpcwe.model.ImmutableJobscriptDescriptor;
import com.hartwig.hpcwe.model.JobscriptDescriptor;
import com.hartwig.hpcwe.model.StoreTask;
import com.hartwig.hpcwe.model.TaskAction;
import com.hartwig.hpcwe.store.PersistentStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles the pending runs of a workflow into jobscripts: one resource map per task pass of the iteration pathway,
 * grouped into jobscripts, linked by their run dependencies and merged across tasks where possible.
 */
public class JobscriptResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobscriptResolver.class);

    private final PersistentStore store;
    private final ResourceMapGenerator resourceMapGenerator;

    public JobscriptResolver(final PersistentStore store, final TaskActionResolver actionResolver) {
        this.store = store;
        this.resourceMapGenerator = new ResourceMapGenerator(store, actionResolver);
    }

    public List<JobscriptDescriptor> resolve() {
        return resolve(null);
    }

    /**
     * @param taskInsertIds tasks to include, or null for all tasks
     */
    public List<JobscriptDescriptor> resolve(Set<Integer> taskInsertIds) {
        try (var ignored = store.cachedLoad()) {
            var dependencies = DependencyCache.build(store);
            var jobscripts = new LinkedHashMap<Integer, JobscriptDescriptor>();
            var elementDependencies = new LinkedHashMap<Integer, Map<Integer, List<Integer>>>();

            for (var pass : IterationTaskPathway.of(store)) {
                if (taskInsertIds != null && !taskInsertIds.contains(pass.getLeft())) {
                    continue;
                }
                var task = store.getTask(pass.getLeft());
                var resourceMap = resourceMapGenerator.generate(task, pass.getRight());
                var allocation = JobscriptGrouper.group(resourceMap.resourceIndices());
                for (JobscriptGroup group : allocation.groups()) {
                    var jobscriptIdx = jobscripts.size();
                    var jobscript = toJobscript(jobscriptIdx, task, pass.getRight(), resourceMap, group);
                    jobscripts.put(jobscriptIdx, jobscript);
                    var dependenciesByElement = externalRunDependencies(jobscript, dependencies);
                    if (!dependenciesByElement.isEmpty()) {
                        elementDependencies.put(jobscriptIdx, dependenciesByElement);
                    }
                }
            }

            var resolved = JobscriptDependencyResolver.resolve(jobscripts, elementDependencies);
            for (var entry : resolved.entrySet()) {
                jobscripts.put(entry.getKey(),
                        ImmutableJobscriptDescriptor.copyOf(jobscripts.get(entry.getKey())).withDependencies(entry.getValue()));
            }
            var result = JobscriptMerger.toList(JobscriptMerger.mergeAcrossTasks(jobscripts));
            LOGGER.info("[{}] Resolved {} jobscript(s) from {} task pass(es) before merging",
                    store.workflowPath().getFileName(),
                    result.size(),
                    jobscripts.size());
            return result;
        }
    }

    private static JobscriptDescriptor toJobscript(int index, StoreTask task, Map<String, Integer> loopIndex, ResourceMap resourceMap,
            JobscriptGroup group) {
        var actions = new TreeSet<Integer>();
        group.elements().values().forEach(actions::addAll);
        var actionRows = new ArrayList<>(actions);
        var elementColumns = new ArrayList<>(group.elements().keySet());

        var runIds = new ArrayList<List<Integer>>();
        for (Integer actionIdx : actionRows) {
            var row = new ArrayList<Integer>();
            for (Integer elementIdx : elementColumns) {
                row.add(group.elements().get(elementIdx).contains(actionIdx)
                        ? resourceMap.runIds()[actionIdx][elementIdx]
                        : ResourceMap.NO_RUN);
            }
            runIds.add(row);
        }

        var taskElements = new LinkedHashMap<Integer, List<Integer>>();
        for (int i = 0; i < elementColumns.size(); i++) {
            taskElements.put(i, List.of(elementColumns.get(i)));
        }

        return JobscriptDescriptor.builder()
                .index(index)
                .resources(resourceMap.resources().get(group.resourceIndex()))
                .addTaskInsertIds(task.id())
                .addTaskLoopIndex(loopIndex)
                .taskActions(actionRows.stream().map(a -> TaskAction.of(task.id(), a, 0)).collect(Collectors.toList()))
                .taskElements(taskElements)
                .runIds(runIds)
                .build();
    }

    private static Map<Integer, List<Integer>> externalRunDependencies(JobscriptDescriptor jobscript, DependencyCache dependencies) {
        var ownRuns = new LinkedHashSet<Integer>();
        jobscript.runIds().forEach(ownRuns::addAll);
        var result = new LinkedHashMap<Integer, List<Integer>>();
        for (int elementIdx = 0; elementIdx < jobscript.numElements(); elementIdx++) {
            var external = new LinkedHashSet<Integer>();
            for (List<Integer> row : jobscript.runIds()) {
                var runId = row.get(elementIdx);
                if (runId == ResourceMap.NO_RUN) {
                    continue;
                }
                dependencies.runDependencies(runId).stream().filter(dep -> !ownRuns.contains(dep)).forEach(external::add);
            }
            if (!external.isEmpty()) {
                result.put(elementIdx, new ArrayList<>(external));
            }
        }
        return result;
    }
}
