package com.hartwig.hpcwe.loop;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.hartwig.hpcwe.dependency.DependencyCache;
import com.hartwig.hpcwe.model.IterableParameter;
import com.hartwig.hpcwe.model.StoreElement;
import com.hartwig.hpcwe.model.StoreElementIteration;
import com.hartwig.hpcwe.model.StoreLoop;
import com.hartwig.hpcwe.model.StoreTask;
import com.hartwig.hpcwe.store.PersistentStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A loop bound to a workflow store: a contiguous range of tasks whose elements are iterated together.
 * <p>
 * Iteration counts are kept per combination of parent loop indices, so a loop nested in another one counts its
 * iterations separately for every iteration of the outer loop.
 */
public class WorkflowLoop {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkflowLoop.class);

    private final PersistentStore store;
    private final int id;

    private WorkflowLoop(final PersistentStore store, final int id) {
        this.store = store;
        this.id = id;
    }

    public static WorkflowLoop load(PersistentStore store, int id) {
        store.getLoop(id);
        return new WorkflowLoop(store, id);
    }

    /**
     * Validates and stages a new loop over the given tasks. Every existing iteration of the looped elements becomes
     * iteration 0 of the new loop. Existing loops over a strict subset of the tasks become child loops of the new one.
     *
     * @param parameterTypes input and output types of at least the looped tasks, used to find the iterable parameters
     */
    public static WorkflowLoop create(PersistentStore store, String name, List<Integer> taskInsertIds, JsonNode template,
            List<TaskParameterTypes> parameterTypes) {
        if (taskInsertIds.isEmpty()) {
            throw new LoopValidationException(String.format("Loop '%s' must contain at least one task", name));
        }
        var existing = store.getLoops();
        if (existing.stream().anyMatch(loop -> loop.name().equals(name))) {
            throw new LoopValidationException(String.format("A loop with the name '%s' already exists in the workflow", name));
        }

        var tasks = store.getTasks(taskInsertIds).stream().sorted(Comparator.comparingInt(StoreTask::index)).collect(Collectors.toList());
        checkContiguous(name, tasks);
        var orderedInsertIds = tasks.stream().map(StoreTask::id).collect(Collectors.toList());

        var taskSet = new HashSet<>(taskInsertIds);
        var parents = new ArrayList<String>();
        var children = new ArrayList<StoreLoop>();
        for (StoreLoop other : existing) {
            var otherSet = new HashSet<>(other.taskInsertIds());
            if (otherSet.containsAll(taskSet)) {
                parents.add(other.name());
            } else if (taskSet.containsAll(otherSet)) {
                children.add(other);
            }
        }

        var iterableParameters = findIterableParameters(name, orderedInsertIds, parameterTypes);

        var iterationIds = new ArrayList<Integer>();
        var numAddedIterations = new LinkedHashMap<List<Integer>, Integer>();
        for (StoreTask task : tasks) {
            for (StoreElement element : store.getElements(task.elementIds())) {
                for (StoreElementIteration iteration : store.getElementIterations(element.iterationIds())) {
                    iterationIds.add(iteration.id());
                    numAddedIterations.putIfAbsent(parentKey(parents, iteration.loopIndex()), 1);
                }
            }
        }
        if (numAddedIterations.isEmpty()) {
            numAddedIterations.put(parents.stream().map(parent -> 0).collect(Collectors.toList()), 1);
        }

        var loopId = store.addLoop(name, orderedInsertIds, template, iterableParameters, parents, numAddedIterations, iterationIds);
        for (StoreLoop child : children) {
            var childParents = new ArrayList<>(child.parents());
            var position = (int) childParents.stream().filter(parents::contains).count();
            childParents.add(position, name);
            store.updateLoopParents(child.id(), childParents);
            LOGGER.info("[{}] Loop now encloses existing loop '{}', which has parents {}", name, child.name(), childParents);
        }
        LOGGER.info("[{}] Added loop over tasks {} with parents {} and iterable parameters {}",
                name,
                orderedInsertIds,
                parents,
                iterableParameters.keySet());
        return new WorkflowLoop(store, loopId);
    }

    private static void checkContiguous(String name, List<StoreTask> tasks) {
        var first = tasks.get(0).index();
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i).index() != first + i) {
                throw new LoopValidationException(String.format("Loop '%s' task subset must be a contiguous range, but has task indices %s",
                        name,
                        tasks.stream().map(StoreTask::index).collect(Collectors.toList())));
            }
        }
    }

    /**
     * A parameter is iterable when a looped task consumes it no later than the first looped task producing it.
     */
    static Map<String, IterableParameter> findIterableParameters(String name, List<Integer> orderedInsertIds,
            List<TaskParameterTypes> parameterTypes) {
        var typesByTask = parameterTypes.stream().collect(Collectors.toMap(TaskParameterTypes::taskInsertId, types -> types));
        var firstInput = new LinkedHashMap<String, Integer>();
        var outputs = new LinkedHashMap<String, List<Integer>>();
        for (Integer insertId : orderedInsertIds) {
            var types = typesByTask.get(insertId);
            if (types == null) {
                throw new IllegalArgumentException(String.format("No parameter types given for task %s of loop '%s'", insertId, name));
            }
            types.inputTypes().forEach(type -> firstInput.putIfAbsent(type, insertId));
            types.outputTypes().forEach(type -> outputs.computeIfAbsent(type, t -> new ArrayList<>()).add(insertId));
        }
        var iterable = new LinkedHashMap<String, IterableParameter>();
        for (var entry : firstInput.entrySet()) {
            var producers = outputs.get(entry.getKey());
            if (producers != null && orderedInsertIds.indexOf(entry.getValue()) <= orderedInsertIds.indexOf(producers.get(0))) {
                iterable.put(entry.getKey(), IterableParameter.builder().inputTask(entry.getValue()).outputTasks(producers).build());
            }
        }
        return iterable;
    }

    private static List<Integer> parentKey(List<String> parents, Map<String, Integer> loopIndex) {
        return parents.stream().map(parent -> loopIndex.getOrDefault(parent, 0)).collect(Collectors.toList());
    }

    public int id() {
        return id;
    }

    public StoreLoop definition() {
        return store.getLoop(id);
    }

    public int numIterations(List<Integer> parentLoopIndices) {
        return definition().numIterations(parentLoopIndices);
    }

    /**
     * Adds one iteration to every looped element whose latest iteration under the given parent loop indices is the
     * current last one, and saves once all of them are staged.
     *
     * @param parentLoopIndices one index per parent loop, in the order of {@link StoreLoop#parents()}
     * @return IDs of the new element iterations
     */
    public List<Integer> addIteration(List<Integer> parentLoopIndices, IterationSource source) {
        var loop = definition();
        if (parentLoopIndices.size() != loop.parents().size()) {
            throw new IllegalArgumentException(String.format("Loop '%s' has parent loops %s, but %s parent indices were given",
                    loop.name(),
                    loop.parents(),
                    parentLoopIndices.size()));
        }
        var key = List.copyOf(parentLoopIndices);
        var current = loop.numIterations(key);
        if (current == 0) {
            throw new IllegalArgumentException(String.format("Loop '%s' has no iterations for parent loop indices %s", loop.name(), key));
        }

        return store.batchUpdate(() -> {
            try (var cached = store.cachedLoad()) {
                var dependencies = DependencyCache.build(store);
                var previousIndex = new LinkedHashMap<String, Integer>();
                for (int i = 0; i < key.size(); i++) {
                    previousIndex.put(loop.parents().get(i), key.get(i));
                }
                previousIndex.put(loop.name(), current - 1);

                var loopElements = new ArrayList<StoreElement>();
                for (StoreTask task : store.getTasks(loop.taskInsertIds())) {
                    loopElements.addAll(store.getElements(task.elementIds()));
                }
                checkNoDownstreamConsumers(loop, loopElements, dependencies);

                var childLoops = store.getLoops().stream().filter(other -> other.parents().contains(loop.name())).collect(Collectors.toList());
                var newIterationIds = new ArrayList<Integer>();
                Map<String, Integer> newIndex = null;
                for (StoreElement element : loopElements) {
                    var previous = latestIteration(element, previousIndex);
                    if (previous.isEmpty()) {
                        LOGGER.debug("[{}] Element {} has no iteration at {}, not iterating it", loop.name(), element.id(), previousIndex);
                        continue;
                    }
                    var loopIndex = new LinkedHashMap<>(previous.get().loopIndex());
                    loopIndex.put(loop.name(), current);
                    childLoops.stream()
                            .filter(child -> child.taskInsertIds().contains(element.taskId()))
                            .forEach(child -> loopIndex.put(child.name(), 0));
                    var dataIndex = source.nextDataIndex(loop, previous.get(), loopIndex, dependencies);
                    newIterationIds.add(store.addElementIteration(element.id(), dataIndex, previous.get().schemaParameters(), loopIndex));
                    newIndex = loopIndex;
                }

                store.updateLoopNumIterations(id, key, current + 1);
                if (newIndex != null) {
                    for (StoreLoop child : childLoops) {
                        var childKey = parentKey(child.parents(), newIndex);
                        if (child.numIterations(childKey) == 0) {
                            store.updateLoopNumIterations(child.id(), childKey, 1);
                        }
                    }
                }
                LOGGER.info("[{}] Added iteration {} for parent loop indices {} to {} element(s)",
                        loop.name(),
                        current,
                        key,
                        newIterationIds.size());
                return newIterationIds;
            }
        });
    }

    private Optional<StoreElementIteration> latestIteration(StoreElement element, Map<String, Integer> loopIndex) {
        StoreElementIteration latest = null;
        for (StoreElementIteration iteration : store.getElementIterations(element.iterationIds())) {
            if (iteration.loopIndex().entrySet().containsAll(loopIndex.entrySet())) {
                latest = iteration;
            }
        }
        return Optional.ofNullable(latest);
    }

    /**
     * A loop with iterable parameters cannot be iterated once elements outside the loop depend on looped elements.
     */
    private static void checkNoDownstreamConsumers(StoreLoop loop, List<StoreElement> loopElements, DependencyCache dependencies) {
        if (loop.iterableParameters().isEmpty()) {
            return;
        }
        Set<Integer> loopElementIds = loopElements.stream().map(StoreElement::id).collect(Collectors.toSet());
        var downstream = dependencies.elementDependentsRecursive(loopElementIds)
                .stream()
                .filter(elementId -> !loopElementIds.contains(elementId))
                .collect(Collectors.toList());
        if (!downstream.isEmpty()) {
            throw new LoopValidationException(String.format(
                    "Cannot iterate loop '%s': elements %s outside the loop already consume its iterable parameters %s",
                    loop.name(),
                    downstream,
                    loop.iterableParameters().keySet()));
        }
    }
}
