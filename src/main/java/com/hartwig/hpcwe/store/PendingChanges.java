package com.hartwig.hpcwe.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.hartwig.hpcwe.model.JobscriptMetadata;
import com.hartwig.hpcwe.model.PendingFile;
import com.hartwig.hpcwe.model.RunEnd;
import com.hartwig.hpcwe.model.RunStart;
import com.hartwig.hpcwe.model.StoreElement;
import com.hartwig.hpcwe.model.StoreElementIteration;
import com.hartwig.hpcwe.model.StoreLoop;
import com.hartwig.hpcwe.model.StoreParameter;
import com.hartwig.hpcwe.model.StoreRun;
import com.hartwig.hpcwe.model.StoreSubmission;
import com.hartwig.hpcwe.model.StoreTask;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Changes made to a {@link PersistentStore} that are not yet durable, one bucket per {@link CommitStep}. New entities
 * are keyed by the ID the store allocated for them; partial updates are keyed by the ID of the entity they modify,
 * which may itself still be pending.
 */
public class PendingChanges {
    private static final Logger LOGGER = LoggerFactory.getLogger(PendingChanges.class);

    final Map<Integer, StoreTask> addTasks = new LinkedHashMap<>();
    final Map<Integer, StoreLoop> addLoops = new LinkedHashMap<>();
    final Map<Integer, StoreSubmission> addSubmissions = new LinkedHashMap<>();
    final Map<Integer, Map<String, List<Integer>>> addSubmissionParts = new LinkedHashMap<>();
    final Map<Integer, List<Integer>> addElementIds = new LinkedHashMap<>();
    final Map<Integer, StoreElement> addElements = new LinkedHashMap<>();
    final Map<Integer, List<JsonNode>> addElementSets = new LinkedHashMap<>();
    final Map<Integer, List<Integer>> addIterationIds = new LinkedHashMap<>();
    final Map<Integer, StoreElementIteration> addIterations = new LinkedHashMap<>();
    final Map<Integer, Map<Integer, List<Integer>>> addRunIds = new LinkedHashMap<>();
    final Set<Integer> setRunsInitialised = new LinkedHashSet<>();
    final Map<Integer, StoreRun> addRuns = new LinkedHashMap<>();
    final Map<Integer, Integer> setRunSubmissionIndices = new LinkedHashMap<>();
    final Set<Integer> setRunSkips = new LinkedHashSet<>();
    final Map<Integer, RunStart> setRunStarts = new LinkedHashMap<>();
    final Map<Integer, RunEnd> setRunEnds = new LinkedHashMap<>();
    final Map<Integer, Map<Integer, JobscriptMetadata>> setJobscriptMetadata = new LinkedHashMap<>();
    final Map<Integer, StoreParameter> addParameters = new LinkedHashMap<>();
    final Map<Integer, ParameterAssignment> setParameters = new LinkedHashMap<>();
    final List<PendingFile> addFiles = new ArrayList<>();
    final Map<String, Map<String, JsonNode>> addTemplateComponents = new LinkedHashMap<>();
    final Map<Integer, Map<String, Object>> updateParameterSources = new LinkedHashMap<>();
    final Map<Integer, Map<String, Integer>> updateLoopIndices = new LinkedHashMap<>();
    final Map<Integer, Map<List<Integer>, Integer>> updateLoopNumIterations = new LinkedHashMap<>();
    final Map<Integer, List<String>> updateLoopParents = new LinkedHashMap<>();

    private final PersistentStore store;

    PendingChanges(final PersistentStore store) {
        this.store = store;
    }

    public boolean isEmpty() {
        for (CommitStep step : CommitStep.values()) {
            if (hasChanges(step)) {
                return false;
            }
        }
        return true;
    }

    public boolean hasChanges(CommitStep step) {
        return !bucket(step).isEmpty();
    }

    public int size(CommitStep step) {
        return bucket(step).size();
    }

    private Collection<?> bucket(CommitStep step) {
        switch (step) {
            case TASKS:
                return addTasks.keySet();
            case LOOPS:
                return addLoops.keySet();
            case SUBMISSIONS:
                return addSubmissions.keySet();
            case SUBMISSION_PARTS:
                return addSubmissionParts.keySet();
            case ELEMENT_IDS:
                return addElementIds.keySet();
            case ELEMENTS:
                return addElements.keySet();
            case ELEMENT_SETS:
                return addElementSets.keySet();
            case ITERATION_IDS:
                return addIterationIds.keySet();
            case ITERATIONS:
                return addIterations.keySet();
            case RUN_IDS:
                return addRunIds.keySet();
            case RUNS_INITIALISED:
                return setRunsInitialised;
            case RUNS:
                return addRuns.keySet();
            case RUN_SUBMISSION_INDICES:
                return setRunSubmissionIndices.keySet();
            case RUN_SKIPS:
                return setRunSkips;
            case RUN_STARTS:
                return setRunStarts.keySet();
            case RUN_ENDS:
                return setRunEnds.keySet();
            case JOBSCRIPT_METADATA:
                return setJobscriptMetadata.keySet();
            case PARAMETERS:
                // set values of durable parameters are committed by the same step as new parameters
                var parameterIds = new LinkedHashSet<Integer>(addParameters.keySet());
                parameterIds.addAll(setParameters.keySet());
                return parameterIds;
            case FILES:
                return addFiles;
            case TEMPLATE_COMPONENTS:
                return addTemplateComponents.keySet();
            case PARAMETER_SOURCES:
                return updateParameterSources.keySet();
            case LOOP_INDICES:
                return updateLoopIndices.keySet();
            case LOOP_NUM_ITERATIONS:
                return updateLoopNumIterations.keySet();
            case LOOP_PARENTS:
                return updateLoopParents.keySet();
            default:
                throw new IllegalArgumentException(String.format("Unknown commit step %s", step));
        }
    }

    /**
     * Applies every populated bucket to the store, one resource group at a time. A group that fails is rolled back to
     * its pending state and the remaining groups are still attempted; the failure is rethrown once all groups ran.
     */
    public void commitAll() {
        var failedSteps = new ArrayList<CommitStep>();
        RuntimeException firstFailure = null;
        for (CommitGroup group : store.commitResourceMap().groups()) {
            var steps = group.steps().stream().filter(this::hasChanges).toArray(CommitStep[]::new);
            if (steps.length == 0) {
                continue;
            }
            var snapshot = copy();
            var cleanUpFiles = List.of(steps).contains(CommitStep.FILES) ? filesToCleanUp() : List.<PendingFile>of();
            try {
                store.withResources(group.resources(), ResourceAction.UPDATE, () -> {
                    for (CommitStep step : steps) {
                        // an earlier step of the group may have consumed this bucket
                        if (hasChanges(step)) {
                            LOGGER.debug("[{}] Committing {} pending change(s)", step, size(step));
                            commit(step);
                        }
                        step.invalidates().ifPresent(store::invalidateCache);
                    }
                    return null;
                });
                store.cleanUpFileSources(cleanUpFiles);
            } catch (RuntimeException e) {
                LOGGER.warn("Commit of steps {} on resources {} failed, changes stay pending", List.of(steps), group.resources(), e);
                restore(snapshot);
                store.clearCache();
                failedSteps.addAll(List.of(steps));
                if (firstFailure == null) {
                    firstFailure = e;
                } else {
                    firstFailure.addSuppressed(e);
                }
            }
        }
        if (firstFailure != null) {
            throw new CommitFailedException(failedSteps, firstFailure);
        }
    }

    private List<PendingFile> filesToCleanUp() {
        return addFiles.stream().filter(file -> file.storeContents() && file.cleanUp()).collect(Collectors.toList());
    }

    private void commit(CommitStep step) {
        switch (step) {
            case TASKS:
                commitTasks();
                break;
            case LOOPS:
                commitLoops();
                break;
            case SUBMISSIONS:
                commitSubmissions();
                break;
            case SUBMISSION_PARTS:
                commitSubmissionParts();
                break;
            case ELEMENT_IDS:
                commitElementIds();
                break;
            case ELEMENTS:
                commitElements();
                break;
            case ELEMENT_SETS:
                store.appendElementSets(new LinkedHashMap<>(addElementSets));
                addElementSets.clear();
                break;
            case ITERATION_IDS:
                commitIterationIds();
                break;
            case ITERATIONS:
                commitIterations();
                break;
            case RUN_IDS:
                commitRunIds();
                break;
            case RUNS_INITIALISED:
                store.replaceIterations(updateDurable(store.readIterations(setRunsInitialised), iteration -> iteration.markRunsInitialised()));
                setRunsInitialised.clear();
                break;
            case RUNS:
                commitRuns();
                break;
            case RUN_SUBMISSION_INDICES:
                store.replaceRuns(updateDurable(store.readRuns(setRunSubmissionIndices.keySet()),
                        run -> run.assignedToSubmission(setRunSubmissionIndices.get(run.id()))));
                setRunSubmissionIndices.clear();
                break;
            case RUN_SKIPS:
                store.replaceRuns(updateDurable(store.readRuns(setRunSkips), StoreRun::skipped));
                setRunSkips.clear();
                break;
            case RUN_STARTS:
                store.replaceRuns(updateDurable(store.readRuns(setRunStarts.keySet()), run -> run.started(setRunStarts.get(run.id()))));
                setRunStarts.clear();
                break;
            case RUN_ENDS:
                store.replaceRuns(updateDurable(store.readRuns(setRunEnds.keySet()), run -> run.ended(setRunEnds.get(run.id()))));
                setRunEnds.clear();
                break;
            case JOBSCRIPT_METADATA:
                store.replaceSubmissions(updateDurable(store.readSubmissions(setJobscriptMetadata.keySet()),
                        submission -> submission.withJobscriptMetadata(setJobscriptMetadata.get(submission.index()))));
                setJobscriptMetadata.clear();
                break;
            case PARAMETERS:
                commitParameters();
                break;
            case FILES:
                store.writeFiles(List.copyOf(addFiles));
                addFiles.clear();
                break;
            case TEMPLATE_COMPONENTS:
                store.appendTemplateComponents(new LinkedHashMap<>(addTemplateComponents));
                addTemplateComponents.clear();
                break;
            case PARAMETER_SOURCES:
                store.replaceParameters(updateDurable(store.readParameters(updateParameterSources.keySet()),
                        parameter -> parameter.withSourceUpdate(updateParameterSources.get(parameter.id()))));
                updateParameterSources.clear();
                break;
            case LOOP_INDICES:
                store.replaceIterations(updateDurable(store.readIterations(updateLoopIndices.keySet()),
                        iteration -> iteration.withLoopIndexUpdate(updateLoopIndices.get(iteration.id()))));
                updateLoopIndices.clear();
                break;
            case LOOP_NUM_ITERATIONS:
                store.replaceLoops(updateDurable(store.readLoops(updateLoopNumIterations.keySet()), this::withIterationCounts));
                updateLoopNumIterations.clear();
                break;
            case LOOP_PARENTS:
                store.replaceLoops(updateDurable(store.readLoops(updateLoopParents.keySet()),
                        loop -> loop.withParentsUpdate(updateLoopParents.get(loop.id()))));
                updateLoopParents.clear();
                break;
            default:
                throw new IllegalArgumentException(String.format("Unknown commit step %s", step));
        }
    }

    private void commitTasks() {
        // pending element IDs of new tasks are folded into the appended records
        store.appendTasks(store.getTasks(List.copyOf(addTasks.keySet())));
        addTasks.keySet().forEach(addElementIds::remove);
        addTasks.clear();
    }

    private void commitLoops() {
        store.appendLoops(store.getLoops(List.copyOf(addLoops.keySet())));
        addLoops.keySet().forEach(id -> {
            updateLoopNumIterations.remove(id);
            updateLoopParents.remove(id);
        });
        addLoops.clear();
    }

    private void commitSubmissions() {
        store.appendSubmissions(store.getSubmissions(List.copyOf(addSubmissions.keySet())));
        addSubmissions.keySet().forEach(id -> {
            addSubmissionParts.remove(id);
            setJobscriptMetadata.remove(id);
        });
        addSubmissions.clear();
    }

    private void commitSubmissionParts() {
        store.replaceSubmissions(updateDurable(store.readSubmissions(addSubmissionParts.keySet()),
                submission -> submission.withPartsAdded(addSubmissionParts.get(submission.index()))));
        addSubmissionParts.clear();
    }

    private void commitElementIds() {
        store.replaceTasks(updateDurable(store.readTasks(addElementIds.keySet()), task -> task.appendElementIds(addElementIds.get(task.id()))));
        addElementIds.clear();
    }

    private void commitElements() {
        store.appendElements(store.getElements(List.copyOf(addElements.keySet())));
        addElements.keySet().forEach(addIterationIds::remove);
        addElements.clear();
    }

    private void commitIterationIds() {
        store.replaceElements(updateDurable(store.readElements(addIterationIds.keySet()),
                element -> element.appendIterationIds(addIterationIds.get(element.id()))));
        addIterationIds.clear();
    }

    private void commitIterations() {
        store.appendIterations(store.getElementIterations(List.copyOf(addIterations.keySet())));
        addIterations.keySet().forEach(id -> {
            addRunIds.remove(id);
            setRunsInitialised.remove(id);
            updateLoopIndices.remove(id);
        });
        addIterations.clear();
    }

    private void commitRunIds() {
        store.replaceIterations(updateDurable(store.readIterations(addRunIds.keySet()), iteration -> {
            var updated = iteration;
            for (var entry : addRunIds.get(iteration.id()).entrySet()) {
                updated = updated.appendRunIds(entry.getKey(), entry.getValue());
            }
            return updated;
        }));
        addRunIds.clear();
    }

    private void commitRuns() {
        store.appendRuns(store.getRuns(List.copyOf(addRuns.keySet())));
        addRuns.keySet().forEach(id -> {
            setRunSubmissionIndices.remove(id);
            setRunSkips.remove(id);
            setRunStarts.remove(id);
            setRunEnds.remove(id);
        });
        addRuns.clear();
    }

    private void commitParameters() {
        if (!addParameters.isEmpty()) {
            store.appendParameters(store.getParameters(List.copyOf(addParameters.keySet())));
            addParameters.keySet().forEach(id -> {
                setParameters.remove(id);
                updateParameterSources.remove(id);
            });
            addParameters.clear();
        }
        if (!setParameters.isEmpty()) {
            store.replaceParameters(updateDurable(store.readParameters(setParameters.keySet()),
                    parameter -> setParameters.get(parameter.id()).applyTo(parameter)));
            setParameters.clear();
        }
    }

    private StoreLoop withIterationCounts(StoreLoop loop) {
        var updated = loop;
        for (var entry : updateLoopNumIterations.get(loop.id()).entrySet()) {
            updated = updated.withNumIterations(entry.getKey(), entry.getValue());
        }
        return updated;
    }

    private static <T> List<T> updateDurable(Map<Integer, T> durable, Function<T, T> update) {
        var updated = new ArrayList<T>(durable.size());
        for (T item : durable.values()) {
            updated.add(update.apply(item));
        }
        return updated;
    }

    /**
     * A copy deep enough that clearing or removing from any bucket of this instance leaves the copy intact.
     */
    PendingChanges copy() {
        var copy = new PendingChanges(store);
        copy.transferFrom(this);
        return copy;
    }

    void restore(PendingChanges snapshot) {
        clear();
        transferFrom(snapshot);
    }

    public void clear() {
        addTasks.clear();
        addLoops.clear();
        addSubmissions.clear();
        addSubmissionParts.clear();
        addElementIds.clear();
        addElements.clear();
        addElementSets.clear();
        addIterationIds.clear();
        addIterations.clear();
        addRunIds.clear();
        setRunsInitialised.clear();
        addRuns.clear();
        setRunSubmissionIndices.clear();
        setRunSkips.clear();
        setRunStarts.clear();
        setRunEnds.clear();
        setJobscriptMetadata.clear();
        addParameters.clear();
        setParameters.clear();
        addFiles.clear();
        addTemplateComponents.clear();
        updateParameterSources.clear();
        updateLoopIndices.clear();
        updateLoopNumIterations.clear();
        updateLoopParents.clear();
    }

    private void transferFrom(PendingChanges source) {
        addTasks.putAll(source.addTasks);
        addLoops.putAll(source.addLoops);
        addSubmissions.putAll(source.addSubmissions);
        source.addSubmissionParts.forEach((id, parts) -> addSubmissionParts.put(id, new LinkedHashMap<>(parts)));
        source.addElementIds.forEach((id, ids) -> addElementIds.put(id, new ArrayList<>(ids)));
        addElements.putAll(source.addElements);
        source.addElementSets.forEach((id, sets) -> addElementSets.put(id, new ArrayList<>(sets)));
        source.addIterationIds.forEach((id, ids) -> addIterationIds.put(id, new ArrayList<>(ids)));
        addIterations.putAll(source.addIterations);
        source.addRunIds.forEach((id, byAction) -> {
            var copy = new LinkedHashMap<Integer, List<Integer>>();
            byAction.forEach((action, ids) -> copy.put(action, new ArrayList<>(ids)));
            addRunIds.put(id, copy);
        });
        setRunsInitialised.addAll(source.setRunsInitialised);
        addRuns.putAll(source.addRuns);
        setRunSubmissionIndices.putAll(source.setRunSubmissionIndices);
        setRunSkips.addAll(source.setRunSkips);
        setRunStarts.putAll(source.setRunStarts);
        setRunEnds.putAll(source.setRunEnds);
        source.setJobscriptMetadata.forEach((id, metadata) -> setJobscriptMetadata.put(id, new LinkedHashMap<>(metadata)));
        addParameters.putAll(source.addParameters);
        setParameters.putAll(source.setParameters);
        addFiles.addAll(source.addFiles);
        source.addTemplateComponents.forEach((type, components) -> addTemplateComponents.put(type, new LinkedHashMap<>(components)));
        source.updateParameterSources.forEach((id, update) -> updateParameterSources.put(id, new LinkedHashMap<>(update)));
        source.updateLoopIndices.forEach((id, update) -> updateLoopIndices.put(id, new LinkedHashMap<>(update)));
        source.updateLoopNumIterations.forEach((id, counts) -> updateLoopNumIterations.put(id, new LinkedHashMap<>(counts)));
        source.updateLoopParents.forEach((id, parents) -> updateLoopParents.put(id, new ArrayList<>(parents)));
    }
}
