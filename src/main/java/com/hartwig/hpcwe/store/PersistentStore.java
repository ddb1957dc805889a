package com.hartwig.hpcwe.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hartwig.hpcwe.config.StoreConfig;
import com.hartwig.hpcwe.model.DataIndex;
import com.hartwig.hpcwe.model.EntityKind;
import com.hartwig.hpcwe.model.FileReference;
import com.hartwig.hpcwe.model.ImmutableStoreParameter;
import com.hartwig.hpcwe.model.IterableParameter;
import com.hartwig.hpcwe.model.JobscriptDescriptor;
import com.hartwig.hpcwe.model.JobscriptMetadata;
import com.hartwig.hpcwe.model.ParameterAlreadySetException;
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
 * Coordinates a workflow's durable entities with its pending changes. The store allocates every entity ID, stages
 * mutations in {@link PendingChanges} after checking them against the merged view, and serves reads by merging the
 * durable records with pending ones. Nothing becomes durable until {@link #save()}.
 *
 * <p>Not thread safe: one writer per workflow.</p>
 */
public abstract class PersistentStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(PersistentStore.class);

    public static final String INPUT_FILES_DIR = "artifacts/input_files";
    public static final String OUTPUT_FILES_DIR = "artifacts/output_files";

    protected final Path workflowPath;
    protected final StoreConfig config;
    protected final ObjectMapper objectMapper;
    protected final EntityCodec codec;
    protected final ParameterCodec parameterCodec;

    private final PendingChanges pending;
    private final Map<String, StoreResource> resources = new LinkedHashMap<>();
    private final StoreCache cache = new StoreCache();
    private int cacheScopes;
    private int batchScopes;

    /**
     * A scope to be closed with try-with-resources.
     */
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    protected PersistentStore(final Path workflowPath, final StoreConfig config, final ObjectMapper objectMapper) {
        this.workflowPath = workflowPath;
        this.config = config;
        this.objectMapper = objectMapper;
        this.codec = new EntityCodec(objectMapper, config.timestampFormat());
        this.parameterCodec = new ParameterCodec(objectMapper);
        this.pending = new PendingChanges(this);
    }

    public Path workflowPath() {
        return workflowPath;
    }

    public StoreConfig config() {
        return config;
    }

    public EntityCodec codec() {
        return codec;
    }

    PendingChanges pending() {
        return pending;
    }

    protected abstract CommitResourceMap commitResourceMap();

    // resources

    protected void registerResource(StoreResource resource) {
        resources.put(resource.name(), resource);
    }

    protected StoreResource resource(String name) {
        var resource = resources.get(name);
        if (resource == null) {
            throw new IllegalArgumentException(String.format("Unknown store resource '%s'", name));
        }
        return resource;
    }

    protected void initialiseResources() {
        resources.values().forEach(StoreResource::initialise);
    }

    /**
     * Runs {@code body} with the named resource open. Nested calls share the loaded data; updated data is written when
     * the outermost update scope closes, and dropped if any scope failed.
     */
    public <T> T withResource(String name, ResourceAction action, Supplier<T> body) {
        var resource = resource(name);
        resource.open(action);
        var success = false;
        try {
            var result = body.get();
            success = true;
            return result;
        } finally {
            resource.close(action, success);
        }
    }

    public <T> T withResources(List<String> names, ResourceAction action, Supplier<T> body) {
        if (names.isEmpty()) {
            return body.get();
        }
        return withResource(names.get(0), action, () -> withResources(names.subList(1, names.size()), action, body));
    }

    // lifecycle

    public boolean hasPendingChanges() {
        return !pending.isEmpty();
    }

    /**
     * Commits pending changes, unless there are none or a batch update is open.
     */
    public void save() {
        if (batchScopes > 0) {
            return;
        }
        if (pending.isEmpty()) {
            LOGGER.debug("[{}] No pending changes to save", workflowPath);
            return;
        }
        commitAll();
    }

    public void commitAll() {
        LOGGER.info("[{}] Committing pending changes", workflowPath);
        pending.commitAll();
    }

    /**
     * Runs the body with {@link #save()} deferred until the outermost batch completes, which saves once. If the body
     * throws, the changes it staged are discarded and nothing is saved.
     */
    public <T> T batchUpdate(Supplier<T> body) {
        var snapshot = pending.copy();
        batchScopes++;
        T result;
        try {
            result = body.get();
        } catch (RuntimeException e) {
            batchScopes--;
            LOGGER.warn("[{}] Discarding changes staged by failed batch update", workflowPath);
            pending.restore(snapshot);
            throw e;
        }
        batchScopes--;
        if (batchScopes == 0) {
            save();
        }
        return result;
    }

    /**
     * Caches durable reads until the outermost cached scope closes.
     */
    public Scope cachedLoad() {
        cacheScopes++;
        return () -> {
            cacheScopes--;
            if (cacheScopes == 0 && !config.cacheEnabled()) {
                cache.clear();
            }
        };
    }

    private boolean cacheActive() {
        return config.cacheEnabled() || cacheScopes > 0;
    }

    void invalidateCache(EntityKind kind) {
        cache.invalidate(kind);
    }

    void clearCache() {
        cache.clear();
    }

    // ID allocation

    private int pendingCount(EntityKind kind) {
        switch (kind) {
            case TASK:
                return pending.addTasks.size();
            case ELEMENT:
                return pending.addElements.size();
            case ITERATION:
                return pending.addIterations.size();
            case RUN:
                return pending.addRuns.size();
            case PARAMETER:
                return pending.addParameters.size();
            case LOOP:
                return pending.addLoops.size();
            case SUBMISSION:
                return pending.addSubmissions.size();
            default:
                throw new IllegalArgumentException(String.format("Unknown entity kind %s", kind));
        }
    }

    /**
     * Total number of entities of a kind, durable and pending. This is also the next ID of that kind.
     */
    public int count(EntityKind kind) {
        return persistentCount(kind) + pendingCount(kind);
    }

    // tasks

    public int addTask(int index, JsonNode template) {
        var numTasks = count(EntityKind.TASK);
        if (index < 0 || index > numTasks) {
            throw new IllegalArgumentException(String.format("Task index %s out of range for workflow with %s tasks", index, numTasks));
        }
        var id = numTasks;
        pending.addTasks.put(id, StoreTask.builder().id(id).index(index).template(template).build());
        LOGGER.debug("Added pending task {} at index {}", id, index);
        return id;
    }

    public List<StoreTask> getTasks(List<Integer> ids) {
        return merge(EntityKind.TASK, StoreTask.class, ids, pending.addTasks, this::readTasks, this::patchTask);
    }

    public List<StoreTask> getTasks() {
        return getTasks(allIds(EntityKind.TASK));
    }

    public StoreTask getTask(int id) {
        return getTasks(List.of(id)).get(0);
    }

    public List<StoreElement> getTaskElements(int taskId) {
        return getElements(getTask(taskId).elementIds());
    }

    public void addElementSet(int taskId, JsonNode elementSet) {
        getTask(taskId);
        pending.addElementSets.computeIfAbsent(taskId, id -> new ArrayList<>()).add(elementSet);
    }

    public List<JsonNode> getElementSets(int taskId) {
        var sets = new ArrayList<>(readElementSets().getOrDefault(taskId, List.of()));
        sets.addAll(pending.addElementSets.getOrDefault(taskId, List.of()));
        return sets;
    }

    /**
     * The workflow template: task templates in task order, each with its element sets, and loop templates.
     */
    public ObjectNode getTemplate() {
        var template = objectMapper.createObjectNode();
        var tasks = template.putArray("tasks");
        var durableSets = readElementSets();
        getTasks().stream().sorted((a, b) -> Integer.compare(a.index(), b.index())).forEach(task -> {
            var taskTemplate = task.template().isObject() ? ((ObjectNode) task.template()).deepCopy() : objectMapper.createObjectNode();
            var sets = taskTemplate.putArray("element_sets");
            durableSets.getOrDefault(task.id(), List.of()).forEach(sets::add);
            pending.addElementSets.getOrDefault(task.id(), List.of()).forEach(sets::add);
            tasks.add(taskTemplate);
        });
        var loops = template.putArray("loops");
        getLoops().forEach(loop -> loops.add(loop.template()));
        return template;
    }

    public void addTemplateComponents(Map<String, Map<String, JsonNode>> components) {
        var existing = getTemplateComponents();
        for (var byType : components.entrySet()) {
            var known = existing.getOrDefault(byType.getKey(), Map.of());
            for (var component : byType.getValue().entrySet()) {
                if (!known.containsKey(component.getKey())) {
                    pending.addTemplateComponents.computeIfAbsent(byType.getKey(), type -> new LinkedHashMap<>())
                            .put(component.getKey(), component.getValue());
                }
            }
        }
    }

    /**
     * Component type to component hash to component, e.g. task schemas and environments.
     */
    public Map<String, Map<String, JsonNode>> getTemplateComponents() {
        var merged = new LinkedHashMap<String, Map<String, JsonNode>>();
        readTemplateComponents().forEach((type, components) -> merged.put(type, new LinkedHashMap<>(components)));
        pending.addTemplateComponents.forEach((type, components) -> merged.computeIfAbsent(type, t -> new LinkedHashMap<>())
                .putAll(components));
        return merged;
    }

    // elements, iterations and runs

    public int addElement(int taskId, int elementSetIndex, Map<String, Integer> sequenceIndices, Map<String, Integer> sourceIndices) {
        var task = getTask(taskId);
        var id = count(EntityKind.ELEMENT);
        pending.addElements.put(id,
                StoreElement.builder()
                        .id(id)
                        .taskId(taskId)
                        .index(task.elementIds().size())
                        .elementSetIndex(elementSetIndex)
                        .sequenceIndices(sequenceIndices)
                        .sourceIndices(sourceIndices)
                        .build());
        pending.addElementIds.computeIfAbsent(taskId, t -> new ArrayList<>()).add(id);
        return id;
    }

    public List<StoreElement> getElements(List<Integer> ids) {
        return merge(EntityKind.ELEMENT, StoreElement.class, ids, pending.addElements, this::readElements, this::patchElement);
    }

    public StoreElement getElement(int id) {
        return getElements(List.of(id)).get(0);
    }

    public int addElementIteration(int elementId, DataIndex dataIndex, List<String> schemaParameters, Map<String, Integer> loopIndex) {
        getElement(elementId);
        var id = count(EntityKind.ITERATION);
        pending.addIterations.put(id,
                StoreElementIteration.builder()
                        .id(id)
                        .elementId(elementId)
                        .dataIndex(dataIndex)
                        .schemaParameters(schemaParameters)
                        .loopIndex(loopIndex)
                        .build());
        pending.addIterationIds.computeIfAbsent(elementId, e -> new ArrayList<>()).add(id);
        return id;
    }

    public List<StoreElementIteration> getElementIterations(List<Integer> ids) {
        return merge(EntityKind.ITERATION, StoreElementIteration.class, ids, pending.addIterations, this::readIterations, this::patchIteration);
    }

    public StoreElementIteration getElementIteration(int id) {
        return getElementIterations(List.of(id)).get(0);
    }

    public void setRunsInitialised(int iterationId) {
        getElementIteration(iterationId);
        pending.setRunsInitialised.add(iterationId);
    }

    public void updateLoopIndex(int iterationId, Map<String, Integer> loopIndex) {
        getElementIteration(iterationId);
        pending.updateLoopIndices.computeIfAbsent(iterationId, i -> new LinkedHashMap<>()).putAll(loopIndex);
    }

    public int addRun(int iterationId, int actionIndex, List<Integer> commandsIndex, DataIndex dataIndex, JsonNode metadata) {
        getElementIteration(iterationId);
        var id = count(EntityKind.RUN);
        pending.addRuns.put(id,
                StoreRun.builder()
                        .id(id)
                        .iterationId(iterationId)
                        .actionIndex(actionIndex)
                        .commandsIndex(commandsIndex)
                        .dataIndex(dataIndex)
                        .metadata(metadata)
                        .build());
        pending.addRunIds.computeIfAbsent(iterationId, i -> new LinkedHashMap<>())
                .computeIfAbsent(actionIndex, a -> new ArrayList<>())
                .add(id);
        return id;
    }

    public List<StoreRun> getRuns(List<Integer> ids) {
        return merge(EntityKind.RUN, StoreRun.class, ids, pending.addRuns, this::readRuns, this::patchRun);
    }

    public StoreRun getRun(int id) {
        return getRuns(List.of(id)).get(0);
    }

    public void setRunSubmissionIndices(Map<Integer, Integer> submissionIndexByRun) {
        getRuns(List.copyOf(submissionIndexByRun.keySet()));
        pending.setRunSubmissionIndices.putAll(submissionIndexByRun);
    }

    public void setRunSkip(int runId) {
        getRun(runId);
        pending.setRunSkips.add(runId);
    }

    public void setRunStart(int runId, RunStart start) {
        getRun(runId);
        pending.setRunStarts.put(runId, start);
    }

    public void setRunEnd(int runId, RunEnd end) {
        getRun(runId);
        pending.setRunEnds.put(runId, end);
    }

    // parameters

    public int addUnsetParameter(Map<String, Object> source) {
        return addParameter(StoreParameter.builder().isSet(false).source(source));
    }

    public int addSetParameter(Object data, Map<String, Object> source) {
        return addParameter(StoreParameter.builder().isSet(true).data(Optional.ofNullable(copyData(data))).source(source));
    }

    /**
     * Adds a set parameter whose value is a file, staging the file contents for the content area when
     * {@code storeContents} is true.
     */
    public int addFileParameter(boolean storeContents, boolean isInput, Path path, Optional<String> contents, Optional<String> filename,
            boolean cleanUp, Map<String, Object> source) {
        var reference = prepareFile(storeContents, isInput, path, contents, filename, cleanUp);
        return addParameter(StoreParameter.builder().isSet(true).file(reference).source(source));
    }

    private int addParameter(ImmutableStoreParameter.Builder builder) {
        var id = count(EntityKind.PARAMETER);
        pending.addParameters.put(id, builder.id(id).build());
        return id;
    }

    public void setParameterValue(int parameterId, Object data) {
        checkUnset(parameterId);
        pending.setParameters.put(parameterId, ParameterAssignment.ofData(copyData(data)));
    }

    private Object copyData(Object data) {
        return data == null ? null : parameterCodec.copyData(data);
    }

    public void setFile(int parameterId, boolean storeContents, boolean isInput, Path path, Optional<String> contents,
            Optional<String> filename, boolean cleanUp) {
        checkUnset(parameterId);
        var reference = prepareFile(storeContents, isInput, path, contents, filename, cleanUp);
        pending.setParameters.put(parameterId, ParameterAssignment.ofFile(reference));
    }

    private void checkUnset(int parameterId) {
        if (getParameter(parameterId).isSet()) {
            throw new ParameterAlreadySetException(parameterId);
        }
    }

    public void updateParameterSource(int parameterId, Map<String, Object> source) {
        getParameter(parameterId);
        pending.updateParameterSources.merge(parameterId, Map.copyOf(source), StoreParameter::mergeSources);
    }

    public List<StoreParameter> getParameters(List<Integer> ids) {
        return merge(EntityKind.PARAMETER, StoreParameter.class, ids, pending.addParameters, this::readParameters, this::patchParameter);
    }

    public StoreParameter getParameter(int id) {
        return getParameters(List.of(id)).get(0);
    }

    public List<Boolean> getParameterSetStatuses(List<Integer> ids) {
        return getParameters(ids).stream().map(StoreParameter::isSet).collect(Collectors.toList());
    }

    public List<Map<String, Object>> getParameterSources(List<Integer> ids) {
        return getParameters(ids).stream().map(StoreParameter::source).collect(Collectors.toList());
    }

    public List<Boolean> checkParametersExist(List<Integer> ids) {
        var total = count(EntityKind.PARAMETER);
        return ids.stream().map(id -> id >= 0 && id < total).collect(Collectors.toList());
    }

    private FileReference prepareFile(boolean storeContents, boolean isInput, Path path, Optional<String> contents, Optional<String> filename,
            boolean cleanUp) {
        var name = filename.orElse(path.getFileName().toString());
        Path destination;
        String referencePath;
        if (storeContents) {
            var contentDirectory = workflowPath.resolve(isInput ? INPUT_FILES_DIR : OUTPUT_FILES_DIR);
            var pendingOfKind = pending.addFiles.stream().filter(file -> file.storeContents() && file.isInput() == isInput).count();
            var number = countDirectories(contentDirectory) + pendingOfKind;
            destination = contentDirectory.resolve(String.valueOf(number)).resolve(name);
            referencePath = workflowPath.relativize(destination).toString();
        } else {
            destination = path;
            referencePath = path.toString();
        }
        pending.addFiles.add(PendingFile.builder()
                .storeContents(storeContents)
                .isInput(isInput)
                .destinationPath(destination.toString())
                .sourcePath(path.toString())
                .contents(contents)
                .cleanUp(cleanUp)
                .build());
        return FileReference.builder().storeContents(storeContents).path(referencePath).build();
    }

    private static long countDirectories(Path directory) {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        try (var entries = Files.list(directory)) {
            return entries.filter(Files::isDirectory).count();
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("Could not list content directory '%s'", directory), e);
        }
    }

    /**
     * Writes staged files into the content area. Files that are only referenced are left where they are.
     */
    protected void writeFiles(List<PendingFile> files) {
        for (PendingFile file : files) {
            if (!file.storeContents()) {
                continue;
            }
            var destination = Path.of(file.destinationPath());
            var source = Path.of(file.sourcePath());
            try {
                Files.createDirectories(destination.getParent());
                if (file.contents().isPresent()) {
                    Files.writeString(destination, file.contents().get());
                } else {
                    Files.copy(source, destination, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                throw new UncheckedIOException(String.format("Could not store file '%s' at '%s'", source, destination), e);
            }
            LOGGER.debug("Stored file '{}' at '{}'", source, destination);
        }
    }

    /**
     * Deletes the sources of stored files marked for clean-up, once the commit group that stored them has succeeded.
     */
    void cleanUpFileSources(List<PendingFile> files) {
        for (PendingFile file : files) {
            var source = Path.of(file.sourcePath());
            try {
                Files.deleteIfExists(source);
                LOGGER.debug("Deleted stored file source '{}'", source);
            } catch (IOException e) {
                LOGGER.warn("Could not delete stored file source '{}'", source, e);
            }
        }
    }

    // loops

    public int addLoop(String name, List<Integer> taskInsertIds, JsonNode template, Map<String, IterableParameter> iterableParameters,
            List<String> parents, Map<List<Integer>, Integer> numAddedIterations, List<Integer> iterationIds) {
        var id = count(EntityKind.LOOP);
        pending.addLoops.put(id,
                StoreLoop.builder()
                        .id(id)
                        .name(name)
                        .taskInsertIds(taskInsertIds)
                        .template(template)
                        .iterableParameters(iterableParameters)
                        .parents(parents)
                        .numAddedIterations(numAddedIterations)
                        .build());
        for (Integer iterationId : iterationIds) {
            updateLoopIndex(iterationId, Map.of(name, 0));
        }
        return id;
    }

    public List<StoreLoop> getLoops(List<Integer> ids) {
        return merge(EntityKind.LOOP, StoreLoop.class, ids, pending.addLoops, this::readLoops, this::patchLoop);
    }

    public List<StoreLoop> getLoops() {
        return getLoops(allIds(EntityKind.LOOP));
    }

    public StoreLoop getLoop(int id) {
        return getLoops(List.of(id)).get(0);
    }

    public void updateLoopNumIterations(int loopId, List<Integer> parentKey, int numIterations) {
        var loop = getLoop(loopId);
        if (numIterations < loop.numIterations(parentKey)) {
            throw new IllegalArgumentException(String.format("Loop '%s' iteration count for %s cannot shrink from %s to %s",
                    loop.name(),
                    parentKey,
                    loop.numIterations(parentKey),
                    numIterations));
        }
        pending.updateLoopNumIterations.computeIfAbsent(loopId, l -> new LinkedHashMap<>()).put(List.copyOf(parentKey), numIterations);
    }

    public void updateLoopParents(int loopId, List<String> parents) {
        getLoop(loopId);
        pending.updateLoopParents.put(loopId, List.copyOf(parents));
    }

    // submissions

    public int addSubmission(List<JobscriptDescriptor> jobscripts) {
        var index = count(EntityKind.SUBMISSION);
        pending.addSubmissions.put(index, StoreSubmission.builder().index(index).jobscripts(jobscripts).build());
        return index;
    }

    public void addSubmissionPart(int submissionIndex, Instant dispatchTime, List<Integer> jobscriptIndices) {
        getSubmission(submissionIndex);
        pending.addSubmissionParts.computeIfAbsent(submissionIndex, s -> new LinkedHashMap<>())
                .put(codec.formatTimestamp(dispatchTime), List.copyOf(jobscriptIndices));
    }

    public void setJobscriptMetadata(int submissionIndex, int jobscriptIndex, JobscriptMetadata metadata) {
        var submission = getSubmission(submissionIndex);
        if (jobscriptIndex < 0 || jobscriptIndex >= submission.jobscripts().size()) {
            throw new IllegalArgumentException(String.format("Submission %s has no jobscript %s", submissionIndex, jobscriptIndex));
        }
        pending.setJobscriptMetadata.computeIfAbsent(submissionIndex, s -> new LinkedHashMap<>())
                .merge(jobscriptIndex, metadata, JobscriptMetadata::merge);
    }

    public List<StoreSubmission> getSubmissions(List<Integer> ids) {
        return merge(EntityKind.SUBMISSION, StoreSubmission.class, ids, pending.addSubmissions, this::readSubmissions, this::patchSubmission);
    }

    public List<StoreSubmission> getSubmissions() {
        return getSubmissions(allIds(EntityKind.SUBMISSION));
    }

    public StoreSubmission getSubmission(int index) {
        return getSubmissions(List.of(index)).get(0);
    }

    // merged reads

    private List<Integer> allIds(EntityKind kind) {
        return IntStream.range(0, count(kind)).boxed().collect(Collectors.toList());
    }

    private <T> List<T> merge(EntityKind kind, Class<T> type, List<Integer> ids, Map<Integer, T> pendingItems,
            Function<Collection<Integer>, Map<Integer, T>> reader, UnaryOperator<T> patch) {
        var persistentCount = persistentCount(kind);
        var durableIds = ids.stream().filter(id -> id >= 0 && id < persistentCount).distinct().collect(Collectors.toList());
        var durable = readDurable(kind, type, durableIds, reader);
        var result = new ArrayList<T>(ids.size());
        var missing = new ArrayList<Integer>();
        for (Integer id : ids) {
            var item = id < persistentCount ? durable.get(id) : pendingItems.get(id);
            if (item == null) {
                missing.add(id);
            } else {
                result.add(patch.apply(item));
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingStoreItemException(kind, missing);
        }
        return result;
    }

    private <T> Map<Integer, T> readDurable(EntityKind kind, Class<T> type, List<Integer> ids,
            Function<Collection<Integer>, Map<Integer, T>> reader) {
        if (ids.isEmpty()) {
            return Map.of();
        }
        if (!cacheActive()) {
            return reader.apply(ids);
        }
        var result = new HashMap<Integer, T>();
        var toRead = new ArrayList<Integer>();
        for (Integer id : ids) {
            cache.get(kind, id, type).ifPresentOrElse(item -> result.put(id, item), () -> toRead.add(id));
        }
        if (!toRead.isEmpty()) {
            var read = reader.apply(toRead);
            cache.putAll(kind, read);
            result.putAll(read);
        }
        return result;
    }

    private StoreTask patchTask(StoreTask task) {
        var elementIds = pending.addElementIds.get(task.id());
        return elementIds == null ? task : task.appendElementIds(elementIds);
    }

    private StoreElement patchElement(StoreElement element) {
        var iterationIds = pending.addIterationIds.get(element.id());
        return iterationIds == null ? element : element.appendIterationIds(iterationIds);
    }

    private StoreElementIteration patchIteration(StoreElementIteration iteration) {
        var patched = iteration;
        var runIds = pending.addRunIds.get(iteration.id());
        if (runIds != null) {
            for (var entry : runIds.entrySet()) {
                patched = patched.appendRunIds(entry.getKey(), entry.getValue());
            }
        }
        var loopIndex = pending.updateLoopIndices.get(iteration.id());
        if (loopIndex != null) {
            patched = patched.withLoopIndexUpdate(loopIndex);
        }
        if (pending.setRunsInitialised.contains(iteration.id())) {
            patched = patched.markRunsInitialised();
        }
        return patched;
    }

    private StoreRun patchRun(StoreRun run) {
        var patched = run;
        var submissionIndex = pending.setRunSubmissionIndices.get(run.id());
        if (submissionIndex != null) {
            patched = patched.assignedToSubmission(submissionIndex);
        }
        if (pending.setRunSkips.contains(run.id())) {
            patched = patched.skipped();
        }
        var start = pending.setRunStarts.get(run.id());
        if (start != null) {
            patched = patched.started(start);
        }
        var end = pending.setRunEnds.get(run.id());
        if (end != null) {
            patched = patched.ended(end);
        }
        return patched;
    }

    private StoreParameter patchParameter(StoreParameter parameter) {
        var patched = parameter;
        var assignment = pending.setParameters.get(parameter.id());
        if (assignment != null) {
            patched = assignment.applyTo(patched);
        }
        var sourceUpdate = pending.updateParameterSources.get(parameter.id());
        if (sourceUpdate != null) {
            patched = patched.withSourceUpdate(sourceUpdate);
        }
        // every read gets its own copy of the data containers
        if (patched.data().isPresent()) {
            patched = ImmutableStoreParameter.copyOf(patched).withData(Optional.of(parameterCodec.copyData(patched.data().get())));
        }
        return patched;
    }

    private StoreLoop patchLoop(StoreLoop loop) {
        var patched = loop;
        var counts = pending.updateLoopNumIterations.get(loop.id());
        if (counts != null) {
            for (var entry : counts.entrySet()) {
                patched = patched.withNumIterations(entry.getKey(), entry.getValue());
            }
        }
        var parents = pending.updateLoopParents.get(loop.id());
        if (parents != null) {
            patched = patched.withParentsUpdate(parents);
        }
        return patched;
    }

    private StoreSubmission patchSubmission(StoreSubmission submission) {
        var patched = submission;
        var parts = pending.addSubmissionParts.get(submission.index());
        if (parts != null) {
            patched = patched.withPartsAdded(parts);
        }
        var metadata = pending.setJobscriptMetadata.get(submission.index());
        if (metadata != null) {
            patched = patched.withJobscriptMetadata(metadata);
        }
        return patched;
    }

    // backend

    protected abstract int persistentCount(EntityKind kind);

    protected abstract Map<Integer, StoreTask> readTasks(Collection<Integer> ids);

    protected abstract Map<Integer, StoreElement> readElements(Collection<Integer> ids);

    protected abstract Map<Integer, StoreElementIteration> readIterations(Collection<Integer> ids);

    protected abstract Map<Integer, StoreRun> readRuns(Collection<Integer> ids);

    protected abstract Map<Integer, StoreParameter> readParameters(Collection<Integer> ids);

    protected abstract Map<Integer, StoreLoop> readLoops(Collection<Integer> ids);

    protected abstract Map<Integer, StoreSubmission> readSubmissions(Collection<Integer> ids);

    protected abstract Map<Integer, List<JsonNode>> readElementSets();

    protected abstract Map<String, Map<String, JsonNode>> readTemplateComponents();

    protected abstract void appendTasks(List<StoreTask> tasks);

    protected abstract void replaceTasks(List<StoreTask> tasks);

    protected abstract void appendElements(List<StoreElement> elements);

    protected abstract void replaceElements(List<StoreElement> elements);

    protected abstract void appendIterations(List<StoreElementIteration> iterations);

    protected abstract void replaceIterations(List<StoreElementIteration> iterations);

    protected abstract void appendRuns(List<StoreRun> runs);

    protected abstract void replaceRuns(List<StoreRun> runs);

    protected abstract void appendParameters(List<StoreParameter> parameters);

    protected abstract void replaceParameters(List<StoreParameter> parameters);

    protected abstract void appendLoops(List<StoreLoop> loops);

    protected abstract void replaceLoops(List<StoreLoop> loops);

    protected abstract void appendSubmissions(List<StoreSubmission> submissions);

    protected abstract void replaceSubmissions(List<StoreSubmission> submissions);

    protected abstract void appendElementSets(Map<Integer, List<JsonNode>> elementSets);

    protected abstract void appendTemplateComponents(Map<String, Map<String, JsonNode>> components);
}
