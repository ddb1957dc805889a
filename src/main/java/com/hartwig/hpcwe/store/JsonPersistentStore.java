package com.hartwig.hpcwe.store;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.ToIntFunction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hartwig.hpcwe.config.StoreConfig;
import com.hartwig.hpcwe.model.EntityKind;
import com.hartwig.hpcwe.model.StoreElement;
import com.hartwig.hpcwe.model.StoreElementIteration;
import com.hartwig.hpcwe.model.StoreLoop;
import com.hartwig.hpcwe.model.StoreParameter;
import com.hartwig.hpcwe.model.StoreRun;
import com.hartwig.hpcwe.model.StoreSubmission;
import com.hartwig.hpcwe.model.StoreTask;

/**
 * Keeps a workflow in three JSON documents: {@code metadata.json} for the template and the task, element, iteration,
 * run and loop records, {@code parameters.json} for parameter data and sources, and {@code submissions.json}.
 */
public class JsonPersistentStore extends PersistentStore {
    public static final String METADATA = "metadata";
    public static final String PARAMETERS = "parameters";
    public static final String SUBMISSIONS = "submissions";

    static final String METADATA_FILE = "metadata.json";
    static final String PARAMETERS_FILE = "parameters.json";
    static final String SUBMISSIONS_FILE = "submissions.json";

    private static final CommitResourceMap COMMIT_RESOURCE_MAP = new CommitResourceMap(resourceTable());

    public JsonPersistentStore(final Path workflowPath, final StoreConfig config, final ObjectMapper objectMapper) {
        super(workflowPath, config, objectMapper);
        registerResource(new JsonDocumentResource(METADATA, workflowPath.resolve(METADATA_FILE), objectMapper, initialMetadata()));
        registerResource(new JsonDocumentResource(SUBMISSIONS,
                workflowPath.resolve(SUBMISSIONS_FILE),
                objectMapper,
                objectMapper.createArrayNode()));
        registerParameterResource();
    }

    static Map<CommitStep, List<String>> resourceTable() {
        var table = new EnumMap<CommitStep, List<String>>(CommitStep.class);
        table.put(CommitStep.TASKS, List.of(METADATA));
        table.put(CommitStep.LOOPS, List.of(METADATA));
        table.put(CommitStep.SUBMISSIONS, List.of(SUBMISSIONS));
        table.put(CommitStep.SUBMISSION_PARTS, List.of(SUBMISSIONS));
        table.put(CommitStep.ELEMENT_IDS, List.of(METADATA));
        table.put(CommitStep.ELEMENTS, List.of(METADATA));
        table.put(CommitStep.ELEMENT_SETS, List.of());
        table.put(CommitStep.ITERATION_IDS, List.of(METADATA));
        table.put(CommitStep.ITERATIONS, List.of(METADATA));
        table.put(CommitStep.RUN_IDS, List.of(METADATA));
        table.put(CommitStep.RUNS_INITIALISED, List.of(METADATA));
        table.put(CommitStep.RUNS, List.of(METADATA));
        table.put(CommitStep.RUN_SUBMISSION_INDICES, List.of(METADATA));
        table.put(CommitStep.RUN_SKIPS, List.of(METADATA));
        table.put(CommitStep.RUN_STARTS, List.of(METADATA));
        table.put(CommitStep.RUN_ENDS, List.of(METADATA));
        table.put(CommitStep.JOBSCRIPT_METADATA, List.of(SUBMISSIONS));
        table.put(CommitStep.PARAMETERS, List.of(PARAMETERS));
        table.put(CommitStep.FILES, List.of());
        table.put(CommitStep.TEMPLATE_COMPONENTS, List.of(METADATA));
        table.put(CommitStep.PARAMETER_SOURCES, List.of(PARAMETERS));
        table.put(CommitStep.LOOP_INDICES, List.of(METADATA));
        table.put(CommitStep.LOOP_NUM_ITERATIONS, List.of(METADATA));
        table.put(CommitStep.LOOP_PARENTS, List.of(METADATA));
        return table;
    }

    @Override
    protected CommitResourceMap commitResourceMap() {
        return COMMIT_RESOURCE_MAP;
    }

    protected void registerParameterResource() {
        var parameters = objectMapper.createObjectNode();
        parameters.putObject("data");
        parameters.putObject("sources");
        registerResource(new JsonDocumentResource(PARAMETERS, workflowPath.resolve(PARAMETERS_FILE), objectMapper, parameters));
    }

    private ObjectNode initialMetadata() {
        var metadata = objectMapper.createObjectNode();
        metadata.put("name", "");
        metadata.put("ts_fmt", config.timestampFormat());
        metadata.putObject("creation_info");
        metadata.putObject("template_components");
        metadata.putObject("element_sets");
        metadata.putArray("tasks");
        metadata.putArray("elements");
        metadata.putArray("iters");
        metadata.putArray("runs");
        metadata.put("num_added_tasks", 0);
        metadata.putArray("loops");
        return metadata;
    }

    /**
     * Writes the empty documents of a new workflow.
     */
    public void initialise(String name, JsonNode creationInfo) {
        initialiseResources();
        withResource(METADATA, ResourceAction.UPDATE, () -> {
            var metadata = (ObjectNode) metadataForUpdate();
            metadata.put("name", name);
            metadata.set("creation_info", creationInfo);
            return null;
        });
    }

    public String name() {
        return withResource(METADATA, ResourceAction.READ, () -> metadata().get("name").asText());
    }

    public JsonNode creationInfo() {
        return withResource(METADATA, ResourceAction.READ, () -> metadata().get("creation_info").deepCopy());
    }

    private JsonNode metadata() {
        return ((JsonDocumentResource) resource(METADATA)).document();
    }

    private JsonNode metadataForUpdate() {
        return ((JsonDocumentResource) resource(METADATA)).documentForUpdate();
    }

    private JsonNode parameterDocument() {
        return ((JsonDocumentResource) resource(PARAMETERS)).document();
    }

    private JsonNode parameterDocumentForUpdate() {
        return ((JsonDocumentResource) resource(PARAMETERS)).documentForUpdate();
    }

    private ArrayNode submissionDocument() {
        return (ArrayNode) ((JsonDocumentResource) resource(SUBMISSIONS)).document();
    }

    private ArrayNode submissionDocumentForUpdate() {
        return (ArrayNode) ((JsonDocumentResource) resource(SUBMISSIONS)).documentForUpdate();
    }

    @Override
    protected int persistentCount(EntityKind kind) {
        switch (kind) {
            case TASK:
                return metadataArraySize("tasks");
            case ELEMENT:
                return metadataArraySize("elements");
            case ITERATION:
                return metadataArraySize("iters");
            case RUN:
                return metadataArraySize("runs");
            case LOOP:
                return metadataArraySize("loops");
            case PARAMETER:
                return withResource(PARAMETERS, ResourceAction.READ, () -> parameterDocument().get("data").size());
            case SUBMISSION:
                return withResource(SUBMISSIONS, ResourceAction.READ, () -> submissionDocument().size());
            default:
                throw new IllegalArgumentException(String.format("Unknown entity kind %s", kind));
        }
    }

    private int metadataArraySize(String field) {
        return withResource(METADATA, ResourceAction.READ, () -> metadata().get(field).size());
    }

    private <T> Map<Integer, T> readMetadataArray(EntityKind kind, String field, Collection<Integer> ids, Function<JsonNode, T> decoder) {
        return withResource(METADATA, ResourceAction.READ, () -> readArray(kind, metadata().get(field), ids, decoder));
    }

    protected static <T> Map<Integer, T> readArray(EntityKind kind, JsonNode array, Collection<Integer> ids, Function<JsonNode, T> decoder) {
        var result = new HashMap<Integer, T>();
        for (Integer id : ids) {
            if (id < 0 || id >= array.size()) {
                throw new MissingStoreItemException(kind, List.of(id));
            }
            result.put(id, decoder.apply(array.get(id)));
        }
        return result;
    }

    private <T> void appendMetadataArray(EntityKind kind, String field, List<T> records, ToIntFunction<T> id, Function<T, JsonNode> encoder) {
        withResource(METADATA, ResourceAction.UPDATE, () -> {
            appendArray(kind, (ArrayNode) metadataForUpdate().get(field), records, id, encoder);
            return null;
        });
    }

    protected static <T> void appendArray(EntityKind kind, ArrayNode array, List<T> records, ToIntFunction<T> id, Function<T, JsonNode> encoder) {
        for (T record : records) {
            if (id.applyAsInt(record) != array.size()) {
                throw new IllegalStateException(String.format("Cannot append %s %s, the next durable ID is %s",
                        kind.label(),
                        id.applyAsInt(record),
                        array.size()));
            }
            array.add(encoder.apply(record));
        }
    }

    private <T> void replaceMetadataArray(EntityKind kind, String field, List<T> records, ToIntFunction<T> id, Function<T, JsonNode> encoder) {
        withResource(METADATA, ResourceAction.UPDATE, () -> {
            var array = (ArrayNode) metadataForUpdate().get(field);
            for (T record : records) {
                var index = id.applyAsInt(record);
                if (index < 0 || index >= array.size()) {
                    throw new MissingStoreItemException(kind, List.of(index));
                }
                array.set(index, encoder.apply(record));
            }
            return null;
        });
    }

    @Override
    protected Map<Integer, StoreTask> readTasks(Collection<Integer> ids) {
        return readMetadataArray(EntityKind.TASK, "tasks", ids, codec::decodeTask);
    }

    @Override
    protected void appendTasks(List<StoreTask> tasks) {
        appendMetadataArray(EntityKind.TASK, "tasks", tasks, StoreTask::id, codec::encodeTask);
        withResource(METADATA, ResourceAction.UPDATE, () -> {
            var metadata = (ObjectNode) metadataForUpdate();
            metadata.put("num_added_tasks", metadata.get("tasks").size());
            return null;
        });
    }

    @Override
    protected void replaceTasks(List<StoreTask> tasks) {
        replaceMetadataArray(EntityKind.TASK, "tasks", tasks, StoreTask::id, codec::encodeTask);
    }

    @Override
    protected Map<Integer, StoreElement> readElements(Collection<Integer> ids) {
        return readMetadataArray(EntityKind.ELEMENT, "elements", ids, codec::decodeElement);
    }

    @Override
    protected void appendElements(List<StoreElement> elements) {
        appendMetadataArray(EntityKind.ELEMENT, "elements", elements, StoreElement::id, codec::encodeElement);
    }

    @Override
    protected void replaceElements(List<StoreElement> elements) {
        replaceMetadataArray(EntityKind.ELEMENT, "elements", elements, StoreElement::id, codec::encodeElement);
    }

    @Override
    protected Map<Integer, StoreElementIteration> readIterations(Collection<Integer> ids) {
        return readMetadataArray(EntityKind.ITERATION, "iters", ids, codec::decodeIteration);
    }

    @Override
    protected void appendIterations(List<StoreElementIteration> iterations) {
        appendMetadataArray(EntityKind.ITERATION, "iters", iterations, StoreElementIteration::id, codec::encodeIteration);
    }

    @Override
    protected void replaceIterations(List<StoreElementIteration> iterations) {
        replaceMetadataArray(EntityKind.ITERATION, "iters", iterations, StoreElementIteration::id, codec::encodeIteration);
    }

    @Override
    protected Map<Integer, StoreRun> readRuns(Collection<Integer> ids) {
        return readMetadataArray(EntityKind.RUN, "runs", ids, codec::decodeRun);
    }

    @Override
    protected void appendRuns(List<StoreRun> runs) {
        appendMetadataArray(EntityKind.RUN, "runs", runs, StoreRun::id, codec::encodeRun);
    }

    @Override
    protected void replaceRuns(List<StoreRun> runs) {
        replaceMetadataArray(EntityKind.RUN, "runs", runs, StoreRun::id, codec::encodeRun);
    }

    @Override
    protected Map<Integer, StoreLoop> readLoops(Collection<Integer> ids) {
        return readMetadataArray(EntityKind.LOOP, "loops", ids, codec::decodeLoop);
    }

    @Override
    protected void appendLoops(List<StoreLoop> loops) {
        appendMetadataArray(EntityKind.LOOP, "loops", loops, StoreLoop::id, codec::encodeLoop);
    }

    @Override
    protected void replaceLoops(List<StoreLoop> loops) {
        replaceMetadataArray(EntityKind.LOOP, "loops", loops, StoreLoop::id, codec::encodeLoop);
    }

    @Override
    protected Map<Integer, StoreParameter> readParameters(Collection<Integer> ids) {
        return withResource(PARAMETERS, ResourceAction.READ, () -> {
            var data = parameterDocument().get("data");
            var sources = parameterDocument().get("sources");
            var result = new HashMap<Integer, StoreParameter>();
            for (Integer id : ids) {
                var key = String.valueOf(id);
                if (!data.has(key)) {
                    throw new MissingStoreItemException(EntityKind.PARAMETER, List.of(id));
                }
                result.put(id, parameterCodec.decode(id, data.get(key), codec.decodeSource(sources.get(key))));
            }
            return result;
        });
    }

    @Override
    protected void appendParameters(List<StoreParameter> parameters) {
        withResource(PARAMETERS, ResourceAction.UPDATE, () -> {
            var data = (ObjectNode) parameterDocumentForUpdate().get("data");
            for (StoreParameter parameter : parameters) {
                if (parameter.id() != data.size()) {
                    throw new IllegalStateException(String.format("Cannot append parameter %s, the next durable ID is %s",
                            parameter.id(),
                            data.size()));
                }
                writeParameter(parameter);
            }
            return null;
        });
    }

    @Override
    protected void replaceParameters(List<StoreParameter> parameters) {
        withResource(PARAMETERS, ResourceAction.UPDATE, () -> {
            var data = parameterDocumentForUpdate().get("data");
            for (StoreParameter parameter : parameters) {
                if (!data.has(String.valueOf(parameter.id()))) {
                    throw new MissingStoreItemException(EntityKind.PARAMETER, List.of(parameter.id()));
                }
                writeParameter(parameter);
            }
            return null;
        });
    }

    private void writeParameter(StoreParameter parameter) {
        var document = parameterDocumentForUpdate();
        var key = String.valueOf(parameter.id());
        ((ObjectNode) document.get("data")).set(key, parameterCodec.encode(parameter));
        ((ObjectNode) document.get("sources")).set(key, codec.encodeSource(parameter.source()));
    }

    @Override
    protected Map<Integer, StoreSubmission> readSubmissions(Collection<Integer> ids) {
        return withResource(SUBMISSIONS, ResourceAction.READ,
                () -> readArray(EntityKind.SUBMISSION, submissionDocument(), ids, node -> objectMapper.convertValue(node, StoreSubmission.class)));
    }

    @Override
    protected void appendSubmissions(List<StoreSubmission> submissions) {
        withResource(SUBMISSIONS, ResourceAction.UPDATE, () -> {
            appendArray(EntityKind.SUBMISSION, submissionDocumentForUpdate(), submissions, StoreSubmission::index, objectMapper::valueToTree);
            return null;
        });
    }

    @Override
    protected void replaceSubmissions(List<StoreSubmission> submissions) {
        withResource(SUBMISSIONS, ResourceAction.UPDATE, () -> {
            var array = submissionDocumentForUpdate();
            for (StoreSubmission submission : submissions) {
                if (submission.index() < 0 || submission.index() >= array.size()) {
                    throw new MissingStoreItemException(EntityKind.SUBMISSION, List.of(submission.index()));
                }
                array.set(submission.index(), objectMapper.<JsonNode>valueToTree(submission));
            }
            return null;
        });
    }

    @Override
    protected Map<Integer, List<JsonNode>> readElementSets() {
        return withResource(METADATA, ResourceAction.READ, () -> {
            var result = new LinkedHashMap<Integer, List<JsonNode>>();
            metadata().get("element_sets").fields().forEachRemaining(entry -> {
                var sets = new ArrayList<JsonNode>();
                entry.getValue().forEach(sets::add);
                result.put(Integer.parseInt(entry.getKey()), sets);
            });
            return result;
        });
    }

    @Override
    protected void appendElementSets(Map<Integer, List<JsonNode>> elementSets) {
        withResource(METADATA, ResourceAction.UPDATE, () -> {
            var document = (ObjectNode) metadataForUpdate().get("element_sets");
            for (var entry : elementSets.entrySet()) {
                var key = String.valueOf(entry.getKey());
                var sets = document.has(key) ? (ArrayNode) document.get(key) : document.putArray(key);
                entry.getValue().forEach(sets::add);
            }
            return null;
        });
    }

    @Override
    protected Map<String, Map<String, JsonNode>> readTemplateComponents() {
        return withResource(METADATA, ResourceAction.READ, () -> {
            var result = new LinkedHashMap<String, Map<String, JsonNode>>();
            metadata().get("template_components").fields().forEachRemaining(byType -> {
                var components = new LinkedHashMap<String, JsonNode>();
                byType.getValue().fields().forEachRemaining(component -> components.put(component.getKey(), component.getValue()));
                result.put(byType.getKey(), components);
            });
            return result;
        });
    }

    @Override
    protected void appendTemplateComponents(Map<String, Map<String, JsonNode>> components) {
        withResource(METADATA, ResourceAction.UPDATE, () -> {
            var document = (ObjectNode) metadataForUpdate().get("template_components");
            for (var byType : components.entrySet()) {
                var typeNode = document.has(byType.getKey()) ? (ObjectNode) document.get(byType.getKey()) : document.putObject(byType.getKey());
                byType.getValue().forEach(typeNode::set);
            }
            return null;
        });
    }
}
