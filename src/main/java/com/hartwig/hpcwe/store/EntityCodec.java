package com.hartwig.hpcwe.store;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hartwig.hpcwe.model.DataIndex;
import com.hartwig.hpcwe.model.IterableParameter;
import com.hartwig.hpcwe.model.StoreElement;
import com.hartwig.hpcwe.model.StoreElementIteration;
import com.hartwig.hpcwe.model.StoreLoop;
import com.hartwig.hpcwe.model.StoreRun;
import com.hartwig.hpcwe.model.StoreTask;

/**
 * Translates entity records to and from their document form. Timestamps are written with the workflow's timestamp
 * pattern in UTC.
 */
public class EntityCodec {
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Integer>> INT_MAP = new TypeReference<>() {
    };
    private static final TypeReference<List<Integer>> INT_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final DateTimeFormatter timestampFormatter;

    public EntityCodec(final ObjectMapper objectMapper, final String timestampFormat) {
        this.objectMapper = objectMapper;
        this.timestampFormatter = DateTimeFormatter.ofPattern(timestampFormat);
    }

    public String formatTimestamp(Instant instant) {
        return timestampFormatter.format(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    public Instant parseTimestamp(String timestamp) {
        return LocalDateTime.parse(timestamp, timestampFormatter).toInstant(ZoneOffset.UTC);
    }

    public ObjectNode encodeTask(StoreTask task) {
        var node = objectMapper.createObjectNode();
        node.put("id_", task.id());
        node.put("index", task.index());
        node.set("element_IDs", objectMapper.valueToTree(task.elementIds()));
        node.set("template", task.template());
        return node;
    }

    public StoreTask decodeTask(JsonNode node) {
        return StoreTask.builder()
                .id(node.get("id_").asInt())
                .index(node.get("index").asInt())
                .elementIds(intList(node.get("element_IDs")))
                .template(node.get("template"))
                .build();
    }

    public ObjectNode encodeElement(StoreElement element) {
        var node = objectMapper.createObjectNode();
        node.put("id_", element.id());
        node.put("task_ID", element.taskId());
        node.put("index", element.index());
        node.put("es_idx", element.elementSetIndex());
        node.set("seq_idx", objectMapper.valueToTree(element.sequenceIndices()));
        node.set("src_idx", objectMapper.valueToTree(element.sourceIndices()));
        node.set("iteration_IDs", objectMapper.valueToTree(element.iterationIds()));
        return node;
    }

    public StoreElement decodeElement(JsonNode node) {
        return StoreElement.builder()
                .id(node.get("id_").asInt())
                .taskId(node.get("task_ID").asInt())
                .index(node.get("index").asInt())
                .elementSetIndex(node.get("es_idx").asInt())
                .sequenceIndices(objectMapper.convertValue(node.get("seq_idx"), INT_MAP))
                .sourceIndices(objectMapper.convertValue(node.get("src_idx"), INT_MAP))
                .iterationIds(intList(node.get("iteration_IDs")))
                .build();
    }

    public ObjectNode encodeIteration(StoreElementIteration iteration) {
        var node = objectMapper.createObjectNode();
        node.put("id_", iteration.id());
        node.put("element_ID", iteration.elementId());
        node.set("data_idx", objectMapper.valueToTree(iteration.dataIndex().toDocument()));
        node.set("schema_parameters", objectMapper.valueToTree(iteration.schemaParameters()));
        node.set("loop_idx", objectMapper.valueToTree(iteration.loopIndex()));
        node.put("EARs_initialised", iteration.runsInitialised());
        var runIds = node.putObject("EAR_IDs");
        for (var entry : iteration.runIds().entrySet()) {
            runIds.set(String.valueOf(entry.getKey()), objectMapper.valueToTree(entry.getValue()));
        }
        return node;
    }

    public StoreElementIteration decodeIteration(JsonNode node) {
        var runIds = new LinkedHashMap<Integer, List<Integer>>();
        node.get("EAR_IDs").fields().forEachRemaining(entry -> runIds.put(Integer.parseInt(entry.getKey()), intList(entry.getValue())));
        return StoreElementIteration.builder()
                .id(node.get("id_").asInt())
                .elementId(node.get("element_ID").asInt())
                .dataIndex(decodeDataIndex(node.get("data_idx")))
                .schemaParameters(objectMapper.convertValue(node.get("schema_parameters"), STRING_LIST))
                .loopIndex(objectMapper.convertValue(node.get("loop_idx"), INT_MAP))
                .runsInitialised(node.get("EARs_initialised").asBoolean())
                .runIds(runIds)
                .build();
    }

    public ObjectNode encodeRun(StoreRun run) {
        var node = objectMapper.createObjectNode();
        node.put("id_", run.id());
        node.put("elem_iter_ID", run.iterationId());
        node.put("action_idx", run.actionIndex());
        node.set("commands_idx", objectMapper.valueToTree(run.commandsIndex()));
        node.set("data_idx", objectMapper.valueToTree(run.dataIndex().toDocument()));
        node.set("submission_idx", objectMapper.valueToTree(run.submissionIndex().orElse(null)));
        node.set("success", objectMapper.valueToTree(run.success().orElse(null)));
        node.put("skip", run.skip());
        node.set("start_time", objectMapper.valueToTree(run.startTime().map(this::formatTimestamp).orElse(null)));
        node.set("end_time", objectMapper.valueToTree(run.endTime().map(this::formatTimestamp).orElse(null)));
        node.set("snapshot_start", run.snapshotStart().orElse(null));
        node.set("snapshot_end", run.snapshotEnd().orElse(null));
        node.set("exit_code", objectMapper.valueToTree(run.exitCode().orElse(null)));
        node.set("metadata", run.metadata());
        node.set("run_hostname", objectMapper.valueToTree(run.runHostname().orElse(null)));
        return node;
    }

    public StoreRun decodeRun(JsonNode node) {
        return StoreRun.builder()
                .id(node.get("id_").asInt())
                .iterationId(node.get("elem_iter_ID").asInt())
                .actionIndex(node.get("action_idx").asInt())
                .commandsIndex(intList(node.get("commands_idx")))
                .dataIndex(decodeDataIndex(node.get("data_idx")))
                .submissionIndex(present(node, "submission_idx").map(JsonNode::asInt))
                .success(present(node, "success").map(JsonNode::asBoolean))
                .skip(node.get("skip").asBoolean())
                .startTime(present(node, "start_time").map(value -> parseTimestamp(value.asText())))
                .endTime(present(node, "end_time").map(value -> parseTimestamp(value.asText())))
                .snapshotStart(present(node, "snapshot_start"))
                .snapshotEnd(present(node, "snapshot_end"))
                .exitCode(present(node, "exit_code").map(JsonNode::asInt))
                .metadata(node.get("metadata"))
                .runHostname(present(node, "run_hostname").map(JsonNode::asText))
                .build();
    }

    public ObjectNode encodeLoop(StoreLoop loop) {
        var node = objectMapper.createObjectNode();
        node.put("id_", loop.id());
        node.put("name", loop.name());
        node.set("task_insert_IDs", objectMapper.valueToTree(loop.taskInsertIds()));
        node.set("template", loop.template());
        var iterable = node.putObject("iterable_parameters");
        for (var entry : loop.iterableParameters().entrySet()) {
            var parameter = iterable.putObject(entry.getKey());
            parameter.put("input_task", entry.getValue().inputTask());
            parameter.set("output_tasks", objectMapper.valueToTree(entry.getValue().outputTasks()));
        }
        node.set("parents", objectMapper.valueToTree(loop.parents()));
        node.set("num_added_iterations", encodeIterationCounts(loop.numAddedIterations()));
        return node;
    }

    public ArrayNode encodeIterationCounts(Map<List<Integer>, Integer> counts) {
        var array = objectMapper.createArrayNode();
        for (var entry : counts.entrySet()) {
            var pair = array.addArray();
            pair.add(objectMapper.valueToTree(entry.getKey()));
            pair.add(entry.getValue());
        }
        return array;
    }

    public StoreLoop decodeLoop(JsonNode node) {
        var iterable = new LinkedHashMap<String, IterableParameter>();
        node.get("iterable_parameters").fields().forEachRemaining(entry -> iterable.put(entry.getKey(),
                IterableParameter.builder()
                        .inputTask(entry.getValue().get("input_task").asInt())
                        .outputTasks(intList(entry.getValue().get("output_tasks")))
                        .build()));
        var counts = new LinkedHashMap<List<Integer>, Integer>();
        for (JsonNode pair : node.get("num_added_iterations")) {
            counts.put(intList(pair.get(0)), pair.get(1).asInt());
        }
        return StoreLoop.builder()
                .id(node.get("id_").asInt())
                .name(node.get("name").asText())
                .taskInsertIds(intList(node.get("task_insert_IDs")))
                .template(node.get("template"))
                .iterableParameters(iterable)
                .parents(objectMapper.convertValue(node.get("parents"), STRING_LIST))
                .numAddedIterations(counts)
                .build();
    }

    public Map<String, Object> decodeSource(JsonNode node) {
        return objectMapper.convertValue(node, OBJECT_MAP);
    }

    public JsonNode encodeSource(Map<String, Object> source) {
        return objectMapper.valueToTree(source);
    }

    private DataIndex decodeDataIndex(JsonNode node) {
        return DataIndex.fromDocument(objectMapper.convertValue(node, OBJECT_MAP));
    }

    private List<Integer> intList(JsonNode node) {
        return new ArrayList<>(objectMapper.convertValue(node, INT_LIST));
    }

    private static Optional<JsonNode> present(JsonNode node, String field) {
        var value = node.get(field);
        return value == null || value.isNull() ? Optional.empty() : Optional.of(value);
    }
}
