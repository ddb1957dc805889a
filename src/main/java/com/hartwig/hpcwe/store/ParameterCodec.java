package com.hartwig.hpcwe.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hartwig.hpcwe.model.FileReference;
import com.hartwig.hpcwe.model.StoreParameter;

/**
 * Encodes parameter values. An unset parameter is stored as {@code 0}, a file parameter as {@code {"file": ...}} and a
 * set parameter as {@code {"data": ..., "type_lookup": {"tuples": [...], "sets": [...]}}}, where the type lookup lists
 * the paths of values that were sets or tuples ({@code Object[]}) before being flattened to JSON arrays.
 */
public class ParameterCodec {
    public static final int MAX_DEPTH = 50;

    private static final TypeReference<List<List<Object>>> PATH_LIST = new TypeReference<>() {
    };

    private enum ContainerType {
        TUPLE,
        SET
    }

    private final ObjectMapper objectMapper;

    public ParameterCodec(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode encode(StoreParameter parameter) {
        if (!parameter.isSet()) {
            return IntNode.valueOf(0);
        }
        if (parameter.file().isPresent()) {
            var node = objectMapper.createObjectNode();
            node.set("file", objectMapper.valueToTree(parameter.file().get()));
            return node;
        }
        return encodeData(parameter.data().orElse(null));
    }

    private ObjectNode encodeData(Object data) {
        var node = objectMapper.createObjectNode();
        var tuples = new ArrayList<List<Object>>();
        var sets = new ArrayList<List<Object>>();
        node.set("data", encodeValue(data, new ArrayList<>(), 0, tuples, sets));
        var typeLookup = node.putObject("type_lookup");
        typeLookup.set("tuples", objectMapper.valueToTree(tuples));
        typeLookup.set("sets", objectMapper.valueToTree(sets));
        return node;
    }

    /**
     * Returns an independent copy of parameter data, as it would read back after being stored.
     */
    public Object copyData(Object data) {
        return decodeData(encodeData(data));
    }

    private JsonNode encodeValue(Object value, List<Object> path, int depth, List<List<Object>> tuples, List<List<Object>> sets) {
        if (depth > MAX_DEPTH) {
            throw new IllegalArgumentException(String.format("Parameter data is nested more than %s levels deep", MAX_DEPTH));
        }
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof Map) {
            var node = objectMapper.createObjectNode();
            for (var entry : ((Map<?, ?>) value).entrySet()) {
                var key = String.valueOf(entry.getKey());
                node.set(key, encodeValue(entry.getValue(), childPath(path, key), depth + 1, tuples, sets));
            }
            return node;
        }
        Iterable<?> items = null;
        if (value instanceof Set) {
            sets.add(List.copyOf(path));
            items = (Set<?>) value;
        } else if (value instanceof Object[]) {
            tuples.add(List.copyOf(path));
            items = Arrays.asList((Object[]) value);
        } else if (value instanceof List) {
            items = (List<?>) value;
        }
        if (items != null) {
            var node = objectMapper.createArrayNode();
            var index = 0;
            for (Object item : items) {
                node.add(encodeValue(item, childPath(path, index), depth + 1, tuples, sets));
                index++;
            }
            return node;
        }
        return objectMapper.valueToTree(value);
    }

    private static List<Object> childPath(List<Object> path, Object key) {
        var child = new ArrayList<>(path);
        child.add(key);
        return child;
    }

    public StoreParameter decode(int id, JsonNode node, Map<String, Object> source) {
        var builder = StoreParameter.builder().id(id).source(source);
        if (node.isNumber()) {
            return builder.isSet(false).build();
        }
        if (node.has("file")) {
            return builder.isSet(true).file(objectMapper.convertValue(node.get("file"), FileReference.class)).build();
        }
        return builder.isSet(true).data(Optional.ofNullable(decodeData(node))).build();
    }

    private Object decodeData(JsonNode node) {
        var containerTypes = new HashMap<List<Object>, ContainerType>();
        var typeLookup = node.path("type_lookup");
        if (typeLookup.has("tuples")) {
            objectMapper.convertValue(typeLookup.get("tuples"), PATH_LIST).forEach(path -> containerTypes.put(path, ContainerType.TUPLE));
        }
        if (typeLookup.has("sets")) {
            objectMapper.convertValue(typeLookup.get("sets"), PATH_LIST).forEach(path -> containerTypes.put(path, ContainerType.SET));
        }
        return decodeValue(node.path("data"), new ArrayList<>(), containerTypes);
    }

    private Object decodeValue(JsonNode node, List<Object> path, Map<List<Object>, ContainerType> containerTypes) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            node.fields().forEachRemaining(field -> map.put(field.getKey(),
                    decodeValue(field.getValue(), childPath(path, field.getKey()), containerTypes)));
            return map;
        }
        if (node.isArray()) {
            var items = new ArrayList<Object>();
            for (int i = 0; i < node.size(); i++) {
                items.add(decodeValue(node.get(i), childPath(path, i), containerTypes));
            }
            var type = containerTypes.get(path);
            if (type == ContainerType.SET) {
                return new LinkedHashSet<>(items);
            }
            return type == ContainerType.TUPLE ? items.toArray() : items;
        }
        return objectMapper.convertValue(node, Object.class);
    }
}
