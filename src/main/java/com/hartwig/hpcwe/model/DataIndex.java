package com.hartwig.hpcwe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps parameter paths (e.g. {@code inputs.p1}) to the IDs of the parameters holding their data. A path is either
 * single, pointing at one parameter, or grouped, pointing at an ordered list of parameters. Once a path points at a
 * parameter it is never repointed: new data gets a new parameter ID and a new data index.
 */
public final class DataIndex {
    private static final DataIndex EMPTY = new DataIndex(Map.of(), Set.of());

    private final Map<String, List<Integer>> parameterIds;
    private final Set<String> groupedPaths;

    private DataIndex(final Map<String, List<Integer>> parameterIds, final Set<String> groupedPaths) {
        this.parameterIds = parameterIds;
        this.groupedPaths = groupedPaths;
    }

    public static DataIndex empty() {
        return EMPTY;
    }

    public static DataIndex of(Map<String, Integer> singlePaths) {
        var result = EMPTY;
        for (var entry : singlePaths.entrySet()) {
            result = result.with(entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Builds an index from its document form, where a single path maps to an integer and a grouped path to a list of
     * integers.
     */
    public static DataIndex fromDocument(Map<String, ?> document) {
        var ids = new LinkedHashMap<String, List<Integer>>();
        var grouped = new LinkedHashSet<String>();
        for (var entry : document.entrySet()) {
            var value = entry.getValue();
            if (value instanceof Number) {
                ids.put(entry.getKey(), List.of(((Number) value).intValue()));
            } else if (value instanceof List) {
                var list = new ArrayList<Integer>();
                for (Object item : (List<?>) value) {
                    list.add(((Number) item).intValue());
                }
                ids.put(entry.getKey(), List.copyOf(list));
                grouped.add(entry.getKey());
            } else {
                throw new IllegalArgumentException(String.format("Data index path '%s' has unsupported value '%s'",
                        entry.getKey(),
                        value));
            }
        }
        return new DataIndex(Collections.unmodifiableMap(ids), Collections.unmodifiableSet(grouped));
    }

    public DataIndex with(String path, int parameterId) {
        return put(path, List.of(parameterId), false);
    }

    public DataIndex withGrouped(String path, List<Integer> ids) {
        return put(path, List.copyOf(ids), true);
    }

    /**
     * Adds every path of {@code other}; paths present in both must agree.
     */
    public DataIndex withAll(DataIndex other) {
        var result = this;
        for (var entry : other.parameterIds.entrySet()) {
            result = result.put(entry.getKey(), entry.getValue(), other.groupedPaths.contains(entry.getKey()));
        }
        return result;
    }

    private DataIndex put(String path, List<Integer> ids, boolean grouped) {
        var existing = parameterIds.get(path);
        if (existing != null) {
            if (existing.equals(ids) && groupedPaths.contains(path) == grouped) {
                return this;
            }
            throw new IllegalStateException(String.format("Data index path '%s' already points to parameter(s) %s, cannot repoint to %s",
                    path,
                    existing,
                    ids));
        }
        var updatedIds = new LinkedHashMap<>(parameterIds);
        updatedIds.put(path, ids);
        var updatedGrouped = new LinkedHashSet<>(groupedPaths);
        if (grouped) {
            updatedGrouped.add(path);
        }
        return new DataIndex(Collections.unmodifiableMap(updatedIds), Collections.unmodifiableSet(updatedGrouped));
    }

    public Set<String> paths() {
        return parameterIds.keySet();
    }

    public boolean isGrouped(String path) {
        return groupedPaths.contains(path);
    }

    public Optional<List<Integer>> get(String path) {
        return Optional.ofNullable(parameterIds.get(path));
    }

    public List<Integer> allParameterIds() {
        var all = new ArrayList<Integer>();
        parameterIds.values().forEach(all::addAll);
        return all;
    }

    public boolean isEmpty() {
        return parameterIds.isEmpty();
    }

    public Map<String, Object> toDocument() {
        var document = new LinkedHashMap<String, Object>();
        for (var entry : parameterIds.entrySet()) {
            document.put(entry.getKey(), groupedPaths.contains(entry.getKey()) ? entry.getValue() : entry.getValue().get(0));
        }
        return document;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DataIndex)) {
            return false;
        }
        var other = (DataIndex) o;
        return parameterIds.equals(other.parameterIds) && groupedPaths.equals(other.groupedPaths);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameterIds, groupedPaths);
    }

    @Override
    public String toString() {
        return "DataIndex" + toDocument();
    }
}
