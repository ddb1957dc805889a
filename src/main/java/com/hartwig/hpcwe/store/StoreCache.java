package com.hartwig.hpcwe.store;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.hartwig.hpcwe.model.EntityKind;

/**
 * Durable entity records keyed by ID, per kind. Pending changes are applied on top of cached records at read time, so
 * only commits make entries stale.
 */
class StoreCache {
    private final Map<EntityKind, Map<Integer, Object>> entries = new EnumMap<>(EntityKind.class);

    <T> Optional<T> get(EntityKind kind, int id, Class<T> type) {
        var kindEntries = entries.get(kind);
        return kindEntries == null ? Optional.empty() : Optional.ofNullable(kindEntries.get(id)).map(type::cast);
    }

    void putAll(EntityKind kind, Map<Integer, ?> records) {
        entries.computeIfAbsent(kind, k -> new HashMap<>()).putAll(records);
    }

    void invalidate(EntityKind kind) {
        entries.remove(kind);
    }

    void clear() {
        entries.clear();
    }
}
