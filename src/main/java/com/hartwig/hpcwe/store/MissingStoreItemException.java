package com.hartwig.hpcwe.store;

import java.util.Collection;
import java.util.List;

import com.hartwig.hpcwe.model.EntityKind;

/**
 * A requested entity ID was never allocated by the store.
 */
public class MissingStoreItemException extends RuntimeException {
    private final EntityKind kind;
    private final List<Integer> ids;

    public MissingStoreItemException(final EntityKind kind, final Collection<Integer> ids) {
        super(String.format("Store %ss with IDs %s do not exist", kind.label(), ids));
        this.kind = kind;
        this.ids = List.copyOf(ids);
    }

    public EntityKind getKind() {
        return kind;
    }

    public List<Integer> getIds() {
        return ids;
    }
}
