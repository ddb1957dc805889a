package com.hartwig.hpcwe.store;

import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A named piece of backing storage (a document, a chunked array) loaded into memory while open. Opens nest: the data
 * is loaded by the outermost open, shared by inner ones, and written back when the last update scope closes. A read
 * issued while an update is open sees the in-memory update data.
 */
public abstract class StoreResource {
    private static final Logger LOGGER = LoggerFactory.getLogger(StoreResource.class);

    private final String name;
    private final Map<ResourceAction, Integer> openCounts = new EnumMap<>(ResourceAction.class);
    private boolean updated;
    private boolean aborted;

    protected StoreResource(final String name) {
        this.name = name;
        for (ResourceAction action : ResourceAction.values()) {
            openCounts.put(action, 0);
        }
    }

    public String name() {
        return name;
    }

    public void open(ResourceAction action) {
        if (!isOpen()) {
            LOGGER.debug("[{}] Loading resource for {}", name, action);
            load();
        }
        openCounts.merge(action, 1, Integer::sum);
        if (action == ResourceAction.UPDATE) {
            updated = true;
        }
    }

    /**
     * Closes one scope. When the last scope closes, updated data is dumped unless any scope closed unsuccessfully, in
     * which case the in-memory changes are dropped.
     */
    public void close(ResourceAction action, boolean success) {
        var count = openCounts.get(action);
        if (count == 0) {
            throw new IllegalStateException(String.format("Resource '%s' is not open for %s", name, action));
        }
        openCounts.put(action, count - 1);
        if (!success) {
            aborted = true;
        }
        if (isOpen()) {
            return;
        }
        try {
            if (updated && !aborted) {
                LOGGER.debug("[{}] Dumping resource", name);
                dump();
            } else if (aborted) {
                LOGGER.warn("[{}] Discarding in-memory changes after a failure", name);
            }
        } finally {
            updated = false;
            aborted = false;
            unload();
        }
    }

    public boolean isOpen() {
        return openCounts.values().stream().anyMatch(count -> count > 0);
    }

    public boolean isOpen(ResourceAction action) {
        return openCounts.get(action) > 0;
    }

    protected void checkOpen(ResourceAction action) {
        if (action == ResourceAction.UPDATE ? !isOpen(ResourceAction.UPDATE) : !isOpen()) {
            throw new IllegalStateException(String.format("Resource '%s' must be open for %s", name, action));
        }
    }

    /**
     * Creates the empty backing storage for a new workflow.
     */
    public abstract void initialise();

    protected abstract void load();

    protected abstract void dump();

    protected abstract void unload();
}
