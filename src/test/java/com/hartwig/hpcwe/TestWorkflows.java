package com.hartwig.hpcwe;

import java.io.IOException;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.hartwig.hpcwe.config.StoreConfig;
import com.hartwig.hpcwe.store.JsonPersistentStore;
import com.hartwig.hpcwe.store.WorkflowStores;

public final class TestWorkflows {
    public static final String NAME = "test-workflow";

    private TestWorkflows() {
    }

    public static JsonPersistentStore create(Path directory) throws IOException {
        return create(directory, StoreConfig.defaults());
    }

    public static JsonPersistentStore create(Path directory, StoreConfig config) throws IOException {
        var creationInfo = JsonNodeFactory.instance.objectNode().put("app_version", "1.0.0");
        return WorkflowStores.create(directory.resolve(NAME), config, NAME, creationInfo);
    }

    public static JsonNode taskTemplate(String schema) {
        return JsonNodeFactory.instance.objectNode().put("schema", schema);
    }
}
