package com.hartwig.hpcwe.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.hartwig.hpcwe.config.ConfigReader;
import com.hartwig.hpcwe.config.StoreConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and opens workflow directories. The store format is fixed at creation and recorded in
 * {@value ConfigReader#STORE_CONFIG_FILE} next to the store documents.
 */
public final class WorkflowStores {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkflowStores.class);

    private WorkflowStores() {
    }

    public static ObjectMapper objectMapper() {
        var objectMapper = new ObjectMapper();
        objectMapper.registerModule(new Jdk8Module());
        return objectMapper;
    }

    public static JsonPersistentStore create(Path path, StoreConfig config, String name, JsonNode creationInfo) throws IOException {
        if (Files.isDirectory(path)) {
            try (var entries = Files.list(path)) {
                if (entries.findAny().isPresent()) {
                    throw new IllegalStateException(String.format("Cannot create workflow '%s' in non-empty directory '%s'", name, path));
                }
            }
        }
        Files.createDirectories(path);
        new ConfigReader().write(config, path.resolve(ConfigReader.STORE_CONFIG_FILE));
        var store = instantiate(path, config);
        store.initialise(name, creationInfo);
        LOGGER.info("[{}] Created {} workflow store at '{}'", name, config.format(), path);
        return store;
    }

    public static JsonPersistentStore open(Path path) throws IOException {
        var configFile = path.resolve(ConfigReader.STORE_CONFIG_FILE);
        if (!Files.exists(configFile)) {
            throw new IllegalArgumentException(String.format("'%s' is not a workflow directory, %s is missing",
                    path,
                    ConfigReader.STORE_CONFIG_FILE));
        }
        var config = new ConfigReader().read(configFile);
        var store = instantiate(path, config);
        LOGGER.info("[{}] Opened {} workflow store at '{}'", store.name(), config.format(), path);
        return store;
    }

    private static JsonPersistentStore instantiate(Path path, StoreConfig config) {
        switch (config.format()) {
            case JSON:
                return new JsonPersistentStore(path, config, objectMapper());
            case CHUNKED:
                return new ChunkedPersistentStore(path, config, objectMapper());
            default:
                throw new IllegalArgumentException(String.format("Unknown store format %s", config.format()));
        }
    }
}
