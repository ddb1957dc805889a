package com.hartwig.hpcwe.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

public class ConfigReader {
    public static final String STORE_CONFIG_FILE = "store.yaml";

    private final ObjectMapper objectMapper;

    public ConfigReader() {
        objectMapper = new ObjectMapper(new YAMLFactory());
        objectMapper.registerModule(new Jdk8Module());
    }

    public StoreConfig read(InputStream config) throws IOException {
        return objectMapper.readValue(config, StoreConfig.class);
    }

    public StoreConfig read(Path config) throws IOException {
        try (var inputStream = Files.newInputStream(config)) {
            return read(inputStream);
        }
    }

    public void write(StoreConfig config, Path destination) throws IOException {
        objectMapper.writeValue(destination.toFile(), config);
    }
}
