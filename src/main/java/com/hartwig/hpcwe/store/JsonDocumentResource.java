package com.hartwig.hpcwe.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * One JSON document on disk. Writes go to a temporary sibling first and are moved into place.
 */
public class JsonDocumentResource extends StoreResource {
    private final Path path;
    private final ObjectMapper objectMapper;
    private final JsonNode initialDocument;
    private JsonNode document;

    public JsonDocumentResource(final String name, final Path path, final ObjectMapper objectMapper, final JsonNode initialDocument) {
        super(name);
        this.path = path;
        this.objectMapper = objectMapper;
        this.initialDocument = initialDocument;
    }

    public JsonNode document() {
        checkOpen(ResourceAction.READ);
        return document;
    }

    public JsonNode documentForUpdate() {
        checkOpen(ResourceAction.UPDATE);
        return document;
    }

    @Override
    public void initialise() {
        write(initialDocument);
    }

    @Override
    protected void load() {
        try {
            document = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("Could not read store document '%s'", path), e);
        }
    }

    @Override
    protected void dump() {
        write(document);
    }

    @Override
    protected void unload() {
        document = null;
    }

    private void write(JsonNode content) {
        var temporary = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(temporary.toFile(), content);
            Files.move(temporary, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("Could not write store document '%s'", path), e);
        }
    }
}
