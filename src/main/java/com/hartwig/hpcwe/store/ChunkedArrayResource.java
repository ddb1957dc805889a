package com.hartwig.hpcwe.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An append-mostly array of records split over fixed-size CBOR chunk files. Chunks are read on first access and only
 * modified chunks are rewritten on dump.
 */
public class ChunkedArrayResource extends StoreResource {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkedArrayResource.class);
    private static final String INDEX_FILE = "index.json";

    private final Path directory;
    private final int chunkSize;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper cborMapper = new ObjectMapper(new CBORFactory());
    private final Map<Integer, ArrayNode> chunks = new HashMap<>();
    private final TreeSet<Integer> dirtyChunks = new TreeSet<>();
    private int length = -1;

    public ChunkedArrayResource(final String name, final Path directory, final int chunkSize, final ObjectMapper jsonMapper) {
        super(name);
        this.directory = directory;
        this.chunkSize = chunkSize;
        this.jsonMapper = jsonMapper;
    }

    public int size() {
        checkOpen(ResourceAction.READ);
        return length;
    }

    public JsonNode get(int index) {
        checkOpen(ResourceAction.READ);
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException(String.format("Index %s out of range for chunked array '%s' of length %s",
                    index,
                    name(),
                    length));
        }
        return chunk(index / chunkSize).get(index % chunkSize);
    }

    public void set(int index, JsonNode record) {
        checkOpen(ResourceAction.UPDATE);
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException(String.format("Index %s out of range for chunked array '%s' of length %s",
                    index,
                    name(),
                    length));
        }
        var chunkIndex = index / chunkSize;
        chunk(chunkIndex).set(index % chunkSize, record);
        dirtyChunks.add(chunkIndex);
    }

    public void append(JsonNode record) {
        checkOpen(ResourceAction.UPDATE);
        var chunkIndex = length / chunkSize;
        chunk(chunkIndex).add(record);
        dirtyChunks.add(chunkIndex);
        length++;
    }

    private ArrayNode chunk(int chunkIndex) {
        return chunks.computeIfAbsent(chunkIndex, this::readChunk);
    }

    private ArrayNode readChunk(int chunkIndex) {
        var file = chunkFile(chunkIndex);
        if (!Files.exists(file)) {
            return cborMapper.createArrayNode();
        }
        try {
            return (ArrayNode) cborMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("Could not read chunk %s of '%s'", chunkIndex, name()), e);
        }
    }

    private Path chunkFile(int chunkIndex) {
        return directory.resolve(String.format("chunk-%05d.cbor", chunkIndex));
    }

    @Override
    public void initialise() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("Could not create chunked array directory '%s'", directory), e);
        }
        writeIndex(0);
    }

    @Override
    protected void load() {
        try {
            var index = jsonMapper.readTree(directory.resolve(INDEX_FILE).toFile());
            length = index.get("length").asInt();
            var storedChunkSize = index.get("chunk_size").asInt();
            if (storedChunkSize != chunkSize) {
                throw new IllegalStateException(String.format("Chunked array '%s' was written with chunk size %s, not %s",
                        name(),
                        storedChunkSize,
                        chunkSize));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("Could not read index of chunked array '%s'", name()), e);
        }
    }

    @Override
    protected void dump() {
        for (Integer chunkIndex : dirtyChunks) {
            var file = chunkFile(chunkIndex);
            var temporary = file.resolveSibling(file.getFileName() + ".tmp");
            try {
                cborMapper.writeValue(temporary.toFile(), chunks.get(chunkIndex));
                Files.move(temporary, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new UncheckedIOException(String.format("Could not write chunk %s of '%s'", chunkIndex, name()), e);
            }
        }
        LOGGER.debug("[{}] Wrote {} chunk(s), length is now {}", name(), dirtyChunks.size(), length);
        writeIndex(length);
    }

    @Override
    protected void unload() {
        chunks.clear();
        dirtyChunks.clear();
        length = -1;
    }

    private void writeIndex(int newLength) {
        var index = jsonMapper.createObjectNode();
        index.put("length", newLength);
        index.put("chunk_size", chunkSize);
        var file = directory.resolve(INDEX_FILE);
        var temporary = directory.resolve(INDEX_FILE + ".tmp");
        try {
            jsonMapper.writeValue(temporary.toFile(), index);
            Files.move(temporary, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("Could not write index of chunked array '%s'", name()), e);
        }
    }
}
