package com.hartwig.hpcwe.store;

import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hartwig.hpcwe.config.StoreConfig;
import com.hartwig.hpcwe.model.EntityKind;
import com.hartwig.hpcwe.model.StoreParameter;
import com.hartwig.hpcwe.model.StoreRun;

/**
 * A {@link JsonPersistentStore} that keeps runs and parameters, the two largest collections, in chunked arrays so a
 * commit only rewrites the chunks it touched.
 */
public class ChunkedPersistentStore extends JsonPersistentStore {
    public static final String RUNS = "runs";

    private static final CommitResourceMap COMMIT_RESOURCE_MAP = new CommitResourceMap(chunkedResourceTable());

    public ChunkedPersistentStore(final Path workflowPath, final StoreConfig config, final ObjectMapper objectMapper) {
        super(workflowPath, config, objectMapper);
        registerResource(new ChunkedArrayResource(RUNS, workflowPath.resolve(RUNS), config.chunkSize(), objectMapper));
    }

    static Map<CommitStep, List<String>> chunkedResourceTable() {
        var table = resourceTable();
        for (CommitStep step : List.of(CommitStep.RUNS,
                CommitStep.RUN_SUBMISSION_INDICES,
                CommitStep.RUN_SKIPS,
                CommitStep.RUN_STARTS,
                CommitStep.RUN_ENDS)) {
            table.put(step, List.of(RUNS));
        }
        return table;
    }

    @Override
    protected CommitResourceMap commitResourceMap() {
        return COMMIT_RESOURCE_MAP;
    }

    @Override
    protected void registerParameterResource() {
        registerResource(new ChunkedArrayResource(PARAMETERS, workflowPath.resolve(PARAMETERS), config.chunkSize(), objectMapper));
    }

    private ChunkedArrayResource runArray() {
        return (ChunkedArrayResource) resource(RUNS);
    }

    private ChunkedArrayResource parameterArray() {
        return (ChunkedArrayResource) resource(PARAMETERS);
    }

    @Override
    protected int persistentCount(EntityKind kind) {
        switch (kind) {
            case RUN:
                return withResource(RUNS, ResourceAction.READ, () -> runArray().size());
            case PARAMETER:
                return withResource(PARAMETERS, ResourceAction.READ, () -> parameterArray().size());
            default:
                return super.persistentCount(kind);
        }
    }

    @Override
    protected Map<Integer, StoreRun> readRuns(Collection<Integer> ids) {
        return withResource(RUNS, ResourceAction.READ, () -> {
            var array = runArray();
            var result = new HashMap<Integer, StoreRun>();
            for (Integer id : ids) {
                if (id < 0 || id >= array.size()) {
                    throw new MissingStoreItemException(EntityKind.RUN, List.of(id));
                }
                result.put(id, codec.decodeRun(array.get(id)));
            }
            return result;
        });
    }

    @Override
    protected void appendRuns(List<StoreRun> runs) {
        withResource(RUNS, ResourceAction.UPDATE, () -> {
            var array = runArray();
            for (StoreRun run : runs) {
                checkNextId(EntityKind.RUN, run.id(), array.size());
                array.append(codec.encodeRun(run));
            }
            return null;
        });
    }

    @Override
    protected void replaceRuns(List<StoreRun> runs) {
        withResource(RUNS, ResourceAction.UPDATE, () -> {
            var array = runArray();
            for (StoreRun run : runs) {
                checkExists(EntityKind.RUN, run.id(), array.size());
                array.set(run.id(), codec.encodeRun(run));
            }
            return null;
        });
    }

    @Override
    protected Map<Integer, StoreParameter> readParameters(Collection<Integer> ids) {
        return withResource(PARAMETERS, ResourceAction.READ, () -> {
            var array = parameterArray();
            var result = new HashMap<Integer, StoreParameter>();
            for (Integer id : ids) {
                if (id < 0 || id >= array.size()) {
                    throw new MissingStoreItemException(EntityKind.PARAMETER, List.of(id));
                }
                var record = array.get(id);
                result.put(id, parameterCodec.decode(id, record.get("data"), codec.decodeSource(record.get("source"))));
            }
            return result;
        });
    }

    @Override
    protected void appendParameters(List<StoreParameter> parameters) {
        withResource(PARAMETERS, ResourceAction.UPDATE, () -> {
            var array = parameterArray();
            for (StoreParameter parameter : parameters) {
                checkNextId(EntityKind.PARAMETER, parameter.id(), array.size());
                array.append(encodeParameterRecord(parameter));
            }
            return null;
        });
    }

    @Override
    protected void replaceParameters(List<StoreParameter> parameters) {
        withResource(PARAMETERS, ResourceAction.UPDATE, () -> {
            var array = parameterArray();
            for (StoreParameter parameter : parameters) {
                checkExists(EntityKind.PARAMETER, parameter.id(), array.size());
                array.set(parameter.id(), encodeParameterRecord(parameter));
            }
            return null;
        });
    }

    private ObjectNode encodeParameterRecord(StoreParameter parameter) {
        var record = objectMapper.createObjectNode();
        record.set("data", parameterCodec.encode(parameter));
        record.set("source", codec.encodeSource(parameter.source()));
        return record;
    }

    private static void checkNextId(EntityKind kind, int id, int size) {
        if (id != size) {
            throw new IllegalStateException(String.format("Cannot append %s %s, the next durable ID is %s", kind.label(), id, size));
        }
    }

    private static void checkExists(EntityKind kind, int id, int size) {
        if (id < 0 || id >= size) {
            throw new MissingStoreItemException(kind, List.of(id));
        }
    }
}
