package com.hartwig.hpcwe.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import org.immutables.value.Value;

/**
 * One execution attempt of one schema action within an element iteration. Lifecycle updates return a new copy.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StoreRun {
    int id();

    int iterationId();

    int actionIndex();

    List<Integer> commandsIndex();

    DataIndex dataIndex();

    Optional<Integer> submissionIndex();

    @Value.Default
    default boolean skip() {
        return false;
    }

    Optional<Boolean> success();

    Optional<Instant> startTime();

    Optional<Instant> endTime();

    Optional<JsonNode> snapshotStart();

    Optional<JsonNode> snapshotEnd();

    Optional<Integer> exitCode();

    Optional<String> runHostname();

    @Value.Default
    default JsonNode metadata() {
        return JsonNodeFactory.instance.objectNode();
    }

    default StoreRun assignedToSubmission(int submissionIndex) {
        return ImmutableStoreRun.copyOf(this).withSubmissionIndex(submissionIndex);
    }

    default StoreRun skipped() {
        return ImmutableStoreRun.copyOf(this).withSkip(true);
    }

    default StoreRun started(RunStart start) {
        return ImmutableStoreRun.copyOf(this)
                .withStartTime(start.time())
                .withSnapshotStart(start.snapshot())
                .withRunHostname(start.hostname());
    }

    default StoreRun ended(RunEnd end) {
        return ImmutableStoreRun.copyOf(this)
                .withEndTime(end.time())
                .withSnapshotEnd(end.snapshot())
                .withExitCode(end.exitCode())
                .withSuccess(end.success());
    }

    static ImmutableStoreRun.Builder builder() {
        return ImmutableStoreRun.builder();
    }
}
