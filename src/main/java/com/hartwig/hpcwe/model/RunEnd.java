package com.hartwig.hpcwe.model;

import java.time.Instant;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface RunEnd {
    Instant time();

    Optional<JsonNode> snapshot();

    int exitCode();

    boolean success();

    static ImmutableRunEnd.Builder builder() {
        return ImmutableRunEnd.builder();
    }
}
