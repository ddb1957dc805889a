package com.hartwig.hpcwe.model;

import java.time.Instant;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface RunStart {
    Instant time();

    /**
     * Directory snapshot taken just before the run started.
     */
    Optional<JsonNode> snapshot();

    String hostname();

    static ImmutableRunStart.Builder builder() {
        return ImmutableRunStart.builder();
    }
}
