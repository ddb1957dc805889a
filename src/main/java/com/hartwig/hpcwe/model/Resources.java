package com.hartwig.hpcwe.model;

import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

/**
 * Resolved resource requirements of a run. Two runs with equal resources can share a jobscript.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableResources.class)
@JsonSerialize(as = ImmutableResources.class)
public interface Resources {
    Optional<String> scheduler();

    Optional<String> shell();

    @Value.Default
    default int numCores() {
        return 1;
    }

    Optional<Integer> numNodes();

    /**
     * Extra scheduler directives, e.g. {@code {"partition": "short"}}.
     */
    Map<String, String> schedulerArgs();

    static ImmutableResources.Builder builder() {
        return ImmutableResources.builder();
    }
}
