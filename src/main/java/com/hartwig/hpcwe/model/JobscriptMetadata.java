package com.hartwig.hpcwe.model;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

/**
 * What a scheduler backend reported after a jobscript was handed to it.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableJobscriptMetadata.class)
@JsonSerialize(as = ImmutableJobscriptMetadata.class)
public interface JobscriptMetadata {
    Optional<String> schedulerJobId();

    Optional<Long> processId();

    Optional<String> submitTime();

    Optional<String> submitHostname();

    List<String> submitCommand();

    /**
     * Fields present in {@code update} replace ours.
     */
    default JobscriptMetadata merge(JobscriptMetadata update) {
        var builder = builder().from(this);
        update.schedulerJobId().ifPresent(builder::schedulerJobId);
        update.processId().ifPresent(builder::processId);
        update.submitTime().ifPresent(builder::submitTime);
        update.submitHostname().ifPresent(builder::submitHostname);
        if (!update.submitCommand().isEmpty()) {
            builder.submitCommand(update.submitCommand());
        }
        return builder.build();
    }

    static JobscriptMetadata empty() {
        return builder().build();
    }

    static ImmutableJobscriptMetadata.Builder builder() {
        return ImmutableJobscriptMetadata.builder();
    }
}
