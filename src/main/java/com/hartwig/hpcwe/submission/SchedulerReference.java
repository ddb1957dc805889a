package com.hartwig.hpcwe.submission;

import java.util.List;
import java.util.Optional;

import com.hartwig.hpcwe.model.JobscriptMetadata;

import org.immutables.value.Value;

/**
 * How a scheduler backend identifies a dispatched jobscript.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface SchedulerReference {
    String jobId();

    Optional<Long> processId();

    Optional<String> hostname();

    List<String> submitCommand();

    default JobscriptMetadata toMetadata(String submitTime) {
        return JobscriptMetadata.builder()
                .schedulerJobId(jobId())
                .processId(processId())
                .submitHostname(hostname())
                .submitTime(submitTime)
                .submitCommand(submitCommand())
                .build();
    }

    static SchedulerReference of(String jobId) {
        return builder().jobId(jobId).build();
    }

    static ImmutableSchedulerReference.Builder builder() {
        return ImmutableSchedulerReference.builder();
    }
}
