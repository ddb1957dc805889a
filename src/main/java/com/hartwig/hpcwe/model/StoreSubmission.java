package com.hartwig.hpcwe.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableStoreSubmission.class)
@JsonSerialize(as = ImmutableStoreSubmission.class)
public interface StoreSubmission {
    int index();

    List<JobscriptDescriptor> jobscripts();

    /**
     * Dispatch timestamp to the indices of the jobscripts handed to a scheduler at that time, in dispatch order.
     */
    Map<String, List<Integer>> submissionParts();

    default StoreSubmission withPartsAdded(Map<String, List<Integer>> parts) {
        var merged = new LinkedHashMap<>(submissionParts());
        merged.putAll(parts);
        return ImmutableStoreSubmission.copyOf(this).withSubmissionParts(merged);
    }

    default StoreSubmission withJobscriptMetadata(Map<Integer, JobscriptMetadata> metadata) {
        var updated = new ArrayList<JobscriptDescriptor>();
        for (JobscriptDescriptor jobscript : jobscripts()) {
            var update = metadata.get(jobscript.index());
            updated.add(update == null
                    ? jobscript
                    : ImmutableJobscriptDescriptor.copyOf(jobscript).withMetadata(jobscript.metadata().merge(update)));
        }
        return ImmutableStoreSubmission.copyOf(this).withJobscripts(updated);
    }

    default List<Integer> submittedJobscripts() {
        var submitted = new ArrayList<Integer>();
        submissionParts().values().forEach(submitted::addAll);
        return submitted;
    }

    static ImmutableStoreSubmission.Builder builder() {
        return ImmutableStoreSubmission.builder();
    }
}
