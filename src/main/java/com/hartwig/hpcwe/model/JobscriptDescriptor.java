package com.hartwig.hpcwe.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

/**
 * A batch of runs sharing one resource signature. Rows of {@link #runIds()} are the jobscript's task actions, columns
 * its elements; -1 marks a cell without a run.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableJobscriptDescriptor.class)
@JsonSerialize(as = ImmutableJobscriptDescriptor.class)
public interface JobscriptDescriptor {
    int index();

    Resources resources();

    List<Integer> taskInsertIds();

    List<Map<String, Integer>> taskLoopIndex();

    List<TaskAction> taskActions();

    /**
     * Jobscript element index to the task element index it covers, one per entry of {@link #taskInsertIds()}.
     */
    Map<Integer, List<Integer>> taskElements();

    List<List<Integer>> runIds();

    /**
     * Index of another jobscript in the same submission to how this one depends on it.
     */
    Map<Integer, JobscriptDependency> dependencies();

    @Value.Default
    default JobscriptMetadata metadata() {
        return JobscriptMetadata.empty();
    }

    default int numElements() {
        return runIds().isEmpty() ? 0 : runIds().get(0).size();
    }

    static ImmutableJobscriptDescriptor.Builder builder() {
        return ImmutableJobscriptDescriptor.builder();
    }
}
