package com.hartwig.hpcwe.submission;

import java.util.List;
import java.util.Map;

import org.immutables.value.Value;

/**
 * One jobscript found by {@link JobscriptGrouper}: a resource index and, per element column, the action rows it runs.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface JobscriptGroup {
    int resourceIndex();

    /**
     * Element index to action indices, both ascending.
     */
    Map<Integer, List<Integer>> elements();

    static ImmutableJobscriptGroup.Builder builder() {
        return ImmutableJobscriptGroup.builder();
    }
}
