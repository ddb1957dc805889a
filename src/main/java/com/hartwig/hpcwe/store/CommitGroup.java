package com.hartwig.hpcwe.store;

import java.util.List;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface CommitGroup {
    /**
     * Resources held open for update while the steps run, in opening order.
     */
    List<String> resources();

    List<CommitStep> steps();

    static ImmutableCommitGroup.Builder builder() {
        return ImmutableCommitGroup.builder();
    }
}
