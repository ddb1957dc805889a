package com.hartwig.hpcwe.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableFileReference.class)
@JsonSerialize(as = ImmutableFileReference.class)
public interface FileReference {
    /**
     * Whether the file contents are copied into the workflow content area.
     */
    boolean storeContents();

    /**
     * Path relative to the workflow directory when the contents are stored, otherwise the original path.
     */
    String path();

    static ImmutableFileReference.Builder builder() {
        return ImmutableFileReference.builder();
    }
}
