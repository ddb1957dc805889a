package com.hartwig.hpcwe.model;

import java.util.Optional;

import org.immutables.value.Value;

/**
 * A file whose contents still have to be written into the workflow content area.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface PendingFile {
    boolean storeContents();

    boolean isInput();

    String destinationPath();

    String sourcePath();

    /**
     * Literal contents to write instead of copying from {@link #sourcePath()}.
     */
    Optional<String> contents();

    @Value.Default
    default boolean cleanUp() {
        return false;
    }

    static ImmutablePendingFile.Builder builder() {
        return ImmutablePendingFile.builder();
    }
}
