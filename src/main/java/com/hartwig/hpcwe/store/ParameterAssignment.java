package com.hartwig.hpcwe.store;

import java.util.Optional;

import com.hartwig.hpcwe.model.FileReference;
import com.hartwig.hpcwe.model.StoreParameter;

import org.immutables.value.Value;

/**
 * A staged value for a parameter that was created unset.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ParameterAssignment {
    Optional<Object> data();

    Optional<FileReference> file();

    default StoreParameter applyTo(StoreParameter parameter) {
        return file().isPresent() ? parameter.withFileValue(file().get()) : parameter.withValue(data().orElse(null));
    }

    static ParameterAssignment ofData(Object data) {
        return ImmutableParameterAssignment.builder().data(Optional.ofNullable(data)).build();
    }

    static ParameterAssignment ofFile(FileReference file) {
        return ImmutableParameterAssignment.builder().file(file).build();
    }
}
