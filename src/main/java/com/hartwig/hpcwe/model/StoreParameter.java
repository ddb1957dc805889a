package com.hartwig.hpcwe.model;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.immutables.value.Value;

/**
 * A unit of parameter data. Starts either unset or set; an unset parameter can be set exactly once, with either an
 * inline value or a file reference.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StoreParameter {
    int id();

    boolean isSet();

    /**
     * The value when set inline. Empty for unset parameters, file parameters and values set to null.
     */
    Optional<Object> data();

    Optional<FileReference> file();

    /**
     * Provenance of the value, e.g. {@code {"type": "EAR_output", "EAR_ID": 3}}.
     */
    Map<String, Object> source();

    default StoreParameter withValue(Object value) {
        if (isSet()) {
            throw new ParameterAlreadySetException(id());
        }
        return ImmutableStoreParameter.copyOf(this).withIsSet(true).withData(Optional.ofNullable(value));
    }

    default StoreParameter withFileValue(FileReference reference) {
        if (isSet()) {
            throw new ParameterAlreadySetException(id());
        }
        return ImmutableStoreParameter.copyOf(this).withIsSet(true).withFile(reference);
    }

    default StoreParameter withSourceUpdate(Map<String, Object> update) {
        return ImmutableStoreParameter.copyOf(this).withSource(mergeSources(source(), update));
    }

    static Map<String, Object> mergeSources(Map<String, Object> source, Map<String, Object> update) {
        var merged = new TreeMap<>(source);
        merged.putAll(update);
        return merged;
    }

    static ImmutableStoreParameter.Builder builder() {
        return ImmutableStoreParameter.builder();
    }
}
