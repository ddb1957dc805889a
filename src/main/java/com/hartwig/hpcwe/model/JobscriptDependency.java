package com.hartwig.hpcwe.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableJobscriptDependency.class)
@JsonSerialize(as = ImmutableJobscriptDependency.class)
public interface JobscriptDependency {
    /**
     * Element index in the dependent jobscript to the element indices it depends on in the dependency jobscript.
     */
    Map<Integer, List<Integer>> elementMapping();

    /**
     * True when every element depends on exactly one element of the dependency and all elements of both are covered,
     * so the dependency can be expressed element-wise on an array job.
     */
    boolean isArray();

    static ImmutableJobscriptDependency.Builder builder() {
        return ImmutableJobscriptDependency.builder();
    }
}
