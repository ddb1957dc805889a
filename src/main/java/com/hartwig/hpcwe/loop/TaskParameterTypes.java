package com.hartwig.hpcwe.loop;

import java.util.List;

import org.immutables.value.Value;

/**
 * The parameter types a task's schema consumes and produces, as supplied by the template layer.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface TaskParameterTypes {
    int taskInsertId();

    List<String> inputTypes();

    List<String> outputTypes();

    static TaskParameterTypes of(int taskInsertId, List<String> inputTypes, List<String> outputTypes) {
        return ImmutableTaskParameterTypes.builder().taskInsertId(taskInsertId).inputTypes(inputTypes).outputTypes(outputTypes).build();
    }
}
