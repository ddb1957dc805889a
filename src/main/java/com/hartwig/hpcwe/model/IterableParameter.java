package com.hartwig.hpcwe.model;

import java.util.List;

import org.immutables.value.Value;

/**
 * An input of a looped task whose value is fed back from the output of a task later in the same loop.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface IterableParameter {
    int inputTask();

    List<Integer> outputTasks();

    static ImmutableIterableParameter.Builder builder() {
        return ImmutableIterableParameter.builder();
    }
}
