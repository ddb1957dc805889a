package com.hartwig.hpcwe.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableTaskAction.class)
@JsonSerialize(as = ImmutableTaskAction.class)
public interface TaskAction {
    int taskInsertId();

    int actionIndex();

    /**
     * Index into the jobscript's task loop indices.
     */
    int loopIndexPosition();

    static TaskAction of(int taskInsertId, int actionIndex, int loopIndexPosition) {
        return ImmutableTaskAction.builder()
                .taskInsertId(taskInsertId)
                .actionIndex(actionIndex)
                .loopIndexPosition(loopIndexPosition)
                .build();
    }
}
