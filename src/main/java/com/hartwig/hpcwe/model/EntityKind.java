package com.hartwig.hpcwe.model;

public enum EntityKind {
    TASK("task"),
    ELEMENT("element"),
    ITERATION("element iteration"),
    RUN("element action run"),
    PARAMETER("parameter"),
    LOOP("loop"),
    SUBMISSION("submission");

    private final String label;

    EntityKind(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
