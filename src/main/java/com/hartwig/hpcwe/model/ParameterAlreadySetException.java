package com.hartwig.hpcwe.model;

public class ParameterAlreadySetException extends IllegalStateException {
    private final int parameterId;

    public ParameterAlreadySetException(final int parameterId) {
        super(String.format("Parameter ID %s is already set!", parameterId));
        this.parameterId = parameterId;
    }

    public int getParameterId() {
        return parameterId;
    }
}
