package com.hartwig.hpcwe.store;

public enum ResourceAction {
    READ,
    UPDATE
}
