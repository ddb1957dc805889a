package com.hartwig.hpcwe.store;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum StoreFormat {
    /**
     * Every entity kind in plain JSON documents.
     */
    @JsonProperty("json")
    JSON,
    /**
     * Runs and parameter data in CBOR-encoded chunk files, everything else in JSON documents.
     */
    @JsonProperty("chunked")
    CHUNKED
}
