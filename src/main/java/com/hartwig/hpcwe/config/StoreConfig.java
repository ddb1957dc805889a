package com.hartwig.hpcwe.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.hartwig.hpcwe.store.StoreFormat;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableStoreConfig.class)
@JsonSerialize(as = ImmutableStoreConfig.class)
public interface StoreConfig {
    String DEFAULT_TIMESTAMP_FORMAT = "yyyy-MM-dd HH:mm:ss.SSSSSS";

    @Value.Default
    default StoreFormat format() {
        return StoreFormat.JSON;
    }

    /**
     * {@link java.time.format.DateTimeFormatter} pattern for persisted timestamps, interpreted in UTC.
     */
    @Value.Default
    default String timestampFormat() {
        return DEFAULT_TIMESTAMP_FORMAT;
    }

    /**
     * Number of records per chunk file in the chunked format.
     */
    @Value.Default
    default int chunkSize() {
        return 500;
    }

    /**
     * Keep durable reads cached between commits, not only inside a cached-load scope.
     */
    @Value.Default
    default boolean cacheEnabled() {
        return false;
    }

    @Value.Default
    default int dispatcherThreads() {
        return 4;
    }

    @Value.Check
    default void check() {
        if (chunkSize() < 1) {
            throw new IllegalArgumentException(String.format("Chunk size must be positive, but was %s", chunkSize()));
        }
        if (dispatcherThreads() < 1) {
            throw new IllegalArgumentException(String.format("Dispatcher threads must be positive, but was %s", dispatcherThreads()));
        }
    }

    static StoreConfig defaults() {
        return builder().build();
    }

    static ImmutableStoreConfig.Builder builder() {
        return ImmutableStoreConfig.builder();
    }
}
