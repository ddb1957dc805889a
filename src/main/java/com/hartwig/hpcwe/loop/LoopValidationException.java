package com.hartwig.hpcwe.loop;

/**
 * A loop definition or iteration request that would break the loop structure. Raised before anything is staged.
 */
public class LoopValidationException extends RuntimeException {
    public LoopValidationException(final String message) {
        super(message);
    }
}
