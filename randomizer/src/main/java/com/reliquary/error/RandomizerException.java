package com.reliquary.error;

/**
 * Base type for every failure surfaced by the randomizer.
 *
 * <p>All randomizer failures are unchecked. Callers that want to present a
 * user-facing message can catch this type and read {@link #getMessage()}.
 */
public class RandomizerException extends RuntimeException {

    public RandomizerException(String message) {
        super(message);
    }

    public RandomizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
