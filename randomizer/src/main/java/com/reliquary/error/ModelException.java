package com.reliquary.error;

import lombok.Getter;

import javax.annotation.Nullable;

/**
 * Thrown when an accessibility model is malformed: unknown token references,
 * duplicate locations, inconsistent placed constraints or a token/location
 * count mismatch. Raised before any search starts and never retried.
 */
@Getter
public class ModelException extends RandomizerException {

    @Nullable
    private final String seed;

    public ModelException(String message) {
        this(message, null, null);
    }

    public ModelException(String message, @Nullable Throwable cause) {
        this(message, null, cause);
    }

    public ModelException(String message, @Nullable String seed, @Nullable Throwable cause) {
        super(message, cause);
        this.seed = seed;
    }

    /**
     * Copy of this exception tagged with the seed of the failed randomization.
     */
    public ModelException withSeed(String seed) {
        ModelException tagged = new ModelException(getMessage(), seed, getCause());
        tagged.setStackTrace(getStackTrace());
        return tagged;
    }
}
