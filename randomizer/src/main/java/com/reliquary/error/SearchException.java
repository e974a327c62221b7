package com.reliquary.error;

import lombok.Getter;

import javax.annotation.Nullable;

/**
 * Thrown when a placement worker detects a contradiction it cannot resolve by
 * retrying, for example a pinned relic whose escape requirement can never hold.
 *
 * <p>Fatal for the current seed. Carries the offending location and lock so the
 * failure can be reproduced.
 */
@Getter
public class SearchException extends RandomizerException {

    @Nullable
    private final String seed;

    @Nullable
    private final String location;

    @Nullable
    private final String lock;

    public SearchException(String message, @Nullable String location, @Nullable String lock) {
        this(message, null, location, lock, null);
    }

    public SearchException(String message,
                           @Nullable String seed,
                           @Nullable String location,
                           @Nullable String lock,
                           @Nullable Throwable cause) {
        super(message, cause);
        this.seed = seed;
        this.location = location;
        this.lock = lock;
    }

    /**
     * Copy of this exception tagged with the seed it was raised under.
     */
    public SearchException withSeed(String seed) {
        SearchException tagged = new SearchException(getMessage(), seed, location, lock, getCause());
        tagged.setStackTrace(getStackTrace());
        return tagged;
    }
}
