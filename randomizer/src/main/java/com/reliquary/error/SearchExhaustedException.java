package com.reliquary.error;

import lombok.Getter;

/**
 * Thrown when every worker spent its dispatch budget without finding a valid
 * placement. Recoverable: the caller may retry with a new nonce base.
 */
@Getter
public class SearchExhaustedException extends RandomizerException {

    private final String seed;
    private final long attempts;

    public SearchExhaustedException(String seed, long attempts) {
        super("No valid relic placement found for seed '" + seed + "' after " + attempts + " attempts");
        this.seed = seed;
        this.attempts = attempts;
    }
}
