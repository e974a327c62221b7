package com.reliquary.orchestrator;

import com.reliquary.model.AccessibilityModel;
import com.reliquary.search.SeedContext;

import javax.annotation.Nullable;

/**
 * Messages sent from the orchestrator to a single worker's inbox.
 */
public interface WorkerMessage {

    Cancel CANCEL = new Cancel();

    /**
     * Run up to the configured number of rounds for one nonce.
     *
     * @param nonce     the attempt nonce, seeding the random stream
     * @param bootstrap problem data, present only on a worker's first request
     */
    record AttemptRequest(long nonce, @Nullable Bootstrap bootstrap) implements WorkerMessage {

        public static AttemptRequest first(long nonce, AccessibilityModel model, SeedContext seedContext) {
            return new AttemptRequest(nonce, new Bootstrap(model, seedContext));
        }

        public static AttemptRequest next(long nonce) {
            return new AttemptRequest(nonce, null);
        }
    }

    /**
     * The model and seed a worker keeps for all later requests.
     */
    record Bootstrap(AccessibilityModel model, SeedContext seedContext) {
    }

    /**
     * Stop after the current round. Not acknowledged.
     */
    record Cancel() implements WorkerMessage {
    }
}
