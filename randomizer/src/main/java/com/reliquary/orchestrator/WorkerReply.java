package com.reliquary.orchestrator;

import com.reliquary.search.PlacementResult;

import javax.annotation.Nullable;

/**
 * A worker's answer to one attempt request, posted to the shared reply queue.
 *
 * @param workerId the replying worker
 * @param nonce    the nonce of the request being answered
 * @param done     true when {@code result} holds a valid placement
 * @param result   the placement, when done
 * @param error    the failure that stopped the worker, if any
 */
public record WorkerReply(int workerId,
                          long nonce,
                          boolean done,
                          @Nullable PlacementResult result,
                          @Nullable Throwable error) {

    public static WorkerReply success(int workerId, long nonce, PlacementResult result) {
        return new WorkerReply(workerId, nonce, true, result, null);
    }

    /**
     * No valid placement this time; the worker wants another nonce.
     */
    public static WorkerReply retry(int workerId, long nonce) {
        return new WorkerReply(workerId, nonce, false, null, null);
    }

    public static WorkerReply failure(int workerId, long nonce, Throwable error) {
        return new WorkerReply(workerId, nonce, false, null, error);
    }

    public boolean isError() {
        return error != null;
    }
}
