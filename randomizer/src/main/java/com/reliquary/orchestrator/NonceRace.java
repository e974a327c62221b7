package com.reliquary.orchestrator;

import javax.annotation.Nullable;
import java.util.TreeSet;

/**
 * Tracks in-flight nonces and the best success so far.
 *
 * <p>The smallest successful nonce wins. The race is decided once a success is
 * known and no smaller nonce is still running, so the winner does not depend
 * on the order replies arrive in. Not thread-safe; owned by the orchestrating
 * thread.
 *
 * @param <T> the result type
 */
public class NonceRace<T> {

    private final TreeSet<Long> outstanding = new TreeSet<>();
    private long bestNonce = -1;
    @Nullable
    private T best;

    public void dispatched(long nonce) {
        outstanding.add(nonce);
    }

    /**
     * Record a success.
     *
     * @return true if this result is the new best
     */
    public boolean succeeded(long nonce, T result) {
        if (!outstanding.remove(nonce)) {
            return false;
        }
        if (best == null || nonce < bestNonce) {
            best = result;
            bestNonce = nonce;
            return true;
        }
        return false;
    }

    public void failed(long nonce) {
        outstanding.remove(nonce);
    }

    /**
     * Drop a nonce whose outcome no longer matters. A later reply for it is ignored.
     */
    public void abandon(long nonce) {
        outstanding.remove(nonce);
    }

    public boolean isOutstanding(long nonce) {
        return outstanding.contains(nonce);
    }

    public boolean hasOutstanding() {
        return !outstanding.isEmpty();
    }

    public boolean hasWinner() {
        return best != null;
    }

    /**
     * True if a success exists and nothing below it is still running.
     */
    public boolean isDecided() {
        return best != null && (outstanding.isEmpty() || outstanding.first() > bestNonce);
    }

    /**
     * Whether a still-running nonce can no longer beat the best success.
     */
    public boolean isBeaten(long nonce) {
        return best != null && nonce > bestNonce;
    }

    @Nullable
    public T getBest() {
        return best;
    }

    public long getBestNonce() {
        return bestNonce;
    }
}
