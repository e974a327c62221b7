package com.reliquary.core;

import com.reliquary.proof.MinimizedProof;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one relic randomization, ready for the patch writer and the
 * spoiler log.
 */
@Value
@Builder
public class RandomizationResult {

    String seed;

    /**
     * Nonce of the accepted attempt, or -1 when relic locations were not randomized.
     */
    long nonce;

    /**
     * Location id to token, in model location order.
     */
    Map<String, String> assignment;

    int complexity;

    /**
     * Null when relic locations were not randomized.
     */
    @Nullable
    MinimizedProof proof;

    List<String> proofLines;

    public boolean isRandomized() {
        return proof != null;
    }

    public String proofText() {
        return String.join("\n", proofLines);
    }
}
