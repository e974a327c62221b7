package com.reliquary.orchestrator;

import com.reliquary.proof.ReachabilityProof;
import com.reliquary.search.PlacementResult;

import java.util.Map;

/**
 * The winning placement of a search and the nonce that produced it.
 */
public record OrchestrationResult(long nonce, PlacementResult result) {

    public Map<String, String> assignment() {
        return result.assignment();
    }

    public ReachabilityProof proof() {
        return result.proof();
    }

    public int complexity() {
        return result.complexity();
    }
}
