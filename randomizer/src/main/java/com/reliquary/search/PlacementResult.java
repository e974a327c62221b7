package com.reliquary.search;

import com.reliquary.proof.ReachabilityProof;

import java.util.List;
import java.util.Map;

/**
 * A verified placement.
 *
 * @param assignment       location id to token, in model location order
 * @param proof            reachability proof of the goal
 * @param complexity       measured dependency depth of the goal
 * @param acquisitionOrder tokens in the order the forward simulation collects them
 */
public record PlacementResult(Map<String, String> assignment,
                              ReachabilityProof proof,
                              int complexity,
                              List<String> acquisitionOrder) {
}
