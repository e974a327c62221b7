package com.reliquary.search;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of a forward reachability simulation.
 *
 * @param waves            token to the wave it was collected in; wave 0 holds
 *                         tokens of locations open from the start
 * @param acquisitionOrder collected tokens by wave, then by location order
 * @param unreached        ids of locations never opened
 */
public record Reachability(Map<String, Integer> waves,
                           List<String> acquisitionOrder,
                           Set<String> unreached) {

    public boolean isComplete() {
        return unreached.isEmpty();
    }

    public boolean isCollected(String token) {
        return waves.containsKey(token);
    }

    public int wave(String token) {
        Integer wave = waves.get(token);
        if (wave == null) {
            throw new IllegalArgumentException("Token was never collected: " + token);
        }
        return wave;
    }
}
