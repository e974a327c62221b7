package com.reliquary.search;

import com.reliquary.model.ComplexityGoal;
import com.reliquary.model.Lock;
import com.reliquary.proof.ProofNode;

import javax.annotation.Nullable;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Measures how many chained dependencies a proof needs.
 *
 * <p>A leaf has depth 1. A gated token has depth 1 plus the smallest, over its
 * alternatives, of the deepest child. A goal lock costs its deepest token, and
 * the goal costs its cheapest satisfied lock.
 */
public final class ComplexityMeter {

    private ComplexityMeter() {
        // Utility class - prevent instantiation
    }

    /**
     * Depth of the goal, or of collecting every token when there is no goal.
     *
     * @param goal  the complexity goal, may be null
     * @param nodes proof node of every collected token
     * @return the measured depth, or -1 if no goal lock is satisfied
     */
    public static int measure(@Nullable ComplexityGoal goal, Map<String, ProofNode> nodes) {
        Map<ProofNode, Integer> memo = new IdentityHashMap<>();
        if (goal == null) {
            return deepest(nodes.keySet(), nodes, memo);
        }
        int best = -1;
        for (Lock lock : goal.goals()) {
            if (!nodes.keySet().containsAll(lock.tokens())) {
                continue;
            }
            int depth = deepest(lock.tokens(), nodes, memo);
            if (best < 0 || depth < best) {
                best = depth;
            }
        }
        return best;
    }

    /**
     * Depth of a single node.
     */
    public static int depth(ProofNode node) {
        return depth(node, new IdentityHashMap<>());
    }

    private static int deepest(Iterable<String> tokens, Map<String, ProofNode> nodes, Map<ProofNode, Integer> memo) {
        int max = 0;
        for (String token : tokens) {
            max = Math.max(max, depth(nodes.get(token), memo));
        }
        return max;
    }

    private static int depth(ProofNode node, Map<ProofNode, Integer> memo) {
        Integer known = memo.get(node);
        if (known != null) {
            return known;
        }
        int depth;
        if (node instanceof ProofNode.Gated gated) {
            int cheapest = Integer.MAX_VALUE;
            for (List<ProofNode> alternative : gated.alternatives()) {
                int max = 0;
                for (ProofNode child : alternative) {
                    max = Math.max(max, depth(child, memo));
                }
                cheapest = Math.min(cheapest, max);
            }
            depth = 1 + (cheapest == Integer.MAX_VALUE ? 0 : cheapest);
        } else {
            depth = 1;
        }
        memo.put(node, depth);
        return depth;
    }
}
