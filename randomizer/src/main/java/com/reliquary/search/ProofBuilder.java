package com.reliquary.search;

import com.reliquary.model.AccessibilityModel;
import com.reliquary.model.ComplexityGoal;
import com.reliquary.model.Lock;
import com.reliquary.model.RelicLocation;
import com.reliquary.proof.ProofNode;
import com.reliquary.proof.ReachabilityProof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the reachability proof DAG of a simulated assignment.
 *
 * <p>A token's alternatives are the locks of its location whose tokens were all
 * collected in earlier waves. Tokens at locations open from the start become
 * leaves. Since nodes are created in acquisition order, every child exists
 * before its parent and the graph is acyclic.
 */
public final class ProofBuilder {

    private ProofBuilder() {
        // Utility class - prevent instantiation
    }

    /**
     * Proof node of every collected token, in acquisition order.
     *
     * @param model       the model
     * @param assignment  location id to token
     * @param reachability simulation result of that assignment
     */
    public static Map<String, ProofNode> nodes(AccessibilityModel model,
                                               Map<String, String> assignment,
                                               Reachability reachability) {
        Map<String, RelicLocation> locationByToken = new HashMap<>();
        for (RelicLocation location : model.getLocations()) {
            String token = assignment.get(location.getId());
            if (token != null) {
                locationByToken.put(token, location);
            }
        }

        Map<String, ProofNode> nodes = new LinkedHashMap<>();
        for (String token : reachability.acquisitionOrder()) {
            RelicLocation location = locationByToken.get(token);
            if (location.isUnconditional()) {
                nodes.put(token, new ProofNode.Leaf(token));
                continue;
            }
            int wave = reachability.wave(token);
            List<List<ProofNode>> alternatives = new ArrayList<>();
            for (Lock lock : location.getLocks()) {
                if (opensBefore(lock, wave, reachability)) {
                    alternatives.add(children(lock.tokens(), nodes));
                }
            }
            nodes.put(token, new ProofNode.Gated(token, Collections.unmodifiableList(alternatives)));
        }
        return Collections.unmodifiableMap(nodes);
    }

    /**
     * The top-level proof: one solution per satisfied goal lock, or a single
     * solution listing every collected token when there is no goal.
     */
    public static ReachabilityProof proof(AccessibilityModel model,
                                          Map<String, ProofNode> nodes,
                                          Reachability reachability) {
        List<List<ProofNode>> solutions = new ArrayList<>();
        ComplexityGoal goal = model.getGoal();
        if (goal == null) {
            solutions.add(children(reachability.acquisitionOrder(), nodes));
        } else {
            for (Lock lock : goal.goals()) {
                if (nodes.keySet().containsAll(lock.tokens())) {
                    solutions.add(children(lock.tokens(), nodes));
                }
            }
        }
        return new ReachabilityProof(Collections.unmodifiableList(solutions));
    }

    private static boolean opensBefore(Lock lock, int wave, Reachability reachability) {
        for (String token : lock.tokens()) {
            if (!reachability.isCollected(token) || reachability.wave(token) >= wave) {
                return false;
            }
        }
        return true;
    }

    private static List<ProofNode> children(Iterable<String> tokens, Map<String, ProofNode> nodes) {
        List<ProofNode> children = new ArrayList<>();
        for (String token : tokens) {
            children.add(nodes.get(token));
        }
        return Collections.unmodifiableList(children);
    }
}
