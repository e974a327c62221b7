package com.reliquary.proof;

import com.reliquary.error.ProofException;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reduces a reachability proof DAG to its simplest explanation.
 *
 * <p>Steps:
 * <ol>
 *   <li><b>Score</b> every node: a leaf has depth 1, a gated node has depth 1
 *       plus the depth of its chosen alternative. An alternative's depth is
 *       its deepest requirement, its weight the sum of requirement depths.</li>
 *   <li><b>Select</b> per node the alternative with the smallest
 *       (depth, weight, average), averages compared by cross multiplication.
 *       Ties keep the earlier alternative.</li>
 *   <li><b>Prune</b> requirements whose ability closure is covered by deeper
 *       siblings, recursively and at the top level.</li>
 *   <li><b>Collapse</b> single-requirement chains into one node.</li>
 * </ol>
 */
@Slf4j
@Singleton
public class SolutionMinimizer {

    /**
     * Minimize a proof.
     *
     * @param proof the proof DAG
     * @return the minimized tree
     * @throws ProofException if the proof is malformed: no top-level solution,
     *                        an empty alternative, a gated node without
     *                        alternatives, a null node or a cycle
     */
    public MinimizedProof minimize(ReachabilityProof proof) {
        if (proof == null || proof.solutions() == null || proof.solutions().isEmpty()) {
            throw new ProofException("Proof has no top-level solutions");
        }

        Scorer scorer = new Scorer();
        Choice best = scorer.select(proof.solutions(), "top level");

        Map<ProofNode, Requirement> materialized = new IdentityHashMap<>();
        List<Requirement> top = new ArrayList<>();
        for (ProofNode node : best.alternative()) {
            top.add(materialize(node, scorer, materialized));
        }
        Requirement root = new Requirement(null, 1 + best.depth(), top);
        pruneSubsets(root, new HashMap<>());

        List<SolutionNode> roots = new ArrayList<>();
        for (Requirement requirement : root.children) {
            roots.add(collapse(requirement));
        }
        log.debug("Minimized proof to depth {} with {} roots", best.depth(), roots.size());
        return new MinimizedProof(best.depth(), Collections.unmodifiableList(roots));
    }

    // ========================================================================
    // Scoring and selection
    // ========================================================================

    private record Choice(List<ProofNode> alternative, int depth, int weight, int count) {

        boolean isBetterThan(Choice other) {
            if (depth != other.depth) {
                return depth < other.depth;
            }
            if (weight != other.weight) {
                return weight < other.weight;
            }
            // weight / count < other.weight / other.count
            return (long) weight * other.count < (long) other.weight * count;
        }
    }

    private record Score(int depth, @Nullable Choice chosen) {
    }

    private static class Scorer {
        private final Map<ProofNode, Score> memo = new IdentityHashMap<>();
        private final Set<ProofNode> visiting = Collections.newSetFromMap(new IdentityHashMap<>());

        Score score(ProofNode node) {
            if (node == null) {
                throw new ProofException("Proof contains a null node");
            }
            Score known = memo.get(node);
            if (known != null) {
                return known;
            }
            if (!visiting.add(node)) {
                throw new ProofException("Proof contains a cycle through " + node.token());
            }

            Score score;
            if (node instanceof ProofNode.Gated gated) {
                if (gated.alternatives() == null || gated.alternatives().isEmpty()) {
                    throw new ProofException("Gated node " + gated.token() + " has no alternatives");
                }
                Choice chosen = select(gated.alternatives(), gated.token());
                score = new Score(1 + chosen.depth(), chosen);
            } else {
                score = new Score(1, null);
            }

            visiting.remove(node);
            memo.put(node, score);
            return score;
        }

        Choice select(List<List<ProofNode>> alternatives, String owner) {
            Choice best = null;
            for (List<ProofNode> alternative : alternatives) {
                if (alternative == null || alternative.isEmpty()) {
                    throw new ProofException("Empty alternative under " + owner);
                }
                int depth = 0;
                int weight = 0;
                for (ProofNode child : alternative) {
                    int childDepth = score(child).depth();
                    depth = Math.max(depth, childDepth);
                    weight += childDepth;
                }
                Choice choice = new Choice(alternative, depth, weight, alternative.size());
                if (best == null || choice.isBetterThan(best)) {
                    best = choice;
                }
            }
            return best;
        }
    }

    // ========================================================================
    // Pruning
    // ========================================================================

    /**
     * Mutable tree of chosen requirements. Shared by identity wherever the
     * proof DAG shares a node.
     */
    private static class Requirement {
        @Nullable
        final String token;
        final int depth;
        @Nullable
        final List<Requirement> children;
        boolean pruned;

        Requirement(@Nullable String token, int depth, @Nullable List<Requirement> children) {
            this.token = token;
            this.depth = depth;
            this.children = children;
        }
    }

    private Requirement materialize(ProofNode node, Scorer scorer, Map<ProofNode, Requirement> materialized) {
        Requirement known = materialized.get(node);
        if (known != null) {
            return known;
        }
        Score score = scorer.score(node);
        Requirement requirement;
        if (score.chosen() == null) {
            requirement = new Requirement(node.token(), score.depth(), null);
        } else {
            List<Requirement> children = new ArrayList<>();
            for (ProofNode child : score.chosen().alternative()) {
                children.add(materialize(child, scorer, materialized));
            }
            requirement = new Requirement(node.token(), score.depth(), children);
        }
        materialized.put(node, requirement);
        return requirement;
    }

    /**
     * Drop every requirement whose closure is covered by the closures of the
     * deeper requirements kept before it.
     */
    private void pruneSubsets(Requirement requirement, Map<String, Set<String>> closures) {
        if (requirement.children == null || requirement.pruned) {
            return;
        }
        requirement.pruned = true;

        List<Requirement> nodes = requirement.children;
        nodes.sort(Comparator.comparingInt((Requirement r) -> r.depth).reversed());
        Set<String> covered = new HashSet<>();
        for (int i = 0; i < nodes.size(); i++) {
            Requirement kept = nodes.get(i);
            pruneSubsets(kept, closures);
            covered.addAll(closure(kept, closures));
            for (int j = i + 1; j < nodes.size(); j++) {
                if (covered.containsAll(closure(nodes.get(j), closures))) {
                    nodes.remove(j--);
                }
            }
        }
    }

    private Set<String> closure(Requirement requirement, Map<String, Set<String>> closures) {
        Set<String> known = closures.get(requirement.token);
        if (known != null) {
            return known;
        }
        Set<String> abilities = new HashSet<>();
        abilities.add(requirement.token);
        if (requirement.children != null) {
            for (Requirement child : requirement.children) {
                abilities.addAll(closure(child, closures));
            }
        }
        closures.put(requirement.token, abilities);
        return abilities;
    }

    // ========================================================================
    // Collapsing
    // ========================================================================

    private SolutionNode collapse(Requirement requirement) {
        List<String> items = new ArrayList<>();
        Requirement current = requirement;
        while (current.children != null && current.children.size() == 1) {
            items.add(current.token);
            current = current.children.get(0);
        }
        items.add(current.token);

        List<SolutionNode> solution = new ArrayList<>();
        if (current.children != null) {
            for (Requirement child : current.children) {
                solution.add(collapse(child));
            }
        }
        return SolutionNode.of(items, solution);
    }
}
