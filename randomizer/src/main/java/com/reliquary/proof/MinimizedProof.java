package com.reliquary.proof;

import java.util.ArrayList;
import java.util.List;

/**
 * The single cheapest explanation of a placement, with dominated requirements
 * removed and single-requirement chains collapsed.
 *
 * @param depth dependency depth of the chosen top-level solution
 * @param roots requirements of that solution, deepest first
 */
public record MinimizedProof(int depth, List<SolutionNode> roots) {

    /**
     * Expand back into a proof with exactly one alternative everywhere.
     * Minimizing the result gives this proof again.
     */
    public ReachabilityProof toProof() {
        List<ProofNode> solution = new ArrayList<>();
        for (SolutionNode root : roots) {
            solution.add(expand(root));
        }
        return new ReachabilityProof(List.of(solution));
    }

    private static ProofNode expand(SolutionNode node) {
        List<String> items = node.items();
        String last = items.get(items.size() - 1);
        ProofNode current;
        if (node.isLeaf()) {
            current = new ProofNode.Leaf(last);
        } else {
            List<ProofNode> children = new ArrayList<>();
            for (SolutionNode child : node.solution()) {
                children.add(expand(child));
            }
            current = new ProofNode.Gated(last, List.of(children));
        }
        for (int i = items.size() - 2; i >= 0; i--) {
            current = new ProofNode.Gated(items.get(i), List.of(List.of(current)));
        }
        return current;
    }
}
