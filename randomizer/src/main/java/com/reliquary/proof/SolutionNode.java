package com.reliquary.proof;

import java.util.List;

/**
 * A node of a minimized proof tree.
 *
 * @param items    a chain of tokens, each requiring the next, in the order
 *                 they are displayed ({@code items[0] < items[1] < ...})
 * @param solution what the last item of the chain requires; empty when it is
 *                 open from the start
 */
public record SolutionNode(List<String> items, List<SolutionNode> solution) {

    public static SolutionNode leaf(String... items) {
        return new SolutionNode(List.of(items), List.of());
    }

    public static SolutionNode of(List<String> items, List<SolutionNode> solution) {
        return new SolutionNode(List.copyOf(items), List.copyOf(solution));
    }

    public boolean isLeaf() {
        return solution.isEmpty();
    }
}
