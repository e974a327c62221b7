package com.reliquary.proof;

import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Renders a minimized proof as indented text.
 *
 * <p>Each node prints its chain of names joined by {@code " < "}. Children are
 * prefixed with {@code "^ "} and indented so the caret sits under the last
 * name of the parent chain. A requiring B, which needs both C and D, renders as:
 * <pre>
 * A &lt; B
 *     ^ C
 *     ^ D
 * </pre>
 */
@Singleton
public class SolutionRenderer {

    private static final String CHAIN = " < ";
    private static final String BRANCH = "^ ";
    private static final String CHAIN_SPACING = "   ";

    /**
     * Render every root of a proof.
     *
     * @param proof the minimized proof
     * @param names display name of a token
     * @return the lines, without trailing newlines
     */
    public List<String> render(MinimizedProof proof, Function<String, String> names) {
        List<String> lines = new ArrayList<>();
        for (SolutionNode root : proof.roots()) {
            renderNode(0, false, root, names, lines);
        }
        return lines;
    }

    public String renderText(MinimizedProof proof, Function<String, String> names) {
        return String.join("\n", render(proof, names));
    }

    private void renderNode(int indent, boolean sub, SolutionNode node,
                            Function<String, String> names, List<String> lines) {
        List<String> labels = new ArrayList<>(node.items().size());
        for (String item : node.items()) {
            labels.add(names.apply(item));
        }
        lines.add(" ".repeat(indent) + (sub ? BRANCH : "") + String.join(CHAIN, labels));

        if (node.isLeaf()) {
            return;
        }
        int childIndent = indent + (sub ? BRANCH.length() : 0);
        // Width of every label but the last, each followed by the spacing
        for (int i = 0; i < labels.size() - 1; i++) {
            childIndent += labels.get(i).length() + CHAIN_SPACING.length();
        }
        for (SolutionNode child : node.solution()) {
            renderNode(childIndent, true, child, names, lines);
        }
    }
}
