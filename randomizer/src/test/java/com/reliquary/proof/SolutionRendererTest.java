package com.reliquary.proof;

import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link SolutionRenderer}.
 */
public class SolutionRendererTest {

    private static final Function<String, String> TOKENS = Function.identity();

    private SolutionRenderer renderer;

    @Before
    public void setUp() {
        renderer = new SolutionRenderer();
    }

    private static MinimizedProof proofOf(SolutionNode... roots) {
        return new MinimizedProof(0, List.of(roots));
    }

    @Test
    public void testRender_ChildAlignsUnderLastName() {
        MinimizedProof proof = proofOf(SolutionNode.of(List.of("A", "B"), List.of(SolutionNode.leaf("C"))));

        assertEquals(List.of("A < B", "    ^ C"), renderer.render(proof, TOKENS));
    }

    @Test
    public void testRender_NestedBranchesAddCaretWidth() {
        SolutionNode bc = SolutionNode.of(List.of("B", "C"), List.of(SolutionNode.leaf("D"), SolutionNode.leaf("E")));
        MinimizedProof proof = proofOf(SolutionNode.of(List.of("A"), List.of(bc)));

        assertEquals(List.of(
                "A",
                "^ B < C",
                "      ^ D",
                "      ^ E"), renderer.render(proof, TOKENS));
    }

    @Test
    public void testRender_UsesDisplayNames() {
        Map<String, String> names = Map.of("B", "Soul of Bat", "M", "Form of Mist", "L", "Jewel of Open");
        MinimizedProof proof = proofOf(SolutionNode.of(List.of("B", "M"), List.of(SolutionNode.leaf("L"))));

        List<String> lines = renderer.render(proof, names::get);

        assertEquals("Soul of Bat < Form of Mist", lines.get(0));
        assertEquals(" ".repeat(14) + "^ Jewel of Open", lines.get(1));
    }

    @Test
    public void testRender_MultipleRootsStartAtColumnZero() {
        MinimizedProof proof = proofOf(SolutionNode.leaf("X", "Y"), SolutionNode.leaf("Z"));

        assertEquals(List.of("X < Y", "Z"), renderer.render(proof, TOKENS));
    }

    @Test
    public void testRenderText_JoinsWithNewlines() {
        MinimizedProof proof = proofOf(SolutionNode.of(List.of("A", "B"), List.of(SolutionNode.leaf("C"))));

        assertEquals("A < B\n    ^ C", renderer.renderText(proof, TOKENS));
    }

    @Test
    public void testRender_Stable() {
        SolutionNode deep = SolutionNode.of(List.of("R"), List.of(
                SolutionNode.of(List.of("Y", "B"), List.of(SolutionNode.leaf("L"), SolutionNode.leaf("J"))),
                SolutionNode.leaf("M", "L")));
        MinimizedProof proof = proofOf(deep);

        assertEquals(renderer.renderText(proof, TOKENS), renderer.renderText(proof, TOKENS));
        assertEquals(List.of(
                "R",
                "^ Y < B",
                "      ^ L",
                "      ^ J",
                "^ M < L"), renderer.render(proof, TOKENS));
    }

    @Test
    public void testRender_EmptyProof_NoLines() {
        assertTrue(renderer.render(new MinimizedProof(0, List.of()), TOKENS).isEmpty());
    }
}
