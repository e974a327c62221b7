package com.reliquary.proof;

import com.reliquary.error.ProofException;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link SolutionMinimizer}.
 */
public class SolutionMinimizerTest {

    private SolutionMinimizer minimizer;

    @Before
    public void setUp() {
        minimizer = new SolutionMinimizer();
    }

    // ========================================================================
    // Helper Methods
    // ========================================================================

    private static ProofNode leaf(String token) {
        return new ProofNode.Leaf(token);
    }

    @SafeVarargs
    private static ProofNode gated(String token, List<ProofNode>... alternatives) {
        return new ProofNode.Gated(token, List.of(alternatives));
    }

    @SafeVarargs
    private static ReachabilityProof proof(List<ProofNode>... solutions) {
        return new ReachabilityProof(List.of(solutions));
    }

    // ========================================================================
    // Selection
    // ========================================================================

    @Test
    public void testMinimize_ShallowerAlternativeWins() {
        ProofNode a = leaf("a");
        ProofNode b = gated("b", List.of(a));
        ProofNode c = gated("c", List.of(b));
        ProofNode x = gated("x", List.of(c), List.of(a));

        MinimizedProof result = minimizer.minimize(proof(List.of(x)));

        assertEquals(2, result.depth());
        assertEquals(List.of(SolutionNode.leaf("x", "a")), result.roots());
    }

    @Test
    public void testMinimize_TieKeepsFirstAlternative() {
        ProofNode x = gated("x", List.of(leaf("p")), List.of(leaf("q")));

        MinimizedProof result = minimizer.minimize(proof(List.of(x)));

        assertEquals(List.of(SolutionNode.leaf("x", "p")), result.roots());
    }

    @Test
    public void testMinimize_LighterAlternativeWins() {
        ProofNode x = gated("x", List.of(leaf("p"), leaf("q")), List.of(leaf("r")));

        MinimizedProof result = minimizer.minimize(proof(List.of(x)));

        assertEquals(List.of(SolutionNode.leaf("x", "r")), result.roots());
    }

    @Test
    public void testMinimize_LowerAverageWins() {
        ProofNode g1 = gated("g1", List.of(leaf("l1")));
        ProofNode g2 = gated("g2", List.of(leaf("l2")));
        ProofNode g3 = gated("g3", List.of(leaf("l3")));
        // Same depth 2 and weight 4; averages 2 and 4/3
        ProofNode x = gated("x", List.of(g2, g3), List.of(g1, leaf("l4"), leaf("l5")));

        MinimizedProof result = minimizer.minimize(proof(List.of(x)));

        SolutionNode expected = SolutionNode.of(List.of("x"), List.of(
                SolutionNode.leaf("g1", "l1"),
                SolutionNode.leaf("l4"),
                SolutionNode.leaf("l5")));
        assertEquals(List.of(expected), result.roots());
        assertEquals(3, result.depth());
    }

    @Test
    public void testMinimize_CheapestTopLevelSolution() {
        ProofNode a = leaf("a");
        ProofNode b = gated("b", List.of(a));

        MinimizedProof result = minimizer.minimize(proof(List.of(b), List.of(a)));

        assertEquals(1, result.depth());
        assertEquals(List.of(SolutionNode.leaf("a")), result.roots());
    }

    // ========================================================================
    // Pruning and collapsing
    // ========================================================================

    @Test
    public void testMinimize_TopLevelDominatedRequirementPruned() {
        ProofNode a = leaf("a");
        ProofNode b = gated("b", List.of(a));

        MinimizedProof result = minimizer.minimize(proof(List.of(a, b)));

        assertEquals(List.of(SolutionNode.leaf("b", "a")), result.roots());
        assertEquals(2, result.depth());
    }

    @Test
    public void testMinimize_NestedDominatedRequirementPruned() {
        ProofNode a = leaf("a");
        ProofNode b = gated("b", List.of(a));
        ProofNode x = gated("x", List.of(a, b));

        MinimizedProof result = minimizer.minimize(proof(List.of(x)));

        assertEquals(List.of(SolutionNode.leaf("x", "b", "a")), result.roots());
    }

    @Test
    public void testMinimize_IndependentRequirementsKept_DeepestFirst() {
        ProofNode p = leaf("p");
        ProofNode q = leaf("q");
        ProofNode r = gated("r", List.of(leaf("s")));

        MinimizedProof result = minimizer.minimize(proof(List.of(p, q, r)));

        assertEquals(List.of(SolutionNode.leaf("r", "s"), SolutionNode.leaf("p"), SolutionNode.leaf("q")),
                result.roots());
    }

    @Test
    public void testMinimize_SharedNodesPrunedOnce() {
        ProofNode l = leaf("L");
        ProofNode m = gated("M", List.of(l));
        ProofNode b = gated("B", List.of(m));
        ProofNode e = gated("E", List.of(b));
        ProofNode a = gated("A", List.of(l, b, m));

        MinimizedProof result = minimizer.minimize(proof(List.of(l, m, b, e, a)));

        // E and A both cover B, M and L; A keeps only B
        assertEquals(List.of(SolutionNode.leaf("E", "B", "M", "L"), SolutionNode.leaf("A", "B", "M", "L")),
                result.roots());
        assertEquals(4, result.depth());
    }

    // ========================================================================
    // Idempotence
    // ========================================================================

    @Test
    public void testMinimize_Idempotent() {
        ProofNode l = leaf("L");
        ProofNode j = leaf("J");
        ProofNode m = gated("M", List.of(l));
        ProofNode v = gated("V", List.of(l));
        ProofNode b = gated("B", List.of(m), List.of(l, v), List.of(l, j));
        ProofNode y = gated("Y", List.of(l, b), List.of(l, v, j));
        ProofNode r = gated("R", List.of(l, b, y));

        MinimizedProof first = minimizer.minimize(proof(List.of(r), List.of(y, m)));
        MinimizedProof second = minimizer.minimize(first.toProof());

        assertEquals(first, second);
    }

    // ========================================================================
    // Malformed proofs
    // ========================================================================

    @Test(expected = ProofException.class)
    public void testMinimize_NoSolutions_Throws() {
        minimizer.minimize(new ReachabilityProof(List.of()));
    }

    @Test(expected = ProofException.class)
    public void testMinimize_NullProof_Throws() {
        minimizer.minimize(null);
    }

    @Test(expected = ProofException.class)
    public void testMinimize_EmptyAlternative_Throws() {
        minimizer.minimize(proof(List.of(gated("x", List.of()))));
    }

    @Test(expected = ProofException.class)
    public void testMinimize_GatedWithoutAlternatives_Throws() {
        minimizer.minimize(proof(List.of(new ProofNode.Gated("x", List.of()))));
    }

    @Test(expected = ProofException.class)
    public void testMinimize_EmptyTopLevelSolution_Throws() {
        minimizer.minimize(proof(List.of()));
    }

    @Test(expected = ProofException.class)
    public void testMinimize_NullNode_Throws() {
        minimizer.minimize(proof(Arrays.asList(leaf("a"), null)));
    }

    @Test(expected = ProofException.class)
    public void testMinimize_Cycle_Throws() {
        List<List<ProofNode>> alternatives = new ArrayList<>();
        ProofNode x = new ProofNode.Gated("x", alternatives);
        ProofNode y = new ProofNode.Gated("y", List.of(List.of(x)));
        alternatives.add(List.of(y));

        minimizer.minimize(proof(List.of(x)));
    }
}
