package com.reliquary.proof;

import java.util.List;

/**
 * A node of the reachability proof DAG: why a token could be collected.
 *
 * <p>Nodes are shared, so the same {@link Leaf} or {@link Gated} instance may
 * appear under several parents.
 */
public interface ProofNode {

    /**
     * The token this node proves.
     */
    String token();

    /**
     * A token found at a location that is open from the start.
     */
    record Leaf(String token) implements ProofNode {
    }

    /**
     * A token behind a lock. Each alternative lists the tokens of one lock
     * that was already satisfied when the token was collected; any single
     * alternative is a complete explanation.
     */
    record Gated(String token, List<List<ProofNode>> alternatives) implements ProofNode {
    }
}
