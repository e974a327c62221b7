package com.reliquary.proof;

import java.util.List;

/**
 * Top-level explanation of a placement: each solution is a list of proof nodes
 * that together satisfy one goal lock.
 *
 * <p>Without a complexity goal there is a single solution requiring every
 * placed token, in acquisition order.
 */
public record ReachabilityProof(List<List<ProofNode>> solutions) {
}
