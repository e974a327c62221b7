package com.reliquary.error;

/**
 * Thrown when a reachability proof is structurally invalid (cycles, gated
 * nodes without alternatives, empty requirement sets). Always a programming
 * error, never expected for proofs produced by the placement search.
 */
public class ProofException extends RandomizerException {

    public ProofException(String message) {
        super(message);
    }
}
