package com.reliquary.search;

import com.reliquary.model.AccessibilityModel;
import com.reliquary.util.Randomization;

import java.util.Optional;

/**
 * Strategy for one randomized placement attempt.
 *
 * <p>Implementations must be stateless: every draw comes from the given
 * {@link Randomization}, so the same model and stream always produce the same
 * outcome. A single worker calls {@link #attempt} repeatedly, and different
 * workers call it concurrently on the same shared model.
 */
public interface PlacementSearch {

    /**
     * Try to place every token once.
     *
     * @param model  the validated model
     * @param random the attempt's random stream
     * @return a verified placement, or empty if this attempt hit a dead end
     * @throws com.reliquary.error.SearchException if the model contains a
     *         contradiction no retry can resolve
     */
    Optional<PlacementResult> attempt(AccessibilityModel model, Randomization random);
}
