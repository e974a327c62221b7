package com.reliquary.model;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Target number of chained ability dependencies needed to reach a win
 * condition.
 *
 * @param min   minimum depth, inclusive
 * @param max   maximum depth, inclusive, or null for no upper bound
 * @param goals win conditions; satisfying any one of them completes the game
 */
public record ComplexityGoal(int min, @Nullable Integer max, ImmutableList<Lock> goals) {

    public ComplexityGoal {
        goals = goals == null ? ImmutableList.of() : goals;
    }

    public static ComplexityGoal of(int min, @Nullable Integer max, List<Lock> goals) {
        return new ComplexityGoal(min, max, ImmutableList.copyOf(goals));
    }

    /**
     * Check whether a measured depth lies inside the target range.
     */
    public boolean accepts(int depth) {
        return depth >= min && (max == null || depth <= max);
    }

    @Override
    public String toString() {
        return (max == null ? String.valueOf(min) : min + "-" + max) + ":" + goals;
    }
}
