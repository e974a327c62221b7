package com.reliquary.model;

import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.Set;

/**
 * A set of ability tokens that are required together.
 *
 * <p>A location may carry several locks; any one satisfied lock grants access.
 * The empty lock is always satisfied.
 *
 * @param tokens the required tokens, in declaration order
 */
public record Lock(ImmutableSet<String> tokens) {

    public static final Lock EMPTY = new Lock(ImmutableSet.of());

    public Lock {
        tokens = tokens == null ? ImmutableSet.of() : tokens;
    }

    public static Lock of(String... tokens) {
        return new Lock(ImmutableSet.copyOf(tokens));
    }

    public static Lock of(Collection<String> tokens) {
        return new Lock(ImmutableSet.copyOf(tokens));
    }

    public boolean isSatisfiedBy(Set<String> held) {
        return held.containsAll(tokens);
    }

    public boolean contains(String token) {
        return tokens.contains(token);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public int size() {
        return tokens.size();
    }

    @Override
    public String toString() {
        return tokens.isEmpty() ? "(none)" : String.join("+", tokens);
    }
}
