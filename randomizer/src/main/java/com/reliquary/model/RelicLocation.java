package com.reliquary.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * A place where one ability token can be put.
 *
 * <p>Base locations are identified by the ability normally found there;
 * extension locations by the name of the item they replace.
 */
@Value
@Builder(toBuilder = true)
public class RelicLocation {

    /**
     * Stable identifier, distinct from ability tokens for extension locations.
     */
    String id;

    LocationKind kind;

    /**
     * The token found here in the unmodified game.
     */
    String vanilla;

    /**
     * Access locks (OR across locks, AND within a lock).
     */
    @Singular
    List<Lock> locks;

    /**
     * Escape locks constraining the routes that grant access to this location.
     */
    @Singular
    List<Lock> escapes;

    /**
     * Reachable without holding any ability.
     */
    public boolean isUnconditional() {
        return locks.isEmpty() || locks.stream().anyMatch(Lock::isEmpty);
    }

    /**
     * Check whether the held abilities open this location.
     *
     * @param held tokens already collected
     * @return true if any lock is satisfied
     */
    public boolean isAccessible(Set<String> held) {
        if (locks.isEmpty()) {
            return true;
        }
        for (Lock lock : locks) {
            if (lock.isSatisfiedBy(held)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasEscapes() {
        return !escapes.isEmpty();
    }
}
