package com.reliquary.search;

import com.reliquary.model.AccessibilityModel;
import com.reliquary.model.Lock;
import com.reliquary.model.RelicLocation;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks escape requirements: a player who reaches a location and takes its
 * token must be able to leave again.
 *
 * <p>A route into a location is one of its locks that does not need the token
 * found there (the empty route if it has no locks). For every such route, the
 * route's tokens plus the collected token must satisfy at least one escape
 * lock. Locations without escape locks always pass.
 */
public final class EscapeVerifier {

    private EscapeVerifier() {
        // Utility class - prevent instantiation
    }

    /**
     * A route that leaves the player stuck.
     *
     * @param location the location id
     * @param token    the token placed there
     * @param route    the route that cannot escape
     */
    public record Violation(String location, String token, Lock route) {
    }

    /**
     * Check one location holding one token.
     *
     * @return the first failing route, or null if every route escapes
     */
    @Nullable
    public static Violation check(RelicLocation location, String token) {
        if (!location.hasEscapes()) {
            return null;
        }
        for (Lock route : routes(location, token)) {
            Set<String> held = new HashSet<>(route.tokens());
            held.add(token);
            boolean escapes = false;
            for (Lock escape : location.getEscapes()) {
                if (escape.isSatisfiedBy(held)) {
                    escapes = true;
                    break;
                }
            }
            if (!escapes) {
                return new Violation(location.getId(), token, route);
            }
        }
        return null;
    }

    public static boolean allows(RelicLocation location, String token) {
        return check(location, token) == null;
    }

    /**
     * Check a whole assignment.
     *
     * @return the first violation in location order, or null
     */
    @Nullable
    public static Violation verify(AccessibilityModel model, Map<String, String> assignment) {
        for (RelicLocation location : model.getLocations()) {
            String token = assignment.get(location.getId());
            if (token == null) {
                continue;
            }
            Violation violation = check(location, token);
            if (violation != null) {
                return violation;
            }
        }
        return null;
    }

    private static List<Lock> routes(RelicLocation location, String token) {
        List<Lock> routes = new ArrayList<>();
        if (location.getLocks().isEmpty()) {
            routes.add(Lock.EMPTY);
            return routes;
        }
        for (Lock lock : location.getLocks()) {
            if (!lock.contains(token)) {
                routes.add(lock);
            }
        }
        return routes;
    }
}
