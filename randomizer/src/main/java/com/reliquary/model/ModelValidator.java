package com.reliquary.model;

import com.reliquary.error.ModelException;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks on an {@link AccessibilityModel}.
 *
 * <p>Validation is purely structural. Whether an escape lock can actually be
 * met is decided per attempt by the placement search.
 */
@Slf4j
public final class ModelValidator {

    private ModelValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * Validate a model.
     *
     * @param model the model to check
     * @throws ModelException describing the first problem found
     */
    public static void validate(AccessibilityModel model) {
        if (model == null) {
            throw new ModelException("Accessibility model is null");
        }

        Set<String> tokens = new HashSet<>();
        for (Ability ability : model.getAbilities()) {
            if (ability.token() == null || ability.token().isEmpty()) {
                throw new ModelException("Ability with empty token");
            }
            if (!tokens.add(ability.token())) {
                throw new ModelException("Duplicate ability token: " + ability.token());
            }
        }

        Set<String> locationIds = new HashSet<>();
        for (RelicLocation location : model.getLocations()) {
            if (!locationIds.add(location.getId())) {
                throw new ModelException("Duplicate location: " + location.getId());
            }
            checkLocks(location.getId(), "lock", location.getLocks(), tokens);
            checkLocks(location.getId(), "escape lock", location.getEscapes(), tokens);
        }

        if (tokens.size() != locationIds.size()) {
            throw new ModelException("Ability count " + tokens.size()
                    + " does not match location count " + locationIds.size());
        }

        checkPlaced(model, tokens);

        ComplexityGoal goal = model.getGoal();
        if (goal != null) {
            if (goal.min() < 0) {
                throw new ModelException("Complexity minimum must not be negative: " + goal.min());
            }
            if (goal.max() != null && goal.max() < goal.min()) {
                throw new ModelException("Complexity maximum " + goal.max()
                        + " is below minimum " + goal.min());
            }
            if (goal.goals().isEmpty()) {
                throw new ModelException("Complexity goal has no goal locks");
            }
            if (goal.goals().stream().anyMatch(Lock::isEmpty)) {
                throw new ModelException("Complexity goal contains an empty goal lock");
            }
            checkLocks("goal", "goal lock", goal.goals(), tokens);
        }

        log.debug("Validated model: {} abilities, {} locations, {} placed",
                tokens.size(), locationIds.size(), model.getPlaced().size());
    }

    private static void checkLocks(String owner, String what, List<Lock> locks, Set<String> tokens) {
        for (Lock lock : locks) {
            for (String token : lock.tokens()) {
                if (!tokens.contains(token)) {
                    throw new ModelException("Unknown token '" + token + "' in " + what
                            + " " + lock + " of " + owner);
                }
            }
        }
    }

    private static void checkPlaced(AccessibilityModel model, Set<String> tokens) {
        Map<String, String> pinnedBy = new HashMap<>();
        for (Map.Entry<String, String> entry : model.getPlaced().entrySet()) {
            String locationId = entry.getKey();
            String token = entry.getValue();

            RelicLocation location = model.location(locationId)
                    .orElseThrow(() -> new ModelException("Placed relic at unknown location: " + locationId));
            if (!tokens.contains(token)) {
                throw new ModelException("Unknown token '" + token + "' placed at " + locationId);
            }
            String previous = pinnedBy.put(token, locationId);
            if (previous != null) {
                throw new ModelException("Token '" + token + "' placed at both "
                        + previous + " and " + locationId);
            }
            if (!location.getLocks().isEmpty()
                    && location.getLocks().stream().allMatch(lock -> lock.contains(token))) {
                throw new ModelException("Token '" + token + "' placed at " + locationId
                        + " is required by every lock of that location");
            }
        }
    }
}
