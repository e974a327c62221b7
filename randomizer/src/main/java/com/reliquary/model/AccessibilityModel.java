package com.reliquary.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable relic placement puzzle: the abilities to place, the locations
 * that receive them, pinned placements and an optional complexity goal.
 *
 * <p>Built once per randomization and shared read-only by every search worker.
 * Use {@link ModelValidator#validate(AccessibilityModel)} before searching.
 */
@Value
@Builder
public class AccessibilityModel {

    @Singular
    List<Ability> abilities;

    @Singular
    List<RelicLocation> locations;

    /**
     * Pinned placements, location id to token.
     */
    @Singular("place")
    Map<String, String> placed;

    @Nullable
    ComplexityGoal goal;

    public Optional<RelicLocation> location(String id) {
        for (RelicLocation location : locations) {
            if (location.getId().equals(id)) {
                return Optional.of(location);
            }
        }
        return Optional.empty();
    }

    public Optional<Ability> ability(String token) {
        for (Ability ability : abilities) {
            if (ability.token().equals(token)) {
                return Optional.of(ability);
            }
        }
        return Optional.empty();
    }

    /**
     * Display name of a token, falling back to the token itself.
     */
    public String abilityName(String token) {
        return ability(token).map(Ability::name).orElse(token);
    }

    /**
     * All tokens in declaration order.
     */
    public List<String> tokens() {
        List<String> tokens = new ArrayList<>(abilities.size());
        for (Ability ability : abilities) {
            tokens.add(ability.token());
        }
        return tokens;
    }

    public boolean isPinned(String locationId) {
        return placed.containsKey(locationId);
    }
}
