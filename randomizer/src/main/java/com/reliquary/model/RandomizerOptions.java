package com.reliquary.model;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parsed randomizer options relevant to relic placement.
 *
 * <p>Produced by the options grammar (outside this module) and merged into an
 * {@link AccessibilityModel} by {@link AccessibilityModelFactory}.
 */
@Value
@Builder(toBuilder = true)
public class RandomizerOptions {

    /**
     * Whether relic locations are randomized at all.
     */
    @Builder.Default
    boolean relicLocations = true;

    @Builder.Default
    ExtensionMode extension = ExtensionMode.GUARDED;

    /**
     * Lock overrides by location id. Replaces the catalog locks of that location.
     */
    @Singular
    Map<String, List<Lock>> locks;

    /**
     * Escape requirements by location id, appended to the catalog ones.
     */
    @Singular
    Map<String, List<Lock>> escapes;

    /**
     * Pinned placements, location id to token.
     */
    @Singular("place")
    Map<String, String> placed;

    @Nullable
    ComplexityGoal goal;

    public static RandomizerOptions defaults() {
        return RandomizerOptions.builder().build();
    }

    /**
     * Canonical JSON form, used when salting seeds. Map entries keep builder
     * order so identical option objects always serialize identically.
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("relicLocations", relicLocations);
        json.addProperty("extension", extension.name().toLowerCase(Locale.ROOT));
        json.add("locks", locksToJson(locks));
        json.add("escapes", locksToJson(escapes));
        JsonObject placedJson = new JsonObject();
        placed.forEach(placedJson::addProperty);
        json.add("placed", placedJson);
        if (goal != null) {
            JsonObject goalJson = new JsonObject();
            goalJson.addProperty("min", goal.min());
            if (goal.max() != null) {
                goalJson.addProperty("max", goal.max());
            }
            goalJson.add("goals", lockList(goal.goals()));
            json.add("goal", goalJson);
        }
        return json;
    }

    private static JsonObject locksToJson(Map<String, List<Lock>> byLocation) {
        JsonObject json = new JsonObject();
        byLocation.forEach((location, list) -> json.add(location, lockList(list)));
        return json;
    }

    private static JsonArray lockList(List<Lock> list) {
        JsonArray array = new JsonArray();
        for (Lock lock : list) {
            JsonArray tokens = new JsonArray();
            lock.tokens().forEach(tokens::add);
            array.add(tokens);
        }
        return array;
    }
}
