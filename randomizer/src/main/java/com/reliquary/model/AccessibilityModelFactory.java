package com.reliquary.model;

import com.reliquary.error.ModelException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges randomizer options into the catalog to produce a validated model.
 */
@Slf4j
public final class AccessibilityModelFactory {

    private AccessibilityModelFactory() {
        // Utility class - prevent instantiation
    }

    /**
     * Build and validate the model for a set of options.
     *
     * @param catalog the relic catalog
     * @param options parsed options
     * @return a validated, immutable model
     * @throws ModelException if the options reference unknown locations or the
     *                        merged model is invalid
     */
    public static AccessibilityModel build(LocationCatalog catalog, RandomizerOptions options) {
        List<RelicLocation> included = catalog.buildLocations(options.getExtension());

        Set<String> ids = new HashSet<>();
        included.forEach(location -> ids.add(location.getId()));
        requireKnown(ids, options.getLocks().keySet(), "Lock override");
        requireKnown(ids, options.getEscapes().keySet(), "Escape requirement");

        AccessibilityModel.AccessibilityModelBuilder builder = AccessibilityModel.builder()
                .abilities(catalog.abilitiesFor(included))
                .placed(options.getPlaced())
                .goal(options.getGoal());

        for (RelicLocation location : included) {
            builder.location(merge(location, options));
        }

        AccessibilityModel model = builder.build();
        ModelValidator.validate(model);

        log.info("Built accessibility model: {} locations (extension {}), {} overrides, {} placed{}",
                model.getLocations().size(),
                options.getExtension(),
                options.getLocks().size() + options.getEscapes().size(),
                model.getPlaced().size(),
                model.getGoal() != null ? ", goal " + model.getGoal() : "");
        return model;
    }

    private static RelicLocation merge(RelicLocation location, RandomizerOptions options) {
        List<Lock> lockOverride = options.getLocks().get(location.getId());
        List<Lock> extraEscapes = options.getEscapes().get(location.getId());
        if (lockOverride == null && extraEscapes == null) {
            return location;
        }

        RelicLocation.RelicLocationBuilder merged = location.toBuilder();
        if (lockOverride != null) {
            merged.clearLocks().locks(lockOverride);
        }
        if (extraEscapes != null) {
            merged.escapes(extraEscapes);
        }
        return merged.build();
    }

    private static void requireKnown(Set<String> ids, Set<String> referenced, String what) {
        for (String id : referenced) {
            if (!ids.contains(id)) {
                throw new ModelException(what + " for unknown relic location: " + id);
            }
        }
    }

    /**
     * The unmodified game: every location holds its vanilla token.
     */
    public static Map<String, String> vanillaAssignment(AccessibilityModel model) {
        Map<String, String> assignment = new LinkedHashMap<>();
        for (RelicLocation location : model.getLocations()) {
            assignment.put(location.getId(), location.getVanilla());
        }
        return Collections.unmodifiableMap(assignment);
    }
}
