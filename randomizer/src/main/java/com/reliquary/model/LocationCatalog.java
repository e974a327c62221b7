package com.reliquary.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The fixed set of relics and every location that can hold one, across all
 * extension modes.
 *
 * <p>Loaded once from {@code /data/relics.json} by
 * {@link com.reliquary.data.LocationCatalogLoader}.
 */
@Getter
public class LocationCatalog {

    private final ImmutableList<Ability> relics;
    private final ImmutableList<RelicLocation> locations;
    private final ImmutableMap<String, String> namesByToken;

    public LocationCatalog(List<Ability> relics, List<RelicLocation> locations) {
        this.relics = ImmutableList.copyOf(relics);
        this.locations = ImmutableList.copyOf(locations);

        Map<String, String> names = new LinkedHashMap<>();
        for (Ability relic : relics) {
            names.put(relic.token(), relic.name());
        }
        this.namesByToken = ImmutableMap.copyOf(names);
    }

    /**
     * Locations included by the given extension mode, base locations first,
     * then guarded, then equipment, each group in catalog order.
     */
    public List<RelicLocation> buildLocations(ExtensionMode extensionMode) {
        return buildLocations(locations, extensionMode);
    }

    /**
     * Select the locations of a base set included by an extension mode.
     *
     * @param baseSet       every known location
     * @param extensionMode which extension kinds to include
     * @return ordered, immutable list of included locations
     */
    public static List<RelicLocation> buildLocations(Collection<RelicLocation> baseSet,
                                                     ExtensionMode extensionMode) {
        ImmutableList.Builder<RelicLocation> result = ImmutableList.builder();
        for (LocationKind kind : LocationKind.values()) {
            if (!extensionMode.includes(kind)) {
                continue;
            }
            for (RelicLocation location : baseSet) {
                if (location.getKind() == kind) {
                    result.add(location);
                }
            }
        }
        return result.build();
    }

    /**
     * The abilities to place for a set of locations: the vanilla token of each
     * location, in location order.
     */
    public List<Ability> abilitiesFor(List<RelicLocation> included) {
        List<Ability> abilities = new ArrayList<>(included.size());
        for (RelicLocation location : included) {
            abilities.add(new Ability(location.getVanilla(), abilityName(location.getVanilla())));
        }
        return abilities;
    }

    /**
     * Display name for a token. Relics resolve to their catalog name,
     * extension items are their own name.
     */
    public String abilityName(String token) {
        return namesByToken.getOrDefault(token, token);
    }
}
