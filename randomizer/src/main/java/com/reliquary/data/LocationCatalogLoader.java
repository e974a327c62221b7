package com.reliquary.data;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.reliquary.error.ModelException;
import com.reliquary.model.Ability;
import com.reliquary.model.LocationCatalog;
import com.reliquary.model.LocationKind;
import com.reliquary.model.Lock;
import com.reliquary.model.RelicLocation;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the relic catalog from a JSON resource.
 *
 * <p>Expected layout:
 * <pre>
 * {
 *   "relics":    [ { "ability": "B", "name": "Soul of Bat" }, ... ],
 *   "locations": [ { "id": "B", "kind": "base", "vanilla": "B",
 *                    "locks": [["M"], ["L", "V"]], "escapes": [] }, ... ]
 * }
 * </pre>
 * {@code locks} and {@code escapes} are optional and default to empty.
 * {@code vanilla} defaults to the location id.
 */
@Slf4j
@Singleton
public class LocationCatalogLoader {

    public static final String DEFAULT_CATALOG = "/data/relics.json";

    private final Gson gson;

    @Inject
    public LocationCatalogLoader(Gson gson) {
        this.gson = gson;
    }

    /**
     * Load and parse a catalog resource.
     *
     * @param resourcePath classpath resource path
     * @return the parsed catalog
     * @throws JsonResourceLoader.JsonLoadException if the resource is missing or malformed
     * @throws ModelException if the catalog declares duplicate relics or locations
     */
    public LocationCatalog load(String resourcePath) {
        JsonObject root = JsonResourceLoader.load(gson, resourcePath);

        List<Ability> relics = new ArrayList<>();
        Set<String> tokens = new HashSet<>();
        for (JsonElement element : JsonResourceLoader.getRequiredArray(root, "relics")) {
            JsonObject obj = element.getAsJsonObject();
            String token = JsonResourceLoader.getRequiredString(obj, "ability");
            String name = obj.has("name") ? obj.get("name").getAsString() : token;
            if (!tokens.add(token)) {
                throw new ModelException("Duplicate relic in catalog " + resourcePath + ": " + token);
            }
            relics.add(new Ability(token, name));
        }

        List<RelicLocation> locations = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (JsonElement element : JsonResourceLoader.getRequiredArray(root, "locations")) {
            RelicLocation location = parseLocation(element.getAsJsonObject(), resourcePath);
            if (!ids.add(location.getId())) {
                throw new ModelException("Duplicate location in catalog " + resourcePath + ": " + location.getId());
            }
            locations.add(location);
        }

        log.info("Loaded relic catalog {}: {} relics, {} locations", resourcePath, relics.size(), locations.size());
        return new LocationCatalog(relics, locations);
    }

    private RelicLocation parseLocation(JsonObject obj, String resourcePath) {
        String id = JsonResourceLoader.getRequiredString(obj, "id");
        LocationKind kind;
        try {
            kind = gson.fromJson(obj.get("kind"), LocationKind.class);
        } catch (JsonParseException e) {
            throw new JsonResourceLoader.JsonLoadException(
                    "Invalid kind for location " + id + " in " + resourcePath, e);
        }
        if (kind == null) {
            throw new JsonResourceLoader.JsonLoadException(
                    "Missing kind for location " + id + " in " + resourcePath);
        }

        return RelicLocation.builder()
                .id(id)
                .kind(kind)
                .vanilla(obj.has("vanilla") ? obj.get("vanilla").getAsString() : id)
                .locks(parseLocks(obj.getAsJsonArray("locks")))
                .escapes(parseLocks(obj.getAsJsonArray("escapes")))
                .build();
    }

    private List<Lock> parseLocks(JsonArray array) {
        List<Lock> locks = new ArrayList<>();
        if (array == null) {
            return locks;
        }
        for (JsonElement element : array) {
            locks.add(gson.fromJson(element, Lock.class));
        }
        return locks;
    }
}
