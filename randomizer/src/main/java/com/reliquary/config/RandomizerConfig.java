package com.reliquary.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.reliquary.data.LocationCatalogLoader;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;

/**
 * Runtime settings of the randomizer.
 *
 * <p>Loaded from the optional classpath resource {@code /reliquary.json}; any
 * field missing there keeps its default:
 * <pre>
 * {
 *   "version": "1.0.0",
 *   "workerCount": 0,
 *   "rounds": 1,
 *   "dispatchBudget": 2048,
 *   "catalogPath": "/data/relics.json"
 * }
 * </pre>
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class RandomizerConfig {

    public static final String RESOURCE = "/reliquary.json";

    /**
     * Version tag mixed into every seed, so a release change reshuffles all seeds.
     */
    @Builder.Default
    String version = "1.0.0";

    /**
     * Number of placement workers. 0 derives the count from available cores.
     */
    @Builder.Default
    int workerCount = 0;

    /**
     * Attempts each worker makes per request before replying.
     */
    @Builder.Default
    int rounds = 1;

    /**
     * Requests each worker may receive before the search gives up.
     */
    @Builder.Default
    int dispatchBudget = 2048;

    @Builder.Default
    String catalogPath = LocationCatalogLoader.DEFAULT_CATALOG;

    public static RandomizerConfig defaults() {
        return RandomizerConfig.builder().build();
    }

    /**
     * Worker count to use on a machine with the given number of cores: three
     * quarters of them, at least one.
     */
    public static int workerCountFromCores(int cores) {
        return Math.max(cores * 3 / 4, 1);
    }

    /**
     * The configured worker count, or the core-derived one when unset.
     */
    public int effectiveWorkerCount() {
        return workerCount > 0 ? workerCount : workerCountFromCores(Runtime.getRuntime().availableProcessors());
    }

    /**
     * Build a config from its JSON form. Missing or invalid fields fall back
     * to their defaults.
     *
     * @param json parsed {@code /reliquary.json}, or null for all defaults
     */
    public static RandomizerConfig fromJson(@Nullable JsonObject json) {
        RandomizerConfigBuilder builder = RandomizerConfig.builder();
        if (json == null) {
            return builder.build();
        }
        if (json.has("version")) {
            builder.version(json.get("version").getAsString());
        }
        Integer workers = positiveInt(json, "workerCount", true);
        if (workers != null) {
            builder.workerCount(workers);
        }
        Integer rounds = positiveInt(json, "rounds", false);
        if (rounds != null) {
            builder.rounds(rounds);
        }
        Integer budget = positiveInt(json, "dispatchBudget", false);
        if (budget != null) {
            builder.dispatchBudget(budget);
        }
        if (json.has("catalogPath")) {
            builder.catalogPath(json.get("catalogPath").getAsString());
        }
        return builder.build();
    }

    @Nullable
    private static Integer positiveInt(JsonObject json, String field, boolean allowZero) {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        int value;
        try {
            value = element.getAsInt();
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
            log.warn("Ignoring non-numeric {} in {}: {}", field, RESOURCE, element);
            return null;
        }
        if (value < 0 || (value == 0 && !allowZero)) {
            log.warn("Ignoring out-of-range {} in {}: {}", field, RESOURCE, value);
            return null;
        }
        return value;
    }
}
