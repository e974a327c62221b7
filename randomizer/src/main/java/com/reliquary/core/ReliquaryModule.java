package com.reliquary.core;

import com.google.gson.Gson;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.reliquary.config.RandomizerConfig;
import com.reliquary.data.GsonFactory;
import com.reliquary.data.JsonResourceLoader;
import com.reliquary.data.LocationCatalogLoader;
import com.reliquary.model.LocationCatalog;
import com.reliquary.search.ForwardFillSearch;
import com.reliquary.search.PlacementSearch;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;

/**
 * Guice module for the relic randomizer.
 *
 * Binds the placement search strategy and provides config and catalog.
 * Everything else is {@code @Singleton} annotated on the classes themselves.
 */
@Slf4j
public class ReliquaryModule extends AbstractModule {

    @Nullable
    private final RandomizerConfig config;

    public ReliquaryModule() {
        this(null);
    }

    /**
     * @param config fixed config, or null to load {@code /reliquary.json}
     */
    public ReliquaryModule(@Nullable RandomizerConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(PlacementSearch.class).to(ForwardFillSearch.class);
    }

    @Provides
    @Singleton
    public Gson provideGson() {
        return GsonFactory.create();
    }

    @Provides
    @Singleton
    public RandomizerConfig provideConfig(Gson gson) {
        if (config != null) {
            return config;
        }
        RandomizerConfig loaded = RandomizerConfig.fromJson(
                JsonResourceLoader.tryLoadOptional(gson, RandomizerConfig.RESOURCE));
        log.info("Randomizer config: version {}, {} workers, {} rounds, budget {}",
                loaded.getVersion(), loaded.effectiveWorkerCount(), loaded.getRounds(), loaded.getDispatchBudget());
        return loaded;
    }

    @Provides
    @Singleton
    public LocationCatalog provideCatalog(LocationCatalogLoader loader, RandomizerConfig randomizerConfig) {
        return loader.load(randomizerConfig.getCatalogPath());
    }
}
