package com.reliquary.core;

import com.reliquary.config.RandomizerConfig;
import com.reliquary.error.ModelException;
import com.reliquary.model.AccessibilityModel;
import com.reliquary.model.AccessibilityModelFactory;
import com.reliquary.model.LocationCatalog;
import com.reliquary.model.RandomizerOptions;
import com.reliquary.orchestrator.OrchestrationResult;
import com.reliquary.orchestrator.PlacementOrchestrator;
import com.reliquary.proof.MinimizedProof;
import com.reliquary.proof.SolutionMinimizer;
import com.reliquary.proof.SolutionRenderer;
import com.reliquary.search.SeedContext;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.List;

/**
 * Entry point: options and seed in, relic assignment and rendered proof out.
 *
 * <p>Runs model construction, the placement race, minimization and rendering
 * in order. Errors of any stage propagate unchanged; no partial result is
 * returned.
 */
@Slf4j
@Singleton
public class RelicRandomizer {

    private final LocationCatalog catalog;
    private final PlacementOrchestrator orchestrator;
    private final SolutionMinimizer minimizer;
    private final SolutionRenderer renderer;
    private final RandomizerConfig config;

    @Inject
    public RelicRandomizer(LocationCatalog catalog,
                           PlacementOrchestrator orchestrator,
                           SolutionMinimizer minimizer,
                           SolutionRenderer renderer,
                           RandomizerConfig config) {
        this.catalog = catalog;
        this.orchestrator = orchestrator;
        this.minimizer = minimizer;
        this.renderer = renderer;
        this.config = config;
    }

    public RandomizationResult randomize(RandomizerOptions options, String seed) throws InterruptedException {
        return randomize(options, seed, 0);
    }

    /**
     * Randomize relic locations.
     *
     * @param options   parsed options
     * @param seed      user seed
     * @param nonceBase first nonce to try; pass a new base to retry after
     *                  {@link com.reliquary.error.SearchExhaustedException}
     * @return the accepted assignment and its proof
     * @throws ModelException if the options are invalid, tagged with the seed
     * @throws com.reliquary.error.SearchExhaustedException if no placement was found
     * @throws com.reliquary.error.SearchException if the search hit a contradiction
     * @throws InterruptedException if interrupted while searching
     */
    public RandomizationResult randomize(RandomizerOptions options, String seed, long nonceBase)
            throws InterruptedException {
        AccessibilityModel model;
        try {
            model = AccessibilityModelFactory.build(catalog, options);
        } catch (ModelException e) {
            throw e.withSeed(seed);
        }

        if (!options.isRelicLocations()) {
            log.info("Relic locations not randomized for seed '{}'", seed);
            return RandomizationResult.builder()
                    .seed(seed)
                    .nonce(-1)
                    .assignment(AccessibilityModelFactory.vanillaAssignment(model))
                    .proofLines(List.of())
                    .build();
        }

        SeedContext seedContext = SeedContext.of(config.getVersion(), options, seed);
        OrchestrationResult found = orchestrator.search(model, seedContext, nonceBase);
        MinimizedProof proof = minimizer.minimize(found.proof());
        List<String> lines = renderer.render(proof, model::abilityName);

        return RandomizationResult.builder()
                .seed(seed)
                .nonce(found.nonce())
                .assignment(found.assignment())
                .complexity(found.complexity())
                .proof(proof)
                .proofLines(List.copyOf(lines))
                .build();
    }
}
