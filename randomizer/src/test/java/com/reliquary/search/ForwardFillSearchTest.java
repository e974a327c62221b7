package com.reliquary.search;

import com.reliquary.data.GsonFactory;
import com.reliquary.data.LocationCatalogLoader;
import com.reliquary.error.SearchException;
import com.reliquary.model.AccessibilityModel;
import com.reliquary.model.AccessibilityModelFactory;
import com.reliquary.model.ComplexityGoal;
import com.reliquary.model.ExtensionMode;
import com.reliquary.model.LocationCatalog;
import com.reliquary.model.Lock;
import com.reliquary.model.RandomizerOptions;
import com.reliquary.model.RelicLocation;
import com.reliquary.util.Randomization;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.Assert.*;

/**
 * Tests {@link ForwardFillSearch} on the chain fixture and the bundled catalog.
 */
public class ForwardFillSearchTest {

    private static LocationCatalog catalog;

    private ForwardFillSearch search;

    @BeforeClass
    public static void loadCatalog() {
        catalog = new LocationCatalogLoader(GsonFactory.create()).load(LocationCatalogLoader.DEFAULT_CATALOG);
    }

    @Before
    public void setUp() {
        search = new ForwardFillSearch();
    }

    private PlacementResult firstSuccess(AccessibilityModel model, long fromSeed) {
        for (long seed = fromSeed; seed < fromSeed + 200; seed++) {
            Optional<PlacementResult> result = search.attempt(model, new Randomization(seed));
            if (result.isPresent()) {
                return result.get();
            }
        }
        fail("No placement found in 200 attempts");
        return null;
    }

    // ========================================================================
    // Chain fixture
    // ========================================================================

    @Test
    public void testAttempt_ChainModel_FindsTheOnlySoundAssignment() {
        AccessibilityModel model = ModelFixtures.chain();
        for (long seed = 0; seed < 20; seed++) {
            Optional<PlacementResult> result = search.attempt(model, new Randomization(seed));

            assertTrue(result.isPresent());
            assertEquals(Map.of("L1", "a", "L2", "b", "L3", "c"), result.get().assignment());
            assertEquals(List.of("a", "b", "c"), result.get().acquisitionOrder());
        }
    }

    @Test
    public void testAttempt_AssignmentInLocationOrder() {
        PlacementResult result = search.attempt(ModelFixtures.chain(), new Randomization(1L)).orElseThrow();
        assertEquals(List.of("L1", "L2", "L3"), List.copyOf(result.assignment().keySet()));
    }

    @Test
    public void testAttempt_GoalInRange_Accepted() {
        AccessibilityModel model = ModelFixtures.chainWithGoal(3, 3, Lock.of("c"));
        PlacementResult result = search.attempt(model, new Randomization(5L)).orElseThrow();

        assertEquals(3, result.complexity());
        assertEquals(1, result.proof().solutions().size());
    }

    @Test
    public void testAttempt_GoalOutOfRange_Rejected() {
        AccessibilityModel model = ModelFixtures.chainWithGoal(4, null, Lock.of("c"));
        for (long seed = 0; seed < 10; seed++) {
            assertFalse(search.attempt(model, new Randomization(seed)).isPresent());
        }
    }

    @Test
    public void testAttempt_PinnedTokenIsKept() {
        AccessibilityModel model = ModelFixtures.chainBuilder().place("L3", "c").build();
        PlacementResult result = search.attempt(model, new Randomization(2L)).orElseThrow();
        assertEquals("c", result.assignment().get("L3"));
    }

    @Test
    public void testAttempt_PinnedTokenThatCannotEscape_Throws() {
        RelicLocation trap = ModelFixtures.location("L1").toBuilder().escape(Lock.of("b")).build();
        AccessibilityModel model = AccessibilityModel.builder()
                .abilities(ModelFixtures.chain().getAbilities())
                .location(trap)
                .location(ModelFixtures.location("L2", Lock.of("a")))
                .location(ModelFixtures.location("L3", Lock.of("a", "b")))
                .place("L1", "a")
                .build();
        try {
            search.attempt(model, new Randomization(0L));
            fail("Expected SearchException");
        } catch (SearchException e) {
            assertEquals("L1", e.getLocation());
            assertEquals("(none)", e.getLock());
        }
    }

    @Test
    public void testAttempt_EscapeRequirementSteersPlacement() {
        // Whatever lands on L2 must be b, since b is needed to leave L2
        RelicLocation l2 = ModelFixtures.location("L2", Lock.of("a")).toBuilder().escape(Lock.of("b")).build();
        AccessibilityModel model = AccessibilityModel.builder()
                .abilities(ModelFixtures.chain().getAbilities())
                .location(ModelFixtures.location("L1"))
                .location(l2)
                .location(ModelFixtures.location("L3"))
                .build();
        for (long seed = 0; seed < 20; seed++) {
            search.attempt(model, new Randomization(seed))
                    .ifPresent(result -> assertEquals("b", result.assignment().get("L2")));
        }
    }

    // ========================================================================
    // Bundled catalog
    // ========================================================================

    @Test
    public void testAttempt_Catalog_BijectionAndSoundness() {
        AccessibilityModel model = AccessibilityModelFactory.build(catalog, RandomizerOptions.defaults());
        PlacementResult result = firstSuccess(model, 0);

        Map<String, String> assignment = result.assignment();
        assertEquals(model.getLocations().size(), assignment.size());
        assertEquals(new HashSet<>(model.tokens()), new HashSet<>(assignment.values()));
        assertTrue(ReachabilitySimulator.simulate(model, assignment).isComplete());
        assertNull(EscapeVerifier.verify(model, assignment));
        assertEquals(model.getLocations().size(), result.acquisitionOrder().size());
    }

    @Test
    public void testAttempt_Catalog_SameStreamSameResult() {
        AccessibilityModel model = AccessibilityModelFactory.build(catalog,
                RandomizerOptions.builder().extension(ExtensionMode.EQUIPMENT).build());
        for (long seed = 100; seed < 110; seed++) {
            Optional<PlacementResult> first = search.attempt(model, new Randomization(seed));
            Optional<PlacementResult> second = search.attempt(model, new Randomization(seed));

            assertEquals(first.isPresent(), second.isPresent());
            if (first.isPresent()) {
                assertEquals(first.get().assignment(), second.get().assignment());
                assertEquals(first.get().acquisitionOrder(), second.get().acquisitionOrder());
                assertEquals(first.get().complexity(), second.get().complexity());
            }
        }
    }

    @Test
    public void testAttempt_Catalog_GoalSatisfied() {
        RandomizerOptions options = RandomizerOptions.builder()
                .goal(ComplexityGoal.of(3, null, List.of(Lock.of("R"), Lock.of("N"))))
                .build();
        AccessibilityModel model = AccessibilityModelFactory.build(catalog, options);
        PlacementResult result = firstSuccess(model, 0);

        assertTrue(result.complexity() >= 3);
        assertFalse(result.proof().solutions().isEmpty());
    }
}
