package com.reliquary.search;

import com.reliquary.model.AccessibilityModel;
import com.reliquary.model.Ability;
import com.reliquary.model.ComplexityGoal;
import com.reliquary.model.LocationKind;
import com.reliquary.model.Lock;
import com.reliquary.model.RelicLocation;

import java.util.List;

/**
 * Small hand-built models shared by search, orchestrator and proof tests.
 */
public final class ModelFixtures {

    private ModelFixtures() {
    }

    public static RelicLocation location(String id, Lock... locks) {
        return RelicLocation.builder()
                .id(id)
                .kind(LocationKind.BASE)
                .vanilla(id)
                .locks(List.of(locks))
                .build();
    }

    /**
     * L1 open, L2 needs a, L3 needs a and b. Only L1=a, L2=b, L3=c is sound.
     */
    public static AccessibilityModel.AccessibilityModelBuilder chainBuilder() {
        return AccessibilityModel.builder()
                .ability(Ability.of("a"))
                .ability(Ability.of("b"))
                .ability(Ability.of("c"))
                .location(location("L1"))
                .location(location("L2", Lock.of("a")))
                .location(location("L3", Lock.of("a", "b")));
    }

    public static AccessibilityModel chain() {
        return chainBuilder().build();
    }

    public static AccessibilityModel chainWithGoal(int min, Integer max, Lock... goals) {
        return chainBuilder().goal(ComplexityGoal.of(min, max, List.of(goals))).build();
    }
}
