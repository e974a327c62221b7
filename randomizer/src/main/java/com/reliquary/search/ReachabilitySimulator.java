package com.reliquary.search;

import com.reliquary.model.AccessibilityModel;
import com.reliquary.model.RelicLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Simulates a player collecting tokens under a fixed assignment.
 *
 * <p>Each wave opens every location whose locks are satisfied by the tokens of
 * earlier waves and collects what they hold. The simulation stops when a wave
 * opens nothing new.
 */
public final class ReachabilitySimulator {

    private ReachabilitySimulator() {
        // Utility class - prevent instantiation
    }

    /**
     * Run the simulation.
     *
     * @param model      the model
     * @param assignment location id to token; locations without an entry are
     *                   opened but hold nothing
     * @return waves, acquisition order and locations never opened
     */
    public static Reachability simulate(AccessibilityModel model, Map<String, String> assignment) {
        Set<String> held = new HashSet<>();
        Map<String, Integer> waves = new LinkedHashMap<>();
        List<String> order = new ArrayList<>();
        Set<String> unopened = new LinkedHashSet<>();
        for (RelicLocation location : model.getLocations()) {
            unopened.add(location.getId());
        }

        int wave = 0;
        while (!unopened.isEmpty()) {
            List<RelicLocation> opened = new ArrayList<>();
            for (RelicLocation location : model.getLocations()) {
                if (unopened.contains(location.getId()) && location.isAccessible(held)) {
                    opened.add(location);
                }
            }
            if (opened.isEmpty()) {
                break;
            }
            // Collect after the scan so a wave only sees earlier waves
            for (RelicLocation location : opened) {
                unopened.remove(location.getId());
                String token = assignment.get(location.getId());
                if (token != null && !waves.containsKey(token)) {
                    waves.put(token, wave);
                    order.add(token);
                }
            }
            held.addAll(order);
            wave++;
        }

        return new Reachability(Collections.unmodifiableMap(waves),
                Collections.unmodifiableList(order),
                Collections.unmodifiableSet(unopened));
    }
}
