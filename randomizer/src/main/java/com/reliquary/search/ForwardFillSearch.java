package com.reliquary.search;

import com.reliquary.error.SearchException;
import com.reliquary.model.AccessibilityModel;
import com.reliquary.model.ComplexityGoal;
import com.reliquary.model.RelicLocation;
import com.reliquary.proof.ProofNode;
import com.reliquary.util.Randomization;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Randomized forward fill.
 *
 * <p>Starting with no tokens, the search repeatedly:
 * <ol>
 *   <li>collects pinned tokens at every open location holding one</li>
 *   <li>picks a random open, unfilled location</li>
 *   <li>puts a random remaining token there, skipping tokens that would trap
 *       the player; when only one location is open, tokens that open another
 *       location are preferred so the fill does not stall</li>
 * </ol>
 * The finished assignment is then re-verified from scratch: forward
 * reachability, escape requirements and the complexity goal. Any failure
 * discards the attempt.
 */
@Slf4j
@Singleton
public class ForwardFillSearch implements PlacementSearch {

    @Override
    public Optional<PlacementResult> attempt(AccessibilityModel model, Randomization random) {
        checkPinnedEscapes(model);

        Map<String, String> filled = fill(model, random);
        if (filled == null) {
            return Optional.empty();
        }

        Map<String, String> assignment = new LinkedHashMap<>();
        for (RelicLocation location : model.getLocations()) {
            assignment.put(location.getId(), filled.get(location.getId()));
        }

        Reachability reachability = ReachabilitySimulator.simulate(model, assignment);
        if (!reachability.isComplete()) {
            log.debug("Attempt rejected: unreachable locations {}", reachability.unreached());
            return Optional.empty();
        }

        EscapeVerifier.Violation violation = EscapeVerifier.verify(model, assignment);
        if (violation != null) {
            log.debug("Attempt rejected: {} at {} cannot escape via {}",
                    violation.token(), violation.location(), violation.route());
            return Optional.empty();
        }

        Map<String, ProofNode> nodes = ProofBuilder.nodes(model, assignment, reachability);
        ComplexityGoal goal = model.getGoal();
        int complexity = ComplexityMeter.measure(goal, nodes);
        if (goal != null && (complexity < 0 || !goal.accepts(complexity))) {
            log.debug("Attempt rejected: complexity {} outside goal {}", complexity, goal);
            return Optional.empty();
        }

        return Optional.of(new PlacementResult(
                Collections.unmodifiableMap(assignment),
                ProofBuilder.proof(model, nodes, reachability),
                complexity,
                reachability.acquisitionOrder()));
    }

    /**
     * A pinned token whose escape requirement fails can never be fixed by
     * another attempt.
     */
    private void checkPinnedEscapes(AccessibilityModel model) {
        for (Map.Entry<String, String> pinned : model.getPlaced().entrySet()) {
            RelicLocation location = model.location(pinned.getKey()).orElseThrow();
            EscapeVerifier.Violation violation = EscapeVerifier.check(location, pinned.getValue());
            if (violation != null) {
                throw new SearchException("Pinned relic '" + pinned.getValue() + "' at " + location.getId()
                        + " can never meet its escape requirement " + location.getEscapes(),
                        location.getId(), violation.route().toString());
            }
        }
    }

    /**
     * @return location id to token, or null on a dead end
     */
    private Map<String, String> fill(AccessibilityModel model, Randomization random) {
        Set<String> pinnedTokens = new HashSet<>(model.getPlaced().values());
        List<String> pool = new ArrayList<>();
        for (String token : model.tokens()) {
            if (!pinnedTokens.contains(token)) {
                pool.add(token);
            }
        }

        Map<String, String> filled = new LinkedHashMap<>();
        Set<String> held = new HashSet<>();

        while (filled.size() < model.getLocations().size()) {
            List<RelicLocation> frontier = new ArrayList<>();
            boolean collectedPinned = false;
            for (RelicLocation location : model.getLocations()) {
                if (filled.containsKey(location.getId()) || !location.isAccessible(held)) {
                    continue;
                }
                String pinned = model.getPlaced().get(location.getId());
                if (pinned != null) {
                    filled.put(location.getId(), pinned);
                    held.add(pinned);
                    collectedPinned = true;
                } else {
                    frontier.add(location);
                }
            }
            if (collectedPinned) {
                continue;
            }
            if (frontier.isEmpty()) {
                log.debug("Dead end after {} placements, {} tokens left", filled.size(), pool.size());
                return null;
            }

            RelicLocation target = random.chooseRandom(frontier);
            List<String> candidates = new ArrayList<>();
            for (String token : pool) {
                if (EscapeVerifier.allows(target, token)) {
                    candidates.add(token);
                }
            }
            if (frontier.size() == 1) {
                List<String> opening = opening(model, filled, held, target, candidates);
                if (!opening.isEmpty()) {
                    candidates = opening;
                }
            }
            if (candidates.isEmpty()) {
                log.debug("No token fits {} after {} placements", target.getId(), filled.size());
                return null;
            }

            String token = random.chooseRandom(candidates);
            filled.put(target.getId(), token);
            pool.remove(token);
            held.add(token);
        }
        return filled;
    }

    /**
     * Candidates that open at least one more unfilled location once collected.
     */
    private List<String> opening(AccessibilityModel model, Map<String, String> filled, Set<String> held,
                                 RelicLocation target, List<String> candidates) {
        List<String> opening = new ArrayList<>();
        for (String token : candidates) {
            Set<String> next = new HashSet<>(held);
            next.add(token);
            for (RelicLocation location : model.getLocations()) {
                if (!location.getId().equals(target.getId()) && !filled.containsKey(location.getId())
                        && !location.isAccessible(held) && location.isAccessible(next)) {
                    opening.add(token);
                    break;
                }
            }
        }
        return opening;
    }
}
