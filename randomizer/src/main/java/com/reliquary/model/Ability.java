package com.reliquary.model;

/**
 * One unlockable capability, the unit being placed.
 *
 * @param token opaque unique identifier used in locks and assignments
 * @param name  display name used when rendering proofs
 */
public record Ability(String token, String name) {

    public static Ability of(String token) {
        return new Ability(token, token);
    }
}
