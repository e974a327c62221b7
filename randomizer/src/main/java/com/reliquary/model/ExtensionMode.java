package com.reliquary.model;

import com.reliquary.error.ModelException;

import java.util.Locale;

/**
 * Which extension locations join the base relic locations.
 *
 * <p>{@link #EQUIPMENT} implies {@link #GUARDED}.
 */
public enum ExtensionMode {

    NONE,
    GUARDED,
    EQUIPMENT;

    /**
     * Check whether locations of the given kind are part of this mode.
     *
     * @param kind the location kind
     * @return true if locations of that kind are included
     */
    public boolean includes(LocationKind kind) {
        switch (kind) {
            case BASE:
                return true;
            case GUARDED:
                return this == GUARDED || this == EQUIPMENT;
            case EQUIPMENT:
                return this == EQUIPMENT;
            default:
                return false;
        }
    }

    /**
     * Parse a mode name as it appears in options ("guarded", "equipment").
     * A null or blank name means {@link #NONE}.
     *
     * @throws ModelException for an unknown name
     */
    public static ExtensionMode fromName(String name) {
        if (name == null || name.isBlank()) {
            return NONE;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ModelException("Invalid relic locations extension: " + name, e);
        }
    }
}
