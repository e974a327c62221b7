package com.reliquary.model;

/**
 * Category of a relic location.
 */
public enum LocationKind {

    /**
     * Vanilla relic spot, always present.
     */
    BASE,

    /**
     * Item guarded by a boss or hidden room, included by the guarded extension.
     */
    GUARDED,

    /**
     * Equipment pickup, included by the equipment extension.
     */
    EQUIPMENT
}
