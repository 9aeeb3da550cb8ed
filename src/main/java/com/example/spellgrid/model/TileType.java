package com.example.spellgrid.model;

/**
 * Terrain classification of a single grid coordinate. Independent of which
 * entity stands there.
 */
public enum TileType {
    EMPTY,
    OBSTACLE,
    WATER,
    FOREST,
    CORPSE,
    ITEM;

    /** The player can never step onto obstacles or corpses. */
    public boolean blocksPlayer() {
        return this == OBSTACLE || this == CORPSE;
    }

    /** AI-controlled units are only stopped by obstacles. */
    public boolean blocksUnits() {
        return this == OBSTACLE;
    }
}
