package com.example.spellgrid.engine;

/**
 * How a turn was spent. Decides the mana regenerated in cleanup.
 */
public enum TurnKind {
    /** Moving, dashing, using an item or casting. */
    ACTION,
    /** Focusing (waiting): larger mana regeneration. */
    FOCUS
}
