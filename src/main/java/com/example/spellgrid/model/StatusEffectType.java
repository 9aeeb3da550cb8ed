package com.example.spellgrid.model;

public enum StatusEffectType {
    /** Deals damage at the start of every turn. */
    BURN,
    /** Skips the enemy's action entirely. */
    FROZEN
}
