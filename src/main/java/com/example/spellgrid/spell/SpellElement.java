package com.example.spellgrid.spell;

/**
 * Magic elements. Each has a base damage (see CombatCalculator) and a rider:
 * fire burns, water freezes, air pushes back, earth has none.
 */
public enum SpellElement {
    FIRE("fire"),
    WATER("water"),
    EARTH("earth"),
    AIR("air");

    private final String key;

    SpellElement(String key) {
        this.key = key;
    }

    /** Lowercase key used in configuration files. */
    public String getKey() { return key; }

    public static SpellElement fromString(String s) {
        if (s == null) return null;
        String k = s.trim().toLowerCase();
        for (SpellElement e : values()) {
            if (e.key.equals(k)) return e;
        }
        return null;
    }
}
