package com.example.spellgrid.spell;

/**
 * Spell shapes. BALL, CONE and WALL are elemental area spells; SELF, SUMMON
 * and RAISE_DEAD ignore the selected element.
 */
public enum SpellShape {
    BALL("ball", true),
    CONE("cone", true),
    WALL("wall", true),
    SELF("self", false),
    SUMMON("summon", false),
    RAISE_DEAD("raise_dead", false);

    private final String key;
    private final boolean elemental;

    SpellShape(String key, boolean elemental) {
        this.key = key;
        this.elemental = elemental;
    }

    public String getKey() { return key; }

    /** True for shapes that deal elemental damage to the tiles they cover. */
    public boolean isElemental() { return elemental; }

    public static SpellShape fromString(String s) {
        if (s == null) return null;
        String k = s.trim().toLowerCase().replace('-', '_');
        if (k.equals("raisedead")) return RAISE_DEAD;
        for (SpellShape shape : values()) {
            if (shape.key.equals(k)) return shape;
        }
        return null;
    }
}
