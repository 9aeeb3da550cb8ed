package com.example.spellgrid.model;

/**
 * Enemy archetypes. Combat numbers live in configuration
 * (see {@link com.example.spellgrid.config.EnemyStats}).
 */
public enum EnemyType {
    GOBLIN("goblin", "Goblin"),
    ARCHER("archer", "Archer"),
    OGRE("ogre", "Ogre");

    private final String key;
    private final String displayName;

    EnemyType(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }

    public static EnemyType fromString(String s) {
        if (s == null) return null;
        String k = s.trim().toLowerCase();
        for (EnemyType t : values()) {
            if (t.key.equals(k)) return t;
        }
        return null;
    }
}
