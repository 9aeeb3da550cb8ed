package com.example.spellgrid.model;

public enum ItemType {
    HEALTH_POTION("health potion"),
    MANA_POTION("mana potion");

    private final String displayName;

    ItemType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() { return displayName; }

    public static ItemType fromString(String s) {
        if (s == null) return null;
        String k = s.trim().toLowerCase().replace(' ', '_');
        switch (k) {
            case "health_potion": case "healthpotion": case "health": return HEALTH_POTION;
            case "mana_potion": case "manapotion": case "mana": return MANA_POTION;
            default: return null;
        }
    }
}
