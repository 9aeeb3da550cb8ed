package com.example.spellgrid.model;

/**
 * A timed effect bound to a grid coordinate.
 */
public record TerrainEffect(TerrainEffectType type, int duration) {

    public TerrainEffect tick() {
        return new TerrainEffect(type, duration - 1);
    }

    public boolean isExpired() {
        return duration <= 0;
    }
}
