package com.example.spellgrid.model;

/**
 * A timed status effect attached to an enemy. Duration counts resolved turns.
 */
public record StatusEffect(StatusEffectType type, int duration) {

    public StatusEffect tick() {
        return new StatusEffect(type, duration - 1);
    }

    public boolean isExpired() {
        return duration <= 0;
    }
}
