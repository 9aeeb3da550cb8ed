package com.example.spellgrid.model;

import com.example.spellgrid.spell.SpellElement;

import java.util.Collections;
import java.util.List;

/**
 * An enemy on the battlefield.
 *
 * Identity (id, type) and archetype data (attack range, weakness, resistance,
 * xp value) never change once spawned. Position, health and the status list
 * are replaced through the {@code with*} methods, each of which returns a new
 * instance.
 */
public final class Enemy {

    private final String id;
    private final Position position;
    private final EnemyType type;
    private final int health;
    private final int attackRange;
    private final SpellElement weakness;     // nullable
    private final SpellElement resistance;   // nullable
    private final List<StatusEffect> statusEffects;
    private final int xpValue;

    public Enemy(String id, Position position, EnemyType type, int health, int attackRange,
                 SpellElement weakness, SpellElement resistance,
                 List<StatusEffect> statusEffects, int xpValue) {
        if (weakness != null && weakness == resistance) {
            throw new IllegalArgumentException("Enemy " + id + " cannot be weak and resistant to " + weakness);
        }
        this.id = id;
        this.position = position;
        this.type = type;
        this.health = health;
        this.attackRange = attackRange;
        this.weakness = weakness;
        this.resistance = resistance;
        this.statusEffects = statusEffects == null ? Collections.emptyList() : List.copyOf(statusEffects);
        this.xpValue = xpValue;
    }

    public String getId() { return id; }
    public Position getPosition() { return position; }
    public EnemyType getType() { return type; }
    public int getHealth() { return health; }
    public int getAttackRange() { return attackRange; }
    public SpellElement getWeakness() { return weakness; }
    public SpellElement getResistance() { return resistance; }
    public List<StatusEffect> getStatusEffects() { return statusEffects; }
    public int getXpValue() { return xpValue; }

    public boolean isDefeated() {
        return health <= 0;
    }

    public boolean hasStatus(StatusEffectType statusType) {
        for (StatusEffect effect : statusEffects) {
            if (effect.type() == statusType && !effect.isExpired()) return true;
        }
        return false;
    }

    public String getName() {
        return type.getDisplayName() + " " + id;
    }

    public Enemy withPosition(Position newPosition) {
        return new Enemy(id, newPosition, type, health, attackRange, weakness, resistance, statusEffects, xpValue);
    }

    public Enemy withHealth(int newHealth) {
        return new Enemy(id, position, type, newHealth, attackRange, weakness, resistance, statusEffects, xpValue);
    }

    public Enemy withStatusEffects(List<StatusEffect> newEffects) {
        return new Enemy(id, position, type, health, attackRange, weakness, resistance, newEffects, xpValue);
    }

    @Override
    public String toString() {
        return "Enemy[" + id + " " + type.getKey() + " at " + position + ", hp=" + health
            + (statusEffects.isEmpty() ? "" : ", status=" + statusEffects) + "]";
    }
}
