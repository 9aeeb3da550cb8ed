package com.example.spellgrid.model;

/**
 * A friendly unit controlled by the minion AI. Summoned minions have no
 * source type; raised minions remember the enemy type they were raised from.
 */
public final class Minion {

    private final String id;
    private final Position position;
    private final EnemyType sourceType;   // null for a summoned minion
    private final int health;

    public Minion(String id, Position position, EnemyType sourceType, int health) {
        this.id = id;
        this.position = position;
        this.sourceType = sourceType;
        this.health = health;
    }

    public String getId() { return id; }
    public Position getPosition() { return position; }
    public EnemyType getSourceType() { return sourceType; }
    public int getHealth() { return health; }

    public boolean isUndead() {
        return sourceType != null;
    }

    public boolean isDefeated() {
        return health <= 0;
    }

    public String getName() {
        return (isUndead() ? "Undead " + sourceType.getDisplayName().toLowerCase() : "Minion") + " " + id;
    }

    public Minion withPosition(Position newPosition) {
        return new Minion(id, newPosition, sourceType, health);
    }

    public Minion withHealth(int newHealth) {
        return new Minion(id, position, sourceType, newHealth);
    }

    @Override
    public String toString() {
        return "Minion[" + id + (isUndead() ? " " + sourceType.getKey() : "") + " at " + position + ", hp=" + health + "]";
    }
}
