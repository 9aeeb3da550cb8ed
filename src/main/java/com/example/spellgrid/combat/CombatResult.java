package com.example.spellgrid.combat;

/**
 * Outcome of one hit on one target. Collected by the resolvers so callers
 * (and tests) can inspect what happened without diffing whole states.
 */
public class CombatResult {

    public enum ResultType {
        HIT,        // Damage dealt, target survived
        DEATH,      // Damage dealt, target dropped to zero or below
        PUSHED,     // Target displaced by an air spell
        BLOCKED     // Pushback had nowhere to go
    }

    private final ResultType type;
    private final String targetId;
    private final int damage;

    private CombatResult(ResultType type, String targetId, int damage) {
        this.type = type;
        this.targetId = targetId;
        this.damage = damage;
    }

    public static CombatResult hit(String targetId, int damage) {
        return new CombatResult(ResultType.HIT, targetId, damage);
    }

    public static CombatResult death(String targetId, int finalDamage) {
        return new CombatResult(ResultType.DEATH, targetId, finalDamage);
    }

    public static CombatResult pushed(String targetId) {
        return new CombatResult(ResultType.PUSHED, targetId, 0);
    }

    public static CombatResult blocked(String targetId) {
        return new CombatResult(ResultType.BLOCKED, targetId, 0);
    }

    public ResultType getType() { return type; }
    public String getTargetId() { return targetId; }
    public int getDamage() { return damage; }

    public boolean isKill() {
        return type == ResultType.DEATH;
    }

    @Override
    public String toString() {
        return "CombatResult[" + type + " " + targetId + (damage > 0 ? " for " + damage : "") + "]";
    }
}
