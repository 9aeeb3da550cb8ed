package com.example.spellgrid.combat;

import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.model.Enemy;
import com.example.spellgrid.model.EnemyType;
import com.example.spellgrid.spell.SpellElement;

import java.util.List;

/**
 * Combat calculator for spell damage and enemy attack damage.
 *
 * Spell damage: (base[element] + spellPower), then multiplied in order by
 *   - 1.25 if the caster stands on water and casts water
 *   - 0.75 if the target stands on water and the spell is fire
 *   - 1.5  if the target is weak to the element
 *   - 0.5  if the target resists the element
 * and rounded to the nearest integer.
 *
 * Enemy attack: base damage of the type, halved for an archer shooting into
 * a forest tile, rounded, plus the goblin swarm bonus
 * (bonus per goblin * other goblins within the swarm radius).
 */
public class CombatCalculator {

    public static final double CASTER_WATER_BONUS = 1.25;
    public static final double TARGET_WATER_FIRE_PENALTY = 0.75;
    public static final double WEAKNESS_MULTIPLIER = 1.5;
    public static final double RESISTANCE_MULTIPLIER = 0.5;
    public static final double FOREST_COVER_MULTIPLIER = 0.5;

    private final GameConfig config;

    public CombatCalculator(GameConfig config) {
        this.config = config;
    }

    /**
     * Base damage of an element, before spell power and modifiers.
     */
    public int getBaseSpellDamage(SpellElement element) {
        return config.getSpellDamage(element);
    }

    /**
     * Product of all situational modifiers for one spell hit.
     *
     * @param element        element being cast
     * @param casterOnWater  caster is standing on a water tile
     * @param targetOnWater  target is standing on a water tile
     * @param weakness       target weakness, may be null
     * @param resistance     target resistance, may be null
     */
    public double calculateSpellMultiplier(SpellElement element, boolean casterOnWater, boolean targetOnWater,
                                           SpellElement weakness, SpellElement resistance) {
        double multiplier = 1.0;
        if (casterOnWater && element == SpellElement.WATER) {
            multiplier *= CASTER_WATER_BONUS;
        }
        if (targetOnWater && element == SpellElement.FIRE) {
            multiplier *= TARGET_WATER_FIRE_PENALTY;
        }
        if (weakness != null && weakness == element) {
            multiplier *= WEAKNESS_MULTIPLIER;
        }
        if (resistance != null && resistance == element) {
            multiplier *= RESISTANCE_MULTIPLIER;
        }
        return multiplier;
    }

    /**
     * Final damage one spell hit deals to one target.
     */
    public int calculateSpellDamage(SpellElement element, int spellPower, boolean casterOnWater,
                                    boolean targetOnWater, SpellElement weakness, SpellElement resistance) {
        double raw = getBaseSpellDamage(element) + spellPower;
        raw *= calculateSpellMultiplier(element, casterOnWater, targetOnWater, weakness, resistance);
        return (int) Math.round(raw);
    }

    public int calculateSpellDamage(SpellElement element, int spellPower, boolean casterOnWater,
                                    boolean targetOnWater, Enemy target) {
        return calculateSpellDamage(element, spellPower, casterOnWater, targetOnWater,
            target.getWeakness(), target.getResistance());
    }

    /**
     * Damage of a standard (non-stomp) enemy attack.
     *
     * @param type            attacker type
     * @param targetInForest  the target stands on a forest tile
     * @param nearbyGoblins   other goblins within the swarm radius of the attacker
     */
    public int calculateEnemyAttackDamage(EnemyType type, boolean targetInForest, int nearbyGoblins) {
        double damage = config.getEnemyStats(type).damage();
        if (type == EnemyType.ARCHER && targetInForest) {
            damage *= FOREST_COVER_MULTIPLIER;
        }
        int total = (int) Math.round(damage);
        if (type == EnemyType.GOBLIN) {
            total += config.getGoblinSwarmBonus() * nearbyGoblins;
        }
        return total;
    }

    /**
     * Count goblins other than the attacker within the swarm radius (Manhattan).
     */
    public int countNearbyGoblins(Enemy attacker, List<Enemy> enemies) {
        int count = 0;
        for (Enemy other : enemies) {
            if (other.getId().equals(attacker.getId())) continue;
            if (other.getType() != EnemyType.GOBLIN) continue;
            if (other.getPosition().distanceTo(attacker.getPosition()) <= config.getSwarmRadius()) {
                count++;
            }
        }
        return count;
    }

    public int getOgreStompDamage() {
        return config.getOgreStompDamage();
    }

    public int getMinionDamage() {
        return config.getMinionDamage();
    }
}
