package com.example.spellgrid.config;

/**
 * Archetype numbers for one enemy type.
 *
 * @param health      starting health
 * @param attackRange Manhattan range within which the enemy attacks instead of moving
 * @param damage      base damage of a standard attack
 * @param xpValue     experience granted when defeated
 */
public record EnemyStats(int health, int attackRange, int damage, int xpValue) {
}
