package com.example.spellgrid.model;

/**
 * What a defeated enemy leaves behind. Keeps the enemy's id and type so
 * raise-dead can bring back the right kind of minion.
 */
public record Corpse(String id, Position position, EnemyType sourceType) {
}
