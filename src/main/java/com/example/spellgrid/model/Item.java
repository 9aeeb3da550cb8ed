package com.example.spellgrid.model;

/**
 * A consumable. Lives either in the player's inventory or on the grid, never both.
 */
public record Item(String id, ItemType type) {
}
