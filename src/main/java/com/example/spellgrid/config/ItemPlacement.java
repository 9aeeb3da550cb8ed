package com.example.spellgrid.config;

import com.example.spellgrid.model.ItemType;
import com.example.spellgrid.model.Position;

/** A potion placed on the grid at wave start. */
public record ItemPlacement(String id, ItemType type, Position position) {
}
