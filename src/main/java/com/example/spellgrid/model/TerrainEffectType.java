package com.example.spellgrid.model;

public enum TerrainEffectType {
    BURNING
}
