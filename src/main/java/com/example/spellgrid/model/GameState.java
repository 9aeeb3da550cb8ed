package com.example.spellgrid.model;

import com.example.spellgrid.spell.SpellElement;
import com.example.spellgrid.spell.SpellShape;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One immutable snapshot of the whole game. The turn engine produces a new
 * snapshot per resolved action; renderers only read it.
 */
public final class GameState {

    private final Grid grid;
    private final Player player;
    private final List<Enemy> enemies;
    private final List<Minion> minions;
    private final Map<Position, Item> itemsOnGrid;
    private final Map<Position, Corpse> corpses;
    private final Map<Position, TerrainEffect> terrainEffects;
    private final GameStatus status;
    private final int wave;
    private final int turn;
    private final List<String> messages;

    public GameState(Grid grid, Player player, List<Enemy> enemies, List<Minion> minions,
                     Map<Position, Item> itemsOnGrid, Map<Position, Corpse> corpses,
                     Map<Position, TerrainEffect> terrainEffects,
                     GameStatus status, int wave, int turn, List<String> messages) {
        this.grid = grid;
        this.player = player;
        this.enemies = List.copyOf(enemies);
        this.minions = List.copyOf(minions);
        this.itemsOnGrid = Collections.unmodifiableMap(new LinkedHashMap<>(itemsOnGrid));
        this.corpses = Collections.unmodifiableMap(new LinkedHashMap<>(corpses));
        this.terrainEffects = Collections.unmodifiableMap(new LinkedHashMap<>(terrainEffects));
        this.status = status;
        this.wave = wave;
        this.turn = turn;
        this.messages = List.copyOf(messages);
    }

    public Grid getGrid() { return grid; }
    public int getGridSize() { return grid.getSize(); }
    public Player getPlayer() { return player; }
    public List<Enemy> getEnemies() { return enemies; }
    public List<Minion> getMinions() { return minions; }
    public Map<Position, Item> getItemsOnGrid() { return itemsOnGrid; }
    public Map<Position, Corpse> getCorpses() { return corpses; }
    public Map<Position, TerrainEffect> getTerrainEffects() { return terrainEffects; }
    public GameStatus getStatus() { return status; }
    public int getWave() { return wave; }
    /** Number of turns resolved since the last restart. */
    public int getTurn() { return turn; }
    /** Combat messages produced by the action that created this snapshot. */
    public List<String> getMessages() { return messages; }

    public boolean isPlaying() {
        return status == GameStatus.PLAYING;
    }

    public SpellElement getSelectedElement() { return player.getSelectedElement(); }
    public SpellShape getSelectedShape() { return player.getSelectedShape(); }
    public Direction getPlayerFacing() { return player.getFacing(); }

    public Enemy findEnemy(String id) {
        for (Enemy e : enemies) {
            if (e.getId().equals(id)) return e;
        }
        return null;
    }

    public Enemy enemyAt(Position p) {
        for (Enemy e : enemies) {
            if (e.getPosition().equals(p)) return e;
        }
        return null;
    }

    public Minion minionAt(Position p) {
        for (Minion m : minions) {
            if (m.getPosition().equals(p)) return m;
        }
        return null;
    }

    @Override
    public String toString() {
        return "GameState[wave=" + wave + ", turn=" + turn + ", status=" + status + ", " + player
            + ", enemies=" + enemies.size() + ", minions=" + minions.size() + "]";
    }
}
