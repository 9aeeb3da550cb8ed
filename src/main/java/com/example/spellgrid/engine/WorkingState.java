package com.example.spellgrid.engine;

import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.model.Corpse;
import com.example.spellgrid.model.Enemy;
import com.example.spellgrid.model.GameState;
import com.example.spellgrid.model.GameStatus;
import com.example.spellgrid.model.Grid;
import com.example.spellgrid.model.Item;
import com.example.spellgrid.model.Minion;
import com.example.spellgrid.model.Player;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.model.TerrainEffect;
import com.example.spellgrid.model.TileType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable copy of a {@link GameState} that one action works on. Every phase
 * of the turn pipeline edits this copy; {@link #toSnapshot()} commits it as
 * the next immutable state. Nothing outside the engine ever sees it.
 */
public class WorkingState {

    private final GameConfig config;

    private final Grid.Builder grid;
    private final Player.Builder player;
    private List<Enemy> enemies;
    private List<Minion> minions;
    private final Map<Position, Item> items;
    private final Map<Position, Corpse> corpses;
    private final Map<Position, TerrainEffect> terrain;

    /** Enemies defeated this turn, in order of death, at the tile they died on. */
    private final List<Enemy> defeated = new ArrayList<>();
    private final List<String> messages = new ArrayList<>();

    private GameStatus status;
    private final int wave;
    private int turn;
    private int spawnCounter;

    public WorkingState(GameState state, GameConfig config) {
        this.config = config;
        this.grid = state.getGrid().toBuilder();
        this.player = state.getPlayer().toBuilder();
        this.enemies = new ArrayList<>(state.getEnemies());
        this.minions = new ArrayList<>(state.getMinions());
        this.items = new LinkedHashMap<>(state.getItemsOnGrid());
        this.corpses = new LinkedHashMap<>(state.getCorpses());
        this.terrain = new LinkedHashMap<>(state.getTerrainEffects());
        this.status = state.getStatus();
        this.wave = state.getWave();
        this.turn = state.getTurn();
    }

    public GameConfig getConfig() { return config; }
    public Grid.Builder getGrid() { return grid; }
    public Player.Builder getPlayer() { return player; }
    public List<Enemy> getEnemies() { return enemies; }
    public List<Minion> getMinions() { return minions; }
    public Map<Position, Item> getItems() { return items; }
    public Map<Position, Corpse> getCorpses() { return corpses; }
    public Map<Position, TerrainEffect> getTerrain() { return terrain; }
    public List<Enemy> getDefeated() { return defeated; }
    public List<String> getMessages() { return messages; }
    public GameStatus getStatus() { return status; }
    public int getWave() { return wave; }
    public int getTurn() { return turn; }

    public void setEnemies(List<Enemy> enemies) { this.enemies = new ArrayList<>(enemies); }
    public void setMinions(List<Minion> minions) { this.minions = new ArrayList<>(minions); }
    public void setStatus(GameStatus status) { this.status = status; }

    public void advanceTurn() {
        turn++;
    }

    public Position getPlayerPosition() {
        return player.getPosition();
    }

    public TileType tileAt(Position p) {
        return grid.tileAt(p);
    }

    public boolean inBounds(Position p) {
        return grid.inBounds(p);
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

    /** True if the player, an enemy or a minion stands on the tile. */
    public boolean isOccupied(Position p) {
        return p.equals(player.getPosition()) || enemyAt(p) != null || minionAt(p) != null;
    }

    /**
     * Move every enemy at or below zero health from the roster to the
     * defeated list. Called once per phase after that phase's damage.
     */
    public void collectDefeatedEnemies() {
        List<Enemy> survivors = new ArrayList<>(enemies.size());
        for (Enemy e : enemies) {
            if (e.isDefeated()) {
                defeated.add(e);
                log("%s is defeated!", e.getName());
            } else {
                survivors.add(e);
            }
        }
        enemies = survivors;
    }

    /**
     * Id for an entity created this turn. Turn numbers only increase until a
     * restart clears the board, so ids never collide.
     */
    public String nextSpawnId(String prefix) {
        spawnCounter++;
        return prefix + "_" + (turn + 1) + (spawnCounter > 1 ? "_" + spawnCounter : "");
    }

    public void log(String format, Object... args) {
        messages.add(args.length == 0 ? format : String.format(format, args));
    }

    public void addMessage(String message) {
        messages.add(message);
    }

    /** Commit this working copy as an immutable snapshot. */
    public GameState toSnapshot() {
        return new GameState(grid.build(), player.build(), enemies, minions, items, corpses, terrain,
            status, wave, turn, messages);
    }
}
