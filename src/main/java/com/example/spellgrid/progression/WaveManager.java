package com.example.spellgrid.progression;

import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.config.ItemPlacement;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the battlefield for a wave and moves the game from one wave to the
 * next once the current roster is empty.
 */
public class WaveManager {

    private static final Logger logger = LoggerFactory.getLogger(WaveManager.class);

    private final GameConfig config;
    private final WaveRoster roster;
    private final ProgressionService progression;

    public WaveManager(GameConfig config, WaveRoster roster, ProgressionService progression) {
        this.config = config;
        this.roster = roster;
        this.progression = progression;
    }

    /**
     * A brand new game: fresh player, first wave.
     */
    public GameState initialState() {
        Player player = Player.fresh(config.getPlayerStart(), config.getPlayerHealth(),
            config.getPlayerMana(), progression.xpToNextLevel(1));
        int wave = roster.getFirstWave();
        logger.info("New game: wave {} with {} enemies", wave, roster.getSpawns(wave).size());
        return buildWave(player, wave, 0, List.of("Wave " + wave + " begins."));
    }

    /**
     * Static terrain with the default item placements on top.
     */
    public Grid buildGrid() {
        Grid.Builder grid = new Grid.Builder(config.getGridSize());
        setAll(grid, config.getObstacles(), TileType.OBSTACLE);
        setAll(grid, config.getWater(), TileType.WATER);
        setAll(grid, config.getForest(), TileType.FOREST);
        for (ItemPlacement placement : config.getDefaultItems()) {
            if (grid.inBounds(placement.position())) {
                grid.set(placement.position(), TileType.ITEM);
            }
        }
        return grid.build();
    }

    /**
     * Wave check, run after a turn is committed. If the roster is empty and
     * the game is still on, either the next wave starts or the game is won.
     * Otherwise the state is returned unchanged.
     */
    public GameState checkWaveComplete(GameState state) {
        if (state.getStatus() != GameStatus.PLAYING || !state.getEnemies().isEmpty()) {
            return state;
        }

        List<String> messages = new ArrayList<>(state.getMessages());
        messages.add("Wave " + state.getWave() + " cleared!");
        int nextWave = state.getWave() + 1;

        if (!roster.hasWave(nextWave)) {
            logger.info("Final wave {} cleared: victory after {} turns", state.getWave(), state.getTurn());
            messages.add("Victory! Every wave has been defeated.");
            return new GameState(state.getGrid(), state.getPlayer(), state.getEnemies(), state.getMinions(),
                state.getItemsOnGrid(), state.getCorpses(), state.getTerrainEffects(),
                GameStatus.VICTORY, state.getWave(), state.getTurn(), messages);
        }

        logger.info("Wave {} cleared, starting wave {}", state.getWave(), nextWave);
        messages.add("Wave " + nextWave + " begins.");
        Player player = state.getPlayer().toBuilder().position(config.getPlayerStart()).build();
        return buildWave(player, nextWave, state.getTurn(), messages);
    }

    private GameState buildWave(Player player, int wave, int turn, List<String> messages) {
        List<Enemy> enemies = new ArrayList<>();
        int n = 0;
        for (EnemySpawn spawn : roster.getSpawns(wave)) {
            n++;
            enemies.add(spawn.toEnemy("enemy_" + wave + "_" + n, config.getEnemyStats(spawn.type())));
        }

        // Potions kept from an earlier wave may still sit in the inventory, so ids carry the wave.
        Grid grid = buildGrid();
        Map<Position, Item> items = new LinkedHashMap<>();
        for (ItemPlacement placement : config.getDefaultItems()) {
            if (grid.inBounds(placement.position())) {
                items.put(placement.position(), new Item(placement.id() + "_w" + wave, placement.type()));
            }
        }

        return new GameState(grid, player, enemies, Collections.<Minion>emptyList(), items,
            Collections.<Position, Corpse>emptyMap(), Collections.<Position, TerrainEffect>emptyMap(),
            GameStatus.PLAYING, wave, turn, messages);
    }

    private static void setAll(Grid.Builder grid, List<Position> positions, TileType type) {
        for (Position p : positions) {
            if (grid.inBounds(p)) {
                grid.set(p, type);
            } else {
                logger.warn("Ignoring {} tile outside the grid at {}", type, p);
            }
        }
    }
}
