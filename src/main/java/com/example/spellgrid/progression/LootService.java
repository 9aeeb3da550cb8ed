package com.example.spellgrid.progression;

import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.engine.WorkingState;
import com.example.spellgrid.model.Corpse;
import com.example.spellgrid.model.Direction;
import com.example.spellgrid.model.Enemy;
import com.example.spellgrid.model.Item;
import com.example.spellgrid.model.ItemType;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.model.TileType;
import com.example.spellgrid.util.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Loot and xp phase. The enemies defeated this turn are handled together:
 * <ol>
 *   <li>each leaves a corpse on the tile it died on (replacing any item there);</li>
 *   <li>then, in order of death, each drops a random potion with the configured
 *       chance on a random EMPTY, unoccupied orthogonal neighbour (nothing drops
 *       if there is none);</li>
 * </ol>
 * then the summed xp of all kills is granted in one award.
 *
 * All corpses are down before any drop is placed, so a potion never lands on
 * a tile that a later kill of the same turn turns into a corpse.
 *
 * Random draws per enemy, in order: drop roll, potion type, neighbour shuffle.
 */
public class LootService {

    private static final Logger logger = LoggerFactory.getLogger(LootService.class);

    private final GameConfig config;
    private final ProgressionService progression;

    public LootService(GameConfig config, ProgressionService progression) {
        this.config = config;
        this.progression = progression;
    }

    public void process(WorkingState ws, RandomSource random) {
        List<Enemy> defeated = ws.getDefeated();
        if (defeated.isEmpty()) return;

        int totalXp = 0;
        for (Enemy enemy : defeated) {
            Position at = enemy.getPosition();
            ws.getItems().remove(at);
            ws.getGrid().set(at, TileType.CORPSE);
            ws.getCorpses().put(at, new Corpse(enemy.getId(), at, enemy.getType()));
            totalXp += enemy.getXpValue();
        }
        for (Enemy enemy : defeated) {
            if (random.chance(config.getLootDropChance())) {
                dropPotion(ws, enemy.getPosition(), random);
            }
        }
        defeated.clear();

        ws.log("You gain %d experience.", totalXp);
        progression.grantXp(ws.getPlayer(), totalXp, ws::addMessage);
    }

    private void dropPotion(WorkingState ws, Position origin, RandomSource random) {
        ItemType[] types = ItemType.values();
        ItemType type = types[random.nextInt(types.length)];

        List<Position> candidates = new ArrayList<>(4);
        for (Direction d : Direction.values()) {
            Position p = origin.step(d);
            if (ws.inBounds(p) && ws.tileAt(p) == TileType.EMPTY && !ws.isOccupied(p)) {
                candidates.add(p);
            }
        }
        random.shuffle(candidates);
        if (candidates.isEmpty()) {
            logger.debug("No room to drop loot around {}", origin);
            return;
        }

        Position at = candidates.get(0);
        Item item = new Item(ws.nextSpawnId("loot"), type);
        ws.getItems().put(at, item);
        ws.getGrid().set(at, TileType.ITEM);
        ws.log("A %s drops at %s.", type.getDisplayName(), at);
    }
}
