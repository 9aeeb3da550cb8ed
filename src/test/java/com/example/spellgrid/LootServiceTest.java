package com.example.spellgrid;

import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.engine.WorkingState;
import com.example.spellgrid.model.Corpse;
import com.example.spellgrid.model.EnemyType;
import com.example.spellgrid.model.Item;
import com.example.spellgrid.model.ItemType;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.model.TileType;
import com.example.spellgrid.progression.LootService;
import com.example.spellgrid.progression.ProgressionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for corpses, potion drops and xp awarded for defeated enemies.
 */
@DisplayName("Loot Service Tests")
public class LootServiceTest {

    private final GameConfig config = GameConfig.defaults();
    private final LootService loot = new LootService(config, new ProgressionService(config));

    private static WorkingState withDefeatedGoblin(StateFixture fixture, int x, int y) {
        WorkingState ws = fixture.working();
        ws.getDefeated().add(StateFixture.enemyOf(EnemyType.GOBLIN, "enemy_1_1", x, y).withHealth(0));
        return ws;
    }

    @Test
    @DisplayName("A defeated enemy leaves a corpse and grants its xp")
    void corpseAndXp() {
        WorkingState ws = withDefeatedGoblin(StateFixture.create(), 5, 5);
        loot.process(ws, ScriptedRandom.neverDrops());

        Position at = Position.of(5, 5);
        assertEquals(TileType.CORPSE, ws.tileAt(at));
        assertEquals(new Corpse("enemy_1_1", at, EnemyType.GOBLIN), ws.getCorpses().get(at));
        assertEquals(25, ws.getPlayer().getXp());
        assertTrue(ws.getDefeated().isEmpty());
        assertTrue(ws.getItems().isEmpty());
        assertTrue(ws.getMessages().contains("You gain 25 experience."));
    }

    @Test
    @DisplayName("A successful roll drops the chosen potion on a free neighbour")
    void potionDrops() {
        WorkingState ws = withDefeatedGoblin(StateFixture.create(), 5, 5);
        loot.process(ws, new ScriptedRandom().doubles(0.1).ints(1));

        Position up = Position.of(5, 4);
        Item item = ws.getItems().get(up);
        assertNotNull(item);
        assertEquals(ItemType.MANA_POTION, item.type());
        assertEquals("loot_1", item.id());
        assertEquals(TileType.ITEM, ws.tileAt(up));
    }

    @Test
    @DisplayName("Shuffled candidates decide which neighbour gets the drop")
    void shuffledPlacement() {
        WorkingState ws = withDefeatedGoblin(StateFixture.create(), 5, 5);
        loot.process(ws, new ScriptedRandom().doubles(0.0).ints(0).reverseOnShuffle());

        assertEquals(ItemType.HEALTH_POTION, ws.getItems().get(Position.of(6, 5)).type());
    }

    @Test
    @DisplayName("Only empty tiles can take a drop")
    void noRoomNoDrop() {
        StateFixture fixture = StateFixture.create()
            .tile(5, 4, TileType.OBSTACLE)
            .tile(5, 6, TileType.WATER)
            .tile(4, 5, TileType.FOREST)
            .corpse("old", EnemyType.ARCHER, 6, 5);
        WorkingState ws = withDefeatedGoblin(fixture, 5, 5);
        loot.process(ws, new ScriptedRandom().doubles(0.0));

        assertTrue(ws.getItems().isEmpty());
        assertEquals(2, ws.getCorpses().size());
    }

    @Test
    @DisplayName("Corpses of the same turn are placed before any potion drops")
    void corpsesBeforeDrops() {
        WorkingState ws = StateFixture.create().working();
        ws.getDefeated().add(StateFixture.enemyOf(EnemyType.GOBLIN, "enemy_1_1", 5, 5).withHealth(0));
        ws.getDefeated().add(StateFixture.enemyOf(EnemyType.GOBLIN, "enemy_1_2", 5, 4).withHealth(0));

        loot.process(ws, new ScriptedRandom().doubles(0.1).ints(0));

        assertEquals(TileType.CORPSE, ws.tileAt(Position.of(5, 4)));
        assertEquals(1, ws.getItems().size());
        assertEquals(ItemType.HEALTH_POTION, ws.getItems().get(Position.of(5, 6)).type());
        assertTrue(ws.getMessages().contains("A health potion drops at (5, 6)."));
        assertTrue(ws.getMessages().contains("You gain 50 experience."));
    }

    @Test
    @DisplayName("Drops skip tiles held by the player, enemies or minions")
    void dropsAvoidOccupiedTiles() {
        StateFixture fixture = StateFixture.create()
            .playerAt(5, 4)
            .minion("minion_1", 5, 6)
            .enemy(EnemyType.ARCHER, "enemy_1_2", 4, 5);
        WorkingState ws = withDefeatedGoblin(fixture, 5, 5);
        loot.process(ws, new ScriptedRandom().doubles(0.0).ints(0));

        assertEquals(1, ws.getItems().size());
        assertEquals(ItemType.HEALTH_POTION, ws.getItems().get(Position.of(6, 5)).type());
    }

    @Test
    @DisplayName("A corpse replaces an item lying under the enemy")
    void corpseReplacesItem() {
        StateFixture fixture = StateFixture.create().item("item_1", ItemType.HEALTH_POTION, 5, 5);
        WorkingState ws = withDefeatedGoblin(fixture, 5, 5);
        loot.process(ws, ScriptedRandom.neverDrops());

        assertFalse(ws.getItems().containsKey(Position.of(5, 5)));
        assertEquals(TileType.CORPSE, ws.tileAt(Position.of(5, 5)));
    }

    @Test
    @DisplayName("Xp from a kill can level the player up")
    void killLevelsUp() {
        WorkingState ws = withDefeatedGoblin(StateFixture.create().player(p -> p.xp(90)), 5, 5);
        loot.process(ws, ScriptedRandom.neverDrops());

        assertEquals(2, ws.getPlayer().getLevel());
        assertEquals(15, ws.getPlayer().getXp());
        assertTrue(ws.getMessages().contains("You reached level 2!"));
    }

    @Test
    @DisplayName("Nothing happens without defeated enemies")
    void nothingDefeated() {
        WorkingState ws = StateFixture.create().working();
        loot.process(ws, new ScriptedRandom().doubles(0.0));
        assertTrue(ws.getMessages().isEmpty());
        assertTrue(ws.getCorpses().isEmpty());
    }
}
