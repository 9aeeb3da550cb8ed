package com.example.spellgrid;

import com.example.spellgrid.combat.CombatCalculator;
import com.example.spellgrid.combat.CombatResolver;
import com.example.spellgrid.combat.CombatResult;
import com.example.spellgrid.combat.Pushback;
import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.engine.WorkingState;
import com.example.spellgrid.model.Direction;
import com.example.spellgrid.model.Enemy;
import com.example.spellgrid.model.EnemyType;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.model.StatusEffect;
import com.example.spellgrid.model.StatusEffectType;
import com.example.spellgrid.model.TerrainEffectType;
import com.example.spellgrid.model.TileType;
import com.example.spellgrid.spell.SpellContext;
import com.example.spellgrid.spell.SpellElement;
import com.example.spellgrid.spell.SpellGeometry;
import com.example.spellgrid.spell.SpellRegistry;
import com.example.spellgrid.spell.SpellShape;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for area spell resolution: damage, status riders, pushback and fire walls.
 */
@DisplayName("Combat Resolver Tests")
public class CombatResolverTest {

    private final GameConfig config = GameConfig.defaults();
    private final CombatResolver resolver = new CombatResolver(config, new CombatCalculator(config));

    private static Set<Position> ball(int x, int y) {
        return Set.of(Position.of(x, y));
    }

    @Test
    @DisplayName("Fire ball damages and sets a burn")
    void fireBallBurns() {
        WorkingState ws = StateFixture.create().enemy(EnemyType.GOBLIN, "g", 3, 6).working();

        List<CombatResult> results = resolver.resolveAreaSpell(ws, SpellElement.FIRE, SpellShape.BALL, ball(3, 6));

        Enemy goblin = ws.getEnemies().get(0);
        assertEquals(20, goblin.getHealth());
        assertEquals(List.of(new StatusEffect(StatusEffectType.BURN, 3)), goblin.getStatusEffects());
        assertEquals(1, results.size());
        assertEquals(CombatResult.ResultType.HIT, results.get(0).getType());
        assertEquals(30, results.get(0).getDamage());
    }

    @Test
    @DisplayName("Reapplying a status refreshes it instead of stacking")
    void statusRefreshes() {
        Enemy burning = StateFixture.withStatus(StateFixture.enemyOf(EnemyType.GOBLIN, "g", 3, 6),
            new StatusEffect(StatusEffectType.BURN, 1));
        WorkingState ws = StateFixture.create().enemy(burning).working();

        resolver.resolveAreaSpell(ws, SpellElement.FIRE, SpellShape.BALL, ball(3, 6));

        assertEquals(List.of(new StatusEffect(StatusEffectType.BURN, 3)), ws.getEnemies().get(0).getStatusEffects());
    }

    @Test
    @DisplayName("Water freezes and keeps an existing burn")
    void waterFreezes() {
        Enemy burning = StateFixture.withStatus(StateFixture.enemyOf(EnemyType.GOBLIN, "g", 3, 6),
            new StatusEffect(StatusEffectType.BURN, 2));
        WorkingState ws = StateFixture.create().enemy(burning).working();

        resolver.resolveAreaSpell(ws, SpellElement.WATER, SpellShape.BALL, ball(3, 6));

        Enemy goblin = ws.getEnemies().get(0);
        assertEquals(25, goblin.getHealth());
        assertTrue(goblin.hasStatus(StatusEffectType.BURN));
        assertTrue(goblin.hasStatus(StatusEffectType.FROZEN));
    }

    @ParameterizedTest
    @EnumSource(value = SpellElement.class, names = {"EARTH", "AIR"})
    @DisplayName("Earth and air carry no status rider")
    void noStatusRider(SpellElement element) {
        WorkingState ws = StateFixture.create().enemy(EnemyType.OGRE, "o", 3, 6).working();
        resolver.resolveAreaSpell(ws, element, SpellShape.BALL, ball(3, 6));
        assertTrue(ws.getEnemies().get(0).getStatusEffects().isEmpty());
    }

    @Test
    @DisplayName("Enemies outside the covered tiles are untouched")
    void missesOutsideTiles() {
        WorkingState ws = StateFixture.create().enemy(EnemyType.GOBLIN, "g", 3, 6).working();
        List<CombatResult> results = resolver.resolveAreaSpell(ws, SpellElement.FIRE, SpellShape.BALL, ball(3, 7));
        assertTrue(results.isEmpty());
        assertEquals(50, ws.getEnemies().get(0).getHealth());
    }

    @Test
    @DisplayName("Caster on water boosts water spells")
    void casterOnWater() {
        WorkingState ws = StateFixture.create().tile(0, 0, TileType.WATER)
            .enemy(EnemyType.GOBLIN, "g", 3, 6).working();
        resolver.resolveAreaSpell(ws, SpellElement.WATER, SpellShape.BALL, ball(3, 6));
        assertEquals(19, ws.getEnemies().get(0).getHealth());
    }

    @Test
    @DisplayName("A kill through the spell handler moves the enemy to the defeated list")
    void killThroughHandler() {
        Enemy weak = StateFixture.enemyOf(EnemyType.GOBLIN, "g", 3, 6).withHealth(10);
        WorkingState ws = StateFixture.create().enemy(weak).enemy(EnemyType.GOBLIN, "far", 15, 15).working();

        SpellRegistry registry = SpellRegistry.withDefaults(config, resolver);
        boolean cast = registry.get(SpellShape.BALL)
            .cast(new SpellContext(ws, SpellElement.FIRE, SpellShape.BALL, Position.of(3, 6), ball(3, 6)));

        assertTrue(cast);
        assertEquals(1, ws.getEnemies().size());
        assertEquals("far", ws.getEnemies().get(0).getId());
        assertEquals(1, ws.getDefeated().size());
        assertEquals("g", ws.getDefeated().get(0).getId());
        assertTrue(ws.getMessages().contains("Goblin g is defeated!"));
    }

    // ==================== Pushback ====================

    @Test
    @DisplayName("Air pushes a surviving enemy one tile away from the caster")
    void airPushes() {
        WorkingState ws = StateFixture.create().playerAt(5, 5).enemy(EnemyType.GOBLIN, "g", 5, 7).working();

        List<CombatResult> results = resolver.resolveAreaSpell(ws, SpellElement.AIR, SpellShape.BALL, ball(5, 7));

        Enemy goblin = ws.getEnemies().get(0);
        assertEquals(35, goblin.getHealth());
        assertEquals(Position.of(5, 8), goblin.getPosition());
        assertTrue(results.stream().anyMatch(r -> r.getType() == CombatResult.ResultType.PUSHED));
    }

    @Test
    @DisplayName("Diagonal pushback breaks the tie vertically")
    void diagonalPushback() {
        assertEquals(Position.of(6, 7), Pushback.destination(Position.of(5, 5), Position.of(6, 6)));
        assertEquals(Position.of(9, 4), Pushback.destination(Position.of(5, 5), Position.of(8, 4)));
        assertNull(Pushback.destination(Position.of(5, 5), Position.of(5, 5)));
    }

    @Test
    @DisplayName("Pushback is cancelled by obstacles and the grid edge")
    void pushbackBlocked() {
        WorkingState ws = StateFixture.create().playerAt(5, 5)
            .tile(5, 8, TileType.OBSTACLE)
            .enemy(EnemyType.GOBLIN, "g1", 5, 7)
            .enemy(EnemyType.GOBLIN, "g2", 5, 19)
            .working();
        Set<Position> tiles = Set.of(Position.of(5, 7), Position.of(5, 19));

        List<CombatResult> results = resolver.resolveAreaSpell(ws, SpellElement.AIR, SpellShape.WALL, tiles);

        assertEquals(Position.of(5, 7), ws.getEnemies().get(0).getPosition());
        assertEquals(Position.of(5, 19), ws.getEnemies().get(1).getPosition());
        assertEquals(2, results.stream().filter(r -> r.getType() == CombatResult.ResultType.BLOCKED).count());
    }

    @Test
    @DisplayName("Pushback never moves an enemy onto an occupied tile")
    void pushbackCollision() {
        WorkingState ws = StateFixture.create().playerAt(5, 5)
            .enemy(EnemyType.GOBLIN, "g1", 5, 7)
            .enemy(EnemyType.GOBLIN, "g2", 5, 8)
            .working();
        Set<Position> tiles = SpellGeometry.affectedTiles(SpellShape.WALL, Position.of(5, 8), Position.of(5, 5),
            Direction.UP, 20);

        resolver.resolveAreaSpell(ws, SpellElement.AIR, SpellShape.WALL, tiles);

        assertEquals(Position.of(5, 7), ws.getEnemies().get(0).getPosition());
        assertEquals(Position.of(5, 9), ws.getEnemies().get(1).getPosition());
    }

    @Test
    @DisplayName("Pushback does not land on a minion")
    void pushbackAvoidsMinions() {
        WorkingState ws = StateFixture.create().playerAt(5, 5)
            .enemy(EnemyType.GOBLIN, "g", 5, 7)
            .minion("m", 5, 8)
            .working();
        resolver.resolveAreaSpell(ws, SpellElement.AIR, SpellShape.BALL, ball(5, 7));
        assertEquals(Position.of(5, 7), ws.getEnemies().get(0).getPosition());
    }

    @Test
    @DisplayName("Enemies killed by the air spell are not pushed")
    void deadEnemiesStay() {
        Enemy weak = StateFixture.enemyOf(EnemyType.GOBLIN, "g", 5, 7).withHealth(10);
        WorkingState ws = StateFixture.create().playerAt(5, 5).enemy(weak).working();

        List<CombatResult> results = resolver.resolveAreaSpell(ws, SpellElement.AIR, SpellShape.BALL, ball(5, 7));

        assertEquals(Position.of(5, 7), ws.getEnemies().get(0).getPosition());
        assertTrue(results.get(0).isKill());
    }

    // ==================== Fire wall ====================

    @Test
    @DisplayName("Fire wall sets burning terrain on every non-obstacle tile")
    void fireWallIgnites() {
        WorkingState ws = StateFixture.create().tile(10, 10, TileType.OBSTACLE).working();
        Set<Position> tiles = SpellGeometry.affectedTiles(SpellShape.WALL, Position.of(10, 10), Position.of(0, 0),
            Direction.UP, 20);

        resolver.resolveAreaSpell(ws, SpellElement.FIRE, SpellShape.WALL, tiles);

        assertEquals(8, ws.getTerrain().size());
        assertFalse(ws.getTerrain().containsKey(Position.of(10, 10)));
        ws.getTerrain().values().forEach(t -> {
            assertEquals(TerrainEffectType.BURNING, t.type());
            assertEquals(3, t.duration());
        });
    }

    @Test
    @DisplayName("Other fire shapes leave the ground alone")
    void fireBallDoesNotIgnite() {
        WorkingState ws = StateFixture.create().working();
        resolver.resolveAreaSpell(ws, SpellElement.FIRE, SpellShape.BALL, ball(10, 10));
        assertTrue(ws.getTerrain().isEmpty());
    }
}
