package com.example.spellgrid;

import com.example.spellgrid.combat.CombatCalculator;
import com.example.spellgrid.combat.CombatResolver;
import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.engine.WorkingState;
import com.example.spellgrid.model.EnemyType;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.spell.SpellContext;
import com.example.spellgrid.spell.SpellElement;
import com.example.spellgrid.spell.SpellRegistry;
import com.example.spellgrid.spell.SpellShape;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the shape-to-handler registry and the non-damaging handlers.
 */
@DisplayName("Spell Registry Tests")
public class SpellRegistryTest {

    private final GameConfig config = GameConfig.defaults();
    private final SpellRegistry registry =
        SpellRegistry.withDefaults(config, new CombatResolver(config, new CombatCalculator(config)));

    @ParameterizedTest
    @EnumSource(SpellShape.class)
    @DisplayName("Every shape has a handler")
    void everyShapeRegistered(SpellShape shape) {
        assertTrue(registry.exists(shape));
        assertNotNull(registry.get(shape));
    }

    @Test
    @DisplayName("Area shapes share one handler")
    void areaShapesShareHandler() {
        assertSame(registry.get(SpellShape.BALL), registry.get(SpellShape.CONE));
        assertSame(registry.get(SpellShape.BALL), registry.get(SpellShape.WALL));
        assertNotSame(registry.get(SpellShape.BALL), registry.get(SpellShape.SELF));
        assertEquals(SpellShape.values().length, registry.getAll().size());
    }

    @Test
    @DisplayName("Null shapes and handlers are ignored")
    void nullsIgnored() {
        SpellRegistry empty = new SpellRegistry();
        empty.register(null, ctx -> true);
        empty.register(SpellShape.BALL, null);
        assertFalse(empty.exists(SpellShape.BALL));
        assertFalse(empty.exists(null));
        assertNull(empty.get(null));
        assertTrue(empty.getAll().isEmpty());
    }

    @Test
    @DisplayName("Self heal is clamped to max health")
    void selfHealClamped() {
        WorkingState ws = StateFixture.create().player(p -> p.health(95)).working();
        assertTrue(registry.get(SpellShape.SELF)
            .cast(new SpellContext(ws, SpellElement.FIRE, SpellShape.SELF, Position.of(0, 0), Set.of())));
        assertEquals(100, ws.getPlayer().getHealth());
    }

    @Test
    @DisplayName("Raise dead refuses a corpse with someone standing on it")
    void raiseDeadOccupied() {
        WorkingState ws = StateFixture.create()
            .corpse("c", EnemyType.GOBLIN, 4, 4)
            .enemy(EnemyType.GOBLIN, "g", 4, 4)
            .working();
        assertFalse(registry.get(SpellShape.RAISE_DEAD)
            .cast(new SpellContext(ws, SpellElement.FIRE, SpellShape.RAISE_DEAD, Position.of(4, 4), Set.of())));
        assertEquals(1, ws.getCorpses().size());
        assertTrue(ws.getMinions().isEmpty());
    }

    @Test
    @DisplayName("Two summons in one turn get distinct ids")
    void summonIds() {
        WorkingState ws = StateFixture.create().working();
        registry.get(SpellShape.SUMMON)
            .cast(new SpellContext(ws, SpellElement.FIRE, SpellShape.SUMMON, Position.of(2, 2), Set.of()));
        registry.get(SpellShape.SUMMON)
            .cast(new SpellContext(ws, SpellElement.FIRE, SpellShape.SUMMON, Position.of(3, 2), Set.of()));

        assertEquals("minion_1", ws.getMinions().get(0).getId());
        assertEquals("minion_1_2", ws.getMinions().get(1).getId());
    }
}
