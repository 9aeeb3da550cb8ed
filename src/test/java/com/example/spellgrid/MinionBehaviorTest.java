package com.example.spellgrid;

import com.example.spellgrid.ai.MinionBehavior;
import com.example.spellgrid.combat.CombatCalculator;
import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.engine.WorkingState;
import com.example.spellgrid.model.EnemyType;
import com.example.spellgrid.model.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the minion phase.
 */
@DisplayName("Minion Behavior Tests")
public class MinionBehaviorTest {

    private final MinionBehavior behavior = new MinionBehavior(new CombatCalculator(GameConfig.defaults()));

    @Test
    @DisplayName("Minions idle when there are no enemies")
    void idleWithoutEnemies() {
        WorkingState ws = StateFixture.create().minion("m", 4, 4).working();
        behavior.process(ws);
        assertEquals(Position.of(4, 4), ws.getMinions().get(0).getPosition());
    }

    @Test
    @DisplayName("An adjacent minion strikes its nearest enemy")
    void minionStrikes() {
        WorkingState ws = StateFixture.create().minion("m", 4, 4).enemy(EnemyType.GOBLIN, "g", 4, 5).working();
        behavior.process(ws);

        assertEquals(40, ws.getEnemies().get(0).getHealth());
        assertEquals(Position.of(4, 4), ws.getMinions().get(0).getPosition());
    }

    @Test
    @DisplayName("A minion steps towards the nearest enemy")
    void minionApproaches() {
        WorkingState ws = StateFixture.create().minion("m", 0, 10)
            .enemy(EnemyType.GOBLIN, "g", 5, 10)
            .enemy(EnemyType.GOBLIN, "h", 0, 17)
            .working();
        behavior.process(ws);
        assertEquals(Position.of(1, 10), ws.getMinions().get(0).getPosition());
    }

    @Test
    @DisplayName("The player blocks a minion's path")
    void playerBlocks() {
        WorkingState ws = StateFixture.create().playerAt(1, 10).minion("m", 0, 10)
            .enemy(EnemyType.GOBLIN, "g", 5, 10).working();
        behavior.process(ws);
        assertEquals(Position.of(0, 10), ws.getMinions().get(0).getPosition());
    }

    @Test
    @DisplayName("A kill collects the enemy and its tile stays claimed for the phase")
    void killKeepsTileClaimed() {
        WorkingState ws = StateFixture.create()
            .enemy(StateFixture.enemyOf(EnemyType.GOBLIN, "g1", 5, 5).withHealth(10))
            .enemy(EnemyType.GOBLIN, "g2", 5, 8)
            .minion("m1", 4, 5)
            .minion("m2", 5, 4)
            .working();
        behavior.process(ws);

        assertEquals(1, ws.getEnemies().size());
        assertEquals("g2", ws.getEnemies().get(0).getId());
        assertEquals("g1", ws.getDefeated().get(0).getId());
        assertEquals(Position.of(5, 4), ws.getMinions().get(1).getPosition());
    }
}
