package com.example.spellgrid.ai;

import com.example.spellgrid.combat.CombatCalculator;
import com.example.spellgrid.engine.WorkingState;
import com.example.spellgrid.model.Enemy;
import com.example.spellgrid.model.Minion;
import com.example.spellgrid.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Minion phase. Each minion, in roster order, goes after the nearest enemy:
 * adjacent means attack (and stay put), otherwise one chase step.
 *
 * The occupancy set starts with the player, every enemy and every minion;
 * a minion that steps releases its old tile. A killed enemy keeps its tile
 * claimed until the phase ends, since its corpse will lie there.
 */
public class MinionBehavior {

    private static final Logger logger = LoggerFactory.getLogger(MinionBehavior.class);

    private final CombatCalculator calculator;

    public MinionBehavior(CombatCalculator calculator) {
        this.calculator = calculator;
    }

    public void process(WorkingState ws) {
        if (ws.getEnemies().isEmpty() || ws.getMinions().isEmpty()) {
            return;
        }

        Set<Position> occupied = new HashSet<>();
        occupied.add(ws.getPlayerPosition());
        for (Enemy e : ws.getEnemies()) occupied.add(e.getPosition());
        for (Minion m : ws.getMinions()) occupied.add(m.getPosition());

        List<Minion> next = new ArrayList<>(ws.getMinions().size());
        for (Minion minion : ws.getMinions()) {
            Enemy target = TargetSelector.nearestEnemy(minion.getPosition(), ws.getEnemies());
            if (target == null) {
                next.add(minion);
                continue;
            }

            int distance = minion.getPosition().distanceTo(target.getPosition());
            if (distance == 1) {
                attack(ws, minion, target);
                next.add(minion);
            } else {
                Position to = StepMovement.tryStep(ws, occupied, minion.getPosition(), target.getPosition());
                if (!to.equals(minion.getPosition())) {
                    logger.debug("{} moves {} -> {}", minion.getId(), minion.getPosition(), to);
                }
                next.add(minion.withPosition(to));
            }
        }
        ws.setMinions(next);
    }

    private void attack(WorkingState ws, Minion minion, Enemy target) {
        int damage = calculator.getMinionDamage();
        List<Enemy> enemies = ws.getEnemies();
        for (int i = 0; i < enemies.size(); i++) {
            if (enemies.get(i).getId().equals(target.getId())) {
                enemies.set(i, target.withHealth(target.getHealth() - damage));
                break;
            }
        }
        ws.log("%s strikes %s for %d damage.", minion.getName(), target.getName(), damage);
        if (target.getHealth() - damage <= 0) {
            ws.collectDefeatedEnemies();
        }
    }
}
