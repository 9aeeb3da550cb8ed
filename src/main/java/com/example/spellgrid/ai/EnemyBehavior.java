package com.example.spellgrid.ai;

import com.example.spellgrid.combat.CombatCalculator;
import com.example.spellgrid.engine.WorkingState;
import com.example.spellgrid.model.Enemy;
import com.example.spellgrid.model.EnemyType;
import com.example.spellgrid.model.Minion;
import com.example.spellgrid.model.Player;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.model.StatusEffectType;
import com.example.spellgrid.model.TileType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Enemy phase. Each enemy, in roster order:
 * <ol>
 *   <li>does nothing while frozen (it still holds its tile);</li>
 *   <li>picks the player, or a strictly closer minion;</li>
 *   <li>attacks if the target is within its attack range: an ogre next to its
 *       target stomps everything in its 3x3 neighbourhood, everyone else hits
 *       the single target;</li>
 *   <li>otherwise takes one chase step.</li>
 * </ol>
 * Minions killed here vanish at once and free their tile.
 */
public class EnemyBehavior {

    private static final Logger logger = LoggerFactory.getLogger(EnemyBehavior.class);

    private final CombatCalculator calculator;

    public EnemyBehavior(CombatCalculator calculator) {
        this.calculator = calculator;
    }

    public void process(WorkingState ws) {
        Set<Position> occupied = new HashSet<>();
        occupied.add(ws.getPlayerPosition());
        for (Enemy e : ws.getEnemies()) occupied.add(e.getPosition());
        for (Minion m : ws.getMinions()) occupied.add(m.getPosition());

        List<Enemy> roster = ws.getEnemies();
        for (int i = 0; i < roster.size(); i++) {
            Enemy enemy = roster.get(i);
            if (enemy.hasStatus(StatusEffectType.FROZEN)) {
                ws.log("%s is frozen solid.", enemy.getName());
                continue;
            }

            TargetSelector.Target target = TargetSelector.enemyTarget(enemy, ws.getPlayerPosition(), ws.getMinions());
            if (target.distance() <= enemy.getAttackRange()) {
                if (enemy.getType() == EnemyType.OGRE && target.distance() == 1) {
                    stomp(ws, enemy, occupied);
                } else {
                    attack(ws, enemy, target, roster, occupied);
                }
            } else {
                Position to = StepMovement.tryStep(ws, occupied, enemy.getPosition(), target.position());
                if (!to.equals(enemy.getPosition())) {
                    logger.debug("{} moves {} -> {}", enemy.getId(), enemy.getPosition(), to);
                    roster.set(i, enemy.withPosition(to));
                }
            }
        }
    }

    private void stomp(WorkingState ws, Enemy ogre, Set<Position> occupied) {
        int damage = calculator.getOgreStompDamage();
        Position center = ogre.getPosition();
        ws.log("%s stomps the ground!", ogre.getName());

        Player.Builder player = ws.getPlayer();
        if (center.isWithinOneStep(player.getPosition())) {
            player.health(player.getHealth() - damage);
            ws.log("The shockwave hits you for %d damage.", damage);
        }

        List<Minion> minions = ws.getMinions();
        for (int i = 0; i < minions.size(); i++) {
            Minion m = minions.get(i);
            if (center.isWithinOneStep(m.getPosition())) {
                minions.set(i, m.withHealth(m.getHealth() - damage));
                ws.log("The shockwave hits %s for %d damage.", m.getName(), damage);
            }
        }
        removeFallenMinions(ws, occupied);
    }

    private void attack(WorkingState ws, Enemy enemy, TargetSelector.Target target,
                        List<Enemy> roster, Set<Position> occupied) {
        boolean inForest = ws.tileAt(target.position()) == TileType.FOREST;
        int nearbyGoblins = enemy.getType() == EnemyType.GOBLIN ? calculator.countNearbyGoblins(enemy, roster) : 0;
        int damage = calculator.calculateEnemyAttackDamage(enemy.getType(), inForest, nearbyGoblins);

        if (target.isPlayer()) {
            Player.Builder player = ws.getPlayer();
            player.health(player.getHealth() - damage);
            ws.log("%s attacks you for %d damage.", enemy.getName(), damage);
            return;
        }

        List<Minion> minions = ws.getMinions();
        for (int i = 0; i < minions.size(); i++) {
            Minion m = minions.get(i);
            if (m.getId().equals(target.minion().getId())) {
                minions.set(i, m.withHealth(m.getHealth() - damage));
                ws.log("%s attacks %s for %d damage.", enemy.getName(), m.getName(), damage);
                break;
            }
        }
        removeFallenMinions(ws, occupied);
    }

    private void removeFallenMinions(WorkingState ws, Set<Position> occupied) {
        Iterator<Minion> it = ws.getMinions().iterator();
        while (it.hasNext()) {
            Minion m = it.next();
            if (m.isDefeated()) {
                it.remove();
                occupied.remove(m.getPosition());
                ws.log("%s is destroyed.", m.getName());
            }
        }
    }
}
