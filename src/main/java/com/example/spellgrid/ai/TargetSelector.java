package com.example.spellgrid.ai;

import com.example.spellgrid.model.Enemy;
import com.example.spellgrid.model.Minion;
import com.example.spellgrid.model.Position;

import java.util.List;

/**
 * Nearest-target selection by Manhattan distance. Earlier roster entries win
 * ties.
 */
public final class TargetSelector {

    private TargetSelector() {}

    /**
     * What an enemy has decided to go after.
     *
     * @param minion   the targeted minion, or null when the target is the player
     * @param position where the target stands
     * @param distance Manhattan distance from the attacker
     */
    public record Target(Minion minion, Position position, int distance) {
        public boolean isPlayer() {
            return minion == null;
        }
    }

    /**
     * Nearest enemy to a position, or null if there are none.
     */
    public static Enemy nearestEnemy(Position from, List<Enemy> enemies) {
        Enemy best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (Enemy e : enemies) {
            int d = from.distanceTo(e.getPosition());
            if (d < bestDistance) {
                best = e;
                bestDistance = d;
            }
        }
        return best;
    }

    /**
     * Target for an enemy: the player by default, replaced by a minion only
     * when that minion is strictly closer.
     */
    public static Target enemyTarget(Enemy enemy, Position playerPosition, List<Minion> minions) {
        Position from = enemy.getPosition();
        Target best = new Target(null, playerPosition, from.distanceTo(playerPosition));
        for (Minion m : minions) {
            int d = from.distanceTo(m.getPosition());
            if (d < best.distance()) {
                best = new Target(m, m.getPosition(), d);
            }
        }
        return best;
    }
}
