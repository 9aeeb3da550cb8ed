package com.example.spellgrid.combat;

import com.example.spellgrid.engine.WorkingState;
import com.example.spellgrid.model.Direction;
import com.example.spellgrid.model.Enemy;
import com.example.spellgrid.model.Minion;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.model.TileType;
import com.example.spellgrid.spell.SpellGeometry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Air-spell knockback: each struck enemy is shoved one tile directly away
 * from the caster along the dominant axis (vertical on a tie).
 *
 * A shove only lands on an in-bounds EMPTY tile that no other enemy holds at
 * that moment (the player's and minions' tiles are never valid either).
 * Enemies are processed in roster order and the occupancy set follows each
 * accepted shove, so two pushed enemies never meet.
 */
public final class Pushback {

    private Pushback() {}

    /**
     * Tile one step away from the caster, or null if enemy and caster share a tile.
     */
    public static Position destination(Position caster, Position enemy) {
        int dx = enemy.x() - caster.x();
        int dy = enemy.y() - caster.y();
        if (dx == 0 && dy == 0) return null;
        Direction away = SpellGeometry.dominantDirection(dx, dy);
        return enemy.step(away);
    }

    /**
     * Apply pushback to the surviving enemies whose ids are listed.
     */
    public static List<CombatResult> apply(WorkingState ws, Set<String> struckIds, Position caster) {
        List<CombatResult> results = new ArrayList<>();
        Set<Position> occupied = new HashSet<>();
        occupied.add(ws.getPlayerPosition());
        for (Minion m : ws.getMinions()) {
            occupied.add(m.getPosition());
        }
        for (Enemy e : ws.getEnemies()) {
            occupied.add(e.getPosition());
        }

        List<Enemy> next = new ArrayList<>(ws.getEnemies().size());
        for (Enemy e : ws.getEnemies()) {
            if (!struckIds.contains(e.getId()) || e.isDefeated()) {
                next.add(e);
                continue;
            }
            Position dest = destination(caster, e.getPosition());
            if (dest != null && ws.inBounds(dest) && ws.tileAt(dest) == TileType.EMPTY && !occupied.contains(dest)) {
                occupied.remove(e.getPosition());
                occupied.add(dest);
                next.add(e.withPosition(dest));
                ws.log("%s is blown back to %s.", e.getName(), dest);
                results.add(CombatResult.pushed(e.getId()));
            } else {
                next.add(e);
                results.add(CombatResult.blocked(e.getId()));
            }
        }
        ws.setEnemies(next);
        return results;
    }
}
