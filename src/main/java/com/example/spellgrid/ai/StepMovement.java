package com.example.spellgrid.ai;

import com.example.spellgrid.engine.WorkingState;
import com.example.spellgrid.model.Position;

import java.util.Set;

/**
 * Single-step chase movement shared by minions and enemies.
 */
public final class StepMovement {

    private StepMovement() {}

    /**
     * One step from {@code from} towards {@code to} along the axis with the
     * larger distance; on a tie the horizontal axis wins. Returns {@code from}
     * when the two positions coincide.
     */
    public static Position stepToward(Position from, Position to) {
        int dx = to.x() - from.x();
        int dy = to.y() - from.y();
        if (dx == 0 && dy == 0) {
            return from;
        }
        if (Math.abs(dx) >= Math.abs(dy)) {
            return from.offset(Integer.signum(dx), 0);
        }
        return from.offset(0, Integer.signum(dy));
    }

    /**
     * A unit may enter a tile that is on the grid, not an obstacle and not
     * claimed in the occupancy set.
     */
    public static boolean canEnter(WorkingState ws, Set<Position> occupied, Position p) {
        return ws.inBounds(p) && !ws.tileAt(p).blocksUnits() && !occupied.contains(p);
    }

    /**
     * Step towards the target if possible, keeping the occupancy set in sync.
     * @return the unit's position after the attempt
     */
    public static Position tryStep(WorkingState ws, Set<Position> occupied, Position from, Position target) {
        Position step = stepToward(from, target);
        if (step.equals(from) || !canEnter(ws, occupied, step)) {
            return from;
        }
        occupied.remove(from);
        occupied.add(step);
        return step;
    }
}
