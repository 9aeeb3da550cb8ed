package com.example.spellgrid.spell;

import com.example.spellgrid.model.Direction;
import com.example.spellgrid.model.Position;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Maps a spell shape and target to the set of tiles it covers.
 *
 * <ul>
 *   <li>BALL, SUMMON, RAISE_DEAD: the target tile only</li>
 *   <li>SELF: no tiles</li>
 *   <li>CONE: one tile directly ahead of the caster plus three tiles two steps
 *       ahead (left, centre, right), pointing along the dominant axis towards the
 *       target, or along the caster's facing when targeting its own tile</li>
 *   <li>WALL: the 3x3 block centred on the target</li>
 * </ul>
 * Every result is clipped to the grid.
 */
public final class SpellGeometry {

    private SpellGeometry() {}

    public static Set<Position> affectedTiles(SpellShape shape, Position target, Position caster,
                                              Direction facing, int gridSize) {
        if (shape == null || target == null) return Collections.emptySet();

        Set<Position> tiles = new LinkedHashSet<>();
        switch (shape) {
            case BALL:
            case SUMMON:
            case RAISE_DEAD:
                addIfValid(tiles, target, gridSize);
                break;
            case SELF:
                break;
            case CONE:
                addCone(tiles, caster, coneDirection(caster, target, facing), gridSize);
                break;
            case WALL:
                for (int dx = -1; dx <= 1; dx++) {
                    for (int dy = -1; dy <= 1; dy++) {
                        addIfValid(tiles, target.offset(dx, dy), gridSize);
                    }
                }
                break;
            default:
                break;
        }
        return tiles;
    }

    /**
     * Direction a cone points. Ties between the axes go to the vertical one.
     */
    public static Direction coneDirection(Position caster, Position target, Direction facing) {
        int dx = target.x() - caster.x();
        int dy = target.y() - caster.y();
        if (dx == 0 && dy == 0) {
            return facing;
        }
        return dominantDirection(dx, dy);
    }

    /**
     * Direction along the axis with the larger delta; vertical on a tie.
     * (dx, dy) must not both be zero.
     */
    public static Direction dominantDirection(int dx, int dy) {
        if (Math.abs(dx) > Math.abs(dy)) {
            return dx > 0 ? Direction.RIGHT : Direction.LEFT;
        }
        return dy > 0 ? Direction.DOWN : Direction.UP;
    }

    private static void addCone(Set<Position> tiles, Position caster, Direction dir, int gridSize) {
        // (fx, fy) points forward, (sx, sy) sideways
        int fx = dir.getDx();
        int fy = dir.getDy();
        int sx = fy;
        int sy = fx;
        addIfValid(tiles, caster.offset(fx, fy), gridSize);
        addIfValid(tiles, caster.offset(2 * fx - sx, 2 * fy - sy), gridSize);
        addIfValid(tiles, caster.offset(2 * fx, 2 * fy), gridSize);
        addIfValid(tiles, caster.offset(2 * fx + sx, 2 * fy + sy), gridSize);
    }

    private static void addIfValid(Set<Position> tiles, Position p, int gridSize) {
        if (p.x() >= 0 && p.x() < gridSize && p.y() >= 0 && p.y() < gridSize) {
            tiles.add(p);
        }
    }
}
