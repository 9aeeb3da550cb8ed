package com.example.spellgrid.model;

/**
 * Integer grid coordinate. Used as the key of every positional overlay
 * (items, corpses, terrain effects), so equality is structural.
 */
public record Position(int x, int y) {

    public static Position of(int x, int y) {
        return new Position(x, y);
    }

    public Position step(Direction direction) {
        return new Position(x + direction.getDx(), y + direction.getDy());
    }

    public Position offset(int dx, int dy) {
        return new Position(x + dx, y + dy);
    }

    /** Manhattan distance: |dx| + |dy|. */
    public int distanceTo(Position other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    /** True if other lies in the 3x3 block centred on this position (itself included). */
    public boolean isWithinOneStep(Position other) {
        return Math.abs(x - other.x) <= 1 && Math.abs(y - other.y) <= 1;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
