package com.example.spellgrid.model;

/**
 * The four movement/facing directions. Y grows downward.
 */
public enum Direction {
    UP(0, -1),
    DOWN(0, 1),
    LEFT(-1, 0),
    RIGHT(1, 0);

    private final int dx;
    private final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public int getDx() { return dx; }
    public int getDy() { return dy; }

    /**
     * Parse a direction name (case-insensitive). Accepts the full names
     * plus the single-letter shortcuts u/d/l/r.
     * @return the direction, or null if the string is not recognised
     */
    public static Direction fromString(String s) {
        if (s == null) return null;
        switch (s.trim().toLowerCase()) {
            case "up": case "u": case "north": return UP;
            case "down": case "d": case "south": return DOWN;
            case "left": case "l": case "west": return LEFT;
            case "right": case "r": case "east": return RIGHT;
            default: return null;
        }
    }
}
