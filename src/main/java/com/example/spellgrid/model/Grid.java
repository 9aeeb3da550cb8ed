package com.example.spellgrid.model;

import java.util.Arrays;

/**
 * Square tile-type matrix. Pure storage plus bounds checks; no game rules.
 * Immutable; edits go through {@link Builder}.
 */
public final class Grid {

    private final int size;
    private final TileType[][] tiles; // [y][x]

    private Grid(int size, TileType[][] tiles) {
        this.size = size;
        this.tiles = tiles;
    }

    /** A grid of the given size filled with {@link TileType#EMPTY}. */
    public static Grid empty(int size) {
        return new Builder(size).build();
    }

    public int getSize() { return size; }

    public boolean inBounds(Position p) {
        return p != null && inBounds(p.x(), p.y());
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < size && y >= 0 && y < size;
    }

    /**
     * Tile at the given coordinate.
     * @throws IndexOutOfBoundsException if the coordinate is off the grid
     */
    public TileType tileAt(Position p) {
        return tileAt(p.x(), p.y());
    }

    public TileType tileAt(int x, int y) {
        if (!inBounds(x, y)) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside grid of size " + size);
        }
        return tiles[y][x];
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid)) return false;
        Grid other = (Grid) o;
        return size == other.size && Arrays.deepEquals(tiles, other.tiles);
    }

    @Override
    public int hashCode() {
        return 31 * size + Arrays.deepHashCode(tiles);
    }

    /**
     * Mutable working copy of a grid.
     */
    public static final class Builder {
        private final int size;
        private final TileType[][] tiles;

        public Builder(int size) {
            if (size <= 0) throw new IllegalArgumentException("Grid size must be positive: " + size);
            this.size = size;
            this.tiles = new TileType[size][size];
            for (TileType[] row : tiles) {
                Arrays.fill(row, TileType.EMPTY);
            }
        }

        private Builder(Grid grid) {
            this.size = grid.size;
            this.tiles = new TileType[size][];
            for (int y = 0; y < size; y++) {
                tiles[y] = Arrays.copyOf(grid.tiles[y], size);
            }
        }

        public int getSize() { return size; }

        public boolean inBounds(Position p) {
            return p != null && p.x() >= 0 && p.x() < size && p.y() >= 0 && p.y() < size;
        }

        public TileType tileAt(Position p) {
            if (!inBounds(p)) {
                throw new IndexOutOfBoundsException(p + " outside grid of size " + size);
            }
            return tiles[p.y()][p.x()];
        }

        public Builder set(Position p, TileType type) {
            if (!inBounds(p)) {
                throw new IndexOutOfBoundsException(p + " outside grid of size " + size);
            }
            tiles[p.y()][p.x()] = type;
            return this;
        }

        public Grid build() {
            TileType[][] copy = new TileType[size][];
            for (int y = 0; y < size; y++) {
                copy[y] = Arrays.copyOf(tiles[y], size);
            }
            return new Grid(size, copy);
        }
    }
}
