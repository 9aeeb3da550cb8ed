package com.example.spellgrid;

import com.example.spellgrid.model.Direction;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.spell.SpellGeometry;
import com.example.spellgrid.spell.SpellShape;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the tile footprint of each spell shape.
 */
@DisplayName("Spell Geometry Tests")
public class SpellGeometryTest {

    private static final int SIZE = 20;
    private static final Position CASTER = Position.of(5, 5);

    private static Set<Position> tiles(SpellShape shape, Position target) {
        return SpellGeometry.affectedTiles(shape, target, CASTER, Direction.UP, SIZE);
    }

    @ParameterizedTest
    @EnumSource(value = SpellShape.class, names = {"BALL", "SUMMON", "RAISE_DEAD"})
    @DisplayName("Single-tile shapes cover exactly the target")
    void singleTileShapes(SpellShape shape) {
        assertEquals(Set.of(Position.of(9, 2)), tiles(shape, Position.of(9, 2)));
    }

    @Test
    @DisplayName("Self covers no tiles")
    void selfCoversNothing() {
        assertTrue(tiles(SpellShape.SELF, CASTER).isEmpty());
    }

    @ParameterizedTest
    @EnumSource(SpellShape.class)
    @DisplayName("A null target covers nothing for any shape")
    void nullTargetIsEmpty(SpellShape shape) {
        assertTrue(tiles(shape, null).isEmpty());
    }

    @Test
    @DisplayName("Ball outside the grid covers nothing")
    void ballOffGrid() {
        assertTrue(tiles(SpellShape.BALL, Position.of(20, 3)).isEmpty());
        assertTrue(tiles(SpellShape.BALL, Position.of(-1, 0)).isEmpty());
    }

    // ==================== Wall ====================

    @Test
    @DisplayName("Wall covers the 3x3 block around the target")
    void wallBlock() {
        Set<Position> wall = tiles(SpellShape.WALL, Position.of(10, 10));
        assertEquals(9, wall.size());
        for (int x = 9; x <= 11; x++) {
            for (int y = 9; y <= 11; y++) {
                assertTrue(wall.contains(Position.of(x, y)), "missing " + x + "," + y);
            }
        }
    }

    @Test
    @DisplayName("Wall in a corner is clipped to the grid")
    void wallClippedInCorner() {
        assertEquals(Set.of(Position.of(0, 0), Position.of(1, 0), Position.of(0, 1), Position.of(1, 1)),
            tiles(SpellShape.WALL, Position.of(0, 0)));
        assertEquals(4, tiles(SpellShape.WALL, Position.of(19, 19)).size());
        assertEquals(6, tiles(SpellShape.WALL, Position.of(19, 7)).size());
    }

    // ==================== Cone ====================

    @ParameterizedTest(name = "target ({0},{1}) -> {2}")
    @CsvSource({
        "5, 0, UP",
        "5, 9, DOWN",
        "0, 5, LEFT",
        "12, 6, RIGHT",
        "7, 7, DOWN",
        "3, 3, UP",
        "8, 2, UP",
        "9, 3, RIGHT"
    })
    @DisplayName("Cone points along the dominant axis, vertical on ties")
    void coneDirection(int x, int y, Direction expected) {
        assertEquals(expected, SpellGeometry.coneDirection(CASTER, Position.of(x, y), Direction.LEFT));
    }

    @Test
    @DisplayName("Cone aimed at the caster's own tile uses facing")
    void coneAtSelfUsesFacing() {
        assertEquals(Direction.RIGHT, SpellGeometry.coneDirection(CASTER, CASTER, Direction.RIGHT));
        Set<Position> cone = SpellGeometry.affectedTiles(SpellShape.CONE, CASTER, CASTER, Direction.RIGHT, SIZE);
        assertEquals(Set.of(Position.of(6, 5), Position.of(7, 4), Position.of(7, 5), Position.of(7, 6)), cone);
    }

    @Test
    @DisplayName("Cone upward covers one tile ahead and three two steps ahead")
    void coneUp() {
        assertEquals(Set.of(Position.of(5, 4), Position.of(4, 3), Position.of(5, 3), Position.of(6, 3)),
            tiles(SpellShape.CONE, Position.of(5, 1)));
    }

    @Test
    @DisplayName("Cone downward and leftward")
    void coneDownAndLeft() {
        assertEquals(Set.of(Position.of(5, 6), Position.of(4, 7), Position.of(5, 7), Position.of(6, 7)),
            tiles(SpellShape.CONE, Position.of(5, 15)));
        assertEquals(Set.of(Position.of(4, 5), Position.of(3, 4), Position.of(3, 5), Position.of(3, 6)),
            tiles(SpellShape.CONE, Position.of(1, 6)));
    }

    @Test
    @DisplayName("Cone does not depend on how far away the target is")
    void coneIgnoresRange() {
        assertEquals(tiles(SpellShape.CONE, Position.of(5, 4)), tiles(SpellShape.CONE, Position.of(5, 0)));
    }

    @Test
    @DisplayName("Cone at the grid edge is clipped")
    void coneClipped() {
        Set<Position> cone = SpellGeometry.affectedTiles(SpellShape.CONE, Position.of(0, 0), Position.of(0, 1),
            Direction.UP, SIZE);
        assertEquals(Set.of(Position.of(0, 0)), cone);
    }

    @ParameterizedTest
    @CsvSource({
        "3, 0, RIGHT",
        "-3, 1, LEFT",
        "1, 1, DOWN",
        "-2, -2, UP",
        "0, 4, DOWN"
    })
    @DisplayName("Dominant direction breaks ties vertically")
    void dominantDirection(int dx, int dy, Direction expected) {
        assertEquals(expected, SpellGeometry.dominantDirection(dx, dy));
    }
}
