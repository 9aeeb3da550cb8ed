package com.example.spellgrid.engine;

import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.config.GameConfigLoader;
import com.example.spellgrid.config.WaveRosterLoader;
import com.example.spellgrid.model.Direction;
import com.example.spellgrid.model.GameState;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.progression.WaveRoster;
import com.example.spellgrid.spell.SpellElement;
import com.example.spellgrid.spell.SpellShape;
import com.example.spellgrid.util.RandomSource;
import com.example.spellgrid.util.SeededRandomSource;

import java.util.Objects;
import java.util.Set;

/**
 * Entry point for the rendering and input layers. Owns the single current
 * {@link GameState}; each call runs to completion and replaces it with the
 * next snapshot. Callers only ever read the snapshots.
 *
 * Not thread-safe: drive it from one thread.
 */
public class TurnEngine {

    private final PlayerActions actions;
    private GameState state;

    public TurnEngine(GameConfig config, WaveRoster roster, RandomSource random) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(roster, "roster");
        Objects.requireNonNull(random, "random");

        this.actions = PlayerActions.create(config, roster, random);
        this.state = actions.restart();
    }

    /**
     * Engine configured from the classpath resources (spellgrid.yaml, waves.yaml),
     * with an unseeded random source.
     */
    public static TurnEngine fromClasspath() {
        return fromClasspath(new SeededRandomSource());
    }

    public static TurnEngine fromClasspath(RandomSource random) {
        return new TurnEngine(
            GameConfigLoader.loadFromYamlResource(GameConfigLoader.DEFAULT_RESOURCE),
            WaveRosterLoader.loadFromYamlResource(WaveRosterLoader.DEFAULT_RESOURCE),
            random);
    }

    public GameState getState() {
        return state;
    }

    public GameState move(Direction direction) {
        return commit(actions.move(state, direction));
    }

    public GameState dash(Direction direction) {
        return commit(actions.dash(state, direction));
    }

    public GameState useItem(String itemId) {
        return commit(actions.useItem(state, itemId));
    }

    public GameState focus() {
        return commit(actions.focus(state));
    }

    /** Same as {@link #focus()}. */
    public GameState waitTurn() {
        return focus();
    }

    public GameState castSpellAt(int x, int y) {
        return commit(actions.castSpellAt(state, x, y));
    }

    public GameState selectElement(SpellElement element) {
        return commit(actions.selectElement(state, element));
    }

    public GameState selectSpellShape(SpellShape shape) {
        return commit(actions.selectSpellShape(state, shape));
    }

    public GameState restart() {
        return commit(actions.restart());
    }

    /** Preview of the tiles the current loadout covers; does not change state. */
    public Set<Position> affectedTiles(Position target) {
        return actions.affectedTiles(state, target);
    }

    private GameState commit(GameState next) {
        this.state = next;
        return next;
    }
}
