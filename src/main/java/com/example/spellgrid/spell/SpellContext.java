package com.example.spellgrid.spell;

import com.example.spellgrid.engine.WorkingState;
import com.example.spellgrid.model.Position;

import java.util.Set;

/**
 * Context passed to spell handlers: the working state being resolved, the
 * active loadout, the targeted tile and the tiles the shape covers.
 */
public class SpellContext {
    private final WorkingState state;
    private final SpellElement element;
    private final SpellShape shape;
    private final Position target;
    private final Set<Position> affectedTiles;

    public SpellContext(WorkingState state, SpellElement element, SpellShape shape,
                        Position target, Set<Position> affectedTiles) {
        this.state = state;
        this.element = element;
        this.shape = shape;
        this.target = target;
        this.affectedTiles = affectedTiles;
    }

    public WorkingState getState() { return state; }
    public SpellElement getElement() { return element; }
    public SpellShape getShape() { return shape; }
    public Position getTarget() { return target; }
    public Set<Position> getAffectedTiles() { return affectedTiles; }
}
