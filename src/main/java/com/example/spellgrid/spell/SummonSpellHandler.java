package com.example.spellgrid.spell;

import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.engine.WorkingState;
import com.example.spellgrid.model.Minion;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.model.TileType;

/**
 * Summons a generic minion on an empty, unoccupied tile.
 */
public class SummonSpellHandler implements SpellHandler {

    private final GameConfig config;

    public SummonSpellHandler(GameConfig config) {
        this.config = config;
    }

    @Override
    public boolean cast(SpellContext ctx) {
        WorkingState ws = ctx.getState();
        Position target = ctx.getTarget();
        if (!ws.inBounds(target) || ws.tileAt(target) != TileType.EMPTY || ws.isOccupied(target)) {
            return false;
        }
        Minion minion = new Minion(ws.nextSpawnId("minion"), target, null, config.getMinionHealth());
        ws.getMinions().add(minion);
        ws.log("A minion answers your call at %s.", target);
        return true;
    }
}
