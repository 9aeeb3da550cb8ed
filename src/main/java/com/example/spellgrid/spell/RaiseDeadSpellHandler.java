package com.example.spellgrid.spell;

import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.engine.WorkingState;
import com.example.spellgrid.model.Corpse;
import com.example.spellgrid.model.Minion;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.model.TileType;

/**
 * Consumes the corpse on the target tile and raises an undead minion of the
 * corpse's type in its place. Fails when there is no corpse, or when an
 * enemy or minion is standing on it.
 */
public class RaiseDeadSpellHandler implements SpellHandler {

    private final GameConfig config;

    public RaiseDeadSpellHandler(GameConfig config) {
        this.config = config;
    }

    @Override
    public boolean cast(SpellContext ctx) {
        WorkingState ws = ctx.getState();
        Position target = ctx.getTarget();
        Corpse corpse = ws.getCorpses().get(target);
        if (corpse == null || ws.enemyAt(target) != null || ws.minionAt(target) != null) {
            return false;
        }
        ws.getCorpses().remove(target);
        ws.getGrid().set(target, TileType.EMPTY);
        Minion minion = new Minion(ws.nextSpawnId("undead"), target, corpse.sourceType(), config.getMinionHealth());
        ws.getMinions().add(minion);
        ws.log("The %s corpse rises to serve you.", corpse.sourceType().getKey());
        return true;
    }
}
