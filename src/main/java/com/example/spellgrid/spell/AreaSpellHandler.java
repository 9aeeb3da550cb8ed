package com.example.spellgrid.spell;

import com.example.spellgrid.combat.CombatResolver;

/**
 * Ball, cone and wall: elemental damage on every enemy inside the covered
 * tiles. Always succeeds, even when nothing is hit.
 */
public class AreaSpellHandler implements SpellHandler {

    private final CombatResolver resolver;

    public AreaSpellHandler(CombatResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public boolean cast(SpellContext ctx) {
        if (ctx.getAffectedTiles().isEmpty()) {
            ctx.getState().log("Your %s %s fizzles against the edge of the world.",
                ctx.getElement().getKey(), ctx.getShape().getKey());
            return true;
        }
        resolver.resolveAreaSpell(ctx.getState(), ctx.getElement(), ctx.getShape(), ctx.getAffectedTiles());
        ctx.getState().collectDefeatedEnemies();
        return true;
    }
}
