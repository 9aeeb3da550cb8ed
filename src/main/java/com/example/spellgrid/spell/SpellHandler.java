package com.example.spellgrid.spell;

/**
 * Functional interface for spell implementations. Implementations perform
 * the spell's effect on the context's working state and report whether it
 * took effect. A handler that returns false must leave the working state
 * untouched; the caster pays no mana and spends no turn.
 */
@FunctionalInterface
public interface SpellHandler {
    /**
     * Execute the spell.
     * @param ctx caster state, target and covered tiles
     * @return true if the spell executed successfully
     */
    boolean cast(SpellContext ctx);
}
