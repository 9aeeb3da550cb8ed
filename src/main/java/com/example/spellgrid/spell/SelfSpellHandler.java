package com.example.spellgrid.spell;

import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.model.Player;

/**
 * Heals the caster, clamped to maximum health.
 */
public class SelfSpellHandler implements SpellHandler {

    private final GameConfig config;

    public SelfSpellHandler(GameConfig config) {
        this.config = config;
    }

    @Override
    public boolean cast(SpellContext ctx) {
        Player.Builder player = ctx.getState().getPlayer();
        int healed = Math.min(player.getHealth() + config.getSelfHeal(), player.getMaxHealth());
        player.health(Math.max(healed, player.getHealth()));
        ctx.getState().log("You mend your wounds. Health: %d/%d.", player.getHealth(), player.getMaxHealth());
        return true;
    }
}
