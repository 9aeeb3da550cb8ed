package com.example.spellgrid.effect;

import com.example.spellgrid.engine.WorkingState;
import com.example.spellgrid.model.Enemy;
import com.example.spellgrid.model.StatusEffect;
import com.example.spellgrid.model.StatusEffectType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Status phase: each enemy takes the damage of its active effects (burn
 * ticks for a fixed amount, frozen deals none), every duration drops by one,
 * and expired effects are removed.
 *
 * Only enemies carry status effects; minions never do.
 */
public class StatusEffectProcessor {

    private static final Logger logger = LoggerFactory.getLogger(StatusEffectProcessor.class);

    public void process(WorkingState ws) {
        List<Enemy> next = new ArrayList<>(ws.getEnemies().size());
        for (Enemy e : ws.getEnemies()) {
            next.add(tick(e, ws));
        }
        ws.setEnemies(next);
        ws.collectDefeatedEnemies();
    }

    Enemy tick(Enemy enemy, WorkingState ws) {
        if (enemy.getStatusEffects().isEmpty()) {
            return enemy;
        }
        int damage = 0;
        List<StatusEffect> remaining = new ArrayList<>();
        for (StatusEffect effect : enemy.getStatusEffects()) {
            damage += damageOf(effect, ws);
            StatusEffect ticked = effect.tick();
            if (ticked.isExpired()) {
                logger.debug("{} wore off {}", effect.type(), enemy.getId());
            } else {
                remaining.add(ticked);
            }
        }
        if (damage > 0) {
            ws.log("%s burns for %d damage.", enemy.getName(), damage);
        }
        return enemy.withHealth(enemy.getHealth() - damage).withStatusEffects(remaining);
    }

    private int damageOf(StatusEffect effect, WorkingState ws) {
        if (effect.type() == StatusEffectType.BURN) {
            return ws.getConfig().getBurnDamage();
        }
        return 0;
    }
}
