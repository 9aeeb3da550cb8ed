package com.example.spellgrid.combat;

import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.engine.WorkingState;
import com.example.spellgrid.model.Enemy;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.model.StatusEffect;
import com.example.spellgrid.model.StatusEffectType;
import com.example.spellgrid.model.TerrainEffect;
import com.example.spellgrid.model.TerrainEffectType;
import com.example.spellgrid.model.TileType;
import com.example.spellgrid.spell.SpellElement;
import com.example.spellgrid.spell.SpellShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves an elemental area spell against the enemies standing in its tiles.
 *
 * Order: damage, then status riders (fire refreshes burn, water refreshes
 * frozen), then air pushback for the survivors. A fire wall also sets its
 * tiles burning. Killed enemies stay in the roster with health at or below
 * zero until the caller collects them.
 */
public class CombatResolver {

    private static final Logger logger = LoggerFactory.getLogger(CombatResolver.class);

    private final GameConfig config;
    private final CombatCalculator calculator;

    public CombatResolver(GameConfig config, CombatCalculator calculator) {
        this.config = config;
        this.calculator = calculator;
    }

    public List<CombatResult> resolveAreaSpell(WorkingState ws, SpellElement element, SpellShape shape,
                                               Set<Position> tiles) {
        List<CombatResult> results = new ArrayList<>();
        Position caster = ws.getPlayerPosition();
        boolean casterOnWater = ws.tileAt(caster) == TileType.WATER;
        int spellPower = ws.getPlayer().getSpellPower();

        Set<String> struck = new LinkedHashSet<>();
        List<Enemy> next = new ArrayList<>(ws.getEnemies().size());
        for (Enemy e : ws.getEnemies()) {
            if (!tiles.contains(e.getPosition())) {
                next.add(e);
                continue;
            }
            boolean targetOnWater = ws.tileAt(e.getPosition()) == TileType.WATER;
            int damage = calculator.calculateSpellDamage(element, spellPower, casterOnWater, targetOnWater, e);
            Enemy hit = applyStatus(e.withHealth(e.getHealth() - damage), element);
            struck.add(e.getId());
            next.add(hit);

            ws.log("Your %s %s hits %s for %d damage.", element.getKey(), shape.getKey(), e.getName(), damage);
            logger.debug("{} {} hit {} for {} (hp {} -> {})", element, shape, e.getId(), damage, e.getHealth(), hit.getHealth());
            results.add(hit.isDefeated() ? CombatResult.death(e.getId(), damage) : CombatResult.hit(e.getId(), damage));
        }
        ws.setEnemies(next);

        if (element == SpellElement.AIR && !struck.isEmpty()) {
            results.addAll(Pushback.apply(ws, struck, caster));
        }
        if (element == SpellElement.FIRE && shape == SpellShape.WALL) {
            ignite(ws, tiles);
        }
        return results;
    }

    /**
     * Refresh (never stack) the element's status rider on a struck enemy.
     */
    Enemy applyStatus(Enemy enemy, SpellElement element) {
        StatusEffectType type;
        int duration;
        if (element == SpellElement.FIRE) {
            type = StatusEffectType.BURN;
            duration = config.getBurnDuration();
        } else if (element == SpellElement.WATER) {
            type = StatusEffectType.FROZEN;
            duration = config.getFrozenDuration();
        } else {
            return enemy;
        }
        List<StatusEffect> effects = new ArrayList<>();
        for (StatusEffect existing : enemy.getStatusEffects()) {
            if (existing.type() != type) effects.add(existing);
        }
        effects.add(new StatusEffect(type, duration));
        return enemy.withStatusEffects(effects);
    }

    private void ignite(WorkingState ws, Set<Position> tiles) {
        for (Position p : tiles) {
            if (ws.tileAt(p) == TileType.OBSTACLE) continue;
            ws.getTerrain().put(p, new TerrainEffect(TerrainEffectType.BURNING, config.getBurningTerrainDuration()));
        }
        logger.debug("Fire wall ignited {} tile(s)", tiles.size());
    }
}
