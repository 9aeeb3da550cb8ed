package com.example.spellgrid.effect;

import com.example.spellgrid.engine.WorkingState;
import com.example.spellgrid.model.Enemy;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.model.TerrainEffect;
import com.example.spellgrid.model.TerrainEffectType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Terrain phase: burning tiles scorch the player and any enemy standing on
 * them, then every terrain effect ticks down and expired ones are dropped.
 *
 * Minions are not damaged by burning ground.
 */
public class TerrainEffectProcessor {

    private static final Logger logger = LoggerFactory.getLogger(TerrainEffectProcessor.class);

    public void process(WorkingState ws) {
        int damage = ws.getConfig().getBurningTerrainDamage();
        List<Enemy> next = new ArrayList<>(ws.getEnemies());

        Iterator<Map.Entry<Position, TerrainEffect>> it = ws.getTerrain().entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Position, TerrainEffect> entry = it.next();
            Position tile = entry.getKey();
            TerrainEffect effect = entry.getValue();

            if (effect.type() == TerrainEffectType.BURNING) {
                if (tile.equals(ws.getPlayerPosition())) {
                    ws.getPlayer().health(ws.getPlayer().getHealth() - damage);
                    ws.log("The burning ground scorches you for %d damage.", damage);
                }
                for (int i = 0; i < next.size(); i++) {
                    Enemy e = next.get(i);
                    if (e.getPosition().equals(tile)) {
                        next.set(i, e.withHealth(e.getHealth() - damage));
                        ws.log("%s is scorched by the flames for %d damage.", e.getName(), damage);
                    }
                }
            }

            TerrainEffect ticked = effect.tick();
            if (ticked.isExpired()) {
                it.remove();
                logger.debug("Terrain effect {} at {} burned out", effect.type(), tile);
            } else {
                entry.setValue(ticked);
            }
        }

        ws.setEnemies(next);
        ws.collectDefeatedEnemies();
    }
}
