package com.example.spellgrid.progression;

import com.example.spellgrid.config.EnemyStats;
import com.example.spellgrid.model.Enemy;
import com.example.spellgrid.model.EnemyType;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.spell.SpellElement;

import java.util.Collections;

/**
 * One roster entry: which enemy appears where, with its elemental affinity.
 * Weakness and resistance are never both set.
 */
public record EnemySpawn(EnemyType type, Position position, SpellElement weakness, SpellElement resistance) {

    public EnemySpawn {
        if (weakness != null && resistance != null) {
            throw new IllegalArgumentException("A spawn may have a weakness or a resistance, not both");
        }
    }

    public static EnemySpawn of(EnemyType type, int x, int y) {
        return new EnemySpawn(type, Position.of(x, y), null, null);
    }

    public EnemySpawn weakTo(SpellElement element) {
        return new EnemySpawn(type, position, element, null);
    }

    public EnemySpawn resists(SpellElement element) {
        return new EnemySpawn(type, position, null, element);
    }

    public Enemy toEnemy(String id, EnemyStats stats) {
        return new Enemy(id, position, type, stats.health(), stats.attackRange(),
            weakness, resistance, Collections.emptyList(), stats.xpValue());
    }
}
