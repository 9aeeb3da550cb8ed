package com.example.spellgrid.progression;

import com.example.spellgrid.model.EnemyType;
import com.example.spellgrid.spell.SpellElement;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Static table from wave number to the enemies spawned for that wave.
 */
public final class WaveRoster {

    private final Map<Integer, List<EnemySpawn>> waves;
    private final int firstWave;

    public WaveRoster(Map<Integer, List<EnemySpawn>> waves) {
        if (waves == null || waves.isEmpty()) {
            throw new IllegalStateException("A wave roster needs at least one wave");
        }
        TreeMap<Integer, List<EnemySpawn>> copy = new TreeMap<>();
        for (Map.Entry<Integer, List<EnemySpawn>> e : waves.entrySet()) {
            copy.put(e.getKey(), List.copyOf(e.getValue()));
        }
        this.waves = Collections.unmodifiableMap(copy);
        this.firstWave = copy.firstKey();
    }

    /** The three built-in waves. */
    public static WaveRoster defaults() {
        Map<Integer, List<EnemySpawn>> w = new TreeMap<>();
        w.put(1, List.of(
            EnemySpawn.of(EnemyType.GOBLIN, 5, 5),
            EnemySpawn.of(EnemyType.GOBLIN, 8, 2)));
        w.put(2, List.of(
            EnemySpawn.of(EnemyType.GOBLIN, 9, 9),
            EnemySpawn.of(EnemyType.GOBLIN, 11, 9),
            EnemySpawn.of(EnemyType.ARCHER, 14, 6).weakTo(SpellElement.AIR)));
        w.put(3, List.of(
            EnemySpawn.of(EnemyType.OGRE, 12, 12).resists(SpellElement.FIRE),
            EnemySpawn.of(EnemyType.GOBLIN, 6, 12),
            EnemySpawn.of(EnemyType.GOBLIN, 7, 13),
            EnemySpawn.of(EnemyType.ARCHER, 17, 3).weakTo(SpellElement.FIRE)));
        return new WaveRoster(w);
    }

    public boolean hasWave(int wave) {
        return waves.containsKey(wave);
    }

    /** Spawns for a wave, or an empty list if the wave is not defined. */
    public List<EnemySpawn> getSpawns(int wave) {
        return waves.getOrDefault(wave, Collections.emptyList());
    }

    public int getFirstWave() {
        return firstWave;
    }

    public int size() {
        return waves.size();
    }
}
