package com.example.spellgrid.config;

import com.example.spellgrid.model.EnemyType;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.progression.EnemySpawn;
import com.example.spellgrid.progression.WaveRoster;
import com.example.spellgrid.spell.SpellElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.example.spellgrid.config.YamlValues.getInt;
import static com.example.spellgrid.config.YamlValues.getMapList;
import static com.example.spellgrid.config.YamlValues.getPosition;
import static com.example.spellgrid.config.YamlValues.getString;

/**
 * Loads the wave table from YAML:
 *
 * <pre>
 * waves:
 *   - wave: 1
 *     enemies:
 *       - { type: goblin, at: [5, 5] }
 *       - { type: archer, at: [14, 6], weakness: air }
 * </pre>
 */
public class WaveRosterLoader {

    private static final Logger logger = LoggerFactory.getLogger(WaveRosterLoader.class);

    public static final String DEFAULT_RESOURCE = "/waves.yaml";

    /**
     * Load waves from a classpath resource, falling back to the built-in
     * waves when the resource is missing.
     *
     * @throws IllegalStateException if the resource exists but defines no usable wave
     */
    public static WaveRoster loadFromYamlResource(String resourcePath) {
        Map<String, Object> root;
        try (InputStream in = WaveRosterLoader.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.warn("No wave table found at {}, using built-in waves", resourcePath);
                return WaveRoster.defaults();
            }
            root = new Yaml().load(in);
        } catch (Exception e) {
            logger.warn("Failed to read wave table from {}, using built-in waves: {}", resourcePath, e.getMessage());
            return WaveRoster.defaults();
        }
        WaveRoster roster = fromMap(root);
        logger.info("Loaded {} wave(s) from {}", roster.size(), resourcePath);
        return roster;
    }

    public static WaveRoster parse(String yamlText) {
        Map<String, Object> root = new Yaml().load(yamlText);
        return fromMap(root);
    }

    static WaveRoster fromMap(Map<String, Object> root) {
        Map<Integer, List<EnemySpawn>> waves = new TreeMap<>();
        for (Map<String, Object> waveData : getMapList(root, "waves")) {
            int number = getInt(waveData, "wave", -1);
            if (number < 1) {
                logger.warn("Skipping wave without a valid number: {}", waveData);
                continue;
            }
            List<EnemySpawn> spawns = new ArrayList<>();
            for (Map<String, Object> enemyData : getMapList(waveData, "enemies")) {
                EnemySpawn spawn = toSpawn(enemyData);
                if (spawn != null) spawns.add(spawn);
            }
            if (spawns.isEmpty()) {
                logger.warn("Skipping wave {} with no enemies", number);
                continue;
            }
            waves.put(number, spawns);
        }
        if (waves.isEmpty()) {
            throw new IllegalStateException("Wave table defines no waves");
        }
        return new WaveRoster(waves);
    }

    private static EnemySpawn toSpawn(Map<String, Object> data) {
        EnemyType type = EnemyType.fromString(getString(data, "type"));
        Position at = getPosition(data, "at", null);
        if (type == null || at == null) {
            logger.warn("Skipping malformed enemy entry: {}", data);
            return null;
        }
        SpellElement weakness = SpellElement.fromString(getString(data, "weakness"));
        SpellElement resistance = SpellElement.fromString(getString(data, "resistance"));
        if (weakness != null && resistance != null) {
            logger.warn("Enemy entry {} has both weakness and resistance; keeping the weakness", data);
            resistance = null;
        }
        return new EnemySpawn(type, at, weakness, resistance);
    }
}
