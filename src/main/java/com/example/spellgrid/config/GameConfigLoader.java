package com.example.spellgrid.config;

import com.example.spellgrid.model.EnemyType;
import com.example.spellgrid.model.ItemType;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.spell.SpellElement;
import com.example.spellgrid.spell.SpellShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.example.spellgrid.config.YamlValues.getDouble;
import static com.example.spellgrid.config.YamlValues.getInt;
import static com.example.spellgrid.config.YamlValues.getMap;
import static com.example.spellgrid.config.YamlValues.getMapList;
import static com.example.spellgrid.config.YamlValues.getPosition;
import static com.example.spellgrid.config.YamlValues.getPositionList;
import static com.example.spellgrid.config.YamlValues.getString;

/**
 * Loads {@link GameConfig} from YAML. Every key is optional; anything absent
 * keeps its built-in default.
 *
 * <pre>
 * grid_size: 20
 * player: { start: [0, 0], health: 100, mana: 100 }
 * dash: { mana_cost: 20, distance: 3, cooldown: 5 }
 * spell:
 *   cost: { ball: 10, cone: 15 }
 *   damage: { fire: 30 }
 * enemies:
 *   goblin: { health: 50, range: 1, damage: 10, xp: 25 }
 * </pre>
 */
public class GameConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(GameConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "/spellgrid.yaml";

    /**
     * Load configuration from a classpath resource. A missing resource or a
     * parse failure yields the defaults.
     */
    public static GameConfig loadFromYamlResource(String resourcePath) {
        try (InputStream in = GameConfigLoader.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.warn("No game config found at {}, using defaults", resourcePath);
                return GameConfig.defaults();
            }
            Map<String, Object> root = new Yaml().load(in);
            GameConfig config = fromMap(root);
            logger.info("Loaded game config from {} (grid {}x{})", resourcePath, config.getGridSize(), config.getGridSize());
            return config;
        } catch (Exception e) {
            logger.warn("Failed to load game config from {}, using defaults: {}", resourcePath, e.getMessage());
            return GameConfig.defaults();
        }
    }

    /** Parse configuration from YAML text. */
    public static GameConfig parse(String yamlText) {
        Map<String, Object> root = new Yaml().load(yamlText);
        return fromMap(root);
    }

    static GameConfig fromMap(Map<String, Object> root) {
        GameConfig.Builder b = GameConfig.builder();
        if (root == null) {
            return b.build();
        }
        GameConfig d = GameConfig.defaults();

        b.gridSize(getInt(root, "grid_size", d.getGridSize()));

        Map<String, Object> player = getMap(root, "player");
        b.playerStart(getPosition(player, "start", d.getPlayerStart()));
        b.playerHealth(getInt(player, "health", d.getPlayerHealth()));
        b.playerMana(getInt(player, "mana", d.getPlayerMana()));

        Map<String, Object> dash = getMap(root, "dash");
        b.dashManaCost(getInt(dash, "mana_cost", d.getDashManaCost()));
        b.dashDistance(getInt(dash, "distance", d.getDashDistance()));
        b.dashCooldown(getInt(dash, "cooldown", d.getDashCooldown()));

        Map<String, Object> potion = getMap(root, "potion");
        b.potionHeal(getInt(potion, "heal", d.getPotionHeal()));
        b.potionMana(getInt(potion, "mana", d.getPotionMana()));

        Map<String, Object> regen = getMap(root, "regen");
        b.manaRegen(getInt(regen, "mana", d.getManaRegen()));
        b.focusManaRegen(getInt(regen, "focus_mana", d.getFocusManaRegen()));

        Map<String, Object> spell = getMap(root, "spell");
        b.selfHeal(getInt(spell, "self_heal", d.getSelfHeal()));
        Map<String, Object> costs = getMap(spell, "cost");
        for (SpellShape shape : SpellShape.values()) {
            b.spellCost(shape, getInt(costs, shape.getKey(), d.getSpellCost(shape)));
        }
        Map<String, Object> damage = getMap(spell, "damage");
        for (SpellElement element : SpellElement.values()) {
            b.spellDamage(element, getInt(damage, element.getKey(), d.getSpellDamage(element)));
        }

        Map<String, Object> status = getMap(root, "status");
        b.burnDuration(getInt(status, "burn_duration", d.getBurnDuration()));
        b.burnDamage(getInt(status, "burn_damage", d.getBurnDamage()));
        b.frozenDuration(getInt(status, "frozen_duration", d.getFrozenDuration()));

        Map<String, Object> terrain = getMap(root, "terrain");
        b.burningTerrainDuration(getInt(terrain, "burning_duration", d.getBurningTerrainDuration()));
        b.burningTerrainDamage(getInt(terrain, "burning_damage", d.getBurningTerrainDamage()));
        List<Position> obstacles = getPositionList(terrain, "obstacles");
        if (obstacles != null) b.obstacles(obstacles);
        List<Position> water = getPositionList(terrain, "water");
        if (water != null) b.water(water);
        List<Position> forest = getPositionList(terrain, "forest");
        if (forest != null) b.forest(forest);

        Map<String, Object> minion = getMap(root, "minion");
        b.minionHealth(getInt(minion, "health", d.getMinionHealth()));
        b.minionDamage(getInt(minion, "damage", d.getMinionDamage()));

        Map<String, Object> enemies = getMap(root, "enemies");
        for (EnemyType type : EnemyType.values()) {
            EnemyStats def = d.getEnemyStats(type);
            Map<String, Object> e = getMap(enemies, type.getKey());
            b.enemyStats(type, new EnemyStats(
                getInt(e, "health", def.health()),
                getInt(e, "range", def.attackRange()),
                getInt(e, "damage", def.damage()),
                getInt(e, "xp", def.xpValue())));
        }

        Map<String, Object> combat = getMap(root, "combat");
        b.ogreStompDamage(getInt(combat, "ogre_stomp_damage", d.getOgreStompDamage()));
        b.goblinSwarmBonus(getInt(combat, "goblin_swarm_bonus", d.getGoblinSwarmBonus()));
        b.swarmRadius(getInt(combat, "swarm_radius", d.getSwarmRadius()));

        Map<String, Object> loot = getMap(root, "loot");
        b.lootDropChance(getDouble(loot, "drop_chance", d.getLootDropChance()));

        Map<String, Object> progression = getMap(root, "progression");
        b.xpBase(getInt(progression, "xp_base", d.getXpBase()));
        b.xpMultiplier(getDouble(progression, "xp_multiplier", d.getXpMultiplier()));

        if (root.containsKey("items")) {
            List<ItemPlacement> items = new ArrayList<>();
            for (Map<String, Object> itemData : getMapList(root, "items")) {
                String id = getString(itemData, "id");
                ItemType type = ItemType.fromString(getString(itemData, "type"));
                Position at = getPosition(itemData, "at", null);
                if (id == null || type == null || at == null) {
                    logger.warn("Skipping incomplete item placement: {}", itemData);
                    continue;
                }
                items.add(new ItemPlacement(id, type, at));
            }
            b.defaultItems(items);
        }

        return b.build();
    }
}
