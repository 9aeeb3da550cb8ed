package com.example.spellgrid.config;

import com.example.spellgrid.model.EnemyType;
import com.example.spellgrid.model.ItemType;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.spell.SpellElement;
import com.example.spellgrid.spell.SpellShape;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Every tunable number of the combat rules, with built-in defaults.
 * Immutable; use {@link #builder()} or {@link GameConfigLoader} to obtain one.
 */
public final class GameConfig {

    private final int gridSize;
    private final Position playerStart;
    private final int playerHealth;
    private final int playerMana;

    private final int dashManaCost;
    private final int dashDistance;
    private final int dashCooldown;

    private final int potionHeal;
    private final int potionMana;

    private final int manaRegen;
    private final int focusManaRegen;

    private final Map<SpellShape, Integer> spellCosts;
    private final Map<SpellElement, Integer> spellDamage;
    private final int selfHeal;

    private final int burnDuration;
    private final int burnDamage;
    private final int frozenDuration;
    private final int burningTerrainDuration;
    private final int burningTerrainDamage;

    private final int minionHealth;
    private final int minionDamage;

    private final Map<EnemyType, EnemyStats> enemyStats;
    private final int ogreStompDamage;
    private final int goblinSwarmBonus;
    private final int swarmRadius;

    private final double lootDropChance;

    private final int xpBase;
    private final double xpMultiplier;

    private final List<Position> obstacles;
    private final List<Position> water;
    private final List<Position> forest;
    private final List<ItemPlacement> defaultItems;

    private GameConfig(Builder b) {
        this.gridSize = b.gridSize;
        this.playerStart = b.playerStart;
        this.playerHealth = b.playerHealth;
        this.playerMana = b.playerMana;
        this.dashManaCost = b.dashManaCost;
        this.dashDistance = b.dashDistance;
        this.dashCooldown = b.dashCooldown;
        this.potionHeal = b.potionHeal;
        this.potionMana = b.potionMana;
        this.manaRegen = b.manaRegen;
        this.focusManaRegen = b.focusManaRegen;
        this.spellCosts = Collections.unmodifiableMap(new EnumMap<>(b.spellCosts));
        this.spellDamage = Collections.unmodifiableMap(new EnumMap<>(b.spellDamage));
        this.selfHeal = b.selfHeal;
        this.burnDuration = b.burnDuration;
        this.burnDamage = b.burnDamage;
        this.frozenDuration = b.frozenDuration;
        this.burningTerrainDuration = b.burningTerrainDuration;
        this.burningTerrainDamage = b.burningTerrainDamage;
        this.minionHealth = b.minionHealth;
        this.minionDamage = b.minionDamage;
        this.enemyStats = Collections.unmodifiableMap(new EnumMap<>(b.enemyStats));
        this.ogreStompDamage = b.ogreStompDamage;
        this.goblinSwarmBonus = b.goblinSwarmBonus;
        this.swarmRadius = b.swarmRadius;
        this.lootDropChance = b.lootDropChance;
        this.xpBase = b.xpBase;
        this.xpMultiplier = b.xpMultiplier;
        this.obstacles = List.copyOf(b.obstacles);
        this.water = List.copyOf(b.water);
        this.forest = List.copyOf(b.forest);
        this.defaultItems = List.copyOf(b.defaultItems);
    }

    /** The built-in defaults. */
    public static GameConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public int getGridSize() { return gridSize; }
    public Position getPlayerStart() { return playerStart; }
    public int getPlayerHealth() { return playerHealth; }
    public int getPlayerMana() { return playerMana; }
    public int getDashManaCost() { return dashManaCost; }
    public int getDashDistance() { return dashDistance; }
    public int getDashCooldown() { return dashCooldown; }
    public int getPotionHeal() { return potionHeal; }
    public int getPotionMana() { return potionMana; }
    public int getManaRegen() { return manaRegen; }
    public int getFocusManaRegen() { return focusManaRegen; }
    public int getSelfHeal() { return selfHeal; }
    public int getBurnDuration() { return burnDuration; }
    public int getBurnDamage() { return burnDamage; }
    public int getFrozenDuration() { return frozenDuration; }
    public int getBurningTerrainDuration() { return burningTerrainDuration; }
    public int getBurningTerrainDamage() { return burningTerrainDamage; }
    public int getMinionHealth() { return minionHealth; }
    public int getMinionDamage() { return minionDamage; }
    public int getOgreStompDamage() { return ogreStompDamage; }
    public int getGoblinSwarmBonus() { return goblinSwarmBonus; }
    public int getSwarmRadius() { return swarmRadius; }
    public double getLootDropChance() { return lootDropChance; }
    public int getXpBase() { return xpBase; }
    public double getXpMultiplier() { return xpMultiplier; }
    public List<Position> getObstacles() { return obstacles; }
    public List<Position> getWater() { return water; }
    public List<Position> getForest() { return forest; }
    public List<ItemPlacement> getDefaultItems() { return defaultItems; }

    public int getSpellCost(SpellShape shape) {
        return spellCosts.getOrDefault(shape, 0);
    }

    public int getSpellDamage(SpellElement element) {
        return spellDamage.getOrDefault(element, 0);
    }

    public EnemyStats getEnemyStats(EnemyType type) {
        return enemyStats.get(type);
    }

    public static final class Builder {
        private int gridSize = 20;
        private Position playerStart = Position.of(0, 0);
        private int playerHealth = 100;
        private int playerMana = 100;
        private int dashManaCost = 20;
        private int dashDistance = 3;
        private int dashCooldown = 5;
        private int potionHeal = 30;
        private int potionMana = 30;
        private int manaRegen = 2;
        private int focusManaRegen = 10;
        private final Map<SpellShape, Integer> spellCosts = new EnumMap<>(SpellShape.class);
        private final Map<SpellElement, Integer> spellDamage = new EnumMap<>(SpellElement.class);
        private int selfHeal = 20;
        private int burnDuration = 3;
        private int burnDamage = 5;
        private int frozenDuration = 2;
        private int burningTerrainDuration = 3;
        private int burningTerrainDamage = 5;
        private int minionHealth = 40;
        private int minionDamage = 10;
        private final Map<EnemyType, EnemyStats> enemyStats = new EnumMap<>(EnemyType.class);
        private int ogreStompDamage = 15;
        private int goblinSwarmBonus = 2;
        private int swarmRadius = 3;
        private double lootDropChance = 0.25;
        private int xpBase = 100;
        private double xpMultiplier = 1.5;
        private List<Position> obstacles = List.of(
            Position.of(3, 3), Position.of(4, 3), Position.of(5, 3),
            Position.of(15, 10), Position.of(15, 11), Position.of(15, 12));
        private List<Position> water = List.of(
            Position.of(12, 2), Position.of(13, 2), Position.of(12, 3), Position.of(13, 3));
        private List<Position> forest = List.of(
            Position.of(2, 14), Position.of(3, 14), Position.of(2, 15), Position.of(3, 15), Position.of(4, 15));
        private List<ItemPlacement> defaultItems = List.of(
            new ItemPlacement("item_1", ItemType.HEALTH_POTION, Position.of(10, 10)),
            new ItemPlacement("item_2", ItemType.MANA_POTION, Position.of(16, 4)));

        private Builder() {
            spellCosts.put(SpellShape.BALL, 10);
            spellCosts.put(SpellShape.CONE, 15);
            spellCosts.put(SpellShape.WALL, 20);
            spellCosts.put(SpellShape.SELF, 15);
            spellCosts.put(SpellShape.SUMMON, 30);
            spellCosts.put(SpellShape.RAISE_DEAD, 25);

            spellDamage.put(SpellElement.FIRE, 30);
            spellDamage.put(SpellElement.WATER, 25);
            spellDamage.put(SpellElement.EARTH, 20);
            spellDamage.put(SpellElement.AIR, 15);

            enemyStats.put(EnemyType.GOBLIN, new EnemyStats(50, 1, 10, 25));
            enemyStats.put(EnemyType.ARCHER, new EnemyStats(35, 4, 8, 30));
            enemyStats.put(EnemyType.OGRE, new EnemyStats(120, 1, 20, 60));
        }

        private Builder(GameConfig c) {
            this.gridSize = c.gridSize;
            this.playerStart = c.playerStart;
            this.playerHealth = c.playerHealth;
            this.playerMana = c.playerMana;
            this.dashManaCost = c.dashManaCost;
            this.dashDistance = c.dashDistance;
            this.dashCooldown = c.dashCooldown;
            this.potionHeal = c.potionHeal;
            this.potionMana = c.potionMana;
            this.manaRegen = c.manaRegen;
            this.focusManaRegen = c.focusManaRegen;
            this.spellCosts.putAll(c.spellCosts);
            this.spellDamage.putAll(c.spellDamage);
            this.selfHeal = c.selfHeal;
            this.burnDuration = c.burnDuration;
            this.burnDamage = c.burnDamage;
            this.frozenDuration = c.frozenDuration;
            this.burningTerrainDuration = c.burningTerrainDuration;
            this.burningTerrainDamage = c.burningTerrainDamage;
            this.minionHealth = c.minionHealth;
            this.minionDamage = c.minionDamage;
            this.enemyStats.putAll(c.enemyStats);
            this.ogreStompDamage = c.ogreStompDamage;
            this.goblinSwarmBonus = c.goblinSwarmBonus;
            this.swarmRadius = c.swarmRadius;
            this.lootDropChance = c.lootDropChance;
            this.xpBase = c.xpBase;
            this.xpMultiplier = c.xpMultiplier;
            this.obstacles = c.obstacles;
            this.water = c.water;
            this.forest = c.forest;
            this.defaultItems = c.defaultItems;
        }

        public Builder gridSize(int v) { this.gridSize = v; return this; }
        public Builder playerStart(Position v) { this.playerStart = v; return this; }
        public Builder playerHealth(int v) { this.playerHealth = v; return this; }
        public Builder playerMana(int v) { this.playerMana = v; return this; }
        public Builder dashManaCost(int v) { this.dashManaCost = v; return this; }
        public Builder dashDistance(int v) { this.dashDistance = v; return this; }
        public Builder dashCooldown(int v) { this.dashCooldown = v; return this; }
        public Builder potionHeal(int v) { this.potionHeal = v; return this; }
        public Builder potionMana(int v) { this.potionMana = v; return this; }
        public Builder manaRegen(int v) { this.manaRegen = v; return this; }
        public Builder focusManaRegen(int v) { this.focusManaRegen = v; return this; }
        public Builder spellCost(SpellShape shape, int v) { this.spellCosts.put(shape, v); return this; }
        public Builder spellDamage(SpellElement element, int v) { this.spellDamage.put(element, v); return this; }
        public Builder selfHeal(int v) { this.selfHeal = v; return this; }
        public Builder burnDuration(int v) { this.burnDuration = v; return this; }
        public Builder burnDamage(int v) { this.burnDamage = v; return this; }
        public Builder frozenDuration(int v) { this.frozenDuration = v; return this; }
        public Builder burningTerrainDuration(int v) { this.burningTerrainDuration = v; return this; }
        public Builder burningTerrainDamage(int v) { this.burningTerrainDamage = v; return this; }
        public Builder minionHealth(int v) { this.minionHealth = v; return this; }
        public Builder minionDamage(int v) { this.minionDamage = v; return this; }
        public Builder enemyStats(EnemyType type, EnemyStats v) { this.enemyStats.put(type, v); return this; }
        public Builder ogreStompDamage(int v) { this.ogreStompDamage = v; return this; }
        public Builder goblinSwarmBonus(int v) { this.goblinSwarmBonus = v; return this; }
        public Builder swarmRadius(int v) { this.swarmRadius = v; return this; }
        public Builder lootDropChance(double v) { this.lootDropChance = v; return this; }
        public Builder xpBase(int v) { this.xpBase = v; return this; }
        public Builder xpMultiplier(double v) { this.xpMultiplier = v; return this; }
        public Builder obstacles(List<Position> v) { this.obstacles = List.copyOf(v); return this; }
        public Builder water(List<Position> v) { this.water = List.copyOf(v); return this; }
        public Builder forest(List<Position> v) { this.forest = List.copyOf(v); return this; }
        public Builder defaultItems(List<ItemPlacement> v) { this.defaultItems = List.copyOf(v); return this; }

        public GameConfig build() {
            if (gridSize <= 0) throw new IllegalArgumentException("grid_size must be positive: " + gridSize);
            if (xpBase <= 0) throw new IllegalArgumentException("xp_base must be positive: " + xpBase);
            if (xpMultiplier < 1.0) throw new IllegalArgumentException("xp_multiplier must be at least 1: " + xpMultiplier);
            for (EnemyType type : EnemyType.values()) {
                if (!enemyStats.containsKey(type)) {
                    throw new IllegalArgumentException("Missing enemy stats for " + type.getKey());
                }
            }
            return new GameConfig(this);
        }
    }
}
