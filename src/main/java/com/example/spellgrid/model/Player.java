package com.example.spellgrid.model;

import com.example.spellgrid.spell.SpellElement;
import com.example.spellgrid.spell.SpellShape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The player character. Immutable; use {@link #toBuilder()} to derive a
 * changed copy.
 *
 * Health and mana are clamped to their maximums when restored but are not
 * clamped at zero when damage lands: the game-over check reads a negative or
 * zero health at the end of the turn.
 */
public final class Player {

    private final Position position;
    private final Direction facing;
    private final int health;
    private final int maxHealth;
    private final int mana;
    private final int maxMana;
    private final List<Item> inventory;
    private final int dashCooldown;
    private final int level;
    private final int xp;
    private final int xpToNextLevel;
    private final Set<SpellElement> unlockedElements;
    private final Set<SpellShape> unlockedShapes;
    private final int spellPower;
    private final SpellElement selectedElement;
    private final SpellShape selectedShape;

    private Player(Builder b) {
        this.position = b.position;
        this.facing = b.facing;
        this.health = b.health;
        this.maxHealth = b.maxHealth;
        this.mana = b.mana;
        this.maxMana = b.maxMana;
        this.inventory = Collections.unmodifiableList(new ArrayList<>(b.inventory));
        this.dashCooldown = b.dashCooldown;
        this.level = b.level;
        this.xp = b.xp;
        this.xpToNextLevel = b.xpToNextLevel;
        this.unlockedElements = Collections.unmodifiableSet(copyOf(b.unlockedElements, SpellElement.class));
        this.unlockedShapes = Collections.unmodifiableSet(copyOf(b.unlockedShapes, SpellShape.class));
        this.spellPower = b.spellPower;
        this.selectedElement = b.selectedElement;
        this.selectedShape = b.selectedShape;
    }

    private static <E extends Enum<E>> EnumSet<E> copyOf(Set<E> src, Class<E> type) {
        return src.isEmpty() ? EnumSet.noneOf(type) : EnumSet.copyOf(src);
    }

    /**
     * A level-one player at the given position: fire/ball only, full pools.
     */
    public static Player fresh(Position start, int health, int mana, int xpToNextLevel) {
        return new Builder()
            .position(start)
            .facing(Direction.UP)
            .health(health).maxHealth(health)
            .mana(mana).maxMana(mana)
            .level(1).xp(0).xpToNextLevel(xpToNextLevel)
            .unlockedElements(EnumSet.of(SpellElement.FIRE))
            .unlockedShapes(EnumSet.of(SpellShape.BALL))
            .selectedElement(SpellElement.FIRE)
            .selectedShape(SpellShape.BALL)
            .build();
    }

    public Position getPosition() { return position; }
    public Direction getFacing() { return facing; }
    public int getHealth() { return health; }
    public int getMaxHealth() { return maxHealth; }
    public int getMana() { return mana; }
    public int getMaxMana() { return maxMana; }
    public List<Item> getInventory() { return inventory; }
    public int getDashCooldown() { return dashCooldown; }
    public int getLevel() { return level; }
    public int getXp() { return xp; }
    public int getXpToNextLevel() { return xpToNextLevel; }
    public Set<SpellElement> getUnlockedElements() { return unlockedElements; }
    public Set<SpellShape> getUnlockedShapes() { return unlockedShapes; }
    public int getSpellPower() { return spellPower; }
    public SpellElement getSelectedElement() { return selectedElement; }
    public SpellShape getSelectedShape() { return selectedShape; }

    public boolean isDefeated() {
        return health <= 0;
    }

    /** Find an inventory item by id, or null. */
    public Item findItem(String itemId) {
        if (itemId == null) return null;
        for (Item item : inventory) {
            if (item.id().equals(itemId)) return item;
        }
        return null;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public String toString() {
        return "Player[at " + position + " facing " + facing + ", hp=" + health + "/" + maxHealth
            + ", mp=" + mana + "/" + maxMana + ", lvl=" + level + ", xp=" + xp + "/" + xpToNextLevel + "]";
    }

    public static final class Builder {
        private Position position = Position.of(0, 0);
        private Direction facing = Direction.UP;
        private int health;
        private int maxHealth;
        private int mana;
        private int maxMana;
        private List<Item> inventory = new ArrayList<>();
        private int dashCooldown;
        private int level = 1;
        private int xp;
        private int xpToNextLevel;
        private Set<SpellElement> unlockedElements = EnumSet.noneOf(SpellElement.class);
        private Set<SpellShape> unlockedShapes = EnumSet.noneOf(SpellShape.class);
        private int spellPower;
        private SpellElement selectedElement = SpellElement.FIRE;
        private SpellShape selectedShape = SpellShape.BALL;

        public Builder() {
        }

        private Builder(Player p) {
            this.position = p.position;
            this.facing = p.facing;
            this.health = p.health;
            this.maxHealth = p.maxHealth;
            this.mana = p.mana;
            this.maxMana = p.maxMana;
            this.inventory = new ArrayList<>(p.inventory);
            this.dashCooldown = p.dashCooldown;
            this.level = p.level;
            this.xp = p.xp;
            this.xpToNextLevel = p.xpToNextLevel;
            this.unlockedElements = copyOf(p.unlockedElements, SpellElement.class);
            this.unlockedShapes = copyOf(p.unlockedShapes, SpellShape.class);
            this.spellPower = p.spellPower;
            this.selectedElement = p.selectedElement;
            this.selectedShape = p.selectedShape;
        }

        public Builder position(Position position) { this.position = position; return this; }
        public Builder facing(Direction facing) { this.facing = facing; return this; }
        public Builder health(int health) { this.health = health; return this; }
        public Builder maxHealth(int maxHealth) { this.maxHealth = maxHealth; return this; }
        public Builder mana(int mana) { this.mana = mana; return this; }
        public Builder maxMana(int maxMana) { this.maxMana = maxMana; return this; }
        public Builder inventory(List<Item> inventory) { this.inventory = new ArrayList<>(inventory); return this; }
        public Builder addItem(Item item) { this.inventory.add(item); return this; }
        public Builder removeItem(Item item) { this.inventory.remove(item); return this; }
        public Builder dashCooldown(int dashCooldown) { this.dashCooldown = dashCooldown; return this; }
        public Builder level(int level) { this.level = level; return this; }
        public Builder xp(int xp) { this.xp = xp; return this; }
        public Builder xpToNextLevel(int xpToNextLevel) { this.xpToNextLevel = xpToNextLevel; return this; }
        public Builder unlockedElements(Set<SpellElement> elements) { this.unlockedElements = copyOf(elements, SpellElement.class); return this; }
        public Builder unlockElement(SpellElement element) { this.unlockedElements.add(element); return this; }
        public Builder unlockedShapes(Set<SpellShape> shapes) { this.unlockedShapes = copyOf(shapes, SpellShape.class); return this; }
        public Builder unlockShape(SpellShape shape) { this.unlockedShapes.add(shape); return this; }
        public Builder spellPower(int spellPower) { this.spellPower = spellPower; return this; }
        public Builder selectedElement(SpellElement element) { this.selectedElement = element; return this; }
        public Builder selectedShape(SpellShape shape) { this.selectedShape = shape; return this; }

        public Position getPosition() { return position; }
        public Direction getFacing() { return facing; }
        public int getHealth() { return health; }
        public int getMaxHealth() { return maxHealth; }
        public int getMana() { return mana; }
        public int getMaxMana() { return maxMana; }
        public int getDashCooldown() { return dashCooldown; }
        public int getLevel() { return level; }
        public int getXp() { return xp; }
        public int getXpToNextLevel() { return xpToNextLevel; }
        public int getSpellPower() { return spellPower; }
        public List<Item> getInventory() { return Collections.unmodifiableList(inventory); }

        public Player build() {
            return new Player(this);
        }
    }
}
