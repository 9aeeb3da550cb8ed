package com.example.spellgrid.progression;

import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.model.Player;
import com.example.spellgrid.spell.SpellElement;
import com.example.spellgrid.spell.SpellShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Experience and leveling.
 *
 * Each level-up carries the surplus xp over, raises max health by 10 and max
 * mana by 5, refills both, adds 2 spell power and applies the unlock for the
 * new level, if any. The xp needed for the next level is
 * round(base * multiplier^(level - 1)).
 */
public class ProgressionService {

    private static final Logger logger = LoggerFactory.getLogger(ProgressionService.class);

    public static final int HEALTH_PER_LEVEL = 10;
    public static final int MANA_PER_LEVEL = 5;
    public static final int SPELL_POWER_PER_LEVEL = 2;

    private static final Map<Integer, Unlock> UNLOCKS;

    static {
        Map<Integer, Unlock> m = new TreeMap<>();
        m.put(2, Unlock.element(SpellElement.WATER));
        m.put(3, Unlock.shape(SpellShape.CONE));
        m.put(4, Unlock.element(SpellElement.EARTH));
        m.put(5, Unlock.shape(SpellShape.WALL));
        m.put(6, Unlock.element(SpellElement.AIR));
        m.put(7, Unlock.shape(SpellShape.SELF));
        m.put(8, Unlock.shape(SpellShape.SUMMON));
        m.put(9, Unlock.shape(SpellShape.RAISE_DEAD));
        UNLOCKS = Collections.unmodifiableMap(m);
    }

    private final GameConfig config;

    public ProgressionService(GameConfig config) {
        this.config = config;
    }

    public static Map<Integer, Unlock> getUnlockTable() {
        return UNLOCKS;
    }

    /** Unlock granted on reaching a level, or null. */
    public static Unlock unlockForLevel(int level) {
        return UNLOCKS.get(level);
    }

    /**
     * Xp required to go from {@code level} to the next one. Never less than 1.
     */
    public int xpToNextLevel(int level) {
        long needed = Math.round(config.getXpBase() * Math.pow(config.getXpMultiplier(), level - 1));
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, needed));
    }

    /**
     * Grant xp and run as many level-ups as it pays for.
     *
     * @param messages receives one line per level-up and unlock
     * @return number of levels gained
     */
    public int grantXp(Player.Builder player, int amount, Consumer<String> messages) {
        if (amount <= 0) return 0;
        int xp = player.getXp() + amount;
        int level = player.getLevel();
        int needed = Math.max(1, player.getXpToNextLevel());
        int gained = 0;

        while (xp >= needed) {
            xp -= needed;
            level++;
            gained++;

            int maxHealth = player.getMaxHealth() + HEALTH_PER_LEVEL;
            int maxMana = player.getMaxMana() + MANA_PER_LEVEL;
            player.level(level)
                .maxHealth(maxHealth).health(maxHealth)
                .maxMana(maxMana).mana(maxMana)
                .spellPower(player.getSpellPower() + SPELL_POWER_PER_LEVEL);

            messages.accept("You reached level " + level + "!");
            Unlock unlock = unlockForLevel(level);
            if (unlock != null) {
                if (unlock.element() != null) player.unlockElement(unlock.element());
                if (unlock.shape() != null) player.unlockShape(unlock.shape());
                messages.accept("You have learned " + unlock.describe() + ".");
            }
            needed = xpToNextLevel(level);
            logger.info("Player reached level {} (next at {} xp)", level, needed);
        }

        player.xp(xp).xpToNextLevel(needed);
        return gained;
    }

    /** Apply every unlock up to and including the given level. */
    public static void applyUnlocksUpTo(Player.Builder player, int level) {
        for (Map.Entry<Integer, Unlock> e : UNLOCKS.entrySet()) {
            if (e.getKey() > level) break;
            Unlock u = e.getValue();
            if (u.element() != null) player.unlockElement(u.element());
            if (u.shape() != null) player.unlockShape(u.shape());
        }
    }
}
