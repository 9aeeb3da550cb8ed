package com.example.spellgrid.engine;

import com.example.spellgrid.ai.EnemyBehavior;
import com.example.spellgrid.ai.MinionBehavior;
import com.example.spellgrid.combat.CombatCalculator;
import com.example.spellgrid.combat.CombatResolver;
import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.effect.StatusEffectProcessor;
import com.example.spellgrid.effect.TerrainEffectProcessor;
import com.example.spellgrid.model.Direction;
import com.example.spellgrid.model.GameState;
import com.example.spellgrid.model.Item;
import com.example.spellgrid.model.ItemType;
import com.example.spellgrid.model.Player;
import com.example.spellgrid.model.Position;
import com.example.spellgrid.model.TileType;
import com.example.spellgrid.progression.LootService;
import com.example.spellgrid.progression.ProgressionService;
import com.example.spellgrid.progression.WaveManager;
import com.example.spellgrid.progression.WaveRoster;
import com.example.spellgrid.spell.SpellContext;
import com.example.spellgrid.spell.SpellElement;
import com.example.spellgrid.spell.SpellGeometry;
import com.example.spellgrid.spell.SpellHandler;
import com.example.spellgrid.spell.SpellRegistry;
import com.example.spellgrid.spell.SpellShape;
import com.example.spellgrid.util.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The player's actions as pure functions from one state to the next.
 *
 * Every action first requires the game to be PLAYING. Requests that cannot
 * be carried out (not enough mana, locked loadout, missing item, bad target)
 * return the very same state instance: nothing changes and no turn passes.
 * A blocked move is the exception; it still turns the player and spends a turn.
 */
public class PlayerActions {

    private static final Logger logger = LoggerFactory.getLogger(PlayerActions.class);

    private final GameConfig config;
    private final TurnResolver resolver;
    private final SpellRegistry spells;
    private final WaveManager waveManager;

    public PlayerActions(GameConfig config, TurnResolver resolver, SpellRegistry spells, WaveManager waveManager) {
        this.config = config;
        this.resolver = resolver;
        this.spells = spells;
        this.waveManager = waveManager;
    }

    /**
     * Wire up the standard rules: combat, spells, AI phases, loot, progression and waves.
     */
    public static PlayerActions create(GameConfig config, WaveRoster roster, RandomSource random) {
        CombatCalculator calculator = new CombatCalculator(config);
        CombatResolver combat = new CombatResolver(config, calculator);
        ProgressionService progression = new ProgressionService(config);
        WaveManager waves = new WaveManager(config, roster, progression);
        TurnResolver resolver = new TurnResolver(config,
            new TerrainEffectProcessor(),
            new StatusEffectProcessor(),
            new MinionBehavior(calculator),
            new EnemyBehavior(calculator),
            new LootService(config, progression),
            waves,
            random);
        return new PlayerActions(config, resolver, SpellRegistry.withDefaults(config, combat), waves);
    }

    public GameState move(GameState state, Direction direction) {
        Objects.requireNonNull(direction, "direction");
        if (!state.isPlaying()) return state;

        WorkingState ws = new WorkingState(state, config);
        ws.getPlayer().facing(direction);
        Position from = ws.getPlayerPosition();
        Position to = from.step(direction);
        if (canPlayerEnter(ws, to)) {
            ws.getPlayer().position(to);
            pickUpItem(ws, to);
        } else {
            logger.debug("Move {} from {} blocked", direction, from);
        }
        return resolver.resolve(ws, TurnKind.ACTION);
    }

    public GameState dash(GameState state, Direction direction) {
        Objects.requireNonNull(direction, "direction");
        if (!state.isPlaying()) return state;
        Player player = state.getPlayer();
        if (player.getMana() < config.getDashManaCost() || player.getDashCooldown() != 0) {
            return state;
        }

        WorkingState ws = new WorkingState(state, config);
        Player.Builder p = ws.getPlayer();
        p.facing(direction);
        int travelled = 0;
        for (int i = 0; i < config.getDashDistance(); i++) {
            Position next = p.getPosition().step(direction);
            if (!canPlayerEnter(ws, next)) break;
            p.position(next);
            pickUpItem(ws, next);
            travelled++;
        }
        p.mana(p.getMana() - config.getDashManaCost());
        p.dashCooldown(config.getDashCooldown());
        ws.log("You dash %d tile(s) %s.", travelled, direction.name().toLowerCase());
        return resolver.resolve(ws, TurnKind.ACTION);
    }

    public GameState useItem(GameState state, String itemId) {
        if (!state.isPlaying()) return state;
        Item item = state.getPlayer().findItem(itemId);
        if (item == null) return state;

        WorkingState ws = new WorkingState(state, config);
        Player.Builder p = ws.getPlayer();
        p.removeItem(item);
        if (item.type() == ItemType.HEALTH_POTION) {
            p.health(Math.min(p.getHealth() + config.getPotionHeal(), p.getMaxHealth()));
            ws.log("You drink a health potion. Health: %d/%d.", p.getHealth(), p.getMaxHealth());
        } else if (item.type() == ItemType.MANA_POTION) {
            p.mana(Math.min(p.getMana() + config.getPotionMana(), p.getMaxMana()));
            ws.log("You drink a mana potion. Mana: %d/%d.", p.getMana(), p.getMaxMana());
        }
        return resolver.resolve(ws, TurnKind.ACTION);
    }

    /** Spend the turn focusing; regenerates extra mana. Also used for waiting. */
    public GameState focus(GameState state) {
        if (!state.isPlaying()) return state;
        WorkingState ws = new WorkingState(state, config);
        ws.log("You focus your mind.");
        return resolver.resolve(ws, TurnKind.FOCUS);
    }

    public GameState castSpellAt(GameState state, int x, int y) {
        if (!state.isPlaying()) return state;
        Player player = state.getPlayer();
        SpellShape shape = player.getSelectedShape();
        SpellElement element = player.getSelectedElement();
        int cost = config.getSpellCost(shape);
        if (player.getMana() < cost) return state;

        Position target = Position.of(x, y);
        if (shape != SpellShape.SELF && !state.getGrid().inBounds(target)) return state;

        SpellHandler handler = spells.get(shape);
        if (handler == null) return state;

        WorkingState ws = new WorkingState(state, config);
        Set<Position> tiles = SpellGeometry.affectedTiles(shape, target, player.getPosition(),
            player.getFacing(), state.getGridSize());
        if (!handler.cast(new SpellContext(ws, element, shape, target, tiles))) {
            logger.debug("{} at {} failed, no turn spent", shape, target);
            return state;
        }
        ws.getPlayer().mana(ws.getPlayer().getMana() - cost);
        return resolver.resolve(ws, TurnKind.ACTION);
    }

    public GameState selectElement(GameState state, SpellElement element) {
        if (!state.isPlaying() || element == null) return state;
        Player player = state.getPlayer();
        if (!player.getUnlockedElements().contains(element) || player.getSelectedElement() == element) {
            return state;
        }
        return withPlayer(state, player.toBuilder().selectedElement(element).build());
    }

    public GameState selectSpellShape(GameState state, SpellShape shape) {
        if (!state.isPlaying() || shape == null) return state;
        Player player = state.getPlayer();
        if (!player.getUnlockedShapes().contains(shape) || player.getSelectedShape() == shape) {
            return state;
        }
        return withPlayer(state, player.toBuilder().selectedShape(shape).build());
    }

    public GameState restart() {
        return waveManager.initialState();
    }

    /**
     * Tiles the current loadout would cover if cast at the target. Read-only;
     * works whatever the game status. A null target covers nothing.
     */
    public Set<Position> affectedTiles(GameState state, Position target) {
        Player player = state.getPlayer();
        return SpellGeometry.affectedTiles(player.getSelectedShape(), target, player.getPosition(),
            player.getFacing(), state.getGridSize());
    }

    private static boolean canPlayerEnter(WorkingState ws, Position p) {
        if (!ws.inBounds(p) || ws.tileAt(p).blocksPlayer()) return false;
        return ws.enemyAt(p) == null && ws.minionAt(p) == null;
    }

    private static void pickUpItem(WorkingState ws, Position p) {
        Item item = ws.getItems().remove(p);
        if (item == null) return;
        ws.getPlayer().addItem(item);
        ws.getGrid().set(p, TileType.EMPTY);
        ws.log("You pick up a %s.", item.type().getDisplayName());
    }

    private static GameState withPlayer(GameState s, Player player) {
        return new GameState(s.getGrid(), player, s.getEnemies(), s.getMinions(), s.getItemsOnGrid(),
            s.getCorpses(), s.getTerrainEffects(), s.getStatus(), s.getWave(), s.getTurn(), List.of());
    }
}
