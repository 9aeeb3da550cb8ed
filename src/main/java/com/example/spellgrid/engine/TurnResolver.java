package com.example.spellgrid.engine;

import com.example.spellgrid.ai.EnemyBehavior;
import com.example.spellgrid.ai.MinionBehavior;
import com.example.spellgrid.config.GameConfig;
import com.example.spellgrid.effect.StatusEffectProcessor;
import com.example.spellgrid.effect.TerrainEffectProcessor;
import com.example.spellgrid.model.GameState;
import com.example.spellgrid.model.GameStatus;
import com.example.spellgrid.model.Player;
import com.example.spellgrid.progression.LootService;
import com.example.spellgrid.progression.WaveManager;
import com.example.spellgrid.util.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The turn pipeline. Runs once per turn-consuming action, in this order:
 * <ol>
 *   <li>terrain effects</li>
 *   <li>status effects</li>
 *   <li>minions (skipped when no enemies remain)</li>
 *   <li>enemies</li>
 *   <li>loot and xp for everything defeated this turn</li>
 *   <li>cleanup: game-over check, mana regeneration, dash cooldown</li>
 * </ol>
 * then commits the working copy and runs the wave check on the committed state.
 */
public class TurnResolver {

    private static final Logger logger = LoggerFactory.getLogger(TurnResolver.class);

    private final GameConfig config;
    private final TerrainEffectProcessor terrainPhase;
    private final StatusEffectProcessor statusPhase;
    private final MinionBehavior minionPhase;
    private final EnemyBehavior enemyPhase;
    private final LootService lootPhase;
    private final WaveManager waveManager;
    private final RandomSource random;

    public TurnResolver(GameConfig config, TerrainEffectProcessor terrainPhase, StatusEffectProcessor statusPhase,
                        MinionBehavior minionPhase, EnemyBehavior enemyPhase, LootService lootPhase,
                        WaveManager waveManager, RandomSource random) {
        this.config = config;
        this.terrainPhase = terrainPhase;
        this.statusPhase = statusPhase;
        this.minionPhase = minionPhase;
        this.enemyPhase = enemyPhase;
        this.lootPhase = lootPhase;
        this.waveManager = waveManager;
        this.random = random;
    }

    /**
     * Resolve one full turn on the working copy and return the committed state.
     */
    public GameState resolve(WorkingState ws, TurnKind kind) {
        terrainPhase.process(ws);
        statusPhase.process(ws);
        minionPhase.process(ws);
        enemyPhase.process(ws);
        lootPhase.process(ws, random);
        cleanup(ws, kind);

        GameState committed = ws.toSnapshot();
        logger.debug("Turn {} resolved: {}", committed.getTurn(), committed);
        return waveManager.checkWaveComplete(committed);
    }

    private void cleanup(WorkingState ws, TurnKind kind) {
        Player.Builder player = ws.getPlayer();
        if (player.getHealth() <= 0) {
            ws.setStatus(GameStatus.GAME_OVER);
            ws.log("You have been defeated. Game over.");
            logger.info("Game over on turn {} (wave {})", ws.getTurn() + 1, ws.getWave());
        }

        int regen = kind == TurnKind.FOCUS ? config.getFocusManaRegen() : config.getManaRegen();
        player.mana(Math.min(player.getMana() + regen, player.getMaxMana()));

        if (player.getDashCooldown() > 0) {
            player.dashCooldown(player.getDashCooldown() - 1);
        }
        ws.advanceTurn();
    }
}
