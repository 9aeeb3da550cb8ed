package com.example.spellgrid.spell;

import com.example.spellgrid.combat.CombatResolver;
import com.example.spellgrid.config.GameConfig;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Registry for spell handlers, keyed by shape. The element only matters to
 * the elemental shapes, whose handler reads it from the context.
 */
public class SpellRegistry {

    private final Map<SpellShape, SpellHandler> handlers = new EnumMap<>(SpellShape.class);

    /** Registry with the standard handler for every shape. */
    public static SpellRegistry withDefaults(GameConfig config, CombatResolver resolver) {
        SpellRegistry registry = new SpellRegistry();
        AreaSpellHandler area = new AreaSpellHandler(resolver);
        for (SpellShape shape : SpellShape.values()) {
            if (shape.isElemental()) registry.register(shape, area);
        }
        registry.register(SpellShape.SELF, new SelfSpellHandler(config));
        registry.register(SpellShape.SUMMON, new SummonSpellHandler(config));
        registry.register(SpellShape.RAISE_DEAD, new RaiseDeadSpellHandler(config));
        return registry;
    }

    public void register(SpellShape shape, SpellHandler handler) {
        if (shape == null || handler == null) return;
        handlers.put(shape, handler);
    }

    public SpellHandler get(SpellShape shape) {
        if (shape == null) return null;
        return handlers.get(shape);
    }

    public boolean exists(SpellShape shape) {
        return shape != null && handlers.containsKey(shape);
    }

    public Map<SpellShape, SpellHandler> getAll() {
        return Collections.unmodifiableMap(handlers);
    }
}
