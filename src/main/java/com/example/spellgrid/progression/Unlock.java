package com.example.spellgrid.progression;

import com.example.spellgrid.spell.SpellElement;
import com.example.spellgrid.spell.SpellShape;

/**
 * What a level-up unlocks: exactly one of an element or a shape.
 */
public record Unlock(SpellElement element, SpellShape shape) {

    public static Unlock element(SpellElement element) {
        return new Unlock(element, null);
    }

    public static Unlock shape(SpellShape shape) {
        return new Unlock(null, shape);
    }

    public String describe() {
        return element != null ? element.getKey() + " magic" : shape.getKey() + " spells";
    }
}
