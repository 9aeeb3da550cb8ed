package com.example.spellgrid.util;

import java.util.List;

/**
 * Source of every random decision the turn resolution makes (loot chance,
 * loot type, candidate tile shuffling). Injected into the engine so a test
 * can seed or script it.
 */
public interface RandomSource {

    /** Uniform double in [0, 1). */
    double nextDouble();

    /** Uniform int in [0, bound). */
    int nextInt(int bound);

    /** Shuffle the list in place. */
    <T> void shuffle(List<T> list);

    /** Convenience: true with the given probability. */
    default boolean chance(double probability) {
        return nextDouble() < probability;
    }
}
