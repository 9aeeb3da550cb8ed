package com.example.spellgrid.util;

import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * {@link RandomSource} backed by {@link java.util.Random}. Two instances built
 * with the same seed produce the same sequence of decisions.
 */
public class SeededRandomSource implements RandomSource {

    private final Random rng;

    public SeededRandomSource(long seed) {
        this.rng = new Random(seed);
    }

    public SeededRandomSource() {
        this.rng = new Random();
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    @Override
    public <T> void shuffle(List<T> list) {
        Collections.shuffle(list, rng);
    }
}
