package com.example.spellgrid;

import com.example.spellgrid.util.RandomSource;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * RandomSource that replays queued values. With nothing queued it never
 * drops loot (0.99), picks index 0 and leaves shuffled lists in order.
 */
class ScriptedRandom implements RandomSource {

    private final Deque<Double> doubles = new ArrayDeque<>();
    private final Deque<Integer> ints = new ArrayDeque<>();
    private boolean reverseOnShuffle;

    static ScriptedRandom neverDrops() {
        return new ScriptedRandom();
    }

    ScriptedRandom doubles(double... values) {
        for (double v : values) doubles.add(v);
        return this;
    }

    ScriptedRandom ints(int... values) {
        for (int v : values) ints.add(v);
        return this;
    }

    ScriptedRandom reverseOnShuffle() {
        this.reverseOnShuffle = true;
        return this;
    }

    @Override
    public double nextDouble() {
        return doubles.isEmpty() ? 0.99 : doubles.poll();
    }

    @Override
    public int nextInt(int bound) {
        return ints.isEmpty() ? 0 : ints.poll() % bound;
    }

    @Override
    public <T> void shuffle(List<T> list) {
        if (reverseOnShuffle) {
            Collections.reverse(list);
        }
    }
}
