package com.di.bancodemo.reconcile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Dimension keys, shuffled once and replicated {@code replicationFactor} times so the pool
 * holds at least as many slots as there are fact rows. The replication is virtual: slot
 * {@code i} is {@code shuffled[i % keyCount]}, so walking consecutive slots hands out every
 * key once before any key repeats.
 */
final class KeyPool {

    private final List<Object> shuffled;
    private final int replicationFactor;

    private KeyPool(List<Object> shuffled, int replicationFactor) {
        this.shuffled = shuffled;
        this.replicationFactor = replicationFactor;
    }

    /**
     * @throws IllegalArgumentException when {@code keys} is empty
     */
    static KeyPool inflate(Collection<?> keys, long factRowCount, Random random) {
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a key pool from an empty dimension");
        }
        List<Object> shuffled = new ArrayList<>(keys);
        Collections.shuffle(shuffled, random);
        return new KeyPool(shuffled, replicationFactor(factRowCount, shuffled.size()));
    }

    /** max(1, ceil(fact / dimension)). */
    static int replicationFactor(long factRowCount, long dimensionRowCount) {
        long factor = (factRowCount + dimensionRowCount - 1) / dimensionRowCount;
        return (int) Math.max(1L, factor);
    }

    int replicationFactor() {
        return replicationFactor;
    }

    int keyCount() {
        return shuffled.size();
    }

    long size() {
        return (long) shuffled.size() * replicationFactor;
    }

    Object get(long slot) {
        return shuffled.get((int) (slot % shuffled.size()));
    }

    /** Materialized pool, slot order. */
    List<Object> toList() {
        List<Object> out = new ArrayList<>();
        for (long slot = 0; slot < size(); slot++) {
            out.add(get(slot));
        }
        return out;
    }
}
