package org.hexwar.runtime.internal.services;

import org.apache.commons.math3.random.Well19937c;
import org.hexwar.runtime.spi.IRandomProvider;

import java.lang.reflect.Field;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * The generator's internal state (the {@code v} array and {@code index} of its
 * {@code AbstractWell} superclass) is read and written through reflection so that
 * {@link #saveState()} and {@link #loadState(byte[])} capture the exact sequence position. The
 * move processor relies on this to roll the sequence back after a dry run, and snapshots use it
 * to resume a game mid-sequence.
 * <p>
 * Derived providers are seeded with a SplitMix64 mix of the parent seed, an FNV-1a hash of the
 * scope and the key.
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Well19937c rng;

    // Cached once; used on every save/load
    private final Field vField;
    private final Field indexField;

    /**
     * Creates a new seeded random provider.
     * @param seed The initial seed for the random number generator.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
        try {
            this.vField = rng.getClass().getSuperclass().getDeclaredField("v");
            this.indexField = rng.getClass().getSuperclass().getDeclaredField("index");
            this.vField.setAccessible(true);
            this.indexField.setAccessible(true);
        } catch (NoSuchFieldException e) {
            throw new IllegalStateException("Failed to initialize RNG reflection fields", e);
        }
    }

    /**
     * @return the seed this provider was created with.
     */
    public long seed() {
        return seed;
    }

    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        long h = mix64(seed);
        h = mix64(h ^ mix64(hashString(scope)));
        h = mix64(h ^ mix64(key));
        return new SeededRandomProvider(h);
    }

    /**
     * Hashes a string using the FNV-1a 64-bit algorithm.
     */
    static long hashString(String s) {
        if (s == null) return 0L;
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        long h = 1469598103934665603L; // FNV-1a 64-bit offset basis
        for (byte value : b) {
            h ^= (value & 0xFF);
            h *= 1099511628211L; // FNV-1a prime
        }
        return h;
    }

    private static long mix64(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }

    @Override
    public byte[] saveState() {
        try {
            int[] v = (int[]) vField.get(rng);
            int index = indexField.getInt(rng);

            // 4 bytes index + 4 bytes per state word
            ByteBuffer buffer = ByteBuffer.allocate(4 + (v.length * 4));
            buffer.putInt(index);
            for (int value : v) {
                buffer.putInt(value);
            }
            return buffer.array();
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Failed to serialize RNG state", e);
        }
    }

    @Override
    public void loadState(byte[] state) {
        if (state == null) {
            throw new IllegalArgumentException("RNG state cannot be null");
        }
        try {
            int[] v = (int[]) vField.get(rng);
            if (state.length != 4 + v.length * 4) {
                throw new IllegalArgumentException("RNG state has " + state.length + " bytes, expected "
                        + (4 + v.length * 4));
            }
            ByteBuffer buffer = ByteBuffer.wrap(state);
            int index = buffer.getInt();
            for (int i = 0; i < v.length; i++) {
                v[i] = buffer.getInt();
            }
            indexField.setInt(rng, index);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Failed to deserialize RNG state", e);
        }
    }
}
