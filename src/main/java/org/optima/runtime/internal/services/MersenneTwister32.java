package org.optima.runtime.internal.services;

import org.apache.commons.math3.random.BitsStreamGenerator;

import java.util.Objects;

/**
 * The 32-bit Mersenne Twister (MT19937) by Matsumoto and Nishimura, 1998.
 * <p>
 * Seeding with a single 32-bit value follows {@code init_genrand} of the reference implementation, so the output
 * sequence for a given seed is identical to that of C++ {@code std::mt19937}. Array seeding follows
 * {@code init_by_array}. All state arithmetic is done in {@code int}, which wraps modulo 2^32 exactly like the
 * unsigned arithmetic of the reference code.
 * </p>
 * <p>
 * Instances are not thread-safe.
 * </p>
 */
public final class MersenneTwister32 extends BitsStreamGenerator {

    private static final long serialVersionUID = 1L;

    private static final int N = 624;
    private static final int M = 397;
    private static final int UPPER_MASK = 0x80000000;
    private static final int LOWER_MASK = 0x7fffffff;
    private static final int[] MAG01 = {0x0, 0x9908b0df};

    /** Seed of the default-constructed engine, as in the reference code. */
    public static final int DEFAULT_SEED = 5489;

    private final int[] mt = new int[N];
    private int mti;

    /**
     * Creates an engine seeded with {@link #DEFAULT_SEED}.
     */
    public MersenneTwister32() {
        setSeed(DEFAULT_SEED);
    }

    /**
     * Creates an engine seeded with the low 32 bits of the given value.
     * @param seed The seed; bits above the lowest 32 are ignored.
     */
    public MersenneTwister32(long seed) {
        setSeed(seed);
    }

    @Override
    public void setSeed(int seed) {
        mt[0] = seed;
        for (mti = 1; mti < N; mti++) {
            mt[mti] = 1812433253 * (mt[mti - 1] ^ (mt[mti - 1] >>> 30)) + mti;
        }
        clear();
    }

    /**
     * Reseeds from the low 32 bits of the given value, which is what converting it to an unsigned 32-bit
     * integer does.
     * @param seed The seed.
     */
    @Override
    public void setSeed(long seed) {
        setSeed((int) seed);
    }

    @Override
    public void setSeed(int[] seed) {
        Objects.requireNonNull(seed, "seed");
        if (seed.length == 0) {
            throw new IllegalArgumentException("Seed array must not be empty");
        }
        setSeed(19650218);
        int i = 1;
        int j = 0;
        for (int k = Math.max(N, seed.length); k > 0; k--) {
            mt[i] = (mt[i] ^ ((mt[i - 1] ^ (mt[i - 1] >>> 30)) * 1664525)) + seed[j] + j;
            i++;
            j++;
            if (i >= N) {
                mt[0] = mt[N - 1];
                i = 1;
            }
            if (j >= seed.length) {
                j = 0;
            }
        }
        for (int k = N - 1; k > 0; k--) {
            mt[i] = (mt[i] ^ ((mt[i - 1] ^ (mt[i - 1] >>> 30)) * 1566083941)) - i;
            i++;
            if (i >= N) {
                mt[0] = mt[N - 1];
                i = 1;
            }
        }
        // MSB is 1, assuring a non-zero initial array
        mt[0] = UPPER_MASK;
        clear();
    }

    /**
     * Returns the next tempered 32-bit output, unsigned, as a {@code long} in {@code [0, 2^32)}.
     * @return The next output.
     */
    public long nextUnsignedInt() {
        return Integer.toUnsignedLong(next(32));
    }

    @Override
    protected int next(int bits) {
        if (mti >= N) {
            twist();
        }
        int y = mt[mti++];
        y ^= y >>> 11;
        y ^= (y << 7) & 0x9d2c5680;
        y ^= (y << 15) & 0xefc60000;
        y ^= y >>> 18;
        return y >>> (32 - bits);
    }

    private void twist() {
        int kk;
        int y;
        for (kk = 0; kk < N - M; kk++) {
            y = (mt[kk] & UPPER_MASK) | (mt[kk + 1] & LOWER_MASK);
            mt[kk] = mt[kk + M] ^ (y >>> 1) ^ MAG01[y & 0x1];
        }
        for (; kk < N - 1; kk++) {
            y = (mt[kk] & UPPER_MASK) | (mt[kk + 1] & LOWER_MASK);
            mt[kk] = mt[kk + (M - N)] ^ (y >>> 1) ^ MAG01[y & 0x1];
        }
        y = (mt[N - 1] & UPPER_MASK) | (mt[0] & LOWER_MASK);
        mt[N - 1] = mt[M - 1] ^ (y >>> 1) ^ MAG01[y & 0x1];
        mti = 0;
    }
}
