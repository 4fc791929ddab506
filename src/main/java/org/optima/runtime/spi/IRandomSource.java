package org.optima.runtime.spi;

/**
 * A source of 32-bit pseudo-random values with global seed control.
 * <p>
 * Values are unsigned 32-bit integers carried in a {@code long}, always within {@code [0, 2^32)}.
 * </p>
 */
public interface IRandomSource {

    /**
     * Returns the next element of the pseudo-random sequence.
     *
     * @return the next value, in the range [0, 2^32)
     */
    long next();

    /**
     * Resets the sequence so that subsequent calls to {@link #next()} repeat the same values for the same seed.
     * Only the low 32 bits of the seed are used.
     *
     * @param seed the new seed; any value is accepted, zero included
     */
    void setSeed(long seed);
}
