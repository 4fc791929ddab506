package org.optima.runtime;

import org.optima.runtime.internal.services.MersenneTwister32;

/**
 * Factory for private random engines owned by individual components.
 * <p>
 * A component seeds its engine once at construction and draws from it independently afterwards, so only the
 * seeding step touches the shared source.
 * </p>
 */
public final class RandomEngines {

    private RandomEngines() {
        // Private constructor to prevent instantiation
    }

    /**
     * Creates an engine seeded with the next value of the {@link GlobalRandomSource}.
     * @return A new engine, not thread-safe.
     */
    public static MersenneTwister32 create() {
        return create(GlobalRandomSource.getInstance().next());
    }

    /**
     * Creates an engine with an explicit seed.
     * @param seed The seed; only the low 32 bits are used.
     * @return A new engine, not thread-safe.
     */
    public static MersenneTwister32 create(long seed) {
        return new MersenneTwister32(seed);
    }
}
