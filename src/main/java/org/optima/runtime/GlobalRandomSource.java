package org.optima.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.optima.config.ConfigLoader;
import org.optima.runtime.internal.services.MersenneTwister32;
import org.optima.runtime.spi.IRandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;

/**
 * A thread-safe, process-wide pseudo-random sequence with global seed control.
 * <p>
 * All components that own a random engine should seed it from {@link #next()}, so that a single call to
 * {@link #setSeed(long)} makes every subsequently constructed component reproducible:
 * </p>
 * <pre>{@code
 * long seed = GlobalRandomSource.getInstance().next();
 * MersenneTwister32 engine = new MersenneTwister32(seed);
 * }</pre>
 * <p>
 * The sequence comes from the 32-bit Mersenne Twister. The singleton is created on first access to
 * {@link #getInstance()}. Its initial seed is {@code optima.random.seed} if configured, otherwise a value drawn once
 * from {@link SecureRandom}.
 * </p>
 * <p>
 * Every access to the engine holds the engine monitor, which is not fair. Under concurrent use the order in which threads draw values is
 * whatever the lock grants; the sequence is deterministic only for a single thread or under external ordering.
 * </p>
 */
public final class GlobalRandomSource implements IRandomSource {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalRandomSource.class);

    static final String SEED_PATH = "optima.random.seed";
    private static final long MAX_SEED = 0xFFFFFFFFL;

    private final MersenneTwister32 engine;
    private final Object engineLock = new Object();

    private static final class Holder {
        private static final GlobalRandomSource INSTANCE = fromConfig(ConfigLoader.load());
    }

    private GlobalRandomSource(long seed) {
        this.engine = new MersenneTwister32(seed);
    }

    /**
     * Returns the singleton instance, creating it on first call.
     * @return The singleton instance.
     */
    public static GlobalRandomSource getInstance() {
        return Holder.INSTANCE;
    }

    /**
     * Builds a source seeded from {@code optima.random.seed}, or from system entropy if the path is absent.
     *
     * @param config The resolved configuration.
     * @return A new, independent source.
     * @throws ConfigException.BadValue if the configured seed is not an unsigned 32-bit value.
     */
    static GlobalRandomSource fromConfig(Config config) {
        if (config.hasPath(SEED_PATH)) {
            long seed = config.getLong(SEED_PATH);
            if (seed < 0 || seed > MAX_SEED) {
                throw new ConfigException.BadValue(SEED_PATH, "must be between 0 and " + MAX_SEED + ", was " + seed);
            }
            LOG.info("Global random source seeded from configuration with {}", seed);
            return new GlobalRandomSource(seed);
        }
        LOG.debug("Global random source seeded from system entropy");
        return new GlobalRandomSource(Integer.toUnsignedLong(new SecureRandom().nextInt()));
    }

    @Override
    public long next() {
        synchronized (engineLock) {
            return engine.nextUnsignedInt();
        }
    }

    @Override
    public void setSeed(long seed) {
        synchronized (engineLock) {
            engine.setSeed(seed);
        }
    }
}
