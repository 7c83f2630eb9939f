package com.qqsuccubus.zonal.core.sampling;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.function.DoubleSupplier;

/**
 * Factories for {@link RandomSource}.
 * <p>
 * Use {@link #seeded(long)} for reproducible simulations and tests, {@link #entropy()} in production.
 * </p>
 */
public final class RandomSources {
    private RandomSources() {
    }

    /**
     * Deterministic source: equal seeds produce equal sequences.
     */
    public static RandomSource seeded(long seed) {
        SplittableRandom random = new SplittableRandom(seed);
        return random::nextDouble;
    }

    /**
     * Non-reproducible source seeded from the platform's entropy pool.
     */
    public static RandomSource entropy() {
        return seeded(new SecureRandom().nextLong());
    }

    /**
     * Adapts an arbitrary supplier, e.g. a scripted sequence of draws.
     * The supplier must return values in {@code [0, 1)}.
     */
    public static RandomSource of(DoubleSupplier supplier) {
        Objects.requireNonNull(supplier, "supplier");
        return supplier::getAsDouble;
    }
}
