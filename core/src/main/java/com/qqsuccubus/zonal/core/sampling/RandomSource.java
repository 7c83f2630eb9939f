package com.qqsuccubus.zonal.core.sampling;

/**
 * Source of uniform random reals used for backend selection.
 * <p>
 * Implementations are stateful and exclusively owned by one client; they are not required
 * to be thread-safe.
 * </p>
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * @return Next uniform real in {@code [0, 1)}
     */
    double nextDouble();
}
