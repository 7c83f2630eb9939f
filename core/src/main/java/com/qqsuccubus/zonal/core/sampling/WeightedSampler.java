package com.qqsuccubus.zonal.core.sampling;

import com.qqsuccubus.zonal.core.model.Backend;
import com.qqsuccubus.zonal.core.model.MultiplierMap;

import java.util.Optional;

/**
 * One-pass weighted random selection of a single backend (weighted reservoir of size 1).
 * <p>
 * <b>Algorithm:</b> walk the backends once, keeping a running total of the weights seen so far.
 * Each candidate of weight {@code w} first adds {@code w} to the total, then replaces the current
 * pick with probability {@code w / total}. Backend {@code i} ends up selected with probability
 * {@code w_i / Σ w_j} whatever the order; no cumulative-weight table is built.
 * </p>
 * <p>
 * Backends are skipped without consuming a draw when the filter rejects them, when their zone has
 * no multiplier, or when their weight is not positive.
 * </p>
 * <p>
 * <b>Thread-safety:</b> stateless; the random source passed in must not be shared across threads.
 * </p>
 */
public final class WeightedSampler {
    private WeightedSampler() {
    }

    /**
     * Selects the id of one backend.
     *
     * @param backends    Candidates in registry order
     * @param multipliers Multipliers of the calling client
     * @param filter      Eligibility filter
     * @param random      Random source of the calling client
     * @return Selected id, or empty if no backend is eligible with a positive weight
     */
    public static <I, Z extends Comparable<? super Z>> Optional<I> select(Iterable<Backend<I, Z>> backends,
                                                                         MultiplierMap<Z> multipliers,
                                                                         BackendFilter<I, Z> filter,
                                                                         RandomSource random) {
        return selectBackend(backends, multipliers, filter, random).map(Backend::getId);
    }

    /**
     * Same as {@link #select}, returning the full backend record.
     */
    public static <I, Z extends Comparable<? super Z>> Optional<Backend<I, Z>> selectBackend(
            Iterable<Backend<I, Z>> backends,
            MultiplierMap<Z> multipliers,
            BackendFilter<I, Z> filter,
            RandomSource random) {
        Backend<I, Z> current = null;
        double totalWeight = 0.0;

        for (Backend<I, Z> backend : backends) {
            if (!filter.test(backend) || !multipliers.contains(backend.getZone())) {
                continue;
            }
            double weight = multipliers.weightOf(backend);
            if (!(weight > 0.0)) {
                continue;
            }
            // Total must include this candidate before the acceptance draw
            totalWeight += weight;
            if (random.nextDouble() < weight / totalWeight) {
                current = backend;
            }
        }
        return Optional.ofNullable(current);
    }
}
