package com.qqsuccubus.zonal.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code zonal.<component>.<metric>}, counters end in {@code .total}.
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: backend selections.
     * <p>
     * Tags: backend, zone, home_zone, locality (in_zone/cross_zone)
     * </p>
     */
    public static final String SIM_SELECTIONS_TOTAL = "zonal.sim.selections.total";

    /**
     * Counter: selections that found no eligible backend.
     * <p>
     * Tags: home_zone
     * </p>
     */
    public static final String SIM_EMPTY_SELECTIONS_TOTAL = "zonal.sim.selections.empty.total";

    /**
     * Gauge: multiplier of a zone for a client.
     * <p>
     * Tags: zone, home_zone
     * </p>
     */
    public static final String CLIENT_ZONE_MULTIPLIER = "zonal.client.zone.multiplier";
}
