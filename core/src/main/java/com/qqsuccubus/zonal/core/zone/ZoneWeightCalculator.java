package com.qqsuccubus.zonal.core.zone;

import com.google.common.math.DoubleMath;
import com.qqsuccubus.zonal.core.error.UnknownHomeZoneException;
import com.qqsuccubus.zonal.core.model.MultiplierMap;
import com.qqsuccubus.zonal.core.model.ZoneCapacities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Derives the per-zone multipliers of a client from the fleet's zone capacities.
 * <p>
 * <b>Formula:</b> with {@code avg = total / zones} and {@code home = capacity[homeZone]}:
 * <ul>
 *   <li>{@code home >= avg}: all traffic stays in the home zone.</li>
 *   <li>{@code home < avg}: a fraction {@code home / avg} stays local; the rest is spread over
 *       zones above average, proportionally to each zone's share of the total surplus
 *       {@code Σ max(0, c - avg)}. Zones at or below average receive nothing.</li>
 * </ul>
 * Each zone weight is divided by the zone's capacity, so multiplying the result by one backend's
 * capacity yields that backend's share of the zone weight, and
 * {@code Σ multiplier[z] * capacity[z] == 1}.
 * </p>
 * <p>
 * <b>Rationale:</b> zones under the average must not absorb extra traffic from other zones, while
 * zones over it absorb spillover in proportion to their surplus, so per-backend load converges to
 * uniform regardless of where clients sit.
 * </p>
 */
public final class ZoneWeightCalculator {
    private static final Logger log = LoggerFactory.getLogger(ZoneWeightCalculator.class);

    /**
     * Allowed drift of {@code Σ multiplier * capacity} from 1.
     */
    public static final double NORMALIZATION_TOLERANCE = 1e-9;

    private static final ZoneWeightCalculator LENIENT = new ZoneWeightCalculator(false);
    private static final ZoneWeightCalculator STRICT = new ZoneWeightCalculator(true);

    private final boolean requireHomeZone;

    private ZoneWeightCalculator(boolean requireHomeZone) {
        this.requireHomeZone = requireHomeZone;
    }

    /**
     * Calculator tolerating a home zone without backends (all traffic then leaves the zone).
     */
    public static ZoneWeightCalculator lenient() {
        return LENIENT;
    }

    /**
     * Calculator rejecting a home zone without backends.
     */
    public static ZoneWeightCalculator strict() {
        return STRICT;
    }

    public boolean isStrict() {
        return requireHomeZone;
    }

    /**
     * Computes the multipliers for a client located in {@code homeZone}.
     *
     * @param capacities Zone capacities of the current registry snapshot
     * @param homeZone   Zone of the client
     * @return Multipliers; zones absent from the result receive no traffic
     * @throws UnknownHomeZoneException if this calculator is strict and the home zone has no backends
     */
    public <Z extends Comparable<? super Z>> MultiplierMap<Z> calculate(ZoneCapacities<Z> capacities, Z homeZone) {
        Objects.requireNonNull(capacities, "capacities");
        Objects.requireNonNull(homeZone, "homeZone");

        if (requireHomeZone && !capacities.contains(homeZone)) {
            throw new UnknownHomeZoneException(homeZone);
        }

        double avg = capacities.averageCapacity();
        double home = capacities.capacityOf(homeZone);

        if (home >= avg) {
            return MultiplierMap.singleton(homeZone, 1.0 / home);
        }

        double surplus = capacities.surplus();
        if (surplus <= 0.0) {
            return degenerate(capacities, homeZone);
        }

        // Under-capacity home zone: keep what the zone can absorb, spill the rest
        double inZone = home / avg;
        double crossZone = 1.0 - inZone;

        Map<Z, Double> multipliers = new HashMap<>();
        for (Map.Entry<Z, Double> e : capacities.getPerZone().entrySet()) {
            Z zone = e.getKey();
            double zoneCapacity = e.getValue();
            double zoneWeight;
            if (zone.equals(homeZone)) {
                zoneWeight = inZone;
            } else if (zoneCapacity <= avg) {
                zoneWeight = 0.0;
            } else {
                zoneWeight = crossZone * (zoneCapacity - avg) / surplus;
            }
            multipliers.put(zone, zoneWeight / zoneCapacity);
        }

        MultiplierMap<Z> result = MultiplierMap.of(multipliers);
        verifyNormalized(result, capacities, homeZone);
        return result;
    }

    /**
     * No zone above average while the home zone sits below it, which only rounding can produce.
     * Traffic stays in-zone; a home zone without backends then receives nothing at all.
     */
    private <Z extends Comparable<? super Z>> MultiplierMap<Z> degenerate(ZoneCapacities<Z> capacities, Z homeZone) {
        double home = capacities.capacityOf(homeZone);
        if (home > 0.0) {
            log.warn("No surplus capacity while home zone {} is below average; routing in-zone only", homeZone);
            return MultiplierMap.singleton(homeZone, 1.0 / home);
        }

        log.warn("Home zone {} has no backends and no zone has surplus; no backend can be selected", homeZone);
        return MultiplierMap.empty();
    }

    private static <Z extends Comparable<? super Z>> void verifyNormalized(MultiplierMap<Z> multipliers,
                                                                            ZoneCapacities<Z> capacities,
                                                                            Z homeZone) {
        double sum = multipliers.normalizedSum(capacities);
        if (!DoubleMath.fuzzyEquals(sum, 1.0, NORMALIZATION_TOLERANCE)) {
            log.warn("Multipliers for home zone {} sum to {} instead of 1: {}", homeZone, sum, multipliers);
        }
    }
}
