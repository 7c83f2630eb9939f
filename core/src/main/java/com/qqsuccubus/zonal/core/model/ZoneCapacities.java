package com.qqsuccubus.zonal.core.model;

import com.google.common.collect.ImmutableSortedMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Comparator;
import java.util.Map;
import java.util.Set;

/**
 * Total capacity per zone of one registry snapshot, plus the fleet-wide total.
 * <p>
 * <b>Invariant:</b> the per-zone values sum to {@link #getTotalCapacity()} and the keys are
 * exactly the zones present in the snapshot.
 * </p>
 *
 * @param <Z> zone identifier type
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ZoneCapacities<Z extends Comparable<? super Z>> {

    private final ImmutableSortedMap<Z, Double> perZone;
    private final double totalCapacity;

    /**
     * @param perZone Total capacity of every zone hosting at least one backend
     * @throws IllegalArgumentException if the map is empty or a capacity is not positive and finite
     */
    public ZoneCapacities(Map<Z, Double> perZone) {
        if (perZone.isEmpty()) {
            throw new IllegalArgumentException("perZone must contain at least one zone");
        }
        this.perZone = ImmutableSortedMap.copyOf(perZone, Comparator.<Z>naturalOrder());

        double total = 0.0;
        for (Map.Entry<Z, Double> e : this.perZone.entrySet()) {
            double capacity = e.getValue();
            if (!(capacity > 0.0) || Double.isInfinite(capacity)) {
                throw new IllegalArgumentException(
                    "capacity of zone " + e.getKey() + " must be positive and finite, was " + capacity);
            }
            total += capacity;
        }
        this.totalCapacity = total;
    }

    public int getZoneCount() {
        return perZone.size();
    }

    public Set<Z> zones() {
        return perZone.keySet();
    }

    public boolean contains(Z zone) {
        return perZone.containsKey(zone);
    }

    /**
     * @return Total capacity of the zone, or 0 if no backend lives there
     */
    public double capacityOf(Z zone) {
        Double capacity = perZone.get(zone);
        return capacity != null ? capacity : 0.0;
    }

    /**
     * Fleet-wide average capacity per zone ({@code total / zoneCount}).
     */
    public double averageCapacity() {
        return totalCapacity / perZone.size();
    }

    /**
     * Sum over zones of the capacity above average: {@code Σ max(0, c - avg)}.
     */
    public double surplus() {
        double avg = averageCapacity();
        double surplus = 0.0;
        for (double capacity : perZone.values()) {
            if (capacity > avg) {
                surplus += capacity - avg;
            }
        }
        return surplus;
    }
}
