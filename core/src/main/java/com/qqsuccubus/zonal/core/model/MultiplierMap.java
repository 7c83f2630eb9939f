package com.qqsuccubus.zonal.core.model;

import com.google.common.collect.ImmutableSortedMap;
import lombok.EqualsAndHashCode;

import java.util.Comparator;
import java.util.Map;
import java.util.Set;

/**
 * Per-zone traffic multipliers derived for one client.
 * <p>
 * For a backend {@code b}, {@code multiplierOf(b.zone) * b.capacity} is its unnormalized
 * selection weight. Zones without an entry receive no traffic; zero multipliers are never stored.
 * </p>
 * <p>
 * <b>Thread-safety:</b> immutable. Recomputed wholesale when the registry changes.
 * </p>
 *
 * @param <Z> zone identifier type
 */
@EqualsAndHashCode
public final class MultiplierMap<Z extends Comparable<? super Z>> {

    private final ImmutableSortedMap<Z, Double> multipliers;

    private MultiplierMap(ImmutableSortedMap<Z, Double> multipliers) {
        this.multipliers = multipliers;
    }

    /**
     * Builds a map from raw multipliers, dropping zones whose multiplier is zero.
     *
     * @throws IllegalArgumentException if a multiplier is negative or not finite
     */
    public static <Z extends Comparable<? super Z>> MultiplierMap<Z> of(Map<Z, Double> multipliers) {
        ImmutableSortedMap.Builder<Z, Double> builder = ImmutableSortedMap.orderedBy(Comparator.<Z>naturalOrder());
        for (Map.Entry<Z, Double> e : multipliers.entrySet()) {
            double value = e.getValue();
            if (value < 0.0 || !Double.isFinite(value)) {
                throw new IllegalArgumentException("multiplier for zone " + e.getKey() + " must be >= 0, was " + value);
            }
            if (value > 0.0) {
                builder.put(e.getKey(), value);
            }
        }
        return new MultiplierMap<>(builder.build());
    }

    public static <Z extends Comparable<? super Z>> MultiplierMap<Z> singleton(Z zone, double multiplier) {
        return of(Map.of(zone, multiplier));
    }

    public static <Z extends Comparable<? super Z>> MultiplierMap<Z> empty() {
        return new MultiplierMap<>(ImmutableSortedMap.<Z, Double>orderedBy(Comparator.<Z>naturalOrder()).build());
    }

    public boolean contains(Z zone) {
        return multipliers.containsKey(zone);
    }

    /**
     * @return Multiplier of the zone, 0 when the zone receives no traffic
     */
    public double multiplierOf(Z zone) {
        Double value = multipliers.get(zone);
        return value != null ? value : 0.0;
    }

    /**
     * Unnormalized selection weight of a backend for the owning client.
     */
    public double weightOf(Backend<?, Z> backend) {
        return multiplierOf(backend.getZone()) * backend.getCapacity();
    }

    /**
     * {@code Σ multiplier[z] * capacity[z]}; equals 1 for every derived map.
     */
    public double normalizedSum(ZoneCapacities<Z> capacities) {
        double sum = 0.0;
        for (Map.Entry<Z, Double> e : multipliers.entrySet()) {
            sum += e.getValue() * capacities.capacityOf(e.getKey());
        }
        return sum;
    }

    /**
     * Whether all traffic stays in {@code homeZone}.
     */
    public boolean isLocalOnly(Z homeZone) {
        return multipliers.size() == 1 && multipliers.containsKey(homeZone);
    }

    public Set<Z> zones() {
        return multipliers.keySet();
    }

    public Map<Z, Double> asMap() {
        return multipliers;
    }

    public int size() {
        return multipliers.size();
    }

    public boolean isEmpty() {
        return multipliers.isEmpty();
    }

    @Override
    public String toString() {
        return multipliers.toString();
    }
}
