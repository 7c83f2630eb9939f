package com.qqsuccubus.zonal.core.model;

import com.google.common.collect.ImmutableMap;
import lombok.Value;

import java.util.Map;

/**
 * Immutable descriptor of a backend that can receive traffic.
 * <p>
 * Capacity is a relative serving capability (e.g. a concurrency budget), not an absolute unit.
 * It is validated when the backend is placed in a {@link RegistrySnapshot}.
 * </p>
 *
 * @param <I> backend identifier type
 * @param <Z> zone identifier type
 */
@Value
public class Backend<I, Z extends Comparable<? super Z>> {
    /**
     * Opaque identifier, unique within a registry snapshot.
     */
    I id;

    /**
     * Availability zone hosting this backend.
     */
    Z zone;

    /**
     * Relative capacity; must be positive and finite.
     */
    double capacity;

    /**
     * Free-form labels used by capability filters (e.g. subset or tier).
     */
    Map<String, String> labels;

    public Backend(I id, Z zone, double capacity, Map<String, String> labels) {
        this.id = id;
        this.zone = zone;
        this.capacity = capacity;
        this.labels = labels == null ? ImmutableMap.of() : ImmutableMap.copyOf(labels);
    }

    public static <I, Z extends Comparable<? super Z>> Backend<I, Z> of(I id, Z zone, double capacity) {
        return new Backend<>(id, zone, capacity, ImmutableMap.of());
    }

    public static <I, Z extends Comparable<? super Z>> Backend<I, Z> of(I id, Z zone, double capacity,
                                                                       Map<String, String> labels) {
        return new Backend<>(id, zone, capacity, labels);
    }

    public String label(String key) {
        return labels.get(key);
    }
}
