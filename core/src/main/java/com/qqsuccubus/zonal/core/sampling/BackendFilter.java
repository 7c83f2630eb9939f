package com.qqsuccubus.zonal.core.sampling;

import com.google.common.collect.ImmutableSet;
import com.qqsuccubus.zonal.core.model.Backend;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Eligibility predicate applied to every backend before it is weighed.
 *
 * @param <I> backend identifier type
 * @param <Z> zone identifier type
 */
@FunctionalInterface
public interface BackendFilter<I, Z extends Comparable<? super Z>> {

    boolean test(Backend<I, Z> backend);

    default BackendFilter<I, Z> and(BackendFilter<I, Z> other) {
        Objects.requireNonNull(other, "other");
        return b -> test(b) && other.test(b);
    }

    default BackendFilter<I, Z> or(BackendFilter<I, Z> other) {
        Objects.requireNonNull(other, "other");
        return b -> test(b) || other.test(b);
    }

    default BackendFilter<I, Z> negate() {
        return b -> !test(b);
    }

    static <I, Z extends Comparable<? super Z>> BackendFilter<I, Z> all() {
        return b -> true;
    }

    static <I, Z extends Comparable<? super Z>> BackendFilter<I, Z> none() {
        return b -> false;
    }

    static <I, Z extends Comparable<? super Z>> BackendFilter<I, Z> inZones(Collection<? extends Z> zones) {
        Set<Z> allowed = ImmutableSet.copyOf(zones);
        return b -> allowed.contains(b.getZone());
    }

    static <I, Z extends Comparable<? super Z>> BackendFilter<I, Z> withIds(Collection<? extends I> ids) {
        Set<I> allowed = ImmutableSet.copyOf(ids);
        return b -> allowed.contains(b.getId());
    }

    /**
     * Matches backends whose label {@code key} equals {@code value}.
     */
    static <I, Z extends Comparable<? super Z>> BackendFilter<I, Z> withLabel(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        return b -> value.equals(b.label(key));
    }
}
