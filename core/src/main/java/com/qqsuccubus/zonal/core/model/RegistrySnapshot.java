package com.qqsuccubus.zonal.core.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.qqsuccubus.zonal.core.error.InvalidBackendException;
import lombok.Getter;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Ordered, immutable view of the backends visible to every client during one weight-computation epoch.
 * <p>
 * <b>Validation:</b> every backend must carry an id and a zone, a positive finite capacity,
 * and an id not used by another backend of the same snapshot.
 * Topology changes produce a new snapshot via {@link #nextEpoch(List)}; snapshots are never mutated.
 * </p>
 * <p>
 * <b>Thread-safety:</b> immutable; safe for concurrent reads by any number of clients.
 * </p>
 *
 * @param <I> backend identifier type
 * @param <Z> zone identifier type
 */
public final class RegistrySnapshot<I, Z extends Comparable<? super Z>> implements Iterable<Backend<I, Z>> {

    @Getter
    private final long epoch;
    private final ImmutableList<Backend<I, Z>> backends;

    private RegistrySnapshot(long epoch, ImmutableList<Backend<I, Z>> backends) {
        this.epoch = epoch;
        this.backends = backends;
    }

    /**
     * Builds a snapshot for the first epoch.
     *
     * @param backends Backends in registry order
     * @return Validated snapshot
     * @throws InvalidBackendException if any backend violates the snapshot rules
     */
    public static <I, Z extends Comparable<? super Z>> RegistrySnapshot<I, Z> of(List<Backend<I, Z>> backends) {
        return of(1L, backends);
    }

    public static <I, Z extends Comparable<? super Z>> RegistrySnapshot<I, Z> of(long epoch,
                                                                                List<Backend<I, Z>> backends) {
        if (backends == null) {
            throw new InvalidBackendException("backends must not be null");
        }
        Set<I> seenIds = new HashSet<>();
        for (Backend<I, Z> backend : backends) {
            validate(backend);
            if (!seenIds.add(backend.getId())) {
                throw new InvalidBackendException("Duplicate backend id: " + backend.getId());
            }
        }
        return new RegistrySnapshot<>(epoch, ImmutableList.copyOf(backends));
    }

    /**
     * Builds the replacement snapshot for the next epoch.
     */
    public RegistrySnapshot<I, Z> nextEpoch(List<Backend<I, Z>> backends) {
        return of(epoch + 1, backends);
    }

    private static void validate(Backend<?, ?> backend) {
        if (backend == null) {
            throw new InvalidBackendException("backend must not be null");
        }
        if (backend.getId() == null) {
            throw new InvalidBackendException("backend id must not be null");
        }
        if (backend.getZone() == null) {
            throw new InvalidBackendException("zone of backend " + backend.getId() + " must not be null");
        }
        double capacity = backend.getCapacity();
        if (!(capacity > 0.0) || Double.isInfinite(capacity)) {
            throw new InvalidBackendException(
                "capacity of backend " + backend.getId() + " must be positive and finite, was " + capacity);
        }
    }

    public List<Backend<I, Z>> backends() {
        return backends;
    }

    public int size() {
        return backends.size();
    }

    public boolean isEmpty() {
        return backends.isEmpty();
    }

    /**
     * Distinct zones of this snapshot in natural order.
     */
    public Set<Z> zones() {
        ImmutableSortedSet.Builder<Z> zones = ImmutableSortedSet.naturalOrder();
        for (Backend<I, Z> backend : backends) {
            zones.add(backend.getZone());
        }
        return zones.build();
    }

    @Override
    public Iterator<Backend<I, Z>> iterator() {
        return backends.iterator();
    }

    @Override
    public String toString() {
        return "RegistrySnapshot{epoch=" + epoch + ", backends=" + backends.size() + "}";
    }
}
