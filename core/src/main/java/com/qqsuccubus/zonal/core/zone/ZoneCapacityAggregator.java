package com.qqsuccubus.zonal.core.zone;

import com.qqsuccubus.zonal.core.error.EmptyRegistryException;
import com.qqsuccubus.zonal.core.model.Backend;
import com.qqsuccubus.zonal.core.model.RegistrySnapshot;
import com.qqsuccubus.zonal.core.model.ZoneCapacities;

import java.util.HashMap;
import java.util.Map;

/**
 * Reduces a registry snapshot into per-zone and total capacity.
 */
public final class ZoneCapacityAggregator {
    private ZoneCapacityAggregator() {
    }

    /**
     * Sums backend capacity per zone in a single pass; the total is the sum of the zone totals.
     *
     * @param snapshot Registry snapshot to reduce
     * @return Per-zone capacities of the snapshot
     * @throws EmptyRegistryException if the snapshot has no backends
     */
    public static <I, Z extends Comparable<? super Z>> ZoneCapacities<Z> aggregate(RegistrySnapshot<I, Z> snapshot) {
        if (snapshot.isEmpty()) {
            throw new EmptyRegistryException(snapshot.getEpoch());
        }

        Map<Z, Double> perZone = new HashMap<>();
        for (Backend<I, Z> backend : snapshot) {
            perZone.merge(backend.getZone(), backend.getCapacity(), Double::sum);
        }
        return new ZoneCapacities<>(perZone);
    }
}
