package com.qqsuccubus.zonal.core.zone;

import com.qqsuccubus.zonal.core.error.EmptyRegistryException;
import com.qqsuccubus.zonal.core.model.Backend;
import com.qqsuccubus.zonal.core.model.RegistrySnapshot;
import com.qqsuccubus.zonal.core.model.ZoneCapacities;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ZoneCapacityAggregatorTest {

    @Test
    void testSumsPerZoneAndTotal() {
        RegistrySnapshot<Integer, String> snapshot = RegistrySnapshot.of(List.of(
            Backend.of(0, "a", 1.0),
            Backend.of(1, "b", 2.5),
            Backend.of(2, "b", 0.5),
            Backend.of(3, "c", 4.0)
        ));

        ZoneCapacities<String> capacities = ZoneCapacityAggregator.aggregate(snapshot);

        assertEquals(3, capacities.getZoneCount());
        assertEquals(8.0, capacities.getTotalCapacity(), 1e-12);
        assertEquals(1.0, capacities.capacityOf("a"), 1e-12);
        assertEquals(3.0, capacities.capacityOf("b"), 1e-12);
        assertEquals(4.0, capacities.capacityOf("c"), 1e-12);
        assertEquals(0.0, capacities.capacityOf("d"), 1e-12);
        assertFalse(capacities.contains("d"));

        double sum = capacities.getPerZone().values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(capacities.getTotalCapacity(), sum, 1e-12);
    }

    @Test
    void testAverageAndSurplus() {
        RegistrySnapshot<Integer, String> snapshot = RegistrySnapshot.of(List.of(
            Backend.of(0, "a", 1.0),
            Backend.of(1, "b", 5.0),
            Backend.of(2, "c", 9.0)
        ));

        ZoneCapacities<String> capacities = ZoneCapacityAggregator.aggregate(snapshot);

        assertEquals(5.0, capacities.averageCapacity(), 1e-12);
        // only zone c is above average
        assertEquals(4.0, capacities.surplus(), 1e-12);
    }

    @Test
    void testEmptyRegistry_Fails() {
        RegistrySnapshot<Integer, String> empty = RegistrySnapshot.of(List.of());

        assertThrows(EmptyRegistryException.class, () -> ZoneCapacityAggregator.aggregate(empty));
    }

    @Test
    void testWorksWithNonStringZones() {
        RegistrySnapshot<String, Integer> snapshot = RegistrySnapshot.of(List.of(
            Backend.of("x", 20, 1.0),
            Backend.of("y", 10, 1.0),
            Backend.of("z", 20, 1.0)
        ));

        ZoneCapacities<Integer> capacities = ZoneCapacityAggregator.aggregate(snapshot);

        assertEquals(List.of(10, 20), List.copyOf(capacities.zones()));
        assertEquals(2.0, capacities.capacityOf(20), 1e-12);
    }
}
