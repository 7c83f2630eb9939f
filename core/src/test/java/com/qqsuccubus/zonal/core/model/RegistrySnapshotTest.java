package com.qqsuccubus.zonal.core.model;

import com.qqsuccubus.zonal.core.error.InvalidBackendException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RegistrySnapshotTest {

    @Test
    void testKeepsRegistryOrder_AndSortsZones() {
        RegistrySnapshot<String, String> snapshot = RegistrySnapshot.of(List.of(
            Backend.of("c-1", "c", 2.0),
            Backend.of("a-1", "a", 1.0),
            Backend.of("b-1", "b", 1.5),
            Backend.of("a-2", "a", 1.0)
        ));

        assertEquals(4, snapshot.size());
        assertEquals("c-1", snapshot.backends().get(0).getId());
        assertEquals("a-2", snapshot.backends().get(3).getId());
        assertEquals(List.of("a", "b", "c"), new ArrayList<>(snapshot.zones()));
        assertEquals(1L, snapshot.getEpoch());
    }

    @Test
    void testNextEpoch_IncrementsEpochKeepsPreviousSnapshot() {
        RegistrySnapshot<Integer, String> first = RegistrySnapshot.of(List.of(Backend.of(1, "a", 1.0)));
        RegistrySnapshot<Integer, String> second = first.nextEpoch(List.of(
            Backend.of(1, "a", 1.0),
            Backend.of(2, "b", 1.0)
        ));

        assertEquals(2L, second.getEpoch());
        assertEquals(2, second.size());
        assertEquals(1, first.size());
    }

    @Test
    void testEmptySnapshotAllowed() {
        RegistrySnapshot<Integer, String> snapshot = RegistrySnapshot.of(List.of());

        assertTrue(snapshot.isEmpty());
        assertTrue(snapshot.zones().isEmpty());
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(InvalidBackendException.class,
            () -> RegistrySnapshot.of(List.of(Backend.of(1, "a", 0.0))));
        assertThrows(InvalidBackendException.class,
            () -> RegistrySnapshot.of(List.of(Backend.of(1, "a", -2.0))));
        assertThrows(InvalidBackendException.class,
            () -> RegistrySnapshot.of(List.of(Backend.of(1, "a", Double.NaN))));
        assertThrows(InvalidBackendException.class,
            () -> RegistrySnapshot.of(List.of(Backend.of(1, "a", Double.POSITIVE_INFINITY))));
    }

    @Test
    void testRejectsMissingIdentity() {
        assertThrows(InvalidBackendException.class,
            () -> RegistrySnapshot.of(List.of(Backend.<Integer, String>of(null, "a", 1.0))));
        assertThrows(InvalidBackendException.class,
            () -> RegistrySnapshot.of(List.of(Backend.<Integer, String>of(1, null, 1.0))));
    }

    @Test
    void testRejectsDuplicateIds() {
        InvalidBackendException e = assertThrows(InvalidBackendException.class,
            () -> RegistrySnapshot.of(List.of(Backend.of(7, "a", 1.0), Backend.of(7, "b", 1.0))));

        assertTrue(e.getMessage().contains("7"));
    }

    @Test
    void testBackendLabelsAreCopied() {
        Map<String, String> labels = new HashMap<>();
        labels.put("tier", "gold");
        Backend<Integer, String> backend = Backend.of(1, "a", 1.0, labels);
        labels.put("tier", "silver");

        assertEquals("gold", backend.label("tier"));
        assertNull(backend.label("missing"));
        assertTrue(Backend.of(2, "a", 1.0).getLabels().isEmpty());
    }
}
