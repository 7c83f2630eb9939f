package com.qqsuccubus.zonal.core.sampling;

import com.qqsuccubus.zonal.core.model.Backend;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BackendFilterTest {

    private final Backend<String, String> gold = Backend.of("b-1", "a", 1.0, Map.of("tier", "gold"));
    private final Backend<String, String> silver = Backend.of("b-2", "b", 1.0, Map.of("tier", "silver"));
    private final Backend<String, String> plain = Backend.of("b-3", "c", 1.0);

    @Test
    void testAllAndNone() {
        assertTrue(BackendFilter.<String, String>all().test(plain));
        assertFalse(BackendFilter.<String, String>none().test(plain));
    }

    @Test
    void testInZones() {
        BackendFilter<String, String> filter = BackendFilter.inZones(List.of("a", "c"));

        assertTrue(filter.test(gold));
        assertFalse(filter.test(silver));
        assertTrue(filter.test(plain));
    }

    @Test
    void testWithIds() {
        BackendFilter<String, String> filter = BackendFilter.withIds(List.of("b-2"));

        assertFalse(filter.test(gold));
        assertTrue(filter.test(silver));
    }

    @Test
    void testWithLabel() {
        BackendFilter<String, String> filter = BackendFilter.withLabel("tier", "gold");

        assertTrue(filter.test(gold));
        assertFalse(filter.test(silver));
        assertFalse(filter.test(plain));
    }

    @Test
    void testCombinators() {
        BackendFilter<String, String> goldOrZoneC = BackendFilter.<String, String>withLabel("tier", "gold")
            .or(BackendFilter.inZones(List.of("c")));
        BackendFilter<String, String> notGold = BackendFilter.<String, String>withLabel("tier", "gold").negate();
        BackendFilter<String, String> silverInB = BackendFilter.<String, String>withLabel("tier", "silver")
            .and(BackendFilter.inZones(List.of("b")));

        assertTrue(goldOrZoneC.test(gold));
        assertTrue(goldOrZoneC.test(plain));
        assertFalse(goldOrZoneC.test(silver));
        assertFalse(notGold.test(gold));
        assertTrue(notGold.test(plain));
        assertTrue(silverInB.test(silver));
        assertFalse(silverInB.test(gold));
    }
}
