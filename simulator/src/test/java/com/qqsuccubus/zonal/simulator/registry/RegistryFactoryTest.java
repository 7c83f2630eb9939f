package com.qqsuccubus.zonal.simulator.registry;

import com.qqsuccubus.zonal.core.error.InvalidBackendException;
import com.qqsuccubus.zonal.core.model.Backend;
import com.qqsuccubus.zonal.core.model.RegistrySnapshot;
import com.qqsuccubus.zonal.simulator.config.SimulatorConfig;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegistryFactoryTest {

    @Test
    void testFromLayout_AssignsSequentialIdsInZoneOrder() {
        RegistrySnapshot<Integer, String> snapshot = RegistryFactory.fromLayout("a:1,b:5,c:9", 1.0);

        assertEquals(15, snapshot.size());
        assertEquals("a", snapshot.backends().get(0).getZone());
        assertEquals("b", snapshot.backends().get(1).getZone());
        assertEquals("b", snapshot.backends().get(5).getZone());
        assertEquals("c", snapshot.backends().get(6).getZone());
        for (int i = 0; i < snapshot.size(); i++) {
            assertEquals(i, snapshot.backends().get(i).getId());
            assertEquals(1.0, snapshot.backends().get(i).getCapacity());
        }
    }

    @Test
    void testFromLayout_ZeroCountZoneIsSkipped() {
        RegistrySnapshot<Integer, String> snapshot = RegistryFactory.fromLayout("a:2, d:0 ,b:1", 3.0);

        assertEquals(3, snapshot.size());
        assertEquals(List.of("a", "b"), List.copyOf(snapshot.zones()));
    }

    @Test
    void testFromLayout_RejectsMalformedEntries() {
        assertThrows(IllegalArgumentException.class, () -> RegistryFactory.fromLayout("a", 1.0));
        assertThrows(IllegalArgumentException.class, () -> RegistryFactory.fromLayout("a:x", 1.0));
        assertThrows(IllegalArgumentException.class, () -> RegistryFactory.fromLayout("a:-1", 1.0));
        assertThrows(IllegalArgumentException.class, () -> RegistryFactory.fromLayout(":3", 1.0));
    }

    @Test
    void testFromLayout_RejectsNonPositiveCapacity() {
        assertThrows(InvalidBackendException.class, () -> RegistryFactory.fromLayout("a:1", 0.0));
    }

    @Test
    void testFromJsonFile() throws URISyntaxException {
        Path file = Path.of(getClass().getResource("/registry.json").toURI());

        RegistrySnapshot<Integer, String> snapshot = RegistryFactory.fromJson(file);

        assertEquals(4, snapshot.size());
        Backend<Integer, String> first = snapshot.backends().get(0);
        assertEquals(10, first.getId());
        assertEquals("eu-west-1a", first.getZone());
        assertEquals(4.0, first.getCapacity());
        assertEquals("gold", first.label("tier"));
        assertTrue(snapshot.backends().get(2).getLabels().isEmpty());
    }

    @Test
    void testFromConfig_PrefersRegistryFile() throws URISyntaxException {
        Path file = Path.of(getClass().getResource("/registry.json").toURI());
        SimulatorConfig config = SimulatorConfig.from(key -> null).toBuilder()
            .registryFile(file.toString())
            .build();

        assertEquals(4, RegistryFactory.fromConfig(config).size());
        assertEquals(15, RegistryFactory.fromConfig(SimulatorConfig.from(key -> null)).size());
    }

    @Test
    void testFromJsonString_RejectsDuplicateIds() {
        String json = "[{\"id\":1,\"zone\":\"a\",\"capacity\":1.0},{\"id\":1,\"zone\":\"b\",\"capacity\":1.0}]";

        assertThrows(InvalidBackendException.class, () -> RegistryFactory.fromJson(json));
    }

    @Test
    void testFromJsonString_MalformedJsonFails() {
        assertThrows(RuntimeException.class, () -> RegistryFactory.fromJson("[{\"id\":"));
    }
}
