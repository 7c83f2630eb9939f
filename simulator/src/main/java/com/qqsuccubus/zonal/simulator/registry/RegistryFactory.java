package com.qqsuccubus.zonal.simulator.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.base.Splitter;
import com.qqsuccubus.zonal.core.model.Backend;
import com.qqsuccubus.zonal.core.model.RegistrySnapshot;
import com.qqsuccubus.zonal.core.util.JsonUtils;
import com.qqsuccubus.zonal.simulator.config.SimulatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the registry snapshot fed to the simulated clients.
 */
public final class RegistryFactory {
    private static final Logger log = LoggerFactory.getLogger(RegistryFactory.class);

    private static final TypeReference<List<BackendRecord>> RECORDS = new TypeReference<>() {
    };

    private RegistryFactory() {
    }

    public static RegistrySnapshot<Integer, String> fromConfig(SimulatorConfig config) {
        if (config.hasRegistryFile()) {
            return fromJson(Path.of(config.getRegistryFile()));
        }
        return fromLayout(config.getZoneLayout(), config.getBackendCapacity());
    }

    /**
     * Generates backends from a layout such as {@code "a:1,b:5,c:9"}: one zone after the other,
     * ids assigned sequentially from 0.
     *
     * @throws IllegalArgumentException if an entry is not {@code zone:count} with a non-negative count
     */
    public static RegistrySnapshot<Integer, String> fromLayout(String layout, double capacity) {
        List<Backend<Integer, String>> backends = new ArrayList<>();
        for (String entry : Splitter.on(',').trimResults().omitEmptyStrings().split(layout)) {
            List<String> parts = Splitter.on(':').trimResults().splitToList(entry);
            if (parts.size() != 2 || parts.get(0).isEmpty()) {
                throw new IllegalArgumentException("Invalid zone layout entry '" + entry + "', expected zone:count");
            }
            int count;
            try {
                count = Integer.parseInt(parts.get(1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid backend count in '" + entry + "'", e);
            }
            if (count < 0) {
                throw new IllegalArgumentException("Backend count must be >= 0 in '" + entry + "'");
            }
            for (int i = 0; i < count; i++) {
                backends.add(Backend.of(backends.size(), parts.get(0), capacity));
            }
        }
        log.info("Generated {} backends from layout '{}'", backends.size(), layout);
        return RegistrySnapshot.of(backends);
    }

    /**
     * Loads backends from a JSON array of {@code {"id", "zone", "capacity", "labels"}} objects.
     */
    public static RegistrySnapshot<Integer, String> fromJson(Path file) {
        List<BackendRecord> records = JsonUtils.readValue(file, RECORDS);
        return fromRecords(records);
    }

    public static RegistrySnapshot<Integer, String> fromJson(String json) {
        return fromRecords(JsonUtils.readValue(json, RECORDS));
    }

    private static RegistrySnapshot<Integer, String> fromRecords(List<BackendRecord> records) {
        List<Backend<Integer, String>> backends = new ArrayList<>(records.size());
        for (BackendRecord record : records) {
            backends.add(record.toBackend());
        }
        log.info("Loaded {} backends from registry file", backends.size());
        return RegistrySnapshot.of(backends);
    }
}
