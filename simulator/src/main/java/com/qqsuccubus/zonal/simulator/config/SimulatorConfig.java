package com.qqsuccubus.zonal.simulator.config;

import com.google.common.base.Splitter;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.function.Function;

/**
 * Configuration for the simulator, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SimulatorConfig {

    int iterations;          // selections per client
    long seed;               // client k is seeded with seed + k
    String zoneLayout;       // "zone:count,..." in registry order
    double backendCapacity;  // capacity of each generated backend
    @Singular
    List<String> homeZones;  // empty = one client per registry zone
    String registryFile;     // optional JSON registry, replaces zoneLayout
    boolean strictHomeZone;
    boolean reportJson;

    public static SimulatorConfig fromEnv() {
        return from(System::getenv);
    }

    /**
     * Builds the configuration from an arbitrary variable lookup (missing keys map to {@code null}).
     */
    public static SimulatorConfig from(Function<String, String> env) {
        return SimulatorConfig.builder()
            .iterations(Integer.parseInt(get(env, "ITERATIONS", "1000")))
            .seed(Long.parseLong(get(env, "SEED", "42")))
            .zoneLayout(get(env, "ZONE_LAYOUT", "a:1,b:5,c:9"))
            .backendCapacity(Double.parseDouble(get(env, "BACKEND_CAPACITY", "1.0")))
            .homeZones(Splitter.on(',').trimResults().omitEmptyStrings().splitToList(get(env, "HOME_ZONES", "")))
            .registryFile(get(env, "REGISTRY_FILE", ""))
            .strictHomeZone(Boolean.parseBoolean(get(env, "STRICT_HOME_ZONE", "false")))
            .reportJson(Boolean.parseBoolean(get(env, "REPORT_JSON", "false")))
            .build();
    }

    public boolean hasRegistryFile() {
        return registryFile != null && !registryFile.isBlank();
    }

    private static String get(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value != null ? value : defaultValue;
    }
}
