package com.qqsuccubus.zonal.simulator.sim;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one simulation run.
 * <p>
 * A backend's load ratio is its selection count divided by the count it would receive under a
 * perfectly uniform spread ({@code selections / backends}); 1.0 means exactly its fair share.
 * </p>
 */
@Value
@Builder
public class SimulationReport {

    int iterations;
    long selections;
    long emptySelections;
    long inZoneSelections;
    double minLoadRatio;
    double maxLoadRatio;
    @Singular
    List<BackendLoad> backends;
    @Singular
    List<ClientSummary> clients;
    Instant generatedAt;

    /**
     * Share of successful selections that stayed in the requesting client's zone.
     */
    public double getInZoneFraction() {
        return selections == 0 ? 0.0 : (double) inZoneSelections / selections;
    }

    @Value
    public static class BackendLoad {
        int id;
        String zone;
        long count;
        double loadRatio;
    }

    @Value
    public static class ClientSummary {
        String homeZone;
        long seed;
        boolean localOnly;
        Map<String, Double> multipliers;
        long selections;
        long inZoneSelections;
        long emptySelections;
    }
}
