package com.qqsuccubus.zonal.simulator;

import com.qqsuccubus.zonal.core.model.RegistrySnapshot;
import com.qqsuccubus.zonal.core.util.JsonUtils;
import com.qqsuccubus.zonal.simulator.config.SimulatorConfig;
import com.qqsuccubus.zonal.simulator.registry.RegistryFactory;
import com.qqsuccubus.zonal.simulator.sim.SimulationReport;
import com.qqsuccubus.zonal.simulator.sim.ZonalSimulation;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: simulates zonal clients against a registry and prints how evenly
 * the backends were loaded.
 */
public class SimulatorApp {
    private static final Logger log = LoggerFactory.getLogger(SimulatorApp.class);

    public static void main(String[] args) {
        SimulatorConfig config = SimulatorConfig.fromEnv();

        log.info("Starting zonal simulation");
        log.info("  Iterations per client: {}", config.getIterations());
        log.info("  Seed: {}", config.getSeed());
        log.info("  Registry: {}", config.hasRegistryFile() ? config.getRegistryFile() : config.getZoneLayout());

        RegistrySnapshot<Integer, String> snapshot = RegistryFactory.fromConfig(config);
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

        SimulationReport report = new ZonalSimulation(config, snapshot, meterRegistry).run().block();
        if (report == null) {
            log.error("Simulation produced no report");
            return;
        }

        for (SimulationReport.BackendLoad load : report.getBackends()) {
            log.info("[{}] {}", load.getZone(), String.format("%.5f", load.getLoadRatio()));
        }
        log.info("% in-zone = {}", report.getInZoneFraction());
        if (report.getEmptySelections() > 0) {
            log.warn("{} selections found no eligible backend", report.getEmptySelections());
        }

        if (config.isReportJson()) {
            log.info("Report:\n{}", JsonUtils.writePretty(report));
        }
    }
}
