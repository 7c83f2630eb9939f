package com.qqsuccubus.zonal.simulator.sim;

import com.qqsuccubus.zonal.core.client.ZonalClient;
import com.qqsuccubus.zonal.core.metrics.MetricsNames;
import com.qqsuccubus.zonal.core.metrics.MetricsTags;
import com.qqsuccubus.zonal.core.model.Backend;
import com.qqsuccubus.zonal.core.model.RegistrySnapshot;
import com.qqsuccubus.zonal.core.model.ZoneCapacities;
import com.qqsuccubus.zonal.core.sampling.BackendFilter;
import com.qqsuccubus.zonal.core.sampling.RandomSources;
import com.qqsuccubus.zonal.core.zone.ZoneCapacityAggregator;
import com.qqsuccubus.zonal.core.zone.ZoneWeightCalculator;
import com.qqsuccubus.zonal.simulator.config.SimulatorConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one zonal client per home zone against a shared registry snapshot and tallies where
 * their selections land.
 * <p>
 * Clients share no mutable state, so each runs on its own rail of the parallel scheduler.
 * Every client {@code k} gets its own random source seeded with {@code seed + k}, which makes a
 * run reproducible for a given configuration.
 * </p>
 */
public class ZonalSimulation {
    private static final Logger log = LoggerFactory.getLogger(ZonalSimulation.class);

    private final SimulatorConfig config;
    private final RegistrySnapshot<Integer, String> snapshot;
    private final MeterRegistry meterRegistry;
    private final BackendFilter<Integer, String> filter;

    // backend id -> position in the snapshot
    private final Map<Integer, Integer> positions = new HashMap<>();

    public ZonalSimulation(SimulatorConfig config,
                           RegistrySnapshot<Integer, String> snapshot,
                           MeterRegistry meterRegistry) {
        this(config, snapshot, meterRegistry, BackendFilter.all());
    }

    public ZonalSimulation(SimulatorConfig config,
                           RegistrySnapshot<Integer, String> snapshot,
                           MeterRegistry meterRegistry,
                           BackendFilter<Integer, String> filter) {
        this.config = config;
        this.snapshot = snapshot;
        this.meterRegistry = meterRegistry;
        this.filter = filter;

        List<Backend<Integer, String>> backends = snapshot.backends();
        for (int i = 0; i < backends.size(); i++) {
            positions.put(backends.get(i).getId(), i);
        }
    }

    /**
     * Runs every client for the configured number of iterations.
     * Fails with the client construction error if the registry is empty or a strict home zone is unknown.
     */
    public Mono<SimulationReport> run() {
        return Mono.fromCallable(() -> ZoneCapacityAggregator.aggregate(snapshot))
            .flatMapMany(capacities -> Flux.fromIterable(plan(capacities)))
            .parallel()
            .runOn(Schedulers.parallel())
            .map(this::runClient)
            .sequential()
            .collectList()
            .map(this::buildReport)
            .doOnNext(report -> log.info("Simulation finished: {} selections, in-zone fraction {}",
                report.getSelections(), String.format("%.5f", report.getInZoneFraction())))
            .doOnError(err -> log.error("Simulation failed", err));
    }

    private List<ClientPlan> plan(ZoneCapacities<String> capacities) {
        List<String> homeZones = config.getHomeZones().isEmpty()
            ? new ArrayList<>(capacities.zones())
            : config.getHomeZones();

        List<ClientPlan> plans = new ArrayList<>(homeZones.size());
        for (int k = 0; k < homeZones.size(); k++) {
            plans.add(new ClientPlan(k, homeZones.get(k), config.getSeed() + k));
        }
        return plans;
    }

    private ClientRun runClient(ClientPlan plan) {
        ZoneWeightCalculator calculator = config.isStrictHomeZone()
            ? ZoneWeightCalculator.strict()
            : ZoneWeightCalculator.lenient();
        ZonalClient<Integer, String> client = new ZonalClient<>(
            plan.homeZone, snapshot, RandomSources.seeded(plan.seed), calculator);

        registerMultiplierGauges(client);

        List<Backend<Integer, String>> backends = snapshot.backends();
        Counter[] counters = new Counter[backends.size()];
        for (int i = 0; i < backends.size(); i++) {
            Backend<Integer, String> backend = backends.get(i);
            counters[i] = Counter.builder(MetricsNames.SIM_SELECTIONS_TOTAL)
                .tag(MetricsTags.BACKEND, String.valueOf(backend.getId()))
                .tag(MetricsTags.ZONE, backend.getZone())
                .tag(MetricsTags.HOME_ZONE, plan.homeZone)
                .tag(MetricsTags.LOCALITY, backend.getZone().equals(plan.homeZone)
                    ? MetricsTags.IN_ZONE
                    : MetricsTags.CROSS_ZONE)
                .register(meterRegistry);
        }
        Counter emptyCounter = Counter.builder(MetricsNames.SIM_EMPTY_SELECTIONS_TOTAL)
            .tag(MetricsTags.HOME_ZONE, plan.homeZone)
            .register(meterRegistry);

        long[] tally = new long[backends.size()];
        long inZone = 0;
        long empty = 0;
        for (int i = 0; i < config.getIterations(); i++) {
            Optional<Integer> selected = client.selectBackend(filter);
            if (selected.isEmpty()) {
                empty++;
                emptyCounter.increment();
                continue;
            }
            int position = positions.get(selected.get());
            tally[position]++;
            counters[position].increment();
            if (backends.get(position).getZone().equals(plan.homeZone)) {
                inZone++;
            }
        }

        log.debug("Client {} in zone {} done: inZone={}, empty={}", plan.index, plan.homeZone, inZone, empty);
        return new ClientRun(plan, client.isLocalOnly(), client.getMultipliers().asMap(), tally, inZone, empty);
    }

    private void registerMultiplierGauges(ZonalClient<Integer, String> client) {
        for (Map.Entry<String, Double> e : client.getMultipliers().asMap().entrySet()) {
            double multiplier = e.getValue();
            Gauge.builder(MetricsNames.CLIENT_ZONE_MULTIPLIER, () -> multiplier)
                .tag(MetricsTags.ZONE, e.getKey())
                .tag(MetricsTags.HOME_ZONE, client.getHomeZone())
                .register(meterRegistry);
        }
    }

    private SimulationReport buildReport(List<ClientRun> runs) {
        List<ClientRun> ordered = new ArrayList<>(runs);
        ordered.sort(Comparator.comparingInt(run -> run.plan.index));

        List<Backend<Integer, String>> backends = snapshot.backends();
        long[] totals = new long[backends.size()];
        long selections = 0;
        long inZone = 0;
        long empty = 0;

        SimulationReport.SimulationReportBuilder report = SimulationReport.builder()
            .iterations(config.getIterations())
            .generatedAt(Instant.now());

        for (ClientRun run : ordered) {
            long clientSelections = 0;
            for (int i = 0; i < totals.length; i++) {
                totals[i] += run.tally[i];
                clientSelections += run.tally[i];
            }
            selections += clientSelections;
            inZone += run.inZone;
            empty += run.empty;
            report.client(new SimulationReport.ClientSummary(
                run.plan.homeZone, run.plan.seed, run.localOnly, run.multipliers,
                clientSelections, run.inZone, run.empty));
        }

        double fairShare = backends.isEmpty() ? 0.0 : (double) selections / backends.size();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < backends.size(); i++) {
            double ratio = fairShare > 0.0 ? totals[i] / fairShare : 0.0;
            min = Math.min(min, ratio);
            max = Math.max(max, ratio);
            Backend<Integer, String> backend = backends.get(i);
            report.backend(new SimulationReport.BackendLoad(backend.getId(), backend.getZone(), totals[i], ratio));
        }

        return report
            .selections(selections)
            .inZoneSelections(inZone)
            .emptySelections(empty)
            .minLoadRatio(min)
            .maxLoadRatio(max)
            .build();
    }

    private static final class ClientPlan {
        final int index;
        final String homeZone;
        final long seed;

        ClientPlan(int index, String homeZone, long seed) {
            this.index = index;
            this.homeZone = homeZone;
            this.seed = seed;
        }
    }

    private static final class ClientRun {
        final ClientPlan plan;
        final boolean localOnly;
        final Map<String, Double> multipliers;
        final long[] tally;
        final long inZone;
        final long empty;

        ClientRun(ClientPlan plan, boolean localOnly, Map<String, Double> multipliers,
                  long[] tally, long inZone, long empty) {
            this.plan = plan;
            this.localOnly = localOnly;
            this.multipliers = multipliers;
            this.tally = tally;
            this.inZone = inZone;
            this.empty = empty;
        }
    }
}
