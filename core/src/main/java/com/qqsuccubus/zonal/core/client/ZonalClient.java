package com.qqsuccubus.zonal.core.client;

import com.qqsuccubus.zonal.core.model.MultiplierMap;
import com.qqsuccubus.zonal.core.model.RegistrySnapshot;
import com.qqsuccubus.zonal.core.model.ZoneCapacities;
import com.qqsuccubus.zonal.core.sampling.BackendFilter;
import com.qqsuccubus.zonal.core.sampling.RandomSource;
import com.qqsuccubus.zonal.core.sampling.WeightedSampler;
import com.qqsuccubus.zonal.core.zone.ZoneCapacityAggregator;
import com.qqsuccubus.zonal.core.zone.ZoneWeightCalculator;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Zone-aware client that picks one backend per request.
 * <p>
 * Multipliers are derived once from the registry snapshot given at construction. A topology
 * change is applied by building a new client ({@link #rebuild(RegistrySnapshot)}), never by
 * mutating the snapshot.
 * </p>
 * <p>
 * <b>Thread-safety:</b> not thread-safe. Every selection advances the client's random source;
 * concurrent callers of the same instance need external synchronization.
 * </p>
 *
 * @param <I> backend identifier type
 * @param <Z> zone identifier type
 */
public class ZonalClient<I, Z extends Comparable<? super Z>> {
    private static final Logger log = LoggerFactory.getLogger(ZonalClient.class);

    @Getter
    private final Z homeZone;
    @Getter
    private final RegistrySnapshot<I, Z> snapshot;
    @Getter
    private final ZoneCapacities<Z> capacities;
    @Getter
    private final MultiplierMap<Z> multipliers;
    private final ZoneWeightCalculator calculator;
    private final RandomSource random;

    /**
     * Creates a client using the lenient weight calculator.
     *
     * @throws com.qqsuccubus.zonal.core.error.EmptyRegistryException if the snapshot has no backends
     */
    public ZonalClient(Z homeZone, RegistrySnapshot<I, Z> snapshot, RandomSource random) {
        this(homeZone, snapshot, random, ZoneWeightCalculator.lenient());
    }

    /**
     * @throws com.qqsuccubus.zonal.core.error.EmptyRegistryException   if the snapshot has no backends
     * @throws com.qqsuccubus.zonal.core.error.UnknownHomeZoneException if the calculator is strict and
     *                                                                  the home zone has no backends
     */
    public ZonalClient(Z homeZone,
                       RegistrySnapshot<I, Z> snapshot,
                       RandomSource random,
                       ZoneWeightCalculator calculator) {
        this.homeZone = Objects.requireNonNull(homeZone, "homeZone");
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
        this.random = Objects.requireNonNull(random, "random");
        this.calculator = Objects.requireNonNull(calculator, "calculator");

        this.capacities = ZoneCapacityAggregator.aggregate(snapshot);
        this.multipliers = calculator.calculate(capacities, homeZone);

        log.info("Client in zone {} (epoch={}, avgCapacity={}, homeCapacity={}): multipliers={}",
            homeZone, snapshot.getEpoch(),
            String.format("%.3f", capacities.averageCapacity()),
            String.format("%.3f", capacities.capacityOf(homeZone)),
            multipliers);
    }

    /**
     * Selects a backend among all backends of the snapshot.
     */
    public Optional<I> selectBackend() {
        return selectBackend(BackendFilter.all());
    }

    /**
     * Selects a backend among those accepted by {@code filter}.
     *
     * @return Selected backend id, or empty if no eligible backend can receive traffic
     */
    public Optional<I> selectBackend(BackendFilter<I, Z> filter) {
        Objects.requireNonNull(filter, "filter");
        return WeightedSampler.select(snapshot, multipliers, filter, random);
    }

    /**
     * Whether every request of this client stays in its home zone.
     */
    public boolean isLocalOnly() {
        return multipliers.isLocalOnly(homeZone);
    }

    /**
     * Builds the client for a replacement snapshot, keeping zone, calculator and random source.
     * This instance must not be used afterwards since both share the random source.
     */
    public ZonalClient<I, Z> rebuild(RegistrySnapshot<I, Z> newSnapshot) {
        return new ZonalClient<>(homeZone, newSnapshot, random, calculator);
    }
}
