package com.qqsuccubus.zonal.simulator.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qqsuccubus.zonal.core.model.Backend;
import lombok.Value;

import java.util.Map;

/**
 * JSON form of a backend in a registry file.
 */
@Value
public class BackendRecord {
    @JsonProperty("id")
    int id;

    @JsonProperty("zone")
    String zone;

    @JsonProperty("capacity")
    double capacity;

    @JsonProperty("labels")
    Map<String, String> labels;

    @JsonCreator
    public BackendRecord(
        @JsonProperty("id") int id,
        @JsonProperty("zone") String zone,
        @JsonProperty("capacity") double capacity,
        @JsonProperty("labels") Map<String, String> labels
    ) {
        this.id = id;
        this.zone = zone;
        this.capacity = capacity;
        this.labels = labels;
    }

    public Backend<Integer, String> toBackend() {
        return Backend.of(id, zone, capacity, labels);
    }
}
