package fr.lapetina.agentnetwork.domain.model;

import java.util.List;

/**
 * The mother (absent before the first turn) plus workers in creation order.
 */
public record InstanceListing(InstanceView mother, List<InstanceView> instances) {
    public InstanceListing {
        instances = instances != null ? List.copyOf(instances) : List.of();
    }

    public static InstanceListing empty() {
        return new InstanceListing(null, List.of());
    }
}
