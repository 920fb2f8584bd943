package com.edafunc.model;

import lombok.Builder;
import lombok.Value;

/**
 * Where a single output event goes, as decided by the backend.
 *
 * Example:
 *   type    = "kafka"
 *   target  = "orders-processed"
 *   cluster = "analytics"   (optional; null or "default" = the input cluster)
 *
 * The type is kept as the backend spelled it. The router resolves it to a
 * {@link DestinationType} and rejects names it does not know.
 */
@Value
@Builder
public class OutputDestination {

    public static final String DEFAULT_CLUSTER = "default";

    String type;
    String target;
    String cluster;

    public static OutputDestination of(DestinationType type, String target, String cluster) {
        return new OutputDestination(type.wireName(), target, cluster);
    }

    public boolean usesDefaultCluster() {
        return cluster == null || cluster.isBlank() || DEFAULT_CLUSTER.equals(cluster);
    }
}
