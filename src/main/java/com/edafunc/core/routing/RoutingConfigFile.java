package com.edafunc.core.routing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * YAML shape of a routing file:
 *
 *   routing:
 *     default: { type: kafka, target: processed-events, cluster: default }
 *     rules:
 *       - name: orders
 *         filter: { prefix: { type: "order." } }
 *         destination: { type: kafka, target: order-events }
 *       - name: drop-heartbeats
 *         filter: { exact: { type: heartbeat } }
 *         destination: { type: discard }
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoutingConfigFile {

    private Routing routing;

    @Getter
    @Setter
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Routing {
        @JsonProperty("default")
        private DestinationSpec defaultDestination;
        private List<RuleSpec> rules = new ArrayList<>();
    }

    @Getter
    @Setter
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RuleSpec {
        private String name;
        private Map<String, Object> filter;
        private DestinationSpec destination;
    }

    @Getter
    @Setter
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DestinationSpec {
        private String type;
        private String target;
        private String cluster;
    }
}
