package com.edafunc.core.routing;

import com.edafunc.model.OutputDestination;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the routing rules plus the fallback destination.
 * Rules are evaluated in declaration order; the first match wins.
 */
@Getter
public final class RoutingTable {

    private final OutputDestination defaultDestination;
    private final List<RoutingRule> rules;

    public RoutingTable(OutputDestination defaultDestination, List<RoutingRule> rules) {
        this.defaultDestination = defaultDestination;
        this.rules = List.copyOf(rules);
    }

    public static RoutingTable defaultsOnly(OutputDestination defaultDestination) {
        return new RoutingTable(defaultDestination, List.of());
    }

    public OutputDestination route(Map<String, String> attributes) {
        for (RoutingRule rule : rules) {
            if (rule.matches(attributes)) {
                return rule.getDestination();
            }
        }
        return defaultDestination;
    }

    /** Name of the first matching rule, or null when the default applies. */
    public String matchingRule(Map<String, String> attributes) {
        return rules.stream()
                .filter(rule -> rule.matches(attributes))
                .map(RoutingRule::getName)
                .findFirst()
                .orElse(null);
    }
}
