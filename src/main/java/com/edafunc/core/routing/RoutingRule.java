package com.edafunc.core.routing;

import com.edafunc.model.OutputDestination;
import lombok.Value;

import java.util.Map;

/**
 * A named filter → destination mapping.
 */
@Value
public class RoutingRule {

    String name;
    Filter filter;
    OutputDestination destination;

    public boolean matches(Map<String, String> attributes) {
        return filter.matches(attributes);
    }
}
