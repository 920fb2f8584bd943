package com.edafunc.core.routing;

import java.util.Map;

/**
 * A compiled subscription filter, evaluated against the context attributes
 * of an event (attribute name → string value).
 */
@FunctionalInterface
public interface Filter {

    Filter MATCH_ALL = attributes -> true;

    boolean matches(Map<String, String> attributes);
}
