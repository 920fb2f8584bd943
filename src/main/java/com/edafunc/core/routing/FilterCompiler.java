package com.edafunc.core.routing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiPredicate;

/**
 * Compiles filter objects in the CloudEvents Subscriptions API dialects into
 * {@link Filter} trees.
 *
 * Supported dialects:
 *   exact:  {type: "order.created"}          → every listed attribute equals the value
 *   prefix: {type: "order."}                 → every listed attribute starts with the value
 *   suffix: {source: "/shop"}                → every listed attribute ends with the value
 *   all:    [filter, filter, ...]            → every nested filter matches
 *   any:    [filter, filter, ...]            → at least one nested filter matches
 *   not:    filter                           → nested filter does not match
 *   sql:    "type LIKE 'order.%' AND ..."    → CloudEvents SQL subset, see {@link SqlExpression}
 *
 * Attribute names are case-insensitive, like context attribute names.
 * A filter object with several dialect keys matches when all of them match.
 * A missing or empty filter matches everything.
 */
public final class FilterCompiler {

    private FilterCompiler() {
    }

    public static Filter compile(Object spec) {
        if (spec == null) {
            return Filter.MATCH_ALL;
        }
        if (!(spec instanceof Map<?, ?> map)) {
            throw new FilterSyntaxException("Filter must be an object, got: " + spec);
        }
        if (map.isEmpty()) {
            return Filter.MATCH_ALL;
        }

        List<Filter> parts = new ArrayList<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String dialect = String.valueOf(entry.getKey()).toLowerCase(Locale.ROOT);
            Object value = entry.getValue();
            parts.add(switch (dialect) {
                case "exact" -> attributeFilter(dialect, value, String::equals);
                case "prefix" -> attributeFilter(dialect, value, String::startsWith);
                case "suffix" -> attributeFilter(dialect, value, String::endsWith);
                case "all" -> allOf(nested(dialect, value));
                case "any" -> anyOf(nested(dialect, value));
                case "not" -> not(compile(value));
                case "sql" -> sql(value);
                default -> throw new FilterSyntaxException("Unknown filter dialect: " + entry.getKey());
            });
        }
        return parts.size() == 1 ? parts.get(0) : allOf(parts);
    }

    private static Filter attributeFilter(String dialect, Object value,
                                          BiPredicate<String, String> test) {
        if (!(value instanceof Map<?, ?> attributes) || attributes.isEmpty()) {
            throw new FilterSyntaxException(
                    "'" + dialect + "' filter needs a non-empty attribute map");
        }
        Map<String, String> expected = new LinkedHashMap<>();
        attributes.forEach((k, v) -> {
            if (v == null) {
                throw new FilterSyntaxException("'" + dialect + "' filter value for " + k + " is null");
            }
            expected.put(String.valueOf(k).toLowerCase(Locale.ROOT), String.valueOf(v));
        });
        return event -> expected.entrySet().stream().allMatch(e -> {
            String actual = event.get(e.getKey());
            return actual != null && test.test(actual, e.getValue());
        });
    }

    private static List<Filter> nested(String dialect, Object value) {
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            throw new FilterSyntaxException("'" + dialect + "' filter needs a non-empty list");
        }
        List<Filter> filters = new ArrayList<>(list.size());
        for (Object item : list) {
            filters.add(compile(item));
        }
        return filters;
    }

    private static Filter sql(Object value) {
        if (!(value instanceof String expression) || expression.isBlank()) {
            throw new FilterSyntaxException("'sql' filter needs an expression string");
        }
        SqlExpression compiled = SqlExpression.parse(expression);
        return compiled::evaluate;
    }

    static Filter allOf(List<Filter> filters) {
        List<Filter> copy = List.copyOf(filters);
        return event -> copy.stream().allMatch(f -> f.matches(event));
    }

    static Filter anyOf(List<Filter> filters) {
        List<Filter> copy = List.copyOf(filters);
        return event -> copy.stream().anyMatch(f -> f.matches(event));
    }

    static Filter not(Filter filter) {
        return event -> !filter.matches(event);
    }
}
