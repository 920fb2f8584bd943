package com.edafunc.core.routing;

/**
 * A routing filter could not be compiled.
 */
public class FilterSyntaxException extends RuntimeException {

    public FilterSyntaxException(String message) {
        super(message);
    }
}
