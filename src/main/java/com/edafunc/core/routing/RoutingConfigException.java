package com.edafunc.core.routing;

import com.edafunc.core.CoreException;

/**
 * A routing file is missing, unreadable or invalid.
 */
public class RoutingConfigException extends CoreException {

    public RoutingConfigException(String message) {
        super(message);
    }

    public RoutingConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
