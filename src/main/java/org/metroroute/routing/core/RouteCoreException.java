package org.metroroute.routing.core;

import org.metroroute.core.TransitRoutingException;

/**
 * Inference-engine contract failure (invalid configuration or request shape).
 */
public final class RouteCoreException extends TransitRoutingException {

    public RouteCoreException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
