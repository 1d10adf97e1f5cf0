package org.metroroute.routing.heuristic;

import org.metroroute.core.TransitRoutingException;

/**
 * Thrown when a heuristic provider cannot be built.
 */
public final class HeuristicConfigurationException extends TransitRoutingException {

    public HeuristicConfigurationException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
