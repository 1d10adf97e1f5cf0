package org.metroroute.routing.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.metroroute.core.TransitRoutingException;

/**
 * Thrown when the destination cannot be reached from the origin.
 *
 * <p>A legitimate outcome for disconnected networks, never a partial path.</p>
 */
@Getter
@Accessors(fluent = true)
public final class RouteNotFoundException extends TransitRoutingException {
    public static final String REASON_ROUTE_NOT_FOUND = "ENGINE_ROUTE_NOT_FOUND";

    private final String origin;
    private final String destination;
    private final int nodesExpanded;

    public RouteNotFoundException(String origin, String destination, int nodesExpanded) {
        super(
                REASON_ROUTE_NOT_FOUND,
                "no route from " + origin + " to " + destination + " after expanding " + nodesExpanded + " station(s)"
        );
        this.origin = origin;
        this.destination = destination;
        this.nodesExpanded = nodesExpanded;
    }
}
