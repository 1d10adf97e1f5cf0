package org.metroroute.knowledge;

import lombok.Value;

/**
 * A registered symmetric link between two stations.
 *
 * <p>{@code stationA} and {@code stationB} keep the order of the registering call; traversal
 * in either direction uses the same distance and time.</p>
 */
@Value
public class Connection {
    String stationA;
    String stationB;
    double distanceKm;
    double timeMinutes;

    /**
     * Renders the connection as a rule fact, for example {@code connects(A, B, 1.5, 3.0)}.
     */
    public String toFact() {
        return "connects(" + stationA + ", " + stationB + ", " + distanceKm + ", " + timeMinutes + ")";
    }
}
