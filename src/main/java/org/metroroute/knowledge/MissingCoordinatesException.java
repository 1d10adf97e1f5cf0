package org.metroroute.knowledge;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.metroroute.core.TransitRoutingException;

/**
 * Thrown by {@link KnowledgeBase#estimateHeuristic(String, String)} when either station has
 * no coordinates.
 *
 * <p>Search code treats this as "heuristic unavailable" and falls back to a zero estimate.</p>
 */
@Getter
@Accessors(fluent = true)
public final class MissingCoordinatesException extends TransitRoutingException {
    public static final String REASON_MISSING_COORDINATES = "KB_MISSING_COORDINATES";

    private final String stationName;

    public MissingCoordinatesException(String stationName) {
        super(REASON_MISSING_COORDINATES, "station has no coordinates: " + stationName);
        this.stationName = stationName;
    }
}
