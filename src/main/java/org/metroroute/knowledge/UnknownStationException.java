package org.metroroute.knowledge;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.metroroute.core.TransitRoutingException;

/**
 * Thrown when a station name is not registered in the {@link KnowledgeBase}.
 *
 * <p>Always a caller or data bug; retrying cannot change the outcome.</p>
 */
@Getter
@Accessors(fluent = true)
public final class UnknownStationException extends TransitRoutingException {
    public static final String REASON_UNKNOWN_STATION = "KB_UNKNOWN_STATION";

    private final String stationName;

    public UnknownStationException(String stationName) {
        super(REASON_UNKNOWN_STATION, "station is not registered: " + stationName);
        this.stationName = stationName;
    }
}
