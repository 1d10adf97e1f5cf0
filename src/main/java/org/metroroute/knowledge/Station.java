package org.metroroute.knowledge;

import lombok.Builder;
import lombok.Value;

/**
 * One registered station.
 *
 * <p>Coordinates are geodetic degrees and are either both present or both absent.</p>
 */
@Value
@Builder
public class Station {
    /** Unique station name (registration key). */
    String name;
    /** Line label used by the transfer rule. */
    String line;
    /** Latitude in degrees, {@code null} when the station has no coordinates. */
    Double latitude;
    /** Longitude in degrees, {@code null} when the station has no coordinates. */
    Double longitude;

    /**
     * @return true when both coordinates are known.
     */
    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
