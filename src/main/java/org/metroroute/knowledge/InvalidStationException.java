package org.metroroute.knowledge;

import org.metroroute.core.TransitRoutingException;

/**
 * Thrown when a station registration carries an unusable name, line or coordinate pair.
 */
public final class InvalidStationException extends TransitRoutingException {
    public static final String REASON_NAME_REQUIRED = "KB_STATION_NAME_REQUIRED";
    public static final String REASON_LINE_REQUIRED = "KB_STATION_LINE_REQUIRED";
    public static final String REASON_INVALID_COORDINATES = "KB_INVALID_COORDINATES";

    public InvalidStationException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
