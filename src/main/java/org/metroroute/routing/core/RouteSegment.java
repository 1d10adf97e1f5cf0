package org.metroroute.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * One hop of an explained route.
 */
@Value
@Builder
public class RouteSegment {
    /** 1-based position along the route. */
    int sequence;
    String fromStation;
    String fromLine;
    String toStation;
    String toLine;
    /** True when this hop changes line. */
    boolean transfer;
    /** Connection length, {@code null} when the stations are not directly connected. */
    Double distanceKm;
    /** Connection travel time, {@code null} when the stations are not directly connected. */
    Double timeMinutes;
}
