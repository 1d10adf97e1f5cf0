package org.metroroute.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Structured, presentation-free description of a route.
 *
 * <p>An empty path produces an explanation with null endpoints and no segments.</p>
 */
@Value
@Builder
public class RouteExplanation {
    String origin;
    String originLine;
    String destination;
    String destinationLine;
    @Singular
    List<RouteSegment> segments;
    /** Stations where the rider leaves one line for another, in travel order. */
    @Singular
    List<String> transferPoints;
    RouteStatistics statistics;

    public boolean isEmpty() {
        return origin == null;
    }
}
