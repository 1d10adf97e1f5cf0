package org.metroroute.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.metroroute.routing.heuristic.HeuristicType;

import java.util.List;

/**
 * Successful point-to-point route.
 */
@Value
@Builder
public class RouteResult {
    String origin;
    String destination;
    /** Station names from origin to destination. */
    @Singular("pathStation")
    List<String> path;
    /** Distance plus transfer penalties, the quantity the search minimizes. */
    double totalCost;
    RouteStatistics statistics;
    RoutingAlgorithm algorithm;
    HeuristicType heuristicType;
}
