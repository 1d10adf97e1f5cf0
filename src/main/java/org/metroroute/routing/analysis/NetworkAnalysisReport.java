package org.metroroute.routing.analysis;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.metroroute.routing.core.RouteResult;

import java.util.List;

/**
 * Aggregate outcome of routing every ordered pair of a station sample.
 *
 * <p>Averages are zero and extreme cases {@code null} when no route was found.</p>
 */
@Value
@Builder
public class NetworkAnalysisReport {
    int pairsAttempted;
    int routesFound;
    /** Ordered pairs that raised a route-not-found failure. */
    @Singular
    List<String> unreachablePairs;
    /** Found routes in the order they were computed. */
    @Singular
    List<RouteResult> routes;

    double averageStations;
    int minStations;
    int maxStations;
    double averageTransfers;
    double averageDistanceKm;
    double averageTimeMinutes;
    double averageNodesExpanded;

    /** Route with the most stations. */
    RouteResult longestRoute;
    /** Route with the most transfers. */
    RouteResult mostTransfers;
    /** Route with the smallest total time. */
    RouteResult fastestRoute;
    /** Route whose search expanded the fewest stations. */
    RouteResult mostEfficientSearch;

    /**
     * @return found routes as a percentage of attempted pairs, 0 when nothing was attempted.
     */
    public double successRate() {
        return pairsAttempted == 0 ? 0.0d : 100.0d * routesFound / pairsAttempted;
    }
}
