package org.metroroute.routing.core;

import java.util.List;

/**
 * Internal route planning output.
 *
 * @param path station names from origin to destination.
 * @param totalCost distance plus transfer penalties.
 * @param totalDistanceKm distance only.
 * @param totalTimeMinutes accumulated travel time.
 * @param transferCount line changes along the path.
 * @param nodesExpanded finalized stations, destination included.
 */
record InternalRoutePlan(
        List<String> path,
        double totalCost,
        double totalDistanceKm,
        double totalTimeMinutes,
        int transferCount,
        int nodesExpanded
) {
    /**
     * Creates the plan for a query whose origin is its destination.
     */
    static InternalRoutePlan trivial(String station) {
        return new InternalRoutePlan(List.of(station), 0.0d, 0.0d, 0.0d, 0, 1);
    }
}
