package org.metroroute.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * Per-route statistics for reporting. Never used by the search itself.
 */
@Value
@Builder
public class RouteStatistics {
    /** Number of stations on the path, endpoints included. */
    int stationCount;
    /** Number of line-changing connections on the path. */
    int transferCount;
    /** Sum of connection distances in kilometers, penalties excluded. */
    double totalDistance;
    /** Sum of connection travel times in minutes. */
    double totalTime;
    /** Stations extracted from the frontier and finalized, destination included. */
    int nodesExpanded;
    /** Stations registered in the network when the query ran. */
    int networkStationCount;
    /** {@code nodesExpanded / networkStationCount}. */
    double efficiencyRatio;
}
