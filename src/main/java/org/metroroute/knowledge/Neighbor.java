package org.metroroute.knowledge;

/**
 * One adjacency entry as seen from a station.
 *
 * @param station neighbor station name.
 * @param distanceKm connection length in kilometers.
 * @param timeMinutes nominal travel time in minutes.
 */
public record Neighbor(String station, double distanceKm, double timeMinutes) {
}
