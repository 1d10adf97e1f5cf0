package org.metroroute.routing.heuristic;

/**
 * Supported heuristic modes.
 *
 * <p>{@code NONE} disables guidance (uniform-cost behavior).</p>
 * <p>{@code STRAIGHT_LINE} estimates remaining distance from station coordinates.</p>
 */
public enum HeuristicType {
    NONE,
    STRAIGHT_LINE
}
