package org.metroroute.knowledge;

/**
 * Straight-line distance formulas available to {@link KnowledgeBase#estimateHeuristic(String, String)}.
 *
 * <p>Both produce kilometers so estimates share the unit of connection distances.</p>
 */
public enum DistanceMetric {
    /** Haversine great-circle distance on the mean earth radius. */
    GREAT_CIRCLE,
    /** Flat approximation: 111 km per degree latitude, 111 * 0.85 km per degree longitude. */
    EQUIRECTANGULAR
}
