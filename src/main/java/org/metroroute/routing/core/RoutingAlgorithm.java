package org.metroroute.routing.core;

/**
 * Route search strategy selector used by the inference engine.
 */
public enum RoutingAlgorithm {
    DIJKSTRA,
    A_STAR
}
