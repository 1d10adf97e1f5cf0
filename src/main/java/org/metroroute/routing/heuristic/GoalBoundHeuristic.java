package org.metroroute.routing.heuristic;

/**
 * Remaining-cost estimator bound to one destination.
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * Estimates remaining cost from a station to the bound destination.
     *
     * @param station registered station name.
     * @return admissible, non-negative lower-bound estimate.
     */
    double estimateFromStation(String station);
}
