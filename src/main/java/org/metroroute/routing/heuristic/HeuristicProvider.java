package org.metroroute.routing.heuristic;

/**
 * Heuristic provider contract used by the inference engine.
 */
public interface HeuristicProvider {

    /**
     * @return heuristic mode of this provider.
     */
    HeuristicType type();

    /**
     * Binds a destination station and returns an estimator for one query.
     *
     * @param goalStation registered destination station name.
     * @return estimator bound to the destination.
     */
    GoalBoundHeuristic bindGoal(String goalStation);
}
