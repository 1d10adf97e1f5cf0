package org.metroroute.routing.heuristic;

import lombok.extern.slf4j.Slf4j;
import org.metroroute.knowledge.KnowledgeBase;
import org.metroroute.knowledge.MissingCoordinatesException;

import java.util.Objects;

/**
 * Heuristic provider based on {@link KnowledgeBase#estimateHeuristic(String, String)}.
 *
 * <p>The straight-line distance is multiplied by the calibrated lower-bound scale of a
 * {@link GeometryLowerBoundModel}. The estimate ignores future transfer penalties, which keeps
 * it a lower bound on the remaining cost.</p>
 *
 * <p>A station without coordinates contributes a zero estimate. Each bound estimator belongs to
 * one query and is not meant to be shared between threads.</p>
 */
@Slf4j
public final class StraightLineHeuristicProvider implements HeuristicProvider {
    private final KnowledgeBase knowledgeBase;
    private final double lowerBoundScale;

    /**
     * Creates a straight-line heuristic provider.
     *
     * @param knowledgeBase network providing coordinates.
     * @param lowerBoundModel calibrated admissibility model.
     */
    public StraightLineHeuristicProvider(KnowledgeBase knowledgeBase, GeometryLowerBoundModel lowerBoundModel) {
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase");
        this.lowerBoundScale = Objects.requireNonNull(lowerBoundModel, "lowerBoundModel").lowerBoundScale();
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.STRAIGHT_LINE;
    }

    /**
     * @throws org.metroroute.knowledge.UnknownStationException when the destination is not registered.
     */
    @Override
    public GoalBoundHeuristic bindGoal(String goalStation) {
        knowledgeBase.requireRegistered(goalStation);
        return new BoundStraightLineHeuristic(knowledgeBase, goalStation, lowerBoundScale);
    }

    public double lowerBoundScale() {
        return lowerBoundScale;
    }

    private static final class BoundStraightLineHeuristic implements GoalBoundHeuristic {
        private final KnowledgeBase knowledgeBase;
        private final String goalStation;
        private final double lowerBoundScale;
        private boolean fallbackReported;

        private BoundStraightLineHeuristic(KnowledgeBase knowledgeBase, String goalStation, double lowerBoundScale) {
            this.knowledgeBase = knowledgeBase;
            this.goalStation = goalStation;
            this.lowerBoundScale = lowerBoundScale;
        }

        @Override
        public double estimateFromStation(String station) {
            if (station.equals(goalStation)) {
                return 0.0d;
            }
            try {
                return knowledgeBase.estimateHeuristic(station, goalStation) * lowerBoundScale;
            } catch (MissingCoordinatesException ex) {
                if (!fallbackReported) {
                    fallbackReported = true;
                    log.debug("Heuristic unavailable towards {} ({}), using zero estimate", goalStation, ex.getMessage());
                }
                return 0.0d;
            }
        }
    }
}
