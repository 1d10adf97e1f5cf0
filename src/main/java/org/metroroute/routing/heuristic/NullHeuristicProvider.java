package org.metroroute.routing.heuristic;

import org.metroroute.knowledge.KnowledgeBase;

import java.util.Objects;

/**
 * Null heuristic provider.
 *
 * <p>Always returns zero estimates and therefore behaves like plain Dijkstra
 * while still validating the bound destination.</p>
 */
public final class NullHeuristicProvider implements HeuristicProvider {
    private static final GoalBoundHeuristic ZERO = station -> 0.0d;

    private final KnowledgeBase knowledgeBase;

    public NullHeuristicProvider(KnowledgeBase knowledgeBase) {
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase");
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.NONE;
    }

    /**
     * @throws org.metroroute.knowledge.UnknownStationException when the destination is not registered.
     */
    @Override
    public GoalBoundHeuristic bindGoal(String goalStation) {
        knowledgeBase.requireRegistered(goalStation);
        return ZERO;
    }
}
