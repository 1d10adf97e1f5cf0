package org.metroroute.routing.core;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.metroroute.knowledge.KnowledgeBase;
import org.metroroute.knowledge.Neighbor;
import org.metroroute.routing.heuristic.GoalBoundHeuristic;

import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Station-level best-first shortest-path planner.
 *
 * <p>Priority modes controlled by {@code useHeuristic}:</p>
 * <ul>
 * <li>{@code false}: pure Dijkstra priority ({@code g}).</li>
 * <li>{@code true}: A* priority ({@code g + h}).</li>
 * </ul>
 *
 * <p>Edge cost is {@code distance + transferPenalty} when the two stations lie on different
 * lines, {@code distance} otherwise. Travel time is summed alongside and never affects the
 * ordering. The frontier uses lazy deletion: entries whose {@code g} no longer matches the
 * station's best-known {@code g} are skipped on poll. Finalized stations are never re-expanded.</p>
 */
final class StationRoutePlanner {
    private final boolean useHeuristic;

    StationRoutePlanner(boolean useHeuristic) {
        this.useHeuristic = useHeuristic;
    }

    /**
     * Computes one point-to-point route.
     *
     * @throws RouteNotFoundException when the frontier empties before the destination is finalized.
     * @throws org.metroroute.knowledge.UnknownStationException when a connection leads to an unregistered station.
     */
    InternalRoutePlan compute(
            KnowledgeBase knowledgeBase,
            GoalBoundHeuristic heuristic,
            double transferPenalty,
            String origin,
            String destination
    ) {
        if (origin.equals(destination)) {
            return InternalRoutePlan.trivial(origin);
        }

        Object2ObjectOpenHashMap<String, SearchState> states = new Object2ObjectOpenHashMap<>();
        PriorityQueue<FrontierEntry> frontier = new PriorityQueue<>();
        long sequence = 0L;

        SearchState start = stateOf(states, origin);
        start.g = 0.0d;
        start.h = estimate(heuristic, origin);
        frontier.add(new FrontierEntry(origin, start.g, start.h, start.f(), sequence++));

        int nodesExpanded = 0;
        while (!frontier.isEmpty()) {
            FrontierEntry entry = frontier.poll();
            SearchState current = states.get(entry.station());
            if (current.closed || Double.compare(entry.g(), current.g) != 0) {
                continue;
            }
            current.closed = true;
            nodesExpanded++;

            if (current.station.equals(destination)) {
                return toPlan(states, current, nodesExpanded);
            }

            for (Neighbor neighbor : knowledgeBase.neighborsOf(current.station)) {
                SearchState next = stateOf(states, neighbor.station());
                if (next.closed) {
                    continue;
                }
                boolean transfer = knowledgeBase.requiresTransfer(current.station, neighbor.station());
                double tentativeG = current.g + neighbor.distanceKm() + (transfer ? transferPenalty : 0.0d);
                if (tentativeG >= next.g) {
                    continue;
                }
                boolean firstVisit = next.g == Double.POSITIVE_INFINITY;
                next.relax(current, tentativeG, neighbor.distanceKm(), neighbor.timeMinutes(), transfer);
                if (firstVisit) {
                    next.h = estimate(heuristic, next.station);
                }
                frontier.add(new FrontierEntry(next.station, next.g, next.h, next.f(), sequence++));
            }
        }

        throw new RouteNotFoundException(origin, destination, nodesExpanded);
    }

    /**
     * Computes the heuristic part of the priority.
     *
     * <p>Invalid heuristic outputs are clamped to zero so queue ordering stays numerically safe.</p>
     */
    private double estimate(GoalBoundHeuristic heuristic, String station) {
        if (!useHeuristic) {
            return 0.0d;
        }
        double estimate = heuristic.estimateFromStation(station);
        if (!Double.isFinite(estimate) || estimate < 0.0d) {
            return 0.0d;
        }
        return estimate;
    }

    private static SearchState stateOf(Object2ObjectOpenHashMap<String, SearchState> states, String station) {
        SearchState state = states.get(station);
        if (state == null) {
            state = new SearchState(station);
            states.put(station, state);
        }
        return state;
    }

    private static InternalRoutePlan toPlan(
            Object2ObjectOpenHashMap<String, SearchState> states,
            SearchState goal,
            int nodesExpanded
    ) {
        ObjectArrayList<String> reversed = new ObjectArrayList<>();
        for (SearchState cursor = goal; cursor != null; cursor = cursor.predecessor == null ? null : states.get(cursor.predecessor)) {
            reversed.add(cursor.station);
        }
        Collections.reverse(reversed);
        return new InternalRoutePlan(
                List.copyOf(reversed),
                goal.g,
                goal.distanceKm,
                goal.timeMinutes,
                goal.transfers,
                nodesExpanded
        );
    }

    private record FrontierEntry(
            String station,
            double g,
            double h,
            double f,
            long sequence
    ) implements Comparable<FrontierEntry> {
        /**
         * Orders frontier by f, then h (closer to the goal first), then insertion order.
         */
        @Override
        public int compareTo(FrontierEntry other) {
            int byF = Double.compare(this.f, other.f);
            if (byF != 0) {
                return byF;
            }
            int byH = Double.compare(this.h, other.h);
            if (byH != 0) {
                return byH;
            }
            return Long.compare(this.sequence, other.sequence);
        }
    }
}
