package org.metroroute.routing.analysis;

import lombok.extern.slf4j.Slf4j;
import org.metroroute.knowledge.Station;
import org.metroroute.routing.core.InferenceEngine;
import org.metroroute.routing.core.RouteNotFoundException;
import org.metroroute.routing.core.RouteResult;
import org.metroroute.routing.core.RouteStatistics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;

/**
 * Batch route analysis over an {@link InferenceEngine}.
 *
 * <p>Routes every ordered pair {@code (origin, destination)} of a sample with
 * {@code origin != destination}. Disconnected pairs are counted, not propagated; any other
 * failure (unknown station, broken network) aborts the analysis.</p>
 */
@Slf4j
public final class NetworkAnalyzer {
    private final InferenceEngine engine;

    public NetworkAnalyzer(InferenceEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Analyzes every registered station.
     */
    public NetworkAnalysisReport analyze() {
        List<String> names = new ArrayList<>();
        for (Station station : engine.knowledgeBase().stations()) {
            names.add(station.getName());
        }
        return analyze(names);
    }

    /**
     * Analyzes every ordered pair drawn from {@code sample}.
     *
     * @param sample station names; duplicates are routed as given.
     * @return aggregate report.
     * @throws org.metroroute.knowledge.UnknownStationException when a sample station is null or not registered.
     */
    public NetworkAnalysisReport analyze(Collection<String> sample) {
        Objects.requireNonNull(sample, "sample");
        NetworkAnalysisReport.NetworkAnalysisReportBuilder builder = NetworkAnalysisReport.builder();
        List<RouteResult> found = new ArrayList<>();
        int attempted = 0;

        for (String origin : sample) {
            for (String destination : sample) {
                if (Objects.equals(origin, destination)) {
                    continue;
                }
                attempted++;
                try {
                    RouteResult result = engine.findOptimalRoute(origin, destination);
                    found.add(result);
                    builder.route(result);
                } catch (RouteNotFoundException ex) {
                    builder.unreachablePair(origin + " -> " + destination);
                }
            }
        }

        builder.pairsAttempted(attempted).routesFound(found.size());
        log.debug("Network analysis: {} of {} pair(s) routed", found.size(), attempted);
        if (found.isEmpty()) {
            return builder.build();
        }

        return builder
                .averageStations(average(found, RouteStatistics::getStationCount))
                .minStations(found.stream().mapToInt(r -> r.getStatistics().getStationCount()).min().orElse(0))
                .maxStations(found.stream().mapToInt(r -> r.getStatistics().getStationCount()).max().orElse(0))
                .averageTransfers(average(found, RouteStatistics::getTransferCount))
                .averageDistanceKm(averageDouble(found, RouteStatistics::getTotalDistance))
                .averageTimeMinutes(averageDouble(found, RouteStatistics::getTotalTime))
                .averageNodesExpanded(average(found, RouteStatistics::getNodesExpanded))
                .longestRoute(max(found, Comparator.comparingInt(r -> r.getStatistics().getStationCount())))
                .mostTransfers(max(found, Comparator.comparingInt(r -> r.getStatistics().getTransferCount())))
                .fastestRoute(min(found, Comparator.comparingDouble(r -> r.getStatistics().getTotalTime())))
                .mostEfficientSearch(min(found, Comparator.comparingInt(r -> r.getStatistics().getNodesExpanded())))
                .build();
    }

    private static double average(List<RouteResult> routes, ToIntFunction<RouteStatistics> metric) {
        long sum = 0L;
        for (RouteResult route : routes) {
            sum += metric.applyAsInt(route.getStatistics());
        }
        return (double) sum / routes.size();
    }

    private static double averageDouble(List<RouteResult> routes, ToDoubleFunction<RouteStatistics> metric) {
        double sum = 0.0d;
        for (RouteResult route : routes) {
            sum += metric.applyAsDouble(route.getStatistics());
        }
        return sum / routes.size();
    }

    /**
     * First route with the maximum value; ties keep computation order.
     */
    private static RouteResult max(List<RouteResult> routes, Comparator<RouteResult> order) {
        RouteResult best = routes.get(0);
        for (RouteResult route : routes) {
            if (order.compare(route, best) > 0) {
                best = route;
            }
        }
        return best;
    }

    /**
     * First route with the minimum value; ties keep computation order.
     */
    private static RouteResult min(List<RouteResult> routes, Comparator<RouteResult> order) {
        RouteResult best = routes.get(0);
        for (RouteResult route : routes) {
            if (order.compare(route, best) < 0) {
                best = route;
            }
        }
        return best;
    }
}
