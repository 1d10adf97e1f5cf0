package org.metroroute.routing.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.metroroute.knowledge.KnowledgeBase;
import org.metroroute.knowledge.UnknownStationException;
import org.metroroute.routing.heuristic.GoalBoundHeuristic;
import org.metroroute.routing.heuristic.HeuristicFactory;
import org.metroroute.routing.heuristic.HeuristicProvider;
import org.metroroute.routing.heuristic.HeuristicType;

import java.util.List;
import java.util.Objects;

/**
 * Route inference entry point bound to one {@link KnowledgeBase}.
 *
 * <p>The engine references the knowledge base, never copies it, and keeps no per-query state
 * between calls. Execution flow of {@link #findOptimalRoute(String, String)}:</p>
 * <ul>
 * <li>Validate that both endpoints are registered.</li>
 * <li>Resolve the heuristic provider, recalibrating when the network changed since the last query.</li>
 * <li>Run the planner selected by {@link RoutingConfig#getAlgorithm()}.</li>
 * <li>Derive {@link RouteStatistics} from the plan.</li>
 * </ul>
 *
 * <p>Thread-safety: concurrent queries are safe as long as nobody mutates the knowledge base
 * at the same time.</p>
 */
@Slf4j
public final class InferenceEngine {
    public static final String REASON_CONFIG_REQUIRED = "ENGINE_CONFIG_REQUIRED";
    public static final String REASON_ALGORITHM_REQUIRED = "ENGINE_CONFIG_ALGORITHM_REQUIRED";
    public static final String REASON_HEURISTIC_REQUIRED = "ENGINE_CONFIG_HEURISTIC_REQUIRED";
    public static final String REASON_INVALID_TRANSFER_PENALTY = "ENGINE_CONFIG_INVALID_TRANSFER_PENALTY";
    public static final String REASON_DIJKSTRA_HEURISTIC_MISMATCH = "ENGINE_CONFIG_DIJKSTRA_HEURISTIC_MISMATCH";

    private static final double COST_TOLERANCE = 1e-9d;

    @Getter
    @Accessors(fluent = true)
    private final KnowledgeBase knowledgeBase;
    @Getter
    @Accessors(fluent = true)
    private final RoutingConfig config;

    private final StationRoutePlanner planner;
    private final RouteExplainer explainer = new RouteExplainer();
    private volatile CachedProvider cachedProvider;

    /**
     * Creates an engine with {@link RoutingConfig#defaults()}.
     */
    public InferenceEngine(KnowledgeBase knowledgeBase) {
        this(knowledgeBase, RoutingConfig.defaults());
    }

    /**
     * Creates an engine with explicit configuration.
     *
     * @throws RouteCoreException when the configuration is incomplete or inconsistent.
     */
    public InferenceEngine(KnowledgeBase knowledgeBase, RoutingConfig config) {
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase");
        this.config = validateConfig(config);
        this.planner = new StationRoutePlanner(config.getAlgorithm() == RoutingAlgorithm.A_STAR);
    }

    /**
     * Finds the lowest-cost route between two registered stations.
     *
     * @param origin origin station name.
     * @param destination destination station name.
     * @return path, total cost and statistics.
     * @throws UnknownStationException when either endpoint (or a station reached through a connection) is not registered.
     * @throws RouteNotFoundException when the stations are disconnected.
     */
    public RouteResult findOptimalRoute(String origin, String destination) {
        knowledgeBase.requireRegistered(origin);
        knowledgeBase.requireRegistered(destination);

        GoalBoundHeuristic heuristic = resolveProvider().bindGoal(destination);
        InternalRoutePlan plan = planner.compute(
                knowledgeBase,
                heuristic,
                config.getTransferPenalty(),
                origin,
                destination
        );

        int networkStations = Math.max(1, knowledgeBase.stationCount());
        RouteStatistics statistics = RouteStatistics.builder()
                .stationCount(plan.path().size())
                .transferCount(plan.transferCount())
                .totalDistance(plan.totalDistanceKm())
                .totalTime(plan.totalTimeMinutes())
                .nodesExpanded(plan.nodesExpanded())
                .networkStationCount(networkStations)
                .efficiencyRatio((double) plan.nodesExpanded() / networkStations)
                .build();

        log.debug("Route {} -> {} [{}]: cost={}, stations={}, transfers={}, expanded={}",
                origin, destination, config.getAlgorithm(), plan.totalCost(),
                plan.path().size(), plan.transferCount(), plan.nodesExpanded());

        return RouteResult.builder()
                .origin(origin)
                .destination(destination)
                .path(plan.path())
                .totalCost(plan.totalCost())
                .statistics(statistics)
                .algorithm(config.getAlgorithm())
                .heuristicType(config.getHeuristicType())
                .build();
    }

    /**
     * Describes a path segment by segment. Performs no search.
     *
     * @param path station names in travel order; empty yields an empty explanation.
     * @param statistics statistics to attach, may be {@code null}.
     * @throws UnknownStationException when a path station no longer resolves.
     */
    public RouteExplanation explainRoute(List<String> path, RouteStatistics statistics) {
        return explainer.explain(knowledgeBase, path, statistics);
    }

    /**
     * Convenience overload explaining a found route with its own statistics.
     */
    public RouteExplanation explainRoute(RouteResult result) {
        Objects.requireNonNull(result, "result");
        return explainRoute(result.getPath(), result.getStatistics());
    }

    /**
     * Runs this engine's search and the uniform-cost baseline on the same query.
     *
     * @throws UnknownStationException when either endpoint is not registered.
     * @throws RouteNotFoundException when the stations are disconnected.
     */
    public AlgorithmComparison compareAlgorithms(String origin, String destination) {
        RouteResult informed = findOptimalRoute(origin, destination);
        RouteResult baseline = new InferenceEngine(knowledgeBase, config.asBaseline())
                .findOptimalRoute(origin, destination);

        int informedExpanded = informed.getStatistics().getNodesExpanded();
        int baselineExpanded = baseline.getStatistics().getNodesExpanded();
        int saved = baselineExpanded - informedExpanded;
        return AlgorithmComparison.builder()
                .informed(informed)
                .baseline(baseline)
                .nodesSaved(saved)
                .savingPercent(baselineExpanded == 0 ? 0.0d : 100.0d * saved / baselineExpanded)
                .costsAgree(Math.abs(informed.getTotalCost() - baseline.getTotalCost()) <= COST_TOLERANCE)
                .build();
    }

    /**
     * Returns the heuristic provider for the current network revision.
     *
     * <p>Calibration depends on every connection, so the provider is rebuilt whenever the
     * knowledge base revision moves.</p>
     */
    HeuristicProvider resolveProvider() {
        long revision = knowledgeBase.revision();
        CachedProvider cached = cachedProvider;
        if (cached != null && cached.revision() == revision) {
            return cached.provider();
        }
        HeuristicType type = config.getAlgorithm() == RoutingAlgorithm.DIJKSTRA
                ? HeuristicType.NONE
                : config.getHeuristicType();
        HeuristicProvider provider = HeuristicFactory.create(type, knowledgeBase, config.isCalibrateHeuristic());
        cachedProvider = new CachedProvider(revision, provider);
        return provider;
    }

    private static RoutingConfig validateConfig(RoutingConfig config) {
        if (config == null) {
            throw new RouteCoreException(REASON_CONFIG_REQUIRED, "routing config must be provided");
        }
        if (config.getAlgorithm() == null) {
            throw new RouteCoreException(REASON_ALGORITHM_REQUIRED, "algorithm must be specified");
        }
        if (config.getHeuristicType() == null) {
            throw new RouteCoreException(REASON_HEURISTIC_REQUIRED, "heuristicType must be specified");
        }
        double penalty = config.getTransferPenalty();
        if (!Double.isFinite(penalty) || penalty < 0.0d) {
            throw new RouteCoreException(
                    REASON_INVALID_TRANSFER_PENALTY,
                    "transferPenalty must be finite and >= 0: " + penalty
            );
        }
        if (config.getAlgorithm() == RoutingAlgorithm.DIJKSTRA && config.getHeuristicType() != HeuristicType.NONE) {
            throw new RouteCoreException(
                    REASON_DIJKSTRA_HEURISTIC_MISMATCH,
                    "DIJKSTRA requires heuristicType NONE, got " + config.getHeuristicType()
            );
        }
        return config;
    }

    private record CachedProvider(long revision, HeuristicProvider provider) {
    }
}
