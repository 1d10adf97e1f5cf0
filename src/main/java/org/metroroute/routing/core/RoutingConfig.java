package org.metroroute.routing.core;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.metroroute.routing.heuristic.HeuristicType;

import java.util.Locale;

/**
 * Immutable inference-engine configuration.
 *
 * <p>{@link #defaults()} reads optional overrides from system properties:</p>
 * <ul>
 * <li>{@code metroroute.routing.transferPenalty} - cost added per line change, in kilometers.</li>
 * <li>{@code metroroute.routing.algorithm} - {@code A_STAR} or {@code DIJKSTRA}.</li>
 * <li>{@code metroroute.routing.heuristic} - {@code STRAIGHT_LINE} or {@code NONE}.</li>
 * <li>{@code metroroute.routing.calibrateHeuristic} - {@code true} or {@code false}.</li>
 * </ul>
 * <p>Malformed values are logged and replaced by the built-in default.</p>
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class RoutingConfig {
    public static final double DEFAULT_TRANSFER_PENALTY = 2.0d;

    public static final String PROP_TRANSFER_PENALTY = "metroroute.routing.transferPenalty";
    public static final String PROP_ALGORITHM = "metroroute.routing.algorithm";
    public static final String PROP_HEURISTIC = "metroroute.routing.heuristic";
    public static final String PROP_CALIBRATE = "metroroute.routing.calibrateHeuristic";

    /** Search algorithm. */
    @Builder.Default
    RoutingAlgorithm algorithm = RoutingAlgorithm.A_STAR;
    /** Heuristic mode; must be {@code NONE} for Dijkstra. */
    @Builder.Default
    HeuristicType heuristicType = HeuristicType.STRAIGHT_LINE;
    /** Cost added once per line change, in the distance unit (km). */
    @Builder.Default
    double transferPenalty = DEFAULT_TRANSFER_PENALTY;
    /** Whether straight-line estimates are scaled down to stay below every connection length. */
    @Builder.Default
    boolean calibrateHeuristic = true;

    /**
     * Returns built-in defaults with system-property overrides applied.
     */
    public static RoutingConfig defaults() {
        RoutingAlgorithm algorithm = readEnum(PROP_ALGORITHM, RoutingAlgorithm.class, RoutingAlgorithm.A_STAR);
        HeuristicType heuristicFallback = algorithm == RoutingAlgorithm.DIJKSTRA
                ? HeuristicType.NONE
                : HeuristicType.STRAIGHT_LINE;
        return RoutingConfig.builder()
                .algorithm(algorithm)
                .heuristicType(readEnum(PROP_HEURISTIC, HeuristicType.class, heuristicFallback))
                .transferPenalty(readPenalty())
                .calibrateHeuristic(readBoolean(PROP_CALIBRATE, true))
                .build();
    }

    /**
     * Returns the uninformed baseline configuration with the same penalty.
     */
    public RoutingConfig asBaseline() {
        return toBuilder()
                .algorithm(RoutingAlgorithm.DIJKSTRA)
                .heuristicType(HeuristicType.NONE)
                .build();
    }

    private static double readPenalty() {
        String raw = System.getProperty(PROP_TRANSFER_PENALTY);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_TRANSFER_PENALTY;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isFinite(value) && value >= 0.0d) {
                return value;
            }
        } catch (NumberFormatException ex) {
            log.warn("Ignoring malformed {}={}", PROP_TRANSFER_PENALTY, raw);
            return DEFAULT_TRANSFER_PENALTY;
        }
        log.warn("Ignoring out-of-range {}={}", PROP_TRANSFER_PENALTY, raw);
        return DEFAULT_TRANSFER_PENALTY;
    }

    private static <E extends Enum<E>> E readEnum(String property, Class<E> type, E fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            log.warn("Ignoring unknown {}={}", property, raw);
            return fallback;
        }
    }

    private static boolean readBoolean(String property, boolean fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return Boolean.parseBoolean(raw.trim());
    }
}
