package org.metroroute.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * Informed search versus uniform-cost baseline on the same query.
 */
@Value
@Builder
public class AlgorithmComparison {
    RouteResult informed;
    RouteResult baseline;
    /** {@code baseline.nodesExpanded - informed.nodesExpanded}; negative if the heuristic did worse. */
    int nodesSaved;
    /** {@code nodesSaved} as a percentage of the baseline expansions. */
    double savingPercent;
    /** Whether both searches reported the same cost within tolerance. */
    boolean costsAgree;
}
