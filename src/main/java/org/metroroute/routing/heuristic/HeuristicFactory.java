package org.metroroute.routing.heuristic;

import lombok.experimental.UtilityClass;
import org.metroroute.knowledge.KnowledgeBase;

/**
 * Creates heuristic providers with uniform validation.
 */
@UtilityClass
public final class HeuristicFactory {
    public static final String REASON_TYPE_REQUIRED = "HEURISTIC_TYPE_REQUIRED";
    public static final String REASON_KNOWLEDGE_BASE_REQUIRED = "HEURISTIC_KNOWLEDGE_BASE_REQUIRED";

    /**
     * Creates a heuristic provider.
     *
     * @param type requested heuristic type.
     * @param knowledgeBase network the provider reads.
     * @param calibrate whether straight-line estimates are scaled by a {@link GeometryLowerBoundModel}.
     * @return initialized provider.
     * @throws HeuristicConfigurationException when type or knowledge base is missing.
     */
    public static HeuristicProvider create(HeuristicType type, KnowledgeBase knowledgeBase, boolean calibrate) {
        if (type == null) {
            throw new HeuristicConfigurationException(
                    REASON_TYPE_REQUIRED,
                    "heuristic type must be explicitly specified (NONE, STRAIGHT_LINE)"
            );
        }
        if (knowledgeBase == null) {
            throw new HeuristicConfigurationException(
                    REASON_KNOWLEDGE_BASE_REQUIRED,
                    "knowledgeBase must be provided"
            );
        }

        return switch (type) {
            case NONE -> new NullHeuristicProvider(knowledgeBase);
            case STRAIGHT_LINE -> new StraightLineHeuristicProvider(
                    knowledgeBase,
                    calibrate ? GeometryLowerBoundModel.calibrate(knowledgeBase) : GeometryLowerBoundModel.identity()
            );
        };
    }
}
