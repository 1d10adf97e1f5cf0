package org.metroroute.knowledge;

import lombok.Value;

/**
 * One finding of {@link KnowledgeBase#validateConsistency()}.
 */
@Value
public class ConsistencyViolation {

    /**
     * Violation categories.
     */
    public enum Kind {
        /** A connection references a station that was never registered. */
        UNKNOWN_STATION,
        /** A connection has a negative distance. */
        NEGATIVE_DISTANCE,
        /** A connection has a negative travel time. */
        NEGATIVE_TIME,
        /** A connection has a NaN or infinite distance or time. */
        NON_FINITE_VALUE,
        /** The two traversal directions of a pair disagree or one is missing. */
        ASYMMETRIC_CONNECTION
    }

    Kind kind;
    String description;

    @Override
    public String toString() {
        return kind + ": " + description;
    }
}
