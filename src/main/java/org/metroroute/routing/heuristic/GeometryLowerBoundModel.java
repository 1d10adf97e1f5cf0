package org.metroroute.routing.heuristic;

import lombok.extern.slf4j.Slf4j;
import org.metroroute.knowledge.Connection;
import org.metroroute.knowledge.KnowledgeBase;
import org.metroroute.knowledge.MissingCoordinatesException;
import org.metroroute.knowledge.Station;
import org.metroroute.knowledge.UnknownStationException;

import java.util.Objects;
import java.util.Optional;

/**
 * Admissibility calibration model for straight-line heuristics.
 *
 * <p>Computes a deterministic lower-bound scale:
 * scale = min(1, min over connections of distance_km / straight_line_km).
 * Connections with an unregistered endpoint, with two endpoints lacking coordinates, or whose
 * endpoints coincide geographically do not constrain the scale.</p>
 *
 * <p>Every connection between located stations is at least {@code scale} times its straight-line
 * length, so by the triangle inequality any remaining path through located stations is at least
 * {@code scale} times the straight line to the destination. A path that detours through stations
 * without coordinates has no such bound, so a single connection joining a located station to an
 * unlocated one forces the scale to zero.</p>
 */
@Slf4j
public final class GeometryLowerBoundModel {
    private static final double MAX_SCALE = 1.0d;
    private static final GeometryLowerBoundModel IDENTITY = new GeometryLowerBoundModel(MAX_SCALE);
    private static final GeometryLowerBoundModel ZERO = new GeometryLowerBoundModel(0.0d);

    private final double lowerBoundScale;

    private GeometryLowerBoundModel(double lowerBoundScale) {
        this.lowerBoundScale = lowerBoundScale;
    }

    public double lowerBoundScale() {
        return lowerBoundScale;
    }

    /**
     * Returns the uncalibrated model (scale 1).
     */
    public static GeometryLowerBoundModel identity() {
        return IDENTITY;
    }

    /**
     * Calibrates the scale against the current connections of a knowledge base.
     *
     * @param knowledgeBase network to calibrate against.
     * @return calibrated model, identity when no connection constrains the scale, zero when a
     *         connection joins a located station to an unlocated one.
     */
    public static GeometryLowerBoundModel calibrate(KnowledgeBase knowledgeBase) {
        Objects.requireNonNull(knowledgeBase, "knowledgeBase");

        double bestRatio = MAX_SCALE;
        int constrainingConnections = 0;
        for (Connection connection : knowledgeBase.connections()) {
            Optional<Station> a = knowledgeBase.station(connection.getStationA());
            Optional<Station> b = knowledgeBase.station(connection.getStationB());
            if (a.isEmpty() || b.isEmpty()) {
                continue;
            }
            boolean locatedA = a.get().hasCoordinates();
            boolean locatedB = b.get().hasCoordinates();
            if (locatedA != locatedB) {
                log.debug("Straight-line scale disabled: {} joins located and unlocated stations", connection.toFact());
                return ZERO;
            }
            if (!locatedA) {
                continue;
            }
            double straightLine;
            try {
                straightLine = knowledgeBase.estimateHeuristic(connection.getStationA(), connection.getStationB());
            } catch (MissingCoordinatesException | UnknownStationException ex) {
                // Network changed between the snapshot and this read; the next revision recalibrates.
                continue;
            }
            if (!Double.isFinite(straightLine) || straightLine <= 0.0d) {
                continue;
            }
            constrainingConnections++;
            double ratio = connection.getDistanceKm() / straightLine;
            if (ratio < bestRatio) {
                bestRatio = ratio;
            }
        }

        log.debug("Calibrated straight-line scale {} from {} connection(s)", bestRatio, constrainingConnections);
        return bestRatio == MAX_SCALE ? IDENTITY : new GeometryLowerBoundModel(bestRatio);
    }
}
