package org.metroroute.routing.heuristic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.metroroute.app.SampleNetworks;
import org.metroroute.knowledge.Connection;
import org.metroroute.knowledge.KnowledgeBase;
import org.metroroute.knowledge.Neighbor;
import org.metroroute.knowledge.Station;
import org.metroroute.testutil.TransitFixtures;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Straight-line Heuristic Tests")
class StraightLineHeuristicTest {

    @Nested
    @DisplayName("GeometryLowerBoundModel")
    class Calibration {

        @Test
        @DisplayName("Scale is the smallest track-to-straight-line ratio")
        void testScaleFromShortestRatio() {
            KnowledgeBase kb = TransitFixtures.pqrNetwork();
            double expected = 1.0 / kb.estimateHeuristic("P", "Q");

            GeometryLowerBoundModel model = GeometryLowerBoundModel.calibrate(kb);

            assertEquals(expected, model.lowerBoundScale(), 1e-12);
        }

        @Test
        @DisplayName("Scale never exceeds one")
        void testScaleCappedAtOne() {
            KnowledgeBase kb = new KnowledgeBase();
            kb.addStation("A", "1", 0.0, 0.0);
            kb.addStation("B", "1", 0.0, 0.001);
            kb.addConnection("A", "B", 50.0, 10.0);

            assertSame(GeometryLowerBoundModel.identity(), GeometryLowerBoundModel.calibrate(kb));
        }

        @Test
        @DisplayName("Unregistered, unlocated or coincident endpoints are skipped")
        void testSkipsUnconstrainingConnections() {
            KnowledgeBase kb = new KnowledgeBase();
            kb.addStation("A", "1", 0.0, 0.0);
            kb.addStation("B", "1", 0.0, 0.0);
            kb.addStation("C", "1");
            kb.addStation("D", "1");
            kb.addConnection("A", "B", 0.0, 1.0);
            kb.addConnection("C", "D", 0.0, 1.0);
            kb.addConnection("C", "Ghost", 0.0, 1.0);

            assertEquals(1.0, GeometryLowerBoundModel.calibrate(kb).lowerBoundScale());
        }

        @Test
        @DisplayName("Connection between a located and an unlocated station forces scale zero")
        void testMixedConnectionForcesZeroScale() {
            KnowledgeBase kb = TransitFixtures.pqrNetwork();
            assertTrue(GeometryLowerBoundModel.calibrate(kb).lowerBoundScale() > 0.0);

            kb.addStation("T", "1");
            assertTrue(GeometryLowerBoundModel.calibrate(kb).lowerBoundScale() > 0.0);

            kb.addConnection("R", "T", 1.0, 1.0);
            assertEquals(0.0, GeometryLowerBoundModel.calibrate(kb).lowerBoundScale());
        }

        @Test
        @DisplayName("Detour through unlocated stations zeroes every estimate")
        void testDetourNetworkEstimatesZero() {
            KnowledgeBase kb = TransitFixtures.unlocatedDetourNetwork();
            HeuristicProvider provider = HeuristicFactory.create(HeuristicType.STRAIGHT_LINE, kb, true);
            GoalBoundHeuristic heuristic = provider.bindGoal("G");

            assertEquals(0.0, ((StraightLineHeuristicProvider) provider).lowerBoundScale());
            assertEquals(0.0, heuristic.estimateFromStation("A"));
            assertEquals(0.0, heuristic.estimateFromStation("O"));
        }

        @Test
        @DisplayName("Sample network track that is shorter than the straight line lowers the scale")
        void testSampleNetworkScaleBelowOne() {
            KnowledgeBase kb = SampleNetworks.transMilenio();
            double scale = GeometryLowerBoundModel.calibrate(kb).lowerBoundScale();
            assertTrue(scale < 1.0, "Suba Calle 95 - Calle 75 track is shorter than its straight line");
            for (Connection connection : kb.connections()) {
                double straight = kb.estimateHeuristic(connection.getStationA(), connection.getStationB());
                assertTrue(straight * scale <= connection.getDistanceKm() + 1e-9, connection.toFact());
            }
        }
    }

    @Nested
    @DisplayName("Bound estimator")
    class BoundEstimator {

        @Test
        @DisplayName("Goal estimate is zero")
        void testGoalIsZero() {
            KnowledgeBase kb = SampleNetworks.transMilenio();
            GoalBoundHeuristic heuristic = HeuristicFactory.create(HeuristicType.STRAIGHT_LINE, kb, true).bindGoal("CAD");
            assertEquals(0.0, heuristic.estimateFromStation("CAD"));
        }

        @Test
        @DisplayName("Calibrated estimate is consistent across every connection")
        void testConsistency() {
            KnowledgeBase kb = SampleNetworks.transMilenio();
            HeuristicProvider provider = HeuristicFactory.create(HeuristicType.STRAIGHT_LINE, kb, true);
            for (Station goal : kb.stations()) {
                GoalBoundHeuristic heuristic = provider.bindGoal(goal.getName());
                for (Station from : kb.stations()) {
                    double hFrom = heuristic.estimateFromStation(from.getName());
                    for (Neighbor neighbor : kb.neighborsOf(from.getName())) {
                        double hTo = heuristic.estimateFromStation(neighbor.station());
                        assertTrue(hFrom <= neighbor.distanceKm() + hTo + 1e-9,
                                from.getName() + " -> " + neighbor.station() + " towards " + goal.getName());
                    }
                }
            }
        }

        @Test
        @DisplayName("Station without coordinates falls back to zero")
        void testMissingCoordinatesFallback() {
            KnowledgeBase kb = TransitFixtures.pqrNetwork();
            kb.addStation("T", "1");
            kb.addConnection("R", "T", 1.0, 1.0);

            HeuristicProvider provider = HeuristicFactory.create(HeuristicType.STRAIGHT_LINE, kb, false);
            assertEquals(0.0, provider.bindGoal("T").estimateFromStation("P"));
            assertEquals(0.0, provider.bindGoal("P").estimateFromStation("T"));
            assertTrue(provider.bindGoal("R").estimateFromStation("P") > 0.0);
        }
    }
}
