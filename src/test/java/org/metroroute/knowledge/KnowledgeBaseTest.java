package org.metroroute.knowledge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.metroroute.app.SampleNetworks;
import org.metroroute.testutil.TransitFixtures;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("KnowledgeBase Tests")
class KnowledgeBaseTest {

    @Nested
    @DisplayName("Station registration")
    class StationRegistration {

        @Test
        @DisplayName("Registers stations with and without coordinates")
        void testRegistersStations() {
            KnowledgeBase kb = new KnowledgeBase();
            kb.addStation("A", "Red", 4.7, -74.0);
            kb.addStation("B", "Blue");

            assertEquals(2, kb.stationCount());
            assertTrue(kb.requireRegistered("A").hasCoordinates());
            assertFalse(kb.requireRegistered("B").hasCoordinates());
            assertEquals("Blue", kb.station("B").orElseThrow().getLine());
        }

        @Test
        @DisplayName("Re-registering a name overwrites line and coordinates")
        void testDuplicateNameOverwrites() {
            KnowledgeBase kb = new KnowledgeBase();
            kb.addStation("A", "Red", 1.0, 1.0);
            kb.addStation("A", "Blue", 2.0, 2.0);

            Station station = kb.requireRegistered("A");
            assertEquals(1, kb.stationCount());
            assertEquals("Blue", station.getLine());
            assertEquals(2.0, station.getLatitude());
        }

        @Test
        @DisplayName("Blank names are rejected")
        void testRejectsBlankName() {
            KnowledgeBase kb = new KnowledgeBase();
            InvalidStationException ex = assertThrows(InvalidStationException.class, () -> kb.addStation("  ", "Red"));
            assertEquals(InvalidStationException.REASON_NAME_REQUIRED, ex.getReasonCode());
            assertThrows(InvalidStationException.class, () -> kb.addStation(null, "Red"));
            assertEquals(0, kb.stationCount());
        }

        @Test
        @DisplayName("Missing line label is rejected")
        void testRejectsMissingLine() {
            KnowledgeBase kb = new KnowledgeBase();
            InvalidStationException ex = assertThrows(InvalidStationException.class, () -> kb.addStation("A", null));
            assertEquals(InvalidStationException.REASON_LINE_REQUIRED, ex.getReasonCode());
        }

        @Test
        @DisplayName("Out-of-range or non-finite coordinates are rejected")
        void testRejectsInvalidCoordinates() {
            KnowledgeBase kb = new KnowledgeBase();
            assertEquals(InvalidStationException.REASON_INVALID_COORDINATES,
                    assertThrows(InvalidStationException.class, () -> kb.addStation("A", "Red", 91.0, 0.0)).getReasonCode());
            assertEquals(InvalidStationException.REASON_INVALID_COORDINATES,
                    assertThrows(InvalidStationException.class, () -> kb.addStation("A", "Red", 0.0, -180.5)).getReasonCode());
            assertThrows(InvalidStationException.class, () -> kb.addStation("A", "Red", Double.NaN, 0.0));
            assertFalse(kb.containsStation("A"));
        }

        @Test
        @DisplayName("Stations are grouped by line in sorted line order")
        void testStationsByLine() {
            KnowledgeBase kb = new KnowledgeBase();
            kb.addStation("X", "Zeta");
            kb.addStation("Y", "Alpha");
            kb.addStation("Z", "Alpha");

            Map<String, List<String>> byLine = kb.stationsByLine();
            assertEquals(List.of("Alpha", "Zeta"), new ArrayList<>(byLine.keySet()));
            assertEquals(List.of("Y", "Z"), byLine.get("Alpha"));
        }
    }

    @Nested
    @DisplayName("Connection registration")
    class ConnectionRegistration {

        @Test
        @DisplayName("Connections are symmetric with identical values")
        void testSymmetry() {
            KnowledgeBase kb = TransitFixtures.pqrNetwork();

            Neighbor forward = kb.neighborsOf("P").get(0);
            Neighbor reverse = kb.neighborsOf("Q").stream()
                    .filter(n -> n.station().equals("P"))
                    .findFirst()
                    .orElseThrow();
            assertEquals("Q", forward.station());
            assertEquals(forward.distanceKm(), reverse.distanceKm());
            assertEquals(forward.timeMinutes(), reverse.timeMinutes());
        }

        @Test
        @DisplayName("Re-registering a pair replaces both directions")
        void testReRegistrationReplaces() {
            KnowledgeBase kb = TransitFixtures.pqrNetwork();
            kb.addConnection("Q", "P", 5.0, 7.0);

            assertEquals(2, kb.connectionCount());
            assertEquals(1, kb.neighborsOf("P").size());
            assertEquals(5.0, kb.neighborsOf("P").get(0).distanceKm());
            assertEquals(7.0, kb.connectionBetween("P", "Q").orElseThrow().getTimeMinutes());
        }

        @Test
        @DisplayName("Negative distance fails and leaves state unchanged")
        void testNegativeDistanceLeavesStateUnchanged() {
            KnowledgeBase kb = TransitFixtures.pqrNetwork();
            long revisionBefore = kb.revision();
            List<Connection> before = kb.connections();

            InvalidConnectionException ex = assertThrows(
                    InvalidConnectionException.class,
                    () -> kb.addConnection("P", "Q", -1.0, 2.0)
            );

            assertEquals(InvalidConnectionException.REASON_NEGATIVE_DISTANCE, ex.getReasonCode());
            assertEquals(before, kb.connections());
            assertEquals(1.0, kb.neighborsOf("P").get(0).distanceKm());
            assertEquals(revisionBefore, kb.revision());
        }

        @Test
        @DisplayName("Negative time, non-finite values, blank endpoints and self loops are rejected")
        void testRejectsInvalidConnections() {
            KnowledgeBase kb = new KnowledgeBase();
            assertEquals(InvalidConnectionException.REASON_NEGATIVE_TIME,
                    assertThrows(InvalidConnectionException.class, () -> kb.addConnection("A", "B", 1.0, -1.0)).getReasonCode());
            assertEquals(InvalidConnectionException.REASON_NON_FINITE_VALUE,
                    assertThrows(InvalidConnectionException.class,
                            () -> kb.addConnection("A", "B", Double.POSITIVE_INFINITY, 1.0)).getReasonCode());
            assertEquals(InvalidConnectionException.REASON_ENDPOINT_REQUIRED,
                    assertThrows(InvalidConnectionException.class, () -> kb.addConnection("", "B", 1.0, 1.0)).getReasonCode());
            assertEquals(InvalidConnectionException.REASON_SELF_LOOP,
                    assertThrows(InvalidConnectionException.class, () -> kb.addConnection("A", "A", 1.0, 1.0)).getReasonCode());
            assertEquals(0, kb.connectionCount());
        }

        @Test
        @DisplayName("Zero distance and time are accepted")
        void testZeroValuesAccepted() {
            KnowledgeBase kb = new KnowledgeBase();
            kb.addStation("A", "Red");
            kb.addStation("B", "Red");
            kb.addConnection("A", "B", 0.0, 0.0);
            assertEquals(0.0, kb.neighborsOf("B").get(0).distanceKm());
        }

        @Test
        @DisplayName("Connection facts keep registration order")
        void testConnectionFacts() {
            KnowledgeBase kb = TransitFixtures.pqrNetwork();
            assertEquals(List.of("connects(P, Q, 1.0, 2.0)", "connects(Q, R, 1.0, 2.0)"), kb.connectionFacts());
        }

        @Test
        @DisplayName("Every mutation moves the revision")
        void testRevisionMoves() {
            KnowledgeBase kb = new KnowledgeBase();
            long r0 = kb.revision();
            kb.addStation("A", "Red");
            long r1 = kb.revision();
            kb.addConnection("A", "B", 1.0, 1.0);
            assertNotEquals(r0, r1);
            assertNotEquals(r1, kb.revision());
        }
    }

    @Nested
    @DisplayName("Rule queries")
    class RuleQueries {

        @Test
        @DisplayName("Unknown station raises UnknownStationException")
        void testUnknownStation() {
            KnowledgeBase kb = TransitFixtures.pqrNetwork();
            UnknownStationException ex = assertThrows(UnknownStationException.class, () -> kb.neighborsOf("Nowhere"));
            assertEquals(UnknownStationException.REASON_UNKNOWN_STATION, ex.getReasonCode());
            assertEquals("Nowhere", ex.stationName());
            assertThrows(UnknownStationException.class, () -> kb.requiresTransfer("P", "Nowhere"));
            assertThrows(UnknownStationException.class, () -> kb.estimateHeuristic("Nowhere", "P"));
        }

        @Test
        @DisplayName("Registered station without connections has no neighbors")
        void testIsolatedStation() {
            KnowledgeBase kb = TransitFixtures.pqrWithIsolatedStation();
            assertTrue(kb.neighborsOf("S").isEmpty());
        }

        @Test
        @DisplayName("Transfer rule compares line labels")
        void testTransferRule() {
            KnowledgeBase kb = TransitFixtures.pqrNetwork();
            assertFalse(kb.requiresTransfer("P", "Q"));
            assertTrue(kb.requiresTransfer("Q", "R"));
            assertTrue(kb.requiresTransfer("R", "P"));
        }

        @Test
        @DisplayName("Straight-line estimate is symmetric and zero for the same station")
        void testEstimateSymmetry() {
            KnowledgeBase kb = SampleNetworks.transMilenio();
            double forward = kb.estimateHeuristic("Portal Norte", "CAD");
            assertEquals(forward, kb.estimateHeuristic("CAD", "Portal Norte"), 1e-9);
            assertEquals(0.0, kb.estimateHeuristic("CAD", "CAD"), 1e-12);
            assertTrue(forward > 13.0 && forward < 14.0, "Portal Norte to CAD is about 13.6 km");
        }

        @Test
        @DisplayName("Missing coordinates raise MissingCoordinatesException naming the station")
        void testMissingCoordinates() {
            KnowledgeBase kb = TransitFixtures.pqrNetwork();
            kb.addStation("T", "1");
            MissingCoordinatesException ex = assertThrows(
                    MissingCoordinatesException.class,
                    () -> kb.estimateHeuristic("P", "T")
            );
            assertEquals(MissingCoordinatesException.REASON_MISSING_COORDINATES, ex.getReasonCode());
            assertEquals("T", ex.stationName());
        }

        @Test
        @DisplayName("Equirectangular metric follows the flat degree approximation")
        void testEquirectangularMetric() {
            KnowledgeBase kb = new KnowledgeBase(DistanceMetric.EQUIRECTANGULAR);
            kb.addStation("A", "Red", 0.0, 0.0);
            kb.addStation("B", "Red", 1.0, 0.0);
            kb.addStation("C", "Red", 0.0, 1.0);
            assertEquals(111.0, kb.estimateHeuristic("A", "B"), 1e-9);
            assertEquals(111.0 * 0.85, kb.estimateHeuristic("A", "C"), 1e-9);
        }
    }

    @Nested
    @DisplayName("Consistency validation")
    class ConsistencyValidation {

        @Test
        @DisplayName("Sample network is consistent")
        void testSampleNetworkConsistent() {
            assertTrue(SampleNetworks.transMilenio().validateConsistency().isEmpty());
        }

        @Test
        @DisplayName("Connections to unregistered stations are reported, not thrown")
        void testReportsUnknownEndpoints() {
            KnowledgeBase kb = TransitFixtures.pqrNetwork();
            kb.addConnection("R", "Ghost", 1.0, 1.0);

            List<ConsistencyViolation> violations = kb.validateConsistency();
            assertEquals(1, violations.size());
            assertEquals(ConsistencyViolation.Kind.UNKNOWN_STATION, violations.get(0).getKind());
            assertTrue(violations.get(0).getDescription().contains("Ghost"));
        }
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("Concurrent readers observe a stable network")
    void testConcurrentReads() throws Exception {
        KnowledgeBase kb = SampleNetworks.transMilenio();
        List<Neighbor> expected = kb.neighborsOf("Virrey");
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int t = 0; t < 16; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        if (!expected.equals(kb.neighborsOf("Virrey"))
                                || !kb.requiresTransfer("Virrey", "Centro Memoria")) {
                            return false;
                        }
                    }
                    return true;
                }));
            }
            for (Future<Boolean> future : futures) {
                assertTrue(future.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
