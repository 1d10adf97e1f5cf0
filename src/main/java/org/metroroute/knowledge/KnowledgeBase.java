package org.metroroute.knowledge;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory transit network: stations, symmetric connections and the rules derived from them.
 *
 * <p>Rules exposed by this class:</p>
 * <ul>
 * <li>connectivity: {@code connects(A, B, d, t)} implies B is a neighbor of A and A is a neighbor of B.</li>
 * <li>transfer: {@code line(A) != line(B)} implies {@code requiresTransfer(A, B)}.</li>
 * <li>estimation: coordinates on both stations allow a straight-line distance estimate.</li>
 * </ul>
 *
 * <p>Connections may reference stations that are registered later; {@link #validateConsistency()}
 * reports whatever is still dangling. Iteration order of stations, neighbors and connection
 * facts is registration order.</p>
 *
 * <p>Thread-safety: reads take a shared lock for the duration of one call, mutations take the
 * exclusive lock. Concurrent read-only queries are safe; a query racing a mutation observes each
 * individual read consistently but not the network as a whole.</p>
 */
@Slf4j
public final class KnowledgeBase {
    private static final double MIN_LAT = -90.0d;
    private static final double MAX_LAT = 90.0d;
    private static final double MIN_LON = -180.0d;
    private static final double MAX_LON = 180.0d;

    @Getter
    @Accessors(fluent = true)
    private final DistanceMetric distanceMetric;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Object2ObjectLinkedOpenHashMap<String, Station> stations = new Object2ObjectLinkedOpenHashMap<>();
    private final Object2ObjectLinkedOpenHashMap<String, Object2ObjectLinkedOpenHashMap<String, Neighbor>> adjacency =
            new Object2ObjectLinkedOpenHashMap<>();
    private final Object2ObjectLinkedOpenHashMap<PairKey, Connection> connections = new Object2ObjectLinkedOpenHashMap<>();
    private long revision;

    /**
     * Creates an empty knowledge base using great-circle estimates.
     */
    public KnowledgeBase() {
        this(DistanceMetric.GREAT_CIRCLE);
    }

    /**
     * Creates an empty knowledge base with an explicit estimate formula.
     *
     * @param distanceMetric formula used by {@link #estimateHeuristic(String, String)}.
     */
    public KnowledgeBase(DistanceMetric distanceMetric) {
        this.distanceMetric = Objects.requireNonNull(distanceMetric, "distanceMetric");
    }

    // --- Mutation ---

    /**
     * Registers a station without coordinates, or overwrites an existing one.
     *
     * @param name unique non-blank station name.
     * @param line line label.
     * @throws InvalidStationException when name or line is missing.
     */
    public void addStation(String name, String line) {
        putStation(validateStation(name, line, null, null));
    }

    /**
     * Registers a station with coordinates, or overwrites an existing one.
     *
     * @param name unique non-blank station name.
     * @param line line label.
     * @param latitude latitude in degrees, within [-90, 90].
     * @param longitude longitude in degrees, within [-180, 180].
     * @throws InvalidStationException when name, line or coordinates are invalid.
     */
    public void addStation(String name, String line, double latitude, double longitude) {
        putStation(validateStation(name, line, latitude, longitude));
    }

    /**
     * Registers a symmetric connection, replacing any previous data for the same unordered pair.
     *
     * <p>Endpoints do not need to be registered yet.</p>
     *
     * @param stationA first endpoint.
     * @param stationB second endpoint.
     * @param distanceKm non-negative distance in kilometers.
     * @param timeMinutes non-negative travel time in minutes.
     * @throws InvalidConnectionException when endpoints or values are invalid; nothing is stored.
     */
    public void addConnection(String stationA, String stationB, double distanceKm, double timeMinutes) {
        validateConnection(stationA, stationB, distanceKm, timeMinutes);
        Connection connection = new Connection(stationA, stationB, distanceKm, timeMinutes);

        lock.writeLock().lock();
        try {
            Connection previous = connections.put(PairKey.of(stationA, stationB), connection);
            if (previous != null) {
                log.debug("Overwriting connection {} with {}", previous.toFact(), connection.toFact());
            }
            adjacencyOf(stationA).put(stationB, new Neighbor(stationB, distanceKm, timeMinutes));
            adjacencyOf(stationB).put(stationA, new Neighbor(stationA, distanceKm, timeMinutes));
            revision++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // --- Rule queries ---

    /**
     * Lists the stations directly reachable from {@code station}.
     *
     * @param station registered station name.
     * @return neighbors in registration order, empty when the station has no connections.
     * @throws UnknownStationException when the station is not registered.
     */
    public List<Neighbor> neighborsOf(String station) {
        lock.readLock().lock();
        try {
            requireStation(station);
            Object2ObjectLinkedOpenHashMap<String, Neighbor> neighbors = adjacency.get(station);
            if (neighbors == null || neighbors.isEmpty()) {
                return List.of();
            }
            return List.copyOf(neighbors.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Evaluates the transfer rule for two stations.
     *
     * @return true when the line labels differ.
     * @throws UnknownStationException when either station is not registered.
     */
    public boolean requiresTransfer(String stationA, String stationB) {
        lock.readLock().lock();
        try {
            return !requireStation(stationA).getLine().equals(requireStation(stationB).getLine());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Estimates straight-line distance in kilometers between two stations.
     *
     * @return distance computed with {@link #distanceMetric()}.
     * @throws UnknownStationException when either station is not registered.
     * @throws MissingCoordinatesException when either station has no coordinates.
     */
    public double estimateHeuristic(String stationA, String stationB) {
        lock.readLock().lock();
        try {
            Station a = requireStation(stationA);
            Station b = requireStation(stationB);
            if (!a.hasCoordinates()) {
                throw new MissingCoordinatesException(a.getName());
            }
            if (!b.hasCoordinates()) {
                throw new MissingCoordinatesException(b.getName());
            }
            return GeometryDistance.distanceKm(
                    distanceMetric,
                    a.getLatitude(),
                    a.getLongitude(),
                    b.getLatitude(),
                    b.getLongitude()
            );
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the direct connection between two stations, if any.
     */
    public Optional<Connection> connectionBetween(String stationA, String stationB) {
        if (stationA == null || stationB == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(connections.get(PairKey.of(stationA, stationB)));
        } finally {
            lock.readLock().unlock();
        }
    }

    // --- Read accessors ---

    /**
     * Looks up one station.
     */
    public Optional<Station> station(String name) {
        if (name == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(stations.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Resolves one station or fails.
     *
     * @throws UnknownStationException when the station is not registered.
     */
    public Station requireRegistered(String name) {
        lock.readLock().lock();
        try {
            return requireStation(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean containsStation(String name) {
        return station(name).isPresent();
    }

    /**
     * @return snapshot of all stations in registration order.
     */
    public List<Station> stations() {
        lock.readLock().lock();
        try {
            return List.copyOf(stations.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Groups station names by line label, lines sorted alphabetically.
     */
    public Map<String, List<String>> stationsByLine() {
        lock.readLock().lock();
        try {
            Map<String, List<String>> byLine = new TreeMap<>();
            for (Station station : stations.values()) {
                byLine.computeIfAbsent(station.getLine(), line -> new ArrayList<>()).add(station.getName());
            }
            byLine.replaceAll((line, names) -> List.copyOf(names));
            return Collections.unmodifiableMap(byLine);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return snapshot of registered connections in registration order.
     */
    public List<Connection> connections() {
        lock.readLock().lock();
        try {
            return List.copyOf(connections.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Renders every registered connection as a rule fact.
     */
    public List<String> connectionFacts() {
        List<Connection> snapshot = connections();
        List<String> facts = new ArrayList<>(snapshot.size());
        for (Connection connection : snapshot) {
            facts.add(connection.toFact());
        }
        return facts;
    }

    public int stationCount() {
        lock.readLock().lock();
        try {
            return stations.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns a counter that changes on every successful mutation.
     *
     * <p>Used to invalidate values derived from the whole network, such as heuristic calibration.</p>
     */
    public long revision() {
        lock.readLock().lock();
        try {
            return revision;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int connectionCount() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // --- Diagnostics ---

    /**
     * Scans every connection for structural problems.
     *
     * <p>Never throws. Callers decide whether findings are fatal.</p>
     *
     * @return violations, empty when the network is consistent.
     */
    public List<ConsistencyViolation> validateConsistency() {
        List<ConsistencyViolation> violations = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Connection connection : connections.values()) {
                checkEndpointRegistered(connection, connection.getStationA(), violations);
                checkEndpointRegistered(connection, connection.getStationB(), violations);
                checkValues(connection.toFact(), connection.getDistanceKm(), connection.getTimeMinutes(), violations);
            }

            for (Map.Entry<String, Object2ObjectLinkedOpenHashMap<String, Neighbor>> entry : adjacency.entrySet()) {
                String from = entry.getKey();
                for (Neighbor forward : entry.getValue().values()) {
                    checkSymmetry(from, forward, violations);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        if (!violations.isEmpty()) {
            log.warn("Knowledge base consistency check found {} violation(s), first: {}",
                    violations.size(), violations.get(0));
        }
        return List.copyOf(violations);
    }

    private void checkEndpointRegistered(Connection connection, String endpoint, List<ConsistencyViolation> out) {
        if (!stations.containsKey(endpoint)) {
            out.add(new ConsistencyViolation(
                    ConsistencyViolation.Kind.UNKNOWN_STATION,
                    "station " + endpoint + " referenced by " + connection.toFact() + " is not registered"
            ));
        }
    }

    private static void checkValues(String label, double distanceKm, double timeMinutes, List<ConsistencyViolation> out) {
        if (!Double.isFinite(distanceKm) || !Double.isFinite(timeMinutes)) {
            out.add(new ConsistencyViolation(
                    ConsistencyViolation.Kind.NON_FINITE_VALUE,
                    label + " has a non-finite distance or time"
            ));
            return;
        }
        if (distanceKm < 0.0d) {
            out.add(new ConsistencyViolation(
                    ConsistencyViolation.Kind.NEGATIVE_DISTANCE,
                    label + " has negative distance " + distanceKm
            ));
        }
        if (timeMinutes < 0.0d) {
            out.add(new ConsistencyViolation(
                    ConsistencyViolation.Kind.NEGATIVE_TIME,
                    label + " has negative time " + timeMinutes
            ));
        }
    }

    private void checkSymmetry(String from, Neighbor forward, List<ConsistencyViolation> out) {
        Object2ObjectLinkedOpenHashMap<String, Neighbor> reverseNeighbors = adjacency.get(forward.station());
        Neighbor reverse = reverseNeighbors == null ? null : reverseNeighbors.get(from);
        if (reverse == null) {
            out.add(new ConsistencyViolation(
                    ConsistencyViolation.Kind.ASYMMETRIC_CONNECTION,
                    from + " -> " + forward.station() + " exists but the reverse direction is missing"
            ));
            return;
        }
        // Each unordered pair is visited twice; report a value mismatch only once.
        if (from.compareTo(forward.station()) < 0
                && (Double.compare(forward.distanceKm(), reverse.distanceKm()) != 0
                || Double.compare(forward.timeMinutes(), reverse.timeMinutes()) != 0)) {
            out.add(new ConsistencyViolation(
                    ConsistencyViolation.Kind.ASYMMETRIC_CONNECTION,
                    from + " <-> " + forward.station() + " directions disagree: ("
                            + forward.distanceKm() + " km, " + forward.timeMinutes() + " min) vs ("
                            + reverse.distanceKm() + " km, " + reverse.timeMinutes() + " min)"
            ));
        }
    }

    // --- Internals ---

    private void putStation(Station station) {
        lock.writeLock().lock();
        try {
            Station previous = stations.put(station.getName(), station);
            if (previous != null) {
                log.debug("Overwriting station {}: {} -> {}", station.getName(), previous, station);
            }
            revision++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Object2ObjectLinkedOpenHashMap<String, Neighbor> adjacencyOf(String station) {
        Object2ObjectLinkedOpenHashMap<String, Neighbor> neighbors = adjacency.get(station);
        if (neighbors == null) {
            neighbors = new Object2ObjectLinkedOpenHashMap<>();
            adjacency.put(station, neighbors);
        }
        return neighbors;
    }

    /**
     * Resolves a station; caller must hold a lock.
     */
    private Station requireStation(String name) {
        Station station = name == null ? null : stations.get(name);
        if (station == null) {
            throw new UnknownStationException(name);
        }
        return station;
    }

    private static Station validateStation(String name, String line, Double latitude, Double longitude) {
        if (name == null || name.isBlank()) {
            throw new InvalidStationException(
                    InvalidStationException.REASON_NAME_REQUIRED,
                    "station name must be non-blank"
            );
        }
        if (line == null) {
            throw new InvalidStationException(
                    InvalidStationException.REASON_LINE_REQUIRED,
                    "line label must be provided for station " + name
            );
        }
        if (latitude != null) {
            if (!Double.isFinite(latitude) || latitude < MIN_LAT || latitude > MAX_LAT) {
                throw new InvalidStationException(
                        InvalidStationException.REASON_INVALID_COORDINATES,
                        "latitude out of range for station " + name + ": " + latitude
                );
            }
            if (!Double.isFinite(longitude) || longitude < MIN_LON || longitude > MAX_LON) {
                throw new InvalidStationException(
                        InvalidStationException.REASON_INVALID_COORDINATES,
                        "longitude out of range for station " + name + ": " + longitude
                );
            }
        }
        return Station.builder()
                .name(name)
                .line(line)
                .latitude(latitude)
                .longitude(longitude)
                .build();
    }

    private static void validateConnection(String stationA, String stationB, double distanceKm, double timeMinutes) {
        if (stationA == null || stationA.isBlank() || stationB == null || stationB.isBlank()) {
            throw new InvalidConnectionException(
                    InvalidConnectionException.REASON_ENDPOINT_REQUIRED,
                    "connection endpoints must be non-blank: " + stationA + ", " + stationB
            );
        }
        if (stationA.equals(stationB)) {
            throw new InvalidConnectionException(
                    InvalidConnectionException.REASON_SELF_LOOP,
                    "connection must join two different stations: " + stationA
            );
        }
        if (!Double.isFinite(distanceKm) || !Double.isFinite(timeMinutes)) {
            throw new InvalidConnectionException(
                    InvalidConnectionException.REASON_NON_FINITE_VALUE,
                    "distance and time must be finite for " + stationA + " - " + stationB
            );
        }
        if (distanceKm < 0.0d) {
            throw new InvalidConnectionException(
                    InvalidConnectionException.REASON_NEGATIVE_DISTANCE,
                    "distance must be >= 0 for " + stationA + " - " + stationB + ": " + distanceKm
            );
        }
        if (timeMinutes < 0.0d) {
            throw new InvalidConnectionException(
                    InvalidConnectionException.REASON_NEGATIVE_TIME,
                    "time must be >= 0 for " + stationA + " - " + stationB + ": " + timeMinutes
            );
        }
    }

    /**
     * Unordered station pair used as the connection key.
     */
    private record PairKey(String low, String high) {
        static PairKey of(String a, String b) {
            return a.compareTo(b) <= 0 ? new PairKey(a, b) : new PairKey(b, a);
        }
    }
}
