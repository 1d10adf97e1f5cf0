package org.metroroute.routing.core;

/**
 * Mutable per-station search record for one query.
 *
 * <p>Holds the best-known path to {@link #station}: accumulated cost {@code g}, heuristic
 * estimate {@code h}, predecessor and the distance, time and transfer totals along that path.</p>
 */
final class SearchState {
    final String station;
    double g = Double.POSITIVE_INFINITY;
    double h;
    String predecessor;
    double distanceKm;
    double timeMinutes;
    int transfers;
    boolean closed;

    SearchState(String station) {
        this.station = station;
    }

    double f() {
        return g + h;
    }

    /**
     * Records a better path arriving from {@code from}.
     */
    void relax(SearchState from, double g, double distanceKm, double timeMinutes, boolean transfer) {
        this.g = g;
        this.predecessor = from.station;
        this.distanceKm = from.distanceKm + distanceKm;
        this.timeMinutes = from.timeMinutes + timeMinutes;
        this.transfers = from.transfers + (transfer ? 1 : 0);
    }

    @Override
    public String toString() {
        return "SearchState{" +
                "station=" + station +
                ", g=" + g +
                ", h=" + h +
                ", pred=" + predecessor +
                ", transfers=" + transfers +
                '}';
    }
}
