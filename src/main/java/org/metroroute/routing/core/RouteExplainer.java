package org.metroroute.routing.core;

import org.metroroute.knowledge.Connection;
import org.metroroute.knowledge.KnowledgeBase;
import org.metroroute.knowledge.Station;

import java.util.List;
import java.util.Optional;

/**
 * Builds {@link RouteExplanation} values from a path and the knowledge base's line data.
 */
final class RouteExplainer {

    /**
     * @throws org.metroroute.knowledge.UnknownStationException when a path station is not registered.
     */
    RouteExplanation explain(KnowledgeBase knowledgeBase, List<String> path, RouteStatistics statistics) {
        RouteExplanation.RouteExplanationBuilder builder = RouteExplanation.builder().statistics(statistics);
        if (path == null || path.isEmpty()) {
            return builder.build();
        }

        Station first = knowledgeBase.requireRegistered(path.get(0));
        Station last = knowledgeBase.requireRegistered(path.get(path.size() - 1));
        builder.origin(first.getName())
                .originLine(first.getLine())
                .destination(last.getName())
                .destinationLine(last.getLine());

        Station from = first;
        for (int i = 1; i < path.size(); i++) {
            Station to = knowledgeBase.requireRegistered(path.get(i));
            boolean transfer = knowledgeBase.requiresTransfer(from.getName(), to.getName());
            Optional<Connection> connection = knowledgeBase.connectionBetween(from.getName(), to.getName());

            builder.segment(RouteSegment.builder()
                    .sequence(i)
                    .fromStation(from.getName())
                    .fromLine(from.getLine())
                    .toStation(to.getName())
                    .toLine(to.getLine())
                    .transfer(transfer)
                    .distanceKm(connection.map(Connection::getDistanceKm).orElse(null))
                    .timeMinutes(connection.map(Connection::getTimeMinutes).orElse(null))
                    .build());
            if (transfer) {
                builder.transferPoint(from.getName());
            }
            from = to;
        }
        return builder.build();
    }
}
