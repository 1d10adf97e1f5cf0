package org.metroroute.app;

import lombok.extern.slf4j.Slf4j;
import org.metroroute.knowledge.ConsistencyViolation;
import org.metroroute.knowledge.KnowledgeBase;
import org.metroroute.routing.analysis.NetworkAnalysisReport;
import org.metroroute.routing.analysis.NetworkAnalyzer;
import org.metroroute.routing.core.AlgorithmComparison;
import org.metroroute.routing.core.InferenceEngine;
import org.metroroute.routing.core.RouteExplanation;
import org.metroroute.routing.core.RouteNotFoundException;
import org.metroroute.routing.core.RouteResult;
import org.metroroute.routing.core.RouteSegment;
import org.metroroute.routing.core.RouteStatistics;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Demo runner over the sample TransMilenio network.
 *
 * <p>Without arguments, routes a fixed set of station pairs and prints each explanation.
 * {@code --validate} prints consistency findings, {@code --analyze} routes every pair and
 * prints aggregate statistics.</p>
 */
@Slf4j
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;

    static final List<String[]> DEMO_QUERIES = List.of(
            new String[]{"Portal Norte", "CAD"},
            new String[]{"Portal Suba", "Calle 142"},
            new String[]{"Portal Américas", "Virrey"},
            new String[]{"Toberín", "Marsella"}
    );

    private static final String RULE = "=".repeat(60);
    private static final int FACT_PREVIEW = 5;

    /**
     * Launches the demo.
     *
     * @param args optional single mode flag.
     */
    public static void main(String[] args) {
        int code = run(args, System.out);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Runs one mode against {@code out}.
     *
     * @return process exit code.
     */
    static int run(String[] args, PrintStream out) {
        if (args.length > 1) {
            printUsage(out);
            return EXIT_USAGE;
        }
        String mode = args.length == 0 ? "" : args[0];
        switch (mode) {
            case "":
                runDemo(out);
                return EXIT_OK;
            case "--validate":
                return runValidation(out);
            case "--analyze":
                runAnalysis(out);
                return EXIT_OK;
            case "--help":
            case "-h":
                printUsage(out);
                return EXIT_OK;
            default:
                out.println("Unknown option: " + mode);
                printUsage(out);
                return EXIT_USAGE;
        }
    }

    private static void runDemo(PrintStream out) {
        KnowledgeBase kb = SampleNetworks.transMilenio();
        log.info("Knowledge base ready: {} stations, {} connections", kb.stationCount(), kb.connectionCount());
        InferenceEngine engine = new InferenceEngine(kb);
        log.info("Inference engine ready: {} / {}", engine.config().getAlgorithm(), engine.config().getHeuristicType());

        out.println(RULE);
        out.println("TRANSIT ROUTE INFERENCE");
        out.println(RULE);
        out.println("Stations: " + kb.stationCount() + ", connections: " + kb.connectionCount());

        for (String[] query : DEMO_QUERIES) {
            out.println();
            out.println("Searching route: " + query[0] + " -> " + query[1]);
            try {
                AlgorithmComparison comparison = engine.compareAlgorithms(query[0], query[1]);
                RouteResult result = comparison.getInformed();
                out.print(render(engine.explainRoute(result)));
                out.println(String.format(Locale.ROOT,
                        "Baseline expanded %d station(s); heuristic saved %d (%.1f%%)",
                        comparison.getBaseline().getStatistics().getNodesExpanded(),
                        comparison.getNodesSaved(),
                        comparison.getSavingPercent()));
            } catch (RouteNotFoundException ex) {
                out.println("No route between " + ex.origin() + " and " + ex.destination());
            }
        }

        out.println();
        out.println("First " + FACT_PREVIEW + " connection facts:");
        List<String> facts = kb.connectionFacts();
        for (int i = 0; i < Math.min(FACT_PREVIEW, facts.size()); i++) {
            out.println("  " + (i + 1) + ". " + facts.get(i));
        }
    }

    private static int runValidation(PrintStream out) {
        KnowledgeBase kb = SampleNetworks.transMilenio();
        List<ConsistencyViolation> violations = kb.validateConsistency();
        out.println(RULE);
        out.println("CONSISTENCY VALIDATION");
        out.println(RULE);
        if (violations.isEmpty()) {
            out.println("Network is consistent: " + kb.stationCount() + " stations, "
                    + kb.connectionCount() + " connections");
            return EXIT_OK;
        }
        out.println("Violations: " + violations.size());
        for (int i = 0; i < violations.size(); i++) {
            out.println("  " + (i + 1) + ". " + violations.get(i));
        }
        return 1;
    }

    private static void runAnalysis(PrintStream out) {
        InferenceEngine engine = new InferenceEngine(SampleNetworks.transMilenio());
        NetworkAnalysisReport report = new NetworkAnalyzer(engine).analyze();
        log.info("Analyzed {} station pair(s)", report.getPairsAttempted());

        out.println(RULE);
        out.println("NETWORK ANALYSIS");
        out.println(RULE);
        out.println(String.format(Locale.ROOT, "Pairs attempted: %d", report.getPairsAttempted()));
        out.println(String.format(Locale.ROOT, "Routes found: %d", report.getRoutesFound()));
        out.println(String.format(Locale.ROOT, "Success rate: %.1f%%", report.successRate()));
        if (report.getRoutesFound() == 0) {
            return;
        }
        out.println(String.format(Locale.ROOT, "Average stations: %.2f (min %d, max %d)",
                report.getAverageStations(), report.getMinStations(), report.getMaxStations()));
        out.println(String.format(Locale.ROOT, "Average transfers: %.2f", report.getAverageTransfers()));
        out.println(String.format(Locale.ROOT, "Average distance: %.2f km", report.getAverageDistanceKm()));
        out.println(String.format(Locale.ROOT, "Average time: %.1f min", report.getAverageTimeMinutes()));
        out.println(String.format(Locale.ROOT, "Average stations expanded: %.1f", report.getAverageNodesExpanded()));
        out.println("Longest route: " + describe(report.getLongestRoute()));
        out.println("Most transfers: " + describe(report.getMostTransfers()));
        out.println("Fastest route: " + describe(report.getFastestRoute()));
        out.println("Most efficient search: " + describe(report.getMostEfficientSearch()));
    }

    /**
     * Renders an explanation as plain text.
     */
    static String render(RouteExplanation explanation) {
        if (explanation.isEmpty()) {
            return "No valid route between the requested stations." + System.lineSeparator();
        }
        StringBuilder sb = new StringBuilder();
        String nl = System.lineSeparator();
        sb.append(RULE).append(nl).append("OPTIMAL ROUTE").append(nl).append(RULE).append(nl);
        sb.append("Origin: ").append(explanation.getOrigin())
                .append(" (").append(explanation.getOriginLine()).append(')').append(nl);
        sb.append("Destination: ").append(explanation.getDestination())
                .append(" (").append(explanation.getDestinationLine()).append(')').append(nl);
        sb.append("Stations:").append(nl);

        List<RouteSegment> segments = explanation.getSegments();
        int index = 1;
        for (RouteSegment segment : segments) {
            sb.append("  ").append(index++).append(". ").append(segment.getFromStation())
                    .append(" [").append(segment.getFromLine()).append(']');
            if (segment.isTransfer()) {
                sb.append(" -> TRANSFER to ").append(segment.getToLine());
            }
            sb.append(nl);
        }
        sb.append("  ").append(index).append(". ").append(explanation.getDestination())
                .append(" [").append(explanation.getDestinationLine()).append(']').append(nl);

        RouteStatistics stats = explanation.getStatistics();
        if (stats != null) {
            sb.append("Transfers: ").append(stats.getTransferCount()).append(nl);
            sb.append(String.format(Locale.ROOT, "Distance: %.2f km", stats.getTotalDistance())).append(nl);
            sb.append(String.format(Locale.ROOT, "Time: %.1f min", stats.getTotalTime())).append(nl);
            sb.append("Stations expanded: ").append(stats.getNodesExpanded()).append(nl);
        }
        return sb.toString();
    }

    private static String describe(RouteResult route) {
        RouteStatistics stats = route.getStatistics();
        return String.format(Locale.ROOT, "%s -> %s (%d stations, %d transfers, %.1f min, %d expanded)",
                route.getOrigin(), route.getDestination(), stats.getStationCount(),
                stats.getTransferCount(), stats.getTotalTime(), stats.getNodesExpanded());
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: metro-route [--validate | --analyze | --help]");
        out.println("  (no option)  route the demo station pairs on the sample network");
        out.println("  --validate   check the sample network for consistency problems");
        out.println("  --analyze    route every station pair and print aggregate statistics");
        out.println("  --help       show this message");
    }
}
