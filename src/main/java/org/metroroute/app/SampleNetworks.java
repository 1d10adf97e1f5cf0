package org.metroroute.app;

import lombok.experimental.UtilityClass;
import org.metroroute.knowledge.DistanceMetric;
import org.metroroute.knowledge.KnowledgeBase;

/**
 * Ready-made networks for the demo runner and for tests.
 */
@UtilityClass
public class SampleNetworks {
    public static final String LINE_CARACAS = "Troncal Caracas";
    public static final String LINE_NQS = "Troncal NQS";
    public static final String LINE_AMERICAS = "Troncal Américas";
    public static final String LINE_INTERCHANGE = "Transbordo";

    /**
     * Builds a reduced Bogotá TransMilenio network: three trunk lines joined through
     * Virrey and the Centro Memoria interchange. 16 stations, 16 connections.
     */
    public static KnowledgeBase transMilenio() {
        return transMilenio(DistanceMetric.GREAT_CIRCLE);
    }

    /**
     * Same network with an explicit estimate formula.
     */
    public static KnowledgeBase transMilenio(DistanceMetric metric) {
        KnowledgeBase kb = new KnowledgeBase(metric);

        kb.addStation("Portal Norte", LINE_CARACAS, 4.7656, -74.0467);
        kb.addStation("Toberín", LINE_CARACAS, 4.7532, -74.0464);
        kb.addStation("Calle 142", LINE_CARACAS, 4.7241, -74.0511);
        kb.addStation("Alcalá", LINE_CARACAS, 4.7110, -74.0532);
        kb.addStation("Calle 100", LINE_CARACAS, 4.6858, -74.0549);
        kb.addStation("Virrey", LINE_CARACAS, 4.6656, -74.0569);

        kb.addStation("Portal Suba", LINE_NQS, 4.7462, -74.0832);
        kb.addStation("Suba Calle 95", LINE_NQS, 4.7279, -74.0834);
        kb.addStation("Calle 75", LINE_NQS, 4.6771, -74.0613);
        kb.addStation("Heroes", LINE_NQS, 4.6531, -74.0633);
        kb.addStation("CAD", LINE_NQS, 4.6437, -74.0641);

        kb.addStation("Portal Américas", LINE_AMERICAS, 4.6172, -74.1413);
        kb.addStation("Pradera", LINE_AMERICAS, 4.6294, -74.1291);
        kb.addStation("Marsella", LINE_AMERICAS, 4.6376, -74.1156);
        kb.addStation("Zona Industrial", LINE_AMERICAS, 4.6445, -74.1069);

        kb.addStation("Centro Memoria", LINE_INTERCHANGE, 4.6569, -74.0611);

        kb.addConnection("Portal Norte", "Toberín", 1.5, 3);
        kb.addConnection("Toberín", "Calle 142", 3.2, 6);
        kb.addConnection("Calle 142", "Alcalá", 1.8, 4);
        kb.addConnection("Alcalá", "Calle 100", 2.8, 5);
        kb.addConnection("Calle 100", "Virrey", 2.3, 4);

        kb.addConnection("Portal Suba", "Suba Calle 95", 2.1, 4);
        kb.addConnection("Suba Calle 95", "Calle 75", 5.8, 10);
        kb.addConnection("Calle 75", "Heroes", 2.8, 5);
        kb.addConnection("Heroes", "CAD", 1.2, 3);
        kb.addConnection("CAD", "Centro Memoria", 0.8, 2);

        kb.addConnection("Portal Américas", "Pradera", 1.7, 3);
        kb.addConnection("Pradera", "Marsella", 1.9, 4);
        kb.addConnection("Marsella", "Zona Industrial", 1.5, 3);
        kb.addConnection("Zona Industrial", "Centro Memoria", 1.2, 3);

        // Cross-line links; Virrey -> Calle 75 includes platform wait.
        kb.addConnection("Virrey", "Calle 75", 1.5, 8);
        kb.addConnection("Virrey", "Centro Memoria", 1.8, 5);
        return kb;
    }
}
