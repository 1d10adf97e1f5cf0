package org.metroroute.knowledge;

import lombok.experimental.UtilityClass;

/**
 * Straight-line distance helpers in kilometers.
 */
@UtilityClass
final class GeometryDistance {
    private static final double EARTH_MEAN_RADIUS_KM = 6_371.0088d;
    private static final double KM_PER_DEGREE_LAT = 111.0d;
    private static final double LONGITUDE_SCALE = 0.85d;

    /**
     * Dispatches to the formula of {@code metric}.
     */
    static double distanceKm(DistanceMetric metric, double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        return switch (metric) {
            case GREAT_CIRCLE -> greatCircleDistanceKm(lat1Deg, lon1Deg, lat2Deg, lon2Deg);
            case EQUIRECTANGULAR -> equirectangularDistanceKm(lat1Deg, lon1Deg, lat2Deg, lon2Deg);
        };
    }

    /**
     * Computes great-circle distance in kilometers using haversine formulation.
     */
    static double greatCircleDistanceKm(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double clampedA = clamp(a, 0.0d, 1.0d);
        double c = 2.0d * Math.asin(Math.sqrt(clampedA));
        return EARTH_MEAN_RADIUS_KM * c;
    }

    /**
     * Computes the flat degree-scaled approximation used for small city networks.
     */
    static double equirectangularDistanceKm(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double latKm = (lat2Deg - lat1Deg) * KM_PER_DEGREE_LAT;
        double lonKm = normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg) * KM_PER_DEGREE_LAT * LONGITUDE_SCALE;
        return Math.hypot(latKm, lonKm);
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
