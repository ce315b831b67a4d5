package space.ketterling.imputer.geo;

import space.ketterling.imputer.model.StationMetadata;

/**
 * Station-to-station distance combining great-circle ground distance with the
 * altitude difference.
 */
public final class GeoDistance {
    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistance() {
    }

    /**
     * Great-circle distance between two lat/lon points in kilometers.
     */
    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        return 2 * Math.asin(Math.sqrt(Math.min(1.0, a))) * EARTH_RADIUS_KM;
    }

    /**
     * Vertical separation in kilometers; 0 when either altitude is unknown.
     */
    public static double verticalKm(Double altA, Double altB) {
        if (altA == null || altB == null || altA.isNaN() || altB.isNaN())
            return 0.0;
        return Math.abs(altA - altB) / 1000.0;
    }

    /**
     * 3D distance: sqrt(horizontal^2 + vertical^2).
     */
    public static double distanceKm(StationMetadata a, StationMetadata b) {
        double dxy = haversineKm(a.latitude(), a.longitude(), b.latitude(), b.longitude());
        double dz = verticalKm(a.altitude(), b.altitude());
        return Math.hypot(dxy, dz);
    }

    /**
     * Rounds to the 4 decimal places the neighbor cache stores.
     */
    public static double round4(double km) {
        return Math.round(km * 10_000.0) / 10_000.0;
    }
}
