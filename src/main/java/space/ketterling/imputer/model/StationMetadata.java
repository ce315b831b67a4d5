package space.ketterling.imputer.model;

/**
 * Location of a station. Altitude is in meters and may be null when the catalog
 * does not report it.
 */
public record StationMetadata(String stationId, String category, double longitude, double latitude,
        Double altitude) {
}
