package space.ketterling.imputer.model;

/**
 * A neighbor station and its 3D distance in kilometers.
 */
public record NeighborEntry(String stationId, double distanceKm) {
}
