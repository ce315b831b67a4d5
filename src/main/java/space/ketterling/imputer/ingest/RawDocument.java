package space.ketterling.imputer.ingest;

/**
 * One raw per-station-per-day file as read from a source.
 *
 * @param stationId station the file belongs to (taken from its directory)
 * @param name      file identity used in log messages
 * @param content   raw JSON bytes
 */
public record RawDocument(String stationId, String name, byte[] content) {
}
