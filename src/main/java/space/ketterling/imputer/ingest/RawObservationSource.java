package space.ketterling.imputer.ingest;

import java.io.IOException;
import java.util.SortedSet;

/**
 * Supplies raw observation documents for a set of stations.
 *
 * <p>
 * Implementations deliver documents grouped by station in ascending station
 * order and, within a station, in ascending file name order.
 * </p>
 */
public interface RawObservationSource {

    void forEach(SortedSet<String> stationIds, DocumentHandler handler) throws IOException;

    @FunctionalInterface
    interface DocumentHandler {
        void handle(RawDocument doc);
    }
}
