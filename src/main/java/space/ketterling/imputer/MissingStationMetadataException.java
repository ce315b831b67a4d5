package space.ketterling.imputer;

import java.util.List;

/**
 * One or more valid stations cannot be placed in space. Neighbor graph
 * construction cannot proceed.
 */
public class MissingStationMetadataException extends ImputationException {
    private final List<String> stationIds;

    public MissingStationMetadataException(List<String> stationIds) {
        super("No usable catalog entry for " + stationIds.size() + " valid station(s): " + stationIds);
        this.stationIds = List.copyOf(stationIds);
    }

    public List<String> stationIds() {
        return stationIds;
    }
}
