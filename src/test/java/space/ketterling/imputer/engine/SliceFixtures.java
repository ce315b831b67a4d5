package space.ketterling.imputer.engine;

import space.ketterling.imputer.geo.NeighborGraph;
import space.ketterling.imputer.model.FeatureSchema;
import space.ketterling.imputer.model.FlatObservation;
import space.ketterling.imputer.model.NeighborEntry;
import space.ketterling.imputer.model.TimeSlice;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small builders for slices and graphs used across engine tests.
 */
final class SliceFixtures {
    static final String TEMP = "AirTemperature_Instantaneous";
    static final int TEMP_COL = FeatureSchema.indexOf(TEMP);

    private SliceFixtures() {
    }

    /**
     * A row with only the temperature column set (null means missing).
     */
    static FlatObservation temp(String station, String ts, Double value) {
        Double[] v = new Double[FeatureSchema.size()];
        v[TEMP_COL] = value;
        return FlatObservation.of(station, ts, v);
    }

    static TimeSlice slice(String ts, FlatObservation... rows) {
        List<FlatObservation> sorted = new ArrayList<>(List.of(rows));
        sorted.sort((a, b) -> a.stationId().compareTo(b.stationId()));
        return new TimeSlice(ts, sorted);
    }

    /**
     * Graph from "station -> (neighbor, km)..." pairs, in the order given.
     */
    static GraphBuilder graph() {
        return new GraphBuilder();
    }

    static final class GraphBuilder {
        private final Map<String, List<NeighborEntry>> map = new LinkedHashMap<>();

        GraphBuilder station(String id, Object... neighborAndKm) {
            List<NeighborEntry> list = new ArrayList<>();
            for (int i = 0; i < neighborAndKm.length; i += 2) {
                list.add(new NeighborEntry((String) neighborAndKm[i], ((Number) neighborAndKm[i + 1]).doubleValue()));
            }
            map.put(id, list);
            return this;
        }

        NeighborGraph build() {
            return new NeighborGraph(map);
        }
    }
}
