package space.ketterling.imputer.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.imputer.model.FeatureSchema;
import space.ketterling.imputer.model.FlatObservation;
import space.ketterling.imputer.model.TimeSlice;

/**
 * Groups flat rows into one {@link TimeSlice} per timestamp.
 */
public final class TimeSlicePartitioner {
    private static final Logger log = LoggerFactory.getLogger(TimeSlicePartitioner.class);

    private TimeSlicePartitioner() {
    }

    /**
     * Returns slices in ascending timestamp order, rows in ascending station
     * order. Repeated (station, timestamp) rows are merged; the first non-missing
     * value of each feature wins.
     */
    public static List<TimeSlice> partition(List<FlatObservation> rows) {
        Map<String, Map<String, Double[]>> byTime = new TreeMap<>();
        int merged = 0;
        for (FlatObservation r : rows) {
            Map<String, Double[]> stations = byTime.computeIfAbsent(r.timestamp(), k -> new TreeMap<>());
            Double[] existing = stations.get(r.stationId());
            if (existing == null) {
                stations.put(r.stationId(), r.values().toArray(new Double[0]));
                continue;
            }
            merged++;
            for (int c = 0; c < FeatureSchema.size(); c++) {
                if (existing[c] == null)
                    existing[c] = r.value(c);
            }
        }
        if (merged > 0)
            log.warn("Merged {} repeated station/timestamp rows", merged);

        List<TimeSlice> out = new ArrayList<>(byTime.size());
        for (var t : byTime.entrySet()) {
            List<FlatObservation> sliceRows = new ArrayList<>(t.getValue().size());
            for (var s : t.getValue().entrySet()) {
                sliceRows.add(FlatObservation.of(s.getKey(), t.getKey(), s.getValue()));
            }
            out.add(new TimeSlice(t.getKey(), sliceRows));
        }
        log.info("Partitioned {} rows into {} time slices", rows.size(), out.size());
        return out;
    }
}
