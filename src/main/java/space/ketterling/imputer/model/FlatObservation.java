package space.ketterling.imputer.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One flattened row: a station's readings at one timestamp across the full
 * {@link FeatureSchema}. A {@code null} value means missing.
 */
public record FlatObservation(String stationId, String timestamp, List<Double> values) {

    public FlatObservation {
        if (values.size() != FeatureSchema.size()) {
            throw new IllegalArgumentException("Expected " + FeatureSchema.size() + " values, got " + values.size());
        }
        // nulls are allowed, so List.copyOf is not an option here
        values = Collections.unmodifiableList(Arrays.asList(values.toArray(new Double[0])));
    }

    public static FlatObservation of(String stationId, String timestamp, Double[] values) {
        return new FlatObservation(stationId, timestamp, Arrays.asList(values));
    }

    public Double value(int column) {
        return values.get(column);
    }

    public Double value(String feature) {
        int i = FeatureSchema.indexOf(feature);
        if (i < 0)
            throw new IllegalArgumentException("Unknown feature: " + feature);
        return values.get(i);
    }
}
