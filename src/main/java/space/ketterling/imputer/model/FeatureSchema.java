package space.ketterling.imputer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed schema of measurement groups and their sub-measurements.
 *
 * <p>
 * Every flattened row carries exactly these columns, in this order. A column is
 * named {@code <Group>_<Sub>}, e.g. {@code AirTemperature_Maximum}.
 * </p>
 */
public final class FeatureSchema {
    private static final Map<String, List<String>> GROUPS;
    private static final List<String> COLUMNS;
    private static final Map<String, Integer> INDEX;

    static {
        Map<String, List<String>> g = new LinkedHashMap<>();
        g.put("StationPressure", List.of("Instantaneous"));
        g.put("SeaLevelPressure", List.of("Instantaneous"));
        g.put("AirTemperature", List.of("Instantaneous", "Maximum", "Minimum"));
        g.put("DewPointTemperature", List.of("Instantaneous"));
        g.put("RelativeHumidity", List.of("Instantaneous"));
        g.put("WindSpeed", List.of("TenMinutelyMaximum", "Mean"));
        g.put("WindDirection", List.of("TenMinutelyMaximum", "Mean"));
        g.put("PeakGust", List.of("Direction", "Maximum"));
        g.put("Precipitation", List.of("Accumulation"));
        g.put("PrecipitationDuration", List.of("Total"));
        g.put("SunshineDuration", List.of("Total"));
        g.put("GlobalSolarRadiation", List.of("Accumulation"));
        g.put("Visibility", List.of("Instantaneous"));
        g.put("UVIndex", List.of("Accumulation"));
        g.put("TotalCloudAmount", List.of("Instantaneous"));
        for (int depth : new int[] { 0, 5, 10, 20, 30, 50, 100 }) {
            g.put("SoilTemperatureAt" + depth + "cm", List.of("Instantaneous"));
        }
        GROUPS = Collections.unmodifiableMap(g);

        List<String> cols = new ArrayList<>();
        Map<String, Integer> idx = new HashMap<>();
        for (var e : g.entrySet()) {
            for (String sub : e.getValue()) {
                String col = column(e.getKey(), sub);
                idx.put(col, cols.size());
                cols.add(col);
            }
        }
        COLUMNS = List.copyOf(cols);
        INDEX = Map.copyOf(idx);
    }

    private FeatureSchema() {
    }

    /**
     * Measurement groups in schema order, each with its sub-measurements.
     */
    public static Map<String, List<String>> groups() {
        return GROUPS;
    }

    /**
     * All feature column names in schema order.
     */
    public static List<String> columns() {
        return COLUMNS;
    }

    public static int size() {
        return COLUMNS.size();
    }

    /**
     * Returns the column position of a feature, or -1 if it is not in the schema.
     */
    public static int indexOf(String feature) {
        Integer i = INDEX.get(feature);
        return i == null ? -1 : i;
    }

    public static String column(String group, String sub) {
        return group + "_" + sub;
    }
}
