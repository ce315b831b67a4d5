package space.ketterling.imputer.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * All observations at one timestamp as a station x feature matrix.
 *
 * <p>
 * Rows are the stations that reported at this timestamp, in ascending order;
 * columns follow {@link FeatureSchema}. A slice is owned by exactly one worker
 * while it is being imputed and is not thread-safe.
 * </p>
 */
public final class TimeSlice {
    private final String timestamp;
    private final List<String> stations;
    private final Map<String, Integer> rowIndex;
    private final Double[][] cells;
    private final boolean[][] imputed;

    /**
     * Builds a slice from per-station rows. {@code rows} must be sorted by station
     * and contain each station at most once.
     */
    public TimeSlice(String timestamp, List<FlatObservation> rows) {
        this.timestamp = timestamp;
        int n = rows.size();
        String[] ids = new String[n];
        this.rowIndex = new HashMap<>(n * 2);
        this.cells = new Double[n][];
        this.imputed = new boolean[n][FeatureSchema.size()];
        for (int i = 0; i < n; i++) {
            FlatObservation r = rows.get(i);
            if (!timestamp.equals(r.timestamp()))
                throw new IllegalArgumentException("Row " + r.stationId() + " has timestamp " + r.timestamp()
                        + ", slice is " + timestamp);
            if (rowIndex.put(r.stationId(), i) != null)
                throw new IllegalArgumentException("Duplicate station " + r.stationId() + " at " + timestamp);
            ids[i] = r.stationId();
            cells[i] = r.values().toArray(new Double[0]);
        }
        this.stations = List.of(ids);
    }

    public String timestamp() {
        return timestamp;
    }

    public List<String> stations() {
        return stations;
    }

    public int rowCount() {
        return stations.size();
    }

    public boolean hasStation(String stationId) {
        return rowIndex.containsKey(stationId);
    }

    /**
     * Returns the cell value, or null if missing or if the station has no row.
     */
    public Double value(String stationId, int column) {
        Integer row = rowIndex.get(stationId);
        return row == null ? null : cells[row][column];
    }

    public Double value(int row, int column) {
        return cells[row][column];
    }

    /**
     * Writes an estimated value into a missing cell and marks it as imputed.
     */
    public void fill(int row, int column, double estimate) {
        if (cells[row][column] != null)
            throw new IllegalStateException("Cell " + stations.get(row) + "/" + FeatureSchema.columns().get(column)
                    + " at " + timestamp + " is already set");
        if (Double.isNaN(estimate) || Double.isInfinite(estimate))
            throw new IllegalArgumentException("Refusing non-finite estimate for " + stations.get(row) + " at "
                    + timestamp);
        cells[row][column] = estimate;
        imputed[row][column] = true;
    }

    public boolean isImputed(int row, int column) {
        return imputed[row][column];
    }

    /**
     * Number of cells filled by imputation.
     */
    public int imputedCount() {
        int c = 0;
        for (boolean[] row : imputed)
            for (boolean b : row)
                if (b)
                    c++;
        return c;
    }

    /**
     * Converts the slice back into flat rows, in station order.
     */
    public List<FlatObservation> toRows() {
        FlatObservation[] out = new FlatObservation[stations.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = FlatObservation.of(stations.get(i), timestamp, cells[i]);
        }
        return Collections.unmodifiableList(java.util.Arrays.asList(out));
    }
}
