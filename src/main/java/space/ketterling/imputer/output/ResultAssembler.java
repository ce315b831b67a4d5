package space.ketterling.imputer.output;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import space.ketterling.imputer.model.FlatObservation;
import space.ketterling.imputer.model.StationMetadata;
import space.ketterling.imputer.model.TimeSlice;

/**
 * Folds imputed slices back into one table and left-joins station metadata.
 */
public final class ResultAssembler {
    private ResultAssembler() {
    }

    /**
     * Rows come out in slice order, then station order; each (station,
     * timestamp) of the input slices appears exactly once.
     */
    public static List<ImputedRow> assemble(List<TimeSlice> slices, Map<String, StationMetadata> stations) {
        int total = 0;
        for (TimeSlice s : slices)
            total += s.rowCount();

        List<ImputedRow> out = new ArrayList<>(total);
        for (TimeSlice s : slices) {
            for (FlatObservation row : s.toRows()) {
                out.add(new ImputedRow(row, stations.get(row.stationId())));
            }
        }
        return out;
    }
}
