package space.ketterling.imputer.engine;

import java.util.List;

import space.ketterling.imputer.model.ImputationLogEntry;
import space.ketterling.imputer.model.TimeSlice;

/**
 * A slice after imputation, with the cells its worker could not fill.
 */
public record SliceResult(TimeSlice slice, int filled, List<ImputationLogEntry> unfilled) {
    public SliceResult {
        unfilled = List.copyOf(unfilled);
    }
}
