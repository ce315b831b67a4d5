package space.ketterling.imputer.engine;

import java.util.List;

import space.ketterling.imputer.model.ImputationLogEntry;
import space.ketterling.imputer.model.TimeSlice;

/**
 * Everything a parallel run produced.
 *
 * @param slices     every input slice in input order, imputed where its worker
 *                   succeeded and untouched where it failed
 * @param results    successful slice results in input order
 * @param failures   failed slices in input order
 * @param logEntries unfilled cells of all successful slices, merged in slice
 *                   order
 */
public record ImputationOutcome(List<TimeSlice> slices, List<SliceResult> results, List<SliceFailure> failures,
        List<ImputationLogEntry> logEntries) {

    public ImputationOutcome {
        slices = List.copyOf(slices);
        results = List.copyOf(results);
        failures = List.copyOf(failures);
        logEntries = List.copyOf(logEntries);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public long filledCells() {
        long n = 0;
        for (SliceResult r : results)
            n += r.filled();
        return n;
    }

    public long unfilledCells() {
        return logEntries.size();
    }
}
