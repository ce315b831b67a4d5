package space.ketterling.imputer.engine;

import org.junit.jupiter.api.Test;
import space.ketterling.imputer.geo.NeighborGraph;
import space.ketterling.imputer.model.FeatureSchema;
import space.ketterling.imputer.model.ImputationLogEntry;
import space.ketterling.imputer.model.TimeSlice;

import static org.junit.jupiter.api.Assertions.*;
import static space.ketterling.imputer.engine.SliceFixtures.*;

class SliceImputerTest {

    private static final String T = "2024-05-01T01:00:00+08:00";

    // M's neighbors: A at 10 km, B at 20 km, C at 30 km, D at 40 km
    private static NeighborGraph graph() {
        return SliceFixtures.graph()
                .station("M", "A", 10, "B", 20, "C", 30, "D", 40)
                .station("A", "M", 10, "B", 15, "C", 25, "D", 35)
                .station("B", "A", 15, "M", 20, "C", 22, "D", 33)
                .station("C", "B", 22, "A", 25, "M", 30, "D", 31)
                .station("D", "C", 31, "B", 33, "A", 35, "M", 40)
                .build();
    }

    private static SliceImputer imputer(int quorum) {
        return new SliceImputer(graph(), quorum, new IdwEstimator(2, ZeroDistancePolicy.EXCLUDE));
    }

    @Test
    void twoCandidatesBelowQuorumOfThreeLeavesCellMissingAndLogged() {
        TimeSlice s = slice(T, temp("M", T, null), temp("A", T, 5.0), temp("B", T, 7.0), temp("C", T, null));
        SliceResult r = imputer(3).impute(s);

        assertNull(s.value("M", TEMP_COL));
        ImputationLogEntry e = r.unfilled().stream().filter(x -> x.stationId().equals("M")
                && x.feature().equals(TEMP)).findFirst().orElseThrow();
        assertEquals(T, e.timestamp());
        assertEquals(ImputationLogEntry.Reason.INSUFFICIENT_NEIGHBORS, e.reason());
        assertEquals(1, r.unfilled().stream().filter(x -> x.stationId().equals("M") && x.feature().equals(TEMP))
                .count());
    }

    @Test
    void quorumOfTwoFillsFromNearestObservedNeighbors() {
        TimeSlice s = slice(T, temp("M", T, null), temp("A", T, 5.0), temp("B", T, 7.0), temp("C", T, null));
        SliceResult r = imputer(2).impute(s);

        assertEquals(5.4, s.value("M", TEMP_COL), 1e-12);
        int row = s.stations().indexOf("M");
        assertTrue(s.isImputed(row, TEMP_COL));
        assertTrue(r.unfilled().stream().noneMatch(x -> x.stationId().equals("M") && x.feature().equals(TEMP)));
    }

    @Test
    void scanSkipsMissingAndAbsentNeighborsAndStopsAtQuorum() {
        // B is missing, C has no row at all; quorum 2 is met by A and D
        TimeSlice s = slice(T, temp("M", T, null), temp("A", T, 10.0), temp("B", T, null), temp("D", T, 20.0));
        imputer(2).impute(s);
        double wA = 1 / 100.0, wD = 1 / 1600.0;
        assertEquals((10.0 * wA + 20.0 * wD) / (wA + wD), s.value("M", TEMP_COL), 1e-12);
    }

    @Test
    void cellFilledIffQuorumObserved() {
        TimeSlice full = slice(T, temp("M", T, null), temp("A", T, 1.0), temp("B", T, 2.0), temp("C", T, 3.0));
        imputer(3).impute(full);
        assertNotNull(full.value("M", TEMP_COL));

        TimeSlice sparse = slice(T, temp("M", T, null), temp("A", T, 1.0), temp("B", T, 2.0));
        imputer(3).impute(sparse);
        assertNull(sparse.value("M", TEMP_COL));
    }

    @Test
    void everyMissingCellIsFilledOrLoggedExactlyOnce() {
        TimeSlice s = slice(T, temp("M", T, null), temp("A", T, 5.0), temp("B", T, 7.0));
        int missingBefore = 0;
        for (int row = 0; row < s.rowCount(); row++)
            for (int c = 0; c < FeatureSchema.size(); c++)
                if (s.value(row, c) == null)
                    missingBefore++;

        SliceResult r = imputer(2).impute(s);
        assertEquals(missingBefore, r.filled() + r.unfilled().size());
        assertEquals(r.filled(), s.imputedCount());
        // only temperature has data anywhere, so every other column is logged for every station
        assertEquals((FeatureSchema.size() - 1) * 3, r.unfilled().size());
    }

    @Test
    void estimatesUseOnlyObservedValues() {
        // F is scanned before G; G's nearest neighbor is F, which must not count once F is estimated
        SliceImputer one = new SliceImputer(SliceFixtures.graph()
                .station("A", "F", 10, "G", 60, "Z", 60)
                .station("F", "A", 10, "G", 1, "Z", 50)
                .station("G", "F", 1, "Z", 50, "A", 60)
                .station("Z", "G", 50, "F", 50, "A", 60)
                .build(), 1, new IdwEstimator(2, ZeroDistancePolicy.EXCLUDE));
        TimeSlice s = slice(T, temp("A", T, 4.0), temp("F", T, null), temp("G", T, null), temp("Z", T, 10.0));
        one.impute(s);
        assertEquals(4.0, s.value("F", TEMP_COL), 1e-12);
        assertEquals(10.0, s.value("G", TEMP_COL), 1e-12, "G takes Z, its nearest observed neighbor");
    }

    @Test
    void degenerateWeightsAreLoggedNotNaN() {
        SliceImputer colocated = new SliceImputer(SliceFixtures.graph()
                .station("M", "A", 0, "B", 0)
                .station("A", "M", 0, "B", 0)
                .station("B", "M", 0, "A", 0)
                .build(), 2, new IdwEstimator(2, ZeroDistancePolicy.EXCLUDE));
        TimeSlice s = slice(T, temp("M", T, null), temp("A", T, 4.0), temp("B", T, 6.0));
        SliceResult r = colocated.impute(s);

        assertNull(s.value("M", TEMP_COL));
        assertTrue(r.unfilled().stream().anyMatch(e -> e.stationId().equals("M") && e.feature().equals(TEMP)
                && e.reason() == ImputationLogEntry.Reason.DEGENERATE_WEIGHTS));
    }

    @Test
    void exactPolicyCopiesColocatedReading() {
        SliceImputer exact = new SliceImputer(SliceFixtures.graph()
                .station("M", "A", 0, "B", 10)
                .station("A", "M", 0, "B", 10)
                .station("B", "M", 10, "A", 10)
                .build(), 2, new IdwEstimator(2, ZeroDistancePolicy.EXACT));
        TimeSlice s = slice(T, temp("M", T, null), temp("A", T, 4.0), temp("B", T, 6.0));
        exact.impute(s);
        assertEquals(4.0, s.value("M", TEMP_COL), 1e-12);
    }

    @Test
    void logLineNamesWorkerStationFeatureAndReason() {
        TimeSlice s = slice(T, temp("M", T, null));
        SliceResult r = imputer(3).impute(s);
        ImputationLogEntry e = r.unfilled().stream().filter(x -> x.feature().equals(TEMP)).findFirst().orElseThrow();
        assertEquals(Thread.currentThread().getName(), e.worker());
        assertEquals("[" + T + "][" + e.worker() + "] M/" + TEMP + " insufficient-neighbors (nbr<3)", e.toLine());
    }
}
