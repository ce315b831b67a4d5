package space.ketterling.imputer.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.imputer.geo.NeighborGraph;
import space.ketterling.imputer.model.FeatureSchema;
import space.ketterling.imputer.model.ImputationLogEntry;
import space.ketterling.imputer.model.ImputationLogEntry.Reason;
import space.ketterling.imputer.model.NeighborEntry;
import space.ketterling.imputer.model.TimeSlice;

/**
 * Fills the missing cells of one time slice from the nearest stations that
 * reported the same feature at the same instant.
 *
 * <p>
 * For each missing cell the station's neighbors are scanned nearest first; a
 * neighbor counts once it has a row in the slice and an observed value. The
 * scan stops at {@code quorum} candidates. Estimates only ever use values that
 * were observed when the slice arrived; they are written after the whole slice
 * has been scanned. Instances are stateless and shared by all workers.
 * </p>
 */
public class SliceImputer {
    private static final Logger log = LoggerFactory.getLogger(SliceImputer.class);

    private final NeighborGraph graph;
    private final int quorum;
    private final IdwEstimator estimator;

    public SliceImputer(NeighborGraph graph, int quorum, IdwEstimator estimator) {
        if (quorum < 1)
            throw new IllegalArgumentException("quorum must be >= 1");
        this.graph = graph;
        this.quorum = quorum;
        this.estimator = estimator;
    }

    public SliceResult impute(TimeSlice slice) {
        String worker = Thread.currentThread().getName();
        int cols = FeatureSchema.size();
        List<String> features = FeatureSchema.columns();

        List<double[]> pending = new ArrayList<>(); // {row, col, estimate}
        List<ImputationLogEntry> unfilled = new ArrayList<>();
        double[] values = new double[quorum];
        double[] dists = new double[quorum];

        for (int row = 0; row < slice.rowCount(); row++) {
            String station = slice.stations().get(row);
            List<NeighborEntry> neighbors = graph.neighborsOf(station);

            for (int col = 0; col < cols; col++) {
                if (slice.value(row, col) != null)
                    continue;

                int found = 0;
                for (NeighborEntry n : neighbors) {
                    Double v = slice.value(n.stationId(), col);
                    if (v == null)
                        continue;
                    values[found] = v;
                    dists[found] = n.distanceKm();
                    if (++found >= quorum)
                        break;
                }

                if (found < quorum) {
                    unfilled.add(new ImputationLogEntry(slice.timestamp(), worker, station, features.get(col),
                            Reason.INSUFFICIENT_NEIGHBORS, quorum));
                    continue;
                }
                OptionalDouble est = estimator.estimate(values, dists, found);
                if (est.isEmpty()) {
                    unfilled.add(new ImputationLogEntry(slice.timestamp(), worker, station, features.get(col),
                            Reason.DEGENERATE_WEIGHTS, quorum));
                    continue;
                }
                pending.add(new double[] { row, col, est.getAsDouble() });
            }
        }

        for (double[] p : pending) {
            slice.fill((int) p[0], (int) p[1], p[2]);
        }
        log.debug("Slice {}: filled={} unfilled={}", slice.timestamp(), pending.size(), unfilled.size());
        return new SliceResult(slice, pending.size(), unfilled);
    }

    public int quorum() {
        return quorum;
    }
}
