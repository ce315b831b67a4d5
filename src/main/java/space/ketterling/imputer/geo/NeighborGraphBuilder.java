package space.ketterling.imputer.geo;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.imputer.model.NeighborEntry;
import space.ketterling.imputer.model.StationMetadata;

/**
 * Computes every station's distance-ordered list of all other stations.
 */
public final class NeighborGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(NeighborGraphBuilder.class);

    private NeighborGraphBuilder() {
    }

    /**
     * Builds the graph. Lists are sorted by exact distance, then station ID;
     * stored distances are rounded to 4 decimals.
     */
    public static NeighborGraph build(SortedMap<String, StationMetadata> stations) {
        List<StationMetadata> all = new ArrayList<>(stations.values());
        int n = all.size();

        // symmetric, so each pair is computed once
        double[][] dist = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = GeoDistance.distanceKm(all.get(i), all.get(j));
                dist[i][j] = d;
                dist[j][i] = d;
            }
        }

        Map<String, List<NeighborEntry>> out = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            final double[] row = dist[i];
            List<Integer> others = new ArrayList<>(n - 1);
            for (int j = 0; j < n; j++) {
                if (j != i)
                    others.add(j);
            }
            others.sort(Comparator.<Integer>comparingDouble(j -> row[j])
                    .thenComparing(j -> all.get(j).stationId()));

            List<NeighborEntry> list = new ArrayList<>(others.size());
            for (int j : others) {
                list.add(new NeighborEntry(all.get(j).stationId(), GeoDistance.round4(row[j])));
            }
            out.put(all.get(i).stationId(), list);
        }
        log.info("Built neighbor graph for {} stations", n);
        return new NeighborGraph(out);
    }
}
