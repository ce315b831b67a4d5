package space.ketterling.imputer.geo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import space.ketterling.imputer.model.NeighborEntry;

/**
 * Immutable per-station neighbor lists, each ascending by distance.
 */
public final class NeighborGraph {
    private final Map<String, List<NeighborEntry>> neighbors;

    public NeighborGraph(Map<String, List<NeighborEntry>> neighbors) {
        Map<String, List<NeighborEntry>> copy = new LinkedHashMap<>();
        for (var e : neighbors.entrySet()) {
            copy.put(e.getKey(), List.copyOf(e.getValue()));
        }
        this.neighbors = Collections.unmodifiableMap(copy);
    }

    /**
     * Neighbors of a station nearest first; empty if the station is unknown.
     */
    public List<NeighborEntry> neighborsOf(String stationId) {
        return neighbors.getOrDefault(stationId, List.of());
    }

    public Set<String> stations() {
        return neighbors.keySet();
    }

    public Map<String, List<NeighborEntry>> asMap() {
        return neighbors;
    }

    public int size() {
        return neighbors.size();
    }
}
