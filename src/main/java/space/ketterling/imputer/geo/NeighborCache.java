package space.ketterling.imputer.geo;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import space.ketterling.imputer.model.NeighborEntry;
import space.ketterling.imputer.model.StationMetadata;

/**
 * Persists the neighbor graph as JSON, keyed by a hash of its inputs.
 *
 * <p>
 * The cache file maps each station to {@code [{"station": id, "distance_km": d}, ...]}.
 * A sidecar {@code <cache>.sha256} holds a SHA-256 over every station's ID,
 * longitude, latitude and altitude; the cache is reused only when that hash
 * still matches, so moved or re-surveyed stations force a rebuild.
 * </p>
 */
public class NeighborCache {
    private static final Logger log = LoggerFactory.getLogger(NeighborCache.class);

    private final ObjectMapper om;
    private final Path cacheFile;
    private final Path hashFile;

    public NeighborCache(ObjectMapper om, Path cacheFile) {
        this.om = om;
        this.cacheFile = cacheFile;
        this.hashFile = cacheFile.resolveSibling(cacheFile.getFileName() + ".sha256");
    }

    public Path cacheFile() {
        return cacheFile;
    }

    public Path hashFile() {
        return hashFile;
    }

    /**
     * Returns the cached graph if it was built from identical inputs, otherwise
     * builds, persists and returns a fresh one.
     */
    public NeighborGraph loadOrBuild(SortedMap<String, StationMetadata> stations) throws IOException {
        String hash = inputHash(stations);
        NeighborGraph cached = readIfFresh(hash, stations);
        if (cached != null) {
            log.info("Reusing neighbor cache {} ({} stations)", cacheFile, cached.size());
            return cached;
        }
        NeighborGraph graph = NeighborGraphBuilder.build(stations);
        write(graph, hash);
        return graph;
    }

    /**
     * Writes the graph and its input hash. Station keys are written in the graph's
     * order, so identical inputs produce identical bytes.
     */
    public void write(NeighborGraph graph, String hash) throws IOException {
        ObjectNode root = om.createObjectNode();
        for (var e : graph.asMap().entrySet()) {
            ArrayNode arr = root.putArray(e.getKey());
            for (NeighborEntry n : e.getValue()) {
                ObjectNode o = arr.addObject();
                o.put("station", n.stationId());
                o.put("distance_km", n.distanceKm());
            }
        }

        Path parent = cacheFile.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        Path tmp = cacheFile.resolveSibling(cacheFile.getFileName() + ".tmp");
        om.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), root);
        Files.move(tmp, cacheFile, StandardCopyOption.REPLACE_EXISTING);
        Files.writeString(hashFile, hash + "\n", StandardCharsets.UTF_8);
        log.info("Wrote neighbor cache {} ({} stations)", cacheFile, graph.size());
    }

    /**
     * Reads the cache file without any freshness check.
     */
    public NeighborGraph read() throws IOException {
        JsonNode root = om.readTree(cacheFile.toFile());
        Map<String, List<NeighborEntry>> out = new LinkedHashMap<>();
        var it = root.fields();
        while (it.hasNext()) {
            var e = it.next();
            List<NeighborEntry> list = new ArrayList<>();
            for (JsonNode n : e.getValue()) {
                list.add(new NeighborEntry(n.path("station").asText(), n.path("distance_km").asDouble()));
            }
            out.put(e.getKey(), list);
        }
        return new NeighborGraph(out);
    }

    private NeighborGraph readIfFresh(String hash, SortedMap<String, StationMetadata> stations) throws IOException {
        if (!Files.isRegularFile(cacheFile) || !Files.isRegularFile(hashFile)) {
            log.debug("No neighbor cache at {}", cacheFile);
            return null;
        }
        String stored = Files.readString(hashFile, StandardCharsets.UTF_8).trim();
        if (!stored.equals(hash)) {
            log.info("Neighbor cache {} is stale (input hash changed); rebuilding", cacheFile);
            return null;
        }
        NeighborGraph graph;
        try {
            graph = read();
        } catch (JsonProcessingException e) {
            log.warn("Neighbor cache {} is not valid JSON ({}); rebuilding", cacheFile, e.getOriginalMessage());
            return null;
        }
        if (!graph.stations().equals(stations.keySet())) {
            log.warn("Neighbor cache {} does not cover the current station set; rebuilding", cacheFile);
            return null;
        }
        for (String sid : graph.stations()) {
            if (graph.neighborsOf(sid).size() != stations.size() - 1) {
                log.warn("Neighbor cache {} has an incomplete list for {}; rebuilding", cacheFile, sid);
                return null;
            }
        }
        return graph;
    }

    /**
     * SHA-256 over station IDs and coordinates, in station order.
     */
    public static String inputHash(SortedMap<String, StationMetadata> stations) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        for (StationMetadata m : stations.values()) {
            String line = m.stationId() + "|" + m.longitude() + "|" + m.latitude() + "|" + m.altitude() + "\n";
            md.update(line.getBytes(StandardCharsets.UTF_8));
        }
        return HexFormat.of().formatHex(md.digest());
    }
}
