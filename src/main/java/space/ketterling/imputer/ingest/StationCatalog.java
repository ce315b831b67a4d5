package space.ketterling.imputer.ingest;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import space.ketterling.imputer.MissingStationMetadataException;
import space.ketterling.imputer.model.StationMetadata;

/**
 * Resolves valid station IDs to coordinates from the station list document.
 *
 * <p>
 * The document groups stations by {@code stationAttribute}:
 * {@code {"data":[{"stationAttribute":"cwb","item":[{"stationID":...,"longitude":...,
 * "latitude":...,"altitude":...,"stationEndDate":""}]}]}}. A non-empty
 * {@code stationEndDate} marks a retired station.
 * </p>
 */
public class StationCatalog {
    private static final Logger log = LoggerFactory.getLogger(StationCatalog.class);

    private final ObjectMapper om;

    public StationCatalog(ObjectMapper om) {
        this.om = om;
    }

    /**
     * Reads the valid station list: one ID per line, trimmed, blanks ignored.
     */
    public static SortedSet<String> readValidStations(Path file) throws IOException {
        SortedSet<String> out = new TreeSet<>();
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                String id = line.strip();
                if (!id.isEmpty())
                    out.add(id);
            }
        }
        log.info("Loaded {} valid station IDs from {}", out.size(), file);
        return Collections.unmodifiableSortedSet(out);
    }

    public SortedMap<String, StationMetadata> load(Path catalog, Set<String> validStations) throws IOException {
        return resolve(om.readTree(catalog.toFile()), validStations);
    }

    /**
     * Builds the station to metadata mapping for active valid stations.
     *
     * @throws MissingStationMetadataException if any valid station is not covered
     *                                         or lacks coordinates
     */
    public SortedMap<String, StationMetadata> resolve(JsonNode root, Set<String> validStations) {
        SortedMap<String, StationMetadata> out = new TreeMap<>();
        List<String> unplaced = new ArrayList<>();
        int retired = 0;

        for (JsonNode grp : root.path("data")) {
            String category = grp.path("stationAttribute").asText(null);
            for (JsonNode item : grp.path("item")) {
                String sid = item.path("stationID").asText(null);
                if (sid == null || !validStations.contains(sid))
                    continue;
                String endDate = item.path("stationEndDate").asText("");
                if (!endDate.isBlank()) {
                    retired++;
                    continue;
                }
                if (out.containsKey(sid)) {
                    log.debug("Duplicate catalog entry for {} in group {}; keeping the first", sid, category);
                    continue;
                }
                Double lon = number(item.get("longitude"));
                Double lat = number(item.get("latitude"));
                if (lon == null || lat == null) {
                    unplaced.add(sid);
                    continue;
                }
                out.put(sid, new StationMetadata(sid, category, lon, lat, number(item.get("altitude"))));
            }
        }

        List<String> missing = new ArrayList<>(unplaced);
        for (String sid : validStations) {
            if (!out.containsKey(sid) && !unplaced.contains(sid))
                missing.add(sid);
        }
        if (!missing.isEmpty()) {
            Collections.sort(missing);
            throw new MissingStationMetadataException(missing);
        }
        log.info("Resolved metadata for {} stations (retired entries ignored={})", out.size(), retired);
        return Collections.unmodifiableSortedMap(out);
    }

    private static Double number(JsonNode n) {
        if (n == null || n.isNull())
            return null;
        if (n.isNumber())
            return Double.isFinite(n.doubleValue()) ? n.doubleValue() : null;
        if (n.isTextual())
            return SentinelNormalizer.parseMaybeNumber(n.asText());
        return null;
    }
}
