package space.ketterling.imputer.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import space.ketterling.imputer.MalformedRecordException;
import space.ketterling.imputer.model.FeatureSchema;
import space.ketterling.imputer.model.FlatObservation;

/**
 * Walks raw per-station-per-day documents into flat rows over the fixed
 * {@link FeatureSchema}.
 */
public class ObservationFlattener {
    private static final Logger log = LoggerFactory.getLogger(ObservationFlattener.class);

    private final ObjectMapper om;

    public ObservationFlattener(ObjectMapper om) {
        this.om = om;
    }

    /**
     * Result of one flatten pass.
     *
     * @param rows      flattened observations in station, file, entry order
     * @param documents documents read
     * @param malformed documents skipped as malformed
     */
    public record Result(List<FlatObservation> rows, int documents, int malformed) {
    }

    /**
     * Flattens every document the source holds for the given stations. Malformed
     * documents are logged and skipped; I/O failures of the source propagate.
     */
    public Result flatten(SortedSet<String> stationIds, RawObservationSource source) throws IOException {
        List<FlatObservation> rows = new ArrayList<>();
        int[] counts = new int[2];
        source.forEach(stationIds, doc -> {
            counts[0]++;
            try {
                rows.addAll(parse(doc));
            } catch (MalformedRecordException e) {
                counts[1]++;
                log.warn("Skipping malformed record {}", e.getMessage());
            }
        });
        log.info("Flattened {} documents into {} rows (malformed skipped={})", counts[0], rows.size(), counts[1]);
        return new Result(rows, counts[0], counts[1]);
    }

    /**
     * Parses one document into rows.
     *
     * @throws MalformedRecordException if the document is not JSON or matches no
     *                                  known shape
     */
    public List<FlatObservation> parse(RawDocument doc) {
        JsonNode root;
        try {
            root = om.readTree(doc.content());
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException(doc.name(), "unparseable JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedRecordException(doc.name(), "unreadable: " + e.getMessage(), e);
        }

        List<JsonNode> items = items(doc, root);
        List<FlatObservation> out = new ArrayList<>();
        int untimed = 0;
        for (JsonNode item : items) {
            if (!item.isObject())
                throw new MalformedRecordException(doc.name(), "entry is not an object");
            JsonNode dts = item.get("dts");
            if (dts == null || dts.isNull() || dts.isEmpty())
                dts = item.path("data");
            if (dts.isMissingNode() || dts.isNull())
                continue;
            if (!dts.isArray())
                throw new MalformedRecordException(doc.name(), "timestamped entries are not a list");

            for (JsonNode entry : dts) {
                if (!entry.isObject())
                    throw new MalformedRecordException(doc.name(), "timestamped entry is not an object");
                String ts = entry.path("DataTime").asText(null);
                if (ts == null || ts.isBlank()) {
                    untimed++;
                    continue;
                }
                out.add(toObservation(doc.stationId(), ts, entry));
            }
        }
        if (untimed > 0)
            log.debug("{}: skipped {} entries without DataTime", doc.name(), untimed);
        return out;
    }

    private static List<JsonNode> items(RawDocument doc, JsonNode root) {
        RawShape shape = RawShape.detect(root);
        if (shape == null)
            throw new MalformedRecordException(doc.name(), "unrecognized top-level shape");

        List<JsonNode> items = new ArrayList<>();
        switch (shape) {
            case WRAPPED -> {
                JsonNode data = root.get("data");
                if (!data.isArray())
                    throw new MalformedRecordException(doc.name(), "'data' is not a list");
                data.forEach(items::add);
            }
            case BARE_LIST -> root.forEach(items::add);
            case SINGLE_ENTRY -> items.add(root);
        }
        return items;
    }

    private static FlatObservation toObservation(String stationId, String ts, JsonNode entry) {
        Double[] values = new Double[FeatureSchema.size()];
        int i = 0;
        for (Map.Entry<String, List<String>> g : FeatureSchema.groups().entrySet()) {
            JsonNode grp = entry.get(g.getKey());
            for (String sub : g.getValue()) {
                values[i++] = (grp != null && grp.isObject()) ? SentinelNormalizer.normalize(grp.get(sub)) : null;
            }
        }
        return FlatObservation.of(stationId, ts, values);
    }
}
