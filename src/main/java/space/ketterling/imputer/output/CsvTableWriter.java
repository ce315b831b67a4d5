package space.ketterling.imputer.output;

import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.imputer.model.FeatureSchema;
import space.ketterling.imputer.model.FlatObservation;
import space.ketterling.imputer.model.StationMetadata;

/**
 * Writes the flattened and imputed tables as CSV. Missing values are empty
 * fields.
 */
public final class CsvTableWriter {
    private static final Logger log = LoggerFactory.getLogger(CsvTableWriter.class);

    private CsvTableWriter() {
    }

    public static List<String> flatHeader() {
        List<String> h = new ArrayList<>();
        h.add("StationID");
        h.add("DataTime");
        h.addAll(FeatureSchema.columns());
        return h;
    }

    public static List<String> imputedHeader() {
        List<String> h = flatHeader();
        h.add("Longitude");
        h.add("Latitude");
        h.add("Altitude");
        return h;
    }

    /**
     * {@code StationID,DataTime,<features...>}
     */
    public static void writeFlat(Path file, List<FlatObservation> rows) throws IOException {
        try (BufferedWriter w = open(file)) {
            writeLine(w, flatHeader());
            List<String> cols = new ArrayList<>(FeatureSchema.size() + 2);
            for (FlatObservation r : rows) {
                cols.clear();
                appendObservation(cols, r);
                writeLine(w, cols);
            }
        }
        log.info("Wrote {} rows to {}", rows.size(), file);
    }

    /**
     * {@code StationID,DataTime,<features...>,Longitude,Latitude,Altitude}
     */
    public static void writeImputed(Path file, List<ImputedRow> rows) throws IOException {
        try (BufferedWriter w = open(file)) {
            writeLine(w, imputedHeader());
            List<String> cols = new ArrayList<>(FeatureSchema.size() + 5);
            for (ImputedRow r : rows) {
                cols.clear();
                appendObservation(cols, r.observation());
                StationMetadata m = r.station();
                cols.add(m == null ? "" : format(m.longitude()));
                cols.add(m == null ? "" : format(m.latitude()));
                cols.add(m == null ? "" : format(m.altitude()));
                writeLine(w, cols);
            }
        }
        log.info("Wrote {} rows to {}", rows.size(), file);
    }

    private static BufferedWriter open(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        return Files.newBufferedWriter(file, StandardCharsets.UTF_8);
    }

    private static void appendObservation(List<String> cols, FlatObservation r) {
        cols.add(r.stationId());
        cols.add(r.timestamp());
        for (Double v : r.values())
            cols.add(format(v));
    }

    static String format(Double v) {
        if (v == null)
            return "";
        return BigDecimal.valueOf(v).toPlainString();
    }

    private static void writeLine(BufferedWriter w, List<String> cols) throws IOException {
        for (int i = 0; i < cols.size(); i++) {
            if (i > 0)
                w.write(',');
            w.write(escape(cols.get(i)));
        }
        w.write('\n');
    }

    /**
     * Quotes a field containing a comma, quote or line break.
     */
    private static String escape(String s) {
        if (s.indexOf(',') < 0 && s.indexOf('"') < 0 && s.indexOf('\n') < 0 && s.indexOf('\r') < 0)
            return s;
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }
}
