package space.ketterling.imputer.ingest;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads raw observations bundled as a {@code .tar.gz} with the same
 * {@code <StationID>/<day>.json} layout as the on-disk tree.
 *
 * <p>
 * Any leading directories in entry names (e.g. {@code his_data/}) are ignored;
 * the station is the parent directory of the JSON file. Entries for stations not
 * in the requested set are skipped. Matching entries are buffered so they can be
 * handed out in station/name order regardless of archive order.
 * </p>
 */
public class TarGzObservationSource implements RawObservationSource {
    private static final Logger log = LoggerFactory.getLogger(TarGzObservationSource.class);

    private final Path archive;

    public TarGzObservationSource(Path archive) {
        this.archive = archive;
    }

    @Override
    public void forEach(SortedSet<String> stationIds, DocumentHandler handler) throws IOException {
        Map<String, Map<String, byte[]>> byStation = new TreeMap<>();
        int entries = 0;

        try (var fis = Files.newInputStream(archive);
                var bis = new BufferedInputStream(fis);
                var gis = new GzipCompressorInputStream(bis);
                var tis = new TarArchiveInputStream(gis)) {

            TarArchiveEntry entry;
            while ((entry = tis.getNextEntry()) != null) {
                if (entry.isDirectory())
                    continue;
                String entryName = entry.getName();
                if (entryName == null || !entryName.toLowerCase(Locale.ROOT).endsWith(".json"))
                    continue;

                Path entryPath = Path.of(entryName);
                Path parent = entryPath.getParent();
                if (parent == null) {
                    log.debug("Skipping archive entry {}: not under a station directory", entryName);
                    continue;
                }
                String sid = parent.getFileName().toString();
                if (!stationIds.contains(sid))
                    continue;

                byStation.computeIfAbsent(sid, k -> new TreeMap<>()).put(entryName, tis.readAllBytes());
                entries++;
            }
        }

        log.info("Read {} raw documents for {} stations from {}", entries, byStation.size(), archive);
        for (var st : byStation.entrySet()) {
            for (var doc : st.getValue().entrySet()) {
                handler.handle(new RawDocument(st.getKey(), doc.getKey(), doc.getValue()));
            }
        }
    }
}
