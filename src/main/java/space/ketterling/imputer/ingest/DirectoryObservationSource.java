package space.ketterling.imputer.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.SortedSet;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@code <root>/<StationID>/*.json}.
 */
public class DirectoryObservationSource implements RawObservationSource {
    private static final Logger log = LoggerFactory.getLogger(DirectoryObservationSource.class);

    private final Path root;

    public DirectoryObservationSource(Path root) {
        this.root = root;
    }

    @Override
    public void forEach(SortedSet<String> stationIds, DocumentHandler handler) throws IOException {
        for (String sid : stationIds) {
            Path stationDir = root.resolve(sid);
            if (!Files.isDirectory(stationDir)) {
                log.debug("No raw directory for station {}", sid);
                continue;
            }
            List<Path> files;
            try (Stream<Path> stream = Files.list(stationDir)) {
                files = stream
                        .filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json"))
                        .sorted()
                        .toList();
            }
            for (Path p : files) {
                handler.handle(new RawDocument(sid, root.relativize(p).toString(), Files.readAllBytes(p)));
            }
        }
    }
}
