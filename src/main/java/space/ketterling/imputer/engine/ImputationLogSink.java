package space.ketterling.imputer.engine;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import space.ketterling.imputer.model.ImputationLogEntry;

/**
 * Append-only, line-oriented file of unfilled cells.
 *
 * <p>
 * All writes go through this one instance and are serialized, so lines from
 * different batches never interleave.
 * </p>
 */
public class ImputationLogSink {
    private final Path file;

    public ImputationLogSink(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    /**
     * Creates the file (and its directory) empty, discarding any previous run.
     */
    public synchronized void truncate() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        Files.write(file, new byte[0]);
    }

    public synchronized void append(List<ImputationLogEntry> entries) throws IOException {
        if (entries.isEmpty())
            return;
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
                StandardOpenOption.APPEND)) {
            for (ImputationLogEntry e : entries) {
                w.write(e.toLine());
                w.write('\n');
            }
        }
    }
}
