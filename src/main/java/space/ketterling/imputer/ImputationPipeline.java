package space.ketterling.imputer;

import java.io.IOException;
import java.sql.SQLException;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.imputer.config.AppConfig;
import space.ketterling.imputer.db.Database;
import space.ketterling.imputer.db.ImputationRunRepo;
import space.ketterling.imputer.db.ImputedObservationRepo;
import space.ketterling.imputer.engine.IdwEstimator;
import space.ketterling.imputer.engine.ImputationLogSink;
import space.ketterling.imputer.engine.ImputationOutcome;
import space.ketterling.imputer.engine.ParallelImputationController;
import space.ketterling.imputer.engine.SliceFailure;
import space.ketterling.imputer.engine.SliceImputer;
import space.ketterling.imputer.engine.TimeSlicePartitioner;
import space.ketterling.imputer.geo.NeighborCache;
import space.ketterling.imputer.geo.NeighborGraph;
import space.ketterling.imputer.ingest.DirectoryObservationSource;
import space.ketterling.imputer.ingest.ObservationFlattener;
import space.ketterling.imputer.ingest.RawObservationSource;
import space.ketterling.imputer.ingest.StationCatalog;
import space.ketterling.imputer.ingest.TarGzObservationSource;
import space.ketterling.imputer.model.StationMetadata;
import space.ketterling.imputer.model.TimeSlice;
import space.ketterling.imputer.output.CsvTableWriter;
import space.ketterling.imputer.output.ImputedRow;
import space.ketterling.imputer.output.ResultAssembler;

/**
 * Flatten, place, partition, impute and assemble, end to end.
 *
 * <p>
 * Stage order: valid stations and raw files are flattened (and snapshotted to
 * CSV), the station catalog is resolved, the neighbor graph is loaded from or
 * written to its cache, observations are split into time slices which are
 * imputed in parallel, and the result is written with station locations
 * joined in. When database export is enabled the run and its cells are also
 * recorded there.
 * </p>
 */
public class ImputationPipeline {
    private static final Logger log = LoggerFactory.getLogger(ImputationPipeline.class);

    private final AppConfig cfg;
    private final ObjectMapper om;

    public ImputationPipeline(AppConfig cfg, ObjectMapper om) {
        this.cfg = cfg;
        this.om = om;
    }

    /**
     * Summary of a completed run.
     */
    public record RunReport(
            int validStations,
            int documents,
            int malformedDocuments,
            int flatRows,
            int slices,
            int outputRows,
            long cellsFilled,
            long cellsUnfilled,
            List<SliceFailure> failures,
            UUID runId) {

        public boolean hasFailures() {
            return !failures.isEmpty();
        }
    }

    /**
     * Runs the pipeline and throws if any slice failed. Outputs are written
     * before the exception is raised.
     *
     * @throws ImputationRunException if one or more slices failed
     */
    public RunReport runOrThrow() throws IOException, SQLException {
        RunReport report = run();
        if (report.hasFailures())
            throw new ImputationRunException(report.failures());
        return report;
    }

    /**
     * Runs the pipeline. Slice failures are reported, not thrown; I/O and
     * metadata errors propagate.
     */
    public RunReport run() throws IOException, SQLException {
        if (!cfg.dbExportEnabled())
            return execute(null, null);

        try (HikariDataSource ds = Database.createExportDataSource(cfg)) {
            ImputationRunRepo runs = new ImputationRunRepo(ds);
            runs.ensureSchema();
            UUID runId = runs.startRun("station-impute");
            try {
                RunReport report = execute(ds, runId);
                runs.finishRun(runId, !report.hasFailures(), notes(report));
                return report;
            } catch (IOException | SQLException | RuntimeException e) {
                try {
                    runs.finishRun(runId, false, e.toString());
                } catch (SQLException inner) {
                    e.addSuppressed(inner);
                }
                throw e;
            }
        }
    }

    private RunReport execute(HikariDataSource ds, UUID runId) throws IOException, SQLException {
        // 1) flatten
        MDC.put("job", "flatten");
        SortedSet<String> valid;
        ObservationFlattener.Result flat;
        try {
            valid = StationCatalog.readValidStations(cfg.stationsValid());
            flat = new ObservationFlattener(om).flatten(valid, rawSource());
            CsvTableWriter.writeFlat(cfg.cleanedCsv(), flat.rows());
        } finally {
            MDC.remove("job");
        }

        // 2) stations + neighbors
        MDC.put("job", "neighbors");
        SortedMap<String, StationMetadata> stations;
        NeighborGraph graph;
        try {
            stations = new StationCatalog(om).load(cfg.stationList(), valid);
            graph = new NeighborCache(om, cfg.neighborsCache()).loadOrBuild(stations);
        } finally {
            MDC.remove("job");
        }

        // 3) impute
        MDC.put("job", "impute");
        List<TimeSlice> slices;
        ImputationOutcome outcome;
        try {
            slices = TimeSlicePartitioner.partition(flat.rows());

            ImputationLogSink sink = new ImputationLogSink(cfg.imputeLog());
            sink.truncate();

            SliceImputer worker = new SliceImputer(graph, cfg.minNeighbors(),
                    new IdwEstimator(cfg.idwPower(), cfg.zeroDistance()));
            int threads = ParallelImputationController.parallelism(cfg.cpuFraction());
            outcome = new ParallelImputationController(worker, threads).run(slices);
            sink.append(outcome.logEntries());
        } finally {
            MDC.remove("job");
        }

        // 4) assemble + write
        MDC.put("job", "assemble");
        List<ImputedRow> rows;
        try {
            rows = ResultAssembler.assemble(outcome.slices(), stations);
            CsvTableWriter.writeImputed(cfg.imputedCsv(), rows);
        } finally {
            MDC.remove("job");
        }

        // 5) optional export
        if (ds != null) {
            MDC.put("job", "export");
            try {
                new ImputedObservationRepo(ds).insertSlices(runId, outcome.slices());
            } finally {
                MDC.remove("job");
            }
        }

        RunReport report = new RunReport(valid.size(), flat.documents(), flat.malformed(), flat.rows().size(),
                slices.size(), rows.size(), outcome.filledCells(), outcome.unfilledCells(), outcome.failures(),
                runId);

        if (report.hasFailures()) {
            log.warn("Run finished with {} failed slice(s); their rows were written without imputation",
                    report.failures().size());
        }
        log.info("Run complete: stations={} rows={} slices={} filled={} unfilled={}", report.validStations(),
                report.outputRows(), report.slices(), report.cellsFilled(), report.cellsUnfilled());
        return report;
    }

    private RawObservationSource rawSource() {
        if (cfg.hisArchive() != null) {
            log.info("Reading raw observations from archive {}", cfg.hisArchive());
            return new TarGzObservationSource(cfg.hisArchive());
        }
        log.info("Reading raw observations from {}", cfg.hisRoot());
        return new DirectoryObservationSource(cfg.hisRoot());
    }

    private static String notes(RunReport r) {
        return "rows=" + r.outputRows() + " slices=" + r.slices() + " filled=" + r.cellsFilled() + " unfilled="
                + r.cellsUnfilled() + " failedSlices=" + r.failures().size() + " malformedDocs="
                + r.malformedDocuments();
    }
}
