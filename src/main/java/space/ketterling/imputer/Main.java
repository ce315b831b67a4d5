/*
* Copyright 2025 Taylor Ketterling
* Command-line entry point for the station imputer.
*
* Loads configuration, flattens the per-station daily observation files, builds or reuses
* the station neighbor cache, fills gaps by inverse-distance weighting across nearby stations
* and writes the cleaned and imputed tables. Exit status is 0 on success, 2 when some time
* slices failed (outputs are still written) and 1 on a fatal error.
*/

package space.ketterling.imputer;

import space.ketterling.imputer.config.AppConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs once and returns the process exit status. An optional first argument
     * overrides the data directory.
     */
    static int run(String[] args) {
        if (args.length > 0 && !args[0].isBlank())
            System.setProperty("data.dir", args[0]);

        log.info("Starting station imputer");
        try {
            AppConfig cfg = AppConfig.load();
            log.info("Config: hisRoot={} archive={} quorum={} power={} cpuFraction={} zeroDistance={} dbExport={}",
                    cfg.hisRoot(), cfg.hisArchive(), cfg.minNeighbors(), cfg.idwPower(), cfg.cpuFraction(),
                    cfg.zeroDistance(), cfg.dbExportEnabled());

            ImputationPipeline.RunReport report = new ImputationPipeline(cfg, new ObjectMapper()).runOrThrow();
            log.info("Finished: imputed table {} ({} rows), log {}", cfg.imputedCsv(), report.outputRows(),
                    cfg.imputeLog());
            return 0;
        } catch (ImputationRunException e) {
            log.error("Outputs written, but {}", e.getMessage());
            return 2;
        } catch (MissingStationMetadataException e) {
            log.error("Cannot build neighbor graph: {}", e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Station imputer failed", e);
            return 1;
        }
    }
}
