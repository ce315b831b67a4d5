package space.ketterling.imputer.config;

import org.junit.jupiter.api.Test;
import space.ketterling.imputer.engine.ZeroDistancePolicy;

import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    private static Properties props(String... kv) {
        Properties p = new Properties();
        for (int i = 0; i < kv.length; i += 2)
            p.setProperty(kv[i], kv[i + 1]);
        return p;
    }

    @Test
    void defaultsLayOutFilesUnderDataDir() {
        Path data = Path.of("/srv/weather");
        AppConfig cfg = AppConfig.defaults(data);

        assertEquals(data.resolve("his_data"), cfg.hisRoot());
        assertNull(cfg.hisArchive());
        assertEquals(data.resolve("web_api/stations_valid.txt"), cfg.stationsValid());
        assertEquals(data.resolve("web_api/station_list.json"), cfg.stationList());
        assertEquals(data.resolve("web_api/station_neighbors.json"), cfg.neighborsCache());
        assertEquals(data.resolve("cleaned_initial_data.csv"), cfg.cleanedCsv());
        assertEquals(data.resolve("cleaned_initial_data_imputed.csv"), cfg.imputedCsv());
        assertEquals(data.resolve("logs/preprocess_impute.log"), cfg.imputeLog());
        assertEquals(3, cfg.minNeighbors());
        assertEquals(2.0, cfg.idwPower());
        assertEquals(0.8, cfg.cpuFraction());
        assertEquals(ZeroDistancePolicy.EXCLUDE, cfg.zeroDistance());
        assertFalse(cfg.dbExportEnabled());
    }

    @Test
    void environmentBeatsProperties() {
        Map<String, String> env = Map.of("IMPUTE_MIN_NEIGHBORS", "5", "IMPUTE_ZERO_DISTANCE", "exact");
        AppConfig cfg = AppConfig.load(props("data.dir", "/d", "impute.minNeighbors", "4", "impute.idwPower", "1.5"),
                env::get);

        assertEquals(5, cfg.minNeighbors());
        assertEquals(1.5, cfg.idwPower());
        assertEquals(ZeroDistancePolicy.EXACT, cfg.zeroDistance());
    }

    @Test
    void explicitPathsOverrideLayout() {
        AppConfig cfg = AppConfig.load(props("data.dir", "/d", "paths.hisArchive", "/a/his.tar.gz",
                "paths.imputeLog", "/var/log/impute.log"), k -> null);
        assertEquals(Path.of("/a/his.tar.gz"), cfg.hisArchive());
        assertEquals(Path.of("/var/log/impute.log"), cfg.imputeLog());
        assertEquals(Path.of("/d/his_data"), cfg.hisRoot());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalStateException.class,
                () -> AppConfig.load(props("impute.minNeighbors", "0"), k -> null));
        assertThrows(IllegalStateException.class,
                () -> AppConfig.load(props("impute.minNeighbors", "three"), k -> null));
        assertThrows(IllegalStateException.class,
                () -> AppConfig.load(props("impute.idwPower", "-1"), k -> null));
        assertThrows(IllegalStateException.class,
                () -> AppConfig.load(props("impute.cpuFraction", "1.5"), k -> null));
        assertThrows(IllegalStateException.class,
                () -> AppConfig.load(props("impute.zeroDistance", "nearest"), k -> null));
    }

    @Test
    void exportNeedsConnectionSettings() {
        assertThrows(IllegalStateException.class,
                () -> AppConfig.load(props("db.export.enabled", "true"), k -> null));

        AppConfig cfg = AppConfig.load(props("db.export.enabled", "true", "db.jdbcUrl", "jdbc:postgresql://db/w",
                "db.username", "imputer"), k -> null);
        assertTrue(cfg.dbExportEnabled());
        assertEquals("", cfg.dbPassword());
    }

    @Test
    void withersKeepOtherSettings() {
        AppConfig base = AppConfig.defaults(Path.of("/d"));
        AppConfig tuned = base.withImputation(2, 3.0, ZeroDistancePolicy.EXACT).withDbExport("jdbc:h2:mem:x", "sa", "");

        assertEquals(2, tuned.minNeighbors());
        assertEquals(3.0, tuned.idwPower());
        assertTrue(tuned.dbExportEnabled());
        assertEquals(base.imputedCsv(), tuned.imputedCsv());
        assertEquals(base.cpuFraction(), tuned.cpuFraction());
    }
}
