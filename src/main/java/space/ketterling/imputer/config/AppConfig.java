package space.ketterling.imputer.config;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.imputer.engine.ZeroDistancePolicy;

/**
 * Pipeline configuration loaded from environment variables or properties.
 *
 * <p>
 * Groups the input/output locations, the imputation parameters and the optional
 * database export settings.
 * </p>
 */
public record AppConfig(
        // Inputs
        Path hisRoot,
        Path hisArchive, // nullable; when set, raw files are read from this .tar.gz
        Path stationsValid,
        Path stationList,

        // Outputs
        Path neighborsCache,
        Path cleanedCsv,
        Path imputedCsv,
        Path imputeLog,

        // Imputation
        int minNeighbors,
        double idwPower,
        double cpuFraction,
        ZeroDistancePolicy zeroDistance,

        // DB export
        boolean dbExportEnabled,
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbPoolMax) {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public AppConfig {
        if (minNeighbors < 1)
            throw new IllegalStateException("impute.minNeighbors must be >= 1, got " + minNeighbors);
        if (!(idwPower > 0) || Double.isInfinite(idwPower))
            throw new IllegalStateException("impute.idwPower must be a positive number, got " + idwPower);
        if (!(cpuFraction > 0) || cpuFraction > 1.0)
            throw new IllegalStateException("impute.cpuFraction must be in (0, 1], got " + cpuFraction);
        if (zeroDistance == null)
            throw new IllegalStateException("impute.zeroDistance must be set");
    }

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (Exception e) {
            log.warn("Could not read application.properties, using defaults: {}", e.getMessage());
        }
        return load(p, System::getenv);
    }

    /**
     * Resolves every setting from the given lookups; {@code env} wins over JVM
     * properties, which win over {@code p}.
     */
    static AppConfig load(Properties p, UnaryOperator<String> env) {
        Path data = Path.of(envOr(p, env, "DATA_DIR", "data.dir", "data"));

        Path hisRoot = Path.of(envOr(p, env, "HIS_ROOT", "paths.hisRoot", data.resolve("his_data").toString()));
        String archive = envOr(p, env, "HIS_ARCHIVE", "paths.hisArchive", "");
        Path stationsValid = Path.of(envOr(p, env, "STATIONS_VALID", "paths.stationsValid",
                data.resolve("web_api/stations_valid.txt").toString()));
        Path stationList = Path.of(envOr(p, env, "STATION_LIST", "paths.stationList",
                data.resolve("web_api/station_list.json").toString()));

        Path neighborsCache = Path.of(envOr(p, env, "NEIGHBORS_CACHE", "paths.neighborsCache",
                data.resolve("web_api/station_neighbors.json").toString()));
        Path cleanedCsv = Path.of(envOr(p, env, "CLEANED_CSV", "paths.cleanedCsv",
                data.resolve("cleaned_initial_data.csv").toString()));
        Path imputedCsv = Path.of(envOr(p, env, "IMPUTED_CSV", "paths.imputedCsv",
                data.resolve("cleaned_initial_data_imputed.csv").toString()));
        Path imputeLog = Path.of(envOr(p, env, "IMPUTE_LOG", "paths.imputeLog",
                data.resolve("logs/preprocess_impute.log").toString()));

        int minNeighbors = parseInt(envOr(p, env, "IMPUTE_MIN_NEIGHBORS", "impute.minNeighbors", "3"),
                "impute.minNeighbors");
        double idwPower = parseDouble(envOr(p, env, "IMPUTE_IDW_POWER", "impute.idwPower", "2"), "impute.idwPower");
        double cpuFraction = parseDouble(envOr(p, env, "IMPUTE_CPU_FRACTION", "impute.cpuFraction", "0.8"),
                "impute.cpuFraction");
        ZeroDistancePolicy zero = parsePolicy(envOr(p, env, "IMPUTE_ZERO_DISTANCE", "impute.zeroDistance", "EXCLUDE"));

        boolean dbEnabled = Boolean.parseBoolean(envOr(p, env, "DB_EXPORT_ENABLED", "db.export.enabled", "false"));
        String dbUrl = envOr(p, env, "DB_JDBC_URL", "db.jdbcUrl", "");
        String dbUser = envOr(p, env, "DB_USERNAME", "db.username", "");
        String dbPass = envOr(p, env, "DB_PASSWORD", "db.password", ""); // ok empty if local trust auth
        int dbPoolMax = parseInt(envOr(p, env, "DB_POOL_MAX", "db.poolMax", "4"), "db.poolMax");
        if (dbEnabled) {
            requireNonBlank(dbUrl, "db.jdbcUrl");
            requireNonBlank(dbUser, "db.username");
        }

        // constructor args must match record field order exactly
        return new AppConfig(
                hisRoot,
                archive.isBlank() ? null : Path.of(archive),
                stationsValid,
                stationList,

                neighborsCache,
                cleanedCsv,
                imputedCsv,
                imputeLog,

                minNeighbors,
                idwPower,
                cpuFraction,
                zero,

                dbEnabled,
                dbUrl,
                dbUser,
                dbPass,
                dbPoolMax);
    }

    /**
     * Default layout under a data directory, with export disabled.
     */
    public static AppConfig defaults(Path dataDir) {
        Properties p = new Properties();
        p.setProperty("data.dir", dataDir.toString());
        return load(p, k -> null);
    }

    public AppConfig withImputation(int minNeighbors, double idwPower, ZeroDistancePolicy zeroDistance) {
        return new AppConfig(hisRoot, hisArchive, stationsValid, stationList, neighborsCache, cleanedCsv,
                imputedCsv, imputeLog, minNeighbors, idwPower, cpuFraction, zeroDistance, dbExportEnabled,
                dbJdbcUrl, dbUsername, dbPassword, dbPoolMax);
    }

    public AppConfig withHisArchive(Path archive) {
        return new AppConfig(hisRoot, archive, stationsValid, stationList, neighborsCache, cleanedCsv,
                imputedCsv, imputeLog, minNeighbors, idwPower, cpuFraction, zeroDistance, dbExportEnabled,
                dbJdbcUrl, dbUsername, dbPassword, dbPoolMax);
    }

    public AppConfig withDbExport(String jdbcUrl, String username, String password) {
        return new AppConfig(hisRoot, hisArchive, stationsValid, stationList, neighborsCache, cleanedCsv,
                imputedCsv, imputeLog, minNeighbors, idwPower, cpuFraction, zeroDistance, true,
                jdbcUrl, username, password, dbPoolMax);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, UnaryOperator<String> env, String envKey, String propKey, String def) {
        String v = env.apply(envKey);
        if (v != null && !v.isBlank())
            return v.trim();
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys.trim();
        return p.getProperty(propKey, def).trim();
    }

    private static void requireNonBlank(String v, String key) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value " + key + " (env var, -Dprop, or application.properties).");
        }
    }

    private static int parseInt(String v, String key) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + ": " + v, e);
        }
    }

    private static double parseDouble(String v, String key) {
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for " + key + ": " + v, e);
        }
    }

    private static ZeroDistancePolicy parsePolicy(String v) {
        try {
            return ZeroDistancePolicy.valueOf(v.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid impute.zeroDistance: " + v + " (expected EXCLUDE or EXACT)", e);
        }
    }
}
