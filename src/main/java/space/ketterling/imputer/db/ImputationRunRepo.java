/*
* Copyright 2025 Taylor Ketterling
* Imputation run bookkeeping for the station imputer.
* Utilizes HikariCP for database connection pooling.
*/
package space.ketterling.imputer.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Database access for imputation run records.
 */
public class ImputationRunRepo {
    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ImputationRunRepo.class);

    /**
     * Creates a repo backed by the provided datasource.
     */
    public ImputationRunRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Creates the run and observation tables if they do not exist yet.
     */
    public void ensureSchema() throws SQLException {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS imputation_run ("
                    + "run_id UUID PRIMARY KEY, "
                    + "job_name VARCHAR(128) NOT NULL, "
                    + "started_at TIMESTAMP NOT NULL, "
                    + "finished_at TIMESTAMP, "
                    + "status VARCHAR(16) NOT NULL, "
                    + "notes VARCHAR(2000))");
            st.execute("CREATE TABLE IF NOT EXISTS imputed_observation ("
                    + "run_id UUID NOT NULL, "
                    + "station_id VARCHAR(32) NOT NULL, "
                    + "data_time VARCHAR(64) NOT NULL, "
                    + "feature VARCHAR(64) NOT NULL, "
                    + "obs_value DOUBLE PRECISION NOT NULL, "
                    + "imputed BOOLEAN NOT NULL, "
                    + "PRIMARY KEY (run_id, station_id, data_time, feature))");
        }
        log.debug("ensureSchema: tables present");
    }

    /**
     * Starts a new run and returns its unique ID.
     */
    public UUID startRun(String jobName) throws SQLException {
        UUID runId = UUID.randomUUID();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO imputation_run (run_id, job_name, started_at, status) "
                                + "VALUES (?, ?, CURRENT_TIMESTAMP, 'RUNNING')")) {
            ps.setObject(1, runId);
            ps.setString(2, jobName);
            ps.executeUpdate();
        }
        log.debug("startRun: {} -> {}", jobName, runId);
        return runId;
    }

    /**
     * Marks a run as success or failure with notes.
     */
    public void finishRun(UUID runId, boolean success, String notes) throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "UPDATE imputation_run SET finished_at=CURRENT_TIMESTAMP, status=?, notes=? WHERE run_id=?")) {
            ps.setString(1, success ? "SUCCESS" : "FAILED");
            ps.setString(2, truncate(notes, 2000));
            ps.setObject(3, runId);
            ps.executeUpdate();
        }
        log.debug("finishRun: {} success={} notes={}", runId, success, notes);
    }

    /**
     * Returns the stored status of a run, or null if the run is unknown.
     */
    public String status(UUID runId) throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT status FROM imputation_run WHERE run_id=?")) {
            ps.setObject(1, runId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.length() <= max)
            return s;
        return s.substring(0, max);
    }
}
