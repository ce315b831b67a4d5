/*
* Copyright 2025 Taylor Ketterling
* Imputed observation repository for the station imputer.
* Utilizes HikariCP for database connection pooling and batched inserts.
*/
package space.ketterling.imputer.db;

import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.imputer.model.FeatureSchema;
import space.ketterling.imputer.model.TimeSlice;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

/**
 * Database access for the cells of an imputed dataset, one row per non-missing
 * (station, timestamp, feature).
 */
public class ImputedObservationRepo {
    private static final int BATCH_SIZE = 1000;

    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ImputedObservationRepo.class);

    /**
     * Creates a repo backed by the provided datasource.
     */
    public ImputedObservationRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Inserts every non-missing cell of the slices under a run, in one
     * transaction.
     *
     * @return number of cells written
     */
    public long insertSlices(UUID runId, List<TimeSlice> slices) throws SQLException {
        String sql = "INSERT INTO imputed_observation (run_id, station_id, data_time, feature, obs_value, imputed) "
                + "VALUES (?, ?, ?, ?, ?, ?)";
        List<String> features = FeatureSchema.columns();
        long written = 0;

        try (Connection c = ds.getConnection()) {
            boolean auto = c.getAutoCommit();
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int pending = 0;
                for (TimeSlice s : slices) {
                    for (int row = 0; row < s.rowCount(); row++) {
                        for (int col = 0; col < features.size(); col++) {
                            Double v = s.value(row, col);
                            if (v == null)
                                continue;
                            ps.setObject(1, runId);
                            ps.setString(2, s.stations().get(row));
                            ps.setString(3, s.timestamp());
                            ps.setString(4, features.get(col));
                            ps.setDouble(5, v);
                            ps.setBoolean(6, s.isImputed(row, col));
                            ps.addBatch();
                            written++;
                            if (++pending == BATCH_SIZE) {
                                ps.executeBatch();
                                pending = 0;
                            }
                        }
                    }
                }
                if (pending > 0)
                    ps.executeBatch();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(auto);
            }
        }
        log.info("insertSlices: run={} cells={}", runId, written);
        return written;
    }

    /**
     * Counts the cells stored for a run, optionally only the imputed ones.
     */
    public long countCells(UUID runId, boolean imputedOnly) throws SQLException {
        String sql = "SELECT COUNT(*) FROM imputed_observation WHERE run_id=?" + (imputedOnly ? " AND imputed" : "");
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }
}
