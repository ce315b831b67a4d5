package space.ketterling.imputer.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ImputationRunRepoTest {

    private HikariDataSource ds;
    private ImputationRunRepo repo;

    static HikariDataSource h2(String name) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1");
        hc.setUsername("sa");
        hc.setPassword("");
        hc.setMaximumPoolSize(2);
        return new HikariDataSource(hc);
    }

    @BeforeEach
    void setUp() throws SQLException {
        ds = h2("runs_" + UUID.randomUUID());
        repo = new ImputationRunRepo(ds);
        repo.ensureSchema();
    }

    @AfterEach
    void tearDown() {
        ds.close();
    }

    @Test
    void ensureSchemaIsRepeatable() throws SQLException {
        repo.ensureSchema();
    }

    @Test
    void runLifecycle() throws SQLException {
        UUID ok = repo.startRun("station-impute");
        assertEquals("RUNNING", repo.status(ok));

        repo.finishRun(ok, true, "rows=10");
        assertEquals("SUCCESS", repo.status(ok));

        UUID bad = repo.startRun("station-impute");
        repo.finishRun(bad, false, "x".repeat(5000));
        assertEquals("FAILED", repo.status(bad));

        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "SELECT finished_at, LENGTH(notes) FROM imputation_run WHERE run_id=?")) {
            ps.setObject(1, bad);
            try (ResultSet rs = ps.executeQuery()) {
                assertTrue(rs.next());
                assertNotNull(rs.getTimestamp(1));
                assertEquals(2000, rs.getInt(2));
            }
        }
    }

    @Test
    void unknownRunHasNoStatus() throws SQLException {
        assertNull(repo.status(UUID.randomUUID()));
    }
}
