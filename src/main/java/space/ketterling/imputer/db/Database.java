package space.ketterling.imputer.db;

import space.ketterling.imputer.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates pooled database connections using HikariCP.
 */
public final class Database {
    private Database() {
    }

    /**
     * Builds the connection pool used to export imputation runs.
     */
    public static HikariDataSource createExportDataSource(AppConfig cfg) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.dbJdbcUrl());
        hc.setUsername(cfg.dbUsername());
        hc.setPassword(cfg.dbPassword());
        hc.setPoolName("station-imputer-export");
        hc.setMaximumPoolSize(Math.max(2, cfg.dbPoolMax()));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        return new HikariDataSource(hc);
    }
}
