package taskdock.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import taskdock.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Cache tables are created per namespace
 * by {@link taskdock.engine.cache.JdbcCache}; the shared schema lives here.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("taskdock-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- HISTORY ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS history (
                            id              VARCHAR(64) PRIMARY KEY,
                            task_id         VARCHAR(64),
                            url             VARCHAR(2048) NOT NULL,
                            title           VARCHAR(1024),
                            file_path       VARCHAR(2048),
                            status          VARCHAR(20) NOT NULL,
                            error_message   VARCHAR(2048),
                            recorded_at     TIMESTAMP NOT NULL
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_history_url ON history(url);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_history_recorded_at ON history(recorded_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_history_status ON history(status);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
