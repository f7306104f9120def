package prflow.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import prflow.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit disabled; callers commit or roll back explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("prflow-db-pool");
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
     * Get the underlying DataSource (for frameworks that need it).
     */
    public DataSource getDataSource() {
        return dataSource;
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

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- WORK REQUESTS ----------
            // seq is the insertion order, used to break created_at ties.
            // active_branch mirrors branch_name while PENDING/PROCESSING and is NULL
            // otherwise; its unique constraint enforces one active request per branch.
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS work_requests (
                            id                  VARCHAR(64) PRIMARY KEY,
                            seq                 BIGINT GENERATED BY DEFAULT AS IDENTITY NOT NULL,
                            created_at          TIMESTAMP NOT NULL,
                            created_by          VARCHAR(256) NOT NULL,
                            request_type        VARCHAR(32) NOT NULL,
                            status              VARCHAR(20) NOT NULL,
                            branch_name         VARCHAR(512) NOT NULL,
                            active_branch       VARCHAR(512),
                            pr_title            VARCHAR(1024) NOT NULL,
                            pr_description      CLOB,
                            target_branch       VARCHAR(512) NOT NULL,
                            file_name           VARCHAR(1024) NOT NULL,
                            payload             BYTEA NOT NULL,
                            stage_path          VARCHAR(2048),
                            priority            INT NOT NULL,
                            retry_count         INT DEFAULT 0 NOT NULL,
                            max_retries         INT DEFAULT 3 NOT NULL,
                            processor_id        VARCHAR(256),
                            processed_at        TIMESTAMP,
                            error_message       VARCHAR(4096),
                            github_branch_url   VARCHAR(2048),
                            github_pr_url       VARCHAR(2048),
                            github_pr_number    INT,
                            CONSTRAINT uq_work_requests_seq UNIQUE (seq),
                            CONSTRAINT uq_work_requests_active_branch UNIQUE (active_branch),
                            CONSTRAINT ck_work_requests_priority CHECK (priority BETWEEN 1 AND 10),
                            CONSTRAINT ck_work_requests_retries CHECK (retry_count >= 0 AND retry_count <= max_retries)
                        );
                    """);

            // ---------- AUDIT LOG ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS audit_log (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            request_id      VARCHAR(64),
                            log_level       VARCHAR(10) NOT NULL,
                            message         VARCHAR(4096) NOT NULL,
                            details         CLOB,
                            processor_id    VARCHAR(256),
                            logged_at       TIMESTAMP NOT NULL,
                            CONSTRAINT fk_audit_log_request FOREIGN KEY (request_id) REFERENCES work_requests(id)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_requests_claim ON work_requests(status, priority DESC, created_at, seq);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_requests_branch ON work_requests(branch_name, created_at, seq);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_requests_processing ON work_requests(status, processed_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_audit_request ON audit_log(request_id, logged_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_audit_level_time ON audit_log(log_level, logged_at);");

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
