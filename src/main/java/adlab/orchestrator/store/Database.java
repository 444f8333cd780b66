package adlab.orchestrator.store;

import adlab.orchestrator.config.OrchestratorConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Task records, the work queue and the analysis archive share one pool.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(OrchestratorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("adlab-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection and committing writes.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

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

            // ---------- TASK RECORDS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_records (
                            id              VARCHAR(64) PRIMARY KEY,
                            task_type       VARCHAR(64) NOT NULL,
                            payload         CLOB NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            progress        VARCHAR(1024),
                            result          CLOB,
                            error_code      VARCHAR(64),
                            error_message   VARCHAR(4096),
                            error_attempt   INT,
                            attempts        INT DEFAULT 0,
                            row_version     BIGINT DEFAULT 1,
                            created_at      TIMESTAMP NOT NULL,
                            updated_at      TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- WORK QUEUE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS work_queue (
                            seq             BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            task_id         VARCHAR(64) NOT NULL,
                            task_type       VARCHAR(64) NOT NULL,
                            payload         CLOB NOT NULL,
                            created_at      TIMESTAMP NOT NULL,
                            enqueued_at     TIMESTAMP NOT NULL,
                            visible_at      TIMESTAMP NOT NULL,
                            receipt         VARCHAR(64),
                            deliveries      INT DEFAULT 0
                        );
                    """);

            // ---------- ANALYSIS ARCHIVE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS ad_concepts (
                            ad_archive_id   VARCHAR(256) PRIMARY KEY,
                            image_url       VARCHAR(2048),
                            concept_json    CLOB NOT NULL,
                            created_at      TIMESTAMP NOT NULL
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS ad_recipes (
                            task_id         VARCHAR(64) PRIMARY KEY,
                            ad_archive_id   VARCHAR(256) NOT NULL,
                            image_url       VARCHAR(2048),
                            sales_url       VARCHAR(2048),
                            user_id         VARCHAR(64),
                            ad_concept_json CLOB,
                            sales_page_json CLOB,
                            recipe_prompt   CLOB,
                            created_at      TIMESTAMP NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_task_records_status ON task_records(status, updated_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_work_queue_visible ON work_queue(visible_at, seq);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_work_queue_task ON work_queue(task_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
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
