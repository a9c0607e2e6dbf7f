package com.jobscheduler.db;

import org.h2.jdbcx.JdbcConnectionPool;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Logger;

/**
 * Pooled access to the job store database.
 *
 * <p>Connections come from H2's {@link JdbcConnectionPool}; closing a
 * connection returns it to the pool, so callers use try-with-resources and
 * never hold a connection across a handler invocation.</p>
 *
 * <p>{@link #initialize()} applies {@code schema.sql} from the classpath.
 * Every statement in it is idempotent, so all workers can run it on startup.</p>
 */
public class Database {
    private static final Logger logger = Logger.getLogger(Database.class.getName());
    private static final String SCHEMA_RESOURCE = "schema.sql";
    private static final int CONNECTION_TIMEOUT_SECONDS = 30;

    private final String url;
    private final String user;
    private final String password;
    private final int poolSize;

    private JdbcConnectionPool pool;
    private volatile boolean initialized = false;
    private volatile boolean closed = false;

    public Database(String url, String user, String password, int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be at least 1, got " + poolSize);
        }
        this.url = url;
        this.user = user;
        this.password = password;
        this.poolSize = poolSize;
    }

    /**
     * Create the pool and apply the schema. Calling it twice is a no-op.
     *
     * @throws SQLException if the database is unreachable or the schema fails to apply
     */
    public synchronized void initialize() throws SQLException {
        if (initialized) {
            logger.fine("Database already initialized");
            return;
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }

        logger.info("Initializing connection pool for " + url + " (size " + poolSize + ")");
        pool = JdbcConnectionPool.create(url, user, password);
        pool.setMaxConnections(poolSize);
        pool.setLoginTimeout(CONNECTION_TIMEOUT_SECONDS);

        try {
            initializeSchema();
        } catch (SQLException e) {
            pool.dispose();
            pool = null;
            throw e;
        }

        initialized = true;
        logger.info("Database initialization complete");
    }

    /**
     * Borrow a connection. Closing it returns it to the pool.
     *
     * @return a pooled connection in auto-commit mode
     * @throws SQLException if the database is not initialized, closed, or the pool is exhausted
     */
    public Connection getConnection() throws SQLException {
        if (!initialized) {
            throw new SQLException("Database not initialized. Call initialize() first.");
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }
        return pool.getConnection();
    }

    // Apply schema.sql statement by statement
    private void initializeSchema() throws SQLException {
        String schema = readSchema();

        try (Connection conn = pool.getConnection();
             Statement stmt = conn.createStatement()) {

            StringBuilder currentStatement = new StringBuilder();
            int executedCount = 0;

            for (String line : schema.split("\n")) {
                line = line.trim();
                if (line.startsWith("--") || line.isEmpty()) {
                    continue;
                }

                currentStatement.append(line).append(' ');

                if (line.endsWith(";")) {
                    String sql = currentStatement.toString().trim();
                    sql = sql.substring(0, sql.length() - 1).trim();
                    if (!sql.isEmpty()) {
                        stmt.execute(sql);
                        executedCount++;
                    }
                    currentStatement = new StringBuilder();
                }
            }

            logger.info("Applied " + executedCount + " schema statements");
        }
    }

    private String readSchema() throws SQLException {
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new SQLException(SCHEMA_RESOURCE + " not found on the classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read " + SCHEMA_RESOURCE, e);
        }
    }

    /**
     * Close every pooled connection. In-flight borrowers finish their statement
     * and their connection is discarded on return.
     */
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (pool != null) {
            logger.info("Closing database pool (" + pool.getActiveConnections() + " active connections)");
            pool.dispose();
        }
        logger.info("Database shutdown complete");
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isClosed() {
        return closed;
    }

    public String getUrl() {
        return url;
    }
}
