package com.deadswitch.db;

import org.h2.jdbcx.JdbcConnectionPool;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Connection pool for the H2 database plus schema bootstrap.
 *
 * <p>The schema is read from {@code schema.sql} on the classpath and applied on
 * {@link #initialize()}; every statement is idempotent, so a file database can be
 * reopened across restarts without losing queued jobs.</p>
 */
public class Database {
    private static final Logger logger = Logger.getLogger(Database.class.getName());

    private static final String SCHEMA_RESOURCE = "schema.sql";
    private static final int CONNECTION_TIMEOUT_SECONDS = 30;

    private final String url;
    private final String user;
    private final String password;
    private final int poolSize;

    private JdbcConnectionPool connectionPool;
    private volatile boolean initialized = false;
    private volatile boolean closed = false;

    public Database(String url, String user, String password, int poolSize) {
        this.url = url;
        this.user = user;
        this.password = password;
        this.poolSize = poolSize;
    }

    public synchronized void initialize() throws SQLException {
        if (initialized) {
            logger.fine("Database already initialized");
            return;
        }

        logger.info("Initializing database connection pool for " + url);

        connectionPool = JdbcConnectionPool.create(url, user, password);
        connectionPool.setMaxConnections(poolSize);
        connectionPool.setLoginTimeout(CONNECTION_TIMEOUT_SECONDS);

        try {
            initializeSchema();
        } catch (SQLException e) {
            connectionPool.dispose();
            connectionPool = null;
            throw e;
        }

        initialized = true;
        logger.info("Database initialization complete (pool size " + poolSize + ")");
    }

    public Connection getConnection() throws SQLException {
        if (!initialized) {
            throw new SQLException("Database not initialized. Call initialize() first.");
        }

        if (closed) {
            throw new SQLException("Database has been closed");
        }

        return connectionPool.getConnection();
    }

    // Statements are separated by a ';' at the end of a line; '--' lines are comments
    private void initializeSchema() throws SQLException {
        String schema;
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new SQLException(SCHEMA_RESOURCE + " not found on classpath");
            }
            schema = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema file", e);
        }

        int executedCount = 0;

        try (Connection conn = connectionPool.getConnection();
             Statement stmt = conn.createStatement()) {

            StringBuilder currentStatement = new StringBuilder();

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
        }

        logger.info("Database schema initialized (" + executedCount + " statements)");
    }

    public synchronized void close() {
        if (closed) {
            logger.fine("Database already closed");
            return;
        }

        closed = true;

        if (connectionPool != null) {
            int active = connectionPool.getActiveConnections();
            if (active > 0) {
                logger.warning("Closing database with " + active + " connections still in use");
            }
            try {
                connectionPool.dispose();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Error disposing connection pool", e);
            }
        }

        logger.info("Database shutdown complete");
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isClosed() {
        return closed;
    }
}
