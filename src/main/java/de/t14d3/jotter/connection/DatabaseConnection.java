package de.t14d3.jotter.connection;

import de.t14d3.jotter.exceptions.StoreException;
import de.t14d3.jotter.query.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * One JDBC connection to the persisted store and the executor bound to it.
 */
public class DatabaseConnection implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseConnection.class);

    private final Connection conn;
    private final Dialect dialect;
    private final QueryExecutor executor;

    public DatabaseConnection(String jdbcUrl) {
        this(jdbcUrl, null, null);
    }

    public DatabaseConnection(String jdbcUrl, String username, String password) {
        try {
            this.conn = (username == null || username.isEmpty())
                    ? DriverManager.getConnection(jdbcUrl)
                    : DriverManager.getConnection(jdbcUrl, username, password);
        } catch (SQLException e) {
            throw new StoreException("Cannot connect to " + jdbcUrl, e);
        }
        this.dialect = Dialect.detectFromUrl(jdbcUrl);
        this.executor = new QueryExecutor(conn);
        logger.info("Connected to {} store at {}", dialect, jdbcUrl);
    }

    public QueryExecutor getExecutor() {
        return executor;
    }

    public Dialect getDialect() {
        return dialect;
    }

    @Override
    public void close() {
        try {
            conn.close();
        } catch (SQLException e) {
            throw new StoreException("Failed to close connection", e);
        }
    }
}
