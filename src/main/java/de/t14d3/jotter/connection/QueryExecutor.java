package de.t14d3.jotter.connection;

import de.t14d3.jotter.exceptions.StoreException;
import de.t14d3.jotter.mapping.EntityMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs parameterized statements on one connection and maps rows to entities.
 * <p>
 * {@link SQLException} never escapes this class; it is wrapped in {@link StoreException}
 * together with the failing SQL. The connection is shared, so calls are serialized on it.
 */
public class QueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final Connection conn;

    public QueryExecutor(Connection conn) {
        this.conn = conn;
    }

    public synchronized void execute(String sql, List<Object> params) {
        logger.debug("execute: {} {}", sql, params);
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            setParameters(ps, params);
            ps.execute();
        } catch (SQLException e) {
            throw new StoreException("Failed to execute SQL: " + sql + " params=" + params, e);
        }
    }

    public synchronized int executeUpdate(String sql, List<Object> params) {
        logger.debug("update: {} {}", sql, params);
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            setParameters(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to execute UPDATE: " + sql + " params=" + params, e);
        }
    }

    /**
     * Runs an INSERT and returns the key the store generated for the new row.
     */
    public synchronized long executeInsert(String sql, List<Object> params) {
        logger.debug("insert: {} {}", sql, params);
        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            setParameters(ps, params);
            ps.executeUpdate();
            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) {
                    return rs.getLong(1);
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to execute INSERT: " + sql + " params=" + params, e);
        }
        throw new StoreException("INSERT returned no generated key: " + sql);
    }

    /**
     * Every row of the entity's table.
     */
    public synchronized <T> List<T> findAll(Class<T> cls) {
        EntityMetadata md = EntityMetadata.of(cls);
        String sql = String.format("SELECT %s FROM %s", md.selectList(), md.getTableName());
        logger.debug("query: {}", sql);
        try (PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            List<T> results = new ArrayList<>();
            while (rs.next()) {
                results.add(md.mapRow(rs, cls));
            }
            return results;
        } catch (SQLException e) {
            throw new StoreException("Failed to query " + md.getTableName() + ": " + sql, e);
        }
    }

    private static void setParameters(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }
}
