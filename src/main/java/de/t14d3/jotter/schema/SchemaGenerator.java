package de.t14d3.jotter.schema;

import de.t14d3.jotter.connection.QueryExecutor;
import de.t14d3.jotter.mapping.ColumnMapping;
import de.t14d3.jotter.mapping.EntityMetadata;
import de.t14d3.jotter.query.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates and applies DDL for entity tables.
 */
public class SchemaGenerator {
    private static final Logger logger = LoggerFactory.getLogger(SchemaGenerator.class);

    private final Dialect dialect;

    public SchemaGenerator(Dialect dialect) {
        this.dialect = dialect;
    }

    /**
     * CREATE TABLE statements for the given entities, in the given order.
     */
    public List<String> createStatements(List<EntityMetadata> entities) {
        return entities.stream().map(this::createTable).toList();
    }

    /**
     * DROP TABLE statements for the given entities, in reverse order so referencing tables go first.
     */
    public List<String> dropStatements(List<EntityMetadata> entities) {
        List<String> statements = new ArrayList<>();
        for (int i = entities.size() - 1; i >= 0; i--) {
            statements.add("DROP TABLE IF EXISTS " + entities.get(i).getTableName());
        }
        return statements;
    }

    public void apply(QueryExecutor executor, List<String> statements) {
        for (String sql : statements) {
            logger.info("Applying: {}", sql.replace('\n', ' '));
            executor.execute(sql, List.of());
        }
    }

    public String createTable(EntityMetadata md) {
        StringBuilder sql = new StringBuilder();
        sql.append("CREATE TABLE IF NOT EXISTS ").append(md.getTableName()).append(" (\n");

        List<String> definitions = new ArrayList<>();
        for (ColumnMapping column : md.getColumns()) {
            definitions.add("  " + column.name() + " " + columnDefinition(column));
        }
        definitions.add("  PRIMARY KEY (" + md.getIdColumn().name() + ")");
        for (ColumnMapping column : md.getColumns()) {
            if (column.isForeignKey()) {
                definitions.add(String.format("  FOREIGN KEY (%s) REFERENCES %s(id)", column.name(), column.references()));
            }
        }

        sql.append(String.join(",\n", definitions));
        sql.append("\n)");
        return sql.toString();
    }

    private String columnDefinition(ColumnMapping column) {
        if (column.id() && column.generated()) {
            return dialect.generatedKeyType();
        }
        String type = column.sqlType().isEmpty()
                ? javaTypeToSqlType(column.javaType())
                : dialect.columnType(column.sqlType());
        if (!column.nullable() && !column.id()) {
            type += " NOT NULL";
        }
        if (column.javaType() == boolean.class) {
            type += " DEFAULT 0";
        }
        return type;
    }

    static String javaTypeToSqlType(Class<?> javaType) {
        if (javaType == String.class) {
            return "VARCHAR(255)";
        } else if (javaType == Long.class || javaType == long.class) {
            return "BIGINT";
        } else if (javaType == Integer.class || javaType == int.class) {
            return "INTEGER";
        } else if (javaType == Boolean.class || javaType == boolean.class) {
            return "BOOLEAN";
        }
        throw new IllegalArgumentException("No SQL type for " + javaType.getName());
    }
}
