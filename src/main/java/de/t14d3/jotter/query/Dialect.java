package de.t14d3.jotter.query;

import java.util.Locale;

/**
 * SQL dialects Jotter knows how to create a schema for.
 */
public enum Dialect {
    GENERIC,
    MYSQL,
    POSTGRESQL,
    H2;

    /**
     * Column type for a store-generated 64-bit key.
     */
    public String generatedKeyType() {
        return switch (this) {
            case POSTGRESQL -> "BIGSERIAL";
            case MYSQL, H2 -> "BIGINT AUTO_INCREMENT";
            default -> "BIGINT GENERATED BY DEFAULT AS IDENTITY";
        };
    }

    /**
     * Translate a declared column type into this dialect's spelling.
     */
    public String columnType(String declared) {
        String upper = declared.toUpperCase(Locale.ROOT);
        return switch (this) {
            case H2 -> "TEXT".equals(upper) ? "CLOB" : upper;
            case MYSQL -> "TIMESTAMP".equals(upper) ? "DATETIME" : upper;
            case POSTGRESQL -> "TINYINT".equals(upper) ? "SMALLINT" : upper;
            default -> upper;
        };
    }

    /**
     * Detect dialect from JDBC URL.
     */
    public static Dialect detectFromUrl(String jdbcUrl) {
        if (jdbcUrl == null) return GENERIC;

        String lowerUrl = jdbcUrl.toLowerCase(Locale.ROOT);
        if (lowerUrl.startsWith("jdbc:mysql") || lowerUrl.startsWith("jdbc:mariadb")) return MYSQL;
        if (lowerUrl.startsWith("jdbc:postgresql")) return POSTGRESQL;
        if (lowerUrl.startsWith("jdbc:h2")) return H2;

        return GENERIC;
    }
}
