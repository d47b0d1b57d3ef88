package de.t14d3.jotter.mapping;

import java.lang.reflect.Field;

/**
 * One mapped column of an entity: the field it fills and how the column is declared.
 */
public record ColumnMapping(Field field, String name, boolean nullable, String sqlType, String references,
                            boolean id, boolean generated) {

    public Class<?> javaType() {
        return field.getType();
    }

    public boolean isForeignKey() {
        return !references.isEmpty();
    }
}
