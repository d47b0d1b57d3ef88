package de.t14d3.jotter.mapping;

import de.t14d3.jotter.annotations.Column;
import de.t14d3.jotter.annotations.Entity;
import de.t14d3.jotter.annotations.Id;
import de.t14d3.jotter.annotations.Table;
import de.t14d3.jotter.exceptions.StoreException;
import de.t14d3.jotter.model.Timestamps;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Column layout of an {@link Entity} class, read once by reflection and cached per class.
 * <p>
 * Only fields annotated with {@link Column} are mapped; everything else on the class is left
 * alone when a row is materialized.
 */
public class EntityMetadata {
    private static final Map<Class<?>, EntityMetadata> METADATA_CACHE = new ConcurrentHashMap<>();

    private final Class<?> entityClass;
    private final String tableName;
    private final ColumnMapping idColumn;
    private final List<ColumnMapping> columns;
    private final Constructor<?> constructor;

    private EntityMetadata(Class<?> entityClass) {
        this.entityClass = entityClass;

        if (!entityClass.isAnnotationPresent(Entity.class)) {
            throw new IllegalArgumentException("Class " + entityClass.getName() + " is not annotated with @Entity");
        }

        Table table = entityClass.getAnnotation(Table.class);
        this.tableName = (table != null) ? table.name() : entityClass.getSimpleName().toLowerCase();

        List<ColumnMapping> found = new ArrayList<>();
        ColumnMapping foundId = null;
        for (Field field : entityClass.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers()) || !field.isAnnotationPresent(Column.class)) {
                continue;
            }
            field.setAccessible(true);
            Column column = field.getAnnotation(Column.class);
            Id id = field.getAnnotation(Id.class);
            ColumnMapping mapping = new ColumnMapping(field, column.name(), column.nullable(), column.type(),
                    column.references(), id != null, id != null && id.generated());
            if (mapping.id()) {
                if (foundId != null) {
                    throw new IllegalArgumentException("Entity " + entityClass.getName() + " declares more than one @Id");
                }
                foundId = mapping;
            }
            found.add(mapping);
        }

        if (foundId == null) {
            throw new IllegalArgumentException("Entity " + entityClass.getName() + " must have a field annotated with @Id");
        }
        this.idColumn = foundId;
        this.columns = Collections.unmodifiableList(found);
        this.constructor = findParameterlessConstructor(entityClass);
    }

    /**
     * Get or create metadata for the given entity class.
     */
    public static EntityMetadata of(Class<?> entityClass) {
        return METADATA_CACHE.computeIfAbsent(entityClass, EntityMetadata::new);
    }

    public Class<?> getEntityClass() {
        return entityClass;
    }

    public String getTableName() {
        return tableName;
    }

    public ColumnMapping getIdColumn() {
        return idColumn;
    }

    /**
     * All mapped columns in declaration order, the id column included.
     */
    public List<ColumnMapping> getColumns() {
        return columns;
    }

    /**
     * Comma-separated column list for a SELECT, in {@link #getColumns()} order.
     */
    public String selectList() {
        return String.join(", ", columns.stream().map(ColumnMapping::name).toList());
    }

    /**
     * Creates an entity from the current row of {@code rs}. Every mapped column must be present.
     */
    public <T> T mapRow(ResultSet rs, Class<T> type) throws SQLException {
        Object entity = newInstance();
        for (ColumnMapping column : columns) {
            Object raw = rs.getObject(column.name());
            try {
                column.field().set(entity, convertValue(raw, column.javaType()));
            } catch (IllegalAccessException e) {
                throw new StoreException("Cannot set field " + column.field().getName(), e);
            }
        }
        return type.cast(entity);
    }

    private Object newInstance() {
        try {
            return constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new StoreException("Cannot instantiate entity " + entityClass.getName(), e);
        }
    }

    private static Constructor<?> findParameterlessConstructor(Class<?> entityClass) {
        for (Constructor<?> c : entityClass.getDeclaredConstructors()) {
            if (c.getParameterCount() == 0) {
                c.setAccessible(true);
                return c;
            }
        }
        throw new IllegalArgumentException("Cannot find parameterless constructor for entity " + entityClass.getName());
    }

    /**
     * Convert a raw JDBC value to the target field type.
     */
    static Object convertValue(Object value, Class<?> targetType) throws SQLException {
        if (value == null) {
            if (targetType == boolean.class) return false;
            if (targetType == int.class) return 0;
            if (targetType == long.class) return 0L;
            return null;
        }

        // 0/1 columns
        if (targetType == boolean.class || targetType == Boolean.class) {
            if (value instanceof Number number) {
                return number.intValue() != 0;
            }
            if (value instanceof Boolean) {
                return value;
            }
            throw new StoreException("Cannot convert " + value.getClass() + " to boolean");
        }

        if (value instanceof Number number) {
            if (targetType == int.class || targetType == Integer.class) return number.intValue();
            if (targetType == long.class || targetType == Long.class) return number.longValue();
        }

        if (targetType == String.class) {
            if (value instanceof Timestamp || value instanceof LocalDateTime || value instanceof OffsetDateTime) {
                return Timestamps.fromJdbc(value);
            }
            if (value instanceof Clob clob) {
                String text = clob.getSubString(1, (int) clob.length());
                clob.free();
                return text;
            }
            return value.toString();
        }

        if (targetType.isAssignableFrom(value.getClass())) {
            return value;
        }

        throw new StoreException("Unsupported mapping from " + value.getClass() + " to " + targetType);
    }
}
