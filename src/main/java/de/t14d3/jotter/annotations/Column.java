package de.t14d3.jotter.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Maps a field to a column.
 *
 * @see Entity
 * @see Id
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Column {
    /**
     * The column name.
     */
    String name();

    /**
     * Whether the column accepts NULL.
     */
    boolean nullable() default true;

    /**
     * SQL type used when generating the table. Empty means inferred from the field type.
     */
    String type() default "";

    /**
     * Table whose {@code id} column this column references. Empty means no foreign key.
     */
    String references() default "";
}
