package de.t14d3.jotter.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a row type of the persisted store.
 * <p>
 * Entity classes are discovered by {@link de.t14d3.jotter.mapping.EntityScanner}, read through
 * {@link de.t14d3.jotter.mapping.EntityMetadata} and created from schema by
 * {@link de.t14d3.jotter.schema.SchemaGenerator}. They need a parameterless constructor.
 *
 * @see Table
 * @see Column
 * @see Id
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Entity {
}
