package de.t14d3.jotter.mapping;

import de.t14d3.jotter.annotations.Entity;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;

import java.util.Comparator;
import java.util.List;

public class EntityScanner {
    public static final String MODEL_PACKAGE = "de.t14d3.jotter.model";

    /**
     * Finds every @Entity type under {@code basePackage} and preloads its metadata. Results are
     * sorted so that a table comes after the tables its foreign keys reference.
     */
    public static List<EntityMetadata> scan(String basePackage) {
        Reflections reflections = new Reflections(
                new ConfigurationBuilder()
                        .setUrls(ClasspathHelper.forPackage(basePackage))
                        .filterInputsBy(new FilterBuilder().includePackage(basePackage))
                        .setScanners(Scanners.TypesAnnotated)
        );
        return reflections.getTypesAnnotatedWith(Entity.class).stream()
                .map(EntityMetadata::of)
                .sorted(Comparator.comparingLong(EntityScanner::foreignKeyCount)
                        .thenComparing(EntityMetadata::getTableName))
                .toList();
    }

    public static List<EntityMetadata> scanModel() {
        return scan(MODEL_PACKAGE);
    }

    private static long foreignKeyCount(EntityMetadata md) {
        return md.getColumns().stream().filter(ColumnMapping::isForeignKey).count();
    }
}
