package de.t14d3.jotter.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.util.Objects;

/**
 * Typed view of the {@code jotter} configuration block.
 * <p>
 * {@link #load(String)} layers, highest priority first: system properties, the optional
 * {@code application-<env>.conf} resource, then {@code reference.conf}.
 */
public final class JotterSettings {
    public static final String ENV_VARIABLE = "JOTTER_ENV";
    public static final String DEFAULT_ENV = "local";

    private final Config config;

    public JotterSettings(Config config) {
        this.config = Objects.requireNonNull(config, "config").getConfig("jotter");
        int pageSize = pageSize();
        if (pageSize <= 0) {
            throw new ConfigException.BadValue("jotter.cache.page-size", "must be positive but was " + pageSize);
        }
    }

    /**
     * Settings for the environment named by {@value #ENV_VARIABLE}, or {@value #DEFAULT_ENV}.
     */
    public static JotterSettings load() {
        String env = System.getenv(ENV_VARIABLE);
        return load(env == null || env.isBlank() ? DEFAULT_ENV : env);
    }

    public static JotterSettings load(String env) {
        ConfigFactory.invalidateCaches();
        Config config = ConfigFactory.defaultOverrides()
                .withFallback(ConfigFactory.parseResourcesAnySyntax("application-" + env))
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
        return new JotterSettings(config);
    }

    public String databaseUrl() {
        return config.getString("database.url");
    }

    public String databaseUsername() {
        return config.getString("database.username");
    }

    public String databasePassword() {
        return config.getString("database.password");
    }

    public int pageSize() {
        return config.getInt("cache.page-size");
    }
}
