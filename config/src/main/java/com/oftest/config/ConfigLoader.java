package com.oftest.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigResolveOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Loads and merges runner configuration from multiple sources.
 *
 * <p>Configuration is loaded in the following order (later sources override earlier):
 * <ol>
 *   <li>reference.conf (from classpath - defaults)</li>
 *   <li>application.conf (from classpath)</li>
 *   <li>Config files specified via {@link #load(String...)} or {@link #load(List)}</li>
 *   <li>System properties</li>
 * </ol>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Config config = ConfigLoader.load("lab.conf", "switch-under-test.conf");
 * RunnerConfig runnerConfig = RunnerConfig.fromConfig(config);
 *
 * // Or use the builder
 * Config config = ConfigLoader.builder()
 *     .addFile("lab.conf")
 *     .withSystemProperties(false)
 *     .build();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    /**
     * Load configuration using default loading order:
     * reference.conf -> application.conf -> system properties.
     */
    public static Config load() {
        return ConfigFactory.load();
    }

    /**
     * Load configuration with additional config files.
     * Files are loaded in order, with later files overriding earlier ones.
     *
     * @param configFiles paths to config files
     * @return merged configuration
     */
    public static Config load(String... configFiles) {
        return load(Arrays.asList(configFiles));
    }

    /**
     * Load configuration with additional config files.
     * Files are loaded in order, with later files overriding earlier ones.
     *
     * @param configFiles list of paths to config files
     * @return merged configuration
     */
    public static Config load(List<String> configFiles) {
        return builder().addFiles(configFiles).build();
    }

    /**
     * Load the typed runner configuration directly from config files.
     *
     * @param configFiles paths to config files
     * @return parsed RunnerConfig
     */
    public static RunnerConfig loadRunnerConfig(String... configFiles) {
        return RunnerConfig.fromConfig(load(configFiles));
    }

    /**
     * Create a builder for more control over configuration loading.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ConfigLoader with fine-grained control over loading.
     */
    public static final class Builder {
        private final List<String> configFiles = new ArrayList<>();
        private boolean includeSystemProperties = true;
        private boolean includeApplicationConf = true;

        private Builder() {}

        /**
         * Add a config file to load.
         */
        public Builder addFile(String path) {
            this.configFiles.add(path);
            return this;
        }

        /**
         * Add multiple config files to load.
         */
        public Builder addFiles(List<String> paths) {
            this.configFiles.addAll(paths);
            return this;
        }

        /**
         * Whether to include system properties in resolution.
         * Default: true
         */
        public Builder withSystemProperties(boolean include) {
            this.includeSystemProperties = include;
            return this;
        }

        /**
         * Whether to load application.conf from classpath.
         * Default: true
         */
        public Builder withApplicationConf(boolean include) {
            this.includeApplicationConf = include;
            return this;
        }

        /**
         * Build the merged configuration.
         */
        public Config build() {
            Config config = ConfigFactory.defaultReference();
            log.debug("Loaded reference.conf");

            if (includeApplicationConf) {
                config = ConfigFactory.defaultApplication().withFallback(config);
                log.debug("Loaded application.conf");
            }

            // Later files override earlier ones
            for (String filePath : configFiles) {
                Config fileConfig = loadConfigFile(filePath);
                config = fileConfig.withFallback(config);
                log.info("Loaded config file: {}", filePath);
            }

            if (includeSystemProperties) {
                config = ConfigFactory.systemProperties().withFallback(config);
            }

            return config.resolve(ConfigResolveOptions.defaults());
        }

        private Config loadConfigFile(String path) {
            File file = new File(path);
            if (file.exists()) {
                try {
                    return ConfigFactory.parseFile(file, ConfigParseOptions.defaults());
                } catch (Exception e) {
                    log.error("Failed to parse config file: {}", path, e);
                    throw new ConfigurationException("Failed to parse config file: " + path, e);
                }
            }

            Config classpathConfig = ConfigFactory.parseResources(path, ConfigParseOptions.defaults());
            if (classpathConfig.isEmpty()) {
                throw new ConfigurationException("Config file not found: " + path);
            }
            return classpathConfig;
        }
    }

    /**
     * Exception thrown when configuration loading fails.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
