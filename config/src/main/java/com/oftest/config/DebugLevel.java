package com.oftest.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Debug level names accepted by the runner and the log level each maps to.
 */
public enum DebugLevel {
    DEBUG("debug", "TRACE"),
    VERBOSE("verbose", "DEBUG"),
    INFO("info", "INFO"),
    WARNING("warning", "WARN"),
    WARN("warn", "WARN"),
    ERROR("error", "ERROR"),
    CRITICAL("critical", "ERROR");

    public static final DebugLevel DEFAULT = VERBOSE;

    private static final Logger log = LoggerFactory.getLogger(DebugLevel.class);

    private final String levelName;
    private final String logLevel;

    DebugLevel(String levelName, String logLevel) {
        this.levelName = levelName;
        this.logLevel = logLevel;
    }

    public String getLevelName() {
        return levelName;
    }

    /**
     * Logback level name for this debug level.
     */
    public String getLogLevel() {
        return logLevel;
    }

    /**
     * Parse a debug level name. Unknown names are not fatal: a warning is
     * logged and {@link #DEFAULT} is returned.
     */
    public static DebugLevel parse(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (DebugLevel level : values()) {
                if (level.levelName.equals(normalized)) {
                    return level;
                }
            }
        }
        log.warn("Invalid debug level '{}', using '{}'", name, DEFAULT.levelName);
        return DEFAULT;
    }
}
