package com.oftest.engine.discovery;

import com.oftest.engine.OfTestException;

import java.nio.file.Path;

/**
 * Thrown when a test module cannot be loaded. Discovery stops at the first
 * broken module.
 */
public class DiscoveryException extends OfTestException {

    private final Path source;

    public DiscoveryException(Path source, String message) {
        super(describe(source, message));
        this.source = source;
    }

    public DiscoveryException(Path source, String message, Throwable cause) {
        super(describe(source, message), cause);
        this.source = source;
    }

    /**
     * The module descriptor or directory that failed, if known.
     */
    public Path getSource() {
        return source;
    }

    private static String describe(Path source, String message) {
        return source == null ? message : "Failed to load " + source + ": " + message;
    }
}
