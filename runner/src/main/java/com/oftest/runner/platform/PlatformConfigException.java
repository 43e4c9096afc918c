package com.oftest.runner.platform;

import com.oftest.engine.OfTestException;

/**
 * Thrown when no usable port map can be built.
 */
public class PlatformConfigException extends OfTestException {

    public PlatformConfigException(String message) {
        super(message);
    }

    public PlatformConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
