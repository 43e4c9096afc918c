package com.oftest.runner.profile;

import com.oftest.engine.OfTestException;

/**
 * Thrown when a profile is missing or does not define a skip list.
 */
public class ProfileLoadException extends OfTestException {

    public ProfileLoadException(String message) {
        super(message);
    }

    public ProfileLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
