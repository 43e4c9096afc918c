package com.oftest.runner;

import com.oftest.engine.OfTestException;

/**
 * Thrown when the runner lacks the privileges needed for raw dataplane access.
 */
public class PrivilegeException extends OfTestException {

    public PrivilegeException(String message) {
        super(message);
    }
}
