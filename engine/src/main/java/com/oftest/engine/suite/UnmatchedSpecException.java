package com.oftest.engine.suite;

import com.oftest.engine.OfTestException;
import com.oftest.engine.spec.SpecElement;

/**
 * Thrown when a test spec element selects no discovered test.
 */
public class UnmatchedSpecException extends OfTestException {

    private final SpecElement element;

    public UnmatchedSpecException(SpecElement element) {
        super("Could not find tests matching " + element);
        this.element = element;
    }

    public SpecElement getElement() {
        return element;
    }
}
