package com.oftest.engine.priority;

import java.util.Locale;

/**
 * How skip-list entries are compared with tests.
 */
public enum SkipMatchMode {
    /** Entries are bare test names; a name skips that test in every module. */
    UNQUALIFIED,
    /** Entries are {@code module.test}; only that module's test is skipped. */
    QUALIFIED;

    /**
     * Parse a mode name, case-insensitively.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static SkipMatchMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Skip match mode is null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown skip match mode: " + value
                    + " (expected unqualified or qualified)", e);
        }
    }
}
