package com.oftest.engine.suite;

/**
 * One row of a test listing.
 *
 * @param moduleName  module the test belongs to
 * @param testName    test name
 * @param priority    effective priority under the skip profile
 * @param description one-line description, possibly empty
 * @param eligible    whether the test reaches the priority threshold
 */
public record TestListing(String moduleName, String testName, int priority, String description, boolean eligible) {

    public String qualifiedName() {
        return moduleName + "." + testName;
    }
}
