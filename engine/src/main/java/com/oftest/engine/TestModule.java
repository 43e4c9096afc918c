package com.oftest.engine;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A loaded test module and the tests it registered, keyed by test name.
 */
public final class TestModule {

    private final String name;
    private final Path source;
    private final String description;
    private final SortedMap<String, TestDescriptor> tests;

    public TestModule(String name, Path source, String description, SortedMap<String, TestDescriptor> tests) {
        this.name = Objects.requireNonNull(name, "name");
        this.source = source;
        this.description = description == null ? "" : description;
        this.tests = Collections.unmodifiableSortedMap(new TreeMap<>(tests));
    }

    /**
     * Copy of this module holding only the given tests.
     */
    public TestModule withTests(SortedMap<String, TestDescriptor> selected) {
        return new TestModule(name, source, description, selected);
    }

    public String getName() {
        return name;
    }

    /**
     * Descriptor file the module was loaded from.
     */
    public Path getSource() {
        return source;
    }

    public String getDescription() {
        return description;
    }

    public SortedMap<String, TestDescriptor> getTests() {
        return tests;
    }

    public Collection<TestDescriptor> getTestDescriptors() {
        return tests.values();
    }

    public TestDescriptor getTest(String testName) {
        return tests.get(testName);
    }

    public boolean isEmpty() {
        return tests.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestModule)) return false;
        TestModule that = (TestModule) o;
        return name.equals(that.name)
                && Objects.equals(source, that.source)
                && description.equals(that.description)
                && tests.equals(that.tests);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, source, description, tests);
    }

    @Override
    public String toString() {
        return "TestModule{" + name + ", tests=" + tests.keySet() + '}';
    }
}
