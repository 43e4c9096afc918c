package com.oftest.engine.suite;

import com.oftest.engine.TestDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, immutable list of tests selected for one run.
 */
public final class Suite implements Iterable<TestDescriptor> {

    private final List<TestDescriptor> tests;

    public Suite(List<TestDescriptor> tests) {
        this.tests = Collections.unmodifiableList(new ArrayList<>(tests));
    }

    public List<TestDescriptor> getTests() {
        return tests;
    }

    /**
     * Qualified names in execution order.
     */
    public List<String> getQualifiedNames() {
        return tests.stream().map(TestDescriptor::getQualifiedName).collect(Collectors.toList());
    }

    public int size() {
        return tests.size();
    }

    public boolean isEmpty() {
        return tests.isEmpty();
    }

    @Override
    public Iterator<TestDescriptor> iterator() {
        return tests.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Suite)) return false;
        return tests.equals(((Suite) o).tests);
    }

    @Override
    public int hashCode() {
        return tests.hashCode();
    }

    @Override
    public String toString() {
        return "Suite" + getQualifiedNames();
    }
}
