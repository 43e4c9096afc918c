package com.oftest.engine;

import java.lang.reflect.Constructor;
import java.util.Objects;

/**
 * A discovered test: where it lives, how to create it and its declared priority.
 */
public final class TestDescriptor {

    /** Priority assumed when a test declares none. */
    public static final int DEFAULT_PRIORITY = 100;

    /** Sentinel priority of a test that must not run by default. */
    public static final int SKIP = -1;

    private final String moduleName;
    private final String testName;
    private final Class<? extends OfTest> testClass;
    private final int priority;
    private final String description;

    public TestDescriptor(String moduleName, String testName, Class<? extends OfTest> testClass,
                          int priority, String description) {
        if (priority < SKIP) {
            throw new IllegalArgumentException("Priority must be " + SKIP + " or non-negative: " + priority);
        }
        this.moduleName = Objects.requireNonNull(moduleName, "moduleName");
        this.testName = Objects.requireNonNull(testName, "testName");
        this.testClass = Objects.requireNonNull(testClass, "testClass");
        this.priority = priority;
        this.description = description == null ? "" : description;
    }

    public String getModuleName() {
        return moduleName;
    }

    public String getTestName() {
        return testName;
    }

    /**
     * Get the name in {@code module.test} form.
     */
    public String getQualifiedName() {
        return moduleName + "." + testName;
    }

    public Class<? extends OfTest> getTestClass() {
        return testClass;
    }

    /**
     * Declared priority, before any skip list is applied.
     */
    public int getPriority() {
        return priority;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Create a new instance of the test.
     */
    public OfTest newInstance() throws ReflectiveOperationException {
        Constructor<? extends OfTest> constructor = testClass.getDeclaredConstructor();
        constructor.setAccessible(true);
        return constructor.newInstance();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestDescriptor)) return false;
        TestDescriptor that = (TestDescriptor) o;
        return priority == that.priority
                && moduleName.equals(that.moduleName)
                && testName.equals(that.testName)
                && testClass.equals(that.testClass)
                && description.equals(that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(moduleName, testName, testClass, priority, description);
    }

    @Override
    public String toString() {
        return getQualifiedName() + "(priority=" + priority + ")";
    }
}
