package com.oftest.engine.execution;

import com.oftest.engine.TestDescriptor;
import com.oftest.engine.TestResult;

/**
 * Callbacks around each test the reporter runs.
 */
public interface ExecutionListener {

    ExecutionListener NONE = new ExecutionListener() {};

    default void onTestStarted(TestDescriptor test) {
    }

    default void onTestFinished(TestDescriptor test, TestResult result) {
    }
}
