package com.oftest.engine.fixtures;

import com.oftest.engine.OfTest;
import com.oftest.engine.TestContext;
import com.oftest.engine.TestResult;

public class Erroring implements OfTest {

    @Override
    public TestResult execute(TestContext context) {
        ExecutionLog.record("Erroring.execute");
        throw new IllegalStateException("controller went away");
    }
}
