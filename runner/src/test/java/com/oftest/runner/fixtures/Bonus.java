package com.oftest.runner.fixtures;

import com.oftest.engine.OfTest;
import com.oftest.engine.TestContext;
import com.oftest.engine.TestResult;

public class Bonus implements OfTest {

    @Override
    public TestResult execute(TestContext context) {
        throw new AssertionError("Bonus is broken on this switch");
    }
}
