package com.oftest.engine.fixtures;

import com.oftest.engine.OfTest;
import com.oftest.engine.TestContext;
import com.oftest.engine.TestResult;

public class ReportsFailure implements OfTest {

    @Override
    public TestResult execute(TestContext context) {
        ExecutionLog.record("ReportsFailure.execute");
        return TestResult.failed("no reply");
    }
}
