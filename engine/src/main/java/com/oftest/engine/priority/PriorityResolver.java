package com.oftest.engine.priority;

import com.oftest.engine.TestDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes a test's effective priority under a skip profile.
 */
public class PriorityResolver {

    private static final Logger log = LoggerFactory.getLogger(PriorityResolver.class);

    private final SkipProfile skipProfile;

    public PriorityResolver(SkipProfile skipProfile) {
        this.skipProfile = skipProfile != null ? skipProfile : SkipProfile.empty();
    }

    /**
     * Effective priority: {@link TestDescriptor#SKIP} for a skip-listed test,
     * the declared priority otherwise.
     */
    public int resolve(TestDescriptor test) {
        if (skipProfile.contains(test)) {
            log.info("Skipping test {} (in skip list)", test.getQualifiedName());
            return TestDescriptor.SKIP;
        }
        return test.getPriority();
    }

    /**
     * Whether the test's effective priority reaches the threshold. A threshold
     * of {@link TestDescriptor#SKIP} or lower admits skip-listed tests.
     */
    public boolean isEligible(TestDescriptor test, int threshold) {
        return resolve(test) >= threshold;
    }
}
