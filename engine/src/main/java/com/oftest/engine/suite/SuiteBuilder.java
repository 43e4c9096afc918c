package com.oftest.engine.suite;

import com.oftest.engine.ModuleRegistry;
import com.oftest.engine.TestDescriptor;
import com.oftest.engine.TestModule;
import com.oftest.engine.priority.PriorityResolver;
import com.oftest.engine.priority.SkipProfile;
import com.oftest.engine.spec.SpecElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Selects tests from a registry and orders them into a {@link Suite}.
 *
 * <p>Selection happens in two steps: {@link #prune(List, ModuleRegistry)} keeps
 * the tests named by the spec, then {@link #buildSuite(ModuleRegistry, SkipProfile)}
 * drops tests whose effective priority is below the threshold. Suites are
 * ordered by module name, then test name.</p>
 */
public class SuiteBuilder {

    private static final Logger log = LoggerFactory.getLogger(SuiteBuilder.class);

    private final int threshold;

    /**
     * @param threshold minimum effective priority; may be negative to admit skip-listed tests
     */
    public SuiteBuilder(int threshold) {
        this.threshold = threshold;
    }

    /**
     * Keep only the tests matched by at least one spec element.
     *
     * @throws UnmatchedSpecException if any element matches nothing
     */
    public ModuleRegistry prune(List<SpecElement> specElements, ModuleRegistry registry) {
        Map<String, SortedMap<String, TestDescriptor>> selected = new LinkedHashMap<>();

        for (SpecElement element : specElements) {
            boolean matched = false;
            for (TestModule module : registry.getModules()) {
                if (!element.matchesModule(module.getName())) {
                    continue;
                }
                for (TestDescriptor test : module.getTestDescriptors()) {
                    if (element.matches(module.getName(), test.getTestName())) {
                        selected.computeIfAbsent(module.getName(), k -> new TreeMap<>())
                                .put(test.getTestName(), test);
                        matched = true;
                    }
                }
            }
            if (!matched) {
                throw new UnmatchedSpecException(element);
            }
        }

        Map<String, TestModule> modules = new LinkedHashMap<>();
        for (Map.Entry<String, SortedMap<String, TestDescriptor>> entry : selected.entrySet()) {
            modules.put(entry.getKey(), registry.getModule(entry.getKey()).withTests(entry.getValue()));
        }

        ModuleRegistry pruned = new ModuleRegistry(modules);
        log.debug("Test spec {} selected {} of {} test(s)", specElements, pruned.getTestCount(),
                registry.getTestCount());
        return pruned;
    }

    /**
     * Order the eligible tests of the registry into a suite.
     */
    public Suite buildSuite(ModuleRegistry registry, SkipProfile skipProfile) {
        PriorityResolver resolver = new PriorityResolver(skipProfile);
        List<TestDescriptor> tests = new ArrayList<>();

        for (TestDescriptor test : registry.getAllTests()) {
            if (resolver.isEligible(test, threshold)) {
                tests.add(test);
            } else {
                log.debug("Excluding {} (priority below {})", test.getQualifiedName(), threshold);
            }
        }

        return new Suite(tests);
    }

    /**
     * Describe tests without instantiating them.
     *
     * @param thresholded when true, only tests reaching the threshold are listed
     */
    public List<TestListing> listTests(ModuleRegistry registry, SkipProfile skipProfile, boolean thresholded) {
        PriorityResolver resolver = new PriorityResolver(skipProfile);
        List<TestListing> listings = new ArrayList<>();

        for (TestDescriptor test : registry.getAllTests()) {
            int priority = resolver.resolve(test);
            boolean eligible = priority >= threshold;
            if (thresholded && !eligible) {
                continue;
            }
            listings.add(new TestListing(test.getModuleName(), test.getTestName(), priority,
                    test.getDescription(), eligible));
        }
        return listings;
    }

    /**
     * Qualified {@code module.test} names, in suite order.
     */
    public List<String> listTestNames(ModuleRegistry registry, SkipProfile skipProfile, boolean thresholded) {
        return listTests(registry, skipProfile, thresholded).stream()
                .map(TestListing::qualifiedName)
                .collect(Collectors.toList());
    }
}
