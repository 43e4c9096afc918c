package com.oftest.engine;

import com.oftest.engine.fixtures.basic.Bonus;
import com.oftest.engine.fixtures.basic.Echo;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builders for registries and module descriptor files used across engine tests.
 */
public final class TestRegistries {

    private TestRegistries() {}

    public static TestDescriptor descriptor(String module, Class<? extends OfTest> testClass) {
        return descriptor(module, testClass, TestDescriptor.DEFAULT_PRIORITY);
    }

    public static TestDescriptor descriptor(String module, Class<? extends OfTest> testClass, int priority) {
        return new TestDescriptor(module, testClass.getSimpleName(), testClass, priority, "");
    }

    public static TestModule module(String name, TestDescriptor... tests) {
        TreeMap<String, TestDescriptor> map = new TreeMap<>();
        for (TestDescriptor test : tests) {
            map.put(test.getTestName(), test);
        }
        return new TestModule(name, null, "", map);
    }

    public static ModuleRegistry registry(TestModule... modules) {
        Map<String, TestModule> map = new LinkedHashMap<>();
        for (TestModule module : modules) {
            map.put(module.getName(), module);
        }
        return new ModuleRegistry(map);
    }

    /**
     * {@code {basic: {Echo, Bonus}}}, both at default priority.
     */
    public static ModuleRegistry basicRegistry() {
        return registry(module("basic", descriptor("basic", Echo.class), descriptor("basic", Bonus.class)));
    }

    /**
     * Write a module descriptor listing the given classes.
     */
    public static Path writeModule(Path dir, String moduleName, Class<?>... testClasses) throws IOException {
        StringBuilder sb = new StringBuilder("tests = [\n");
        for (Class<?> testClass : testClasses) {
            sb.append("  \"").append(testClass.getName()).append("\"\n");
        }
        sb.append("]\n");
        return writeFile(dir, moduleName + ".conf", sb.toString());
    }

    public static Path writeFile(Path dir, String fileName, String content) throws IOException {
        Files.createDirectories(dir);
        return Files.writeString(dir.resolve(fileName), content);
    }
}
