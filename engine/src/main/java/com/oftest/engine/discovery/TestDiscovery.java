package com.oftest.engine.discovery;

import com.oftest.engine.ModuleRegistry;
import com.oftest.engine.OfTest;
import com.oftest.engine.TestDescriptor;
import com.oftest.engine.TestInfo;
import com.oftest.engine.TestModule;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Modifier;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds a {@link ModuleRegistry} from a directory of test module descriptors.
 *
 * <p>Every visible {@code <module>.conf} file in a visible directory below the
 * root registers the tests of one module. Names starting with {@code .} hide a
 * file or a whole directory. Test classes are resolved on the classpath, never
 * loaded from the test directory itself:</p>
 * <pre>
 * description = "Basic protocol tests"
 * tests = [
 *   "com.example.basic.Echo"
 *   { class = "com.example.basic.FeaturesRequest", priority = 10 }
 * ]
 * </pre>
 *
 * <p>Files are visited in sorted path order. The first file with a given base
 * name defines the module; later files with the same name are not loaded.
 * Any load failure aborts discovery.</p>
 */
public class TestDiscovery {

    private static final Logger log = LoggerFactory.getLogger(TestDiscovery.class);

    public static final String MODULE_SUFFIX = ".conf";

    private final Path rootDir;
    private final ClassLoader classLoader;

    public TestDiscovery(Path rootDir) {
        this(rootDir, Thread.currentThread().getContextClassLoader());
    }

    public TestDiscovery(Path rootDir, ClassLoader classLoader) {
        this.rootDir = rootDir;
        this.classLoader = classLoader != null ? classLoader : TestDiscovery.class.getClassLoader();
    }

    /**
     * Walk the root directory and load every test module.
     *
     * @return registry of modules that registered at least one test
     * @throws DiscoveryException if the root cannot be read or any module fails to load
     */
    public ModuleRegistry discover() {
        if (!Files.isDirectory(rootDir)) {
            throw new DiscoveryException(rootDir, "test directory does not exist");
        }

        Map<String, TestModule> modules = new LinkedHashMap<>();
        Map<String, Path> loaded = new LinkedHashMap<>();

        for (Path file : findModuleFiles()) {
            String moduleName = moduleName(file);
            Path previous = loaded.get(moduleName);
            if (previous != null) {
                log.debug("Module {} already loaded from {}, ignoring {}", moduleName, previous, file);
                continue;
            }
            loaded.put(moduleName, file);

            TestModule module = loadModule(moduleName, file);
            if (module.isEmpty()) {
                log.debug("Module {} registers no tests", moduleName);
                continue;
            }
            modules.put(moduleName, module);
            log.debug("Loaded module {} with {} test(s) from {}", moduleName, module.getTests().size(), file);
        }

        ModuleRegistry registry = new ModuleRegistry(modules);
        log.info("Discovered {} test(s) in {} module(s) under {}",
                registry.getTestCount(), registry.size(), rootDir);
        return registry;
    }

    private List<Path> findModuleFiles() {
        try (Stream<Path> paths = Files.walk(rootDir)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(this::isVisible)
                    .filter(p -> p.getFileName().toString().endsWith(MODULE_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new DiscoveryException(rootDir, "cannot walk test directory", e);
        }
    }

    private boolean isVisible(Path file) {
        for (Path part : rootDir.relativize(file)) {
            if (part.toString().startsWith(".")) {
                return false;
            }
        }
        return true;
    }

    static String moduleName(Path file) {
        String fileName = file.getFileName().toString();
        return fileName.substring(0, fileName.length() - MODULE_SUFFIX.length());
    }

    private TestModule loadModule(String moduleName, Path file) {
        Config config;
        try {
            config = ConfigFactory.parseFile(file.toFile(), ConfigParseOptions.defaults().setAllowMissing(false))
                    .resolve();
        } catch (ConfigException e) {
            throw new DiscoveryException(file, e.getMessage(), e);
        }

        String description = config.hasPath("description") ? config.getString("description") : "";
        SortedMap<String, TestDescriptor> tests = new TreeMap<>();

        if (config.hasPath("tests")) {
            List<? extends ConfigValue> entries;
            try {
                entries = config.getList("tests");
            } catch (ConfigException e) {
                throw new DiscoveryException(file, e.getMessage(), e);
            }
            for (ConfigValue entry : entries) {
                TestDescriptor descriptor = loadTest(moduleName, file, entry);
                if (descriptor == null) {
                    continue;
                }
                if (tests.putIfAbsent(descriptor.getTestName(), descriptor) != null) {
                    throw new DiscoveryException(file, "duplicate test name " + descriptor.getTestName());
                }
            }
        }

        return new TestModule(moduleName, file, description, tests);
    }

    private TestDescriptor loadTest(String moduleName, Path file, ConfigValue entry) {
        String className;
        Integer priorityOverride = null;
        String descriptionOverride = null;

        if (entry.valueType() == ConfigValueType.STRING) {
            className = (String) entry.unwrapped();
        } else if (entry.valueType() == ConfigValueType.OBJECT) {
            Config entryConfig = ((ConfigObject) entry).toConfig();
            try {
                className = entryConfig.getString("class");
                if (entryConfig.hasPath("priority")) {
                    priorityOverride = entryConfig.getInt("priority");
                }
                if (entryConfig.hasPath("description")) {
                    descriptionOverride = entryConfig.getString("description");
                }
            } catch (ConfigException e) {
                throw new DiscoveryException(file, e.getMessage(), e);
            }
        } else {
            throw new DiscoveryException(file, "test entry must be a class name or an object, got "
                    + entry.valueType() + " at " + entry.origin().description());
        }

        Class<? extends OfTest> testClass = resolveTestClass(file, className);
        if (testClass == null) {
            return null;
        }

        TestInfo info = testClass.getAnnotation(TestInfo.class);
        int priority = priorityOverride != null ? priorityOverride
                : info != null ? info.priority() : TestDescriptor.DEFAULT_PRIORITY;
        String description = descriptionOverride != null ? descriptionOverride
                : info != null ? info.description() : "";

        if (priority < TestDescriptor.SKIP) {
            throw new DiscoveryException(file, "invalid priority " + priority + " for " + className);
        }

        return new TestDescriptor(moduleName, testClass.getSimpleName(), testClass, priority, description);
    }

    /**
     * Resolve a listed class. Returns null for abstract classes, which are
     * shared bases rather than runnable tests.
     */
    private Class<? extends OfTest> resolveTestClass(Path file, String className) {
        Class<?> candidate;
        try {
            candidate = Class.forName(className, false, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new DiscoveryException(file, "cannot load test class " + className, e);
        }

        if (candidate == OfTest.class || !OfTest.class.isAssignableFrom(candidate)) {
            throw new DiscoveryException(file, className + " is not a test case");
        }
        if (candidate.isInterface() || Modifier.isAbstract(candidate.getModifiers())) {
            log.debug("Skipping abstract test class {}", className);
            return null;
        }
        try {
            candidate.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            throw new DiscoveryException(file, className + " has no no-arg constructor", e);
        }
        return candidate.asSubclass(OfTest.class);
    }
}
