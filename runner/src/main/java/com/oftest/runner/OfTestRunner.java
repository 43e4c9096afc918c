package com.oftest.runner;

import ch.qos.logback.classic.Level;
import com.oftest.config.ConfigLoader;
import com.oftest.config.DebugLevel;
import com.oftest.config.RunnerConfig;
import com.oftest.engine.ModuleRegistry;
import com.oftest.engine.OfTestException;
import com.oftest.engine.TestContext;
import com.oftest.engine.TestDescriptor;
import com.oftest.engine.TestModule;
import com.oftest.engine.TestResult;
import com.oftest.engine.discovery.TestDiscovery;
import com.oftest.engine.execution.ExecutionListener;
import com.oftest.engine.execution.ExecutionReporter;
import com.oftest.engine.execution.ExecutionResult;
import com.oftest.engine.execution.Outcome;
import com.oftest.engine.priority.SkipMatchMode;
import com.oftest.engine.priority.SkipProfile;
import com.oftest.engine.spec.SpecElement;
import com.oftest.engine.spec.SpecParser;
import com.oftest.engine.suite.Suite;
import com.oftest.engine.suite.SuiteBuilder;
import com.oftest.engine.suite.TestListing;
import com.oftest.runner.platform.PlatformConfigurator;
import com.oftest.runner.platform.PlatformSettings;
import com.oftest.runner.profile.ProfileLoader;
import com.oftest.runner.report.ReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line test runner.
 *
 * <p>Loads configuration, discovers test modules, selects tests by spec,
 * priority and profile, runs them and exits 0 on success, 1 otherwise.</p>
 *
 * <pre>
 * oftest --test-dir tests --test-spec basic,flow.FlowAdd --profile lab
 * oftest --list
 * oftest -T all --priority -1 -i 1@eth1 -i 2@eth2 --relax
 * </pre>
 */
@Command(name = "oftest",
        mixinStandardHelpOptions = true,
        version = "OFTest Runner 1.0",
        description = "Selects and runs switch conformance tests")
public class OfTestRunner implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(OfTestRunner.class);

    @Option(names = {"--config", "-c"}, description = "Config file layered over the defaults (repeatable)")
    private List<String> configFiles = new ArrayList<>();

    @Option(names = {"--test-spec", "-T"}, description = "Tests to run: all, module, Test or module.Test, comma separated")
    private String testSpec;

    @Option(names = {"--test-dir"}, description = "Directory holding test module descriptors")
    private String testDir;

    @Option(names = {"--priority"}, description = "Minimum priority of tests to run")
    private Integer priority;

    @Option(names = {"--profile"}, description = "Skip-list profile name")
    private String profile;

    @Option(names = {"--profile-dir"}, description = "Directory searched for profiles before the classpath")
    private String profileDir;

    @Option(names = {"--skip-match"}, description = "Skip-list matching: unqualified or qualified")
    private String skipMatch;

    @Option(names = {"--platform"}, description = "Platform providing the port map")
    private String platform;

    @Option(names = {"--platform-args"}, description = "Argument string handed to the platform")
    private String platformArgs;

    @Option(names = {"--interface", "-i"}, description = "Port mapping ofport@ifname (repeatable, bypasses the platform)")
    private List<String> interfaces;

    @Option(names = {"--port-count"}, description = "Number of dataplane ports")
    private Integer portCount;

    @Option(names = {"--base-if-index"}, description = "Index of the first dataplane interface")
    private Integer baseIfIndex;

    @Option(names = {"--controller-host"}, description = "Controller listen address")
    private String controllerHost;

    @Option(names = {"--controller-port"}, description = "Controller listen port")
    private Integer controllerPort;

    @Option(names = {"--default-timeout"}, description = "Default timeout in seconds for test operations")
    private Integer defaultTimeoutSeconds;

    @Option(names = {"--test-params", "-t"}, description = "Test parameters key=value;key=value")
    private String testParams;

    @Option(names = {"--list"}, description = "List tests and exit")
    private boolean list;

    @Option(names = {"--list-test-names"}, description = "List names of runnable tests and exit")
    private boolean listTestNames;

    @Option(names = {"--fail-skipped"}, description = "Fail the run if any test skipped itself")
    private Boolean failSkipped;

    @Option(names = {"--debug"}, description = "Log level: debug, verbose, info, warning, error, critical")
    private String debug;

    @Option(names = {"--relax"}, description = "Run without super-user privileges")
    private Boolean relax;

    @Option(names = {"--report-format", "-f"}, description = "Report format: text, json")
    private String reportFormat;

    @Option(names = {"--output", "-o"}, description = "Output file for report (stdout if not specified)")
    private String outputFile;

    private final PrintStream out;
    private final PrintStream err;
    private final PrivilegeCheck privilegeCheck;

    public OfTestRunner() {
        this(System.out, System.err, new PrivilegeCheck());
    }

    public OfTestRunner(PrintStream out, PrintStream err, PrivilegeCheck privilegeCheck) {
        this.out = out;
        this.err = err;
        this.privilegeCheck = privilegeCheck;
    }

    @Override
    public Integer call() {
        try {
            RunnerConfig config = resolveConfig();
            applyLogLevel(config.getDebugLevel());
            log.info("OFTest runner starting: {}", config);
            return run(config);
        } catch (OfTestException | ConfigLoader.ConfigurationException | IllegalArgumentException e) {
            log.error("{}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Error during testing", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private int run(RunnerConfig config) throws IOException {
        if (config.getPriorityThreshold() < 0) {
            log.warn("Priority threshold {} admits skip-listed tests", config.getPriorityThreshold());
        }

        List<SpecElement> spec = new SpecParser().parse(config.getTestSpec());

        SkipMatchMode matchMode = SkipMatchMode.fromString(config.getSkipMatch());
        SkipProfile skipProfile = new ProfileLoader(Path.of(config.getProfileDir()), matchMode)
                .load(config.getProfile());

        ModuleRegistry registry = new TestDiscovery(Path.of(config.getTestDir())).discover();
        SuiteBuilder suiteBuilder = new SuiteBuilder(config.getPriorityThreshold());
        ModuleRegistry selected = suiteBuilder.prune(spec, registry);

        if (list) {
            printListing(selected, suiteBuilder.listTests(selected, skipProfile, false));
            return 0;
        }
        if (listTestNames) {
            suiteBuilder.listTestNames(selected, skipProfile, true).forEach(out::println);
            return 0;
        }

        ReportGenerator.Format format = ReportGenerator.Format.fromString(config.getReportFormat());

        privilegeCheck.check(config.isRelax());

        Map<Integer, String> portMap = PlatformConfigurator.loadInstalled().configure(
                config.getPlatform(),
                config.getInterfaces(),
                new PlatformSettings(config.getPortCount(), config.getBaseIfIndex(), config.getPlatformArgs()));

        TestContext context = TestContext.builder()
                .portMap(portMap)
                .controllerHost(config.getControllerHost())
                .controllerPort(config.getControllerPort())
                .defaultTimeoutMs(config.getDefaultTimeout().toMillis())
                .testParams(config.getTestParamMap())
                .build();

        Suite suite = suiteBuilder.buildSuite(selected, skipProfile);
        if (suite.isEmpty()) {
            log.warn("No tests reach priority {}", config.getPriorityThreshold());
        }

        ExecutionReporter reporter = new ExecutionReporter(config.isFailOnSkipped(), new ProgressListener(err));
        ExecutionResult result = reporter.run("oftest " + config.getTestSpec(), suite, context);
        Outcome outcome = reporter.classify(result);

        String report = new ReportGenerator().generate(result, outcome, format);
        String output = config.getReportOutput();
        if (output != null && !output.isEmpty()) {
            Files.writeString(Path.of(output), report, StandardCharsets.UTF_8);
            log.info("Report written to: {}", output);
        } else {
            out.println(report);
        }
        return outcome.exitCode();
    }

    /**
     * Layer command-line flags over the loaded configuration.
     */
    RunnerConfig resolveConfig() {
        RunnerConfig.Builder builder = RunnerConfig.fromConfig(ConfigLoader.load(configFiles)).toBuilder();

        if (testSpec != null) builder.testSpec(testSpec);
        if (testDir != null) builder.testDir(testDir);
        if (priority != null) builder.priorityThreshold(priority);
        if (profile != null) builder.profile(profile);
        if (profileDir != null) builder.profileDir(profileDir);
        if (skipMatch != null) builder.skipMatch(skipMatch);
        if (platform != null) builder.platform(platform);
        if (platformArgs != null) builder.platformArgs(platformArgs);
        if (interfaces != null) builder.interfaces(interfaces);
        if (portCount != null) builder.portCount(portCount);
        if (baseIfIndex != null) builder.baseIfIndex(baseIfIndex);
        if (controllerHost != null) builder.controllerHost(controllerHost);
        if (controllerPort != null) builder.controllerPort(controllerPort);
        if (defaultTimeoutSeconds != null) builder.defaultTimeout(Duration.ofSeconds(defaultTimeoutSeconds));
        if (testParams != null) builder.testParams(testParams);
        if (failSkipped != null) builder.failOnSkipped(failSkipped);
        if (debug != null) builder.debugLevel(DebugLevel.parse(debug));
        if (relax != null) builder.relax(relax);
        if (reportFormat != null) builder.reportFormat(reportFormat);
        if (outputFile != null) builder.reportOutput(outputFile);

        return builder.build();
    }

    private void printListing(ModuleRegistry registry, List<TestListing> listings) {
        out.println("Test List:");
        for (TestModule module : registry.getModules()) {
            String description = module.getDescription().isEmpty() ? "No description" : module.getDescription();
            out.printf("Module %s: %s%n", module.getName(), description);
            for (TestListing listing : listings) {
                if (!listing.moduleName().equals(module.getName())) {
                    continue;
                }
                String marker = listing.eligible() ? " " : "*";
                String testDescription = listing.description().isEmpty() ? "No description" : listing.description();
                out.printf("  %s%-24s: %s%n", marker, listing.testName(), testDescription);
            }
        }
        out.println();
        out.println("Tests marked with '*' are not run at the current priority and profile");
        out.printf("%d test(s) in %d module(s)%n", listings.size(), registry.size());
    }

    private static void applyLogLevel(DebugLevel level) {
        Logger logger = LoggerFactory.getLogger("com.oftest");
        if (logger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) logger).setLevel(Level.toLevel(level.getLogLevel()));
        }
    }

    /**
     * Prints one line per finished test.
     */
    private static final class ProgressListener implements ExecutionListener {

        private final PrintStream stream;

        ProgressListener(PrintStream stream) {
            this.stream = stream;
        }

        @Override
        public void onTestFinished(TestDescriptor test, TestResult result) {
            stream.printf("%s ... %s%n", test.getQualifiedName(), result.getStatus());
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new OfTestRunner()).execute(args);
        System.exit(exitCode);
    }
}
