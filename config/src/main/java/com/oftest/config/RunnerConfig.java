package com.oftest.config;

import com.typesafe.config.Config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed configuration for one test run.
 *
 * <p>Built from the {@code oftest} block of a Typesafe Config, then adjusted by
 * the command line through {@link #toBuilder()}.</p>
 */
public final class RunnerConfig {

    public static final String ROOT_PATH = "oftest";

    private final String testDir;
    private final String testSpec;
    private final int priorityThreshold;
    private final String profile;
    private final String profileDir;
    private final String skipMatch;
    private final String platform;
    private final String platformArgs;
    private final List<String> interfaces;
    private final int portCount;
    private final int baseIfIndex;
    private final String controllerHost;
    private final int controllerPort;
    private final Duration defaultTimeout;
    private final String testParams;
    private final boolean failOnSkipped;
    private final DebugLevel debugLevel;
    private final boolean relax;
    private final String reportFormat;
    private final String reportOutput;

    private RunnerConfig(Builder builder) {
        this.testDir = builder.testDir;
        this.testSpec = builder.testSpec;
        this.priorityThreshold = builder.priorityThreshold;
        this.profile = builder.profile;
        this.profileDir = builder.profileDir;
        this.skipMatch = builder.skipMatch;
        this.platform = builder.platform;
        this.platformArgs = builder.platformArgs;
        this.interfaces = Collections.unmodifiableList(new ArrayList<>(builder.interfaces));
        this.portCount = builder.portCount;
        this.baseIfIndex = builder.baseIfIndex;
        this.controllerHost = builder.controllerHost;
        this.controllerPort = builder.controllerPort;
        this.defaultTimeout = builder.defaultTimeout;
        this.testParams = builder.testParams;
        this.failOnSkipped = builder.failOnSkipped;
        this.debugLevel = builder.debugLevel;
        this.relax = builder.relax;
        this.reportFormat = builder.reportFormat;
        this.reportOutput = builder.reportOutput;
    }

    /**
     * Create configuration from the root Typesafe Config.
     */
    public static RunnerConfig fromConfig(Config root) {
        Config config = root.getConfig(ROOT_PATH);

        return builder()
                .testDir(config.getString("test-dir"))
                .testSpec(config.getString("test-spec"))
                .priorityThreshold(config.getInt("priority"))
                .profile(config.getString("profile"))
                .profileDir(config.getString("profile-dir"))
                .skipMatch(config.getString("skip-match"))
                .platform(config.getString("platform"))
                .platformArgs(config.getString("platform-args"))
                .interfaces(config.getStringList("interfaces"))
                .portCount(config.getInt("port-count"))
                .baseIfIndex(config.getInt("base-if-index"))
                .controllerHost(config.getString("controller-host"))
                .controllerPort(config.getInt("controller-port"))
                .defaultTimeout(config.getDuration("default-timeout"))
                .testParams(config.getString("test-params"))
                .failOnSkipped(config.getBoolean("fail-skipped"))
                .debugLevel(DebugLevel.parse(config.getString("debug")))
                .relax(config.getBoolean("relax"))
                .reportFormat(config.getString("report.format"))
                .reportOutput(config.getString("report.output"))
                .build();
    }

    public String getTestDir() {
        return testDir;
    }

    public String getTestSpec() {
        return testSpec;
    }

    public int getPriorityThreshold() {
        return priorityThreshold;
    }

    public String getProfile() {
        return profile;
    }

    public String getProfileDir() {
        return profileDir;
    }

    public String getSkipMatch() {
        return skipMatch;
    }

    public String getPlatform() {
        return platform;
    }

    public String getPlatformArgs() {
        return platformArgs;
    }

    public List<String> getInterfaces() {
        return interfaces;
    }

    public int getPortCount() {
        return portCount;
    }

    public int getBaseIfIndex() {
        return baseIfIndex;
    }

    public String getControllerHost() {
        return controllerHost;
    }

    public int getControllerPort() {
        return controllerPort;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public String getTestParams() {
        return testParams;
    }

    /**
     * Parse {@code key=value;key=value} test parameters. Entries without '='
     * map to an empty string.
     */
    public Map<String, String> getTestParamMap() {
        Map<String, String> params = new LinkedHashMap<>();
        if (testParams == null || testParams.isBlank()) {
            return params;
        }
        for (String entry : testParams.split(";")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq < 0) {
                params.put(trimmed, "");
            } else {
                params.put(trimmed.substring(0, eq).trim(), trimmed.substring(eq + 1).trim());
            }
        }
        return params;
    }

    public boolean isFailOnSkipped() {
        return failOnSkipped;
    }

    public DebugLevel getDebugLevel() {
        return debugLevel;
    }

    public boolean isRelax() {
        return relax;
    }

    public String getReportFormat() {
        return reportFormat;
    }

    public String getReportOutput() {
        return reportOutput;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-populated with this configuration's values.
     */
    public Builder toBuilder() {
        return builder()
                .testDir(testDir)
                .testSpec(testSpec)
                .priorityThreshold(priorityThreshold)
                .profile(profile)
                .profileDir(profileDir)
                .skipMatch(skipMatch)
                .platform(platform)
                .platformArgs(platformArgs)
                .interfaces(interfaces)
                .portCount(portCount)
                .baseIfIndex(baseIfIndex)
                .controllerHost(controllerHost)
                .controllerPort(controllerPort)
                .defaultTimeout(defaultTimeout)
                .testParams(testParams)
                .failOnSkipped(failOnSkipped)
                .debugLevel(debugLevel)
                .relax(relax)
                .reportFormat(reportFormat)
                .reportOutput(reportOutput);
    }

    public static final class Builder {
        private String testDir = "tests";
        private String testSpec = "all";
        private int priorityThreshold = 0;
        private String profile = "default";
        private String profileDir = "profiles";
        private String skipMatch = "unqualified";
        private String platform = "local";
        private String platformArgs = "";
        private final List<String> interfaces = new ArrayList<>();
        private int portCount = 4;
        private int baseIfIndex = 1;
        private String controllerHost = "0.0.0.0";
        private int controllerPort = 6653;
        private Duration defaultTimeout = Duration.ofSeconds(2);
        private String testParams = "";
        private boolean failOnSkipped = false;
        private DebugLevel debugLevel = DebugLevel.DEFAULT;
        private boolean relax = false;
        private String reportFormat = "text";
        private String reportOutput = "";

        private Builder() {}

        public Builder testDir(String testDir) {
            this.testDir = testDir;
            return this;
        }

        public Builder testSpec(String testSpec) {
            this.testSpec = testSpec;
            return this;
        }

        public Builder priorityThreshold(int priorityThreshold) {
            this.priorityThreshold = priorityThreshold;
            return this;
        }

        public Builder profile(String profile) {
            this.profile = profile;
            return this;
        }

        public Builder profileDir(String profileDir) {
            this.profileDir = profileDir;
            return this;
        }

        public Builder skipMatch(String skipMatch) {
            this.skipMatch = skipMatch;
            return this;
        }

        public Builder platform(String platform) {
            this.platform = platform;
            return this;
        }

        public Builder platformArgs(String platformArgs) {
            this.platformArgs = platformArgs;
            return this;
        }

        public Builder interfaces(List<String> interfaces) {
            this.interfaces.clear();
            this.interfaces.addAll(interfaces);
            return this;
        }

        public Builder portCount(int portCount) {
            this.portCount = portCount;
            return this;
        }

        public Builder baseIfIndex(int baseIfIndex) {
            this.baseIfIndex = baseIfIndex;
            return this;
        }

        public Builder controllerHost(String controllerHost) {
            this.controllerHost = controllerHost;
            return this;
        }

        public Builder controllerPort(int controllerPort) {
            this.controllerPort = controllerPort;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder testParams(String testParams) {
            this.testParams = testParams;
            return this;
        }

        public Builder failOnSkipped(boolean failOnSkipped) {
            this.failOnSkipped = failOnSkipped;
            return this;
        }

        public Builder debugLevel(DebugLevel debugLevel) {
            this.debugLevel = debugLevel;
            return this;
        }

        public Builder relax(boolean relax) {
            this.relax = relax;
            return this;
        }

        public Builder reportFormat(String reportFormat) {
            this.reportFormat = reportFormat;
            return this;
        }

        public Builder reportOutput(String reportOutput) {
            this.reportOutput = reportOutput;
            return this;
        }

        public RunnerConfig build() {
            return new RunnerConfig(this);
        }
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "testDir='" + testDir + '\'' +
                ", testSpec='" + testSpec + '\'' +
                ", priority=" + priorityThreshold +
                ", profile='" + profile + '\'' +
                ", platform='" + platform + '\'' +
                ", failOnSkipped=" + failOnSkipped +
                '}';
    }
}
