package com.oftest.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Test context handed to every test: port map, controller address, shared
 * default timeout and free-form test parameters.
 *
 * <p>The context is read-only and shared by all tests of a run.</p>
 */
public class TestContext {

    private static final Logger log = LoggerFactory.getLogger(TestContext.class);

    private final Map<Integer, String> portMap;
    private final String controllerHost;
    private final int controllerPort;
    private final long defaultTimeoutMs;
    private final Map<String, String> testParams;

    private TestContext(Builder builder) {
        this.portMap = Collections.unmodifiableMap(new TreeMap<>(builder.portMap));
        this.controllerHost = builder.controllerHost;
        this.controllerPort = builder.controllerPort;
        this.defaultTimeoutMs = builder.defaultTimeoutMs;
        this.testParams = Collections.unmodifiableMap(new LinkedHashMap<>(builder.testParams));
    }

    /**
     * Get the map of OpenFlow port numbers to interface names, ordered by port.
     */
    public Map<Integer, String> getPortMap() {
        return portMap;
    }

    public Set<Integer> getPorts() {
        return portMap.keySet();
    }

    /**
     * Get the interface bound to an OpenFlow port, or null if the port is not mapped.
     */
    public String getInterface(int port) {
        return portMap.get(port);
    }

    public String getControllerHost() {
        return controllerHost;
    }

    public int getControllerPort() {
        return controllerPort;
    }

    /**
     * Default timeout tests should apply to blocking operations.
     */
    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public Map<String, String> getTestParams() {
        return testParams;
    }

    /**
     * Get a test parameter, or the given default when it was not supplied.
     */
    public String getParam(String key, String defaultValue) {
        return testParams.getOrDefault(key, defaultValue);
    }

    /**
     * Report the running test as skipped. Never returns normally.
     */
    public void skip(String reason) {
        throw new TestSkippedException(reason);
    }

    /**
     * Sleep for the specified duration.
     */
    public void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            log.debug("Sleep interrupted");
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Integer, String> portMap = new TreeMap<>();
        private String controllerHost = "0.0.0.0";
        private int controllerPort = 6653;
        private long defaultTimeoutMs = 2000;
        private final Map<String, String> testParams = new LinkedHashMap<>();

        private Builder() {}

        public Builder portMap(Map<Integer, String> portMap) {
            this.portMap.clear();
            this.portMap.putAll(portMap);
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

        public Builder defaultTimeoutMs(long defaultTimeoutMs) {
            this.defaultTimeoutMs = defaultTimeoutMs;
            return this;
        }

        public Builder testParams(Map<String, String> testParams) {
            this.testParams.clear();
            this.testParams.putAll(testParams);
            return this;
        }

        public TestContext build() {
            return new TestContext(this);
        }
    }
}
