package com.oftest.runner.platform;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PlatformConfigurator and the built-in platforms.
 */
class PlatformConfiguratorTest {

    private static final PlatformSettings FOUR_PORTS = new PlatformSettings(4, 1, "");

    private static class EmptyPlatform implements Platform {
        @Override
        public String getName() {
            return "empty";
        }

        @Override
        public void configure(PlatformSettings settings, Map<Integer, String> portMap) {
        }
    }

    // ==================== Installed Platforms ====================

    @Test
    void loadInstalled_findsBuiltInPlatforms() {
        PlatformConfigurator configurator = PlatformConfigurator.loadInstalled();

        assertTrue(configurator.getPlatformNames().contains("local"));
        assertTrue(configurator.getPlatformNames().contains("remote"));
    }

    @Test
    void localPlatform_usesEveryOtherVeth() {
        Map<Integer, String> portMap = PlatformConfigurator.loadInstalled().configure("local", List.of(), FOUR_PORTS);

        assertEquals(Map.of(1, "veth1", 2, "veth3", 3, "veth5", 4, "veth7"), portMap);
    }

    @Test
    void localPlatform_honoursBaseIndex() {
        Map<Integer, String> portMap = PlatformConfigurator.loadInstalled()
                .configure("local", List.of(), new PlatformSettings(2, 5, ""));

        assertEquals(Map.of(1, "veth5", 2, "veth7"), portMap);
    }

    @Test
    void remotePlatform_usesConsecutiveInterfaces() {
        Map<Integer, String> portMap = PlatformConfigurator.loadInstalled()
                .configure("remote", null, new PlatformSettings(3, 0, ""));

        assertEquals(Map.of(1, "eth0", 2, "eth1", 3, "eth2"), portMap);
    }

    @Test
    void remotePlatform_argsReplacePrefix() {
        Map<Integer, String> portMap = PlatformConfigurator.loadInstalled()
                .configure("remote", null, new PlatformSettings(2, 1, "enp0s"));

        assertEquals(Map.of(1, "enp0s1", 2, "enp0s2"), portMap);
    }

    // ==================== Interface Arguments ====================

    @Test
    void interfaces_bypassPlatform() {
        PlatformConfigurator configurator = new PlatformConfigurator(List.of(new EmptyPlatform()));

        Map<Integer, String> portMap = configurator.configure("empty", List.of("1@eth1", "3@eth3"), FOUR_PORTS);

        assertEquals(Map.of(1, "eth1", 3, "eth3"), portMap);
    }

    @Test
    void interfaces_malformedEntry_throws() {
        PlatformConfigurator configurator = new PlatformConfigurator(List.of());

        assertThrows(PlatformConfigException.class, () -> configurator.configure("local", List.of("eth1"), FOUR_PORTS));
        assertThrows(PlatformConfigException.class, () -> configurator.configure("local", List.of("x@eth1"), FOUR_PORTS));
        assertThrows(PlatformConfigException.class, () -> configurator.configure("local", List.of("1@"), FOUR_PORTS));
    }

    @Test
    void interfaces_duplicatePort_throws() {
        PlatformConfigurator configurator = new PlatformConfigurator(List.of());

        assertThrows(PlatformConfigException.class,
                () -> configurator.configure("local", List.of("1@eth1", "1@eth2"), FOUR_PORTS));
    }

    // ==================== Failures ====================

    @Test
    void unknownPlatform_throws() {
        PlatformConfigException e = assertThrows(PlatformConfigException.class,
                () -> PlatformConfigurator.loadInstalled().configure("mininet", List.of(), FOUR_PORTS));

        assertTrue(e.getMessage().contains("mininet"));
    }

    @Test
    void emptyPortMap_throws() {
        PlatformConfigurator configurator = new PlatformConfigurator(List.of(new EmptyPlatform()));

        assertThrows(PlatformConfigException.class, () -> configurator.configure("empty", List.of(), FOUR_PORTS));
    }

    @Test
    void zeroPortCount_throws() {
        assertThrows(PlatformConfigException.class, () -> PlatformConfigurator.loadInstalled()
                .configure("local", List.of(), new PlatformSettings(0, 1, "")));
    }
}
