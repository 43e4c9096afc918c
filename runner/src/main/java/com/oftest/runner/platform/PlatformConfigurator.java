package com.oftest.runner.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.TreeMap;

/**
 * Builds the port map for a run, either from explicit {@code ofport@ifname}
 * interface arguments or from a named {@link Platform}.
 */
public class PlatformConfigurator {

    private static final Logger log = LoggerFactory.getLogger(PlatformConfigurator.class);

    private final Map<String, Platform> platforms = new TreeMap<>();

    public PlatformConfigurator(Collection<? extends Platform> platforms) {
        for (Platform platform : platforms) {
            this.platforms.put(platform.getName(), platform);
        }
    }

    /**
     * Configurator over every platform registered with {@link ServiceLoader}.
     */
    public static PlatformConfigurator loadInstalled() {
        List<Platform> found = new ArrayList<>();
        ServiceLoader.load(Platform.class).forEach(found::add);
        return new PlatformConfigurator(found);
    }

    public Collection<String> getPlatformNames() {
        return Collections.unmodifiableSet(platforms.keySet());
    }

    /**
     * Build the port map.
     *
     * @param platformName platform used when no interfaces are given
     * @param interfaces   explicit {@code ofport@ifname} entries; bypass the platform when non-empty
     * @param settings     platform inputs
     * @return non-empty port map ordered by port
     * @throws PlatformConfigException if the platform is unknown, an entry is malformed or the map is empty
     */
    public Map<Integer, String> configure(String platformName, List<String> interfaces, PlatformSettings settings) {
        Map<Integer, String> portMap = new TreeMap<>();

        if (interfaces != null && !interfaces.isEmpty()) {
            for (String entry : interfaces) {
                parseInterface(entry, portMap);
            }
            log.info("Port map from interface arguments: {}", portMap);
        } else {
            Platform platform = platforms.get(platformName);
            if (platform == null) {
                throw new PlatformConfigException("Unknown platform " + platformName
                        + " (available: " + platforms.keySet() + ")");
            }
            platform.configure(settings, portMap);
            log.info("Port map from platform {}: {}", platformName, portMap);
        }

        if (portMap.isEmpty()) {
            throw new PlatformConfigException("Interface port map was not defined by the platform. Exiting");
        }
        return portMap;
    }

    private static void parseInterface(String entry, Map<Integer, String> portMap) {
        int at = entry.indexOf('@');
        if (at <= 0 || at == entry.length() - 1) {
            throw new PlatformConfigException("Bad interface '" + entry + "', expected ofport@ifname");
        }
        int port;
        try {
            port = Integer.parseInt(entry.substring(0, at).trim());
        } catch (NumberFormatException e) {
            throw new PlatformConfigException("Bad OpenFlow port in '" + entry + "'", e);
        }
        String previous = portMap.put(port, entry.substring(at + 1).trim());
        if (previous != null) {
            throw new PlatformConfigException("OpenFlow port " + port + " mapped twice");
        }
    }
}
