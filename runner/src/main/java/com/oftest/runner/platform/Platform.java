package com.oftest.runner.platform;

import java.util.Map;

/**
 * Maps OpenFlow port numbers to the dataplane interfaces of a test bed.
 *
 * <p>Implementations are registered in
 * {@code META-INF/services/com.oftest.runner.platform.Platform} and selected by
 * {@link #getName()}.</p>
 */
public interface Platform {

    String getName();

    /**
     * Add this platform's ports to the port map.
     */
    void configure(PlatformSettings settings, Map<Integer, String> portMap);
}
