package com.oftest.runner.platform;

/**
 * Inputs a platform uses to build its port map.
 *
 * @param portCount    number of dataplane ports
 * @param baseIfIndex  index of the first interface
 * @param platformArgs free-form argument string, interpreted by the platform
 */
public record PlatformSettings(int portCount, int baseIfIndex, String platformArgs) {

    /** OpenFlow port number of the first dataplane port. */
    public static final int BASE_OF_PORT = 1;
}
