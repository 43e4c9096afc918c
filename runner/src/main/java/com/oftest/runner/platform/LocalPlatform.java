package com.oftest.runner.platform;

import java.util.Map;

/**
 * Software switch on veth pairs. The test side of each pair is every other
 * veth: veth1, veth3, ...
 */
public class LocalPlatform implements Platform {

    public static final String NAME = "local";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void configure(PlatformSettings settings, Map<Integer, String> portMap) {
        for (int idx = 0; idx < settings.portCount(); idx++) {
            portMap.put(PlatformSettings.BASE_OF_PORT + idx, "veth" + (settings.baseIfIndex() + 2 * idx));
        }
    }
}
