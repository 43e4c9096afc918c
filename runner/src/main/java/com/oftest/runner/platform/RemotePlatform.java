package com.oftest.runner.platform;

import java.util.Map;

/**
 * Hardware switch cabled to consecutive NICs of the test host. The platform
 * arguments, when given, replace the default {@code eth} interface prefix.
 */
public class RemotePlatform implements Platform {

    public static final String NAME = "remote";
    private static final String DEFAULT_PREFIX = "eth";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void configure(PlatformSettings settings, Map<Integer, String> portMap) {
        String args = settings.platformArgs();
        String prefix = args == null || args.isBlank() ? DEFAULT_PREFIX : args.trim();
        for (int idx = 0; idx < settings.portCount(); idx++) {
            portMap.put(PlatformSettings.BASE_OF_PORT + idx, prefix + (settings.baseIfIndex() + idx));
        }
    }
}
