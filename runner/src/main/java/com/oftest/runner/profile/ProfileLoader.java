package com.oftest.runner.profile;

import com.oftest.engine.priority.SkipMatchMode;
import com.oftest.engine.priority.SkipProfile;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads skip-list profiles.
 *
 * <p>A profile named {@code lab} is read from {@code <profileDir>/lab.conf},
 * falling back to {@code profiles/lab.conf} on the classpath. The file must
 * define {@code skip-list}, a list of test names:</p>
 * <pre>
 * skip-list = ["PacketInBuffered", "basic.FlowStats"]
 * </pre>
 */
public class ProfileLoader {

    private static final Logger log = LoggerFactory.getLogger(ProfileLoader.class);

    public static final String SKIP_LIST_PATH = "skip-list";
    private static final String CLASSPATH_DIR = "profiles/";

    private final Path profileDir;
    private final SkipMatchMode matchMode;

    public ProfileLoader(Path profileDir, SkipMatchMode matchMode) {
        this.profileDir = profileDir;
        this.matchMode = matchMode;
    }

    /**
     * Load a profile by name.
     *
     * @throws ProfileLoadException if the profile cannot be found or lacks a skip list
     */
    public SkipProfile load(String name) {
        if (name == null || name.isBlank()) {
            throw new ProfileLoadException("No profile name given");
        }

        Config config = parse(name);
        if (!config.hasPath(SKIP_LIST_PATH)) {
            throw new ProfileLoadException("Profile " + name + " does not define " + SKIP_LIST_PATH);
        }

        List<String> skipList;
        try {
            skipList = config.getStringList(SKIP_LIST_PATH);
        } catch (ConfigException e) {
            throw new ProfileLoadException("Profile " + name + ": " + e.getMessage(), e);
        }

        log.info("Loaded profile {} skipping {} test(s)", name, skipList.size());
        return SkipProfile.of(skipList, matchMode);
    }

    private Config parse(String name) {
        String fileName = name + ".conf";
        try {
            if (profileDir != null) {
                Path file = profileDir.resolve(fileName);
                if (Files.isRegularFile(file)) {
                    log.debug("Reading profile {} from {}", name, file);
                    return ConfigFactory.parseFile(file.toFile()).resolve();
                }
            }
            Config classpath = ConfigFactory.parseResources(CLASSPATH_DIR + fileName,
                    ConfigParseOptions.defaults().setAllowMissing(true));
            if (classpath.isEmpty()) {
                throw new ProfileLoadException("Profile " + name + " not found in "
                        + (profileDir != null ? profileDir + " or " : "") + "classpath:" + CLASSPATH_DIR);
            }
            return classpath.resolve();
        } catch (ConfigException e) {
            throw new ProfileLoadException("Cannot read profile " + name + ": " + e.getMessage(), e);
        }
    }
}
