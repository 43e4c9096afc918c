package com.oftest.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Requires super-user privileges unless explicitly relaxed.
 */
public class PrivilegeCheck {

    private static final Logger log = LoggerFactory.getLogger(PrivilegeCheck.class);

    private final String userName;

    public PrivilegeCheck() {
        this(System.getProperty("user.name"));
    }

    public PrivilegeCheck(String userName) {
        this.userName = userName;
    }

    public boolean isPrivileged() {
        return "root".equals(userName);
    }

    /**
     * @param relax skip the check
     * @throws PrivilegeException if not privileged and not relaxed
     */
    public void check(boolean relax) {
        if (isPrivileged()) {
            return;
        }
        if (relax) {
            log.warn("Running as {} without super-user privileges; dataplane access may fail", userName);
            return;
        }
        throw new PrivilegeException("Super-user privileges required. Please re-run with sudo or use --relax");
    }
}
