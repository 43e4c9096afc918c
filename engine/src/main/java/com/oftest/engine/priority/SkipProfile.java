package com.oftest.engine.priority;

import com.oftest.engine.TestDescriptor;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable set of tests a profile keeps out of the run.
 */
public final class SkipProfile {

    private static final SkipProfile EMPTY = new SkipProfile(Collections.emptySet(), SkipMatchMode.UNQUALIFIED);

    private final Set<String> names;
    private final SkipMatchMode matchMode;

    private SkipProfile(Collection<String> names, SkipMatchMode matchMode) {
        this.names = Collections.unmodifiableSet(new TreeSet<>(names));
        this.matchMode = Objects.requireNonNull(matchMode, "matchMode");
    }

    public static SkipProfile empty() {
        return EMPTY;
    }

    /**
     * Skip list matched on bare test names.
     */
    public static SkipProfile of(Collection<String> names) {
        return of(names, SkipMatchMode.UNQUALIFIED);
    }

    public static SkipProfile of(Collection<String> names, SkipMatchMode matchMode) {
        return new SkipProfile(names, matchMode);
    }

    public Set<String> getNames() {
        return names;
    }

    public SkipMatchMode getMatchMode() {
        return matchMode;
    }

    public boolean contains(TestDescriptor test) {
        String key = matchMode == SkipMatchMode.QUALIFIED ? test.getQualifiedName() : test.getTestName();
        return names.contains(key);
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    @Override
    public String toString() {
        return "SkipProfile{" + matchMode + ", " + names + '}';
    }
}
