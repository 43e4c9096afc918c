package com.oftest.engine;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Read-only mapping of module name to loaded {@link TestModule}, ordered by name.
 */
public final class ModuleRegistry {

    private static final ModuleRegistry EMPTY = new ModuleRegistry(Collections.emptyMap());

    private final SortedMap<String, TestModule> modules;

    public ModuleRegistry(Map<String, TestModule> modules) {
        this.modules = Collections.unmodifiableSortedMap(new TreeMap<>(modules));
    }

    public static ModuleRegistry empty() {
        return EMPTY;
    }

    public TestModule getModule(String name) {
        return modules.get(name);
    }

    public SortedSet<String> getModuleNames() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(modules.keySet()));
    }

    public Collection<TestModule> getModules() {
        return modules.values();
    }

    /**
     * All tests, ordered by module name then test name.
     */
    public List<TestDescriptor> getAllTests() {
        return modules.values().stream()
                .flatMap(module -> module.getTestDescriptors().stream())
                .collect(Collectors.toList());
    }

    public int getTestCount() {
        return modules.values().stream().mapToInt(m -> m.getTests().size()).sum();
    }

    public int size() {
        return modules.size();
    }

    public boolean isEmpty() {
        return modules.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModuleRegistry)) return false;
        return modules.equals(((ModuleRegistry) o).modules);
    }

    @Override
    public int hashCode() {
        return modules.hashCode();
    }

    @Override
    public String toString() {
        return "ModuleRegistry{modules=" + modules.keySet() + ", tests=" + getTestCount() + '}';
    }
}
