package com.caprouter.capabilities;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result of comparing the product scope against the capability registry.
 */
public final class ScopeConsistency {
    private final Set<String> missingInRegistry;
    private final Set<String> missingInScope;

    public ScopeConsistency(Set<String> missingInRegistry, Set<String> missingInScope) {
        this.missingInRegistry = Collections.unmodifiableSet(new TreeSet<>(missingInRegistry));
        this.missingInScope = Collections.unmodifiableSet(new TreeSet<>(missingInScope));
    }

    /** Ids the scope allows but the registry does not define. */
    public Set<String> getMissingInRegistry() {
        return missingInRegistry;
    }

    /** Ids the registry defines but the scope does not allow. */
    public Set<String> getMissingInScope() {
        return missingInScope;
    }

    public boolean isConsistent() {
        return missingInRegistry.isEmpty() && missingInScope.isEmpty();
    }
}
