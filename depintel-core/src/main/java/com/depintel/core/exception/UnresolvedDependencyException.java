package com.depintel.core.exception;

/**
 * Thrown when a declared dependency cannot be resolved against the metadata provider.
 */
public class UnresolvedDependencyException extends DependencyIntelligenceException {

    private static final long serialVersionUID = 1L;

    private final String dependencyName;
    private final String ecosystem;

    public UnresolvedDependencyException(String dependencyName, String ecosystem) {
        super("Unable to resolve dependency " + ecosystem + ":" + dependencyName
            + " (no latest version or license information)", "UNRESOLVED_DEPENDENCY");
        this.dependencyName = dependencyName;
        this.ecosystem = ecosystem;
    }

    public String getDependencyName() {
        return dependencyName;
    }

    public String getEcosystem() {
        return ecosystem;
    }
}
