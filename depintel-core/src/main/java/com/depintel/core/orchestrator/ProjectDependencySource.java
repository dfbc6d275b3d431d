package com.depintel.core.orchestrator;

import com.depintel.core.model.DeclaredDependency;

import java.util.List;

/**
 * Supplies the declared dependencies of a project, as parsed from its manifests.
 */
@FunctionalInterface
public interface ProjectDependencySource {

    /**
     * @param projectId project identifier
     * @return declared dependencies, empty for a project without manifests
     */
    List<DeclaredDependency> declaredDependencies(String projectId);
}
