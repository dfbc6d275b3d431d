package com.depintel.core.metadata;

import com.depintel.core.model.PackageMetadata;
import com.depintel.core.model.ReleaseRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read-only source of per-package facts.
 *
 * <p>Implementations front external registries or caches. Calls must be idempotent and
 * free of side effects visible to the engine; they may block, in which case the orchestrator
 * bounds the whole analysis with a timeout.
 */
public interface MetadataProvider {

    /**
     * Looks up registry metadata for a package.
     *
     * @param name package name
     * @param ecosystem package ecosystem
     * @return metadata, or empty when the package is not known
     */
    Optional<PackageMetadata> lookup(String name, String ecosystem);

    /**
     * Returns the release history of a package, oldest first.
     *
     * @param name package name
     * @param ecosystem package ecosystem
     * @return releases (empty when unknown)
     */
    List<ReleaseRecord> versionHistory(String name, String ecosystem);
}
