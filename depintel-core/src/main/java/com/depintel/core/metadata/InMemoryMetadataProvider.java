package com.depintel.core.metadata;

import com.depintel.core.model.DependencyNode;
import com.depintel.core.model.PackageMetadata;
import com.depintel.core.model.ReleaseRecord;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link MetadataProvider} backed by fixed maps, typically filled from a {@link ProjectSnapshot}.
 */
public final class InMemoryMetadataProvider implements MetadataProvider {

    private final Map<String, PackageMetadata> metadata;
    private final Map<String, List<ReleaseRecord>> releases;

    private InMemoryMetadataProvider(Map<String, PackageMetadata> metadata,
                                     Map<String, List<ReleaseRecord>> releases) {
        this.metadata = Map.copyOf(metadata);
        this.releases = Map.copyOf(releases);
    }

    /**
     * Creates a provider serving the packages and releases of a snapshot.
     *
     * @param snapshot project snapshot
     * @return provider
     */
    public static InMemoryMetadataProvider fromSnapshot(ProjectSnapshot snapshot) {
        Builder builder = builder();
        snapshot.packages().forEach(builder::add);
        snapshot.releases().forEach(builder::releasesForId);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<PackageMetadata> lookup(String name, String ecosystem) {
        return Optional.ofNullable(metadata.get(DependencyNode.idOf(ecosystem, name)));
    }

    @Override
    public List<ReleaseRecord> versionHistory(String name, String ecosystem) {
        return releases.getOrDefault(DependencyNode.idOf(ecosystem, name), List.of());
    }

    /**
     * Mutable builder; {@link #build()} freezes the collected data.
     */
    public static final class Builder {

        private final Map<String, PackageMetadata> metadata = new HashMap<>();
        private final Map<String, List<ReleaseRecord>> releases = new HashMap<>();

        private Builder() {
        }

        public Builder add(PackageMetadata packageMetadata) {
            Objects.requireNonNull(packageMetadata, "packageMetadata must not be null");
            metadata.put(DependencyNode.idOf(packageMetadata.ecosystem(), packageMetadata.name()), packageMetadata);
            return this;
        }

        public Builder add(PackageMetadata packageMetadata, List<ReleaseRecord> history) {
            add(packageMetadata);
            return releases(packageMetadata.name(), packageMetadata.ecosystem(), history);
        }

        public Builder releases(String name, String ecosystem, List<ReleaseRecord> history) {
            return releasesForId(DependencyNode.idOf(ecosystem, name), history);
        }

        private Builder releasesForId(String id, List<ReleaseRecord> history) {
            releases.put(id, history.stream()
                .sorted(Comparator.comparing(ReleaseRecord::releaseDate))
                .toList());
            return this;
        }

        public InMemoryMetadataProvider build() {
            return new InMemoryMetadataProvider(metadata, releases);
        }
    }
}
