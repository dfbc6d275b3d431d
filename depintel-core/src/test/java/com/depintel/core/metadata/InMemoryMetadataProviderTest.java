package com.depintel.core.metadata;

import com.depintel.core.model.PackageMetadata;
import com.depintel.core.model.ReleaseRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryMetadataProviderTest {

    @Test
    void lookup_isKeyedByEcosystemAndName() {
        InMemoryMetadataProvider provider = InMemoryMetadataProvider.builder()
            .add(PackageMetadata.basic("requests", "pypi", "2.32.3", List.of("Apache-2.0")))
            .build();

        assertThat(provider.lookup("requests", "pypi")).isPresent();
        assertThat(provider.lookup("requests", "npm")).isEmpty();
        assertThat(provider.versionHistory("requests", "pypi")).isEmpty();
    }

    @Test
    void releases_areSortedByDate() {
        InMemoryMetadataProvider provider = InMemoryMetadataProvider.builder()
            .add(PackageMetadata.basic("lodash", "npm", "4.17.21", List.of("MIT")), List.of(
                ReleaseRecord.of("4.17.21", LocalDate.of(2021, 2, 20)),
                ReleaseRecord.of("4.17.15", LocalDate.of(2019, 7, 19)),
                ReleaseRecord.of("4.17.20", LocalDate.of(2020, 8, 13))))
            .build();

        assertThat(provider.versionHistory("lodash", "npm")).extracting(ReleaseRecord::version)
            .containsExactly("4.17.15", "4.17.20", "4.17.21");
    }

    @Test
    void fromSnapshot_servesPackagesAndReleases() {
        ProjectSnapshot snapshot = new ProjectSnapshot("storefront", List.of(),
            List.of(PackageMetadata.basic("axios", "npm", "1.7.2", List.of("MIT"))),
            Map.of("npm:axios", List.of(ReleaseRecord.of("1.7.2", LocalDate.of(2024, 5, 21)))));

        InMemoryMetadataProvider provider = InMemoryMetadataProvider.fromSnapshot(snapshot);

        assertThat(provider.lookup("axios", "npm")).map(PackageMetadata::latestVersion).contains("1.7.2");
        assertThat(provider.versionHistory("axios", "npm")).hasSize(1);
    }
}
