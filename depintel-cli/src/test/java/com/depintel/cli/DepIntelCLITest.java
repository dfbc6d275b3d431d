package com.depintel.cli;

import com.depintel.DepIntelCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of the command line over snapshot files.
 */
class DepIntelCLITest {

    private static final String SNAPSHOT = """
        projectId: storefront
        dependencies:
          - name: axios
            ecosystem: npm
            versionConstraint: "^1.6.0"
            usage: { usedFeatures: 8, unusedFeatures: 2, usageScore: 0.8 }
          - name: request
            ecosystem: npm
            versionConstraint: "^2.88.0"
          - name: readline-sync
            ecosystem: npm
            versionConstraint: "^1.4.0"
        packages:
          - name: axios
            ecosystem: npm
            latestVersion: 1.7.2
            licenses: [MIT]
            category: http-client
            requirements: { follow-redirects: "^1.15.0" }
          - name: request
            ecosystem: npm
            latestVersion: 2.88.2
            licenses: [Apache-2.0]
            category: http-client
            deprecated: true
          - name: readline-sync
            ecosystem: npm
            latestVersion: 1.4.10
            licenses: [GPL-3.0]
          - name: follow-redirects
            ecosystem: npm
            latestVersion: 1.15.6
            licenses: [MIT]
        releases:
          "npm:axios":
            - { version: 1.6.8, releaseDate: 2024-03-15 }
            - { version: 1.7.2, releaseDate: 2024-05-21 }
        """;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private Path snapshot;
    private Path missingConfig;

    @BeforeEach
    void setUp() throws IOException {
        originalOut = System.out;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        snapshot = tempDir.resolve("storefront.yaml");
        Files.writeString(snapshot, SNAPSHOT);
        missingConfig = tempDir.resolve("depintel.yaml");
    }

    @AfterEach
    void restoreStdout() {
        System.setOut(originalOut);
    }

    @Test
    void list_printsEveryInstalledAnalyzer() {
        int exitCode = run("list");

        assertThat(exitCode).isZero();
        assertThat(output()).contains(
            "Impact Scorer (ID: impact-scorer)",
            "Analysis type: license_compliance",
            "Analysis type: performance_profiling");
    }

    @Test
    void analyze_selectedType_writesJsonDocument() throws IOException {
        Path outputDir = tempDir.resolve("out");

        int exitCode = run("analyze", snapshot.toString(), "-c", missingConfig.toString(),
            "-t", "license_compliance", "--set", "target_license=MIT", "-o", outputDir.toString());

        assertThat(exitCode).isZero();
        assertThat(output()).contains("Analyzing project: storefront", "✓ license_compliance",
            "overall_risk_level: high");
        Path document = outputDir.resolve("license_compliance.json");
        assertThat(document).exists();
        assertThat(Files.readString(document))
            .contains("\"project_id\" : \"storefront\"")
            .contains("\"analysis_type\" : \"license_compliance\"")
            .contains("readline-sync");
    }

    @Test
    void analyze_allTypes_completesEveryAnalysis() {
        int exitCode = run("analyze", snapshot.toString(), "-c", missingConfig.toString());

        assertThat(exitCode).isZero();
        assertThat(output()).contains("✓ impact_scoring", "✓ compatibility_prediction",
            "✓ dependency_consolidation", "✓ health_monitoring", "✓ license_compliance", "✓ performance_profiling");
    }

    @Test
    void analyze_unknownType_fails() {
        assertThat(run("analyze", snapshot.toString(), "-c", missingConfig.toString(), "-t", "astrology")).isEqualTo(1);
    }

    @Test
    void analyze_missingSnapshot_fails() {
        assertThat(run("analyze", tempDir.resolve("absent.yaml").toString())).isEqualTo(1);
    }

    @Test
    void recommend_printsRankedRecommendations() throws IOException {
        Path outputFile = tempDir.resolve("reports/recommendations.json");

        int exitCode = run("recommend", snapshot.toString(), "-c", missingConfig.toString(), "-s", "HIGH",
            "-o", outputFile.toString());

        assertThat(exitCode).isZero();
        String output = output();
        assertThat(output).contains("Recommendations for storefront",
            "[HIGH] Resolve license conflict with readline-sync");
        assertThat(output).doesNotContain("[MEDIUM]", "[LOW]");
        assertThat(Files.readString(outputFile)).contains("\"recommendation_type\" : \"license_compliance\"");
    }

    @Test
    void update_listsAvailableUpdatesWithCompatibility() {
        int exitCode = run("update", snapshot.toString(), "-c", missingConfig.toString());

        assertThat(exitCode).isZero();
        assertThat(output()).contains("Available updates for storefront (3):",
            "1.6.0 -> 1.7.2  [minor] compatibility 0.82",
            "2.88.0 -> 2.88.2  [patch] compatibility 0.98",
            ": upgrade_with_caution", ": upgrade");
    }

    @Test
    void update_singleDependency_writesJson() throws IOException {
        Path outputFile = tempDir.resolve("updates.json");

        int exitCode = run("update", snapshot.toString(), "-c", missingConfig.toString(), "-d", "axios",
            "-o", outputFile.toString());

        assertThat(exitCode).isZero();
        assertThat(output()).contains("Available updates for storefront (1):");
        assertThat(Files.readString(outputFile))
            .contains("\"name\" : \"axios\"")
            .contains("\"upgrade_action\" : \"upgrade_with_caution\"")
            .doesNotContain("readline-sync");
    }

    @Test
    void update_unknownDependency_fails() {
        assertThat(run("update", snapshot.toString(), "-c", missingConfig.toString(), "-d", "left-pad"))
            .isEqualTo(1);
    }

    @Test
    void validate_resolvableSnapshot_printsGraphCounts() {
        int exitCode = run("validate", snapshot.toString());

        assertThat(exitCode).isZero();
        assertThat(output()).contains("✓ Snapshot is valid: storefront", "Direct dependencies: 3",
            "Transitive dependencies: 1");
    }

    @Test
    void validate_unresolvableDependency_fails() throws IOException {
        Path broken = tempDir.resolve("broken.yaml");
        Files.writeString(broken, """
            projectId: broken
            dependencies:
              - { name: left-pad, ecosystem: npm, versionConstraint: "^1.3.0" }
            """);

        assertThat(run("validate", broken.toString())).isEqualTo(1);
    }

    @Test
    void resolveTypes_deduplicatesAndRejectsUnknownIds() {
        assertThat(AnalyzeCommand.resolveTypes(List.of("health_monitoring", "health-monitoring")))
            .hasSize(1);
        assertThat(AnalyzeCommand.resolveTypes(List.of())).hasSize(6);
        assertThatThrownBy(() -> AnalyzeCommand.resolveTypes(List.of("astrology")))
            .hasMessage("Unknown analysis type: astrology");
    }

    private int run(String... args) {
        return DepIntelCLI.commandLine().execute(args);
    }

    private String output() {
        return stdout.toString(StandardCharsets.UTF_8);
    }
}
