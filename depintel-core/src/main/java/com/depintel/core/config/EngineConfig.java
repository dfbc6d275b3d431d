package com.depintel.core.config;

import com.depintel.core.exception.InvalidConfigurationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Root configuration of the analysis engine.
 *
 * <p>Loaded from {@code depintel.yaml}. Every section and every value is optional; missing
 * entries fall back to the defaults documented on each section.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * engine:
 *   maxConcurrentJobsPerProject: 5
 *   jobTimeoutSeconds: 300
 *   workerThreads: 4
 *
 * graph:
 *   maxDepth: 4
 *   allowPartialMetadata: false
 *
 * impact:
 *   weights:
 *     businessValue: 0.35
 *     usage: 0.25
 *     complexity: 0.15
 *     health: 0.25
 *
 * license:
 *   defaultTarget: MIT
 * }</pre>
 *
 * @param engine job execution settings
 * @param graph graph construction settings
 * @param impact impact scoring settings
 * @param health health scoring settings
 * @param compatibility compatibility prediction settings
 * @param consolidation consolidation settings
 * @param license license compliance settings
 * @param performance performance profiling settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonProperty("engine") EngineSettings engine,
    @JsonProperty("graph") GraphSettings graph,
    @JsonProperty("impact") ImpactSettings impact,
    @JsonProperty("health") HealthSettings health,
    @JsonProperty("compatibility") CompatibilitySettings compatibility,
    @JsonProperty("consolidation") ConsolidationSettings consolidation,
    @JsonProperty("license") LicenseSettings license,
    @JsonProperty("performance") PerformanceSettings performance
) {
    /**
     * Compact constructor filling missing sections with defaults.
     */
    public EngineConfig {
        if (engine == null) {
            engine = new EngineSettings(null, null, null);
        }
        if (graph == null) {
            graph = new GraphSettings(null, null);
        }
        if (impact == null) {
            impact = new ImpactSettings(null);
        }
        if (health == null) {
            health = new HealthSettings(null, null);
        }
        if (compatibility == null) {
            compatibility = new CompatibilitySettings(null, null, null);
        }
        if (consolidation == null) {
            consolidation = new ConsolidationSettings(null);
        }
        if (license == null) {
            license = new LicenseSettings(null);
        }
        if (performance == null) {
            performance = new PerformanceSettings(null);
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, null, null, null, null, null);
    }

    /**
     * Job execution settings.
     *
     * @param maxConcurrentJobsPerProject active (pending or running) jobs allowed per project, default 5
     * @param jobTimeoutSeconds wall-clock budget of one job, default 300
     * @param workerThreads size of the analysis worker pool, default 4
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EngineSettings(
        @JsonProperty("maxConcurrentJobsPerProject") Integer maxConcurrentJobsPerProject,
        @JsonProperty("jobTimeoutSeconds") Long jobTimeoutSeconds,
        @JsonProperty("workerThreads") Integer workerThreads
    ) {
        public EngineSettings {
            if (maxConcurrentJobsPerProject == null) {
                maxConcurrentJobsPerProject = 5;
            }
            if (jobTimeoutSeconds == null) {
                jobTimeoutSeconds = 300L;
            }
            if (workerThreads == null) {
                workerThreads = 4;
            }
            requirePositive("engine.maxConcurrentJobsPerProject", maxConcurrentJobsPerProject);
            requirePositive("engine.jobTimeoutSeconds", jobTimeoutSeconds);
            requirePositive("engine.workerThreads", workerThreads);
        }

        public Duration jobTimeout() {
            return Duration.ofSeconds(jobTimeoutSeconds);
        }
    }

    /**
     * Graph construction settings.
     *
     * @param maxDepth deepest transitive level expanded (direct = 0), default 4
     * @param allowPartialMetadata keep unresolvable direct dependencies as unknown instead of failing
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GraphSettings(
        @JsonProperty("maxDepth") Integer maxDepth,
        @JsonProperty("allowPartialMetadata") Boolean allowPartialMetadata
    ) {
        public GraphSettings {
            if (maxDepth == null) {
                maxDepth = 4;
            }
            if (allowPartialMetadata == null) {
                allowPartialMetadata = false;
            }
            if (maxDepth < 0) {
                throw new InvalidConfigurationException("graph.maxDepth must not be negative: " + maxDepth);
            }
        }
    }

    /**
     * Impact scoring settings.
     *
     * @param weights composite score weights
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ImpactSettings(
        @JsonProperty("weights") ImpactWeights weights
    ) {
        public ImpactSettings {
            if (weights == null) {
                weights = ImpactWeights.defaults();
            }
        }
    }

    /**
     * Weights of the impact composite. Must be non-negative and sum to 1.
     *
     * @param businessValue weight of the business value score, default 0.35
     * @param usage weight of the usage score, default 0.25
     * @param complexity weight of the complexity score, default 0.15
     * @param health weight of the inverted health score, default 0.25
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ImpactWeights(
        @JsonProperty("businessValue") Double businessValue,
        @JsonProperty("usage") Double usage,
        @JsonProperty("complexity") Double complexity,
        @JsonProperty("health") Double health
    ) {
        private static final double TOLERANCE = 1e-6;

        public ImpactWeights {
            if (businessValue == null) {
                businessValue = 0.35;
            }
            if (usage == null) {
                usage = 0.25;
            }
            if (complexity == null) {
                complexity = 0.15;
            }
            if (health == null) {
                health = 0.25;
            }
            if (businessValue < 0 || usage < 0 || complexity < 0 || health < 0) {
                throw new InvalidConfigurationException("impact weights must not be negative");
            }
            double sum = businessValue + usage + complexity + health;
            if (Math.abs(sum - 1.0) > TOLERANCE) {
                throw new InvalidConfigurationException("impact weights must sum to 1.0 but sum to " + sum);
            }
        }

        public static ImpactWeights defaults() {
            return new ImpactWeights(null, null, null, null);
        }
    }

    /**
     * Health scoring settings. Weights are relative; they are renormalized over known components.
     *
     * @param stalenessWeight weight of release recency, default 0.5
     * @param communityWeight weight of community activity, default 0.5
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HealthSettings(
        @JsonProperty("stalenessWeight") Double stalenessWeight,
        @JsonProperty("communityWeight") Double communityWeight
    ) {
        public HealthSettings {
            if (stalenessWeight == null) {
                stalenessWeight = 0.5;
            }
            if (communityWeight == null) {
                communityWeight = 0.5;
            }
            if (stalenessWeight < 0 || communityWeight < 0 || stalenessWeight + communityWeight <= 0) {
                throw new InvalidConfigurationException("health weights must be non-negative with a positive sum");
            }
        }
    }

    /**
     * Compatibility prediction defaults.
     *
     * @param timeHorizonDays prediction horizon, default 180
     * @param historyWindow number of recent releases used for cadence, default 10
     * @param majorBumpsPerYear historical major bump rate above which predictions are major, default 1.0
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CompatibilitySettings(
        @JsonProperty("timeHorizonDays") Integer timeHorizonDays,
        @JsonProperty("historyWindow") Integer historyWindow,
        @JsonProperty("majorBumpsPerYear") Double majorBumpsPerYear
    ) {
        public CompatibilitySettings {
            if (timeHorizonDays == null) {
                timeHorizonDays = 180;
            }
            if (historyWindow == null) {
                historyWindow = 10;
            }
            if (majorBumpsPerYear == null) {
                majorBumpsPerYear = 1.0;
            }
            requirePositive("compatibility.timeHorizonDays", timeHorizonDays);
            if (historyWindow < 2) {
                throw new InvalidConfigurationException("compatibility.historyWindow must be at least 2");
            }
        }
    }

    /**
     * Consolidation settings.
     *
     * @param transitiveThreshold direct dependencies that must share a transitive package to flag it, default 3
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConsolidationSettings(
        @JsonProperty("transitiveThreshold") Integer transitiveThreshold
    ) {
        public ConsolidationSettings {
            if (transitiveThreshold == null) {
                transitiveThreshold = 3;
            }
            requirePositive("consolidation.transitiveThreshold", transitiveThreshold);
        }
    }

    /**
     * License compliance settings.
     *
     * @param defaultTarget project license used when a job names none, default MIT
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LicenseSettings(
        @JsonProperty("defaultTarget") String defaultTarget
    ) {
        public LicenseSettings {
            if (defaultTarget == null || defaultTarget.isBlank()) {
                defaultTarget = "MIT";
            }
        }
    }

    /**
     * Performance profiling settings.
     *
     * @param defaultProfile {@code bundle_size} or {@code runtime}, default bundle_size
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PerformanceSettings(
        @JsonProperty("defaultProfile") String defaultProfile
    ) {
        public PerformanceSettings {
            if (defaultProfile == null || defaultProfile.isBlank()) {
                defaultProfile = "bundle_size";
            }
        }
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new InvalidConfigurationException(key + " must be positive: " + value);
        }
    }
}
