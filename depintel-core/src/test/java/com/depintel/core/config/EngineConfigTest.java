package com.depintel.core.config;

import com.depintel.core.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @Test
    void defaults_matchDocumentedValues() {
        EngineConfig config = EngineConfig.defaults();

        assertThat(config.engine().maxConcurrentJobsPerProject()).isEqualTo(5);
        assertThat(config.engine().jobTimeout()).isEqualTo(Duration.ofSeconds(300));
        assertThat(config.graph().maxDepth()).isEqualTo(4);
        assertThat(config.graph().allowPartialMetadata()).isFalse();
        assertThat(config.impact().weights().businessValue()).isEqualTo(0.35);
        assertThat(config.impact().weights().usage()).isEqualTo(0.25);
        assertThat(config.impact().weights().complexity()).isEqualTo(0.15);
        assertThat(config.impact().weights().health()).isEqualTo(0.25);
        assertThat(config.compatibility().historyWindow()).isEqualTo(10);
        assertThat(config.consolidation().transitiveThreshold()).isEqualTo(3);
        assertThat(config.license().defaultTarget()).isEqualTo("MIT");
        assertThat(config.performance().defaultProfile()).isEqualTo("bundle_size");
    }

    @Test
    void impactWeights_negative_throwsInvalidConfiguration() {
        assertThatThrownBy(() -> new EngineConfig.ImpactWeights(1.2, -0.2, 0.0, 0.0))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("negative");
    }

    @Test
    void impactWeights_sumWithinTolerance_isAccepted() {
        EngineConfig.ImpactWeights weights = new EngineConfig.ImpactWeights(0.1, 0.2, 0.3, 0.4000000001);

        assertThat(weights.health()).isEqualTo(0.4000000001);
    }

    @Test
    void engineSettings_zeroTimeout_throwsInvalidConfiguration() {
        assertThatThrownBy(() -> new EngineConfig.EngineSettings(5, 0L, 4))
            .isInstanceOf(InvalidConfigurationException.class)
            .satisfies(e -> assertThat(((InvalidConfigurationException) e).getErrorCode())
                .isEqualTo("INVALID_CONFIGURATION"));
    }

    @Test
    void compatibilitySettings_historyWindowBelowTwo_throwsInvalidConfiguration() {
        assertThatThrownBy(() -> new EngineConfig.CompatibilitySettings(180, 1, 1.0))
            .isInstanceOf(InvalidConfigurationException.class);
    }
}
