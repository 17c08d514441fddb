package com.threatsentinel.core.config;

import com.threatsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SiemConfigLoader}.
 */
class SiemConfigLoaderTest {

    @Test
    @DisplayName("Should load the bundled configuration with documented defaults")
    void shouldLoadBundledConfig() {
        SiemConfig config = SiemConfigLoader.fromClasspath(SiemConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getAlertThresholds()).containsKeys(SiemConfig.AUTH_FAILURES,
                SiemConfig.PRIVILEGE_ESCALATION, SiemConfig.MALICIOUS_IP, SiemConfig.DATA_EXFILTRATION,
                SiemConfig.ABNORMAL_ACCESS);
        assertThat(config.getAlertThresholds().get(SiemConfig.DATA_EXFILTRATION).getThreshold())
                .isEqualTo(10_485_760L);
        assertThat(config.getLogRetentionDays()).isEqualTo(90);
        assertThat(config.getMaxEventsInMemory()).isEqualTo(10_000);
        assertThat(config.recipientsFor(Severity.LOW)).isEmpty();
        assertThat(config.recipientsFor(Severity.CRITICAL)).hasSize(2);
    }

    @Test
    @DisplayName("Should load a custom configuration from classpath")
    void shouldLoadCustomConfig() {
        SiemConfig config = SiemConfigLoader.fromClasspath("test-siem.yml");

        AlertThreshold auth = config.getAlertThresholds().get(SiemConfig.AUTH_FAILURES);
        assertThat(auth.getThreshold()).isEqualTo(3);
        assertThat(auth.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(config.getBlacklistedIps()).containsExactly("203.0.113.7");
        assertThat(config.getLogRetentionDays()).isEqualTo(7);
        assertThat(config.getMaxEventsInMemory()).isEqualTo(500);
        assertThat(config.recipientsFor(Severity.HIGH)).containsExactly("team@example.com");
        assertThat(config.recipientsFor(Severity.MEDIUM)).isEmpty();
    }

    @Test
    @DisplayName("Should collect every configuration error")
    void shouldRejectInvalidConfig() {
        assertThatThrownBy(() -> SiemConfigLoader.fromClasspath("invalid-siem.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unknown notification tier 'URGENT'")
                .hasMessageContaining("'logRetentionDays' must be > 0");
    }

    @Test
    @DisplayName("Should merge a comma-separated blacklist without duplicates")
    void shouldMergeBlacklist() {
        SiemConfig config = SiemConfigLoader.fromClasspath("test-siem.yml");

        SiemConfigLoader.mergeBlacklist(config, " 198.51.100.1, 203.0.113.7 ,,198.51.100.2");

        assertThat(config.getBlacklistedIps())
                .containsExactly("203.0.113.7", "198.51.100.1", "198.51.100.2");
    }

    @Test
    @DisplayName("Should ignore an absent blacklist variable")
    void shouldIgnoreBlankBlacklist() {
        SiemConfig config = SiemConfig.defaults();

        SiemConfigLoader.mergeBlacklist(config, null);
        SiemConfigLoader.mergeBlacklist(config, "  ");

        assertThat(config.getBlacklistedIps()).isEmpty();
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> SiemConfigLoader.fromClasspath("no-such-siem.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
