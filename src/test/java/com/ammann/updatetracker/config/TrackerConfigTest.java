/* (C)2026 */
package com.ammann.updatetracker.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.updatetracker.support.TestTrackerConfig;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("TrackerConfig")
class TrackerConfigTest {

    @Nested
    @DisplayName("Upgrade.isBlacklisted")
    class IsBlacklisted {

        @ParameterizedTest
        @ValueSource(strings = {"abc123", "traefik", "traefik:v3.1"})
        @DisplayName("should match id, name or image")
        void shouldMatchIdNameOrImage(String entry) {
            TestTrackerConfig config = new TestTrackerConfig();
            config.blacklist = new HashSet<>(Set.of(entry));

            assertThat(config.upgrade().isBlacklisted("abc123", "traefik", "traefik:v3.1"))
                    .isTrue();
        }

        @Test
        @DisplayName("should not match other containers")
        void shouldNotMatchOtherContainers() {
            TestTrackerConfig config = new TestTrackerConfig();
            config.blacklist = new HashSet<>(Set.of("traefik"));

            assertThat(config.upgrade().isBlacklisted("def456", "web", "nginx:1.25")).isFalse();
        }

        @Test
        @DisplayName("should allow everything without blacklist")
        void shouldAllowEverythingWithoutBlacklist() {
            assertThat(new TestTrackerConfig().upgrade().isBlacklisted("abc", "web", "nginx"))
                    .isFalse();
        }
    }
}
