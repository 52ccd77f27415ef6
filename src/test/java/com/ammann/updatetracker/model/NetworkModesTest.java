/* (C)2026 */
package com.ammann.updatetracker.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("NetworkModes")
class NetworkModesTest {

    private static final String VPN_ID =
            "4f1c2a9e7b3d5a6c8e0f1a2b3c4d5e6f7a8b9c0d1e2f3a4b5c6d7e8f9a0b1c2d";

    @ParameterizedTest
    @ValueSource(strings = {"bridge", "host", "none", "my-network"})
    @DisplayName("should not target a container for ordinary network modes")
    void shouldNotTargetContainer(String mode) {
        assertThat(NetworkModes.targetOf(mode)).isNull();
        assertThat(NetworkModes.isShared(mode)).isFalse();
    }

    @Test
    @DisplayName("should extract the target of container and service modes")
    void shouldExtractTarget() {
        assertThat(NetworkModes.targetOf("container:vpn")).isEqualTo("vpn");
        assertThat(NetworkModes.targetOf("service:web")).isEqualTo("web");
        assertThat(NetworkModes.isShared(null)).isFalse();
    }

    @Test
    @DisplayName("should match a container by name, full id or short id")
    void shouldMatchContainer() {
        assertThat(NetworkModes.targets("container:vpn", VPN_ID, "vpn")).isTrue();
        assertThat(NetworkModes.targets("service:vpn", VPN_ID, "vpn")).isTrue();
        assertThat(NetworkModes.targets("container:" + VPN_ID, VPN_ID, "vpn")).isTrue();
        assertThat(NetworkModes.targets("container:4f1c2a9e7b3d", VPN_ID, "vpn")).isTrue();
        assertThat(NetworkModes.targets("container:proxy", VPN_ID, "vpn")).isFalse();
        assertThat(NetworkModes.targets("bridge", VPN_ID, "vpn")).isFalse();
    }

    @Test
    @DisplayName("should build the mode joining a container")
    void shouldBuildJoiningMode() {
        assertThat(NetworkModes.joining("abc")).isEqualTo("container:abc");
    }
}
