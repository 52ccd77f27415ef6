/* (C)2026 */
package com.ammann.updatetracker.health;

import static com.ammann.updatetracker.support.Injection.injectField;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.updatetracker.cache.CacheStore;
import com.ammann.updatetracker.model.CacheEntry;
import com.ammann.updatetracker.model.CacheMetadata;
import com.ammann.updatetracker.model.ContainerPayload;
import com.ammann.updatetracker.ratelimit.RateGate;
import com.ammann.updatetracker.service.UpdateOrchestrator;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("UpdatePipelineHealthCheck")
class UpdatePipelineHealthCheckTest {

    UpdatePipelineHealthCheck healthCheck;
    RateGate rateGate;
    CacheStore cacheStore;
    UpdateOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        rateGate = mock(RateGate.class);
        cacheStore = mock(CacheStore.class);
        orchestrator = mock(UpdateOrchestrator.class);

        healthCheck = new UpdatePipelineHealthCheck();
        injectField(healthCheck, "rateGate", rateGate);
        injectField(healthCheck, "cacheStore", cacheStore);
        injectField(healthCheck, "orchestrator", orchestrator);
    }

    @Test
    @DisplayName("should stay up while the breaker is open")
    void shouldStayUpWhileBreakerOpen() {
        when(rateGate.isOpen()).thenReturn(true);
        when(rateGate.consecutiveFailures()).thenReturn(5);
        when(cacheStore.get(UpdateOrchestrator.CONTAINERS_KEY)).thenReturn(Optional.empty());

        HealthCheckResponse response = healthCheck.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).isPresent();
        assertThat(response.getData().get())
                .containsEntry("rateLimitBreakerOpen", true)
                .containsEntry("consecutiveRateLimitFailures", 5L)
                .doesNotContainKey("lastCheapRefresh");
    }

    @Test
    @DisplayName("should report the refresh timestamps")
    void shouldReportRefreshTimestamps() {
        Instant at = Instant.parse("2026-07-01T12:00:00Z");
        when(cacheStore.get(UpdateOrchestrator.CONTAINERS_KEY))
                .thenReturn(
                        Optional.of(
                                CacheEntry.of(
                                        UpdateOrchestrator.CONTAINERS_KEY,
                                        new ContainerPayload(List.of(), Map.of()),
                                        CacheMetadata.full(at))));

        Map<String, Object> data = healthCheck.call().getData().orElseThrow();

        assertThat(data)
                .containsEntry("lastCheapRefresh", at.toString())
                .containsEntry("lastExpensiveRefresh", at.toString())
                .containsEntry("refreshRunning", false);
    }
}
