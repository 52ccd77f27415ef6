package com.ammann.updatetracker.health;

import com.ammann.updatetracker.cache.CacheStore;
import com.ammann.updatetracker.model.CacheEntry;
import com.ammann.updatetracker.model.CacheMetadata;
import com.ammann.updatetracker.ratelimit.RateGate;
import com.ammann.updatetracker.service.UpdateOrchestrator;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * MicroProfile Health readiness probe for the update pipeline.
 *
 * <p>Always reports up: an open rate limit breaker or an unreachable container host degrades
 * answers but the cached view stays available. The data lists the breaker state and when the
 * containers and the registry were last consulted.
 */
@Readiness
public class UpdatePipelineHealthCheck implements HealthCheck {

    @Inject RateGate rateGate;

    @Inject CacheStore cacheStore;

    @Inject UpdateOrchestrator orchestrator;

    @Override
    public HealthCheckResponse call() {
        CacheMetadata metadata =
                cacheStore
                        .get(UpdateOrchestrator.CONTAINERS_KEY)
                        .map(CacheEntry::metadata)
                        .orElse(CacheMetadata.empty());

        HealthCheckResponseBuilder builder =
                HealthCheckResponse.named("update-pipeline")
                        .up()
                        .withData("rateLimitBreakerOpen", rateGate.isOpen())
                        .withData("consecutiveRateLimitFailures", rateGate.consecutiveFailures())
                        .withData("refreshRunning", orchestrator.isRefreshRunning());
        if (metadata.lastCheapRefresh() != null) {
            builder.withData("lastCheapRefresh", metadata.lastCheapRefresh().toString());
        }
        if (metadata.lastExpensiveRefresh() != null) {
            builder.withData("lastExpensiveRefresh", metadata.lastExpensiveRefresh().toString());
        }
        return builder.build();
    }
}
