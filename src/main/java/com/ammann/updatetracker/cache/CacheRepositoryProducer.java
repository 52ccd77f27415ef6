/* (C)2026 */
package com.ammann.updatetracker.cache;

import com.ammann.updatetracker.config.TrackerConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.nio.file.Path;
import org.jboss.logging.Logger;

/**
 * CDI producer for the {@link CacheRepository}: file-backed when {@code tracker.cache.directory}
 * is set, in-memory otherwise.
 */
@ApplicationScoped
public class CacheRepositoryProducer {

    @Inject TrackerConfig config;

    @Inject ObjectMapper objectMapper;

    @Inject Logger logger;

    @Produces
    @ApplicationScoped
    public CacheRepository cacheRepository() {
        return config.cache()
                .directory()
                .filter(dir -> !dir.isBlank())
                .<CacheRepository>map(
                        dir -> {
                            logger.infof("Persisting cache entries to %s", dir);
                            return new FileCacheRepository(Path.of(dir), objectMapper);
                        })
                .orElseGet(
                        () -> {
                            logger.info("Keeping cache entries in memory");
                            return new InMemoryCacheRepository();
                        });
    }
}
