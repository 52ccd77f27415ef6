/* (C)2026 */
package com.ammann.updatetracker.cache;

import static com.ammann.updatetracker.support.Injection.injectField;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.ammann.updatetracker.support.TestTrackerConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("CacheRepositoryProducer")
class CacheRepositoryProducerTest {

    CacheRepositoryProducer producer;
    TestTrackerConfig config;

    @BeforeEach
    void setUp() {
        config = new TestTrackerConfig();
        producer = new CacheRepositoryProducer();
        injectField(producer, "config", config);
        injectField(producer, "objectMapper", new ObjectMapper().findAndRegisterModules());
        injectField(producer, "logger", mock(Logger.class));
    }

    @Test
    @DisplayName("should keep entries in memory without cache directory")
    void shouldKeepEntriesInMemory() {
        assertThat(producer.cacheRepository()).isInstanceOf(InMemoryCacheRepository.class);

        config.cacheDirectory = " ";
        assertThat(producer.cacheRepository()).isInstanceOf(InMemoryCacheRepository.class);
    }

    @Test
    @DisplayName("should persist entries to the configured directory")
    void shouldPersistEntriesToDirectory(@TempDir Path directory) {
        config.cacheDirectory = directory.toString();

        assertThat(producer.cacheRepository()).isInstanceOf(FileCacheRepository.class);
    }
}
