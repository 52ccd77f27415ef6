/* (C)2026 */
package com.ammann.updatetracker.config;

import com.ammann.updatetracker.exception.UnknownInstanceException;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;

/**
 * Holds one Docker API client per configured container host.
 *
 * <p>Clients are created lazily with an Apache HTTP transport. Without configured instances a
 * single {@value #DEFAULT_INSTANCE} instance is tracked, using the default Docker environment
 * (typically the local Unix socket).
 */
@ApplicationScoped
public class DockerClientRegistry {

    public static final String DEFAULT_INSTANCE = "local";

    @Inject TrackerConfig config;

    @Inject Logger logger;

    private final Map<String, DockerClient> clients = new ConcurrentHashMap<>();

    /**
     * Returns the names of all tracked instances in a stable order.
     *
     * @return the instance names
     */
    public List<String> instanceNames() {
        if (config.instances().isEmpty()) {
            return List.of(DEFAULT_INSTANCE);
        }
        return config.instances().keySet().stream().sorted().toList();
    }

    /**
     * Returns the client for an instance, creating it on first use.
     *
     * @param instance the instance name
     * @return the Docker client
     * @throws UnknownInstanceException if no such instance is configured
     */
    public DockerClient clientFor(String instance) {
        if (!instanceNames().contains(instance)) {
            throw new UnknownInstanceException(instance);
        }
        return clients.computeIfAbsent(instance, this::createClient);
    }

    private DockerClient createClient(String instance) {
        Optional<String> host =
                Optional.ofNullable(config.instances().get(instance))
                        .flatMap(TrackerConfig.Instance::host);

        DefaultDockerClientConfig.Builder configBuilder =
                DefaultDockerClientConfig.createDefaultConfigBuilder();
        host.ifPresent(configBuilder::withDockerHost);
        DockerClientConfig clientConfig = configBuilder.build();

        DockerHttpClient httpClient =
                new ApacheDockerHttpClient.Builder()
                        .dockerHost(clientConfig.getDockerHost())
                        .sslConfig(clientConfig.getSSLConfig())
                        .maxConnections(100)
                        .connectionTimeout(Duration.ofSeconds(30))
                        .responseTimeout(Duration.ofSeconds(45))
                        .build();

        logger.infof(
                "Created Docker client for instance %s (%s)",
                instance, clientConfig.getDockerHost());
        return DockerClientImpl.getInstance(clientConfig, httpClient);
    }

    @PreDestroy
    void close() {
        clients.forEach(
                (instance, client) -> {
                    try {
                        client.close();
                    } catch (IOException e) {
                        logger.warnf(e, "Error closing Docker client for instance %s", instance);
                    }
                });
        clients.clear();
    }
}
