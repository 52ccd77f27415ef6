/* (C)2026 */
package com.ammann.updatetracker.service;

import com.ammann.updatetracker.cache.CacheStore;
import com.ammann.updatetracker.config.DockerClientRegistry;
import com.ammann.updatetracker.config.TrackerConfig;
import com.ammann.updatetracker.exception.ServiceBlacklistedException;
import com.ammann.updatetracker.exception.UpgradeFailedException;
import com.ammann.updatetracker.model.CacheMetadata;
import com.ammann.updatetracker.model.ContainerPayload;
import com.ammann.updatetracker.model.ImageReference;
import com.ammann.updatetracker.model.NetworkModes;
import com.ammann.updatetracker.model.TrackedItem;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerConfig;
import com.github.dockerjava.api.model.ContainerNetwork;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.NetworkSettings;
import com.github.dockerjava.api.model.Ports;
import com.github.dockerjava.api.model.Volume;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Upgrades a container to the latest image of its tag.
 *
 * <p>The container is recreated: the image is pulled, the container stopped and removed, a new
 * container created with the original configuration (environment, labels, ports, volumes,
 * entrypoint, health check, host config), its additional networks reconnected and the new
 * container started. The cached record is then moved to the new container and image, which
 * clears its update flag without another registry check.
 *
 * <p>Running containers that share the upgraded container's network namespace (network mode
 * {@code container:} or {@code service:}) would be left attached to a removed container. They
 * are stopped and removed before it and recreated afterwards, joined to the new container and
 * without published ports.
 */
@ApplicationScoped
public class ContainerUpgradeService {

    @Inject DockerClientRegistry clientRegistry;

    @Inject CacheStore cacheStore;

    @Inject TrackerConfig config;

    @Inject Logger logger;

    /**
     * Upgrades a container.
     *
     * @param instance    the instance the container runs on
     * @param containerId the Docker container identifier
     * @return the identifier of the new container
     * @throws ServiceBlacklistedException if the container is blacklisted
     * @throws UpgradeFailedException      if recreating the container fails
     */
    public String upgrade(String instance, String containerId) {
        DockerClient client = clientRegistry.clientFor(instance);
        InspectContainerResponse containerInfo = client.inspectContainerCmd(containerId).exec();
        String imageName = containerInfo.getConfig().getImage();
        String containerName = stripSlash(containerInfo.getName());

        if (config.upgrade().isBlacklisted(containerId, containerName, imageName)) {
            throw new ServiceBlacklistedException(instance, containerId);
        }

        logger.infof(
                "Upgrading container %s (%s) on %s to latest %s",
                containerName, containerId, instance, imageName);
        List<InspectContainerResponse> dependents =
                findDependents(
                        client,
                        Objects.requireNonNullElse(containerInfo.getId(), containerId),
                        containerName);

        String newContainerId;
        Map<String, String> recreatedDependents;
        try {
            client.pullImageCmd(imageName).exec(new PullImageResultCallback()).awaitCompletion();

            for (InspectContainerResponse dependent : dependents) {
                stopAndRemove(client, dependent.getId(), stripSlash(dependent.getName()));
            }
            stopAndRemove(client, containerId, containerName);

            HostConfig hostConfig = hostConfigFor(containerInfo.getHostConfig(), null);
            newContainerId =
                    recreate(client, containerInfo, imageName, containerName, hostConfig);
            if (!isShared(hostConfig)) {
                reconnectNetworks(client, containerInfo.getNetworkSettings(), newContainerId);
            }
            client.startContainerCmd(newContainerId).exec();
            recreatedDependents = restoreDependents(client, dependents, newContainerId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpgradeFailedException(
                    containerName, "Upgrade of " + containerName + " interrupted", e);
        } catch (RuntimeException e) {
            logger.errorf(e, "Error upgrading container %s", containerName);
            throw new UpgradeFailedException(
                    containerName, "Failed to upgrade container: " + containerName, e);
        }

        logger.infof("Container %s upgraded, new ID %s", containerName, newContainerId);
        recordUpgrade(
                client, instance, containerId, newContainerId, imageName, recreatedDependents);
        return newContainerId;
    }

    /** Running containers whose network mode joins the given container's namespace. */
    private List<InspectContainerResponse> findDependents(
            DockerClient client, String containerId, String containerName) {
        List<InspectContainerResponse> dependents = new ArrayList<>();
        try {
            for (Container container : client.listContainersCmd().exec()) {
                if (Objects.equals(containerId, container.getId())) {
                    continue;
                }
                String networkMode =
                        container.getHostConfig() != null
                                ? container.getHostConfig().getNetworkMode()
                                : null;
                if (NetworkModes.targets(networkMode, containerId, containerName)) {
                    dependents.add(client.inspectContainerCmd(container.getId()).exec());
                }
            }
        } catch (RuntimeException e) {
            logger.warnf(
                    e, "Could not look up containers sharing the network of %s", containerName);
        }
        if (!dependents.isEmpty()) {
            logger.infof(
                    "Containers sharing the network of %s: %s",
                    containerName,
                    dependents.stream().map(d -> stripSlash(d.getName())).toList());
        }
        return dependents;
    }

    private void stopAndRemove(DockerClient client, String containerId, String containerName) {
        try {
            client.stopContainerCmd(containerId).withTimeout(30).exec();
        } catch (NotModifiedException e) {
            logger.debugf("Container %s was already stopped", containerName);
        }
        client.removeContainerCmd(containerId).withForce(true).exec();
    }

    /**
     * Recreates the dependents on the network of the new container. A dependent that cannot be
     * recreated is logged and skipped.
     *
     * @return the new identifier of each recreated dependent, keyed by its old identifier
     */
    private Map<String, String> restoreDependents(
            DockerClient client, List<InspectContainerResponse> dependents, String providerId) {
        Map<String, String> recreated = new LinkedHashMap<>();
        for (InspectContainerResponse dependent : dependents) {
            String name = stripSlash(dependent.getName());
            try {
                HostConfig hostConfig =
                        hostConfigFor(dependent.getHostConfig(), NetworkModes.joining(providerId));
                String newId =
                        recreate(
                                client,
                                dependent,
                                dependent.getConfig().getImage(),
                                name,
                                hostConfig);
                client.startContainerCmd(newId).exec();
                recreated.put(dependent.getId(), newId);
                logger.infof(
                        "Recreated %s on the network of %s, new ID %s", name, providerId, newId);
            } catch (RuntimeException e) {
                logger.errorf(e, "Could not recreate %s after upgrading its network", name);
            }
        }
        return recreated;
    }

    /**
     * Prepares the host config of a recreated container. Port publishing is dropped for shared
     * network modes, the engine refuses it there.
     *
     * @param original    the inspected host config, possibly {@code null}
     * @param networkMode the network mode to set, or {@code null} to keep the original one
     */
    static HostConfig hostConfigFor(HostConfig original, String networkMode) {
        HostConfig hostConfig = original;
        if (hostConfig == null) {
            if (networkMode == null) {
                return null;
            }
            hostConfig = HostConfig.newHostConfig();
        }
        if (networkMode != null) {
            hostConfig.withNetworkMode(networkMode);
        }
        if (isShared(hostConfig)) {
            hostConfig.withPortBindings((Ports) null).withPublishAllPorts(null);
        }
        return hostConfig;
    }

    private static boolean isShared(HostConfig hostConfig) {
        return hostConfig != null && NetworkModes.isShared(hostConfig.getNetworkMode());
    }

    private String recreate(
            DockerClient client,
            InspectContainerResponse containerInfo,
            String imageName,
            String containerName,
            HostConfig hostConfig) {
        CreateContainerCmd createCmd =
                client.createContainerCmd(imageName).withName(containerName);

        ContainerConfig original = containerInfo.getConfig();
        if (original.getEnv() != null) {
            createCmd.withEnv(original.getEnv());
        }
        if (original.getLabels() != null) {
            createCmd.withLabels(original.getLabels());
        }
        if (original.getExposedPorts() != null && !isShared(hostConfig)) {
            createCmd.withExposedPorts(original.getExposedPorts());
        }
        if (original.getCmd() != null) {
            createCmd.withCmd(original.getCmd());
        }
        if (original.getEntrypoint() != null) {
            createCmd.withEntrypoint(original.getEntrypoint());
        }
        if (original.getWorkingDir() != null) {
            createCmd.withWorkingDir(original.getWorkingDir());
        }
        if (original.getUser() != null && !original.getUser().isEmpty()) {
            createCmd.withUser(original.getUser());
        }
        if (original.getVolumes() != null && !original.getVolumes().isEmpty()) {
            createCmd.withVolumes(original.getVolumes().keySet().toArray(new Volume[0]));
        }
        if (original.getHealthcheck() != null) {
            createCmd.withHealthcheck(original.getHealthcheck());
        }
        // Network mode, restart policy, port bindings and mounts
        if (hostConfig != null) {
            createCmd.withHostConfig(hostConfig);
        }
        return createCmd.exec().getId();
    }

    /** Connects networks beyond the primary one, which the host config already covers. */
    private void reconnectNetworks(
            DockerClient client, NetworkSettings networkSettings, String newContainerId) {
        if (networkSettings == null || networkSettings.getNetworks() == null) {
            return;
        }
        Map<String, ContainerNetwork> networks = networkSettings.getNetworks();
        for (Map.Entry<String, ContainerNetwork> network : networks.entrySet()) {
            if ("bridge".equals(network.getKey()) && networks.size() > 1) {
                continue;
            }
            try {
                var connectCmd =
                        client.connectToNetworkCmd()
                                .withContainerId(newContainerId)
                                .withNetworkId(network.getKey());
                if (network.getValue() != null && network.getValue().getAliases() != null) {
                    connectCmd.withContainerNetwork(
                            new ContainerNetwork().withAliases(network.getValue().getAliases()));
                }
                connectCmd.exec();
            } catch (RuntimeException e) {
                logger.debugf(
                        "Network %s already connected or primary: %s",
                        network.getKey(), e.getMessage());
            }
        }
    }

    /**
     * Moves the cached records of the upgraded container and its recreated dependents to their
     * new containers. The cached registry data is kept, so the upgraded record compares the new
     * image against the latest known digest.
     */
    private void recordUpgrade(
            DockerClient client,
            String instance,
            String oldContainerId,
            String newContainerId,
            String imageName,
            Map<String, String> recreatedDependents) {
        List<TrackedItem> cached =
                cacheStore.get(UpdateOrchestrator.CONTAINERS_KEY)
                        .map(entry -> entry.payload().items())
                        .orElse(List.of())
                        .stream()
                        .filter(item -> instance.equals(item.instance()))
                        .toList();

        List<TrackedItem> moved = new ArrayList<>();
        for (TrackedItem item : cached) {
            String newId = recreatedDependents.get(item.id());
            if (newId != null) {
                moved.add(item.withCurrentImage(newId, item.currentDigest(), item.repoDigests()));
            }
        }

        Optional<TrackedItem> upgraded =
                cached.stream().filter(item -> oldContainerId.equals(item.id())).findFirst();
        if (upgraded.isEmpty()) {
            logger.debugf("Container %s not cached, nothing to update", oldContainerId);
        } else {
            try {
                String imageId = client.inspectContainerCmd(newContainerId).exec().getImageId();
                List<String> repoDigests =
                        client.inspectImageCmd(imageId).exec().getRepoDigests();
                List<String> digests = repoDigests != null ? repoDigests : List.of();
                String digest =
                        ImageReference.isImageId(imageName)
                                ? imageId
                                : ImageReference.parse(imageName)
                                        .digestIn(digests)
                                        .orElse(imageId);
                moved.add(upgraded.get().withCurrentImage(newContainerId, digest, digests));
            } catch (RuntimeException e) {
                logger.warnf(
                        e, "Upgraded %s but could not update its cached record", newContainerId);
            }
        }

        if (!moved.isEmpty()) {
            cacheStore.merge(
                    UpdateOrchestrator.CONTAINERS_KEY,
                    new ContainerPayload(moved, Map.of()),
                    CacheMetadata.empty());
        }
    }

    private static String stripSlash(String name) {
        return name != null && name.startsWith("/") ? name.substring(1) : name;
    }
}
