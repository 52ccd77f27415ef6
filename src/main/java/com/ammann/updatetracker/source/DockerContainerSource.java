/* (C)2026 */
package com.ammann.updatetracker.source;

import com.ammann.updatetracker.config.DockerClientRegistry;
import com.ammann.updatetracker.exception.SourceUnavailableException;
import com.ammann.updatetracker.model.Digests;
import com.ammann.updatetracker.model.ImageReference;
import com.ammann.updatetracker.model.NetworkModes;
import com.ammann.updatetracker.model.TrackedItem;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.Image;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Lists containers through the Docker API of each configured instance.
 *
 * <p>Besides identity and state, each container gets its stack (from the compose project or
 * swarm stack namespace label), its network topology flags, and the digests of the image it
 * runs. Images that no container uses are counted per instance.
 */
@ApplicationScoped
public class DockerContainerSource implements ContainerSource {

    static final String COMPOSE_PROJECT_LABEL = "com.docker.compose.project";
    static final String STACK_NAMESPACE_LABEL = "com.docker.stack.namespace";

    private static final int SHORT_ID_LENGTH = 12;

    @Inject DockerClientRegistry clientRegistry;

    @Inject Logger logger;

    @Override
    public List<String> instances() {
        return clientRegistry.instanceNames();
    }

    @Override
    public ContainerSnapshot listCurrent(String scope) {
        List<String> instances;
        if (scope == null) {
            instances = clientRegistry.instanceNames();
        } else {
            clientRegistry.clientFor(scope);
            instances = List.of(scope);
        }

        List<TrackedItem> items = new ArrayList<>();
        Map<String, Integer> unused = new HashMap<>();
        Set<String> listed = new LinkedHashSet<>();
        RuntimeException lastFailure = null;

        for (String instance : instances) {
            try {
                DockerClient client = clientRegistry.clientFor(instance);
                List<Container> containers = client.listContainersCmd().withShowAll(true).exec();
                List<Image> images = client.listImagesCmd().exec();

                items.addAll(mapContainers(instance, containers, images));
                unused.put(instance, countUnusedImages(containers, images));
                listed.add(instance);
                logger.debugf("Listed %d containers on %s", containers.size(), instance);
            } catch (RuntimeException e) {
                lastFailure = e;
                logger.warnf(e, "Unable to list containers on instance %s", instance);
            }
        }

        if (listed.isEmpty() && !instances.isEmpty()) {
            throw new SourceUnavailableException(
                    "No container host could be reached: " + String.join(", ", instances),
                    lastFailure);
        }
        return new ContainerSnapshot(items, unused, listed);
    }

    private List<TrackedItem> mapContainers(
            String instance, List<Container> containers, List<Image> images) {
        Map<String, Image> imagesById = new HashMap<>();
        for (Image image : images) {
            imagesById.put(image.getId(), image);
        }

        Set<String> networkTargets = new HashSet<>();
        for (Container container : containers) {
            String target = NetworkModes.targetOf(networkMode(container));
            if (target != null) {
                networkTargets.add(target);
            }
        }

        List<TrackedItem> items = new ArrayList<>(containers.size());
        for (Container container : containers) {
            String name = containerName(container);
            Image image = imagesById.get(container.getImageId());
            List<String> repoDigests =
                    image != null && image.getRepoDigests() != null
                            ? Arrays.asList(image.getRepoDigests())
                            : List.of();

            items.add(
                    new TrackedItem(
                            container.getId(),
                            instance,
                            name,
                            container.getImage(),
                            stackOf(container),
                            container.getState(),
                            container.getStatus(),
                            currentDigest(container, repoDigests),
                            currentTag(container.getImage()),
                            repoDigests,
                            null,
                            null,
                            null,
                            providesNetwork(container, name, networkTargets),
                            NetworkModes.isShared(networkMode(container))));
        }
        return items;
    }

    private int countUnusedImages(List<Container> containers, List<Image> images) {
        Set<String> used = new HashSet<>();
        for (Container container : containers) {
            used.add(container.getImageId());
        }
        return (int) images.stream().filter(image -> !used.contains(image.getId())).count();
    }

    /** Returns the stack a container belongs to, or {@code null} if it runs standalone. */
    static String stackOf(Container container) {
        Map<String, String> labels = container.getLabels();
        if (labels == null) {
            return null;
        }
        String project = labels.get(COMPOSE_PROJECT_LABEL);
        if (project != null && !project.isBlank()) {
            return project;
        }
        String namespace = labels.get(STACK_NAMESPACE_LABEL);
        return namespace != null && !namespace.isBlank() ? namespace : null;
    }

    private static boolean providesNetwork(
            Container container, String name, Set<String> networkTargets) {
        String id = container.getId();
        if (networkTargets.contains(name) || networkTargets.contains(id)) {
            return true;
        }
        return id != null
                && id.length() >= SHORT_ID_LENGTH
                && networkTargets.contains(id.substring(0, SHORT_ID_LENGTH));
    }

    private static String networkMode(Container container) {
        return container.getHostConfig() != null
                ? container.getHostConfig().getNetworkMode()
                : null;
    }

    private static String containerName(Container container) {
        String[] names = container.getNames();
        if (names == null || names.length == 0) {
            return container.getId();
        }
        String name = names[0];
        return name.startsWith("/") ? name.substring(1) : name;
    }

    /**
     * Picks the digest the container runs: the repo digest of its image, or the local image id
     * for images that were never pulled.
     */
    private static String currentDigest(Container container, List<String> repoDigests) {
        String image = container.getImage();
        if (image == null || image.isBlank() || ImageReference.isImageId(image)) {
            return repoDigests.isEmpty()
                    ? container.getImageId()
                    : Digests.digestOf(repoDigests.get(0));
        }
        return ImageReference.parse(image)
                .digestIn(repoDigests)
                .orElse(container.getImageId());
    }

    private static String currentTag(String image) {
        if (image == null || image.isBlank() || ImageReference.isImageId(image)) {
            return null;
        }
        return ImageReference.parse(image).tag();
    }
}
