/* (C)2026 */
package com.ammann.updatetracker.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parsed form of a Docker image reference such as {@code ghcr.io/org/app:1.2}.
 *
 * <p>References without an explicit registry host resolve to Docker Hub, and single-segment
 * Docker Hub repositories are placed under {@code library/} so that {@code nginx} and
 * {@code docker.io/library/nginx} compare equal.
 *
 * @param registry   the registry host (e.g. {@code docker.io}, {@code localhost:5000})
 * @param repository the repository path inside the registry
 * @param tag        the tag, {@code latest} when none was given
 * @param digest     the pinned digest of an {@code @sha256:...} reference, otherwise {@code null}
 */
public record ImageReference(String registry, String repository, String tag, String digest) {

    public static final String DOCKER_HUB = "docker.io";
    public static final String DEFAULT_TAG = "latest";

    private static final Pattern IMAGE_ID_PATTERN = Pattern.compile("^(sha256:)?[a-f0-9]{12,64}$");

    /**
     * Parses an image reference.
     *
     * @param reference the image reference (name, optional tag, optional digest)
     * @return the parsed reference
     * @throws IllegalArgumentException if the reference is blank
     */
    public static ImageReference parse(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Image reference must not be blank");
        }

        String remainder = reference.trim();
        String digest = null;
        int at = remainder.indexOf('@');
        if (at >= 0) {
            digest = remainder.substring(at + 1);
            remainder = remainder.substring(0, at);
        }

        // A colon after the last slash separates the tag; earlier colons belong to a registry port
        String tag = null;
        int lastColon = remainder.lastIndexOf(':');
        if (lastColon > remainder.lastIndexOf('/')) {
            tag = remainder.substring(lastColon + 1);
            remainder = remainder.substring(0, lastColon);
        }

        String registry = DOCKER_HUB;
        String[] parts = remainder.split("/", 2);
        if (parts.length == 2 && isRegistryHost(parts[0])) {
            registry = parts[0].toLowerCase(Locale.ROOT);
            remainder = parts[1];
        }
        if ("index.docker.io".equals(registry) || "registry-1.docker.io".equals(registry)) {
            registry = DOCKER_HUB;
        }
        if (DOCKER_HUB.equals(registry) && !remainder.contains("/")) {
            remainder = "library/" + remainder;
        }

        return new ImageReference(registry, remainder, tag == null ? DEFAULT_TAG : tag, digest);
    }

    /**
     * Determines whether the given reference is a bare image identifier rather than a name.
     * Containers whose image was deleted or re-tagged report such identifiers and cannot be
     * checked against a registry.
     *
     * @param reference the image reference as reported by the container host
     * @return {@code true} if the reference is an image identifier
     */
    public static boolean isImageId(String reference) {
        return reference != null
                && IMAGE_ID_PATTERN.matcher(reference.trim().toLowerCase(Locale.ROOT)).matches();
    }

    /** Returns {@code registry/repository}, the form used to compare repo digests. */
    public String canonicalName() {
        return registry + "/" + repository;
    }

    /**
     * Checks whether a {@code RepoDigests} entry (e.g. {@code nginx@sha256:...}) belongs to this
     * image's repository.
     *
     * @param repoDigest an entry of the image's repo digests
     * @return {@code true} if the entry names the same repository
     */
    public boolean ownsRepoDigest(String repoDigest) {
        if (repoDigest == null || !repoDigest.contains("@")) {
            return false;
        }
        String name = repoDigest.substring(0, repoDigest.indexOf('@'));
        return !name.isBlank() && parse(name).canonicalName().equals(canonicalName());
    }

    /**
     * Picks the digest of this image from an image's repo digests: the entry belonging to this
     * repository, otherwise the first entry.
     *
     * @param repoDigests the repo digests of a local image
     * @return the digest, empty if the image has none (it was built locally, never pulled)
     */
    public Optional<String> digestIn(List<String> repoDigests) {
        if (repoDigests == null || repoDigests.isEmpty()) {
            return Optional.empty();
        }
        return repoDigests.stream()
                .filter(this::ownsRepoDigest)
                .findFirst()
                .or(() -> Optional.of(repoDigests.get(0)))
                .map(Digests::digestOf);
    }

    private static boolean isRegistryHost(String segment) {
        // Registry prefixes contain a dot (ghcr.io, docker.io) or port (localhost:5000)
        return segment.contains(".") || segment.contains(":") || "localhost".equals(segment);
    }
}
