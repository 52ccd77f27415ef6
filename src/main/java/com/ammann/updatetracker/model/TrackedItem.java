/* (C)2026 */
package com.ammann.updatetracker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * A container tracked on one of the configured container hosts.
 *
 * <p>Identity, topology and current-image fields come from the container host; the
 * {@code latest*} fields come from the last registry check and are only meaningful together
 * with {@link #registryCheckedAt()}. Whether an update is available is never stored: it is
 * derived from the digests on every read, and a {@code hasUpdate} flag persisted by an older
 * cache format is ignored when deserializing.
 *
 * @param id                the container identifier reported by the host
 * @param instance          the name of the container host the container runs on
 * @param name              the container name without leading slash
 * @param image             the image reference the container was created from
 * @param ownerGroupKey     the stack the container belongs to, may be {@code null}
 * @param state             the container state (e.g. "running", "exited")
 * @param status            the human-readable status (e.g. "Up 5 hours")
 * @param currentDigest     the registry digest of the image the container runs
 * @param currentTag        the tag of the image the container runs
 * @param repoDigests       all repo digests of the local image, used for multi-arch matching
 * @param latestDigest      the digest the registry reports for the tag
 * @param latestTag         the tag the registry check resolved
 * @param registryCheckedAt when the registry data above was obtained, {@code null} if it was not
 * @param providesNetwork   whether other containers share this container's network namespace
 * @param usesNetworkMode   whether this container runs in another container's network namespace
 */
@JsonIgnoreProperties(
        value = {"hasUpdateAvailable"},
        allowGetters = true,
        ignoreUnknown = true)
public record TrackedItem(
        String id,
        String instance,
        String name,
        String image,
        String ownerGroupKey,
        String state,
        String status,
        String currentDigest,
        String currentTag,
        List<String> repoDigests,
        String latestDigest,
        String latestTag,
        Instant registryCheckedAt,
        Boolean providesNetwork,
        Boolean usesNetworkMode) {

    public TrackedItem {
        repoDigests = repoDigests == null ? List.of() : List.copyOf(repoDigests);
    }

    /**
     * Computes whether a newer image is available from the freshest digest and tag fields.
     *
     * <p>The latest digest appearing among the local repo digests means the container already
     * runs it (multi-arch images carry several). Otherwise differing digests mean an update.
     * Without both digests, differing tags (ignoring a leading {@code v}) mean an update.
     *
     * @return {@code true} if an update is available
     */
    @JsonProperty("hasUpdateAvailable")
    public boolean hasUpdateAvailable() {
        String latest = Digests.normalize(latestDigest);
        String current = Digests.normalize(currentDigest);

        if (latest != null && current != null) {
            for (String repoDigest : repoDigests) {
                if (latest.equals(Digests.normalize(repoDigest))) {
                    return false;
                }
            }
            return !latest.equals(current);
        }

        String latestVersion = normalizeTag(latestTag);
        String currentVersion = normalizeTag(currentTag);
        if (latestVersion != null && currentVersion != null) {
            return !latestVersion.equals(currentVersion);
        }
        return false;
    }

    /** Returns whether this record carries the result of a registry check. */
    public boolean hasRegistryData() {
        return registryCheckedAt != null;
    }

    /** Returns whether both topology flags are known. */
    public boolean hasTopologyFlags() {
        return providesNetwork != null && usesNetworkMode != null;
    }

    /**
     * Returns a copy carrying a successful registry result.
     *
     * @param digest    the digest reported by the registry
     * @param tag       the tag that was resolved
     * @param checkedAt when the check ran
     * @return the updated item
     */
    public TrackedItem withRegistryResult(String digest, String tag, Instant checkedAt) {
        return new TrackedItem(
                id,
                instance,
                name,
                image,
                ownerGroupKey,
                state,
                status,
                currentDigest,
                currentTag,
                repoDigests,
                digest,
                tag,
                checkedAt,
                providesNetwork,
                usesNetworkMode);
    }

    /**
     * Returns a copy whose registry data says the image cannot be tracked: the check ran but
     * produced no digest, so no update is reported.
     *
     * @param checkedAt when the check ran
     * @return the updated item
     */
    public TrackedItem asUntrackable(Instant checkedAt) {
        return withRegistryResult(null, null, checkedAt);
    }

    /**
     * Returns a copy that takes its registry fields from {@code source}, leaving every other
     * field as it is.
     *
     * @param source the item whose registry data is carried over
     * @return the updated item
     */
    public TrackedItem withRegistryDataFrom(TrackedItem source) {
        return withRegistryResult(
                source.latestDigest(), source.latestTag(), source.registryCheckedAt());
    }

    /**
     * Returns a copy running a different container and image, as after an upgrade.
     *
     * @param newId          the new container identifier
     * @param newDigest      the digest of the image now running
     * @param newRepoDigests the repo digests of the image now running
     * @return the updated item
     */
    public TrackedItem withCurrentImage(
            String newId, String newDigest, List<String> newRepoDigests) {
        return new TrackedItem(
                newId,
                instance,
                name,
                image,
                ownerGroupKey,
                state,
                status,
                newDigest,
                currentTag,
                newRepoDigests,
                latestDigest,
                latestTag,
                registryCheckedAt,
                providesNetwork,
                usesNetworkMode);
    }

    private static String normalizeTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return null;
        }
        String value = tag.trim().toLowerCase(Locale.ROOT);
        return value.startsWith("v") ? value.substring(1) : value;
    }
}
