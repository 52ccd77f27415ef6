/* (C)2026 */
package com.ammann.updatetracker.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration mapping for the update tracker, sourced from the {@code tracker.*} properties.
 */
@ConfigMapping(prefix = "tracker")
public interface TrackerConfig {

    /**
     * Container hosts to track, keyed by instance name. When none are configured a single
     * {@code local} instance using the default Docker environment is tracked.
     */
    Map<String, Instance> instances();

    Gate rateGate();

    Refresh refresh();

    Cache cache();

    Scheduler scheduler();

    /** Batch jobs keyed by job type (e.g. {@code registry-check}). */
    Map<String, Job> jobs();

    Upgrade upgrade();

    interface Instance {

        /** Docker host URI, e.g. {@code tcp://10.0.0.5:2375}; the default environment if absent. */
        Optional<String> host();
    }

    interface Gate {

        /** Minimum time between two registry calls. */
        @WithDefault("1000")
        long minSpacingMs();

        /** Rate-limit failures within {@link #failureWindow()} that open the breaker. */
        @WithDefault("5")
        int failureThreshold();

        @WithDefault("60s")
        Duration failureWindow();
    }

    interface Refresh {

        /** Registry checks running in parallel during a full refresh. */
        @WithDefault("4")
        int fanOut();

        /** Time after which a single registry check counts as failed. */
        @WithDefault("2m")
        Duration itemTimeout();
    }

    interface Cache {

        /** Directory holding one JSON file per cache key; in-memory cache if absent. */
        Optional<String> directory();
    }

    interface Scheduler {

        @WithDefault("30s")
        String pollInterval();

        /** Delay before a failed scheduled run is attempted again. */
        @WithDefault("1m")
        Duration retryAfterFailure();
    }

    interface Job {

        @WithDefault("true")
        boolean enabled();

        Optional<Integer> intervalMinutes();

        Optional<String> description();
    }

    interface Upgrade {

        /**
         * Container identifiers, names or image references that must never be upgraded.
         *
         * @return an optional set of blacklisted values, empty if none are configured
         */
        @WithName("blacklist")
        @WithDefault("")
        Optional<Set<String>> blacklist();

        /**
         * Determines whether a container is blacklisted by checking its identifier, name,
         * and image name against the configured blacklist entries.
         *
         * @param containerId   the Docker container identifier
         * @param containerName the container name
         * @param imageName     the image reference (including tag)
         * @return {@code true} if any of the provided values appear in the blacklist
         */
        default boolean isBlacklisted(String containerId, String containerName, String imageName) {
            return blacklist()
                    .map(
                            set ->
                                    set.contains(containerId)
                                            || set.contains(containerName)
                                            || set.contains(imageName))
                    .orElse(false);
        }
    }
}
