/* (C)2026 */
package com.ammann.updatetracker.service;

import com.ammann.updatetracker.cache.CacheStore;
import com.ammann.updatetracker.config.TrackerConfig;
import com.ammann.updatetracker.dto.ContainerOverviewDTO;
import com.ammann.updatetracker.exception.RateLimitExceededException;
import com.ammann.updatetracker.exception.RefreshInProgressException;
import com.ammann.updatetracker.exception.SourceUnavailableException;
import com.ammann.updatetracker.exception.UnknownInstanceException;
import com.ammann.updatetracker.ledger.RunLedger;
import com.ammann.updatetracker.model.CacheEntry;
import com.ammann.updatetracker.model.CacheMetadata;
import com.ammann.updatetracker.model.ContainerPayload;
import com.ammann.updatetracker.model.ImageReference;
import com.ammann.updatetracker.model.RunRecord;
import com.ammann.updatetracker.model.RunTrigger;
import com.ammann.updatetracker.model.TrackedItem;
import com.ammann.updatetracker.model.UpdateCheckResult;
import com.ammann.updatetracker.ratelimit.RateGate;
import com.ammann.updatetracker.schedule.JobTypes;
import com.ammann.updatetracker.source.ContainerSnapshot;
import com.ammann.updatetracker.source.ContainerSource;
import com.ammann.updatetracker.source.RegistrySource;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.IntStream;
import org.jboss.logging.Logger;

/**
 * Decides for each request the least work needed to answer it.
 *
 * <p>An ordinary read is served from the cache and never reaches the registry. Only an empty
 * cache, or one written before the network topology flags existed, causes the container hosts
 * to be listed, all of them even for a read of one instance, and the result is merged into the
 * cache. A forced read performs a full refresh:
 * it lists the containers and checks every remote image against its registry through the
 * {@link RateGate}, with a bounded number of checks in flight.
 *
 * <p>A failed registry check only affects its own container, which keeps its cached update
 * state, except when the registry reports the image as unknown: the container is then marked
 * untrackable. Should the rate limit breaker open during a refresh, the remaining containers
 * are skipped, the results so far are stored and {@link RateLimitExceededException} is thrown.
 *
 * <p>A check that outlives the item timeout is interrupted, keeps its cached state and is not
 * counted as checked. Its slot is only released once the check has returned.
 */
@ApplicationScoped
public class UpdateOrchestrator {

    public static final String CONTAINERS_KEY = "containers";

    @Inject CacheStore cacheStore;

    @Inject ContainerSource containerSource;

    @Inject RegistrySource registrySource;

    @Inject RateGate rateGate;

    @Inject RunLedger runLedger;

    @Inject TrackerConfig config;

    @Inject Clock clock;

    @Inject Logger logger;

    private final AtomicBoolean fullRefreshRunning = new AtomicBoolean();

    /**
     * Returns the tracked containers.
     *
     * @param forceFullRefresh whether to check every image against its registry first
     * @param scope            the instance to restrict the answer and the refresh to, or
     *                         {@code null} for all instances
     * @return the containers, stacks, unused image count and refresh metadata
     * @throws RateLimitExceededException if the rate limit breaker is or becomes open
     * @throws RefreshInProgressException if another full refresh is running
     * @throws SourceUnavailableException if no container host can be listed and nothing is cached
     * @throws UnknownInstanceException   if {@code scope} names no configured instance
     */
    public ContainerOverviewDTO getCurrent(boolean forceFullRefresh, String scope) {
        if (scope != null && !containerSource.instances().contains(scope)) {
            throw new UnknownInstanceException(scope);
        }
        if (forceFullRefresh) {
            return ContainerOverviewDTO.from(fullRefresh(scope, RunTrigger.MANUAL).entry(), scope);
        }

        Optional<CacheEntry> cached = cacheStore.get(CONTAINERS_KEY);
        if (cached.isPresent() && !cached.get().hasSchemaDrift()) {
            return ContainerOverviewDTO.from(cached.get(), scope);
        }

        if (cached.isPresent()) {
            logger.infof(
                    "Cache %s lacks network topology data, backfilling from container hosts",
                    CONTAINERS_KEY);
        } else {
            logger.debugf("Cache %s is empty, listing containers", CONTAINERS_KEY);
        }
        // Always lists every instance, a scoped read must not leave the others uncached.
        return ContainerOverviewDTO.from(cheapRefresh(null, cached), scope);
    }

    /**
     * Runs a full refresh of all instances as a batch job.
     *
     * @param trigger what started the run
     * @return the finished run
     * @throws RateLimitExceededException if the rate limit breaker is or becomes open
     * @throws RefreshInProgressException if another full refresh is running
     * @throws SourceUnavailableException if no container host can be listed and nothing is cached
     */
    public RunRecord refreshAll(RunTrigger trigger) {
        return fullRefresh(null, trigger).run();
    }

    /** Returns whether a full refresh is currently running. */
    public boolean isRefreshRunning() {
        return fullRefreshRunning.get();
    }

    private CacheEntry cheapRefresh(String scope, Optional<CacheEntry> cached) {
        ContainerSnapshot snapshot;
        try {
            snapshot = containerSource.listCurrent(scope);
        } catch (SourceUnavailableException e) {
            if (cached.isPresent()) {
                logger.warnf("Serving cached containers, hosts unavailable: %s", e.getMessage());
                return cached.get();
            }
            throw e;
        }
        return cacheStore.merge(
                CONTAINERS_KEY,
                snapshot.toPayload(),
                CacheMetadata.cheap(clock.instant()),
                snapshot.listedInstances());
    }

    private RefreshResult fullRefresh(String scope, RunTrigger trigger) {
        if (rateGate.isOpen()) {
            throw new RateLimitExceededException(
                    "Registry rate limit exceeded, try again later",
                    rateGate.secondsUntilClose());
        }
        if (!fullRefreshRunning.compareAndSet(false, true)) {
            throw new RefreshInProgressException(JobTypes.REGISTRY_CHECK);
        }
        try {
            RunRecord run = runLedger.createRun(JobTypes.REGISTRY_CHECK, trigger);
            try {
                return runFullRefresh(run, scope);
            } catch (RuntimeException e) {
                failIfRunning(run, e);
                throw e;
            }
        } finally {
            fullRefreshRunning.set(false);
        }
    }

    private RefreshResult runFullRefresh(RunRecord run, String scope) {
        ContainerSnapshot snapshot;
        try {
            snapshot = containerSource.listCurrent(scope);
        } catch (SourceUnavailableException e) {
            Optional<CacheEntry> cached = cacheStore.get(CONTAINERS_KEY);
            if (cached.isEmpty()) {
                throw e;
            }
            logger.warnf("Serving cached containers, hosts unavailable: %s", e.getMessage());
            RunRecord failed = runLedger.failRun(run.id(), 0, 0, e.getMessage());
            return new RefreshResult(cached.get(), failed);
        }

        BatchOutcome outcome = checkAll(snapshot.items());
        ContainerPayload payload =
                new ContainerPayload(outcome.items(), snapshot.unusedImagesByInstance());
        CacheMetadata metadata =
                outcome.breakerOpened()
                        ? CacheMetadata.cheap(clock.instant())
                        : CacheMetadata.full(clock.instant());

        boolean complete =
                scope == null
                        && snapshot.listedInstances().containsAll(containerSource.instances());
        CacheEntry entry =
                complete
                        ? cacheStore.replace(CONTAINERS_KEY, payload, metadata)
                        : cacheStore.merge(
                                CONTAINERS_KEY, payload, metadata, snapshot.listedInstances());

        int updated = countUpdates(entry, outcome);
        if (outcome.breakerOpened()) {
            String message =
                    String.format(
                            "Registry rate limit exceeded after checking %d of %d images",
                            outcome.processed(), outcome.total());
            runLedger.failRun(run.id(), outcome.processed(), updated, message);
            throw new RateLimitExceededException(
                    message, outcome.processed(), outcome.total(), rateGate.secondsUntilClose());
        }

        RunRecord completed = runLedger.completeRun(run.id(), outcome.processed(), updated);
        return new RefreshResult(entry, completed);
    }

    private BatchOutcome checkAll(List<TrackedItem> items) {
        AtomicBoolean breakerOpened = new AtomicBoolean();
        Duration itemTimeout = config.refresh().itemTimeout();
        int fanOut = Math.max(1, config.refresh().fanOut());

        List<ItemOutcome> results =
                Multi.createFrom()
                        .iterable(IntStream.range(0, items.size()).boxed().toList())
                        .onItem()
                        .transformToUni(
                                index ->
                                        checkItem(
                                                index,
                                                items.get(index),
                                                itemTimeout,
                                                breakerOpened))
                        .merge(fanOut)
                        .collect()
                        .asList()
                        .await()
                        .indefinitely();

        TrackedItem[] ordered = items.toArray(new TrackedItem[0]);
        int processed = 0;
        int total = 0;
        List<TrackedItem> checked = new ArrayList<>();
        for (ItemOutcome result : results) {
            ordered[result.index()] = result.item();
            if (result.remote()) {
                total++;
            }
            if (result.attempted()) {
                processed++;
                checked.add(result.item());
            }
        }
        logger.infof(
                "Checked %d of %d remote images (%d containers)",
                processed, total, items.size());
        return new BatchOutcome(List.of(ordered), checked, processed, total, breakerOpened.get());
    }

    private Uni<ItemOutcome> checkItem(
            int index, TrackedItem item, Duration timeout, AtomicBoolean breakerOpened) {
        if (!isRegistryBacked(item)) {
            logger.debugf("Skipping local image %s of %s", item.image(), item.name());
            return Uni.createFrom().item(new ItemOutcome(index, item, false, false));
        }
        return Uni.createFrom()
                .item(() -> checkWithin(timeout, index, item, breakerOpened))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .onFailure()
                .recoverWithItem(
                        failure -> {
                            logger.warnf(
                                    failure, "Registry check of %s failed", item.image());
                            rateGate.recordFailure(false);
                            return new ItemOutcome(index, item, true, true);
                        });
    }

    private ItemOutcome checkWithin(
            Duration timeout, int index, TrackedItem item, AtomicBoolean breakerOpened) {
        try (CheckDeadline deadline = CheckDeadline.start(timeout)) {
            ItemOutcome outcome = checkBlocking(index, item, breakerOpened, deadline);
            if (!deadline.isExpired()) {
                return outcome;
            }
        }
        logger.warnf("Registry check of %s timed out after %s", item.image(), timeout);
        rateGate.recordFailure(false);
        return new ItemOutcome(index, item, true, false);
    }

    private ItemOutcome checkBlocking(
            int index, TrackedItem item, AtomicBoolean breakerOpened, CheckDeadline deadline) {
        if (breakerOpened.get() || rateGate.isOpen()) {
            breakerOpened.set(true);
            return new ItemOutcome(index, item, true, false);
        }
        try {
            rateGate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ItemOutcome(index, item, true, false);
        }
        if (rateGate.isOpen()) {
            breakerOpened.set(true);
            return new ItemOutcome(index, item, true, false);
        }

        UpdateCheckResult result = registrySource.checkUpdate(item);
        if (deadline.isExpired()) {
            return new ItemOutcome(index, item, true, false);
        }
        if (result.isSuccess()) {
            rateGate.recordSuccess();
            return new ItemOutcome(
                    index,
                    item.withRegistryResult(
                            result.latestDigest(), result.latestTag(), clock.instant()),
                    true,
                    true);
        }

        switch (result.error()) {
            case NOT_FOUND -> {
                rateGate.recordSuccess();
                logger.infof("Image %s not found in registry, not tracking it", item.image());
                return new ItemOutcome(index, item.asUntrackable(clock.instant()), true, true);
            }
            case RATE_LIMITED -> {
                if (rateGate.recordFailure(true)) {
                    breakerOpened.set(true);
                }
                return new ItemOutcome(index, item, true, true);
            }
            default -> {
                rateGate.recordFailure(false);
                logger.warnf(
                        "Registry check of %s failed: %s", item.image(), result.message());
                return new ItemOutcome(index, item, true, true);
            }
        }
    }

    private void failIfRunning(RunRecord run, RuntimeException cause) {
        boolean running = runLedger.find(run.id()).map(RunRecord::isRunning).orElse(false);
        if (running) {
            runLedger.failRun(run.id(), 0, 0, String.valueOf(cause.getMessage()));
        }
    }

    private static int countUpdates(CacheEntry entry, BatchOutcome outcome) {
        int updated = 0;
        for (TrackedItem item : entry.payload().items()) {
            if (item.hasUpdateAvailable() && outcome.wasChecked(item)) {
                updated++;
            }
        }
        return updated;
    }

    /**
     * Returns whether an item's image can be checked against a registry: it is referenced by
     * name and the local copy was pulled from a registry (locally built images have no repo
     * digest).
     */
    static boolean isRegistryBacked(TrackedItem item) {
        String image = item.image();
        return image != null
                && !image.isBlank()
                && !ImageReference.isImageId(image)
                && !item.repoDigests().isEmpty();
    }

    private record RefreshResult(CacheEntry entry, RunRecord run) {}

    /**
     * @param remote    whether the item's image lives in a registry
     * @param attempted whether the item was checked (false once the breaker opened or on timeout)
     */
    private record ItemOutcome(int index, TrackedItem item, boolean remote, boolean attempted) {}

    private record BatchOutcome(
            List<TrackedItem> items,
            List<TrackedItem> checked,
            int processed,
            int total,
            boolean breakerOpened) {

        boolean wasChecked(TrackedItem item) {
            return checked.stream()
                    .anyMatch(
                            c ->
                                    Objects.equals(c.instance(), item.instance())
                                            && Objects.equals(c.name(), item.name()));
        }
    }
}
