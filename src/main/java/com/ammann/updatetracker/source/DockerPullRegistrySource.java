/* (C)2026 */
package com.ammann.updatetracker.source;

import com.ammann.updatetracker.config.DockerClientRegistry;
import com.ammann.updatetracker.config.TrackerConfig;
import com.ammann.updatetracker.model.Digests;
import com.ammann.updatetracker.model.ImageReference;
import com.ammann.updatetracker.model.TrackedItem;
import com.ammann.updatetracker.model.UpdateCheckResult;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.InspectImageResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Resolves the latest digest of an image by pulling it through the Docker daemon of the
 * container's instance and reading the repo digest of the pulled image.
 *
 * <p>The daemon talks to the registry with its own credentials, so private registries work
 * wherever the host can already pull. The running container is not touched. A pull that does
 * not finish within the item timeout is abandoned and reported as failed.
 */
@ApplicationScoped
public class DockerPullRegistrySource implements RegistrySource {

    private static final Pattern STATUS_429 = Pattern.compile("\\b429\\b");

    @Inject DockerClientRegistry clientRegistry;

    @Inject TrackerConfig config;

    @Inject Logger logger;

    @Override
    public UpdateCheckResult checkUpdate(TrackedItem item) {
        String imageName = item.image();
        try {
            ImageReference reference = ImageReference.parse(imageName);
            DockerClient client = clientRegistry.clientFor(item.instance());

            logger.debugf("Pulling %s on %s", imageName, item.instance());
            Duration timeout = config.refresh().itemTimeout();
            PullImageResultCallback pull =
                    client.pullImageCmd(imageName).exec(new PullImageResultCallback());
            if (!pull.awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                abandon(pull, imageName);
                return UpdateCheckResult.failed(
                        "Timed out after " + timeout + " pulling " + imageName);
            }

            InspectImageResponse pulled = client.inspectImageCmd(imageName).exec();
            List<String> repoDigests =
                    pulled.getRepoDigests() != null ? pulled.getRepoDigests() : List.of();
            String digest =
                    repoDigests.stream()
                            .filter(reference::ownsRepoDigest)
                            .map(Digests::digestOf)
                            .findFirst()
                            .orElse(null);

            if (digest == null) {
                return UpdateCheckResult.failed("Pulled image has no digest for " + imageName);
            }
            return UpdateCheckResult.found(digest, reference.tag());
        } catch (NotFoundException e) {
            logger.debugf("Image %s not found in registry: %s", imageName, e.getMessage());
            return UpdateCheckResult.notFound(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return UpdateCheckResult.failed("Interrupted while pulling " + imageName);
        } catch (RuntimeException e) {
            return classify(imageName, e);
        }
    }

    private void abandon(PullImageResultCallback pull, String imageName) {
        try {
            pull.close();
        } catch (IOException e) {
            logger.debugf("Closing the pull of %s failed: %s", imageName, e.getMessage());
        }
    }

    private UpdateCheckResult classify(String imageName, RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        String lower = message.toLowerCase(Locale.ROOT);

        if (isRateLimited(e, lower)) {
            logger.warnf("Registry rate limit hit while pulling %s", imageName);
            return UpdateCheckResult.rateLimited(message);
        }
        if (lower.contains("manifest unknown") || lower.contains("not found")) {
            return UpdateCheckResult.notFound(message);
        }
        logger.warnf("Registry check failed for %s: %s", imageName, message);
        return UpdateCheckResult.failed(message);
    }

    /**
     * A 429 answer from the daemon, or a registry error relayed in the message. A bare
     * {@code 429} only counts as a whole word, not inside a digest.
     */
    static boolean isRateLimited(RuntimeException e, String lowerMessage) {
        if (e instanceof DockerException && ((DockerException) e).getHttpStatus() == 429) {
            return true;
        }
        return lowerMessage.contains("toomanyrequests")
                || lowerMessage.contains("too many requests")
                || lowerMessage.contains("rate limit")
                || STATUS_429.matcher(lowerMessage).find();
    }
}
