package com.krickert.testcontainers.speaches.provision;

import com.krickert.testcontainers.speaches.SpeachesConfig;
import com.krickert.testcontainers.speaches.client.ApiResponse;
import com.krickert.testcontainers.speaches.client.SpeachesApi;
import com.krickert.testcontainers.speaches.model.ModelDescriptor;
import com.krickert.testcontainers.speaches.model.ProvisioningOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks until a model shows up in the loaded-models listing, then waits a settle delay
 * because the listing reports a model slightly before it can serve requests.
 * <p>
 * A model that never shows up is not an error here: the timeout is logged and
 * {@link ProvisioningOutcome#READY_TIMEOUT} returned, leaving the caller's first real request
 * to surface the problem.
 */
public class ReadinessPoller {

    private static final Logger LOG = LoggerFactory.getLogger(ReadinessPoller.class);

    private final SpeachesApi api;
    private final SpeachesConfig config;

    public ReadinessPoller(SpeachesApi api, SpeachesConfig config) {
        this.api = api;
        this.config = config;
    }

    public ProvisioningOutcome awaitReady(ModelDescriptor model) {
        Duration maxWait = config.getReadyMaxWait();
        long intervalNanos = config.getReadyPollInterval().toNanos();
        long deadline = System.nanoTime() + maxWait.toNanos();

        LOG.info("Waiting for model {} to be ready...", model.modelId());

        boolean listed = false;
        while (true) {
            if (isListed(model)) {
                listed = true;
                break;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            sleep(model, Math.min(remaining, intervalNanos));
        }

        if (!listed) {
            LOG.warn("Model {} not found in loaded models list after {} ms.", model.modelId(), maxWait.toMillis());
            return ProvisioningOutcome.READY_TIMEOUT;
        }

        Duration settle = config.getSettleDelay(model.capability());
        LOG.info("Model {} is in loaded list, waiting {} ms for full initialization...", model.modelId(), settle.toMillis());
        sleep(model, settle.toNanos());
        LOG.info("Model {} is ready.", model.modelId());
        return ProvisioningOutcome.LOADED_NOW;
    }

    private boolean isListed(ModelDescriptor model) {
        try {
            ApiResponse response = api.listModels();
            return response.statusCode() == 200 && response.body().contains(model.modelId());
        } catch (IOException e) {
            LOG.debug("Error checking model {} in list: {}", model.modelId(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelProvisioningException(model, "Interrupted while waiting for model " + model.modelId(), e);
        }
    }

    private static void sleep(ModelDescriptor model, long nanos) {
        if (nanos <= 0) {
            return;
        }
        try {
            TimeUnit.NANOSECONDS.sleep(nanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelProvisioningException(model, "Interrupted while waiting for model " + model.modelId(), e);
        }
    }
}
