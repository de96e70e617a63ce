package com.krickert.testcontainers.speaches.provision;

import com.krickert.testcontainers.speaches.ModelCacheDirectory;
import com.krickert.testcontainers.speaches.SpeachesConfig;
import com.krickert.testcontainers.speaches.client.ApiResponse;
import com.krickert.testcontainers.speaches.client.SpeachesApi;
import com.krickert.testcontainers.speaches.model.ModelDescriptor;
import com.krickert.testcontainers.speaches.model.ProvisioningOutcome;
import com.krickert.testcontainers.speaches.model.RegistrySupportResult;
import com.krickert.testcontainers.speaches.registry.ModelRegistryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Makes sure one model is supported and loaded in a running Speaches instance.
 * <p>
 * Sequence: registry support check, already-loaded check, load trigger, readiness wait.
 * A model the registry explicitly does not list, or a rejected load request, fails the call;
 * everything else degrades to a logged warning.
 */
public class ModelProvisioner {

    private static final Logger LOG = LoggerFactory.getLogger(ModelProvisioner.class);

    private final SpeachesApi api;
    private final ModelRegistryClient registryClient;
    private final ReadinessPoller readinessPoller;
    private final ModelCacheDirectory cacheDirectory;
    private final RegistryCheckPolicy registryCheckPolicy;

    public ModelProvisioner(SpeachesApi api, SpeachesConfig config) {
        this(api,
                new ModelRegistryClient(api),
                new ReadinessPoller(api, config),
                new ModelCacheDirectory(config.getModelCacheDir()),
                config.getRegistryCheckPolicy());
    }

    public ModelProvisioner(SpeachesApi api,
                            ModelRegistryClient registryClient,
                            ReadinessPoller readinessPoller,
                            ModelCacheDirectory cacheDirectory,
                            RegistryCheckPolicy registryCheckPolicy) {
        this.api = api;
        this.registryClient = registryClient;
        this.readinessPoller = readinessPoller;
        this.cacheDirectory = cacheDirectory;
        this.registryCheckPolicy = registryCheckPolicy;
    }

    /**
     * @throws UnsupportedModelException if the registry rules the model out
     * @throws LoadTriggerException if the instance rejects the load request
     * @throws ModelProvisioningException on transport failure or interruption
     */
    public ProvisioningOutcome provision(ModelDescriptor model) {
        transition(model, ProvisioningState.START);

        transition(model, ProvisioningState.CHECK_REGISTRY);
        checkRegistry(model);

        transition(model, ProvisioningState.CHECK_LOADED);
        if (isLoaded(model)) {
            LOG.info("Model already loaded in container: {}", model.modelId());
            transition(model, ProvisioningState.ALREADY_LOADED);
            return ProvisioningOutcome.ALREADY_LOADED;
        }

        transition(model, ProvisioningState.TRIGGER_LOAD);
        triggerLoad(model);

        transition(model, ProvisioningState.WAIT_READY);
        ProvisioningOutcome outcome = readinessPoller.awaitReady(model);
        transition(model, outcome == ProvisioningOutcome.LOADED_NOW ? ProvisioningState.READY : ProvisioningState.READY_TIMEOUT);
        return outcome;
    }

    private void checkRegistry(ModelDescriptor model) {
        RegistrySupportResult supported = registryClient.querySupported(model.capability());
        if (supported.isEmpty()) {
            if (registryCheckPolicy == RegistryCheckPolicy.STRICT) {
                transition(model, ProvisioningState.UNSUPPORTED);
                throw new UnsupportedModelException(model, api.registryUrl(model.capability()),
                        supported.available() ? "registry lists no models" : "registry query failed");
            }
            LOG.warn("Registry check for {} was inconclusive, continuing without it", model);
        } else if (!supported.supports(model.modelId())) {
            transition(model, ProvisioningState.UNSUPPORTED);
            throw new UnsupportedModelException(model, api.registryUrl(model.capability()));
        }

        if (!model.modelId().startsWith(SpeachesConfig.OFFICIAL_MODEL_PREFIX)) {
            LOG.warn("Model '{}' is not an official speaches-ai model. It may have compatibility issues. "
                    + "Consider using official models like 'speaches-ai/Kokoro-82M-v1.0-ONNX' for TTS "
                    + "or 'Systran/faster-whisper-*' for STT.", model.modelId());
        }
    }

    private boolean isLoaded(ModelDescriptor model) {
        try {
            ApiResponse response = api.listModels();
            if (!response.isSuccessful()) {
                LOG.debug("Loaded models listing returned {}, treating {} as not loaded", response.statusCode(), model.modelId());
                return false;
            }
            return response.body().contains(model.modelId());
        } catch (IOException e) {
            throw new ModelProvisioningException(model, "Error checking loaded models for " + model.modelId() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelProvisioningException(model, "Interrupted while checking loaded models for " + model.modelId(), e);
        }
    }

    private void triggerLoad(ModelDescriptor model) {
        boolean cached = cacheDirectory.hasCachedFiles(model);
        if (cached) {
            LOG.debug("Model found in host directory: {}", cacheDirectory.modelPath(model));
            LOG.info("Model files exist locally, but not loaded in container. Loading model: {} ...", model.modelId());
        } else {
            LOG.info("Start downloading model: {} ...", model.modelId());
        }

        long start = System.currentTimeMillis();
        ApiResponse response;
        try {
            response = api.loadModel(model.modelId());
        } catch (IOException e) {
            throw new ModelProvisioningException(model, "Error downloading/loading model " + model.modelId() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelProvisioningException(model, "Interrupted while loading model " + model.modelId(), e);
        }

        if (!response.isSuccessful()) {
            transition(model, ProvisioningState.LOAD_FAILED);
            throw new LoadTriggerException(model, response.statusCode(), response.body());
        }
        LOG.info("Finish {} model: {} in {}ms", cached ? "loading" : "downloading", model.modelId(), System.currentTimeMillis() - start);
    }

    private static void transition(ModelDescriptor model, ProvisioningState state) {
        LOG.debug("Provisioning {} -> {}", model, state);
    }
}
