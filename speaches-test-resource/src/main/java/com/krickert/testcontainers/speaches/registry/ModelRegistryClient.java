package com.krickert.testcontainers.speaches.registry;

import com.krickert.testcontainers.speaches.client.ApiResponse;
import com.krickert.testcontainers.speaches.client.SpeachesApi;
import com.krickert.testcontainers.speaches.model.CapabilityType;
import com.krickert.testcontainers.speaches.model.RegistrySupportResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Asks a running Speaches instance which model ids it can install for a capability.
 * <p>
 * The answer is advisory: any failure is logged and reported as an
 * {@link RegistrySupportResult#unavailable(CapabilityType) unavailable} empty result.
 */
public class ModelRegistryClient {

    private static final Logger LOG = LoggerFactory.getLogger(ModelRegistryClient.class);

    private final SpeachesApi api;
    private final ModelIdExtractor extractor;

    public ModelRegistryClient(SpeachesApi api) {
        this(api, new ModelIdExtractor());
    }

    public ModelRegistryClient(SpeachesApi api, ModelIdExtractor extractor) {
        this.api = api;
        this.extractor = extractor;
    }

    public RegistrySupportResult querySupported(CapabilityType capability) {
        ApiResponse response;
        try {
            response = api.registry(capability);
        } catch (IOException e) {
            LOG.warn("Error querying model registry for {} at {}: {}", capability.getTask(), api.registryUrl(capability), e.getMessage());
            return RegistrySupportResult.unavailable(capability);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while querying model registry for {}", capability.getTask());
            return RegistrySupportResult.unavailable(capability);
        } catch (RuntimeException e) {
            LOG.warn("Unexpected error querying model registry for {}", capability.getTask(), e);
            return RegistrySupportResult.unavailable(capability);
        }

        if (!response.isSuccessful()) {
            LOG.warn("Failed to query registry for {}, status code: {}", capability.getTask(), response.statusCode());
            return RegistrySupportResult.unavailable(capability);
        }

        List<String> modelIds = extractor.extract(response.body());
        LOG.info("Model ids of type {} known to the Speaches registry: {}", capability.getTask(), modelIds);
        return RegistrySupportResult.of(capability, modelIds);
    }
}
