package com.krickert.testcontainers.speaches.client;

import com.krickert.testcontainers.speaches.model.CapabilityType;

import java.io.IOException;

/**
 * The four Speaches endpoints the provisioning flow depends on.
 * Implementations return non-2xx responses as-is and throw only for transport failures.
 */
public interface SpeachesApi {

    /**
     * Base URL of the instance, e.g. {@code http://localhost:28001}.
     */
    String baseUrl();

    /** {@code GET /health} */
    ApiResponse health() throws IOException, InterruptedException;

    /** {@code GET /v1/registry?task=<task>} */
    ApiResponse registry(CapabilityType capability) throws IOException, InterruptedException;

    /** {@code GET /v1/models} */
    ApiResponse listModels() throws IOException, InterruptedException;

    /** {@code POST /v1/models/{modelId}}, the model id percent-encoded as a single path segment. */
    ApiResponse loadModel(String modelId) throws IOException, InterruptedException;

    /**
     * URL of the registry listing for a capability, for error messages.
     */
    default String registryUrl(CapabilityType capability) {
        return baseUrl() + "/v1/registry?task=" + capability.getTask();
    }
}
