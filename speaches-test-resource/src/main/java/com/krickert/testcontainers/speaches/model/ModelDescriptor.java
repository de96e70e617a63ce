package com.krickert.testcontainers.speaches.model;

import java.util.Objects;

/**
 * A model to provision: its provider-defined id (e.g. {@code Systran/faster-whisper-base})
 * and the capability it is registered under.
 */
public record ModelDescriptor(String modelId, CapabilityType capability) {

    public ModelDescriptor {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("Model id must not be blank");
        }
        Objects.requireNonNull(capability, "capability");
        modelId = modelId.trim();
    }

    public static ModelDescriptor of(CapabilityType capability, String modelId) {
        return new ModelDescriptor(modelId, capability);
    }

    /**
     * Name of the Hugging Face hub cache entry for this model, e.g.
     * {@code models--Systran--faster-whisper-base}.
     */
    public String cacheDirectoryName() {
        return "models--" + modelId.replace("/", "--");
    }

    @Override
    public String toString() {
        return modelId + " (" + capability.getTask() + ")";
    }
}
