package com.krickert.testcontainers.speaches.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Model ids the Speaches registry recognised for one capability at query time.
 * {@code available} is false when the registry query itself failed.
 */
public record RegistrySupportResult(CapabilityType capability, Set<String> modelIds, boolean available) {

    public RegistrySupportResult {
        modelIds = Collections.unmodifiableSet(new LinkedHashSet<>(modelIds));
    }

    public static RegistrySupportResult of(CapabilityType capability, Collection<String> modelIds) {
        return new RegistrySupportResult(capability, new LinkedHashSet<>(modelIds), true);
    }

    public static RegistrySupportResult unavailable(CapabilityType capability) {
        return new RegistrySupportResult(capability, Set.of(), false);
    }

    public boolean isEmpty() {
        return modelIds.isEmpty();
    }

    public boolean supports(String modelId) {
        return modelIds.contains(modelId);
    }
}
