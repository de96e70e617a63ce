package com.krickert.testcontainers.speaches;

import com.krickert.testcontainers.speaches.model.CapabilityType;
import io.micronaut.test.support.TestPropertyProvider;

import java.util.HashMap;
import java.util.Map;

/**
 * Base class for Micronaut tests that talk to Speaches.
 * <p>
 * Before the application context starts, the shared container is started (or reused), the
 * models returned by {@link #getModels()} are provisioned, and the instance's base URL is
 * published as {@code speaches.base-url} (plus host, port and, when configured, api key).
 * Do not combine with {@code @Testcontainers}; the container must outlive individual test classes.
 * <pre>
 * &#64;MicronautTest
 * &#64;TestInstance(TestInstance.Lifecycle.PER_CLASS)
 * class TranscriptionTest extends SpeachesTestPropertyProvider {
 *     &#64;Override
 *     protected Map&lt;CapabilityType, String&gt; getModels() {
 *         return Map.of(CapabilityType.SPEECH_TO_TEXT, "Systran/faster-whisper-base");
 *     }
 * }
 * </pre>
 */
public abstract class SpeachesTestPropertyProvider implements TestPropertyProvider {

    protected abstract Map<CapabilityType, String> getModels();

    protected String getLabel() {
        return SpeachesContainerManager.DEFAULT_LABEL;
    }

    protected SpeachesContainerManager getContainerManager() {
        return SpeachesContainerManager.getInstance();
    }

    /**
     * Extra properties to publish alongside the endpoint.
     */
    protected Map<String, String> getAdditionalProperties() {
        return Map.of();
    }

    @Override
    public Map<String, String> getProperties() {
        SpeachesContainerManager manager = getContainerManager();
        ServiceInstance instance = manager.startIfNeeded(getLabel(), getModels());
        Map<String, String> properties = new HashMap<>(manager.resolveProperties(instance));
        properties.putAll(getAdditionalProperties());
        return properties;
    }
}
