package com.krickert.testcontainers.speaches;

/**
 * Starts (or locates) the Speaches service for a label. Called at most once per label while the
 * returned instance keeps running; {@link SpeachesContainerManager} serialises the calls.
 */
@FunctionalInterface
public interface ServiceInstanceFactory {

    ServiceInstance start(String label);
}
