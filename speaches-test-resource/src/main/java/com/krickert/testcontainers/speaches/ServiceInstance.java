package com.krickert.testcontainers.speaches;

/**
 * The running Speaches service behind a label. At most one exists per label per process.
 */
public interface ServiceInstance {

    String getLabel();

    String getHost();

    int getPort();

    boolean isRunning();

    default String getBaseUrl() {
        return "http://" + getHost() + ":" + getPort();
    }
}
