package com.krickert.testcontainers.speaches;

import org.testcontainers.containers.GenericContainer;

/**
 * A Speaches container started by this process.
 */
public class ContainerServiceInstance implements ServiceInstance {

    private final String label;
    private final GenericContainer<?> container;

    public ContainerServiceInstance(String label, GenericContainer<?> container) {
        this.label = label;
        this.container = container;
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public String getHost() {
        return container.getHost();
    }

    @Override
    public int getPort() {
        return container.getMappedPort(SpeachesContainer.CONTAINER_PORT);
    }

    @Override
    public boolean isRunning() {
        return container.isRunning();
    }

    public String getContainerId() {
        return container.getContainerId();
    }

    @Override
    public String toString() {
        return "ContainerServiceInstance{label=" + label + ", containerId=" + container.getContainerId() + "}";
    }
}
