package com.krickert.testcontainers.speaches;

import com.github.dockerjava.api.command.InspectContainerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.DockerClientFactory;

/**
 * A Speaches container that was already running under the label when it was first requested,
 * typically one started by hand so that several test runs can share it.
 */
public class DiscoveredServiceInstance implements ServiceInstance {

    private static final Logger LOG = LoggerFactory.getLogger(DiscoveredServiceInstance.class);

    private final String label;
    private final String host;
    private final int port;
    private final String containerId;

    public DiscoveredServiceInstance(String label, String host, int port, String containerId) {
        this.label = label;
        this.host = host;
        this.port = port;
        this.containerId = containerId;
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public String getHost() {
        return host;
    }

    @Override
    public int getPort() {
        return port;
    }

    public String getContainerId() {
        return containerId;
    }

    @Override
    public boolean isRunning() {
        try {
            InspectContainerResponse inspect = DockerClientFactory.instance().client()
                    .inspectContainerCmd(containerId)
                    .exec();
            return Boolean.TRUE.equals(inspect.getState().getRunning());
        } catch (RuntimeException e) {
            LOG.warn("Could not inspect Speaches container {}: {}", containerId, e.getMessage());
            return false;
        }
    }

    @Override
    public String toString() {
        return "DiscoveredServiceInstance{label=" + label + ", endpoint=" + getBaseUrl() + ", containerId=" + containerId + "}";
    }
}
