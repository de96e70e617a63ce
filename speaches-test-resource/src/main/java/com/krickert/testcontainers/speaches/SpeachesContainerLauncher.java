package com.krickert.testcontainers.speaches;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.DockerClientFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default {@link ServiceInstanceFactory}: reuses a running container carrying the label, or
 * creates the host model cache directory and starts a new {@link SpeachesContainer}.
 */
public class SpeachesContainerLauncher implements ServiceInstanceFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SpeachesContainerLauncher.class);

    private final SpeachesConfig config;

    /**
     * @param config settings for containers this launcher creates
     */
    public SpeachesContainerLauncher(SpeachesConfig config) {
        this.config = config;
    }

    @Override
    public ServiceInstance start(String label) {
        Optional<ServiceInstance> running = findRunning(label);
        if (running.isPresent()) {
            LOG.info("Reusing running Speaches container for label '{}': {}", label, running.get());
            return running.get();
        }

        new ModelCacheDirectory(config.getModelCacheDir()).ensureExists();
        SpeachesContainer container = new SpeachesContainer(config, label);
        LOG.info("Starting Speaches container with image: {}", config.getImageName());
        container.start();
        LOG.info("Speaches container started. Endpoint: {}", container.getBaseUrl());
        return new ContainerServiceInstance(label, container);
    }

    Optional<ServiceInstance> findRunning(String label) {
        try {
            DockerClient client = DockerClientFactory.instance().client();
            List<Container> containers = client.listContainersCmd()
                    .withLabelFilter(Map.of(SpeachesContainer.LABEL_KEY, label))
                    .exec();
            for (Container container : containers) {
                for (ContainerPort port : container.getPorts()) {
                    if (port.getPrivatePort() != null
                            && port.getPrivatePort() == SpeachesContainer.CONTAINER_PORT
                            && port.getPublicPort() != null) {
                        String host = DockerClientFactory.instance().dockerHostIpAddress();
                        return Optional.of(new DiscoveredServiceInstance(label, host, port.getPublicPort(), container.getId()));
                    }
                }
            }
        } catch (RuntimeException e) {
            LOG.warn("Could not look up running Speaches containers for label '{}': {}", label, e.getMessage());
        }
        return Optional.empty();
    }
}
