package com.krickert.testcontainers.speaches;

import com.krickert.testcontainers.speaches.model.ModelDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Host directory bind-mounted as the container's Hugging Face hub cache, so downloaded models
 * survive container restarts. Its contents are a diagnostic hint only; the loaded-models listing
 * of the running instance is what provisioning trusts.
 */
public class ModelCacheDirectory {

    private static final Logger LOG = LoggerFactory.getLogger(ModelCacheDirectory.class);

    private final Path root;

    public ModelCacheDirectory(Path root) {
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Creates the directory (and parents) if absent.
     *
     * @throws IllegalStateException if it cannot be created
     */
    public Path ensureExists() {
        try {
            Files.createDirectories(root);
            LOG.debug("Model cache directory: {}", root.toAbsolutePath());
            return root;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create model cache directory: " + root, e);
        }
    }

    public Path modelPath(ModelDescriptor model) {
        return root.resolve(model.cacheDirectoryName());
    }

    public boolean hasCachedFiles(ModelDescriptor model) {
        Path modelPath = modelPath(model);
        if (!Files.isDirectory(modelPath)) {
            return false;
        }
        try (Stream<Path> entries = Files.list(modelPath)) {
            return entries.findAny().isPresent();
        } catch (IOException e) {
            LOG.debug("Could not list model cache entry {}: {}", modelPath, e.getMessage());
            return false;
        }
    }
}
