package com.krickert.testcontainers.speaches.registry;

import java.util.List;
import java.util.Optional;

/**
 * Model ids recovered from a listing, and the shape that produced them.
 * {@code shape} is empty when no decoder recognised the text.
 */
public record Extraction(Optional<ResponseShape> shape, List<String> modelIds) {

    public Extraction {
        modelIds = List.copyOf(modelIds);
    }

    static Extraction of(ResponseShape shape, List<String> modelIds) {
        return new Extraction(Optional.of(shape), modelIds);
    }

    static Extraction none() {
        return new Extraction(Optional.empty(), List.of());
    }

    public boolean matched() {
        return shape.isPresent();
    }
}
