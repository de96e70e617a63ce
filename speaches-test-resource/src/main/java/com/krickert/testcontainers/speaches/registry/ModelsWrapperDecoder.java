package com.krickert.testcontainers.speaches.registry;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * {@code {"models": ...}} where the value is an object array, a string array, or another wrapper.
 */
class ModelsWrapperDecoder implements ModelIdDecoder {

    private final List<ModelIdDecoder> inner = List.of(
            new ObjectArrayDecoder(),
            new LooseIdScanDecoder(),
            new StringArrayDecoder(),
            this);

    @Override
    public ResponseShape shape() {
        return ResponseShape.MODELS_WRAPPER;
    }

    @Override
    public List<String> decode(ResponseText text) {
        JsonNode root = text.json().orElse(null);
        if (root == null || !root.isObject()) {
            return List.of();
        }
        JsonNode models = root.get("models");
        if (models == null || models.isNull()) {
            return List.of();
        }
        ResponseText nested = ResponseText.of(models);
        for (ModelIdDecoder decoder : inner) {
            List<String> ids = decoder.decode(nested);
            if (!ids.isEmpty()) {
                return ids;
            }
        }
        return List.of();
    }
}
