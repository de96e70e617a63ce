package com.krickert.testcontainers.speaches.registry;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

class SingleObjectDecoder implements ModelIdDecoder {

    @Override
    public ResponseShape shape() {
        return ResponseShape.SINGLE_OBJECT;
    }

    @Override
    public List<String> decode(ResponseText text) {
        JsonNode root = text.json().orElse(null);
        if (root == null || !root.isObject()) {
            return List.of();
        }
        JsonNode id = root.get("id");
        if (id == null || !id.isTextual() || id.asText().isBlank()) {
            return List.of();
        }
        return List.of(id.asText().trim());
    }
}
