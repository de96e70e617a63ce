package com.krickert.testcontainers.speaches.registry;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

class StringArrayDecoder implements ModelIdDecoder {

    @Override
    public ResponseShape shape() {
        return ResponseShape.STRING_ARRAY;
    }

    @Override
    public List<String> decode(ResponseText text) {
        JsonNode root = text.json().orElse(null);
        if (root == null || !root.isArray()) {
            return List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (JsonNode element : root) {
            if (element.isTextual() && !element.asText().isBlank()) {
                ids.add(element.asText().trim());
            }
        }
        return new ArrayList<>(ids);
    }
}
