package com.krickert.testcontainers.speaches.registry;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

class ObjectArrayDecoder implements ModelIdDecoder {

    @Override
    public ResponseShape shape() {
        return ResponseShape.OBJECT_ARRAY_WITH_ID;
    }

    @Override
    public List<String> decode(ResponseText text) {
        JsonNode root = text.json().orElse(null);
        if (root == null || !root.isArray()) {
            return List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (JsonNode element : root) {
            if (!element.isObject()) {
                continue;
            }
            // only the element's own id; nested ids (voices) are not model ids
            JsonNode id = element.get("id");
            if (id != null && id.isTextual() && ModelIdExtractor.looksLikeModelId(id.asText())) {
                ids.add(id.asText().trim());
            }
        }
        return new ArrayList<>(ids);
    }
}
