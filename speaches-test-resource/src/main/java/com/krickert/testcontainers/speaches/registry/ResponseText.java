package com.krickert.testcontainers.speaches.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Raw listing text together with its JSON tree, when the text is well-formed JSON.
 */
final class ResponseText {

    private final String raw;
    private final JsonNode json;

    private ResponseText(String raw, JsonNode json) {
        this.raw = raw;
        this.json = json;
    }

    static ResponseText parse(String raw, ObjectMapper objectMapper) {
        String text = raw == null ? "" : raw;
        if (text.isBlank()) {
            return new ResponseText(text, null);
        }
        try {
            return new ResponseText(text, objectMapper.readTree(text));
        } catch (JsonProcessingException e) {
            return new ResponseText(text, null);
        }
    }

    static ResponseText of(JsonNode node) {
        return new ResponseText(node.toString(), node);
    }

    String raw() {
        return raw;
    }

    Optional<JsonNode> json() {
        return Optional.ofNullable(json);
    }
}
