package com.krickert.testcontainers.speaches.registry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One identifier per line. Lines opening with a brace or bracket are skipped; any other line
 * that is not a single token rejects the whole text, so prose and error pages yield nothing.
 */
class PlainTextLinesDecoder implements ModelIdDecoder {

    private static final Pattern TOKEN = Pattern.compile("[^\\s\"'{}\\[\\],]+");

    @Override
    public ResponseShape shape() {
        return ResponseShape.PLAIN_TEXT_LINES;
    }

    @Override
    public List<String> decode(ResponseText text) {
        if (text.json().map(node -> node.isContainerNode()).orElse(false)) {
            return List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (String line : text.raw().split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("{") || trimmed.startsWith("[")) {
                continue;
            }
            if (!TOKEN.matcher(trimmed).matches()) {
                return List.of();
            }
            ids.add(trimmed);
        }
        return new ArrayList<>(ids);
    }
}
