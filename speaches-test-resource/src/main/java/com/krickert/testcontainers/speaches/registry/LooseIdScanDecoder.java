package com.krickert.testcontainers.speaches.registry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Any {@code "id": "owner/name"} pair anywhere in the text, so list wrappers such as
 * {@code {"data": [...], "object": "list"}} and truncated JSON still yield their ids.
 */
class LooseIdScanDecoder implements ModelIdDecoder {

    private static final Pattern ID_PATTERN = Pattern.compile("\"id\"\\s*:\\s*\"([^\"]+/[^\"]+)\"\\s*[,}]");

    @Override
    public ResponseShape shape() {
        return ResponseShape.LOOSE_ID_SCAN;
    }

    @Override
    public List<String> decode(ResponseText text) {
        Set<String> ids = new LinkedHashSet<>();
        Matcher matcher = ID_PATTERN.matcher(text.raw());
        while (matcher.find()) {
            String id = matcher.group(1).trim();
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return new ArrayList<>(ids);
    }
}
