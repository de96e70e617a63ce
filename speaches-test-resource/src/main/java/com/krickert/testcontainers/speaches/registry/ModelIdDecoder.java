package com.krickert.testcontainers.speaches.registry;

import java.util.List;

/**
 * Decoder for one {@link ResponseShape}. Returns an empty list when the text is not in its shape.
 */
interface ModelIdDecoder {

    ResponseShape shape();

    List<String> decode(ResponseText text);
}
