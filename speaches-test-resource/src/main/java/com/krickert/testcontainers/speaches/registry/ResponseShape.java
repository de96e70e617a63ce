package com.krickert.testcontainers.speaches.registry;

/**
 * Known layouts of a Speaches model listing, in the order {@link ModelIdExtractor} tries them.
 */
public enum ResponseShape {

    /** {@code [{"id": "org/model", "voices": [{"id": "af_heart"}]}, ...]} */
    OBJECT_ARRAY_WITH_ID,

    /** Array-shaped text, possibly malformed, scanned for {@code "id": "org/model"} pairs. */
    LOOSE_ID_SCAN,

    /** {@code ["org/model", ...]} */
    STRING_ARRAY,

    /** {@code {"models": <any of the above>}} */
    MODELS_WRAPPER,

    /** {@code {"id": "org/model", ...}} */
    SINGLE_OBJECT,

    /** One model id per line. */
    PLAIN_TEXT_LINES
}
