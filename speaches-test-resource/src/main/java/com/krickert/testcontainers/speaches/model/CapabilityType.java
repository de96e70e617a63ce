package com.krickert.testcontainers.speaches.model;

import java.util.Locale;

/**
 * Functional category of a Speaches model. Each capability maps to the task label
 * the Speaches registry is queried with.
 */
public enum CapabilityType {

    SPEECH_TO_TEXT("automatic-speech-recognition", "STT"),
    TEXT_TO_SPEECH("text-to-speech", "TTS"),
    EMBEDDING("speaker-embedding", "EMBEDDING");

    private final String task;
    private final String alias;

    CapabilityType(String task, String alias) {
        this.task = task;
        this.alias = alias;
    }

    /**
     * Task label used in {@code /v1/registry?task=<task>}.
     */
    public String getTask() {
        return task;
    }

    public String getAlias() {
        return alias;
    }

    /**
     * Resolves a capability from its enum name, short alias (STT, TTS, EMBEDDING) or task label.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static CapabilityType from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Capability type must not be blank");
        }
        String normalized = value.trim();
        for (CapabilityType type : values()) {
            if (type.name().equalsIgnoreCase(normalized)
                    || type.alias.equalsIgnoreCase(normalized)
                    || type.task.equals(normalized.toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown capability type: " + value);
    }
}
