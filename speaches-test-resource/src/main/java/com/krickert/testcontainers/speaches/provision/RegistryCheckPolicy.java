package com.krickert.testcontainers.speaches.provision;

import java.util.Locale;

/**
 * How provisioning treats a registry query that produced no model ids.
 */
public enum RegistryCheckPolicy {

    /** An empty or failed registry query is inconclusive; provisioning continues. */
    ADVISORY,

    /** An empty or failed registry query fails provisioning like an explicit mismatch. */
    STRICT;

    public static RegistryCheckPolicy from(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown registry check policy: " + value, e);
        }
    }
}
