package com.krickert.testcontainers.speaches.model;

/**
 * Result of provisioning one model. Fatal outcomes are reported to callers as exceptions;
 * they are listed here so logs and diagnostics can name them.
 */
public enum ProvisioningOutcome {

    ALREADY_LOADED(false),
    LOADED_NOW(false),
    UNSUPPORTED(true),
    LOAD_FAILED(true),
    /** Loading was triggered but the model never showed up in the loaded-models listing. */
    READY_TIMEOUT(false);

    private final boolean fatal;

    ProvisioningOutcome(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
