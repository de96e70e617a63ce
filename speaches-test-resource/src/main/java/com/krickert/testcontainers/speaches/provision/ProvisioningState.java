package com.krickert.testcontainers.speaches.provision;

/**
 * States {@link ModelProvisioner} moves through for one model.
 */
public enum ProvisioningState {
    START,
    CHECK_REGISTRY,
    UNSUPPORTED,
    CHECK_LOADED,
    ALREADY_LOADED,
    TRIGGER_LOAD,
    LOAD_FAILED,
    WAIT_READY,
    READY,
    READY_TIMEOUT
}
