package com.krickert.testcontainers.speaches.provision;

import com.krickert.testcontainers.speaches.model.ModelDescriptor;

/**
 * A model could not be provisioned. Aborts the whole ensure-ready call.
 */
public class ModelProvisioningException extends RuntimeException {

    private final ModelDescriptor model;

    public ModelProvisioningException(ModelDescriptor model, String message) {
        super(message);
        this.model = model;
    }

    public ModelProvisioningException(ModelDescriptor model, String message, Throwable cause) {
        super(message, cause);
        this.model = model;
    }

    public ModelDescriptor getModel() {
        return model;
    }
}
