package com.krickert.testcontainers.speaches.provision;

import com.krickert.testcontainers.speaches.model.ModelDescriptor;

/**
 * Thrown when the Speaches registry does not list a model for its capability, or, under
 * {@link RegistryCheckPolicy#STRICT}, when the registry gave no usable answer.
 */
public class UnsupportedModelException extends ModelProvisioningException {

    public UnsupportedModelException(ModelDescriptor model, String registryUrl) {
        super(model, "Model '" + model.modelId() + "' (type: " + model.capability().getTask()
                + ") is not supported in speaches registry. Please check available models at " + registryUrl);
    }

    /**
     * @param reason why the registry answer could not be used, e.g. {@code registry query failed}
     */
    public UnsupportedModelException(ModelDescriptor model, String registryUrl, String reason) {
        super(model, "Model '" + model.modelId() + "' (type: " + model.capability().getTask()
                + ") cannot be verified against speaches registry at " + registryUrl + ": " + reason);
    }
}
