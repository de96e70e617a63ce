package com.krickert.testcontainers.speaches.provision;

import com.krickert.testcontainers.speaches.model.ModelDescriptor;

/**
 * The load/download request for a model returned a non-2xx status.
 */
public class LoadTriggerException extends ModelProvisioningException {

    private final int statusCode;
    private final String responseBody;

    public LoadTriggerException(ModelDescriptor model, int statusCode, String responseBody) {
        super(model, "Failed to download/load model " + model.modelId() + " (type: " + model.capability().getTask()
                + "), status code: " + statusCode + ", response: " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
