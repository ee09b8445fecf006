package com.updesk.helpdesk.integration.ai;

/**
 * The provider does not know the requested model, or the model does not support
 * content generation.
 */
public class ModelNotFoundException extends AiProviderException {

    private final String model;

    public ModelNotFoundException(String model, String detail) {
        super("Model '%s' not found: %s".formatted(model, detail));
        this.model = model;
    }

    public String getModel() {
        return model;
    }
}
