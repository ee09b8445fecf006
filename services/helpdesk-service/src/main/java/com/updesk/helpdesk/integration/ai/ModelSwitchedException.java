package com.updesk.helpdesk.integration.ai;

/**
 * Signals that a "model not found" failure was answered by selecting another model.
 * The next attempt goes out immediately, without backoff.
 */
class ModelSwitchedException extends AiProviderException {

    private final String newModel;

    ModelSwitchedException(String newModel, ModelNotFoundException cause) {
        super("Switched to model '%s'".formatted(newModel), cause);
        this.newModel = newModel;
    }

    String getNewModel() {
        return newModel;
    }
}
