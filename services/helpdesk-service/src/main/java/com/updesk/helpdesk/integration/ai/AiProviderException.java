package com.updesk.helpdesk.integration.ai;

/**
 * Any failure reported by the generative model provider that has no dedicated
 * recovery path.
 */
public class AiProviderException extends RuntimeException {

    public AiProviderException(String message) {
        super(message);
    }

    public AiProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
