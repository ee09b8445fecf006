package com.updesk.helpdesk.integration.ai;

/**
 * Quota or billing limit reached. Retrying cannot help, so callers stop at the first one.
 */
public class QuotaExhaustedException extends AiProviderException {

    public QuotaExhaustedException(String detail) {
        super("AI provider quota exhausted: " + detail);
    }
}
