package com.updesk.helpdesk.integration.ai;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Entry of the provider's model catalogue, e.g. {@code models/gemini-1.5-flash}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeminiModel(String name, List<String> supportedGenerationMethods) {

    private static final String MODEL_PREFIX = "models/";

    public boolean supportsGenerateContent() {
        return supportedGenerationMethods != null && supportedGenerationMethods.contains("generateContent");
    }

    /**
     * Name without the {@code models/} prefix, as used in generate calls.
     */
    public String shortName() {
        if (name != null && name.startsWith(MODEL_PREFIX)) {
            return name.substring(MODEL_PREFIX.length());
        }
        return name;
    }
}
