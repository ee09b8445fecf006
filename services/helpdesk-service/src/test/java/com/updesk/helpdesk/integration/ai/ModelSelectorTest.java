package com.updesk.helpdesk.integration.ai;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

class ModelSelectorTest {

    private static final List<String> GENERATE = List.of("generateContent", "countTokens");

    private final ModelSelector selector = new ModelSelector(List.of("flash", "pro", "2.5", "2.0"));

    @Test
    void shouldPreferEarlierFragments() {
        var catalogue = List.of(
            new GeminiModel("models/gemini-1.0-pro", GENERATE),
            new GeminiModel("models/gemini-1.5-flash", GENERATE),
            new GeminiModel("models/gemini-2.0-experimental", GENERATE));

        assertThat(selector.select(catalogue)).contains("gemini-1.5-flash");
    }

    @Test
    void shouldSkipModelsThatCannotGenerate() {
        var catalogue = List.of(
            new GeminiModel("models/embedding-flash", List.of("embedContent")),
            new GeminiModel("models/gemini-pro", GENERATE));

        assertThat(selector.select(catalogue)).contains("gemini-pro");
    }

    @Test
    void shouldKeepCatalogueOrderOnTies() {
        var catalogue = List.of(
            new GeminiModel("models/gemini-1.5-flash-001", GENERATE),
            new GeminiModel("models/gemini-1.5-flash-002", GENERATE));

        assertThat(selector.select(catalogue)).contains("gemini-1.5-flash-001");
    }

    @Test
    void shouldFallBackToAnyCapableModel() {
        var catalogue = List.of(new GeminiModel("models/text-bison", GENERATE));

        assertThat(selector.select(catalogue)).contains("text-bison");
        assertThat(selector.score("models/text-bison")).isEqualTo(4);
    }

    @Test
    void shouldReturnEmptyForEmptyCatalogue() {
        assertThat(selector.select(List.of())).isEmpty();
    }
}
