package com.updesk.helpdesk.integration.ai;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks a generation model from the provider catalogue by an ordered list of name
 * fragments: a model containing the first fragment beats one containing the second,
 * and so on. Models matching no fragment rank last; ties keep catalogue order.
 */
public final class ModelSelector {

    private final List<String> preferences;

    public ModelSelector(List<String> preferences) {
        this.preferences = preferences.stream()
            .map(preference -> preference.toLowerCase(Locale.ROOT))
            .toList();
    }

    public Optional<String> select(List<GeminiModel> catalogue) {
        return catalogue.stream()
            .filter(GeminiModel::supportsGenerateContent)
            .filter(model -> model.name() != null && !model.name().isBlank())
            .min(Comparator.comparingInt(model -> score(model.name())))
            .map(GeminiModel::shortName);
    }

    int score(String modelName) {
        String lower = modelName.toLowerCase(Locale.ROOT);
        for (int i = 0; i < preferences.size(); i++) {
            if (lower.contains(preferences.get(i))) {
                return i;
            }
        }
        return preferences.size();
    }
}
