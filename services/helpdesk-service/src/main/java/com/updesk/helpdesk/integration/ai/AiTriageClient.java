package com.updesk.helpdesk.integration.ai;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.updesk.helpdesk.integration.props.IntegrationProperties;

import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Consults the generative model for a suggested fix and an urgency before a ticket is
 * persisted.
 *
 * <p>Policy, per consultation:
 * <ul>
 *   <li>at most {@code maxAttempts} calls to the provider;</li>
 *   <li>"model not found": pick another model from the catalogue, make it the active
 *       model for this and later consultations, retry at once;</li>
 *   <li>quota exhausted: stop immediately with {@link #QUOTA_FALLBACK};</li>
 *   <li>anything else: wait {@code backoff * attempt} and retry with the same model;</li>
 *   <li>all attempts failed: {@link #GENERIC_FALLBACK}.</li>
 * </ul>
 * {@link #suggest} never signals an error.</p>
 */
@Component
public class AiTriageClient {

    private static final Logger log = LoggerFactory.getLogger(AiTriageClient.class);

    public static final String QUOTA_FALLBACK =
        "Não foi possível obter uma sugestão da IA no momento (limite de uso/quota). "
            + "Por favor, prossiga com a abertura do chamado.";

    public static final String GENERIC_FALLBACK =
        "Não foi possível obter uma sugestão da IA no momento. "
            + "Por favor, prossiga com a abertura do chamado.";

    private final GeminiClient geminiClient;
    private final IntegrationProperties.AiProperties properties;
    private final ModelSelector modelSelector;
    private final AtomicReference<String> activeModel;

    public AiTriageClient(GeminiClient geminiClient, IntegrationProperties properties) {
        this.geminiClient = geminiClient;
        this.properties = properties.getAi();
        this.modelSelector = new ModelSelector(this.properties.getModelPreferences());
        this.activeModel = new AtomicReference<>(this.properties.getModel());
    }

    public String activeModel() {
        return activeModel.get();
    }

    public Mono<AiSuggestion> suggest(String title, String description) {
        if (!properties.isConfigured()) {
            log.warn("AI provider not configured (integration.ai.api-key missing); using fallback suggestion");
            return Mono.just(AiSuggestion.unclassified(GENERIC_FALLBACK));
        }

        String prompt = TriagePrompt.render(title, description);

        return Mono.defer(() -> attempt(prompt))
            .retryWhen(retryPolicy())
            .map(TriageResponseParser::parse)
            .doOnNext(suggestion -> log.info("AI triage classified '{}' as {}", title, suggestion.priority()))
            .onErrorResume(QuotaExhaustedException.class, error -> {
                log.error("AI quota exhausted, check the provider quota and billing: {}", error.getMessage());
                return Mono.just(AiSuggestion.unclassified(QUOTA_FALLBACK));
            })
            .onErrorResume(error -> {
                log.error("All AI attempts failed, using fallback suggestion: {}", error.getMessage());
                return Mono.just(AiSuggestion.unclassified(GENERIC_FALLBACK));
            });
    }

    /**
     * Queries the catalogue and makes the preferred model active. Empty when no
     * candidate was found or the catalogue could not be read.
     */
    public Mono<String> selectPreferredModel() {
        if (!properties.isConfigured()) {
            return Mono.empty();
        }
        return geminiClient.listModels()
            .collectList()
            .flatMap(catalogue -> Mono.justOrEmpty(modelSelector.select(catalogue)))
            .doOnNext(model -> {
                activeModel.set(model);
                log.info("Gemini model selected: {}", model);
            })
            .onErrorResume(error -> {
                log.warn("Could not select a Gemini model: {}", error.getMessage());
                return Mono.empty();
            });
    }

    private Mono<String> attempt(String prompt) {
        String model = activeModel.get();
        return geminiClient.generateContent(model, prompt)
            .onErrorResume(ModelNotFoundException.class, notFound -> switchModel(model, notFound));
    }

    private Mono<String> switchModel(String failedModel, ModelNotFoundException notFound) {
        log.info("Model '{}' not available, looking for a compatible one", failedModel);
        return selectPreferredModel()
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(selected -> {
                if (selected.isPresent() && !selected.get().equals(failedModel)) {
                    return Mono.error(new ModelSwitchedException(selected.get(), notFound));
                }
                return Mono.error(notFound);
            });
    }

    private Retry retryPolicy() {
        int maxAttempts = properties.getMaxAttempts();
        Duration backoff = properties.getBackoff();
        return Retry.from(signals -> signals.concatMap(signal -> {
            long attempt = signal.totalRetries() + 1;
            Throwable failure = signal.failure();
            log.warn("AI attempt {} with model '{}' failed: {}", attempt, activeModel.get(), failure.getMessage());

            if (failure instanceof QuotaExhaustedException || attempt >= maxAttempts) {
                return Mono.error(failure);
            }
            if (failure instanceof ModelSwitchedException) {
                return Mono.just(attempt);
            }
            return Mono.delay(backoff.multipliedBy(attempt)).thenReturn(attempt);
        }));
    }
}
