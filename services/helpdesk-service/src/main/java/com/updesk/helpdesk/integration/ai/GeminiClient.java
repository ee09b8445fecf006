package com.updesk.helpdesk.integration.ai;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.updesk.helpdesk.integration.props.IntegrationProperties;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Minimal client for the Google Generative Language REST API. Only implements what
 * triage needs: a single-turn text generation and the model catalogue.
 *
 * <p>HTTP failures are translated into {@link ModelNotFoundException},
 * {@link QuotaExhaustedException} or {@link AiProviderException}; retry decisions are
 * left to {@link AiTriageClient}.</p>
 */
@Component
public class GeminiClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiClient.class);

    private static final String API_KEY_HEADER = "x-goog-api-key";
    private static final String QUOTA_STATUS = "RESOURCE_EXHAUSTED";

    private final WebClient webClient;
    private final IntegrationProperties.AiProperties properties;

    public GeminiClient(WebClient.Builder builder, IntegrationProperties properties) {
        this.properties = properties.getAi();
        this.webClient = builder.clone()
            .baseUrl(this.properties.getBaseUrl())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    /**
     * Sends {@code prompt} to {@code model} and returns the text of the first candidate.
     */
    public Mono<String> generateContent(String model, String prompt) {
        Map<String, Object> payload = Map.of(
            "contents", List.of(Map.of(
                "parts", List.of(Map.of("text", prompt))
            ))
        );

        return webClient.post()
            .uri("/v1beta/models/{model}:generateContent", model)
            .header(API_KEY_HEADER, properties.getApiKey())
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toProviderException(model, response))
            .bodyToMono(GenerateContentResponse.class)
            .timeout(properties.getTimeout())
            .flatMap(response -> Mono.justOrEmpty(response.firstText()))
            .switchIfEmpty(Mono.error(() -> new AiProviderException("Model '%s' returned no text".formatted(model))));
    }

    /**
     * Lists every model visible to the configured key.
     */
    public Flux<GeminiModel> listModels() {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder.path("/v1beta/models").queryParam("pageSize", 1000).build())
            .header(API_KEY_HEADER, properties.getApiKey())
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toProviderException("*", response))
            .bodyToMono(ListModelsResponse.class)
            .timeout(properties.getTimeout())
            .flatMapIterable(response -> response.models() == null ? List.<GeminiModel>of() : response.models())
            .doOnComplete(() -> log.debug("Fetched Gemini model catalogue"));
    }

    private Mono<? extends Throwable> toProviderException(String model, ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(body -> classify(model, status, body));
    }

    static AiProviderException classify(String model, HttpStatusCode status, String body) {
        if (status.value() == HttpStatus.TOO_MANY_REQUESTS.value() || body.contains(QUOTA_STATUS)) {
            return new QuotaExhaustedException("HTTP %d".formatted(status.value()));
        }
        if (status.value() == HttpStatus.NOT_FOUND.value()) {
            return new ModelNotFoundException(model, "HTTP 404");
        }
        return new AiProviderException("Gemini responded with HTTP %d: %s".formatted(status.value(), abbreviate(body)));
    }

    private static String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateContentResponse(List<Candidate> candidates) {

        String firstText() {
            if (candidates == null || candidates.isEmpty()) {
                return null;
            }
            Content content = candidates.get(0).content();
            if (content == null || content.parts() == null) {
                return null;
            }
            StringBuilder text = new StringBuilder();
            for (Part part : content.parts()) {
                if (part.text() != null) {
                    text.append(part.text());
                }
            }
            return text.isEmpty() ? null : text.toString();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Candidate(Content content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Content(List<Part> parts) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Part(String text) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ListModelsResponse(List<GeminiModel> models) {
    }
}
