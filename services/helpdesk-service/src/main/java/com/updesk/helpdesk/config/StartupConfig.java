package com.updesk.helpdesk.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.updesk.helpdesk.integration.ai.AiTriageClient;
import com.updesk.helpdesk.repository.TicketRepository;

/**
 * One-off checks run once the application context is up.
 */
@Configuration
public class StartupConfig {

    private static final Logger log = LoggerFactory.getLogger(StartupConfig.class);

    /**
     * Performs a lightweight startup check by counting existing records, so operators
     * see the database connection is alive before any traffic hits the service.
     */
    @Bean
    public ApplicationRunner databaseProbe(TicketRepository repository) {
        return args -> repository.count()
            .subscribe(
                count -> log.info("Help desk started. Existing ticket count: {}", count),
                error -> log.error("Database probe failed", error));
    }

    /**
     * Picks the preferred Gemini model from the provider catalogue. Does nothing without
     * an API key; any failure leaves the configured model in place.
     */
    @Bean
    @ConditionalOnProperty(prefix = "integration.ai", name = "select-model-on-startup", havingValue = "true",
        matchIfMissing = true)
    public ApplicationRunner aiModelSelection(AiTriageClient aiTriageClient) {
        return args -> aiTriageClient.selectPreferredModel()
            .subscribe(model -> log.info("AI triage will use model {}", model));
    }
}
