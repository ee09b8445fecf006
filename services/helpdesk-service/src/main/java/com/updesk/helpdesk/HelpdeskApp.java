package com.updesk.helpdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.updesk.helpdesk.integration.props.IntegrationProperties;

/**
 * Spring Boot entry point for the UpDesk help-desk service.
 *
 * <p>The application exposes a reactive API that runs AI triage on new tickets, moves
 * them through their lifecycle, and mirrors ticket chat to Telegram and e-mail.</p>
 */
@SpringBootApplication
@EnableConfigurationProperties(IntegrationProperties.class)
public class HelpdeskApp {

    public static void main(String[] args) {
        SpringApplication.run(HelpdeskApp.class, args);
    }
}
