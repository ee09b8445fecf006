package com.updesk.helpdesk.integration.mail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import com.updesk.helpdesk.integration.props.IntegrationProperties;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Sends plain-text e-mails over SMTP. {@link JavaMailSender} blocks, so delivery runs on
 * the bounded elastic scheduler.
 */
@Component
public class EmailNotifier {

    private static final Logger log = LoggerFactory.getLogger(EmailNotifier.class);

    private final JavaMailSender mailSender;
    private final IntegrationProperties.MailProperties properties;

    public EmailNotifier(JavaMailSender mailSender, IntegrationProperties integrationProperties) {
        this.mailSender = mailSender;
        this.properties = integrationProperties.getMail();
    }

    /**
     * Emits {@code true} once the message was handed to the SMTP server and
     * {@code false} when SMTP is not configured. Delivery failures are signalled as errors.
     */
    public Mono<Boolean> send(String recipient, String subject, String body) {
        if (!properties.isConfigured()) {
            log.warn("SMTP not configured (host / username / password missing); e-mail to {} not sent", recipient);
            return Mono.just(false);
        }

        return Mono.fromCallable(() -> {
                SimpleMailMessage message = new SimpleMailMessage();
                message.setFrom(properties.resolveFrom());
                message.setTo(recipient);
                message.setSubject(subject);
                message.setText(body);
                mailSender.send(message);
                log.info("E-mail '{}' sent to {}", subject, recipient);
                return true;
            })
            .subscribeOn(Schedulers.boundedElastic());
    }
}
