package com.updesk.helpdesk.integration.mail;

import java.util.Properties;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import com.updesk.helpdesk.integration.props.IntegrationProperties;

/**
 * SMTP sender built from {@code integration.mail.*}: STARTTLS is required, login uses
 * the configured credentials and every socket operation is time-bounded.
 */
@Configuration
public class MailConfig {

    @Bean
    public JavaMailSender javaMailSender(IntegrationProperties integrationProperties) {
        IntegrationProperties.MailProperties mail = integrationProperties.getMail();
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(mail.getHost());
        sender.setPort(mail.getPort());
        sender.setUsername(mail.getUsername());
        sender.setPassword(mail.getPassword());
        sender.setDefaultEncoding("UTF-8");

        String timeout = String.valueOf(mail.getTimeout().toMillis());
        Properties props = sender.getJavaMailProperties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.starttls.required", "true");
        props.put("mail.smtp.connectiontimeout", timeout);
        props.put("mail.smtp.timeout", timeout);
        props.put("mail.smtp.writetimeout", timeout);
        return sender;
    }
}
