package com.updesk.helpdesk.integration.props;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties describing how the service talks to external systems.
 *
 * <p>The structure mirrors {@code application.yml}. Credentials are optional on purpose:
 * an integration without them is reported as not configured and its calls become
 * logged no-ops, so the ticket workflow keeps running.</p>
 */
@Validated
@ConfigurationProperties(prefix = "integration")
public class IntegrationProperties {

    @Valid
    @NestedConfigurationProperty
    private final AiProperties ai = new AiProperties();

    @Valid
    @NestedConfigurationProperty
    private final TelegramProperties telegram = new TelegramProperties();

    @Valid
    @NestedConfigurationProperty
    private final MailProperties mail = new MailProperties();

    @Valid
    @NestedConfigurationProperty
    private final AttachmentProperties attachments = new AttachmentProperties();

    @Valid
    @NestedConfigurationProperty
    private final TriageProperties triage = new TriageProperties();

    public AiProperties getAi() {
        return ai;
    }

    public TelegramProperties getTelegram() {
        return telegram;
    }

    public MailProperties getMail() {
        return mail;
    }

    public AttachmentProperties getAttachments() {
        return attachments;
    }

    public TriageProperties getTriage() {
        return triage;
    }

    public static class AiProperties {

        private String apiKey;

        @NotBlank
        private String baseUrl = "https://generativelanguage.googleapis.com";

        /**
         * Model used until the client re-selects one after a "model not found" answer.
         */
        @NotBlank
        private String model = "gemini-pro";

        @Min(1)
        private int maxAttempts = 2;

        @NotNull
        private Duration backoff = Duration.ofSeconds(1);

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        private List<String> modelPreferences = new ArrayList<>(List.of("flash", "pro", "2.5", "2.0"));

        private boolean selectModelOnStartup = true;

        public boolean isConfigured() {
            return StringUtils.hasText(apiKey);
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBackoff() {
            return backoff;
        }

        public void setBackoff(Duration backoff) {
            this.backoff = backoff;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public List<String> getModelPreferences() {
            return modelPreferences;
        }

        public void setModelPreferences(List<String> modelPreferences) {
            this.modelPreferences = modelPreferences;
        }

        public boolean isSelectModelOnStartup() {
            return selectModelOnStartup;
        }

        public void setSelectModelOnStartup(boolean selectModelOnStartup) {
            this.selectModelOnStartup = selectModelOnStartup;
        }
    }

    public static class TelegramProperties {

        @NotBlank
        private String baseUrl = "https://api.telegram.org";

        private String botToken;

        private String chatId;

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * When set, inbound webhook calls must carry it in
         * {@code X-Telegram-Bot-Api-Secret-Token}.
         */
        private String webhookSecret;

        /**
         * User id recorded as the author of messages that arrive through Telegram.
         */
        @NotNull
        private Long supportUserId = 1L;

        @NotBlank
        private String supportDisplayName = "Suporte";

        public boolean isConfigured() {
            return StringUtils.hasText(botToken) && StringUtils.hasText(chatId);
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getBotToken() {
            return botToken;
        }

        public void setBotToken(String botToken) {
            this.botToken = botToken;
        }

        public String getChatId() {
            return chatId;
        }

        public void setChatId(String chatId) {
            this.chatId = chatId;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public String getWebhookSecret() {
            return webhookSecret;
        }

        public void setWebhookSecret(String webhookSecret) {
            this.webhookSecret = webhookSecret;
        }

        public Long getSupportUserId() {
            return supportUserId;
        }

        public void setSupportUserId(Long supportUserId) {
            this.supportUserId = supportUserId;
        }

        public String getSupportDisplayName() {
            return supportDisplayName;
        }

        public void setSupportDisplayName(String supportDisplayName) {
            this.supportDisplayName = supportDisplayName;
        }
    }

    public static class MailProperties {

        private String host;

        private int port = 587;

        private String username;

        private String password;

        /**
         * Sender address; the SMTP username is used when blank.
         */
        private String from;

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        public boolean isConfigured() {
            return StringUtils.hasText(host) && StringUtils.hasText(username) && StringUtils.hasText(password);
        }

        public String resolveFrom() {
            return StringUtils.hasText(from) ? from : username;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class AttachmentProperties {

        private List<String> allowedExtensions = new ArrayList<>(List.of("png", "jpg", "jpeg", "gif", "pdf", "doc", "docx"));

        public boolean isAllowed(String filename) {
            if (!StringUtils.hasText(filename)) {
                return false;
            }
            String extension = StringUtils.getFilenameExtension(filename);
            return extension != null && allowedExtensions.contains(extension.toLowerCase(Locale.ROOT));
        }

        public List<String> getAllowedExtensions() {
            return allowedExtensions;
        }

        public void setAllowedExtensions(List<String> allowedExtensions) {
            this.allowedExtensions = allowedExtensions;
        }
    }

    public static class TriageProperties {

        @Min(1)
        private int pageSize = 20;

        /**
         * How long a proposal stays confirmable. Older drafts are rejected and purged.
         */
        @NotNull
        private Duration draftTtl = Duration.ofHours(2);

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public Duration getDraftTtl() {
            return draftTtl;
        }

        public void setDraftTtl(Duration draftTtl) {
            this.draftTtl = draftTtl;
        }
    }
}
