package com.family.library.telegram;

import com.family.library.controller.WebhookController;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Points the Bot API at {@code <telegram.webhook-url>/telegram-webhook} once the app is up.
 */
@Component
@ConditionalOnProperty(name = "telegram.mode", havingValue = "webhook")
public class WebhookRegistrar {

    private static final Logger log = LoggerFactory.getLogger(WebhookRegistrar.class);

    private final TelegramClient client;
    private final String webhookUrl;
    private final String secretToken;

    public WebhookRegistrar(TelegramClient client,
                            @Value("${telegram.webhook-url:}") String webhookUrl,
                            @Value("${telegram.secret-token:}") String secretToken) {
        this.client = client;
        this.webhookUrl = webhookUrl;
        this.secretToken = secretToken;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void register() {
        if (!client.isConfigured() || StringUtils.isBlank(webhookUrl)) {
            log.warn("telegram.token or telegram.webhook-url is empty; webhook not registered");
            return;
        }
        String url = StringUtils.removeEnd(webhookUrl.trim(), "/") + WebhookController.PATH;
        try {
            client.setWebhook(url, secretToken);
        } catch (TelegramApiException e) {
            log.error("Webhook registration failed for {}", url, e);
        }
    }
}
