package com.family.library.telegram;

import com.family.library.dto.InlineButton;
import com.family.library.dto.InlineKeyboard;
import com.family.library.dto.OutboundMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Thin Bot API client over {@link RestTemplate}. Sends are best effort and only log;
 * {@link #getUpdates(long, int)} throws so the polling loop can back off.
 */
@Service
public class TelegramClient {

    private static final Logger log = LoggerFactory.getLogger(TelegramClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String token;
    private final String apiUrl;

    public TelegramClient(RestTemplateBuilder builder,
                          ObjectMapper objectMapper,
                          @Value("${telegram.token:}") String token,
                          @Value("${telegram.api-url:https://api.telegram.org}") String apiUrl,
                          @Value("${telegram.poll-timeout-seconds:30}") int pollTimeoutSeconds) {
        // long polling holds the request open for pollTimeoutSeconds
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(pollTimeoutSeconds + 15L))
                .build();
        this.objectMapper = objectMapper;
        this.token = StringUtils.trimToEmpty(token);
        this.apiUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(apiUrl), "/");
    }

    public boolean isConfigured() {
        return !token.isEmpty();
    }

    // =========================================================
    // OUTBOUND
    // =========================================================
    public void sendMessage(OutboundMessage message) {
        if (!isConfigured()) {
            log.warn("Telegram token not set; skipping sendMessage to {}", message.getTarget());
            return;
        }
        try {
            call("sendMessage", toSendMessagePayload(message));
        } catch (TelegramApiException e) {
            log.error("sendMessage failed for {}", message.getTarget(), e);
        }
    }

    public void answerCallbackQuery(String callbackQueryId) {
        if (!isConfigured() || callbackQueryId == null) {
            return;
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.put("callback_query_id", callbackQueryId);
        try {
            call("answerCallbackQuery", body);
        } catch (TelegramApiException e) {
            log.warn("answerCallbackQuery failed for {}: {}", callbackQueryId, e.getMessage());
        }
    }

    ObjectNode toSendMessagePayload(OutboundMessage message) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("chat_id", message.getTarget().getChatId());
        if (message.getTarget().getThreadId() != null) {
            body.put("message_thread_id", message.getTarget().getThreadId());
        }
        body.put("text", message.getText());
        if (message.hasKeyboard()) {
            body.set("reply_markup", toReplyMarkup(message.getKeyboard()));
        }
        return body;
    }

    private ObjectNode toReplyMarkup(InlineKeyboard keyboard) {
        ObjectNode markup = objectMapper.createObjectNode();
        ArrayNode rows = markup.putArray("inline_keyboard");
        for (List<InlineButton> row : keyboard.getRows()) {
            ArrayNode jsonRow = rows.addArray();
            for (InlineButton button : row) {
                jsonRow.addObject()
                        .put("text", button.getText())
                        .put("callback_data", button.getData());
            }
        }
        return markup;
    }

    // =========================================================
    // INBOUND / WEBHOOK SETUP
    // =========================================================
    public List<JsonNode> getUpdates(long offset, int timeoutSeconds) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("offset", offset);
        body.put("timeout", timeoutSeconds);
        body.putArray("allowed_updates").add("message").add("callback_query");
        JsonNode result = call("getUpdates", body);
        List<JsonNode> updates = new ArrayList<>();
        if (result != null && result.isArray()) {
            result.forEach(updates::add);
        }
        return updates;
    }

    public void setWebhook(String url, String secretToken) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("url", url);
        if (StringUtils.isNotBlank(secretToken)) {
            body.put("secret_token", secretToken);
        }
        body.putArray("allowed_updates").add("message").add("callback_query");
        call("setWebhook", body);
        log.info("Webhook registered | url={}", url);
    }

    public void deleteWebhook() {
        call("deleteWebhook", objectMapper.createObjectNode());
        log.info("Webhook removed, switching to long polling");
    }

    private JsonNode call(String method, ObjectNode body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<String> request;
        try {
            request = new HttpEntity<>(objectMapper.writeValueAsString(body), headers);
        } catch (Exception e) {
            throw new TelegramApiException("Cannot serialize " + method + " request", e);
        }

        String raw;
        try {
            raw = restTemplate.postForObject(apiUrl + "/bot" + token + "/" + method, request, String.class);
        } catch (RestClientException e) {
            // the URL carries the token, keep it out of the message
            throw new TelegramApiException(method + " request failed: " + e.getClass().getSimpleName(), e);
        }

        JsonNode response;
        try {
            response = objectMapper.readTree(raw);
        } catch (Exception e) {
            throw new TelegramApiException("Unreadable " + method + " response", e);
        }
        if (response == null || !response.path("ok").asBoolean(false)) {
            String description = response != null ? response.path("description").asText("") : "";
            throw new TelegramApiException(method + " rejected: " + description);
        }
        return response.get("result");
    }
}
