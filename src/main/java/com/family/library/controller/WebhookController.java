package com.family.library.controller;

import com.family.library.dto.InboundEvent;
import com.family.library.service.UpdateDispatcher;
import com.family.library.telegram.TelegramUpdateMapper;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Push transport: Telegram POSTs each update here. The request is answered right away
 * and the update is dispatched on the update pool.
 */
@RestController
@ConditionalOnProperty(name = "telegram.mode", havingValue = "webhook")
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    public static final String PATH = "/telegram-webhook";
    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private final TelegramUpdateMapper mapper;
    private final UpdateDispatcher dispatcher;
    private final Executor updateExecutor;
    private final String secretToken;

    public WebhookController(TelegramUpdateMapper mapper,
                             UpdateDispatcher dispatcher,
                             @Qualifier("updateExecutor") Executor updateExecutor,
                             @Value("${telegram.secret-token:}") String secretToken) {
        this.mapper = mapper;
        this.dispatcher = dispatcher;
        this.updateExecutor = updateExecutor;
        this.secretToken = StringUtils.trimToEmpty(secretToken);
    }

    @PostMapping(PATH)
    public ResponseEntity<Void> receive(@RequestHeader(value = SECRET_HEADER, required = false) String secret,
                                        @RequestBody JsonNode update) {
        if (!secretToken.isEmpty() && !constantTimeEquals(secretToken, secret)) {
            log.warn("Webhook call with a wrong secret token rejected");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        Optional<InboundEvent> event = mapper.map(update);
        if (event.isPresent()) {
            try {
                updateExecutor.execute(() -> dispatcher.dispatch(event.get()));
            } catch (RejectedExecutionException e) {
                log.error("Update pool saturated, dropping {}", event.get(), e);
            }
        }
        return ResponseEntity.ok().build();
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }
}
