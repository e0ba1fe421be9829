package com.family.library.telegram;

import com.family.library.dto.InboundEvent;
import com.family.library.service.UpdateDispatcher;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Long-polling transport: pulls updates on one background thread and hands each
 * to the dispatcher on the update pool.
 */
@Component
@ConditionalOnProperty(name = "telegram.mode", havingValue = "polling")
public class TelegramPollingRunner {

    private static final Logger log = LoggerFactory.getLogger(TelegramPollingRunner.class);

    private static final long MIN_BACKOFF_MS = 1_000;
    private static final long MAX_BACKOFF_MS = 30_000;

    private final TelegramClient client;
    private final TelegramUpdateMapper mapper;
    private final UpdateDispatcher dispatcher;
    private final Executor updateExecutor;
    private final int pollTimeoutSeconds;

    private volatile boolean running;
    private Thread worker;
    private long offset;

    public TelegramPollingRunner(TelegramClient client,
                                 TelegramUpdateMapper mapper,
                                 UpdateDispatcher dispatcher,
                                 @Qualifier("updateExecutor") Executor updateExecutor,
                                 @Value("${telegram.poll-timeout-seconds:30}") int pollTimeoutSeconds) {
        this.client = client;
        this.mapper = mapper;
        this.dispatcher = dispatcher;
        this.updateExecutor = updateExecutor;
        this.pollTimeoutSeconds = pollTimeoutSeconds;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!client.isConfigured()) {
            log.warn("telegram.token is empty; long polling not started");
            return;
        }
        try {
            client.deleteWebhook();
        } catch (TelegramApiException e) {
            log.warn("Could not remove webhook before polling: {}", e.getMessage());
        }
        running = true;
        worker = new Thread(this::pollLoop, "telegram-poller");
        worker.setDaemon(true);
        worker.start();
        log.info("Long polling started | timeout={}s", pollTimeoutSeconds);
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (worker != null) {
            worker.interrupt();
        }
    }

    private void pollLoop() {
        long backoff = MIN_BACKOFF_MS;
        while (running) {
            try {
                List<JsonNode> updates = client.getUpdates(offset, pollTimeoutSeconds);
                for (JsonNode update : updates) {
                    offset = Math.max(offset, update.path("update_id").asLong() + 1);
                    submit(update);
                }
                backoff = MIN_BACKOFF_MS;
            } catch (TelegramApiException e) {
                if (!running) {
                    break;
                }
                log.warn("getUpdates failed, retrying in {} ms: {}", backoff, e.getMessage());
                if (!sleep(backoff)) {
                    break;
                }
                backoff = Math.min(backoff * 2, MAX_BACKOFF_MS);
            } catch (RuntimeException e) {
                log.error("Polling iteration failed, retrying in {} ms | offset={}", backoff, offset, e);
                if (!running || !sleep(backoff)) {
                    break;
                }
                backoff = Math.min(backoff * 2, MAX_BACKOFF_MS);
            }
        }
        log.info("Long polling stopped | offset={}", offset);
    }

    private void submit(JsonNode update) {
        Optional<InboundEvent> event = mapper.map(update);
        if (event.isEmpty()) {
            return;
        }
        try {
            updateExecutor.execute(() -> dispatcher.dispatch(event.get()));
        } catch (RejectedExecutionException e) {
            log.error("Update pool saturated, dropping {}", event.get(), e);
        }
    }

    private static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
