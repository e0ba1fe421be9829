package com.family.library.telegram;

import com.family.library.dto.InboundEvent;
import com.family.library.service.UpdateDispatcher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramPollingRunnerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TelegramClient client = mock(TelegramClient.class);
    private final UpdateDispatcher dispatcher = mock(UpdateDispatcher.class);
    private final TelegramPollingRunner runner =
            new TelegramPollingRunner(client, new TelegramUpdateMapper(), dispatcher, Runnable::run, 30);

    @AfterEach
    void tearDown() {
        runner.stop();
    }

    private JsonNode update(long id, String text) throws Exception {
        return objectMapper.readTree("{\"update_id\":" + id + ",\"message\":{\"from\":{\"id\":42},"
                + "\"chat\":{\"id\":42},\"text\":\"" + text + "\"}}");
    }

    @Test
    void shouldDispatchUpdatesAndAdvanceOffset() throws Exception {
        when(client.isConfigured()).thenReturn(true);
        when(client.getUpdates(anyLong(), anyInt()))
                .thenReturn(List.of(update(10, "/start"), update(11, "/last")))
                .thenAnswer(inv -> {
                    runner.stop();
                    return List.of();
                });

        runner.start();

        verify(dispatcher, timeout(5_000).times(2)).dispatch(any(InboundEvent.class));
        verify(client, timeout(5_000)).getUpdates(0L, 30);
        verify(client, timeout(5_000)).getUpdates(12L, 30);
        verify(client).deleteWebhook();
    }

    @Test
    void shouldKeepPollingAfterFailure() throws Exception {
        when(client.isConfigured()).thenReturn(true);
        when(client.getUpdates(anyLong(), anyInt()))
                .thenThrow(new TelegramApiException("boom"))
                .thenReturn(List.of(update(5, "/start")))
                .thenAnswer(inv -> {
                    runner.stop();
                    return List.of();
                });

        runner.start();

        verify(dispatcher, timeout(5_000)).dispatch(any(InboundEvent.class));
    }

    @Test
    void shouldKeepPollingAfterUnexpectedError() throws Exception {
        when(client.isConfigured()).thenReturn(true);
        when(client.getUpdates(anyLong(), anyInt()))
                .thenThrow(new IllegalStateException("unexpected payload"))
                .thenReturn(List.of(update(7, "/start")))
                .thenAnswer(inv -> {
                    runner.stop();
                    return List.of();
                });

        runner.start();

        verify(dispatcher, timeout(5_000)).dispatch(any(InboundEvent.class));
        verify(client, timeout(5_000)).getUpdates(8L, 30);
    }

    @Test
    void shouldNotStartWithoutToken() {
        when(client.isConfigured()).thenReturn(false);

        runner.start();

        verify(client, never()).getUpdates(anyLong(), anyInt());
    }
}
