package com.family.library.telegram;

import com.family.library.dto.OutboundMessage;
import com.family.library.service.MessageGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TelegramMessageGateway implements MessageGateway {

    private final TelegramClient client;

    @Override
    public void send(OutboundMessage message) {
        client.sendMessage(message);
    }

    @Override
    public void acknowledge(String callbackId) {
        client.answerCallbackQuery(callbackId);
    }
}
