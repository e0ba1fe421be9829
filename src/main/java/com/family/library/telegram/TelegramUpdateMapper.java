package com.family.library.telegram;

import com.family.library.conversation.ReplyContext;
import com.family.library.dto.InboundEvent;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a raw Bot API {@code Update} into an {@link InboundEvent}.
 * Only text messages and button clicks are of interest; anything else maps to empty.
 */
@Component
public class TelegramUpdateMapper {

    private static final Logger log = LoggerFactory.getLogger(TelegramUpdateMapper.class);

    public Optional<InboundEvent> map(JsonNode update) {
        if (update == null) {
            return Optional.empty();
        }
        JsonNode callback = update.get("callback_query");
        if (callback != null) {
            return mapCallback(callback);
        }
        JsonNode message = update.get("message");
        if (message != null) {
            return mapMessage(message);
        }
        log.debug("Ignoring update {} without message or callback_query", update.path("update_id").asLong());
        return Optional.empty();
    }

    private Optional<InboundEvent> mapMessage(JsonNode message) {
        JsonNode from = message.get("from");
        JsonNode text = message.get("text");
        if (from == null || text == null || !text.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(InboundEvent.text(from.path("id").asLong(), context(message), text.asText()));
    }

    private Optional<InboundEvent> mapCallback(JsonNode callback) {
        JsonNode from = callback.get("from");
        JsonNode message = callback.get("message");
        JsonNode data = callback.get("data");
        if (from == null || message == null || data == null) {
            return Optional.empty();
        }
        return Optional.of(InboundEvent.button(from.path("id").asLong(), context(message),
                data.asText(), callback.path("id").asText(null)));
    }

    private static ReplyContext context(JsonNode message) {
        long chatId = message.path("chat").path("id").asLong();
        JsonNode thread = message.get("message_thread_id");
        return new ReplyContext(chatId, thread != null && thread.canConvertToInt() ? thread.asInt() : null);
    }
}
