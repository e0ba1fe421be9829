package com.family.library.telegram;

import com.family.library.conversation.ReplyContext;
import com.family.library.dto.InboundEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TelegramUpdateMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TelegramUpdateMapper mapper = new TelegramUpdateMapper();

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw.replace('\'', '"'));
    }

    @Test
    void shouldMapTextMessageInForumTopic() throws Exception {
        JsonNode update = json("{'update_id':10,'message':{'message_id':1,'message_thread_id':77,"
                + "'from':{'id':42,'first_name':'Ann'},'chat':{'id':-1001,'type':'supergroup'},'text':'/read@LibBot'}}");

        Optional<InboundEvent> event = mapper.map(update);

        assertThat(event).hasValueSatisfying(e -> {
            assertThat(e.isButton()).isFalse();
            assertThat(e.getUserId()).isEqualTo(42L);
            assertThat(e.getContext()).isEqualTo(new ReplyContext(-1001L, 77));
            assertThat(e.getPayload()).isEqualTo("/read@LibBot");
        });
    }

    @Test
    void shouldMapCallbackQuery() throws Exception {
        JsonNode update = json("{'update_id':11,'callback_query':{'id':'cbq-1','from':{'id':42},"
                + "'message':{'message_id':5,'chat':{'id':555}},'data':'item:3'}}");

        InboundEvent event = mapper.map(update).orElseThrow();

        assertThat(event.isButton()).isTrue();
        assertThat(event.getCallbackId()).isEqualTo("cbq-1");
        assertThat(event.getPayload()).isEqualTo("item:3");
        assertThat(event.getContext()).isEqualTo(ReplyContext.chat(555L));
    }

    @Test
    void shouldIgnoreNonTextUpdates() throws Exception {
        assertThat(mapper.map(json("{'update_id':12,'message':{'from':{'id':1},'chat':{'id':1},'sticker':{}}}"))).isEmpty();
        assertThat(mapper.map(json("{'update_id':13,'edited_message':{'text':'x'}}"))).isEmpty();
        assertThat(mapper.map(null)).isEmpty();
    }
}
