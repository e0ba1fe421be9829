package com.family.library.flow;

import com.family.library.conversation.ConversationState;
import com.family.library.conversation.DialogCommand;
import com.family.library.conversation.NewBookData;
import com.family.library.dto.InboundEvent;
import com.family.library.dto.OutboundMessage;
import com.family.library.service.ResponsePhrases;
import com.family.library.storage.LibraryStorage;
import com.family.library.storage.StorageException;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * {@code /new_book}: asks for a name and registers it as a readable book.
 */
@Component
@RequiredArgsConstructor
public class RegisterBookFlow implements DialogFlow {

    private static final Logger log = LoggerFactory.getLogger(RegisterBookFlow.class);

    static final int STEP_AWAIT_NAME = 1;

    private final LibraryStorage storage;
    private final ResponsePhrases phrases;

    @Override
    public DialogCommand command() {
        return DialogCommand.NEW_BOOK;
    }

    @Override
    public List<String> tokens() {
        return List.of(DialogCommand.NEW_BOOK.getToken());
    }

    @Override
    public Set<String> buttonPrefixes() {
        return Collections.emptySet();
    }

    @Override
    public StepOutcome start(InboundEvent event) {
        ConversationState state = ConversationState.begin(NewBookData.INSTANCE, event.getContext());
        return StepOutcome.of(state, OutboundMessage.text(event.getContext(), phrases.askBookName()));
    }

    @Override
    public StepOutcome onText(ConversationState state, String text) {
        if (state.getStep() != STEP_AWAIT_NAME) {
            throw new IllegalStateException("new_book dialog has no step " + state.getStep());
        }
        String name = StringUtils.trimToEmpty(text);
        if (name.isEmpty()) {
            return StepOutcome.of(state, OutboundMessage.text(state.getContext(), phrases.askBookName()));
        }
        try {
            String id = storage.createBook(name);
            log.info("Registered book | id={} name={}", id, name);
            return StepOutcome.of(state.complete(),
                    OutboundMessage.text(state.getContext(), phrases.bookCreated(name)));
        } catch (StorageException e) {
            log.warn("Failed to create book '{}'", name, e);
            return StepOutcome.of(state.complete(),
                    OutboundMessage.text(state.getContext(), phrases.storageError()));
        }
    }

    @Override
    public StepOutcome onButton(ConversationState state, String prefix, String value) {
        return StepOutcome.of(state, OutboundMessage.text(state.getContext(), phrases.staleButton()));
    }
}
