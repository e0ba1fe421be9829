package com.family.library.flow;

import com.family.library.dto.InboundEvent;
import com.family.library.dto.OutboundMessage;
import com.family.library.entity.ReadingEvent;
import com.family.library.service.ResponsePhrases;
import com.family.library.storage.LibraryStorage;
import com.family.library.storage.StorageException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class LastEventsCommand implements CommandHandler {

    private static final Logger log = LoggerFactory.getLogger(LastEventsCommand.class);

    static final int LIMIT = 10;

    private final LibraryStorage storage;
    private final ResponsePhrases phrases;

    @Override
    public List<String> tokens() {
        return List.of("last");
    }

    @Override
    public StepOutcome start(InboundEvent event) {
        String reply;
        try {
            List<ReadingEvent> events = storage.getLastEvents(LIMIT);
            reply = events.isEmpty() ? phrases.noEventsYet() : phrases.lastEvents(events);
        } catch (StorageException e) {
            log.warn("[{}] Failed to load last events", event.getUserId(), e);
            reply = phrases.storageError();
        }
        return StepOutcome.noDialog(OutboundMessage.text(event.getContext(), reply));
    }
}
