package com.family.library.flow;

import com.family.library.conversation.RotationCalculator;
import com.family.library.dto.InboundEvent;
import com.family.library.dto.OutboundMessage;
import com.family.library.entity.Participant;
import com.family.library.entity.ReadingEvent;
import com.family.library.service.ResponsePhrases;
import com.family.library.storage.LibraryStorage;
import com.family.library.storage.StorageException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@code /who_is_next}: applies the reading rotation to the most recent event.
 */
@Component
@RequiredArgsConstructor
public class WhoIsNextCommand implements CommandHandler {

    private static final Logger log = LoggerFactory.getLogger(WhoIsNextCommand.class);

    private final LibraryStorage storage;
    private final ResponsePhrases phrases;

    @Override
    public List<String> tokens() {
        return List.of("who_is_next");
    }

    @Override
    public StepOutcome start(InboundEvent event) {
        String reply;
        try {
            List<Participant> participants = storage.listParticipants();
            if (participants.isEmpty()) {
                reply = phrases.noParticipants();
            } else {
                List<ReadingEvent> last = storage.getLastEvents(1);
                String lastName = last.isEmpty() ? "" : last.get(0).getParticipantName();
                String next = RotationCalculator.nextParticipant(participants, lastName);
                log.debug("[{}] Rotation | last='{}' next='{}'", event.getUserId(), lastName, next);
                reply = next.isEmpty() ? phrases.noChildParticipants() : phrases.nextReader(next);
            }
        } catch (StorageException e) {
            log.warn("[{}] Failed to compute next reader", event.getUserId(), e);
            reply = phrases.storageError();
        }
        return StepOutcome.noDialog(OutboundMessage.text(event.getContext(), reply));
    }
}
