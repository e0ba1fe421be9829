package com.family.library.flow;

import com.family.library.dto.InboundEvent;
import com.family.library.dto.OutboundMessage;
import com.family.library.dto.RareBookStat;
import com.family.library.service.ResponsePhrases;
import com.family.library.storage.LibraryStorage;
import com.family.library.storage.StorageException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@code /rare}: books nobody has picked up for a while, once for children only and once overall.
 */
@Component
@RequiredArgsConstructor
public class RareBooksCommand implements CommandHandler {

    private static final Logger log = LoggerFactory.getLogger(RareBooksCommand.class);

    static final int LIMIT = 10;

    private final LibraryStorage storage;
    private final ResponsePhrases phrases;

    @Override
    public List<String> tokens() {
        return List.of("rare");
    }

    @Override
    public StepOutcome start(InboundEvent event) {
        String reply;
        try {
            List<RareBookStat> byChildren = storage.getRarelyReadBooks(LIMIT, true);
            List<RareBookStat> overall = storage.getRarelyReadBooks(LIMIT, false);
            reply = phrases.rareBooks(byChildren, overall);
        } catch (StorageException e) {
            log.warn("[{}] Failed to load rarely read books", event.getUserId(), e);
            reply = phrases.storageError();
        }
        return StepOutcome.noDialog(OutboundMessage.text(event.getContext(), reply));
    }
}
