package com.family.library.flow;

import com.family.library.conversation.ConversationState;
import com.family.library.conversation.DialogCommand;
import com.family.library.conversation.ReadData;
import com.family.library.conversation.ReplyContext;
import com.family.library.dto.InboundEvent;
import com.family.library.dto.InlineButton;
import com.family.library.dto.InlineKeyboard;
import com.family.library.dto.OutboundMessage;
import com.family.library.entity.Book;
import com.family.library.entity.Participant;
import com.family.library.service.ResponsePhrases;
import com.family.library.storage.LibraryStorage;
import com.family.library.storage.StorageException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * {@code /read}: date, then book, then reader; records one reading event.
 * <pre>
 * step 1  date:today|yesterday|2daysago|3daysago|custom  (custom -> YYYY-MM-DD text)
 * step 2  item:&lt;index&gt;, page:&lt;n&gt;
 * step 3  actor:&lt;name&gt;
 * </pre>
 */
@Component
public class ReadEventFlow implements DialogFlow {

    private static final Logger log = LoggerFactory.getLogger(ReadEventFlow.class);

    public static final String DATE_PREFIX = "date:";
    public static final String ITEM_PREFIX = "item:";
    public static final String PAGE_PREFIX = "page:";
    public static final String ACTOR_PREFIX = "actor:";

    static final int STEP_DATE = 1;
    static final int STEP_BOOK = 2;
    static final int STEP_PARTICIPANT = 3;

    static final int BOOKS_PER_PAGE = 20;

    private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final DateTimeFormatter STRICT_DATE =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private final LibraryStorage storage;
    private final ResponsePhrases phrases;
    private final Clock clock;

    public ReadEventFlow(LibraryStorage storage, ResponsePhrases phrases, Clock clock) {
        this.storage = storage;
        this.phrases = phrases;
        this.clock = clock;
    }

    @Override
    public DialogCommand command() {
        return DialogCommand.READ;
    }

    @Override
    public List<String> tokens() {
        return List.of(DialogCommand.READ.getToken());
    }

    @Override
    public Set<String> buttonPrefixes() {
        return Set.of(DATE_PREFIX, ITEM_PREFIX, PAGE_PREFIX, ACTOR_PREFIX);
    }

    @Override
    public StepOutcome start(InboundEvent event) {
        ReplyContext ctx = event.getContext();
        List<Book> books;
        try {
            books = storage.listReadableBooks();
        } catch (StorageException e) {
            log.warn("[{}] Failed to list readable books", event.getUserId(), e);
            return StepOutcome.noDialog(OutboundMessage.text(ctx, phrases.storageError()));
        }
        if (books.isEmpty()) {
            log.info("[{}] No readable books available", event.getUserId());
            return StepOutcome.noDialog(OutboundMessage.text(ctx, phrases.noReadableBooks()));
        }
        ConversationState state = ConversationState.begin(ReadData.empty(), ctx);
        return StepOutcome.of(state, OutboundMessage.withKeyboard(ctx, phrases.selectReadingDate(), dateKeyboard()));
    }

    // =========================================================
    // TEXT INPUT
    // =========================================================
    @Override
    public StepOutcome onText(ConversationState state, String text) {
        ReadData data = state.dataAs(ReadData.class);
        if (state.getStep() != STEP_DATE || !data.isAwaitingCustomDate()) {
            return StepOutcome.of(state, OutboundMessage.text(state.getContext(), phrases.useButtonsHint()));
        }
        Optional<LocalDate> date = parseStrictDate(text);
        if (date.isEmpty()) {
            return StepOutcome.of(state, OutboundMessage.text(state.getContext(), phrases.invalidDate()));
        }
        return showBooks(state.withData(data.withDate(date.get())), 0);
    }

    static Optional<LocalDate> parseStrictDate(String text) {
        String trimmed = StringUtils.trimToEmpty(text);
        if (!DATE_PATTERN.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(trimmed, STRICT_DATE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    // =========================================================
    // BUTTONS
    // =========================================================
    @Override
    public StepOutcome onButton(ConversationState state, String prefix, String value) {
        switch (prefix) {
            case DATE_PREFIX:
                return expectStep(state, STEP_DATE).orElseGet(() -> onDate(state, value));
            case PAGE_PREFIX:
                return expectStep(state, STEP_BOOK).orElseGet(() -> onPage(state, value));
            case ITEM_PREFIX:
                return expectStep(state, STEP_BOOK).orElseGet(() -> onBook(state, value));
            case ACTOR_PREFIX:
                return expectStep(state, STEP_PARTICIPANT).orElseGet(() -> onParticipant(state, value));
            default:
                throw new IllegalArgumentException("read dialog does not own prefix " + prefix);
        }
    }

    private Optional<StepOutcome> expectStep(ConversationState state, int step) {
        if (state.getStep() == step) {
            return Optional.empty();
        }
        return Optional.of(StepOutcome.of(state, OutboundMessage.text(state.getContext(), phrases.staleButton())));
    }

    private StepOutcome onDate(ConversationState state, String value) {
        ReadData data = state.dataAs(ReadData.class);
        int daysAgo;
        switch (value) {
            case "custom":
                return StepOutcome.of(state.withData(data.awaitCustomDate()),
                        OutboundMessage.text(state.getContext(), phrases.askCustomDate()));
            case "today":
                daysAgo = 0;
                break;
            case "yesterday":
                daysAgo = 1;
                break;
            case "2daysago":
                daysAgo = 2;
                break;
            case "3daysago":
                daysAgo = 3;
                break;
            default:
                return StepOutcome.of(state, OutboundMessage.withKeyboard(state.getContext(),
                        phrases.selectReadingDate(), dateKeyboard()));
        }
        // wall clock at the moment of the click, not when the dialog started
        LocalDate date = LocalDate.now(clock).minusDays(daysAgo);
        return showBooks(state.withData(data.withDate(date)), 0);
    }

    private StepOutcome onPage(ConversationState state, String value) {
        int page;
        try {
            page = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return StepOutcome.of(state, OutboundMessage.text(state.getContext(), phrases.invalidBookSelection()));
        }
        return showBooks(state, page);
    }

    private StepOutcome onBook(ConversationState state, String value) {
        ReadData data = state.dataAs(ReadData.class);
        int index;
        try {
            index = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return StepOutcome.of(state, OutboundMessage.text(state.getContext(), phrases.invalidBookSelection()));
        }

        List<Book> books;
        try {
            books = storage.listReadableBooks();
        } catch (StorageException e) {
            log.warn("Failed to re-list books for selection {}", index, e);
            return StepOutcome.of(state.complete(), OutboundMessage.text(state.getContext(), phrases.storageError()));
        }
        if (index < 0 || index >= books.size()) {
            log.debug("Book index {} out of range ({} books)", index, books.size());
            return StepOutcome.of(state, OutboundMessage.text(state.getContext(), phrases.invalidBookSelection()));
        }

        String bookName = books.get(index).getName();
        List<Participant> participants;
        try {
            participants = storage.listParticipants();
        } catch (StorageException e) {
            log.warn("Failed to list participants", e);
            return StepOutcome.of(state.complete(), OutboundMessage.text(state.getContext(), phrases.storageError()));
        }

        ConversationState next = state.advanceTo(STEP_PARTICIPANT, data.withBookName(bookName));
        return StepOutcome.of(next, OutboundMessage.withKeyboard(state.getContext(),
                phrases.selectParticipant(), participantKeyboard(participants)));
    }

    private StepOutcome onParticipant(ConversationState state, String participantName) {
        ReadData data = state.dataAs(ReadData.class);
        LocalDate date = data.requireDate();
        String bookName = data.requireBookName();

        try {
            boolean known = storage.listParticipants().stream()
                    .anyMatch(p -> p.getName().equals(participantName));
            if (!known) {
                return StepOutcome.of(state, OutboundMessage.text(state.getContext(), phrases.invalidParticipant()));
            }
            storage.createEvent(date, bookName, participantName);
        } catch (StorageException e) {
            log.warn("Failed to record reading event {} / {} / {}", date, bookName, participantName, e);
            return StepOutcome.of(state.complete(), OutboundMessage.text(state.getContext(), phrases.storageError()));
        }

        log.info("Reading event recorded | date={} book={} reader={}", date, bookName, participantName);
        return StepOutcome.of(state.complete(), OutboundMessage.text(state.getContext(),
                phrases.eventRecorded(date, bookName, participantName)));
    }

    // =========================================================
    // KEYBOARDS
    // =========================================================
    private StepOutcome showBooks(ConversationState state, int requestedPage) {
        ReadData data = state.dataAs(ReadData.class);
        List<Book> books;
        try {
            books = storage.listReadableBooks();
        } catch (StorageException e) {
            log.warn("Failed to list readable books", e);
            return StepOutcome.of(state.complete(), OutboundMessage.text(state.getContext(), phrases.storageError()));
        }
        if (books.isEmpty()) {
            return StepOutcome.of(state.complete(), OutboundMessage.text(state.getContext(), phrases.noReadableBooks()));
        }

        int pageCount = (books.size() + BOOKS_PER_PAGE - 1) / BOOKS_PER_PAGE;
        int page = Math.max(0, Math.min(requestedPage, pageCount - 1));
        ConversationState next = state.advanceTo(STEP_BOOK, data.withPage(page));
        return StepOutcome.of(next, OutboundMessage.withKeyboard(state.getContext(),
                phrases.selectBook(page, pageCount), bookKeyboard(books, page, pageCount)));
    }

    static InlineKeyboard dateKeyboard() {
        List<List<InlineButton>> rows = new ArrayList<>();
        rows.add(List.of(InlineButton.of("📆 Today", DATE_PREFIX, "today"),
                InlineButton.of("⏮ Yesterday", DATE_PREFIX, "yesterday")));
        rows.add(List.of(InlineButton.of("⏮⏮ 2 days ago", DATE_PREFIX, "2daysago"),
                InlineButton.of("⏮⏮⏮ 3 days ago", DATE_PREFIX, "3daysago")));
        rows.add(List.of(InlineButton.of("📝 Custom date", DATE_PREFIX, "custom")));
        return InlineKeyboard.ofRows(rows);
    }

    static InlineKeyboard bookKeyboard(List<Book> books, int page, int pageCount) {
        int from = page * BOOKS_PER_PAGE;
        int to = Math.min(from + BOOKS_PER_PAGE, books.size());
        List<InlineButton> buttons = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            buttons.add(InlineButton.of(books.get(i).getName(), ITEM_PREFIX, String.valueOf(i)));
        }
        InlineKeyboard grid = InlineKeyboard.twoColumns(buttons);
        if (pageCount <= 1) {
            return grid;
        }
        List<InlineButton> nav = new ArrayList<>(2);
        if (page > 0) {
            nav.add(InlineButton.of("« Prev", PAGE_PREFIX, String.valueOf(page - 1)));
        }
        if (page < pageCount - 1) {
            nav.add(InlineButton.of("Next »", PAGE_PREFIX, String.valueOf(page + 1)));
        }
        return grid.withRow(nav);
    }

    static InlineKeyboard participantKeyboard(List<Participant> participants) {
        List<InlineButton> buttons = new ArrayList<>(participants.size());
        for (Participant p : participants) {
            String label = (p.isParent() ? "👨 " : "👶 ") + p.getName();
            buttons.add(InlineButton.of(label, ACTOR_PREFIX, p.getName()));
        }
        return InlineKeyboard.singleColumn(buttons);
    }
}
