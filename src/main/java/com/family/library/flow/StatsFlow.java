package com.family.library.flow;

import com.family.library.conversation.ConversationState;
import com.family.library.conversation.DialogCommand;
import com.family.library.conversation.StatsData;
import com.family.library.dto.BookStat;
import com.family.library.dto.InboundEvent;
import com.family.library.dto.InlineButton;
import com.family.library.dto.InlineKeyboard;
import com.family.library.dto.OutboundMessage;
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
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * {@code /stats}: pick a period, then whose reading to count, then print the top books.
 */
@Component
public class StatsFlow implements DialogFlow {

    private static final Logger log = LoggerFactory.getLogger(StatsFlow.class);

    public static final String PERIOD_PREFIX = "period:";
    public static final String FILTER_PREFIX = "filter:";

    static final int STEP_PERIOD = 1;
    static final int STEP_FILTER = 2;

    static final int TOP_BOOKS = 10;

    static final int MIN_YEAR = 1900;
    static final int MAX_YEAR = 2100;

    private static final Pattern MONTH_PATTERN = Pattern.compile("^(\\d{4})-(0[1-9]|1[0-2])$");
    private static final Pattern YEAR_PATTERN = Pattern.compile("^\\d{4}$");
    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("MMMM uuuu", Locale.ENGLISH);

    private final LibraryStorage storage;
    private final ResponsePhrases phrases;
    private final Clock clock;

    public StatsFlow(LibraryStorage storage, ResponsePhrases phrases, Clock clock) {
        this.storage = storage;
        this.phrases = phrases;
        this.clock = clock;
    }

    @Override
    public DialogCommand command() {
        return DialogCommand.STATS;
    }

    @Override
    public List<String> tokens() {
        return List.of(DialogCommand.STATS.getToken());
    }

    @Override
    public Set<String> buttonPrefixes() {
        return Set.of(PERIOD_PREFIX, FILTER_PREFIX);
    }

    @Override
    public StepOutcome start(InboundEvent event) {
        ConversationState state = ConversationState.begin(StatsData.empty(), event.getContext());
        return StepOutcome.of(state,
                OutboundMessage.withKeyboard(event.getContext(), phrases.selectStatsPeriod(), periodKeyboard()));
    }

    // =========================================================
    // TEXT INPUT
    // =========================================================
    @Override
    public StepOutcome onText(ConversationState state, String text) {
        StatsData data = state.dataAs(StatsData.class);
        if (state.getStep() != STEP_PERIOD) {
            return StepOutcome.of(state, OutboundMessage.text(state.getContext(), phrases.useButtonsHint()));
        }
        String input = StringUtils.trimToEmpty(text);
        switch (data.getAwaiting()) {
            case MONTH:
                return onMonthText(state, data, input);
            case YEAR:
                return onYearText(state, data, input);
            default:
                return StepOutcome.of(state, OutboundMessage.text(state.getContext(), phrases.useButtonsHint()));
        }
    }

    private StepOutcome onMonthText(ConversationState state, StatsData data, String input) {
        if (!MONTH_PATTERN.matcher(input).matches()) {
            return StepOutcome.of(state, OutboundMessage.text(state.getContext(), phrases.invalidMonth()));
        }
        YearMonth month = YearMonth.parse(input);
        String label = month.format(MONTH_LABEL);
        return showFilters(state, data.withPeriod(month.atDay(1), month.atEndOfMonth(), label));
    }

    private StepOutcome onYearText(ConversationState state, StatsData data, String input) {
        if (!YEAR_PATTERN.matcher(input).matches()) {
            return StepOutcome.of(state, OutboundMessage.text(state.getContext(), phrases.invalidYear()));
        }
        int year = Integer.parseInt(input);
        if (year < MIN_YEAR || year > MAX_YEAR) {
            return StepOutcome.of(state, OutboundMessage.text(state.getContext(), phrases.invalidYear()));
        }
        return showFilters(state, data.withPeriod(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31),
                "Year " + year));
    }

    // =========================================================
    // BUTTONS
    // =========================================================
    @Override
    public StepOutcome onButton(ConversationState state, String prefix, String value) {
        switch (prefix) {
            case PERIOD_PREFIX:
                if (state.getStep() != STEP_PERIOD) {
                    return stale(state);
                }
                return onPeriod(state, value);
            case FILTER_PREFIX:
                if (state.getStep() != STEP_FILTER) {
                    return stale(state);
                }
                return onFilter(state, value);
            default:
                throw new IllegalArgumentException("stats dialog does not own prefix " + prefix);
        }
    }

    private StepOutcome stale(ConversationState state) {
        return StepOutcome.of(state, OutboundMessage.text(state.getContext(), phrases.staleButton()));
    }

    private StepOutcome onPeriod(ConversationState state, String value) {
        StatsData data = state.dataAs(StatsData.class);
        LocalDate today = LocalDate.now(clock);
        int months;
        switch (value) {
            case "month":
                return StepOutcome.of(state.withData(data.awaiting(StatsData.Awaiting.MONTH)),
                        OutboundMessage.text(state.getContext(), phrases.askMonth()));
            case "year":
                return StepOutcome.of(state.withData(data.awaiting(StatsData.Awaiting.YEAR)),
                        OutboundMessage.text(state.getContext(), phrases.askYear()));
            case "last2":
                months = 2;
                break;
            case "last3":
                months = 3;
                break;
            case "last6":
                months = 6;
                break;
            case "last12":
                months = 12;
                break;
            default:
                return StepOutcome.of(state, OutboundMessage.withKeyboard(state.getContext(),
                        phrases.selectStatsPeriod(), periodKeyboard()));
        }
        return showFilters(state, data.withPeriod(today.minusMonths(months), today, "Last " + months + " months"));
    }

    private StepOutcome onFilter(ConversationState state, String participantName) {
        StatsData data = state.dataAs(StatsData.class);
        LocalDate start = data.requireStartDate();
        LocalDate end = data.requireEndDate();
        String label = data.requirePeriodLabel();

        List<BookStat> stats;
        try {
            stats = storage.getTopBooks(TOP_BOOKS, start, end, participantName);
        } catch (StorageException e) {
            log.warn("Failed to compute stats {}..{} for '{}'", start, end, participantName, e);
            return StepOutcome.of(state.complete(), OutboundMessage.text(state.getContext(), phrases.storageError()));
        }

        log.info("Stats report | period={} start={} end={} participant='{}' rows={}",
                label, start, end, participantName, stats.size());
        if (stats.isEmpty()) {
            return StepOutcome.of(state.complete(), OutboundMessage.text(state.getContext(), phrases.noEventsInPeriod()));
        }
        return StepOutcome.of(state.complete(), OutboundMessage.text(state.getContext(),
                phrases.statsReport(label, start, end, participantName, stats)));
    }

    // =========================================================
    // KEYBOARDS
    // =========================================================
    private StepOutcome showFilters(ConversationState state, StatsData data) {
        List<Participant> participants;
        try {
            participants = storage.listParticipants();
        } catch (StorageException e) {
            log.warn("Failed to list participants for stats filter", e);
            return StepOutcome.of(state.complete(), OutboundMessage.text(state.getContext(), phrases.storageError()));
        }
        ConversationState next = state.advanceTo(STEP_FILTER, data);
        return StepOutcome.of(next, OutboundMessage.withKeyboard(state.getContext(),
                phrases.selectStatsParticipant(), filterKeyboard(participants)));
    }

    static InlineKeyboard periodKeyboard() {
        List<List<InlineButton>> rows = new ArrayList<>();
        rows.add(List.of(InlineButton.of("📅 Specific month", PERIOD_PREFIX, "month"),
                InlineButton.of("📆 Specific year", PERIOD_PREFIX, "year")));
        rows.add(List.of(InlineButton.of("Last 2 months", PERIOD_PREFIX, "last2"),
                InlineButton.of("Last 3 months", PERIOD_PREFIX, "last3")));
        rows.add(List.of(InlineButton.of("Last 6 months", PERIOD_PREFIX, "last6"),
                InlineButton.of("Last 12 months", PERIOD_PREFIX, "last12")));
        return InlineKeyboard.ofRows(rows);
    }

    static InlineKeyboard filterKeyboard(List<Participant> participants) {
        List<InlineButton> buttons = new ArrayList<>();
        buttons.add(InlineButton.of("👶 All children", FILTER_PREFIX, ""));
        for (Participant p : participants) {
            if (!p.isParent()) {
                buttons.add(InlineButton.of("👶 " + p.getName(), FILTER_PREFIX, p.getName()));
            }
        }
        return InlineKeyboard.singleColumn(buttons);
    }
}
