package com.family.library.service;

import com.family.library.conversation.ConversationState;
import com.family.library.conversation.DialogCommand;
import com.family.library.conversation.InMemoryConversationStateStore;
import com.family.library.conversation.ReadData;
import com.family.library.conversation.ReplyContext;
import com.family.library.dto.InboundEvent;
import com.family.library.dto.OutboundMessage;
import com.family.library.entity.Book;
import com.family.library.flow.CommandHandler;
import com.family.library.flow.HelpCommand;
import com.family.library.flow.LastEventsCommand;
import com.family.library.flow.RareBooksCommand;
import com.family.library.flow.ReadEventFlow;
import com.family.library.flow.RegisterBookFlow;
import com.family.library.flow.StatsFlow;
import com.family.library.flow.StepOutcome;
import com.family.library.flow.WhoIsNextCommand;
import com.family.library.storage.InMemoryLibraryStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class UpdateDispatcherTest {

    private static final long USER = 42L;
    private static final long STRANGER = 99L;
    private static final ReplyContext CTX = new ReplyContext(-1001L, 7);
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);
    private final ResponsePhrases phrases = new ResponsePhrases();
    private final UserAuthorizer authorizer = id -> id == USER;

    private InMemoryConversationStateStore store;
    private InMemoryLibraryStorage storage;
    private RecordingMessageGateway gateway;
    private UpdateDispatcher dispatcher;
    private int callbackSeq;

    @BeforeEach
    void setUp() {
        store = new InMemoryConversationStateStore();
        storage = spy(new InMemoryLibraryStorage(clock));
        storage.addParticipant("Alice", false);
        storage.addParticipant("Bob", false);
        storage.addParticipant("Mom", true);
        gateway = new RecordingMessageGateway();
        dispatcher = newDispatcher(gateway, false, new ArrayList<>());
    }

    private UpdateDispatcher newDispatcher(MessageGateway gw, boolean notifyUnauthorized, List<CommandHandler> extra) {
        List<CommandHandler> handlers = new ArrayList<>(List.of(
                new HelpCommand(phrases),
                new RegisterBookFlow(storage, phrases),
                new ReadEventFlow(storage, phrases, clock),
                new StatsFlow(storage, phrases, clock),
                new WhoIsNextCommand(storage, phrases),
                new LastEventsCommand(storage, phrases),
                new RareBooksCommand(storage, phrases)));
        handlers.addAll(extra);
        return new UpdateDispatcher(store, authorizer, gw, phrases, handlers, notifyUnauthorized);
    }

    private void text(long userId, String text) {
        dispatcher.dispatch(InboundEvent.text(userId, CTX, text));
    }

    private void click(long userId, String data) {
        dispatcher.dispatch(InboundEvent.button(userId, CTX, data, "cb-" + (++callbackSeq)));
    }

    private ConversationState stateOf(long userId) {
        return store.get(userId).orElse(null);
    }

    // =========================================================
    // LOG-EVENT DIALOG
    // =========================================================
    @Test
    void shouldWalkThroughReadDialogAndRecordEvent() {
        storage.createBook("Gruffalo");

        text(USER, "/read");
        assertThat(stateOf(USER).getStep()).isEqualTo(1);

        click(USER, "date:today");
        assertThat(stateOf(USER).getStep()).isEqualTo(2);
        assertThat(gateway.last().hasKeyboard()).isTrue();

        click(USER, "item:0");
        assertThat(stateOf(USER).getStep()).isEqualTo(3);
        assertThat(gateway.last().getText()).isEqualTo(phrases.selectParticipant());

        click(USER, "actor:Alice");

        verify(storage).createEvent(TODAY, "Gruffalo", "Alice");
        assertThat(store.get(USER)).isEmpty();
        assertThat(gateway.last().getText()).contains("Reading event recorded");
        assertThat(gateway.getAcknowledged()).containsExactly("cb-1", "cb-2", "cb-3");
        assertThat(gateway.getSent()).allSatisfy(m -> assertThat(m.getTarget()).isEqualTo(CTX));
    }

    @Test
    void shouldStayOnBookStepForOutOfRangeIndex() {
        storage.createBook("A");
        storage.createBook("B");
        storage.createBook("C");
        text(USER, "/read");
        click(USER, "date:today");
        ConversationState before = stateOf(USER);

        click(USER, "item:999");

        assertThat(stateOf(USER).getStep()).isEqualTo(2);
        assertThat(stateOf(USER).getData()).isSameAs(before.getData());
        assertThat(gateway.last().getText()).isEqualTo(phrases.invalidBookSelection());
        verify(storage, never()).createEvent(any(LocalDate.class), anyString(), anyString());
    }

    // =========================================================
    // COMMANDS AND PRE-EMPTION
    // =========================================================
    @Test
    void shouldReplaceActiveDialogWithNewCommand() {
        storage.createBook("Gruffalo");
        text(USER, "/read");
        click(USER, "date:today");

        text(USER, "/stats");

        assertThat(stateOf(USER).getCommand()).isEqualTo(DialogCommand.STATS);
        assertThat(stateOf(USER).getStep()).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void shouldDropDialogOnOneShotAndUnknownCommands() {
        text(USER, "/stats");
        text(USER, "/last");
        assertThat(store.get(USER)).isEmpty();
        assertThat(gateway.last().getText()).isEqualTo(phrases.noEventsYet());

        text(USER, "/new_book");
        text(USER, "/frobnicate");
        assertThat(store.get(USER)).isEmpty();
        assertThat(gateway.last().getText()).isEqualTo(phrases.unknownCommand());
    }

    @Test
    void shouldRecognizeCommandsAddressedToBot() {
        text(USER, "/new_book@HomeLibraryBot");

        assertThat(stateOf(USER).getCommand()).isEqualTo(DialogCommand.NEW_BOOK);

        text(USER, "Where the Wild Things Are");
        assertThat(store.get(USER)).isEmpty();
        assertThat(storage.listReadableBooks()).extracting(Book::getName).containsExactly("Where the Wild Things Are");
    }

    @Test
    void shouldParseCommandTokens() {
        assertThat(UpdateDispatcher.commandToken("/read")).hasValue("read");
        assertThat(UpdateDispatcher.commandToken("  /Stats@MyBot extra words")).hasValue("stats");
        assertThat(UpdateDispatcher.commandToken("/who_is_next now")).hasValue("who_is_next");
        assertThat(UpdateDispatcher.commandToken("/")).isEmpty();
        assertThat(UpdateDispatcher.commandToken("/@bot")).isEmpty();
        assertThat(UpdateDispatcher.commandToken("read")).isEmpty();
        assertThat(UpdateDispatcher.commandToken(null)).isEmpty();
    }

    @Test
    void shouldParseCommandTokensIndependentOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertThat(UpdateDispatcher.commandToken("/WHO_IS_NEXT")).hasValue("who_is_next");
            assertThat(UpdateDispatcher.commandToken("/HELP")).hasValue("help");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void shouldHintWhenTextArrivesWithoutDialog() {
        text(USER, "hello");

        assertThat(gateway.texts()).containsExactly(phrases.useCommandHint());
        assertThat(store.get(USER)).isEmpty();
    }

    // =========================================================
    // AUTHORIZATION
    // =========================================================
    @Test
    void shouldNeverTouchStateForUnauthorizedUser() {
        ConversationState existing = ConversationState.begin(ReadData.empty(), CTX);
        store.set(STRANGER, existing);

        text(STRANGER, "/stats");
        click(STRANGER, "date:today");
        text(STRANGER, "2024-01-01");

        assertThat(stateOf(STRANGER)).isSameAs(existing);
        assertThat(gateway.getSent()).isEmpty();
        assertThat(gateway.getAcknowledged()).isEmpty();
    }

    @Test
    void shouldNotCreateStateForUnauthorizedUser() {
        text(STRANGER, "/read");

        assertThat(store.get(STRANGER)).isEmpty();
    }

    @Test
    void shouldOptionallyTellStrangersTheBotIsPrivate() {
        dispatcher = newDispatcher(gateway, true, new ArrayList<>());

        text(STRANGER, "/start");
        click(STRANGER, "date:today");

        assertThat(gateway.texts()).containsExactly(phrases.accessDenied());
        assertThat(store.get(STRANGER)).isEmpty();
    }

    // =========================================================
    // STALE AND MISROUTED INPUT
    // =========================================================
    @Test
    void shouldCleanUpCompletedStateOnFirstAccess() {
        store.set(USER, ConversationState.begin(ReadData.empty(), CTX).complete());

        text(USER, "anything");

        assertThat(store.get(USER)).isEmpty();
        assertThat(gateway.texts()).containsExactly(phrases.unknownCommand());

        store.set(USER, ConversationState.begin(ReadData.empty(), CTX).complete());
        click(USER, "date:today");

        assertThat(store.get(USER)).isEmpty();
        assertThat(gateway.last().getText()).isEqualTo(phrases.noActiveDialog());
    }

    @Test
    void shouldDropButtonWithUnknownPrefix() {
        text(USER, "/stats");
        ConversationState before = stateOf(USER);
        gateway.clear();

        click(USER, "bogus:1");
        click(USER, "nocolon");

        assertThat(stateOf(USER)).isSameAs(before);
        assertThat(gateway.getSent()).isEmpty();
        assertThat(gateway.getAcknowledged()).hasSize(2);
    }

    @Test
    void shouldDropButtonOfAnotherCommand() {
        text(USER, "/stats");
        ConversationState before = stateOf(USER);
        gateway.clear();

        click(USER, "date:today");

        assertThat(stateOf(USER)).isSameAs(before);
        assertThat(gateway.getSent()).isEmpty();
    }

    @Test
    void shouldAnswerButtonWithoutDialog() {
        click(USER, "period:last2");

        assertThat(gateway.texts()).containsExactly(phrases.noActiveDialog());
        assertThat(store.get(USER)).isEmpty();
    }

    // =========================================================
    // FAULT ISOLATION
    // =========================================================
    @Test
    void shouldRecoverFromBrokenDialogData() {
        // step 3 without date or book: a step ran out of order
        store.set(USER, new ConversationState(DialogCommand.READ, 3, ReadData.empty(), CTX));

        click(USER, "actor:Alice");

        assertThat(store.get(USER)).isEmpty();
        assertThat(gateway.texts()).containsExactly(phrases.somethingWentWrong());
        verify(storage, never()).createEvent(any(LocalDate.class), anyString(), anyString());
    }

    @Test
    void shouldContainFaultOfOneHandler() {
        CommandHandler boom = new CommandHandler() {
            @Override
            public List<String> tokens() {
                return List.of("boom");
            }

            @Override
            public StepOutcome start(InboundEvent event) {
                throw new NullPointerException("kaboom");
            }
        };
        dispatcher = newDispatcher(gateway, false, List.of(boom));
        text(USER, "/stats");

        text(USER, "/boom");

        assertThat(gateway.last().getText()).isEqualTo(phrases.somethingWentWrong());
        assertThat(store.get(USER)).isEmpty();

        text(USER, "/start");
        assertThat(gateway.last().getText()).isEqualTo(phrases.welcome());
    }

    @Test
    void shouldContainErrorThrownInsideDialogStep() {
        doThrow(new AssertionError("broken query")).when(storage).getTopBooks(anyInt(), any(), any(), any());
        text(USER, "/stats");
        click(USER, "period:last2");
        assertThat(stateOf(USER).getStep()).isEqualTo(2);

        click(USER, "filter:");

        assertThat(store.get(USER)).isEmpty();
        assertThat(gateway.last().getText()).isEqualTo(phrases.somethingWentWrong());
    }

    @Test
    void shouldContainStackOverflowOfOneHandler() {
        dispatcher = newDispatcher(gateway, false, List.of(failingHandler("recurse", new StackOverflowError("recursion"))));

        text(USER, "/recurse");

        assertThat(gateway.texts()).containsExactly(phrases.somethingWentWrong());
        assertThat(store.get(USER)).isEmpty();
    }

    @Test
    void shouldRethrowVirtualMachineErrorAndReleaseUser() {
        dispatcher = newDispatcher(gateway, false, List.of(failingHandler("oom", new OutOfMemoryError("heap"))));
        text(USER, "/stats");

        assertThatThrownBy(() -> text(USER, "/oom")).isInstanceOf(OutOfMemoryError.class);
        assertThat(store.get(USER)).isEmpty();

        text(USER, "/start");
        assertThat(gateway.last().getText()).isEqualTo(phrases.welcome());
    }

    private static CommandHandler failingHandler(String token, Error error) {
        return new CommandHandler() {
            @Override
            public List<String> tokens() {
                return List.of(token);
            }

            @Override
            public StepOutcome start(InboundEvent event) {
                throw error;
            }
        };
    }

    @Test
    void shouldApplyStateEvenWhenDeliveryFails() {
        MessageGateway broken = new MessageGateway() {
            @Override
            public void send(OutboundMessage message) {
                throw new IllegalStateException("network down");
            }

            @Override
            public void acknowledge(String callbackId) {
                throw new IllegalStateException("network down");
            }
        };
        dispatcher = newDispatcher(broken, false, new ArrayList<>());

        text(USER, "/stats");
        click(USER, "period:last2");

        assertThat(stateOf(USER).getStep()).isEqualTo(2);
    }

    @Test
    void shouldRejectDuplicateCommandRegistration() {
        assertThatThrownBy(() -> newDispatcher(gateway, false, List.of(new HelpCommand(phrases))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("/start");
    }

    @Test
    void shouldHandleUsersConcurrently() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        UserAuthorizer everyone = id -> true;
        UpdateDispatcher open = new UpdateDispatcher(store, everyone, gateway, phrases,
                List.of(new StatsFlow(storage, phrases, clock)), false);
        try {
            for (long u = 1; u <= 20; u++) {
                long userId = u;
                pool.execute(() -> {
                    open.dispatch(InboundEvent.text(userId, ReplyContext.chat(userId), "/stats"));
                    open.dispatch(InboundEvent.button(userId, ReplyContext.chat(userId), "period:last3", "cb"));
                });
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(store.size()).isEqualTo(20);
        for (long u = 1; u <= 20; u++) {
            assertThat(stateOf(u).getStep()).isEqualTo(2);
        }
    }

    @Test
    void shouldServeOtherUsersWhileOneUserIsSlow() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(inv -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
            return inv.callRealMethod();
        }).when(storage).listReadableBooks();
        MessageGateway slowGateway = mock(MessageGateway.class);
        UpdateDispatcher open = new UpdateDispatcher(store, id -> true, slowGateway, phrases,
                List.of(new HelpCommand(phrases), new ReadEventFlow(storage, phrases, clock)), false);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int i = 0; i < 4; i++) {
                pool.execute(() -> open.dispatch(InboundEvent.text(1L, ReplyContext.chat(1L), "/read")));
            }
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            pool.execute(() -> open.dispatch(InboundEvent.text(2L, ReplyContext.chat(2L), "/start")));

            verify(slowGateway, timeout(5_000)).send(argThat(m -> phrases.welcome().equals(m.getText())));
            verify(storage, times(1)).listReadableBooks();
        } finally {
            release.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        // queued events of the slow user still run, one after another
        verify(storage, times(4)).listReadableBooks();
        verify(slowGateway, times(4)).send(argThat(m -> phrases.noReadableBooks().equals(m.getText())));
    }
}
