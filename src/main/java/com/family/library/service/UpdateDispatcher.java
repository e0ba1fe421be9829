package com.family.library.service;

import com.family.library.conversation.ConversationState;
import com.family.library.conversation.ConversationStateStore;
import com.family.library.conversation.DialogCommand;
import com.family.library.dto.InboundEvent;
import com.family.library.dto.OutboundMessage;
import com.family.library.flow.CommandHandler;
import com.family.library.flow.DialogFlow;
import com.family.library.flow.StepOutcome;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single entry for every inbound update: checks the allow-list, routes commands,
 * free text and button clicks to the right flow, applies the outcome to the
 * state store and hands replies to the gateway.
 * <p>
 * Nothing thrown while handling one event escapes {@link #dispatch(InboundEvent)}, except a
 * {@link VirtualMachineError}.
 * <p>
 * Events of the same user are handled one at a time and in arrival order. The thread that finds
 * the user idle drains that user's mailbox; a thread that finds the user busy queues the event
 * and returns at once, so a slow user holds at most one worker and never blocks another user.
 */
@Service
public class UpdateDispatcher {

    private static final Logger log = LoggerFactory.getLogger(UpdateDispatcher.class);

    static final String MDC_USER = "userId";

    private final ConversationStateStore store;
    private final UserAuthorizer authorizer;
    private final MessageGateway gateway;
    private final ResponsePhrases phrases;
    private final boolean notifyUnauthorized;

    private final Map<String, CommandHandler> handlersByToken;
    private final Map<String, DialogFlow> flowsByPrefix;
    private final Map<DialogCommand, DialogFlow> flowsByCommand;
    // present while a thread is draining the user; holds the events queued behind it
    private final Map<Long, Deque<InboundEvent>> mailboxes = new ConcurrentHashMap<>();

    public UpdateDispatcher(ConversationStateStore store,
                            UserAuthorizer authorizer,
                            MessageGateway gateway,
                            ResponsePhrases phrases,
                            List<CommandHandler> handlers,
                            @Value("${telegram.notify-unauthorized:false}") boolean notifyUnauthorized) {
        this.store = store;
        this.authorizer = authorizer;
        this.gateway = gateway;
        this.phrases = phrases;
        this.notifyUnauthorized = notifyUnauthorized;

        Map<String, CommandHandler> byToken = new HashMap<>();
        Map<String, DialogFlow> byPrefix = new HashMap<>();
        Map<DialogCommand, DialogFlow> byCommand = new EnumMap<>(DialogCommand.class);
        for (CommandHandler handler : handlers) {
            for (String token : handler.tokens()) {
                if (byToken.putIfAbsent(token, handler) != null) {
                    throw new IllegalStateException("Command /" + token + " is registered twice");
                }
            }
            if (handler instanceof DialogFlow) {
                DialogFlow flow = (DialogFlow) handler;
                if (byCommand.putIfAbsent(flow.command(), flow) != null) {
                    throw new IllegalStateException("Two flows handle " + flow.command());
                }
                for (String prefix : flow.buttonPrefixes()) {
                    if (byPrefix.putIfAbsent(prefix, flow) != null) {
                        throw new IllegalStateException("Button prefix '" + prefix + "' is registered twice");
                    }
                }
            }
        }
        this.handlersByToken = Collections.unmodifiableMap(byToken);
        this.flowsByPrefix = Collections.unmodifiableMap(byPrefix);
        this.flowsByCommand = Collections.unmodifiableMap(byCommand);
        log.info("Dispatcher ready | commands={} buttonPrefixes={}", handlersByToken.keySet(), flowsByPrefix.keySet());
    }

    public void dispatch(InboundEvent event) {
        long userId = event.getUserId();
        if (!authorizer.isAllowed(userId)) {
            log.debug("Dropping update from user {} (not on allow-list)", userId);
            if (notifyUnauthorized && !event.isButton()) {
                sendQuietly(OutboundMessage.text(event.getContext(), phrases.accessDenied()));
            }
            return;
        }

        boolean[] idle = new boolean[1];
        mailboxes.compute(userId, (id, queue) -> {
            if (queue == null) {
                idle[0] = true;
                return new ArrayDeque<>();
            }
            queue.addLast(event);
            return queue;
        });
        if (!idle[0]) {
            log.debug("User {} is busy, queued {}", userId, event);
            return;
        }
        drain(userId, event);
    }

    private void drain(long userId, InboundEvent first) {
        InboundEvent next = first;
        try {
            while (next != null) {
                MDC.put(MDC_USER, String.valueOf(userId));
                try {
                    handle(next);
                } finally {
                    MDC.remove(MDC_USER);
                }
                next = pollMailbox(userId);
            }
        } finally {
            if (next != null) {
                Deque<InboundEvent> dropped = mailboxes.remove(userId);
                log.error("Abandoned mailbox of user {} | dropped={}", userId, dropped != null ? dropped.size() : 0);
            }
        }
    }

    /**
     * Takes the next queued event, or releases the user when the mailbox is empty.
     */
    private InboundEvent pollMailbox(long userId) {
        InboundEvent[] next = new InboundEvent[1];
        mailboxes.computeIfPresent(userId, (id, queue) -> {
            next[0] = queue.pollFirst();
            return next[0] == null ? null : queue;
        });
        return next[0];
    }

    // =========================================================
    // ROUTING
    // =========================================================
    private void handle(InboundEvent event) {
        ConversationState current = null;
        try {
            current = store.get(event.getUserId()).orElse(null);
            StepOutcome outcome = event.isButton()
                    ? onButton(event, current)
                    : onText(event, current);
            if (outcome != null) {
                apply(event.getUserId(), outcome);
            }
        } catch (Throwable t) {
            log.error("Failed to handle update | user={} payload='{}' command={} step={}",
                    event.getUserId(), event.getPayload(),
                    current != null ? current.getCommand() : "-",
                    current != null ? current.getStep() : "-", t);
            store.delete(event.getUserId());
            if (t instanceof VirtualMachineError) {
                throw (VirtualMachineError) t;
            }
            sendQuietly(OutboundMessage.text(event.getContext(), phrases.somethingWentWrong()));
        }
    }

    private StepOutcome onText(InboundEvent event, ConversationState current) {
        String text = event.getPayload();
        Optional<String> token = commandToken(text);
        if (token.isPresent()) {
            if (current != null) {
                log.info("Pre-empting {} dialog at step {} with /{}", current.getCommand(), current.getStep(), token.get());
                store.delete(event.getUserId());
            }
            CommandHandler handler = handlersByToken.get(token.get());
            if (handler == null) {
                log.debug("Unknown command /{}", token.get());
                return StepOutcome.noDialog(OutboundMessage.text(event.getContext(), phrases.unknownCommand()));
            }
            log.info("Command /{}", token.get());
            return handler.start(event);
        }

        if (current == null) {
            return StepOutcome.noDialog(OutboundMessage.text(event.getContext(), phrases.useCommandHint()));
        }
        if (current.isCompleted()) {
            store.delete(event.getUserId());
            return StepOutcome.noDialog(OutboundMessage.text(event.getContext(), phrases.unknownCommand()));
        }
        return flowFor(current).onText(current, text);
    }

    private StepOutcome onButton(InboundEvent event, ConversationState current) {
        acknowledgeQuietly(event.getCallbackId());

        String data = event.getPayload();
        int colon = data.indexOf(':');
        String prefix = colon >= 0 ? data.substring(0, colon + 1) : data;
        DialogFlow owner = flowsByPrefix.get(prefix);
        if (owner == null) {
            log.warn("Dropping button with unknown prefix | data='{}'", data);
            return null;
        }

        if (current == null) {
            return StepOutcome.noDialog(OutboundMessage.text(event.getContext(), phrases.noActiveDialog()));
        }
        if (current.isCompleted()) {
            store.delete(event.getUserId());
            return StepOutcome.noDialog(OutboundMessage.text(event.getContext(), phrases.noActiveDialog()));
        }
        if (owner.command() != current.getCommand()) {
            log.info("Dropping {} button while {} dialog is active | data='{}'",
                    owner.command(), current.getCommand(), data);
            return null;
        }
        return owner.onButton(current, prefix, data.substring(prefix.length()));
    }

    private DialogFlow flowFor(ConversationState state) {
        DialogFlow flow = flowsByCommand.get(state.getCommand());
        if (flow == null) {
            throw new IllegalStateException("No flow registered for " + state.getCommand());
        }
        return flow;
    }

    /**
     * Parses "/cmd", "/cmd@BotName" and "/cmd args" into "cmd".
     */
    static Optional<String> commandToken(String text) {
        String trimmed = StringUtils.trimToEmpty(text);
        if (!trimmed.startsWith("/") || trimmed.length() == 1) {
            return Optional.empty();
        }
        String head = StringUtils.substringBefore(trimmed.substring(1), " ");
        head = StringUtils.substringBefore(head, "@");
        if (head.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(head.toLowerCase(Locale.ROOT));
    }

    // =========================================================
    // OUTCOME
    // =========================================================
    private void apply(long userId, StepOutcome outcome) {
        ConversationState next = outcome.getState();
        if (next == null || next.isCompleted()) {
            store.delete(userId);
        } else {
            store.set(userId, next);
        }
        for (OutboundMessage reply : outcome.getReplies()) {
            sendQuietly(reply);
        }
    }

    private void acknowledgeQuietly(String callbackId) {
        if (callbackId == null) {
            return;
        }
        try {
            gateway.acknowledge(callbackId);
        } catch (Exception e) {
            log.warn("Failed to acknowledge callback {}", callbackId, e);
        }
    }

    private void sendQuietly(OutboundMessage message) {
        try {
            gateway.send(message);
        } catch (Exception e) {
            log.warn("Failed to send reply to {}", message.getTarget(), e);
        }
    }
}
