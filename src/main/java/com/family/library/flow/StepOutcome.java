package com.family.library.flow;

import com.family.library.conversation.ConversationState;
import com.family.library.dto.OutboundMessage;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Result of running one step: the dialog state to keep (if any) and the replies to send.
 * No conversational side effects happen inside a flow; the dispatcher applies the outcome.
 */
public final class StepOutcome {

    private final ConversationState state;
    private final List<OutboundMessage> replies;

    private StepOutcome(ConversationState state, List<OutboundMessage> replies) {
        this.state = state;
        this.replies = replies == null ? Collections.emptyList() : List.copyOf(replies);
    }

    /**
     * Continue (or finish, if the state is completed) the dialog.
     */
    public static StepOutcome of(ConversationState state, OutboundMessage... replies) {
        if (state == null) {
            throw new IllegalArgumentException("state must not be null, use noDialog()");
        }
        return new StepOutcome(state, Arrays.asList(replies));
    }

    /**
     * A command that answers directly and leaves no dialog behind.
     */
    public static StepOutcome noDialog(OutboundMessage... replies) {
        return new StepOutcome(null, Arrays.asList(replies));
    }

    /**
     * State after the step, or {@code null} when no dialog should exist.
     */
    public ConversationState getState() {
        return state;
    }

    public List<OutboundMessage> getReplies() {
        return replies;
    }
}
