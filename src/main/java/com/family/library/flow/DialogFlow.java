package com.family.library.flow;

import com.family.library.conversation.ConversationState;
import com.family.library.conversation.DialogCommand;

import java.util.Set;

/**
 * A command that keeps a dialog open across several user inputs.
 * Implementations never touch the conversation store.
 */
public interface DialogFlow extends CommandHandler {

    DialogCommand command();

    /**
     * Button data prefixes (including the trailing colon) this flow owns.
     */
    Set<String> buttonPrefixes();

    StepOutcome onText(ConversationState state, String text);

    StepOutcome onButton(ConversationState state, String prefix, String value);
}
