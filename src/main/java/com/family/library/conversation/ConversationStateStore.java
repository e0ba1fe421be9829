package com.family.library.conversation;

import java.util.Optional;

/**
 * Active dialogs keyed by user id. At most one per user.
 */
public interface ConversationStateStore {

    Optional<ConversationState> get(long userId);

    void set(long userId, ConversationState state);

    void delete(long userId);
}
