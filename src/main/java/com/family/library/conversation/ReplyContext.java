package com.family.library.conversation;

import java.util.Objects;

/**
 * Where replies for one dialog go: a chat and, in forum-style groups, a topic thread.
 */
public final class ReplyContext {

    private final long chatId;
    private final Integer threadId;

    public ReplyContext(long chatId, Integer threadId) {
        this.chatId = chatId;
        this.threadId = threadId != null && threadId != 0 ? threadId : null;
    }

    public static ReplyContext chat(long chatId) {
        return new ReplyContext(chatId, null);
    }

    public long getChatId() {
        return chatId;
    }

    /**
     * Topic thread id, or {@code null} outside forum topics.
     */
    public Integer getThreadId() {
        return threadId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReplyContext)) return false;
        ReplyContext that = (ReplyContext) o;
        return chatId == that.chatId && Objects.equals(threadId, that.threadId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chatId, threadId);
    }

    @Override
    public String toString() {
        return threadId == null ? "chat:" + chatId : "chat:" + chatId + "/" + threadId;
    }
}
