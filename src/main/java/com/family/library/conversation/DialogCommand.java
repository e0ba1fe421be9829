package com.family.library.conversation;

/**
 * Top-level commands that run a multi-step dialog.
 */
public enum DialogCommand {
    NEW_BOOK("new_book"),
    READ("read"),
    STATS("stats");

    private final String token;

    DialogCommand(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
