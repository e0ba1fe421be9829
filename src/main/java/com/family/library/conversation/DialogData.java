package com.family.library.conversation;

/**
 * Values a dialog carries between its steps. Each command has its own immutable
 * variant, so a step can only read fields its own dialog defines.
 */
public abstract class DialogData {

    public abstract DialogCommand command();

    protected static <T> T require(T value, String field) {
        if (value == null) {
            throw new IllegalStateException("Dialog field '" + field + "' was never set");
        }
        return value;
    }
}
