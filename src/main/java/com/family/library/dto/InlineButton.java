package com.family.library.dto;

import java.util.Objects;

/**
 * A button under a message. {@code data} follows the {@code prefix:value} routing convention.
 */
public final class InlineButton {

    private final String text;
    private final String data;

    public InlineButton(String text, String data) {
        this.text = text;
        this.data = data;
    }

    public static InlineButton of(String text, String prefix, String value) {
        return new InlineButton(text, prefix + value);
    }

    public String getText() {
        return text;
    }

    public String getData() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InlineButton)) return false;
        InlineButton that = (InlineButton) o;
        return Objects.equals(text, that.text) && Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, data);
    }

    @Override
    public String toString() {
        return "[" + text + " -> " + data + "]";
    }
}
