package com.family.library.dto;

import com.family.library.conversation.ReplyContext;

/**
 * A reply for the messaging gateway to deliver: target, body, optional buttons.
 */
public final class OutboundMessage {

    private final ReplyContext target;
    private final String text;
    private final InlineKeyboard keyboard;

    private OutboundMessage(ReplyContext target, String text, InlineKeyboard keyboard) {
        this.target = target;
        this.text = text;
        this.keyboard = keyboard;
    }

    public static OutboundMessage text(ReplyContext target, String text) {
        return new OutboundMessage(target, text, null);
    }

    public static OutboundMessage withKeyboard(ReplyContext target, String text, InlineKeyboard keyboard) {
        return new OutboundMessage(target, text, keyboard);
    }

    public ReplyContext getTarget() {
        return target;
    }

    public String getText() {
        return text;
    }

    public InlineKeyboard getKeyboard() {
        return keyboard;
    }

    public boolean hasKeyboard() {
        return keyboard != null;
    }

    @Override
    public String toString() {
        return "OutboundMessage{" + target + ", text='" + text + "'" + (keyboard != null ? ", keyboard=" + keyboard : "") + "}";
    }
}
