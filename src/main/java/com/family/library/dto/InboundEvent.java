package com.family.library.dto;

import com.family.library.conversation.ReplyContext;

/**
 * One update from the messaging gateway: either a text message or a button click.
 * Both transports (long polling and webhook) produce the same shape.
 */
public final class InboundEvent {

    public enum Kind { TEXT, BUTTON }

    private final Kind kind;
    private final long userId;
    private final ReplyContext context;
    private final String payload;
    private final String callbackId;

    private InboundEvent(Kind kind, long userId, ReplyContext context, String payload, String callbackId) {
        this.kind = kind;
        this.userId = userId;
        this.context = context;
        this.payload = payload != null ? payload : "";
        this.callbackId = callbackId;
    }

    public static InboundEvent text(long userId, ReplyContext context, String text) {
        return new InboundEvent(Kind.TEXT, userId, context, text, null);
    }

    public static InboundEvent button(long userId, ReplyContext context, String data, String callbackId) {
        return new InboundEvent(Kind.BUTTON, userId, context, data, callbackId);
    }

    public boolean isButton() {
        return kind == Kind.BUTTON;
    }

    public long getUserId() {
        return userId;
    }

    public ReplyContext getContext() {
        return context;
    }

    /**
     * Message text, or the button's callback data.
     */
    public String getPayload() {
        return payload;
    }

    public String getCallbackId() {
        return callbackId;
    }

    @Override
    public String toString() {
        return kind + "{user=" + userId + ", " + context + ", payload='" + payload + "'}";
    }
}
