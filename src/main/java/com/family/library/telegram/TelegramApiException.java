package com.family.library.telegram;

/**
 * A Bot API call failed or answered {@code "ok": false}.
 */
public class TelegramApiException extends RuntimeException {

    public TelegramApiException(String message) {
        super(message);
    }

    public TelegramApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
