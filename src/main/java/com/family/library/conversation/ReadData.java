package com.family.library.conversation;

import java.time.LocalDate;

/**
 * Values collected by {@code /read}: the reading date, then the book.
 */
public final class ReadData extends DialogData {

    private final boolean awaitingCustomDate;
    private final LocalDate date;
    private final String bookName;
    private final int page;

    private ReadData(boolean awaitingCustomDate, LocalDate date, String bookName, int page) {
        this.awaitingCustomDate = awaitingCustomDate;
        this.date = date;
        this.bookName = bookName;
        this.page = page;
    }

    public static ReadData empty() {
        return new ReadData(false, null, null, 0);
    }

    @Override
    public DialogCommand command() {
        return DialogCommand.READ;
    }

    public boolean isAwaitingCustomDate() {
        return awaitingCustomDate;
    }

    public LocalDate requireDate() {
        return require(date, "date");
    }

    public String requireBookName() {
        return require(bookName, "bookName");
    }

    /**
     * Page of the book grid last shown, zero based.
     */
    public int getPage() {
        return page;
    }

    public ReadData awaitCustomDate() {
        return new ReadData(true, date, bookName, page);
    }

    public ReadData withDate(LocalDate date) {
        return new ReadData(false, date, bookName, 0);
    }

    public ReadData withPage(int page) {
        return new ReadData(awaitingCustomDate, date, bookName, page);
    }

    public ReadData withBookName(String bookName) {
        return new ReadData(awaitingCustomDate, date, bookName, page);
    }

    @Override
    public String toString() {
        return "ReadData{date=" + date + ", book=" + bookName + ", awaitingCustomDate=" + awaitingCustomDate
                + ", page=" + page + "}";
    }
}
