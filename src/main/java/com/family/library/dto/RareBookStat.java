package com.family.library.dto;

import java.time.LocalDate;

/**
 * A readable book together with the date it was last read, if ever.
 */
public final class RareBookStat {

    public static final long NEVER_READ = -1;

    private final String bookName;
    private final LocalDate lastReadDate;
    private final long daysSinceLastRead;

    public RareBookStat(String bookName, LocalDate lastReadDate, long daysSinceLastRead) {
        this.bookName = bookName;
        this.lastReadDate = lastReadDate;
        this.daysSinceLastRead = lastReadDate == null ? NEVER_READ : daysSinceLastRead;
    }

    public String getBookName() {
        return bookName;
    }

    public LocalDate getLastReadDate() {
        return lastReadDate;
    }

    public long getDaysSinceLastRead() {
        return daysSinceLastRead;
    }

    public boolean isNeverRead() {
        return lastReadDate == null;
    }
}
