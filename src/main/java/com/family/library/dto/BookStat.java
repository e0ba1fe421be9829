package com.family.library.dto;

/**
 * How many times a book was read within a report window.
 */
public final class BookStat {

    private final String bookName;
    private final long readCount;

    public BookStat(String bookName, long readCount) {
        this.bookName = bookName;
        this.readCount = readCount;
    }

    public String getBookName() {
        return bookName;
    }

    public long getReadCount() {
        return readCount;
    }

    @Override
    public String toString() {
        return bookName + "=" + readCount;
    }
}
