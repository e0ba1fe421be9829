package com.family.library.storage;

import com.family.library.dto.BookStat;
import com.family.library.dto.RareBookStat;
import com.family.library.entity.Book;
import com.family.library.entity.Participant;
import com.family.library.entity.ReadingEvent;

import java.time.LocalDate;
import java.util.List;

/**
 * Books, participants and reading events. All methods throw {@link StorageException}
 * on failure; nothing is retried.
 */
public interface LibraryStorage {

    /**
     * Registers a readable book and returns its generated id.
     */
    String createBook(String name);

    /**
     * Readable books ordered by name.
     */
    List<Book> listReadableBooks();

    /**
     * All participants ordered by name.
     */
    List<Participant> listParticipants();

    Participant addParticipant(String name, boolean parent);

    void createEvent(LocalDate date, String bookName, String participantName);

    /**
     * Most recent events first.
     */
    List<ReadingEvent> getLastEvents(int limit);

    /**
     * Top books by read count inside {@code [start, end]}, ties broken by name.
     * A blank participant name means "all children".
     */
    List<BookStat> getTopBooks(int limit, LocalDate start, LocalDate end, String participantName);

    /**
     * Readable books ordered by how long ago they were last read; never-read books first.
     */
    List<RareBookStat> getRarelyReadBooks(int limit, boolean childrenOnly);
}
