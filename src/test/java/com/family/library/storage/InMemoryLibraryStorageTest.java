package com.family.library.storage;

import com.family.library.dto.BookStat;
import com.family.library.dto.RareBookStat;
import com.family.library.entity.Book;
import com.family.library.entity.Participant;
import com.family.library.entity.ReadingEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class InMemoryLibraryStorageTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);
    private InMemoryLibraryStorage storage;

    @BeforeEach
    void setUp() {
        storage = new InMemoryLibraryStorage(clock);
        storage.addParticipant("Bob", false);
        storage.addParticipant("Alice", false);
        storage.addParticipant("Mom", true);
    }

    @Test
    void shouldListBooksAndParticipantsByName() {
        storage.createBook("Zog");
        String id = storage.createBook("Matilda");

        assertThat(id).isNotBlank();
        assertThat(storage.listReadableBooks()).extracting(Book::getName).containsExactly("Matilda", "Zog");
        assertThat(storage.listParticipants()).extracting(Participant::getName).containsExactly("Alice", "Bob", "Mom");
    }

    @Test
    void shouldKeepFirstRoleWhenParticipantIsAddedTwice() {
        Participant again = storage.addParticipant("Mom", false);

        assertThat(again.isParent()).isTrue();
        assertThat(storage.listParticipants()).hasSize(3);
    }

    @Test
    void shouldReturnNewestEventsFirstWithInsertionTieBreak() {
        storage.createEvent(LocalDate.of(2024, 3, 1), "A", "Alice");
        storage.createEvent(LocalDate.of(2024, 3, 3), "B", "Bob");
        storage.createEvent(LocalDate.of(2024, 3, 3), "C", "Alice");

        List<ReadingEvent> last = storage.getLastEvents(2);

        assertThat(last).extracting(ReadingEvent::getBookName).containsExactly("C", "B");
    }

    @Test
    void shouldCountChildrenOnlyForBlankFilter() {
        LocalDate start = LocalDate.of(2024, 3, 1);
        LocalDate end = LocalDate.of(2024, 3, 31);
        storage.createEvent(start, "Zog", "Alice");
        storage.createEvent(end, "Zog", "Bob");
        storage.createEvent(LocalDate.of(2024, 3, 10), "Hamlet", "Mom");
        storage.createEvent(LocalDate.of(2024, 3, 10), "Hamlet", "Mom");
        storage.createEvent(LocalDate.of(2024, 4, 1), "Zog", "Alice");
        storage.createEvent(LocalDate.of(2024, 3, 5), "Alfie", "Bob");

        List<BookStat> children = storage.getTopBooks(10, start, end, "");
        List<BookStat> mom = storage.getTopBooks(10, start, end, "Mom");
        List<BookStat> top1 = storage.getTopBooks(1, start, end, null);

        assertThat(children).extracting(BookStat::getBookName, BookStat::getReadCount)
                .containsExactly(tuple("Zog", 2L), tuple("Alfie", 1L));
        assertThat(mom).extracting(BookStat::getBookName).containsExactly("Hamlet");
        assertThat(top1).hasSize(1);
    }

    @Test
    void shouldRankRarelyReadBooks() {
        storage.createBook("Zog");
        storage.createBook("Matilda");
        storage.createBook("Hamlet");
        storage.createEvent(LocalDate.of(2024, 3, 5), "Zog", "Alice");
        storage.createEvent(LocalDate.of(2024, 3, 1), "Zog", "Bob");
        storage.createEvent(LocalDate.of(2024, 3, 14), "Hamlet", "Mom");

        List<RareBookStat> children = storage.getRarelyReadBooks(10, true);
        List<RareBookStat> overall = storage.getRarelyReadBooks(2, false);

        assertThat(children).extracting(RareBookStat::getBookName, RareBookStat::getDaysSinceLastRead)
                .containsExactly(tuple("Hamlet", RareBookStat.NEVER_READ), tuple("Matilda", RareBookStat.NEVER_READ),
                        tuple("Zog", 10L));
        assertThat(overall).extracting(RareBookStat::getBookName).containsExactly("Matilda", "Zog");
    }
}
