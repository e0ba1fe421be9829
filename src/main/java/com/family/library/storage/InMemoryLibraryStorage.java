package com.family.library.storage;

import com.family.library.dto.BookStat;
import com.family.library.dto.RareBookStat;
import com.family.library.entity.Book;
import com.family.library.entity.Participant;
import com.family.library.entity.ReadingEvent;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Process-local storage for development runs and tests. Nothing survives a restart.
 */
@Service
@ConditionalOnProperty(name = "library.storage", havingValue = "memory")
public class InMemoryLibraryStorage implements LibraryStorage {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Book> booksByName = new HashMap<>();
    private final Map<String, Participant> participantsByName = new HashMap<>();
    private final List<ReadingEvent> events = new ArrayList<>();
    private final Clock clock;

    public InMemoryLibraryStorage(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String createBook(String name) {
        lock.writeLock().lock();
        try {
            Book book = Book.builder()
                    .id(UUID.randomUUID().toString())
                    .name(name)
                    .readable(true)
                    .createdAt(clock.instant())
                    .build();
            booksByName.put(name, book);
            return book.getId();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Book> listReadableBooks() {
        lock.readLock().lock();
        try {
            return booksByName.values().stream()
                    .filter(Book::isReadable)
                    .sorted(Comparator.comparing(Book::getName))
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Participant> listParticipants() {
        lock.readLock().lock();
        try {
            return participantsByName.values().stream()
                    .sorted(Comparator.comparing(Participant::getName))
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Participant addParticipant(String name, boolean parent) {
        lock.writeLock().lock();
        try {
            return participantsByName.computeIfAbsent(name, n -> Participant.builder()
                    .id(UUID.randomUUID().toString())
                    .name(n)
                    .parent(parent)
                    .build());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void createEvent(LocalDate date, String bookName, String participantName) {
        lock.writeLock().lock();
        try {
            events.add(ReadingEvent.builder()
                    .id((long) events.size() + 1)
                    .eventDate(date)
                    .bookName(bookName)
                    .participantName(participantName)
                    .recordedAt(clock.instant())
                    .build());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<ReadingEvent> getLastEvents(int limit) {
        lock.readLock().lock();
        try {
            // insertion order breaks ties when the clock does not move between events
            List<ReadingEvent> sorted = new ArrayList<>(events);
            sorted.sort(Comparator.comparing(ReadingEvent::getEventDate)
                    .thenComparing(ReadingEvent::getRecordedAt)
                    .thenComparing(ReadingEvent::getId)
                    .reversed());
            return new ArrayList<>(sorted.subList(0, Math.min(limit, sorted.size())));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<BookStat> getTopBooks(int limit, LocalDate start, LocalDate end, String participantName) {
        lock.readLock().lock();
        try {
            Map<String, Long> counts = new LinkedHashMap<>();
            for (ReadingEvent event : events) {
                if (event.getEventDate().isBefore(start) || event.getEventDate().isAfter(end)) {
                    continue;
                }
                if (!matchesReader(event.getParticipantName(), participantName)) {
                    continue;
                }
                counts.merge(event.getBookName(), 1L, Long::sum);
            }
            return counts.entrySet().stream()
                    .map(e -> new BookStat(e.getKey(), e.getValue()))
                    .sorted(Comparator.comparingLong(BookStat::getReadCount).reversed()
                            .thenComparing(BookStat::getBookName))
                    .limit(limit > 0 ? limit : Long.MAX_VALUE)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<RareBookStat> getRarelyReadBooks(int limit, boolean childrenOnly) {
        lock.readLock().lock();
        try {
            Map<String, LocalDate> lastRead = new HashMap<>();
            for (ReadingEvent event : events) {
                if (childrenOnly && !isChild(event.getParticipantName())) {
                    continue;
                }
                lastRead.merge(event.getBookName(), event.getEventDate(),
                        (a, b) -> a.isAfter(b) ? a : b);
            }
            List<Book> readable = booksByName.values().stream()
                    .filter(Book::isReadable)
                    .sorted(Comparator.comparing(Book::getName))
                    .collect(Collectors.toList());
            return RareBookRanking.rank(readable, lastRead, LocalDate.now(clock), limit);
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean matchesReader(String eventParticipant, String filter) {
        if (StringUtils.isNotBlank(filter)) {
            return filter.equals(eventParticipant);
        }
        return isChild(eventParticipant);
    }

    private boolean isChild(String name) {
        Participant p = participantsByName.get(name);
        return p != null && !p.isParent();
    }
}
