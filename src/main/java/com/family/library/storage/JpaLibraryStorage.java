package com.family.library.storage;

import com.family.library.dto.BookStat;
import com.family.library.dto.RareBookStat;
import com.family.library.entity.Book;
import com.family.library.entity.Participant;
import com.family.library.entity.ReadingEvent;
import com.family.library.repository.BookRepository;
import com.family.library.repository.ParticipantRepository;
import com.family.library.repository.ReadingEventRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "library.storage", havingValue = "jpa", matchIfMissing = true)
public class JpaLibraryStorage implements LibraryStorage {

    private static final Logger log = LoggerFactory.getLogger(JpaLibraryStorage.class);

    private final BookRepository bookRepository;
    private final ParticipantRepository participantRepository;
    private final ReadingEventRepository eventRepository;
    private final Clock clock;

    // =========================================================
    // BOOKS
    // =========================================================
    @Override
    @Transactional
    public String createBook(String name) {
        try {
            Book book = bookRepository.save(Book.builder()
                    .id(UUID.randomUUID().toString())
                    .name(name)
                    .readable(true)
                    .build());
            log.info("Book created | id={} name={}", book.getId(), name);
            return book.getId();
        } catch (DataAccessException e) {
            throw new StorageException("failed to create book", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Book> listReadableBooks() {
        try {
            return bookRepository.findByReadableTrueOrderByNameAsc();
        } catch (DataAccessException e) {
            throw new StorageException("failed to list readable books", e);
        }
    }

    // =========================================================
    // PARTICIPANTS
    // =========================================================
    @Override
    @Transactional(readOnly = true)
    public List<Participant> listParticipants() {
        try {
            return participantRepository.findAllByOrderByNameAsc();
        } catch (DataAccessException e) {
            throw new StorageException("failed to list participants", e);
        }
    }

    @Override
    @Transactional
    public Participant addParticipant(String name, boolean parent) {
        try {
            return participantRepository.findByName(name)
                    .orElseGet(() -> participantRepository.save(Participant.builder()
                            .id(UUID.randomUUID().toString())
                            .name(name)
                            .parent(parent)
                            .build()));
        } catch (DataAccessException e) {
            throw new StorageException("failed to add participant", e);
        }
    }

    // =========================================================
    // EVENTS
    // =========================================================
    @Override
    @Transactional
    public void createEvent(LocalDate date, String bookName, String participantName) {
        try {
            eventRepository.save(ReadingEvent.builder()
                    .eventDate(date)
                    .bookName(bookName)
                    .participantName(participantName)
                    .recordedAt(clock.instant())
                    .build());
        } catch (DataAccessException e) {
            throw new StorageException("failed to create event", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReadingEvent> getLastEvents(int limit) {
        try {
            return eventRepository.findAllByOrderByEventDateDescRecordedAtDesc(PageRequest.of(0, limit));
        } catch (DataAccessException e) {
            throw new StorageException("failed to get last events", e);
        }
    }

    // =========================================================
    // STATISTICS
    // =========================================================
    @Override
    @Transactional(readOnly = true)
    public List<BookStat> getTopBooks(int limit, LocalDate start, LocalDate end, String participantName) {
        try {
            PageRequest page = PageRequest.of(0, limit);
            List<Object[]> rows = StringUtils.isBlank(participantName)
                    ? eventRepository.countByBookForChildren(start, end, page)
                    : eventRepository.countByBookForParticipant(start, end, participantName, page);
            return rows.stream()
                    .map(r -> new BookStat((String) r[0], ((Number) r[1]).longValue()))
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw new StorageException("failed to get top books", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<RareBookStat> getRarelyReadBooks(int limit, boolean childrenOnly) {
        try {
            List<Object[]> rows = childrenOnly
                    ? eventRepository.findLastReadDatesByChildren()
                    : eventRepository.findLastReadDates();
            Map<String, LocalDate> lastRead = new HashMap<>();
            for (Object[] r : rows) {
                lastRead.put((String) r[0], (LocalDate) r[1]);
            }
            return RareBookRanking.rank(bookRepository.findByReadableTrueOrderByNameAsc(), lastRead,
                    LocalDate.now(clock), limit);
        } catch (DataAccessException e) {
            throw new StorageException("failed to get rarely read books", e);
        }
    }
}
