package com.family.library.repository;

import com.family.library.entity.ReadingEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface ReadingEventRepository extends JpaRepository<ReadingEvent, Long> {

    List<ReadingEvent> findAllByOrderByEventDateDescRecordedAtDesc(Pageable pageable);

    /**
     * Rows of {@code [bookName, count]} for one reader, most read first.
     */
    @Query("SELECT e.bookName, COUNT(e) FROM ReadingEvent e "
            + "WHERE e.eventDate BETWEEN :start AND :end AND e.participantName = :participant "
            + "GROUP BY e.bookName ORDER BY COUNT(e) DESC, e.bookName ASC")
    List<Object[]> countByBookForParticipant(@Param("start") LocalDate start,
                                             @Param("end") LocalDate end,
                                             @Param("participant") String participant,
                                             Pageable pageable);

    /**
     * Rows of {@code [bookName, count]} over all children, most read first.
     */
    @Query("SELECT e.bookName, COUNT(e) FROM ReadingEvent e "
            + "WHERE e.eventDate BETWEEN :start AND :end "
            + "AND e.participantName IN (SELECT p.name FROM Participant p WHERE p.parent = false) "
            + "GROUP BY e.bookName ORDER BY COUNT(e) DESC, e.bookName ASC")
    List<Object[]> countByBookForChildren(@Param("start") LocalDate start,
                                          @Param("end") LocalDate end,
                                          Pageable pageable);

    /**
     * Rows of {@code [bookName, lastReadDate]}.
     */
    @Query("SELECT e.bookName, MAX(e.eventDate) FROM ReadingEvent e GROUP BY e.bookName")
    List<Object[]> findLastReadDates();

    @Query("SELECT e.bookName, MAX(e.eventDate) FROM ReadingEvent e "
            + "WHERE e.participantName IN (SELECT p.name FROM Participant p WHERE p.parent = false) "
            + "GROUP BY e.bookName")
    List<Object[]> findLastReadDatesByChildren();
}
