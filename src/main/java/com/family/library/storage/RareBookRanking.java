package com.family.library.storage;

import com.family.library.dto.RareBookStat;
import com.family.library.entity.Book;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Orders readable books by staleness: never read first, then oldest last read.
 * Shared by both storage backends so they rank identically.
 */
final class RareBookRanking {

    private static final Comparator<RareBookStat> ORDER = Comparator
            .comparing(RareBookStat::isNeverRead).reversed()
            .thenComparing(RareBookStat::getLastReadDate, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(RareBookStat::getBookName);

    private RareBookRanking() {
    }

    static List<RareBookStat> rank(List<Book> readableBooks, Map<String, LocalDate> lastReadByBook,
                                   LocalDate today, int limit) {
        List<RareBookStat> stats = new ArrayList<>(readableBooks.size());
        for (Book book : readableBooks) {
            LocalDate lastRead = lastReadByBook.get(book.getName());
            long days = lastRead == null ? RareBookStat.NEVER_READ : ChronoUnit.DAYS.between(lastRead, today);
            stats.add(new RareBookStat(book.getName(), lastRead, days));
        }
        stats.sort(ORDER);
        if (limit > 0 && stats.size() > limit) {
            return new ArrayList<>(stats.subList(0, limit));
        }
        return stats;
    }
}
