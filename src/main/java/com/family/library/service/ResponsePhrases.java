package com.family.library.service;

import com.family.library.dto.BookStat;
import com.family.library.dto.RareBookStat;
import com.family.library.entity.ReadingEvent;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Every text the bot sends. Flows decide what happens; this decides how it reads.
 */
@Component
public class ResponsePhrases {

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_LOCAL_DATE;

    public String welcome() {
        return "Welcome to the Home Library Bot! 📚\n\n"
                + "Available commands:\n"
                + "/new_book - Register a new book\n"
                + "/read - Record a reading event\n"
                + "/who_is_next - See who should read next\n"
                + "/last - Show last 10 reading events\n"
                + "/stats - View reading statistics\n"
                + "/rare - Show rarely read books";
    }

    public String unknownCommand() {
        return "Unknown command. Use /start to see available commands.";
    }

    public String useCommandHint() {
        return "Please use a command to get started. Use /start to see available commands.";
    }

    public String useButtonsHint() {
        return "Please use the buttons above to continue, or send a command to start over.";
    }

    public String staleButton() {
        return "That button belongs to an earlier step. Please use the latest buttons, or send a command to start over.";
    }

    public String noActiveDialog() {
        return "This dialog has already finished. Send a command to start again.";
    }

    public String accessDenied() {
        return "Sorry, this bot is private.";
    }

    public String somethingWentWrong() {
        return "An error occurred while processing your request. Please try again.";
    }

    public String storageError() {
        return "❌ The library is unavailable right now, nothing was saved. Please try again later.";
    }

    // =========================================================
    // /new_book
    // =========================================================
    public String askBookName() {
        return "Please enter the book name:";
    }

    public String bookCreated(String name) {
        return "✅ Book created successfully!\nName: " + name;
    }

    // =========================================================
    // /read
    // =========================================================
    public String noReadableBooks() {
        return "No readable books available. Please add books first with /new_book";
    }

    public String selectReadingDate() {
        return "📅 Select reading date:";
    }

    public String askCustomDate() {
        return "📝 Please enter the date in format YYYY-MM-DD\n\nExample: 2024-01-15";
    }

    public String invalidDate() {
        return "❌ Invalid date format. Please use YYYY-MM-DD\n\nExample: 2024-01-15";
    }

    public String selectBook(int page, int pageCount) {
        if (pageCount <= 1) {
            return "📚 Select a book:";
        }
        return "📚 Select a book (page " + (page + 1) + " of " + pageCount + "):";
    }

    public String invalidBookSelection() {
        return "❌ Invalid book selection. Please pick a book from the list.";
    }

    public String selectParticipant() {
        return "👤 Select a participant:";
    }

    public String invalidParticipant() {
        return "❌ Unknown participant. Please pick someone from the list.";
    }

    public String eventRecorded(LocalDate date, String bookName, String participantName) {
        return "✅ Reading event recorded!\n\n"
                + "📅 Date: " + date.format(ISO) + "\n"
                + "📚 Book: " + bookName + "\n"
                + "👤 Reader: " + participantName;
    }

    // =========================================================
    // /stats
    // =========================================================
    public String selectStatsPeriod() {
        return "📊 Select time period for statistics:";
    }

    public String askMonth() {
        return "📝 Please enter the month in format YYYY-MM\n\nExample: 2024-11";
    }

    public String invalidMonth() {
        return "❌ Invalid month format. Please use YYYY-MM\n\nExample: 2024-11";
    }

    public String askYear() {
        return "📝 Please enter the year\n\nExample: 2024";
    }

    public String invalidYear() {
        return "❌ Invalid year. Please enter a valid year\n\nExample: 2024";
    }

    public String selectStatsParticipant() {
        return "👥 Select participant:";
    }

    public String noEventsInPeriod() {
        return "No reading events found for the selected period.";
    }

    public String statsReport(String periodLabel, LocalDate start, LocalDate end, String participantName,
                              List<BookStat> stats) {
        StringBuilder text = new StringBuilder("📊 Reading Statistics\n\n");
        text.append("📅 Period: ").append(periodLabel).append('\n');
        text.append("   ").append(start.format(ISO)).append(" - ").append(end.format(ISO)).append("\n\n");
        text.append("👥 Participant: ")
                .append(participantName == null || participantName.isEmpty() ? "All children" : participantName)
                .append("\n\n");
        text.append("📚 Top ").append(stats.size()).append(" Books:\n\n");
        for (int i = 0; i < stats.size(); i++) {
            BookStat stat = stats.get(i);
            text.append(i + 1).append(". ").append(stat.getBookName())
                    .append(" - ").append(stat.getReadCount())
                    .append(stat.getReadCount() == 1 ? " read" : " reads").append('\n');
        }
        return text.toString();
    }

    // =========================================================
    // one-shot queries
    // =========================================================
    public String noParticipants() {
        return "No participants found in database";
    }

    public String noChildParticipants() {
        return "No child participants found in database";
    }

    public String nextReader(String name) {
        return "Next to read: " + name;
    }

    public String noEventsYet() {
        return "No reading events recorded yet.";
    }

    public String lastEvents(List<ReadingEvent> events) {
        StringBuilder text = new StringBuilder("Last reading events:\n\n");
        for (int i = 0; i < events.size(); i++) {
            ReadingEvent e = events.get(i);
            text.append(i + 1).append(". ").append(e.getEventDate().format(ISO))
                    .append(" - ").append(e.getBookName())
                    .append(" (").append(e.getParticipantName()).append(")\n");
        }
        return text.toString();
    }

    public String rareBooks(List<RareBookStat> byChildren, List<RareBookStat> overall) {
        StringBuilder text = new StringBuilder("📚 Rarely read books:\n\n");
        text.append("👶 By children's choice:\n");
        appendRare(text, byChildren);
        text.append("\n📖 Overall (all participants):\n");
        appendRare(text, overall);
        return text.toString();
    }

    private void appendRare(StringBuilder text, List<RareBookStat> stats) {
        if (stats.isEmpty()) {
            text.append("No data available\n");
            return;
        }
        for (int i = 0; i < stats.size(); i++) {
            RareBookStat stat = stats.get(i);
            text.append(i + 1).append(". ").append(stat.getBookName());
            if (stat.isNeverRead()) {
                text.append(" (never read)");
            } else {
                text.append(" (").append(stat.getDaysSinceLastRead()).append(" days ago, last: ")
                        .append(stat.getLastReadDate().format(ISO)).append(')');
            }
            text.append('\n');
        }
    }
}
