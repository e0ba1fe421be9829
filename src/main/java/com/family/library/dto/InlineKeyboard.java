package com.family.library.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Rows of buttons attached to an outbound message.
 */
public final class InlineKeyboard {

    private final List<List<InlineButton>> rows;

    private InlineKeyboard(List<List<InlineButton>> rows) {
        List<List<InlineButton>> copy = new ArrayList<>(rows.size());
        for (List<InlineButton> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static InlineKeyboard ofRows(List<List<InlineButton>> rows) {
        return new InlineKeyboard(rows);
    }

    public static InlineKeyboard singleColumn(List<InlineButton> buttons) {
        return new InlineKeyboard(buttons.stream().map(List::of).collect(Collectors.toList()));
    }

    public static InlineKeyboard twoColumns(List<InlineButton> buttons) {
        List<List<InlineButton>> rows = new ArrayList<>();
        for (int i = 0; i < buttons.size(); i += 2) {
            rows.add(buttons.subList(i, Math.min(i + 2, buttons.size())));
        }
        return new InlineKeyboard(rows);
    }

    public List<List<InlineButton>> getRows() {
        return rows;
    }

    public List<InlineButton> allButtons() {
        return rows.stream().flatMap(List::stream).collect(Collectors.toList());
    }

    /**
     * Returns a copy with one more row appended at the bottom.
     */
    public InlineKeyboard withRow(List<InlineButton> row) {
        List<List<InlineButton>> extended = new ArrayList<>(rows);
        extended.add(row);
        return new InlineKeyboard(extended);
    }

    @Override
    public String toString() {
        return rows.toString();
    }
}
