package com.family.library.conversation;

/**
 * {@code /new_book} needs nothing beyond the step number.
 */
public final class NewBookData extends DialogData {

    public static final NewBookData INSTANCE = new NewBookData();

    private NewBookData() {
    }

    @Override
    public DialogCommand command() {
        return DialogCommand.NEW_BOOK;
    }

    @Override
    public String toString() {
        return "NewBookData";
    }
}
