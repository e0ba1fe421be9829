package com.family.library.conversation;

/**
 * One user's in-flight dialog. Immutable: every transition produces a new instance,
 * which the dispatcher then stores or discards.
 */
public final class ConversationState {

    /** Step value of a dialog that has finished and must be removed. */
    public static final int COMPLETED = -1;

    private final DialogCommand command;
    private final int step;
    private final DialogData data;
    private final ReplyContext context;

    public ConversationState(DialogCommand command, int step, DialogData data, ReplyContext context) {
        if (data == null || data.command() != command) {
            throw new IllegalArgumentException("Dialog data " + data + " does not belong to " + command);
        }
        this.command = command;
        this.step = step;
        this.data = data;
        this.context = context;
    }

    public static ConversationState begin(DialogData data, ReplyContext context) {
        return new ConversationState(data.command(), 1, data, context);
    }

    public DialogCommand getCommand() {
        return command;
    }

    public int getStep() {
        return step;
    }

    public DialogData getData() {
        return data;
    }

    /**
     * Typed view of {@link #getData()}; a mismatch means the state was routed to the wrong flow.
     */
    public <T extends DialogData> T dataAs(Class<T> type) {
        if (!type.isInstance(data)) {
            throw new IllegalStateException("Expected " + type.getSimpleName() + " but " + command
                    + " dialog holds " + data.getClass().getSimpleName());
        }
        return type.cast(data);
    }

    public ReplyContext getContext() {
        return context;
    }

    public boolean isCompleted() {
        return step == COMPLETED;
    }

    public ConversationState advanceTo(int nextStep, DialogData nextData) {
        return new ConversationState(command, nextStep, nextData, context);
    }

    public ConversationState withData(DialogData nextData) {
        return new ConversationState(command, step, nextData, context);
    }

    public ConversationState complete() {
        return new ConversationState(command, COMPLETED, data, context);
    }

    @Override
    public String toString() {
        return "ConversationState{command=" + command + ", step=" + step + ", data=" + data
                + ", context=" + context + "}";
    }
}
