package io.barhistory.session;

public enum SessionState {
    CREATED,
    PULLING,
    CANCELLING,
    FINISHED,
    ERRORED;

    public boolean isTerminal() { return this == FINISHED || this == ERRORED; }
}
