package io.mhm.core.dispatch;

public enum TicketState {
    CREATED,
    SUBMITTED,
    RUNNING,
    COMPLETED,
    FAILED,
    DISPOSED
}
