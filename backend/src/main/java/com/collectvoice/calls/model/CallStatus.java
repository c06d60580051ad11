package com.collectvoice.calls.model;

public enum CallStatus {
    INITIATED,
    DIALING,
    CONNECTED,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
