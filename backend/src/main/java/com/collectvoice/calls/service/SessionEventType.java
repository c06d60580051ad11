package com.collectvoice.calls.service;

public enum SessionEventType {
    USER_TRANSCRIBED,
    CONVERSATION_ITEM_ADDED,
    SESSION_CLOSED,
    END_CALL_REQUESTED,
    VOICEMAIL_DETECTED,
    TRANSFER_REQUESTED,
    OPT_OUT_REQUESTED
}
