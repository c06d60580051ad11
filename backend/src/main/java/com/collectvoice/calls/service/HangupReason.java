package com.collectvoice.calls.service;

public enum HangupReason {
    HARD_TIMEOUT,
    AGENT_ENDED,
    OPERATOR_ENDED,
    VOICEMAIL,
    PLATFORM_CLOSED,
    TRANSFER_FAILED,
    DIAL_FAILED,
    SHUTDOWN
}
