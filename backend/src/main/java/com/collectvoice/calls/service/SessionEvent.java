package com.collectvoice.calls.service;

public record SessionEvent(SessionEventType type, String text, String role, boolean finalTranscript) {

    public static SessionEvent of(SessionEventType type) {
        return new SessionEvent(type, null, null, false);
    }

    public static SessionEvent userTranscribed(String text, boolean finalTranscript) {
        return new SessionEvent(SessionEventType.USER_TRANSCRIBED, text, "user", finalTranscript);
    }

    public static SessionEvent itemAdded(String role, String text) {
        return new SessionEvent(SessionEventType.CONVERSATION_ITEM_ADDED, text, role, true);
    }
}
