package com.collectvoice.platform.model;

public record ParticipantInfo(
        String sid,
        String identity,
        String state
) {
}
