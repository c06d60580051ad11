package com.collectvoice.platform.model;

public record SipDialRequest(
        String roomName,
        String trunkId,
        String callTo,
        String participantIdentity
) {
}
