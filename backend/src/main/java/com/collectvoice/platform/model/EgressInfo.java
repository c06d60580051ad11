package com.collectvoice.platform.model;

public record EgressInfo(
        String egressId,
        String roomName,
        EgressStatus status,
        String filename,
        long durationNanos,
        long fileSize,
        String location,
        String error
) {
}
