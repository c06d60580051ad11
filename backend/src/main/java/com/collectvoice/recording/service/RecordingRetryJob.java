package com.collectvoice.recording.service;

import java.time.Instant;

public record RecordingRetryJob(
        String egressId,
        int attempt,
        Instant availableAt
) {
}
