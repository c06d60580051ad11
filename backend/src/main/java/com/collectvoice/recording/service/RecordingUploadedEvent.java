package com.collectvoice.recording.service;

import java.time.Instant;
import java.util.UUID;

public record RecordingUploadedEvent(
        UUID callId,
        String egressId,
        String fileUrl,
        Instant uploadedAt
) {}
