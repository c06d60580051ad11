package com.collectvoice.calls.dto;

import com.collectvoice.calls.model.CallStatus;
import com.collectvoice.disposition.model.ConnectionStatus;
import com.collectvoice.disposition.model.DispositionSnapshot;
import com.collectvoice.disposition.model.InteractionOutcome;
import com.collectvoice.recording.service.RecordingResult;

import java.time.Instant;
import java.util.UUID;

public record CallResponse(
        UUID callId,
        String roomName,
        String dispatchId,
        String phoneNumber,
        CallStatus status,
        String disposition,
        InteractionOutcome outcome,
        ConnectionStatus connectionStatus,
        Integer durationSeconds,
        String recordingUrl,
        String notes,
        boolean paymentDiscussed,
        boolean disputeRaised,
        boolean followUpRequired,
        boolean active,
        DispositionSnapshot live,
        RecordingResult recording,
        Instant createdAt,
        Instant updatedAt
) {
}
