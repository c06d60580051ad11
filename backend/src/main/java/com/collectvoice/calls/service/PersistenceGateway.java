package com.collectvoice.calls.service;

import com.collectvoice.disposition.model.DispositionSnapshot;
import com.collectvoice.disposition.model.TranscriptItem;

import java.util.List;
import java.util.UUID;

public interface PersistenceGateway {

    void recordCallStarted(UUID callId, String roomName, String phoneNumber);

    void recordCallConnected(UUID callId);

    void recordCallCompleted(UUID callId,
                             DispositionSnapshot snapshot,
                             List<TranscriptItem> transcript,
                             int durationSeconds,
                             String recordingUrl);

    void recordCallFailed(UUID callId, String reason, String rawStatus);
}
