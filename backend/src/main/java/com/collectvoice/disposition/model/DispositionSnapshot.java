package com.collectvoice.disposition.model;

import java.util.List;

public record DispositionSnapshot(
        Disposition disposition,
        ConnectionStatus connectionStatus,
        List<DispositionEvent> history,
        List<TranscriptItem> transcript,
        double callDurationSeconds
) {

    public DispositionSnapshot {
        history = List.copyOf(history);
        transcript = List.copyOf(transcript);
    }

    public String dispositionLabel() {
        return disposition == null ? null : disposition.label();
    }
}
