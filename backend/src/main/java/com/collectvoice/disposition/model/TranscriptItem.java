package com.collectvoice.disposition.model;

import java.time.Instant;
import java.util.Objects;

public record TranscriptItem(
        Speaker speaker,
        String text,
        Instant timestamp
) {

    public TranscriptItem {
        Objects.requireNonNull(speaker, "speaker must not be null");
        text = text == null ? "" : text;
    }
}
