package com.collectvoice.disposition.model;

import java.time.Instant;

public record DispositionEvent(
        Instant timestamp,
        Disposition disposition
) {
}
