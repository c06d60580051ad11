package com.collectvoice.calls.dto;

import com.collectvoice.calls.service.SessionEventType;
import jakarta.validation.constraints.NotNull;

public record SessionEventRequest(
        @NotNull SessionEventType type,
        String text,
        String role,
        Boolean isFinal
) {
}
