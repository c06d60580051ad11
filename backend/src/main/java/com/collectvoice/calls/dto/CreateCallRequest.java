package com.collectvoice.calls.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

public record CreateCallRequest(
        @NotBlank String phoneNumber,
        String fromNumber,
        String transferTo,
        @Valid CustomerInfo customerInfo
) {
}
