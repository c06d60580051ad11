package com.collectvoice.calls.dto;

import jakarta.validation.constraints.PositiveOrZero;

public record CustomerInfo(
        String customerName,
        String last4Digits,
        @PositiveOrZero Double emiAmount,
        @PositiveOrZero Integer daysPastDue,
        Double totalBalance,
        Double lateFee,
        Double apr
) {

    public static CustomerInfo defaults() {
        return new CustomerInfo("Customer", "0000", 1500.0, 30, null, null, null);
    }
}
