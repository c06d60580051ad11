package com.collectvoice.calls.service;

public record DialInfo(String fromNumber, String callTo, String transferTo) {

    public static DialInfo parse(String phoneNumber, String fromNumber, String transferTo) {
        if (phoneNumber == null || phoneNumber.isBlank()) {
            throw new IllegalArgumentException("phone number is required");
        }
        String[] parts = phoneNumber.split(",", -1);
        if (parts.length > 2) {
            throw new IllegalArgumentException("phone number must be a single number or a from,to pair");
        }
        String to = parts[parts.length - 1];
        if (to.isBlank()) {
            throw new IllegalArgumentException("number to dial is missing in '" + phoneNumber + "'");
        }
        String from = parts.length == 2 && !parts[0].isBlank() ? parts[0] : fromNumber;
        return new DialInfo(blankToNull(from), to.trim(), blankToNull(transferTo));
    }

    public String participantIdentity() {
        return callTo;
    }

    public boolean canTransfer() {
        return transferTo != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
