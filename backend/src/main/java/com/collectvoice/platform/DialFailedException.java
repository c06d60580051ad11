package com.collectvoice.platform;

public class DialFailedException extends PlatformException {

    private final String sipStatusCode;
    private final String sipStatus;

    public DialFailedException(String code, String message, String sipStatusCode, String sipStatus) {
        super(code, message);
        this.sipStatusCode = sipStatusCode;
        this.sipStatus = sipStatus;
    }

    public String getSipStatusCode() {
        return sipStatusCode;
    }

    public String getSipStatus() {
        return sipStatus;
    }

    // SIP status such as "486 Busy Here", else the error message
    public String rawStatus() {
        StringBuilder builder = new StringBuilder();
        if (sipStatusCode != null && !sipStatusCode.isBlank()) {
            builder.append(sipStatusCode.trim());
        }
        if (sipStatus != null && !sipStatus.isBlank()) {
            if (!builder.isEmpty()) {
                builder.append(' ');
            }
            builder.append(sipStatus.trim());
        }
        return builder.isEmpty() ? String.valueOf(getMessage()) : builder.toString();
    }
}
