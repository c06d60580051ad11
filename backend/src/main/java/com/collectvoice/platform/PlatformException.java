package com.collectvoice.platform;

public class PlatformException extends RuntimeException {

    private final String code;

    public PlatformException(String code, String message) {
        super(message);
        this.code = code;
    }

    public PlatformException(String message, Throwable cause) {
        super(message, cause);
        this.code = "unknown";
    }

    public String getCode() {
        return code;
    }
}
