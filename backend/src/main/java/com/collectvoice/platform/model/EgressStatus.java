package com.collectvoice.platform.model;

public enum EgressStatus {
    EGRESS_STARTING,
    EGRESS_ACTIVE,
    EGRESS_ENDING,
    EGRESS_COMPLETE,
    EGRESS_FAILED,
    EGRESS_ABORTED,
    EGRESS_LIMIT_REACHED,
    UNKNOWN;

    // LIMIT_REACHED still leaves a file
    public boolean isComplete() {
        return this == EGRESS_COMPLETE || this == EGRESS_LIMIT_REACHED;
    }

    public boolean isFailure() {
        return this == EGRESS_FAILED || this == EGRESS_ABORTED;
    }

    public static EgressStatus parse(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return EgressStatus.valueOf(value.trim());
        } catch (IllegalArgumentException exception) {
            return UNKNOWN;
        }
    }
}
