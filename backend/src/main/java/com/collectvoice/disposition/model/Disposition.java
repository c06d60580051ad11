package com.collectvoice.disposition.model;

public enum Disposition {
    USER_CLAIMED_PAYMENT_WITH_DATE("User Claimed Payment with Payment Date", ConnectionStatus.CONNECTED),
    USER_CLAIMED_PAYMENT("User Claimed Payment", ConnectionStatus.CONNECTED),
    USER_AGREES_TO_MAINTAIN_BALANCE("User Agrees to Maintain Balance", ConnectionStatus.CONNECTED),
    AGREE_TO_PAY("Agree To Pay", ConnectionStatus.CONNECTED),
    GENERAL("General", ConnectionStatus.CONNECTED),
    PAYMENT_DUE_REMINDER("Payment Due Reminder", ConnectionStatus.CONNECTED),
    REFUSED_TO_PAY("Refused to Pay", ConnectionStatus.CONNECTED),
    RTP_COUNSELLED("RTP - Counselled", ConnectionStatus.CONNECTED),
    HUMAN_HANDOFF_REQUESTED("Human Handoff Requested", ConnectionStatus.CONNECTED),
    RAISE_DISPUTE_WITH_DETAIL("Raise Dispute with Detail", ConnectionStatus.CONNECTED),
    USER_BUSY_NOW("User Busy Now", ConnectionStatus.CONNECTED),
    NO_RESPONSE("No Response", ConnectionStatus.CONNECTED),
    CUSTOMER_HANGUP("Customer Hangup", ConnectionStatus.CONNECTED),
    DELAY_REASON("Delay Reason", ConnectionStatus.CONNECTED),
    UNCERTAIN_PROPENSITY_TO_PAY("Uncertain Propensity to Pay", ConnectionStatus.CONNECTED),
    ACCEPTABLE_PROMISE_TO_PAY("Acceptable Promise To Pay", ConnectionStatus.CONNECTED),
    UNACCEPTABLE_PROMISE_TO_PAY("Unacceptable Promise To Pay", ConnectionStatus.CONNECTED),
    DO_NOT_CALL("Do Not Call - Opted Out", ConnectionStatus.CONNECTED),

    BUSY("Busy", ConnectionStatus.NOT_CONNECTED),
    FAILED("Failed", ConnectionStatus.NOT_CONNECTED),
    NO_ANSWER("No Answer", ConnectionStatus.NOT_CONNECTED);

    private final String label;
    private final ConnectionStatus requiredStatus;

    Disposition(String label, ConnectionStatus requiredStatus) {
        this.label = label;
        this.requiredStatus = requiredStatus;
    }

    public String label() {
        return label;
    }

    public ConnectionStatus requiredStatus() {
        return requiredStatus;
    }

    public boolean isCompatibleWith(ConnectionStatus status) {
        return status == null || requiredStatus == status;
    }
}
