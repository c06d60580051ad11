package com.collectvoice.disposition.model;

import java.util.EnumMap;
import java.util.Map;

public enum InteractionOutcome {
    PAYMENT_MADE,
    PAYMENT_PROMISED,
    WILL_CALL_BACK,
    NOT_INTERESTED,
    TRANSFERRED_TO_HUMAN,
    DISPUTE_CLAIM,
    NO_ANSWER,
    HUNG_UP,
    BUSY,
    INVALID_NUMBER;

    private static final Map<Disposition, InteractionOutcome> BY_DISPOSITION = new EnumMap<>(Disposition.class);

    static {
        BY_DISPOSITION.put(Disposition.USER_CLAIMED_PAYMENT_WITH_DATE, PAYMENT_MADE);
        BY_DISPOSITION.put(Disposition.USER_CLAIMED_PAYMENT, PAYMENT_MADE);
        BY_DISPOSITION.put(Disposition.USER_AGREES_TO_MAINTAIN_BALANCE, PAYMENT_PROMISED);
        BY_DISPOSITION.put(Disposition.AGREE_TO_PAY, PAYMENT_PROMISED);
        BY_DISPOSITION.put(Disposition.ACCEPTABLE_PROMISE_TO_PAY, PAYMENT_PROMISED);
        BY_DISPOSITION.put(Disposition.UNACCEPTABLE_PROMISE_TO_PAY, WILL_CALL_BACK);
        BY_DISPOSITION.put(Disposition.REFUSED_TO_PAY, NOT_INTERESTED);
        BY_DISPOSITION.put(Disposition.RTP_COUNSELLED, NOT_INTERESTED);
        BY_DISPOSITION.put(Disposition.HUMAN_HANDOFF_REQUESTED, TRANSFERRED_TO_HUMAN);
        BY_DISPOSITION.put(Disposition.RAISE_DISPUTE_WITH_DETAIL, DISPUTE_CLAIM);
        BY_DISPOSITION.put(Disposition.USER_BUSY_NOW, WILL_CALL_BACK);
        BY_DISPOSITION.put(Disposition.NO_RESPONSE, NO_ANSWER);
        BY_DISPOSITION.put(Disposition.CUSTOMER_HANGUP, HUNG_UP);
        BY_DISPOSITION.put(Disposition.DELAY_REASON, WILL_CALL_BACK);
        BY_DISPOSITION.put(Disposition.UNCERTAIN_PROPENSITY_TO_PAY, WILL_CALL_BACK);
        BY_DISPOSITION.put(Disposition.BUSY, BUSY);
        BY_DISPOSITION.put(Disposition.FAILED, INVALID_NUMBER);
        BY_DISPOSITION.put(Disposition.NO_ANSWER, NO_ANSWER);
        BY_DISPOSITION.put(Disposition.GENERAL, WILL_CALL_BACK);
        BY_DISPOSITION.put(Disposition.PAYMENT_DUE_REMINDER, WILL_CALL_BACK);
    }

    public static InteractionOutcome forDisposition(Disposition disposition) {
        if (disposition == null) {
            return WILL_CALL_BACK;
        }
        return BY_DISPOSITION.getOrDefault(disposition, WILL_CALL_BACK);
    }
}
