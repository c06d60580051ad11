package com.collectvoice.disposition.model;

public enum Speaker {
    AGENT,
    CUSTOMER
}
