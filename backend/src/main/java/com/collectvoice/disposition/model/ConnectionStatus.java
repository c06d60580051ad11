package com.collectvoice.disposition.model;

public enum ConnectionStatus {
    CONNECTED,
    NOT_CONNECTED
}
