package com.collectvoice.recording.model;

public enum RecordingStatus {
    RECORDING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RECORDING;
    }
}
