package com.collectvoice.calls.service;

import com.collectvoice.calls.model.CallStatus;
import com.collectvoice.disposition.model.Disposition;
import com.collectvoice.disposition.service.DispositionTracker;
import com.collectvoice.recording.service.RecordingHandle;

import java.time.Instant;
import java.util.UUID;

public class CallSession {

    private final UUID callId;
    private final String roomName;
    private final DialInfo dialInfo;
    private final String agentMetadataJson;
    private final DispositionTracker tracker;
    private final Instant startTime;

    private volatile CallStatus status = CallStatus.INITIATED;
    private RecordingHandle recording;
    private Disposition forcedDisposition;
    private Instant endTime;

    public CallSession(UUID callId,
                       String roomName,
                       DialInfo dialInfo,
                       String agentMetadataJson,
                       DispositionTracker tracker,
                       Instant startTime) {
        this.callId = callId;
        this.roomName = roomName;
        this.dialInfo = dialInfo;
        this.agentMetadataJson = agentMetadataJson;
        this.tracker = tracker;
        this.startTime = startTime;
    }

    public UUID callId() {
        return callId;
    }

    public String roomName() {
        return roomName;
    }

    public DialInfo dialInfo() {
        return dialInfo;
    }

    public String agentMetadataJson() {
        return agentMetadataJson;
    }

    public DispositionTracker tracker() {
        return tracker;
    }

    public Instant startTime() {
        return startTime;
    }

    public CallStatus status() {
        return status;
    }

    void status(CallStatus status) {
        this.status = status;
    }

    public RecordingHandle recording() {
        return recording;
    }

    void recording(RecordingHandle recording) {
        this.recording = recording;
    }

    public Disposition forcedDisposition() {
        return forcedDisposition;
    }

    void forcedDisposition(Disposition forcedDisposition) {
        this.forcedDisposition = forcedDisposition;
    }

    public Instant endTime() {
        return endTime;
    }

    void endTime(Instant endTime) {
        this.endTime = endTime;
    }
}
