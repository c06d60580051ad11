package com.collectvoice.calls.service;

import com.collectvoice.calls.model.CallRecordEntity;
import com.collectvoice.calls.model.CallStatus;
import com.collectvoice.calls.repo.CallRecordRepository;
import com.collectvoice.disposition.model.ConnectionStatus;
import com.collectvoice.disposition.model.Disposition;
import com.collectvoice.disposition.model.DispositionEvent;
import com.collectvoice.disposition.model.DispositionSnapshot;
import com.collectvoice.disposition.model.InteractionOutcome;
import com.collectvoice.disposition.model.TranscriptItem;
import com.collectvoice.recording.service.RecordingUploadedEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Service
public class JpaPersistenceGateway implements PersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(JpaPersistenceGateway.class);
    private static final List<String> PAYMENT_KEYWORDS = List.of("payment", "pay", "paid", "emi");
    private static final List<String> FOLLOW_UP_KEYWORDS = List.of("promise", "will call", "busy", "uncertain");

    private final CallRecordRepository callRecordRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JpaPersistenceGateway(CallRecordRepository callRecordRepository, ObjectMapper objectMapper, Clock clock) {
        this.callRecordRepository = callRecordRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    @Transactional
    public void recordCallStarted(UUID callId, String roomName, String phoneNumber) {
        CallRecordEntity call = getCall(callId);
        call.setRoomName(roomName);
        call.setPhoneNumber(phoneNumber);
        call.setStatus(CallStatus.DIALING);
        callRecordRepository.save(call);
        log.info("Call {} started in room {}", callId, roomName);
    }

    @Override
    @Transactional
    public void recordCallConnected(UUID callId) {
        CallRecordEntity call = getCall(callId);
        call.setStatus(CallStatus.IN_PROGRESS);
        call.setConnectionStatus(ConnectionStatus.CONNECTED);
        call.setConnectedAt(clock.instant());
        callRecordRepository.save(call);
        log.info("Call {} connected", callId);
    }

    @Override
    @Transactional
    public void recordCallCompleted(UUID callId,
                                    DispositionSnapshot snapshot,
                                    List<TranscriptItem> transcript,
                                    int durationSeconds,
                                    String recordingUrl) {
        CallRecordEntity call = getCall(callId);
        Instant now = clock.instant();
        String label = snapshot.dispositionLabel();
        String lowered = label == null ? "" : label.toLowerCase(Locale.ROOT);

        call.setStatus(CallStatus.COMPLETED);
        call.setOutcome(InteractionOutcome.forDisposition(snapshot.disposition()));
        call.setDisposition(label);
        call.setConnectionStatus(snapshot.connectionStatus());
        call.setEndedAt(now);
        call.setDurationSeconds(durationSeconds);
        call.setTranscriptJson(toJson(transcriptRows(transcript)));
        call.setDispositionJson(toJson(dispositionDocument(snapshot, durationSeconds, now)));
        if (recordingUrl != null) {
            call.setRecordingUrl(recordingUrl);
        }
        call.setNotes("""
                DISPOSITION: %s
                CONNECTION_STATUS: %s
                CALL_DURATION: %d seconds
                DISPOSITION_TIME: %s""".formatted(
                label,
                snapshot.connectionStatus() == null ? "UNKNOWN" : snapshot.connectionStatus(),
                durationSeconds,
                now));
        call.setPaymentDiscussed(PAYMENT_KEYWORDS.stream().anyMatch(lowered::contains));
        call.setDisputeRaised(lowered.contains("dispute"));
        call.setFollowUpRequired(FOLLOW_UP_KEYWORDS.stream().anyMatch(lowered::contains));
        callRecordRepository.save(call);
        log.info("Call {} completed with disposition {}", callId, label);
    }

    @Override
    @Transactional
    public void recordCallFailed(UUID callId, String reason, String rawStatus) {
        CallRecordEntity call = getCall(callId);
        Instant now = clock.instant();

        call.setStatus(CallStatus.FAILED);
        call.setOutcome(failureOutcome(reason));
        call.setDisposition(reason);
        call.setConnectionStatus(ConnectionStatus.NOT_CONNECTED);
        call.setEndedAt(now);
        call.setDurationSeconds(0);
        call.setFailureReason(reason);
        call.setSipStatus(rawStatus);
        call.setNotes("""
                DISPOSITION: %s
                CONNECTION_STATUS: NOT_CONNECTED
                SIP_STATUS: %s
                FAILED_AT: %s""".formatted(reason, rawStatus == null ? "Unknown" : rawStatus, now));

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("failed_at", now.toString());
        document.put("failure_reason", reason);
        document.put("sip_status", rawStatus);
        call.setDispositionJson(toJson(document));
        callRecordRepository.save(call);
        log.info("Call {} failed: {} ({})", callId, reason, rawStatus);
    }

    static InteractionOutcome failureOutcome(String reason) {
        for (Disposition disposition : List.of(Disposition.BUSY, Disposition.NO_ANSWER, Disposition.FAILED)) {
            if (disposition.label().equals(reason)) {
                return InteractionOutcome.forDisposition(disposition);
            }
        }
        return InteractionOutcome.INVALID_NUMBER;
    }

    @EventListener
    @Transactional
    public void onRecordingUploaded(RecordingUploadedEvent event) {
        callRecordRepository.findById(event.callId()).ifPresentOrElse(call -> {
            call.setRecordingUrl(event.fileUrl());
            callRecordRepository.save(call);
            log.info("Call {} now links recording {}", event.callId(), event.egressId());
        }, () -> log.warn("Recording {} uploaded for unknown call {}", event.egressId(), event.callId()));
    }

    private CallRecordEntity getCall(UUID callId) {
        return callRecordRepository.findById(callId)
                .orElseThrow(() -> new IllegalStateException("No call record for " + callId));
    }

    private List<Map<String, Object>> transcriptRows(List<TranscriptItem> transcript) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (TranscriptItem item : transcript) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("speaker", item.speaker().name().toLowerCase(Locale.ROOT));
            row.put("text", item.text());
            row.put("timestamp", item.timestamp().toString());
            rows.add(row);
        }
        return rows;
    }

    private Map<String, Object> dispositionDocument(DispositionSnapshot snapshot, int durationSeconds, Instant completedAt) {
        List<Map<String, Object>> history = new ArrayList<>();
        for (DispositionEvent event : snapshot.history()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("timestamp", event.timestamp().toString());
            entry.put("disposition", event.disposition().label());
            history.add(entry);
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("final_disposition", snapshot.dispositionLabel());
        document.put("connection_status", snapshot.connectionStatus() == null ? null : snapshot.connectionStatus().name());
        document.put("disposition_history", history);
        document.put("duration_seconds", durationSeconds);
        document.put("completed_at", completedAt.toString());
        return document;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException exception) {
            throw new IllegalStateException("Unable to serialize call data", exception);
        }
    }
}
