package com.collectvoice.calls.service;

import com.collectvoice.calls.dto.CallResponse;
import com.collectvoice.calls.dto.SessionEventRequest;
import com.collectvoice.calls.model.CallRecordEntity;

public final class CallMapper {

    private CallMapper() {
    }

    public static CallResponse toResponse(CallRecordEntity entity) {
        return toResponse(new CallDetails(entity, null, null));
    }

    public static CallResponse toResponse(CallDetails details) {
        CallRecordEntity entity = details.call();
        String recordingUrl = entity.getRecordingUrl();
        if (recordingUrl == null && details.recording() != null) {
            recordingUrl = details.recording().fileUrl();
        }
        return new CallResponse(
                entity.getId(),
                entity.getRoomName(),
                entity.getDispatchId(),
                entity.getPhoneNumber(),
                entity.getStatus(),
                entity.getDisposition(),
                entity.getOutcome(),
                entity.getConnectionStatus(),
                entity.getDurationSeconds(),
                recordingUrl,
                entity.getNotes(),
                entity.isPaymentDiscussed(),
                entity.isDisputeRaised(),
                entity.isFollowUpRequired(),
                details.live() != null,
                details.live(),
                details.recording(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }

    public static SessionEvent toEvent(SessionEventRequest request) {
        boolean isFinal = request.isFinal() == null || request.isFinal();
        return new SessionEvent(request.type(), request.text(), request.role(), isFinal);
    }
}
