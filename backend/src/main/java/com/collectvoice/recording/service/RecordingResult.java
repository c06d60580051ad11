package com.collectvoice.recording.service;

import com.collectvoice.recording.model.RecordingJobEntity;
import com.collectvoice.recording.model.RecordingStatus;

import java.time.Instant;

public record RecordingResult(
        String egressId,
        RecordingStatus status,
        Instant startedAt,
        Instant completedAt,
        String filePath,
        String fileUrl,
        Long fileSize,
        Double durationSeconds
) {

    public static RecordingResult from(RecordingJobEntity entity) {
        return new RecordingResult(
                entity.getEgressId(),
                entity.getStatus(),
                entity.getStartedAt(),
                entity.getCompletedAt(),
                entity.getFilePath(),
                entity.getFileUrl(),
                entity.getFileSize(),
                entity.getDurationSeconds()
        );
    }
}
