package com.collectvoice.recording.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@ConditionalOnProperty(value = "app.retry.worker.enabled", havingValue = "true", matchIfMissing = true)
public class RecordingRetryWorker {

    private static final Logger log = LoggerFactory.getLogger(RecordingRetryWorker.class);
    private static final int BATCH_SIZE = 5;

    private final RecordingUploadRetryQueue retryQueue;
    private final RecordingLifecycleMonitor recordingMonitor;

    public RecordingRetryWorker(RecordingUploadRetryQueue retryQueue, RecordingLifecycleMonitor recordingMonitor) {
        this.retryQueue = retryQueue;
        this.recordingMonitor = recordingMonitor;
    }

    @Scheduled(fixedDelayString = "${app.retry.worker.delay-ms:10000}")
    public void pollAndRetryUploads() {
        for (int i = 0; i < BATCH_SIZE; i++) {
            Optional<RecordingRetryJob> job;
            try {
                job = retryQueue.pollReadyJob();
            } catch (Exception exception) {
                log.warn("Upload retry queue unavailable", exception);
                return;
            }
            if (job.isEmpty()) {
                return;
            }

            try {
                recordingMonitor.retryUpload(job.get());
            } catch (Exception exception) {
                log.error("Upload retry failed: {}", job.get(), exception);
            }
        }
    }

    @Scheduled(fixedDelayString = "${app.retry.worker.sweep-delay-ms:60000}")
    public void sweepStaleRecordings() {
        try {
            recordingMonitor.sweepStaleRecordings();
        } catch (Exception exception) {
            log.error("Stale recording sweep failed", exception);
        }
    }
}
