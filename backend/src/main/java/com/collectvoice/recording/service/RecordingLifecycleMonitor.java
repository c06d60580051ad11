package com.collectvoice.recording.service;

import com.collectvoice.config.AppProperties;
import com.collectvoice.platform.VoicePlatform;
import com.collectvoice.platform.model.EgressInfo;
import com.collectvoice.recording.model.RecordingJobEntity;
import com.collectvoice.recording.model.RecordingStatus;
import com.collectvoice.recording.repo.RecordingJobRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

@Service
public class RecordingLifecycleMonitor {

    private static final Logger log = LoggerFactory.getLogger(RecordingLifecycleMonitor.class);
    private static final long RETRY_BACKOFF_SECONDS = 30L;

    private final VoicePlatform voicePlatform;
    private final RecordingJobRepository recordingJobRepository;
    private final RecordingFileOrganizer fileOrganizer;
    private final ObjectStorageService objectStorage;
    private final RecordingUploadRetryQueue retryQueue;
    private final AppProperties appProperties;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final Counter uploadFailedCounter;
    private final Counter retryCounter;

    public RecordingLifecycleMonitor(VoicePlatform voicePlatform,
                                     RecordingJobRepository recordingJobRepository,
                                     RecordingFileOrganizer fileOrganizer,
                                     ObjectStorageService objectStorage,
                                     RecordingUploadRetryQueue retryQueue,
                                     AppProperties appProperties,
                                     @Qualifier("callScheduler") ScheduledExecutorService scheduler,
                                     Clock clock,
                                     ApplicationEventPublisher publisher,
                                     MeterRegistry meterRegistry) {
        this.voicePlatform = voicePlatform;
        this.recordingJobRepository = recordingJobRepository;
        this.fileOrganizer = fileOrganizer;
        this.objectStorage = objectStorage;
        this.retryQueue = retryQueue;
        this.appProperties = appProperties;
        this.scheduler = scheduler;
        this.clock = clock;
        this.publisher = publisher;
        this.uploadFailedCounter = meterRegistry.counter("recordings.upload.failed.total");
        this.retryCounter = meterRegistry.counter("recordings.retry.scheduled.total");
    }

    public Optional<RecordingHandle> start(String roomName, UUID callId) {
        if (!appProperties.storage().hasCredentials()) {
            log.error("Storage credentials not configured, room {} will not be recorded", roomName);
            return Optional.empty();
        }

        try {
            Instant now = clock.instant();
            String filepath = fileOrganizer.egressFilepath(roomName, LocalDate.now(clock), now.getEpochSecond());
            log.info("Starting room recording for {}", roomName);
            String egressId = voicePlatform.startRoomRecording(roomName, filepath);

            RecordingJobEntity job = new RecordingJobEntity();
            job.setCallId(callId);
            job.setEgressId(egressId);
            job.setRoomName(roomName);
            job.setStatus(RecordingStatus.RECORDING);
            job.setStartedAt(now);
            job.setFormat("mp4");
            recordingJobRepository.save(job);
            log.info("Recording started with egress id {}", egressId);

            RecordingHandle handle = new RecordingHandle(egressId, callId, this, appProperties.recording().maxPollErrors());
            long interval = appProperties.recording().pollInterval().toMillis();
            ScheduledFuture<?> loop = scheduler.scheduleWithFixedDelay(handle::pollFromLoop, interval, interval, TimeUnit.MILLISECONDS);
            handle.attach(loop);
            return Optional.of(handle);
        } catch (Exception exception) {
            log.error("Failed to start recording for room {}", roomName, exception);
            return Optional.empty();
        }
    }

    public void stop(String egressId) {
        try {
            log.info("Stopping recording {}", egressId);
            voicePlatform.stopRecording(egressId);
        } catch (Exception exception) {
            log.error("Failed to stop recording {}", egressId, exception);
        }
    }

    public Optional<RecordingResult> findByEgressId(String egressId) {
        return recordingJobRepository.findByEgressId(egressId).map(RecordingResult::from);
    }

    public Optional<RecordingResult> getRecordingInfo(UUID callId) {
        return recordingJobRepository.findTopByCallIdOrderByStartedAtDesc(callId).map(RecordingResult::from);
    }

    public int sweepStaleRecordings() {
        Instant cutoff = clock.instant().minus(appProperties.recording().staleAfter());
        List<RecordingJobEntity> stale = recordingJobRepository
                .findTop20ByStatusAndStartedAtBeforeOrderByStartedAtAsc(RecordingStatus.RECORDING, cutoff);
        int resolved = 0;
        for (RecordingJobEntity job : stale) {
            try {
                RecordingStatus status = pollOnce(job.getEgressId(), job.getCallId());
                if (status.isTerminal()) {
                    resolved++;
                } else {
                    log.warn("Recording {} still running since {}, asking the platform to stop it",
                            job.getEgressId(), job.getStartedAt());
                    stop(job.getEgressId());
                }
            } catch (Exception exception) {
                log.warn("Unable to check stale recording {}", job.getEgressId(), exception);
            }
        }
        if (!stale.isEmpty()) {
            log.info("Swept {} stale recordings, {} resolved", stale.size(), resolved);
        }
        return resolved;
    }

    RecordingStatus pollOnce(String egressId, UUID callId) {
        List<EgressInfo> items = voicePlatform.listRecordings(egressId);
        if (items == null || items.isEmpty()) {
            log.warn("No egress found for {}", egressId);
            return markFailed(egressId);
        }

        EgressInfo egress = items.get(0);
        if (egress.status().isComplete()) {
            log.info("Recording {} completed ({})", egressId, egress.status());
            return handleCompleted(egress, callId);
        }
        if (egress.status().isFailure()) {
            log.error("Recording {} failed: {}", egressId, egress.error());
            return markFailed(egressId);
        }
        return RecordingStatus.RECORDING;
    }

    RecordingStatus markFailed(String egressId) {
        Optional<RecordingJobEntity> job = recordingJobRepository.findByEgressId(egressId);
        if (job.isPresent() && job.get().fail(clock.instant())) {
            recordingJobRepository.save(job.get());
        }
        return RecordingStatus.FAILED;
    }

    public void retryUpload(RecordingRetryJob retryJob) {
        RecordingJobEntity job = recordingJobRepository.findByEgressId(retryJob.egressId()).orElse(null);
        if (job == null || job.getStatus() != RecordingStatus.COMPLETED || job.getFileUrl() != null) {
            return;
        }
        if (job.getFilePath() == null || !Files.exists(Path.of(job.getFilePath()))) {
            log.warn("Local recording for {} is gone, nothing to upload", job.getEgressId());
            return;
        }

        LocalDate date = LocalDate.ofInstant(job.getCompletedAt() == null ? clock.instant() : job.getCompletedAt(), clock.getZone());
        uploadAndRelease(job, Path.of(job.getFilePath()), date, retryJob.attempt());
        recordingJobRepository.save(job);
    }

    private RecordingStatus handleCompleted(EgressInfo egress, UUID callId) {
        RecordingJobEntity job = recordingJobRepository.findByEgressId(egress.egressId()).orElse(null);
        if (job == null) {
            log.warn("Recording {} completed but has no job record", egress.egressId());
            return RecordingStatus.COMPLETED;
        }
        if (!job.complete(clock.instant())) {
            return job.getStatus();
        }
        if (egress.durationNanos() > 0) {
            job.setDurationSeconds(egress.durationNanos() / 1_000_000_000.0);
        }

        LocalDate date = LocalDate.now(clock);
        try {
            Path finalPath = fileOrganizer.organize(egress.filename(), date, callId);
            if (Files.exists(finalPath)) {
                job.setFilePath(finalPath.toString());
                job.setFileSize(Files.size(finalPath));
                if (objectStorage.isEnabled()) {
                    uploadAndRelease(job, finalPath, date, 1);
                }
            } else if (egress.location() != null && !egress.location().isBlank()) {
                job.setFileUrl(egress.location());
                if (egress.fileSize() > 0) {
                    job.setFileSize(egress.fileSize());
                }
                publishUploaded(job);
            }
        } catch (Exception exception) {
            log.error("Unable to organize recording {}", egress.egressId(), exception);
        }

        recordingJobRepository.save(job);
        return RecordingStatus.COMPLETED;
    }

    private boolean uploadAndRelease(RecordingJobEntity job, Path localPath, LocalDate date, int attempt) {
        AppProperties.Storage storage = appProperties.storage();
        String remoteKey = fileOrganizer.remoteKey(storage.prefix(), date, job.getCallId());
        job.setUploadAttempts(job.getUploadAttempts() + 1);

        String url;
        try {
            objectStorage.upload(localPath, remoteKey);
            url = storage.usePresignedUrls()
                    ? objectStorage.presignedUrl(remoteKey, storage.presignedUrlTtl())
                    : objectStorage.publicUrl(remoteKey);
        } catch (Exception exception) {
            uploadFailedCounter.increment();
            log.error("Upload of recording {} failed, keeping local file {}", job.getEgressId(), localPath, exception);
            scheduleUploadRetry(job.getEgressId(), attempt + 1);
            return false;
        }

        job.setFileUrl(url);
        log.info("Uploaded recording {} to {}", job.getEgressId(), remoteKey);
        publishUploaded(job);
        if (storage.deleteLocalAfterUpload()) {
            try {
                Files.deleteIfExists(localPath);
                log.info("Deleted local file after upload: {}", localPath);
            } catch (IOException exception) {
                log.error("Failed to delete local file {}", localPath, exception);
            }
        }
        return true;
    }

    private void publishUploaded(RecordingJobEntity job) {
        try {
            publisher.publishEvent(new RecordingUploadedEvent(job.getCallId(), job.getEgressId(), job.getFileUrl(), clock.instant()));
        } catch (Exception exception) {
            log.warn("Unable to attach recording {} to call {}", job.getEgressId(), job.getCallId(), exception);
        }
    }

    private void scheduleUploadRetry(String egressId, int attempt) {
        if (attempt > appProperties.retry().maxAttempts()) {
            log.error("Giving up on uploading recording {} after {} attempts", egressId, attempt - 1);
            return;
        }
        try {
            Instant availableAt = clock.instant().plus(Duration.ofSeconds(RETRY_BACKOFF_SECONDS * (attempt - 1)));
            retryQueue.enqueue(new RecordingRetryJob(egressId, attempt, availableAt));
            retryCounter.increment();
        } catch (Exception exception) {
            log.error("Unable to enqueue upload retry for recording {}", egressId, exception);
        }
    }
}
