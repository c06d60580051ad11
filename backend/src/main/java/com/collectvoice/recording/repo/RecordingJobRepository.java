package com.collectvoice.recording.repo;

import com.collectvoice.recording.model.RecordingJobEntity;
import com.collectvoice.recording.model.RecordingStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RecordingJobRepository extends JpaRepository<RecordingJobEntity, UUID> {
    Optional<RecordingJobEntity> findByEgressId(String egressId);

    Optional<RecordingJobEntity> findTopByCallIdOrderByStartedAtDesc(UUID callId);

    List<RecordingJobEntity> findTop20ByStatusAndStartedAtBeforeOrderByStartedAtAsc(RecordingStatus status, Instant startedBefore);
}
