package com.collectvoice.calls.repo;

import com.collectvoice.calls.model.CallRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface CallRecordRepository extends JpaRepository<CallRecordEntity, UUID> {

    Optional<CallRecordEntity> findByRoomName(String roomName);
}
