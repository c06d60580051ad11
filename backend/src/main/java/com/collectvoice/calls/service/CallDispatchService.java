package com.collectvoice.calls.service;

import com.collectvoice.calls.dto.CreateCallRequest;
import com.collectvoice.calls.dto.CustomerInfo;
import com.collectvoice.calls.model.CallRecordEntity;
import com.collectvoice.calls.model.CallStatus;
import com.collectvoice.calls.repo.CallRecordRepository;
import com.collectvoice.common.exception.ApiException;
import com.collectvoice.common.exception.BadRequestException;
import com.collectvoice.common.exception.ConflictException;
import com.collectvoice.common.exception.NotFoundException;
import com.collectvoice.config.AppProperties;
import com.collectvoice.disposition.model.DispositionSnapshot;
import com.collectvoice.platform.PlatformException;
import com.collectvoice.platform.VoicePlatform;
import com.collectvoice.recording.service.RecordingLifecycleMonitor;
import com.collectvoice.recording.service.RecordingResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Service
public class CallDispatchService {

    private static final Logger log = LoggerFactory.getLogger(CallDispatchService.class);

    private final CallRecordRepository callRecordRepository;
    private final CallSessionFactory sessionFactory;
    private final CallSessionRegistry registry;
    private final VoicePlatform voicePlatform;
    private final RecordingLifecycleMonitor recordingMonitor;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final Clock clock;

    public CallDispatchService(CallRecordRepository callRecordRepository,
                               CallSessionFactory sessionFactory,
                               CallSessionRegistry registry,
                               VoicePlatform voicePlatform,
                               RecordingLifecycleMonitor recordingMonitor,
                               ObjectMapper objectMapper,
                               AppProperties appProperties,
                               Clock clock) {
        this.callRecordRepository = callRecordRepository;
        this.sessionFactory = sessionFactory;
        this.registry = registry;
        this.voicePlatform = voicePlatform;
        this.recordingMonitor = recordingMonitor;
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    public CallRecordEntity createCall(CreateCallRequest request) {
        AppProperties.LiveKit livekit = appProperties.livekit();
        if (isBlank(livekit.url()) || isBlank(livekit.apiKey()) || isBlank(livekit.apiSecret())) {
            throw new ApiException(HttpStatus.INTERNAL_SERVER_ERROR, "LiveKit configuration missing");
        }

        DialInfo dialInfo;
        try {
            dialInfo = DialInfo.parse(request.phoneNumber(), request.fromNumber(), request.transferTo());
        } catch (IllegalArgumentException exception) {
            throw new BadRequestException(exception.getMessage());
        }

        String digits = dialInfo.callTo().replaceAll("[^0-9]", "");
        String roomName = "outbound-" + digits + "-" + UUID.randomUUID().toString().substring(0, 8);
        try {
            voicePlatform.createRoom(roomName);
        } catch (PlatformException exception) {
            log.error("Failed to create room {}", roomName, exception);
            throw new PlatformException("Failed to create room: " + exception.getMessage(), exception);
        }

        try {
            CallRecordEntity call = new CallRecordEntity();
            call.setPhoneNumber(dialInfo.callTo());
            call.setFromNumber(dialInfo.fromNumber());
            call.setTransferTo(dialInfo.transferTo());
            call.setRoomName(roomName);
            call.setDispatchId("dispatch_" + clock.instant().getEpochSecond() + "_" + digits);
            call.setStatus(CallStatus.INITIATED);
            call = callRecordRepository.save(call);

            String metadata = agentMetadata(call, dialInfo, request.customerInfo());
            call.setDialMetadataJson(metadata);
            call = callRecordRepository.save(call);

            CallSessionController controller = sessionFactory.create(call.getId(), roomName, dialInfo, metadata);
            registry.register(controller);
            controller.launch();
            log.info("Call {} dispatched to {} in room {}", call.getId(), dialInfo.callTo(), roomName);
            return call;
        } catch (RuntimeException exception) {
            releaseRoom(roomName);
            throw exception;
        }
    }

    public CallDetails getCall(UUID callId) {
        CallRecordEntity call = callRecordRepository.findById(callId)
                .orElseThrow(() -> new NotFoundException("Call not found"));
        DispositionSnapshot live = registry.find(callId).map(CallSessionController::snapshot).orElse(null);
        RecordingResult recording = recordingMonitor.getRecordingInfo(callId).orElse(null);
        return new CallDetails(call, live, recording);
    }

    public void endCall(UUID callId) {
        activeController(callId).requestEnd(HangupReason.OPERATOR_ENDED);
    }

    public void publishEvent(UUID callId, SessionEvent event) {
        activeController(callId).onEvent(event);
    }

    public boolean pushAudio(UUID callId, byte[] pcm) {
        return activeController(callId).pushAudio(pcm);
    }

    private CallSessionController activeController(UUID callId) {
        CallSessionController controller = registry.find(callId).orElse(null);
        if (controller != null && !controller.isClosed()) {
            return controller;
        }
        if (!callRecordRepository.existsById(callId)) {
            throw new NotFoundException("Call not found");
        }
        throw new ConflictException("Call is not active");
    }

    private String agentMetadata(CallRecordEntity call, DialInfo dialInfo, CustomerInfo customerInfo) {
        CustomerInfo account = customerInfo == null ? CustomerInfo.defaults() : customerInfo;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("phone_number", (dialInfo.fromNumber() == null ? "" : dialInfo.fromNumber()) + "," + dialInfo.callTo());
        metadata.put("transfer_to", dialInfo.transferTo());
        metadata.put("call_id", call.getId().toString());
        metadata.put("dispatch_id", call.getDispatchId());
        metadata.put("account_info", account);
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException exception) {
            throw new IllegalStateException("Unable to serialize dial metadata", exception);
        }
    }

    private void releaseRoom(String roomName) {
        try {
            voicePlatform.deleteRoom(roomName);
        } catch (RuntimeException exception) {
            log.warn("Unable to clean up room {}", roomName, exception);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
