package com.collectvoice.platform.adapter;

import com.collectvoice.config.AppProperties;
import com.collectvoice.platform.DialFailedException;
import com.collectvoice.platform.PlatformException;
import com.collectvoice.platform.VoicePlatform;
import com.collectvoice.platform.model.EgressInfo;
import com.collectvoice.platform.model.EgressStatus;
import com.collectvoice.platform.model.ParticipantInfo;
import com.collectvoice.platform.model.SipDialRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class LiveKitTwirpClient implements VoicePlatform {

    private static final Logger log = LoggerFactory.getLogger(LiveKitTwirpClient.class);

    private static final String ROOM_SERVICE = "livekit.RoomService";
    private static final String SIP_SERVICE = "livekit.SIP";
    private static final String EGRESS_SERVICE = "livekit.Egress";
    private static final String DISPATCH_SERVICE = "livekit.AgentDispatchService";
    private static final Duration PARTICIPANT_POLL_INTERVAL = Duration.ofMillis(500);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final LiveKitTokenService tokenService;

    public LiveKitTwirpClient(RestClient.Builder builder,
                              ObjectMapper objectMapper,
                              AppProperties appProperties,
                              LiveKitTokenService tokenService) {
        this.restClient = builder.build();
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
        this.tokenService = tokenService;
    }

    @Override
    public void createRoom(String roomName) {
        call(ROOM_SERVICE, "CreateRoom", roomName, Map.of("name", roomName));
    }

    @Override
    public void deleteRoom(String roomName) {
        call(ROOM_SERVICE, "DeleteRoom", roomName, Map.of("room", roomName));
    }

    @Override
    public String dispatchAgent(String roomName, String metadataJson) {
        JsonNode response = call(DISPATCH_SERVICE, "CreateDispatch", roomName, Map.of(
                "room", roomName,
                "agent_name", appProperties.livekit().agentName(),
                "metadata", metadataJson == null ? "" : metadataJson
        ));
        return text(response, "id", "id");
    }

    @Override
    public ParticipantInfo createSipParticipant(SipDialRequest request) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("room_name", request.roomName());
        payload.put("sip_trunk_id", request.trunkId());
        payload.put("sip_call_to", request.callTo());
        payload.put("participant_identity", request.participantIdentity());
        payload.put("wait_until_answered", true);

        JsonNode response = call(SIP_SERVICE, "CreateSIPParticipant", request.roomName(), payload);
        return new ParticipantInfo(
                text(response, "participant_id", "participantId"),
                text(response, "participant_identity", "participantIdentity"),
                "ACTIVE"
        );
    }

    @Override
    public void transferSipParticipant(String roomName, String participantIdentity, String transferTo) {
        call(SIP_SERVICE, "TransferSIPParticipant", roomName, Map.of(
                "room_name", roomName,
                "participant_identity", participantIdentity,
                "transfer_to", transferTo
        ));
    }

    @Override
    public ParticipantInfo waitForParticipant(String roomName, String participantIdentity, Duration timeout) {
        Instant deadline = Instant.now().plus(timeout);
        while (true) {
            JsonNode response = call(ROOM_SERVICE, "ListParticipants", roomName, Map.of("room", roomName));
            for (JsonNode participant : response.path("participants")) {
                if (participantIdentity.equals(participant.path("identity").asText())) {
                    return new ParticipantInfo(
                            participant.path("sid").asText(),
                            participantIdentity,
                            participant.path("state").asText("ACTIVE")
                    );
                }
            }
            if (Instant.now().isAfter(deadline)) {
                throw new PlatformException("deadline_exceeded",
                        "Participant " + participantIdentity + " did not join room " + roomName);
            }
            try {
                Thread.sleep(PARTICIPANT_POLL_INTERVAL.toMillis());
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
                throw new PlatformException("Interrupted while waiting for participant", exception);
            }
        }
    }

    @Override
    public void sendAgentInstruction(String roomName, String instruction) {
        try {
            byte[] data = objectMapper.writeValueAsBytes(Map.of("type", "instruction", "instructions", instruction));
            call(ROOM_SERVICE, "SendData", roomName, Map.of(
                    "room", roomName,
                    "data", Base64.getEncoder().encodeToString(data),
                    "kind", "RELIABLE",
                    "topic", "agent-instructions"
            ));
        } catch (IOException exception) {
            throw new PlatformException("Unable to encode agent instruction", exception);
        }
    }

    @Override
    public String startRoomRecording(String roomName, String filepath) {
        Map<String, Object> fileOutput = new HashMap<>();
        fileOutput.put("file_type", "MP4");
        fileOutput.put("filepath", filepath);
        AppProperties.Storage storage = appProperties.storage();
        if (storage.hasCredentials()) {
            fileOutput.put("s3", Map.of(
                    "access_key", storage.accessKey(),
                    "secret", storage.secretKey(),
                    "bucket", storage.bucket(),
                    "region", storage.region()
            ));
        }

        JsonNode response = call(EGRESS_SERVICE, "StartRoomCompositeEgress", roomName, Map.of(
                "room_name", roomName,
                "audio_only", true,
                "file_outputs", List.of(fileOutput)
        ));
        String egressId = text(response, "egress_id", "egressId");
        if (egressId == null || egressId.isBlank()) {
            throw new PlatformException("internal", "Egress started without an egress id");
        }
        return egressId;
    }

    @Override
    public void stopRecording(String egressId) {
        call(EGRESS_SERVICE, "StopEgress", null, Map.of("egress_id", egressId));
    }

    @Override
    public List<EgressInfo> listRecordings(String egressId) {
        JsonNode response = call(EGRESS_SERVICE, "ListEgress", null, Map.of("egress_id", egressId));
        List<EgressInfo> items = new ArrayList<>();
        for (JsonNode item : response.path("items")) {
            items.add(toEgressInfo(item));
        }
        return items;
    }

    private EgressInfo toEgressInfo(JsonNode item) {
        JsonNode file = item.path("file_results").path(0);
        if (file.isMissingNode()) {
            file = item.path("fileResults").path(0);
        }
        if (file.isMissingNode()) {
            file = item.path("file");
        }
        return new EgressInfo(
                text(item, "egress_id", "egressId"),
                text(item, "room_name", "roomName"),
                EgressStatus.parse(text(item, "status", "status")),
                file.isMissingNode() ? null : file.path("filename").asText(null),
                file.path("duration").asLong(0),
                file.path("size").asLong(0),
                file.isMissingNode() ? null : file.path("location").asText(null),
                item.path("error").asText(null)
        );
    }

    private JsonNode call(String service, String method, String roomName, Object payload) {
        String uri = appProperties.livekit().url() + "/twirp/" + service + "/" + method;
        try {
            String body = restClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("Authorization", "Bearer " + tokenService.serverToken(roomName))
                    .body(payload)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw toPlatformException(method, response.getStatusCode(), response.getBody());
                    })
                    .body(String.class);
            if (body == null || body.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(body);
        } catch (PlatformException exception) {
            throw exception;
        } catch (RestClientException | IOException exception) {
            throw new PlatformException(method + " request failed", exception);
        }
    }

    private PlatformException toPlatformException(String method, HttpStatusCode status, InputStream body) {
        String code = "unknown";
        String message = method + " failed with HTTP " + status.value();
        String sipStatusCode = null;
        String sipStatus = null;
        try {
            String raw = new String(body.readAllBytes(), StandardCharsets.UTF_8);
            if (!raw.isBlank()) {
                JsonNode error = objectMapper.readTree(raw);
                code = error.path("code").asText(code);
                message = error.path("msg").asText(message);
                JsonNode meta = error.path("meta");
                sipStatusCode = meta.path("sip_status_code").asText(null);
                sipStatus = meta.path("sip_status").asText(null);
            }
        } catch (IOException exception) {
            log.debug("Unable to parse error body of {}", method, exception);
        }

        if ("CreateSIPParticipant".equals(method)) {
            return new DialFailedException(code, message, sipStatusCode, sipStatus);
        }
        return new PlatformException(code, message);
    }

    private static String text(JsonNode node, String snakeName, String camelName) {
        JsonNode value = node.path(snakeName);
        if (value.isMissingNode() || value.isNull()) {
            value = node.path(camelName);
        }
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }
}
