package com.collectvoice.platform;

import com.collectvoice.platform.model.EgressInfo;
import com.collectvoice.platform.model.ParticipantInfo;
import com.collectvoice.platform.model.SipDialRequest;

import java.time.Duration;
import java.util.List;

public interface VoicePlatform {

    void createRoom(String roomName);

    void deleteRoom(String roomName);

    String dispatchAgent(String roomName, String metadataJson);

    /**
     * Blocks until the callee answers.
     *
     * @throws DialFailedException when the call does not connect
     */
    ParticipantInfo createSipParticipant(SipDialRequest request);

    void transferSipParticipant(String roomName, String participantIdentity, String transferTo);

    ParticipantInfo waitForParticipant(String roomName, String participantIdentity, Duration timeout);

    void sendAgentInstruction(String roomName, String instruction);

    String startRoomRecording(String roomName, String filepath);

    void stopRecording(String egressId);

    List<EgressInfo> listRecordings(String egressId);
}
