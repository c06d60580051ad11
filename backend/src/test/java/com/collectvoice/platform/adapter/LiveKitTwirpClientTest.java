package com.collectvoice.platform.adapter;

import com.collectvoice.platform.DialFailedException;
import com.collectvoice.platform.PlatformException;
import com.collectvoice.platform.model.EgressInfo;
import com.collectvoice.platform.model.EgressStatus;
import com.collectvoice.platform.model.ParticipantInfo;
import com.collectvoice.platform.model.SipDialRequest;
import com.collectvoice.support.TestFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LiveKitTwirpClientTest {

    private static final String ROOM = "outbound-15551234567-1a2b3c4d";

    @TempDir
    Path workDir;

    private MockRestServiceServer server;
    private LiveKitTwirpClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        LiveKitTokenService tokenService = new LiveKitTokenService(TestFixtures.properties(workDir));
        tokenService.initKey();
        client = new LiveKitTwirpClient(builder, new ObjectMapper(), TestFixtures.properties(workDir), tokenService);
    }

    @Test
    void createRoomPostsToRoomService() {
        server.expect(requestTo("http://livekit.test/twirp/livekit.RoomService/CreateRoom"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", startsWith("Bearer ")))
                .andExpect(jsonPath("$.name").value(ROOM))
                .andRespond(withSuccess("{\"name\":\"" + ROOM + "\"}", MediaType.APPLICATION_JSON));

        client.createRoom(ROOM);

        server.verify();
    }

    @Test
    void dispatchSendsAgentNameAndMetadata() {
        server.expect(requestTo("http://livekit.test/twirp/livekit.AgentDispatchService/CreateDispatch"))
                .andExpect(jsonPath("$.agent_name").value("outbound-caller-local"))
                .andExpect(jsonPath("$.metadata").value("{\"call_id\":\"abc\"}"))
                .andRespond(withSuccess("{\"id\":\"AD_123\"}", MediaType.APPLICATION_JSON));

        assertThat(client.dispatchAgent(ROOM, "{\"call_id\":\"abc\"}")).isEqualTo("AD_123");
    }

    @Test
    void sipParticipantWaitsUntilAnswered() {
        server.expect(requestTo("http://livekit.test/twirp/livekit.SIP/CreateSIPParticipant"))
                .andExpect(jsonPath("$.sip_trunk_id").value("ST_trunk"))
                .andExpect(jsonPath("$.sip_call_to").value("+15551234567"))
                .andExpect(jsonPath("$.wait_until_answered").value(true))
                .andRespond(withSuccess(
                        "{\"participant_id\":\"PA_1\",\"participant_identity\":\"+15551234567\"}",
                        MediaType.APPLICATION_JSON));

        ParticipantInfo participant = client.createSipParticipant(
                new SipDialRequest(ROOM, "ST_trunk", "+15551234567", "+15551234567"));

        assertThat(participant.sid()).isEqualTo("PA_1");
        assertThat(participant.identity()).isEqualTo("+15551234567");
    }

    @Test
    void rejectedDialCarriesSipStatus() {
        server.expect(requestTo("http://livekit.test/twirp/livekit.SIP/CreateSIPParticipant"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"code\":\"not_found\",\"msg\":\"call rejected\","
                                + "\"meta\":{\"sip_status_code\":\"486\",\"sip_status\":\"Busy Here\"}}"));

        assertThatThrownBy(() -> client.createSipParticipant(
                new SipDialRequest(ROOM, "ST_trunk", "+15551234567", "+15551234567")))
                .isInstanceOfSatisfying(DialFailedException.class, exception -> {
                    assertThat(exception.getCode()).isEqualTo("not_found");
                    assertThat(exception.rawStatus()).isEqualTo("486 Busy Here");
                });
    }

    @Test
    void otherErrorsArePlatformExceptions() {
        server.expect(requestTo("http://livekit.test/twirp/livekit.RoomService/DeleteRoom"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"code\":\"internal\",\"msg\":\"boom\"}"));

        assertThatThrownBy(() -> client.deleteRoom(ROOM))
                .isInstanceOf(PlatformException.class)
                .isNotInstanceOf(DialFailedException.class)
                .hasMessage("boom");
    }

    @Test
    void participantAlreadyInRoomIsReturned() {
        server.expect(requestTo("http://livekit.test/twirp/livekit.RoomService/ListParticipants"))
                .andRespond(withSuccess(
                        "{\"participants\":[{\"sid\":\"PA_9\",\"identity\":\"agent\"},"
                                + "{\"sid\":\"PA_1\",\"identity\":\"+15551234567\",\"state\":\"ACTIVE\"}]}",
                        MediaType.APPLICATION_JSON));

        ParticipantInfo participant = client.waitForParticipant(ROOM, "+15551234567", Duration.ofSeconds(5));

        assertThat(participant.sid()).isEqualTo("PA_1");
    }

    @Test
    void participantThatNeverJoinsTimesOut() {
        server.expect(ExpectedCount.manyTimes(), requestTo("http://livekit.test/twirp/livekit.RoomService/ListParticipants"))
                .andRespond(withSuccess("{\"participants\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.waitForParticipant(ROOM, "+15551234567", Duration.ZERO))
                .isInstanceOfSatisfying(PlatformException.class,
                        exception -> assertThat(exception.getCode()).isEqualTo("deadline_exceeded"));
    }

    @Test
    void recordingStartsWithUploadCredentials() {
        server.expect(requestTo("http://livekit.test/twirp/livekit.Egress/StartRoomCompositeEgress"))
                .andExpect(jsonPath("$.audio_only").value(true))
                .andExpect(jsonPath("$.file_outputs[0].filepath").value("recordings/2025/03/01/room.mp4"))
                .andExpect(jsonPath("$.file_outputs[0].s3.bucket").value("call-recordings"))
                .andRespond(withSuccess("{\"egress_id\":\"EG_1\"}", MediaType.APPLICATION_JSON));

        assertThat(client.startRoomRecording(ROOM, "recordings/2025/03/01/room.mp4")).isEqualTo("EG_1");
    }

    @Test
    void recordingWithoutEgressIdIsAnError() {
        server.expect(requestTo("http://livekit.test/twirp/livekit.Egress/StartRoomCompositeEgress"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.startRoomRecording(ROOM, "room.mp4")).isInstanceOf(PlatformException.class);
    }

    @Test
    void listRecordingsReadsFileResults() {
        server.expect(requestTo("http://livekit.test/twirp/livekit.Egress/ListEgress"))
                .andExpect(jsonPath("$.egress_id").value("EG_1"))
                .andRespond(withSuccess("""
                        {"items":[{"egress_id":"EG_1","room_name":"%s","status":"EGRESS_COMPLETE",
                          "file_results":[{"filename":"/out/room.mp4","duration":5000000000,"size":1024,
                          "location":"s3://call-recordings/room.mp4"}]}]}
                        """.formatted(ROOM), MediaType.APPLICATION_JSON));

        List<EgressInfo> items = client.listRecordings("EG_1");

        assertThat(items).singleElement().satisfies(info -> {
            assertThat(info.status()).isEqualTo(EgressStatus.EGRESS_COMPLETE);
            assertThat(info.filename()).isEqualTo("/out/room.mp4");
            assertThat(info.durationNanos()).isEqualTo(5_000_000_000L);
            assertThat(info.fileSize()).isEqualTo(1024);
            assertThat(info.location()).isEqualTo("s3://call-recordings/room.mp4");
            assertThat(info.error()).isNull();
        });
    }
}
