package com.collectvoice.calls.service;

import com.collectvoice.calls.capture.FrameSample;
import com.collectvoice.calls.model.CallStatus;
import com.collectvoice.config.AppProperties;
import com.collectvoice.disposition.model.ConnectionStatus;
import com.collectvoice.disposition.model.Disposition;
import com.collectvoice.disposition.model.DispositionSnapshot;
import com.collectvoice.disposition.model.Speaker;
import com.collectvoice.disposition.model.TranscriptItem;
import com.collectvoice.disposition.service.DispositionClassifier;
import com.collectvoice.disposition.service.DispositionTracker;
import com.collectvoice.platform.DialFailedException;
import com.collectvoice.platform.PlatformException;
import com.collectvoice.platform.VoicePlatform;
import com.collectvoice.platform.model.ParticipantInfo;
import com.collectvoice.platform.model.SipDialRequest;
import com.collectvoice.recording.service.RecordingLifecycleMonitor;
import com.collectvoice.support.DirectExecutorService;
import com.collectvoice.support.MutableClock;
import com.collectvoice.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CallSessionControllerTest {

    private static final String ROOM = "outbound-15551234567-1a2b3c4d";
    private static final String CALLEE = "+15551234567";

    @Mock
    private VoicePlatform voicePlatform;

    @Mock
    private PersistenceGateway persistence;

    @Mock
    private RecordingLifecycleMonitor recordingMonitor;

    @Mock
    private TranscriptArtifactWriter artifactWriter;

    @Mock
    private ScheduledExecutorService scheduler;

    @Captor
    private ArgumentCaptor<List<TranscriptItem>> transcriptCaptor;

    @Captor
    private ArgumentCaptor<List<FrameSample>> framesCaptor;

    @TempDir
    Path workDir;

    private final UUID callId = UUID.randomUUID();
    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
    private final DispositionClassifier classifier = TestFixtures.classifier();
    private final List<UUID> closed = new ArrayList<>();
    private SimpleMeterRegistry meterRegistry;
    private ScheduledFuture<?> timeoutFuture;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        timeoutFuture = mock(ScheduledFuture.class);
    }

    @Test
    void agentSessionStartsBeforeDialing() {
        CallSessionController controller = controller(DialInfo.parse("+15550000000," + CALLEE, null, null));
        stubConnectedCall();

        controller.launch();

        InOrder order = inOrder(persistence, voicePlatform, recordingMonitor, scheduler);
        order.verify(persistence).recordCallStarted(callId, ROOM, CALLEE);
        order.verify(voicePlatform).dispatchAgent(ROOM, "{}");
        order.verify(voicePlatform).createSipParticipant(new SipDialRequest(ROOM, "ST_trunk", CALLEE, CALLEE));
        order.verify(voicePlatform).waitForParticipant(ROOM, CALLEE, Duration.ofSeconds(5));
        order.verify(persistence).recordCallConnected(callId);
        order.verify(recordingMonitor).start(ROOM, callId);
        order.verify(scheduler).schedule(any(Runnable.class), eq(180_000L), eq(TimeUnit.MILLISECONDS));
        assertThat(controller.status()).isEqualTo(CallStatus.IN_PROGRESS);
        assertThat(controller.snapshot().connectionStatus()).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(meterRegistry.timer("calls.dial.latency").count()).isEqualTo(1);
    }

    @Test
    void busyDialIsRecordedAsNotConnectedFailure() {
        CallSessionController controller = controller(DialInfo.parse(CALLEE, null, null));
        when(voicePlatform.dispatchAgent(eq(ROOM), anyString())).thenReturn("AD_1");
        when(voicePlatform.createSipParticipant(any(SipDialRequest.class)))
                .thenThrow(new DialFailedException("unavailable", "twirp error: unavailable", "486", "Busy Here"));

        controller.launch();

        verify(persistence).recordCallFailed(callId, "Busy", "486 Busy Here");
        verify(persistence, never()).recordCallCompleted(any(), any(), anyList(), anyInt(), any());
        verify(recordingMonitor, never()).start(anyString(), any());
        verifyNoInteractions(scheduler);
        verify(voicePlatform).deleteRoom(ROOM);
        assertThat(controller.status()).isEqualTo(CallStatus.FAILED);
        DispositionSnapshot snapshot = controller.snapshot();
        assertThat(snapshot.disposition()).isEqualTo(Disposition.BUSY);
        assertThat(snapshot.connectionStatus()).isEqualTo(ConnectionStatus.NOT_CONNECTED);
        assertThat(closed).containsExactly(callId);
        assertThat(meterRegistry.counter("calls.dial.failed.total").count()).isEqualTo(1.0);
    }

    @Test
    void unclassifiableDialErrorFallsBackToFailed() {
        CallSessionController controller = controller(DialInfo.parse(CALLEE, null, null));
        when(voicePlatform.dispatchAgent(eq(ROOM), anyString())).thenReturn("AD_1");
        when(voicePlatform.createSipParticipant(any(SipDialRequest.class)))
                .thenThrow(new DialFailedException("unavailable", "declined", "603", "Decline"));

        controller.launch();

        verify(persistence).recordCallFailed(callId, "Failed", "603 Decline");
        assertThat(controller.snapshot().disposition()).isEqualTo(Disposition.FAILED);
    }

    @Test
    void agentDispatchFailureNeverDials() {
        CallSessionController controller = controller(DialInfo.parse(CALLEE, null, null));
        when(voicePlatform.dispatchAgent(eq(ROOM), anyString())).thenThrow(new PlatformException("internal", "dispatch error"));

        controller.launch();

        verify(voicePlatform, never()).createSipParticipant(any());
        verify(persistence).recordCallFailed(callId, "Failed", "dispatch error");
        assertThat(controller.status()).isEqualTo(CallStatus.FAILED);
    }

    @Test
    void teardownTwiceRecordsOneCompletion() {
        CallSessionController controller = controller(DialInfo.parse(CALLEE, null, null));
        stubConnectedCall();
        controller.launch();

        controller.onEvent(SessionEvent.of(SessionEventType.END_CALL_REQUESTED));
        controller.requestEnd(HangupReason.OPERATOR_ENDED);
        controller.teardown(HangupReason.HARD_TIMEOUT);

        verify(persistence, times(1)).recordCallCompleted(eq(callId), any(), anyList(), anyInt(), any());
        verify(voicePlatform, times(1)).deleteRoom(ROOM);
        verify(timeoutFuture).cancel(false);
        assertThat(controller.status()).isEqualTo(CallStatus.COMPLETED);
        assertThat(controller.isClosed()).isTrue();
        assertThat(closed).containsExactly(callId);
        assertThat(meterRegistry.counter("calls.completed.total").count()).isEqualTo(1.0);
    }

    @Test
    void hardTimeoutEndsTheCall() {
        CallSessionController controller = controller(DialInfo.parse(CALLEE, null, null));
        stubConnectedCall();
        controller.launch();

        ArgumentCaptor<Runnable> timeout = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(timeout.capture(), eq(180_000L), eq(TimeUnit.MILLISECONDS));
        clock.advance(Duration.ofSeconds(180));
        timeout.getValue().run();

        verify(persistence).recordCallCompleted(eq(callId), any(), anyList(), eq(180), any());
        verify(voicePlatform).deleteRoom(ROOM);
        assertThat(controller.status()).isEqualTo(CallStatus.COMPLETED);
        assertThat(meterRegistry.counter("calls.timeout.total").count()).isEqualTo(1.0);
    }

    @Test
    void transcriptEventsFeedFinalDisposition() throws Exception {
        CallSessionController controller = controller(DialInfo.parse(CALLEE, null, null));
        stubConnectedCall();
        controller.launch();

        controller.onEvent(SessionEvent.itemAdded("assistant", "Hi, this is about your card payment"));
        controller.onEvent(SessionEvent.itemAdded("user", "ignored, arrives as a transcription"));
        controller.onEvent(SessionEvent.userTranscribed("I already", false));
        controller.onEvent(SessionEvent.userTranscribed("I already paid it yesterday", true));
        clock.advance(Duration.ofSeconds(40));
        controller.onEvent(SessionEvent.of(SessionEventType.SESSION_CLOSED));

        ArgumentCaptor<DispositionSnapshot> snapshot = ArgumentCaptor.forClass(DispositionSnapshot.class);
        verify(persistence).recordCallCompleted(eq(callId), snapshot.capture(), transcriptCaptor.capture(), eq(40), isNull());
        assertThat(snapshot.getValue().disposition()).isEqualTo(Disposition.USER_CLAIMED_PAYMENT_WITH_DATE);
        assertThat(transcriptCaptor.getValue()).extracting(TranscriptItem::speaker).containsExactly(Speaker.AGENT, Speaker.CUSTOMER);
        verify(artifactWriter).write(any(CallSession.class), eq(snapshot.getValue()), eq(List.<FrameSample>of()), eq(clock.instant()));
    }

    @Test
    void ringingIsNotCountedAsCallTime() {
        CallSessionController controller = controller(DialInfo.parse(CALLEE, null, null));
        stubConnectedCall(Duration.ofSeconds(25));
        controller.launch();

        clock.advance(Duration.ofSeconds(3));
        controller.onEvent(SessionEvent.of(SessionEventType.SESSION_CLOSED));

        ArgumentCaptor<DispositionSnapshot> snapshot = ArgumentCaptor.forClass(DispositionSnapshot.class);
        verify(persistence).recordCallCompleted(eq(callId), snapshot.capture(), anyList(), eq(3), any());
        assertThat(snapshot.getValue().disposition()).isEqualTo(Disposition.CUSTOMER_HANGUP);
        assertThat(snapshot.getValue().callDurationSeconds()).isEqualTo(3.0);
    }

    @Test
    void optOutForcesDoNotCall() {
        CallSessionController controller = controller(DialInfo.parse(CALLEE, null, null));
        stubConnectedCall();
        controller.launch();

        controller.onEvent(SessionEvent.userTranscribed("I already paid, stop calling me", true));
        controller.onEvent(SessionEvent.of(SessionEventType.OPT_OUT_REQUESTED));
        clock.advance(Duration.ofSeconds(30));
        controller.requestEnd(HangupReason.OPERATOR_ENDED);

        ArgumentCaptor<DispositionSnapshot> snapshot = ArgumentCaptor.forClass(DispositionSnapshot.class);
        verify(persistence).recordCallCompleted(eq(callId), snapshot.capture(), anyList(), anyInt(), any());
        assertThat(snapshot.getValue().disposition()).isEqualTo(Disposition.DO_NOT_CALL);
    }

    @Test
    void transferAnnouncesThenTransfers() {
        CallSessionController controller = controller(DialInfo.parse(CALLEE, null, "+15550001111"));
        stubConnectedCall();
        controller.launch();

        controller.onEvent(SessionEvent.of(SessionEventType.TRANSFER_REQUESTED));

        InOrder order = inOrder(voicePlatform);
        order.verify(voicePlatform).sendAgentInstruction(ROOM, CallSessionController.TRANSFER_ANNOUNCEMENT);
        order.verify(voicePlatform).transferSipParticipant(ROOM, CALLEE, "tel:+15550001111");
        assertThat(controller.isClosed()).isFalse();
        assertThat(controller.snapshot().disposition()).isEqualTo(Disposition.HUMAN_HANDOFF_REQUESTED);
    }

    @Test
    void failedTransferApologisesAndHangsUp() {
        CallSessionController controller = controller(DialInfo.parse(CALLEE, null, "+15550001111"));
        stubConnectedCall();
        controller.launch();
        doThrow(new PlatformException("internal", "transfer rejected"))
                .when(voicePlatform).transferSipParticipant(ROOM, CALLEE, "tel:+15550001111");

        controller.onEvent(SessionEvent.of(SessionEventType.TRANSFER_REQUESTED));

        verify(voicePlatform).sendAgentInstruction(ROOM, CallSessionController.TRANSFER_APOLOGY);
        ArgumentCaptor<DispositionSnapshot> snapshot = ArgumentCaptor.forClass(DispositionSnapshot.class);
        verify(persistence).recordCallCompleted(eq(callId), snapshot.capture(), anyList(), anyInt(), any());
        assertThat(snapshot.getValue().disposition()).isEqualTo(Disposition.HUMAN_HANDOFF_REQUESTED);
        assertThat(controller.isClosed()).isTrue();
    }

    @Test
    void transferWithoutTargetIsIgnored() {
        CallSessionController controller = controller(DialInfo.parse(CALLEE, null, null));
        stubConnectedCall();
        controller.launch();

        controller.onEvent(SessionEvent.of(SessionEventType.TRANSFER_REQUESTED));

        verify(voicePlatform, never()).sendAgentInstruction(anyString(), anyString());
        verify(voicePlatform, never()).transferSipParticipant(anyString(), anyString(), anyString());
        assertThat(controller.isClosed()).isFalse();
    }

    @Test
    void persistenceFailuresDoNotAffectTheCall() {
        CallSessionController controller = controller(DialInfo.parse(CALLEE, null, null));
        stubConnectedCall();
        doThrow(new IllegalStateException("db down")).when(persistence).recordCallStarted(callId, ROOM, CALLEE);
        doThrow(new IllegalStateException("db down")).when(persistence).recordCallConnected(callId);

        controller.launch();
        controller.onEvent(SessionEvent.of(SessionEventType.VOICEMAIL_DETECTED));

        verify(voicePlatform).createSipParticipant(any(SipDialRequest.class));
        verify(voicePlatform).deleteRoom(ROOM);
        assertThat(controller.status()).isEqualTo(CallStatus.COMPLETED);
    }

    @Test
    void roomReleaseFailureMarksSessionFailed() {
        CallSessionController controller = controller(DialInfo.parse(CALLEE, null, null));
        stubConnectedCall();
        doThrow(new PlatformException("internal", "room busy")).when(voicePlatform).deleteRoom(ROOM);
        controller.launch();

        controller.requestEnd(HangupReason.OPERATOR_ENDED);

        verify(persistence).recordCallCompleted(eq(callId), any(), anyList(), anyInt(), any());
        assertThat(controller.status()).isEqualTo(CallStatus.FAILED);
        assertThat(closed).containsExactly(callId);
    }

    @Test
    void eventsAfterTeardownAreIgnored() {
        CallSessionController controller = controller(DialInfo.parse(CALLEE, null, null));
        stubConnectedCall();
        controller.launch();
        controller.requestEnd(HangupReason.OPERATOR_ENDED);

        controller.onEvent(SessionEvent.userTranscribed("hello?", true));

        assertThat(controller.snapshot().transcript()).isEmpty();
        assertThat(controller.pushAudio(new byte[320])).isFalse();
    }

    @Test
    void capturedAudioIsStreamedToWav() throws Exception {
        ExecutorService captureExecutor = Executors.newSingleThreadExecutor();
        try {
            Path wav = workDir.resolve("transcripts/" + ROOM + "_20250301_100000.wav");
            when(artifactWriter.wavPath(eq(ROOM), any(Instant.class))).thenReturn(wav);
            CallSessionController controller = controller(
                    DialInfo.parse(CALLEE, null, null),
                    TestFixtures.properties(workDir, false, true),
                    captureExecutor);
            stubConnectedCall();
            controller.launch();

            for (int i = 0; i < 6; i++) {
                assertThat(controller.pushAudio(new byte[320])).isTrue();
            }
            controller.requestEnd(HangupReason.AGENT_ENDED);

            verify(artifactWriter).write(any(CallSession.class), any(DispositionSnapshot.class), framesCaptor.capture(), any(Instant.class));
            assertThat(framesCaptor.getValue()).hasSize(4);
            assertThat(framesCaptor.getValue().get(0).samples()).isEqualTo(160);
            assertThat(Files.size(wav)).isEqualTo(44L + 6 * 320);
        } finally {
            captureExecutor.shutdownNow();
        }
    }

    private void stubConnectedCall() {
        stubConnectedCall(Duration.ZERO);
    }

    private void stubConnectedCall(Duration ringing) {
        when(voicePlatform.dispatchAgent(eq(ROOM), anyString())).thenReturn("AD_1");
        when(voicePlatform.createSipParticipant(any(SipDialRequest.class))).thenAnswer(invocation -> {
            clock.advance(ringing);
            return new ParticipantInfo("PA_1", CALLEE, "ACTIVE");
        });
        when(voicePlatform.waitForParticipant(eq(ROOM), eq(CALLEE), any(Duration.class)))
                .thenReturn(new ParticipantInfo("PA_1", CALLEE, "ACTIVE"));
        when(recordingMonitor.start(ROOM, callId)).thenReturn(Optional.empty());
        doReturn(timeoutFuture).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    private CallSessionController controller(DialInfo dialInfo) {
        return controller(dialInfo, TestFixtures.properties(workDir, false, false), new DirectExecutorService());
    }

    private CallSessionController controller(DialInfo dialInfo, AppProperties properties, ExecutorService captureExecutor) {
        DispositionTracker tracker = new DispositionTracker(classifier, clock);
        CallSession session = new CallSession(callId, ROOM, dialInfo, "{}", tracker, clock.instant());
        CallSessionDependencies dependencies = new CallSessionDependencies(
                voicePlatform,
                persistence,
                recordingMonitor,
                classifier,
                artifactWriter,
                properties,
                scheduler,
                captureExecutor,
                meterRegistry,
                clock);
        return new CallSessionController(session, dependencies, new DirectExecutorService(), closed::add);
    }
}
