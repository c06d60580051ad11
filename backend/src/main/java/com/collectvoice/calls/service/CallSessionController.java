package com.collectvoice.calls.service;

import com.collectvoice.calls.capture.AudioCaptureTask;
import com.collectvoice.calls.capture.AudioFrame;
import com.collectvoice.calls.capture.CaptureSummary;
import com.collectvoice.calls.capture.FrameSample;
import com.collectvoice.calls.capture.PushAudioFrameSource;
import com.collectvoice.calls.model.CallStatus;
import com.collectvoice.config.AppProperties;
import com.collectvoice.disposition.model.Disposition;
import com.collectvoice.disposition.model.DispositionSnapshot;
import com.collectvoice.disposition.model.Speaker;
import com.collectvoice.disposition.service.DispositionTracker;
import com.collectvoice.platform.DialFailedException;
import com.collectvoice.platform.VoicePlatform;
import com.collectvoice.platform.model.SipDialRequest;
import com.collectvoice.recording.service.RecordingHandle;
import com.collectvoice.recording.service.RecordingResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

public class CallSessionController {

    private static final Logger log = LoggerFactory.getLogger(CallSessionController.class);

    static final String TRANSFER_ANNOUNCEMENT = "let the user know you'll be transferring them";
    static final String TRANSFER_APOLOGY = "there was an error transferring the call.";

    private final CallSession session;
    private final CallSessionDependencies deps;
    private final ExecutorService eventLoop;
    private final Consumer<UUID> onClosed;
    private final AtomicBoolean tornDown = new AtomicBoolean();
    private final Timer dialLatency;
    private final Counter dialFailedCounter;
    private final Counter completedCounter;
    private final Counter timeoutCounter;

    private ScheduledFuture<?> timeoutTask;
    private volatile PushAudioFrameSource audioSource;
    private Future<CaptureSummary> captureTask;

    public CallSessionController(CallSession session,
                                 CallSessionDependencies deps,
                                 ExecutorService eventLoop,
                                 Consumer<UUID> onClosed) {
        this.session = session;
        this.deps = deps;
        this.eventLoop = eventLoop;
        this.onClosed = onClosed;
        this.dialLatency = deps.meterRegistry().timer("calls.dial.latency");
        this.dialFailedCounter = deps.meterRegistry().counter("calls.dial.failed.total");
        this.completedCounter = deps.meterRegistry().counter("calls.completed.total");
        this.timeoutCounter = deps.meterRegistry().counter("calls.timeout.total");
    }

    public CallSession session() {
        return session;
    }

    public CallStatus status() {
        return session.status();
    }

    public boolean isClosed() {
        return tornDown.get();
    }

    public DispositionSnapshot snapshot() {
        return session.tracker().getFinalDisposition();
    }

    public Future<?> launch() {
        return eventLoop.submit(this::runLaunch);
    }

    public void onEvent(SessionEvent event) {
        if (tornDown.get()) {
            log.debug("Call {} already ended, ignoring {}", session.callId(), event.type());
            return;
        }
        submit(() -> handleEvent(event));
    }

    public void requestEnd(HangupReason reason) {
        submit(() -> teardown(reason));
    }

    public boolean pushAudio(byte[] pcm) {
        PushAudioFrameSource source = audioSource;
        if (source == null || pcm == null || pcm.length == 0) {
            return false;
        }
        return source.offer(new AudioFrame(pcm, deps.clock().instant()));
    }

    public void shutdown(Duration timeout) {
        Future<?> pending = submit(() -> teardown(HangupReason.SHUTDOWN));
        if (pending == null) {
            return;
        }
        try {
            pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException exception) {
            log.warn("Teardown of call {} did not finish within {}", session.callId(), timeout);
            eventLoop.shutdownNow();
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException exception) {
            log.error("Teardown of call {} failed", session.callId(), exception.getCause());
        }
    }

    private Future<?> submit(Runnable task) {
        try {
            return eventLoop.submit(task);
        } catch (RejectedExecutionException exception) {
            log.debug("Event loop for call {} is closed", session.callId());
            return null;
        }
    }

    private void runLaunch() {
        VoicePlatform platform = deps.voicePlatform();
        String room = session.roomName();
        DialInfo dialInfo = session.dialInfo();

        persist("start", () -> deps.persistence().recordCallStarted(session.callId(), room, dialInfo.callTo()));

        try {
            String dispatchId = platform.dispatchAgent(room, session.agentMetadataJson());
            log.info("Agent dispatched to room {} ({})", room, dispatchId);
        } catch (Exception exception) {
            log.error("Unable to start agent session in room {}", room, exception);
            handleDialFailure(String.valueOf(exception.getMessage()));
            return;
        }

        session.status(CallStatus.DIALING);
        log.info("Dialing {} from room {}", dialInfo.callTo(), room);
        Timer.Sample sample = Timer.start(deps.meterRegistry());
        try {
            platform.createSipParticipant(new SipDialRequest(
                    room,
                    deps.properties().sip().outboundTrunkId(),
                    dialInfo.callTo(),
                    dialInfo.participantIdentity()));
        } catch (DialFailedException exception) {
            sample.stop(dialLatency);
            log.error("Error creating SIP participant: {}, SIP status: {}", exception.getMessage(), exception.rawStatus());
            handleDialFailure(exception.rawStatus());
            return;
        } catch (Exception exception) {
            sample.stop(dialLatency);
            log.error("Dial to {} failed", dialInfo.callTo(), exception);
            handleDialFailure(String.valueOf(exception.getMessage()));
            return;
        }
        long dialNanos = sample.stop(dialLatency);
        log.info("SIP dial completed in {} ms", TimeUnit.NANOSECONDS.toMillis(dialNanos));

        try {
            platform.waitForParticipant(room, dialInfo.participantIdentity(), deps.properties().sip().participantJoinTimeout());
        } catch (Exception exception) {
            log.error("Participant {} never joined room {}", dialInfo.participantIdentity(), room, exception);
            handleDialFailure("no answer: " + exception.getMessage());
            return;
        }

        session.tracker().setConnectionStatus(true);
        session.status(CallStatus.CONNECTED);
        log.info("Participant joined: {}", dialInfo.participantIdentity());
        persist("connect", () -> deps.persistence().recordCallConnected(session.callId()));

        deps.recordingMonitor().start(room, session.callId()).ifPresent(session::recording);
        armTimeout();
        startCapture();
        session.status(CallStatus.IN_PROGRESS);
    }

    private void handleDialFailure(String rawStatus) {
        Disposition disposition = deps.classifier().dispositionForDialFailure(rawStatus).orElse(Disposition.FAILED);
        DispositionTracker tracker = session.tracker();
        tracker.setConnectionStatus(false);
        tracker.updateDisposition(disposition);
        session.forcedDisposition(disposition);
        session.status(CallStatus.FAILED);
        dialFailedCounter.increment();
        log.info("Call {} not connected: {} ({})", session.callId(), disposition.label(), rawStatus);

        persist("failure", () -> deps.persistence().recordCallFailed(session.callId(), disposition.label(), rawStatus));
        teardown(HangupReason.DIAL_FAILED);
    }

    private void armTimeout() {
        Duration hardTimeout = deps.properties().call().hardTimeout();
        timeoutTask = deps.scheduler().schedule(() -> {
            log.info("Call {} reached {} limit, hanging up", session.callId(), hardTimeout);
            timeoutCounter.increment();
            requestEnd(HangupReason.HARD_TIMEOUT);
        }, hardTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void startCapture() {
        AppProperties.Capture capture = deps.properties().capture();
        if (!capture.enabled()) {
            return;
        }
        try {
            PushAudioFrameSource source = new PushAudioFrameSource(capture.frameQueueCapacity());
            AudioCaptureTask task = new AudioCaptureTask(
                    source,
                    deps.artifactWriter().wavPath(session.roomName(), session.startTime()),
                    capture.maxFrameSamples());
            captureTask = deps.captureExecutor().submit(task);
            audioSource = source;
        } catch (Exception exception) {
            log.error("Unable to start audio capture for call {}", session.callId(), exception);
        }
    }

    private void handleEvent(SessionEvent event) {
        if (tornDown.get()) {
            return;
        }
        try {
            switch (event.type()) {
                case USER_TRANSCRIBED -> {
                    if (event.finalTranscript() && hasText(event.text())) {
                        session.tracker().addTranscriptItem(Speaker.CUSTOMER, event.text());
                    }
                }
                case CONVERSATION_ITEM_ADDED -> {
                    if (isAgentRole(event.role()) && hasText(event.text())) {
                        session.tracker().addTranscriptItem(Speaker.AGENT, event.text());
                    }
                }
                case SESSION_CLOSED -> teardown(HangupReason.PLATFORM_CLOSED);
                case END_CALL_REQUESTED -> teardown(HangupReason.AGENT_ENDED);
                case VOICEMAIL_DETECTED -> {
                    log.info("Detected answering machine on call {}", session.callId());
                    teardown(HangupReason.VOICEMAIL);
                }
                case TRANSFER_REQUESTED -> transfer();
                case OPT_OUT_REQUESTED -> force(Disposition.DO_NOT_CALL);
            }
        } catch (RuntimeException exception) {
            log.error("Failed to handle {} on call {}", event.type(), session.callId(), exception);
        }
    }

    private void force(Disposition disposition) {
        session.tracker().updateDisposition(disposition);
        session.forcedDisposition(disposition);
    }

    private void transfer() {
        DialInfo dialInfo = session.dialInfo();
        if (!dialInfo.canTransfer()) {
            log.warn("Call {} has no transfer target, ignoring transfer request", session.callId());
            return;
        }

        VoicePlatform platform = deps.voicePlatform();
        log.info("Transferring call {} to {}", session.callId(), dialInfo.transferTo());
        try {
            platform.sendAgentInstruction(session.roomName(), TRANSFER_ANNOUNCEMENT);
            force(Disposition.HUMAN_HANDOFF_REQUESTED);
            platform.transferSipParticipant(session.roomName(), dialInfo.participantIdentity(), "tel:" + dialInfo.transferTo());
            log.info("Transferred call {} to {}", session.callId(), dialInfo.transferTo());
        } catch (Exception exception) {
            log.error("Error transferring call {}", session.callId(), exception);
            try {
                platform.sendAgentInstruction(session.roomName(), TRANSFER_APOLOGY);
            } catch (Exception apologyFailure) {
                log.warn("Unable to play transfer apology on call {}", session.callId(), apologyFailure);
            }
            teardown(HangupReason.TRANSFER_FAILED);
        }
    }

    void teardown(HangupReason reason) {
        if (!tornDown.compareAndSet(false, true)) {
            log.debug("Call {} already torn down, ignoring {}", session.callId(), reason);
            return;
        }
        log.info("Ending call {} ({})", session.callId(), reason.name().toLowerCase(Locale.ROOT));
        Instant callEnd = deps.clock().instant();
        session.endTime(callEnd);

        cancelTimeout();
        CaptureSummary capture = stopCapture();
        Optional<RecordingResult> recording = finishRecording();

        DispositionSnapshot snapshot = finalDisposition();
        if (session.status() != CallStatus.FAILED && snapshot != null) {
            String recordingUrl = recording.map(RecordingResult::fileUrl).orElse(null);
            int duration = (int) Math.round(snapshot.callDurationSeconds());
            persist("completion", () -> deps.persistence().recordCallCompleted(
                    session.callId(), snapshot, snapshot.transcript(), duration, recordingUrl));
            session.status(CallStatus.COMPLETED);
            completedCounter.increment();
        }

        if (snapshot != null) {
            List<FrameSample> frames = capture == null ? List.of() : capture.frameSamples();
            try {
                deps.artifactWriter().write(session, snapshot, frames, callEnd);
            } catch (Exception exception) {
                log.error("Unable to write transcript for call {}", session.callId(), exception);
            }
        }

        try {
            deps.voicePlatform().deleteRoom(session.roomName());
        } catch (Exception exception) {
            log.error("Unable to delete room {}", session.roomName(), exception);
            session.status(CallStatus.FAILED);
        }

        try {
            onClosed.accept(session.callId());
        } finally {
            eventLoop.shutdown();
        }
    }

    private void cancelTimeout() {
        ScheduledFuture<?> task = timeoutTask;
        if (task == null) {
            return;
        }
        try {
            task.cancel(false);
        } catch (Exception exception) {
            log.warn("Unable to cancel timeout for call {}", session.callId(), exception);
        }
    }

    private CaptureSummary stopCapture() {
        PushAudioFrameSource source = audioSource;
        if (source == null) {
            return null;
        }
        try {
            source.close();
            return captureTask.get(deps.properties().call().teardownJoinTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException exception) {
            log.warn("Audio capture for call {} did not stop in time", session.callId());
            captureTask.cancel(true);
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
        } catch (Exception exception) {
            log.error("Audio capture for call {} failed", session.callId(), exception);
        }
        return null;
    }

    private Optional<RecordingResult> finishRecording() {
        RecordingHandle handle = session.recording();
        if (handle == null) {
            return Optional.empty();
        }
        try {
            deps.recordingMonitor().stop(handle.egressId());
            return handle.finish(deps.properties().call().recordingGracePeriod());
        } catch (Exception exception) {
            log.error("Unable to finish recording {} for call {}", handle.egressId(), session.callId(), exception);
            handle.cancel();
            return Optional.empty();
        }
    }

    private DispositionSnapshot finalDisposition() {
        DispositionTracker tracker = session.tracker();
        try {
            if (session.status() != CallStatus.FAILED) {
                tracker.updateDisposition(session.forcedDisposition());
            }
            DispositionSnapshot snapshot = tracker.getFinalDisposition();
            log.info("Final disposition for call {}: {}", session.callId(), snapshot.dispositionLabel());
            return snapshot;
        } catch (Exception exception) {
            log.error("Unable to compute final disposition for call {}", session.callId(), exception);
            return null;
        }
    }

    private void persist(String step, Runnable write) {
        try {
            write.run();
        } catch (Exception exception) {
            log.error("Failed to record call {} for {}", step, session.callId(), exception);
        }
    }

    private static boolean hasText(String text) {
        return text != null && !text.isBlank();
    }

    private static boolean isAgentRole(String role) {
        return role != null && (role.equalsIgnoreCase("assistant") || role.equalsIgnoreCase("agent"));
    }
}
