package com.collectvoice.calls.service;

import com.collectvoice.config.AppProperties;
import com.collectvoice.disposition.service.DispositionClassifier;
import com.collectvoice.disposition.service.DispositionTracker;
import com.collectvoice.platform.VoicePlatform;
import com.collectvoice.recording.service.RecordingLifecycleMonitor;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Component
public class CallSessionFactory {

    private final CallSessionDependencies dependencies;
    private final CallSessionRegistry registry;

    public CallSessionFactory(VoicePlatform voicePlatform,
                              PersistenceGateway persistence,
                              RecordingLifecycleMonitor recordingMonitor,
                              DispositionClassifier classifier,
                              TranscriptArtifactWriter artifactWriter,
                              AppProperties appProperties,
                              @Qualifier("callScheduler") ScheduledExecutorService scheduler,
                              @Qualifier("captureExecutor") ExecutorService captureExecutor,
                              MeterRegistry meterRegistry,
                              Clock clock,
                              CallSessionRegistry registry) {
        this.dependencies = new CallSessionDependencies(
                voicePlatform,
                persistence,
                recordingMonitor,
                classifier,
                artifactWriter,
                appProperties,
                scheduler,
                captureExecutor,
                meterRegistry,
                clock);
        this.registry = registry;
    }

    public CallSessionController create(UUID callId, String roomName, DialInfo dialInfo, String agentMetadataJson) {
        DispositionTracker tracker = new DispositionTracker(dependencies.classifier(), dependencies.clock());
        CallSession session = new CallSession(callId, roomName, dialInfo, agentMetadataJson, tracker, tracker.startedAt());
        ExecutorService eventLoop = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("call-" + roomName + "-"));
        return new CallSessionController(session, dependencies, eventLoop, registry::deregister);
    }
}
