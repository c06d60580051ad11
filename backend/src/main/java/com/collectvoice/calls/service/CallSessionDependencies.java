package com.collectvoice.calls.service;

import com.collectvoice.config.AppProperties;
import com.collectvoice.disposition.service.DispositionClassifier;
import com.collectvoice.platform.VoicePlatform;
import com.collectvoice.recording.service.RecordingLifecycleMonitor;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

public record CallSessionDependencies(
        VoicePlatform voicePlatform,
        PersistenceGateway persistence,
        RecordingLifecycleMonitor recordingMonitor,
        DispositionClassifier classifier,
        TranscriptArtifactWriter artifactWriter,
        AppProperties properties,
        ScheduledExecutorService scheduler,
        ExecutorService captureExecutor,
        MeterRegistry meterRegistry,
        Clock clock
) {
}
