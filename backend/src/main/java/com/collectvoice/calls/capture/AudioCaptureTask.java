package com.collectvoice.calls.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

public final class AudioCaptureTask implements Callable<CaptureSummary> {

    private static final Logger log = LoggerFactory.getLogger(AudioCaptureTask.class);
    private static final Duration POLL_TIMEOUT = Duration.ofMillis(200);

    private final PushAudioFrameSource source;
    private final Path wavPath;
    private final int maxFrameSamples;
    private final List<FrameSample> samples = new ArrayList<>();

    public AudioCaptureTask(PushAudioFrameSource source, Path wavPath, int maxFrameSamples) {
        this.source = source;
        this.wavPath = wavPath;
        this.maxFrameSamples = maxFrameSamples;
    }

    @Override
    public CaptureSummary call() throws IOException {
        long frames = 0;
        try (StreamingWavWriter writer = new StreamingWavWriter(wavPath)) {
            while (!source.isDrained()) {
                AudioFrame frame;
                try {
                    frame = source.poll(POLL_TIMEOUT);
                } catch (InterruptedException exception) {
                    Thread.currentThread().interrupt();
                    log.info("Audio capture to {} interrupted", wavPath);
                    break;
                }
                if (frame == null) {
                    continue;
                }
                writer.write(frame.pcm());
                frames++;
                if (samples.size() < maxFrameSamples) {
                    samples.add(new FrameSample(
                            frame.receivedAt().toEpochMilli() / 1000.0,
                            frame.samples(),
                            StreamingWavWriter.SAMPLE_RATE,
                            StreamingWavWriter.CHANNELS));
                }
            }
            log.info("Audio capture finished: {} frames, {} bytes written to {}", frames, writer.dataBytes(), wavPath);
            return new CaptureSummary(wavPath, frames, source.droppedFrames(), writer.dataBytes(), List.copyOf(samples));
        }
    }
}
