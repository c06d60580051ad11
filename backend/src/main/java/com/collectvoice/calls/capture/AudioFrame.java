package com.collectvoice.calls.capture;

import java.time.Instant;

public record AudioFrame(byte[] pcm, Instant receivedAt) {

    public int samples() {
        return pcm.length / StreamingWavWriter.BYTES_PER_SAMPLE;
    }
}
