package com.collectvoice.calls.capture;

public record FrameSample(double timestamp, int samples, int sampleRate, int channels) {
}
