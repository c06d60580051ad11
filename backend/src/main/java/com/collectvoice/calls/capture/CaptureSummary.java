package com.collectvoice.calls.capture;

import java.nio.file.Path;
import java.util.List;

public record CaptureSummary(
        Path wavPath,
        long framesWritten,
        long framesDropped,
        long bytesWritten,
        List<FrameSample> frameSamples
) {
}
