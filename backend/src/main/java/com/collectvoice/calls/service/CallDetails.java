package com.collectvoice.calls.service;

import com.collectvoice.calls.model.CallRecordEntity;
import com.collectvoice.disposition.model.DispositionSnapshot;
import com.collectvoice.recording.service.RecordingResult;

public record CallDetails(CallRecordEntity call, DispositionSnapshot live, RecordingResult recording) {
}
