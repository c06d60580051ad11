package com.collectvoice.calls.controller;

import com.collectvoice.calls.dto.CallResponse;
import com.collectvoice.calls.dto.CreateCallRequest;
import com.collectvoice.calls.dto.SessionEventRequest;
import com.collectvoice.calls.service.CallDispatchService;
import com.collectvoice.calls.service.CallMapper;
import com.collectvoice.common.exception.BadRequestException;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/v1/calls")
@Validated
public class CallController {

    private final CallDispatchService callDispatchService;

    public CallController(CallDispatchService callDispatchService) {
        this.callDispatchService = callDispatchService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CallResponse createCall(@RequestBody @Valid CreateCallRequest request) {
        return CallMapper.toResponse(callDispatchService.createCall(request));
    }

    @GetMapping("/{callId}")
    public CallResponse getCall(@PathVariable UUID callId) {
        return CallMapper.toResponse(callDispatchService.getCall(callId));
    }

    @PostMapping("/{callId}/end")
    public ResponseEntity<Void> endCall(@PathVariable UUID callId) {
        callDispatchService.endCall(callId);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{callId}/events")
    public ResponseEntity<Void> publishEvent(@PathVariable UUID callId,
                                             @RequestBody @Valid SessionEventRequest request) {
        callDispatchService.publishEvent(callId, CallMapper.toEvent(request));
        return ResponseEntity.accepted().build();
    }

    @PostMapping(path = "/{callId}/audio", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public ResponseEntity<Void> pushAudio(@PathVariable UUID callId, @RequestBody byte[] pcm) {
        if (pcm.length % 2 != 0) {
            throw new BadRequestException("PCM16 payload must have an even number of bytes");
        }
        boolean accepted = callDispatchService.pushAudio(callId, pcm);
        return accepted ? ResponseEntity.accepted().build() : ResponseEntity.noContent().build();
    }
}
