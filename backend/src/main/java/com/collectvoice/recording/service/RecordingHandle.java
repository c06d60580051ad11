package com.collectvoice.recording.service;

import com.collectvoice.recording.model.RecordingStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

public final class RecordingHandle {

    private static final Logger log = LoggerFactory.getLogger(RecordingHandle.class);

    private final String egressId;
    private final UUID callId;
    private final RecordingLifecycleMonitor monitor;
    private final int maxPollErrors;
    private final Lock pollLock = new ReentrantLock();
    private final CompletableFuture<RecordingStatus> terminal = new CompletableFuture<>();

    private volatile ScheduledFuture<?> loop;
    private int consecutiveErrors;

    RecordingHandle(String egressId, UUID callId, RecordingLifecycleMonitor monitor, int maxPollErrors) {
        this.egressId = egressId;
        this.callId = callId;
        this.monitor = monitor;
        this.maxPollErrors = maxPollErrors;
    }

    public String egressId() {
        return egressId;
    }

    public UUID callId() {
        return callId;
    }

    public boolean isTerminal() {
        return terminal.isDone();
    }

    void attach(ScheduledFuture<?> loop) {
        this.loop = loop;
        if (terminal.isDone()) {
            loop.cancel(false);
        }
    }

    // must not throw, the executor stops rescheduling after an exception
    void pollFromLoop() {
        try {
            poll();
        } catch (Exception exception) {
            log.error("Error monitoring recording {}", egressId, exception);
            pollLock.lock();
            try {
                consecutiveErrors++;
                if (consecutiveErrors >= maxPollErrors && !terminal.isDone()) {
                    markTerminal(monitor.markFailed(egressId));
                }
            } finally {
                pollLock.unlock();
            }
        }
    }

    void poll() {
        pollLock.lock();
        try {
            if (terminal.isDone()) {
                return;
            }
            RecordingStatus status = monitor.pollOnce(egressId, callId);
            consecutiveErrors = 0;
            if (status.isTerminal()) {
                markTerminal(status);
            }
        } finally {
            pollLock.unlock();
        }
    }

    /**
     * Polls once more and waits up to {@code grace} for a terminal state. The loop is then
     * cancelled without interrupting it.
     */
    public Optional<RecordingResult> finish(Duration grace) {
        try {
            poll();
        } catch (Exception exception) {
            log.warn("Final poll of recording {} failed", egressId, exception);
        }
        try {
            terminal.get(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException exception) {
            log.warn("Recording {} not finished after {}, leaving it in its current state", egressId, grace);
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException exception) {
            log.warn("Recording {} monitor ended abnormally", egressId, exception);
        } finally {
            cancel();
        }
        return monitor.findByEgressId(egressId);
    }

    public void cancel() {
        ScheduledFuture<?> current = loop;
        if (current != null) {
            current.cancel(false);
        }
    }

    private void markTerminal(RecordingStatus status) {
        terminal.complete(status);
        cancel();
    }
}
