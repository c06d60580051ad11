package com.collectvoice.disposition.service;

import com.collectvoice.disposition.model.ConnectionStatus;
import com.collectvoice.disposition.model.Disposition;
import com.collectvoice.disposition.model.DispositionEvent;
import com.collectvoice.disposition.model.DispositionSnapshot;
import com.collectvoice.disposition.model.Speaker;
import com.collectvoice.disposition.model.TranscriptItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Transcript and disposition history of one call.
 * {@link #setConnectionStatus(boolean)} may be called once, and a disposition is never
 * recorded against a connection status it is not valid for.
 */
public class DispositionTracker {

    private static final Logger log = LoggerFactory.getLogger(DispositionTracker.class);

    private final DispositionClassifier classifier;
    private final Clock clock;
    private final Instant startedAt;
    private final Lock lock = new ReentrantLock();
    private final List<TranscriptItem> transcript = new ArrayList<>();
    private final List<DispositionEvent> history = new ArrayList<>();

    private ConnectionStatus connectionStatus;
    private Instant connectedAt;
    private Disposition currentDisposition;

    public DispositionTracker(DispositionClassifier classifier, Clock clock) {
        this.classifier = classifier;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void setConnectionStatus(boolean connected) {
        lock.lock();
        try {
            if (connectionStatus != null) {
                throw new IllegalStateException("Connection status already set to " + connectionStatus);
            }
            ConnectionStatus status = connected ? ConnectionStatus.CONNECTED : ConnectionStatus.NOT_CONNECTED;
            if (currentDisposition != null && !currentDisposition.isCompatibleWith(status)) {
                throw new IllegalStateException("Current disposition " + currentDisposition
                        + " is not valid for a " + status + " call");
            }
            connectionStatus = status;
            if (connected) {
                connectedAt = clock.instant();
            }
        } finally {
            lock.unlock();
        }
    }

    public void addTranscriptItem(Speaker speaker, String text) {
        TranscriptItem item = new TranscriptItem(speaker, text, clock.instant());
        lock.lock();
        try {
            transcript.add(item);
        } finally {
            lock.unlock();
        }
    }

    public Disposition updateDisposition(Disposition forced) {
        lock.lock();
        try {
            Disposition disposition = forced != null
                    ? forced
                    : classifier.classify(List.copyOf(transcript), elapsedSeconds());
            if (!disposition.isCompatibleWith(connectionStatus)) {
                throw new IllegalArgumentException("Disposition " + disposition
                        + " requires " + disposition.requiredStatus() + " but call is " + connectionStatus);
            }
            currentDisposition = disposition;
            history.add(new DispositionEvent(clock.instant(), disposition));
            log.debug("Disposition updated to {} (forced={})", disposition, forced != null);
            return disposition;
        } finally {
            lock.unlock();
        }
    }

    public DispositionSnapshot getFinalDisposition() {
        lock.lock();
        try {
            return new DispositionSnapshot(currentDisposition, connectionStatus, history, transcript, elapsedSeconds());
        } finally {
            lock.unlock();
        }
    }

    public List<TranscriptItem> transcript() {
        lock.lock();
        try {
            return List.copyOf(transcript);
        } finally {
            lock.unlock();
        }
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant connectedAt() {
        lock.lock();
        try {
            return connectedAt;
        } finally {
            lock.unlock();
        }
    }

    // from answer once connected, else from start
    private double elapsedSeconds() {
        Instant from = connectedAt != null ? connectedAt : startedAt;
        return Duration.between(from, clock.instant()).toMillis() / 1000.0;
    }
}
