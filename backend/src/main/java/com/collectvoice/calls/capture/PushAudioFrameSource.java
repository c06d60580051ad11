package com.collectvoice.calls.capture;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

// drops the oldest frame when full
public final class PushAudioFrameSource {

    private final int capacity;
    private final Deque<AudioFrame> frames;
    private final Lock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();

    private boolean closed;
    private long dropped;

    public PushAudioFrameSource(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.frames = new ArrayDeque<>(capacity);
    }

    public boolean offer(AudioFrame frame) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (frames.size() == capacity) {
                frames.pollFirst();
                dropped++;
            }
            frames.addLast(frame);
            available.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public AudioFrame poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (frames.isEmpty()) {
                if (closed || remaining <= 0) {
                    return null;
                }
                remaining = available.awaitNanos(remaining);
            }
            return frames.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            available.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public boolean isDrained() {
        lock.lock();
        try {
            return closed && frames.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public long droppedFrames() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }
}
