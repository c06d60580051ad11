package com.collectvoice.calls.capture;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

// RIFF and data sizes start at zero and are patched on close
public final class StreamingWavWriter implements Closeable {

    public static final int SAMPLE_RATE = 16_000;
    public static final int CHANNELS = 1;
    public static final int BITS_PER_SAMPLE = 16;
    public static final int BYTES_PER_SAMPLE = BITS_PER_SAMPLE / 8;
    static final int HEADER_SIZE = 44;

    private final Path path;
    private final RandomAccessFile file;
    private long dataBytes;
    private boolean closed;

    public StreamingWavWriter(Path path) throws IOException {
        this.path = Objects.requireNonNull(path, "path must not be null");
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        this.file = new RandomAccessFile(path.toFile(), "rw");
        file.setLength(0);
        file.write(header(0));
    }

    public Path path() {
        return path;
    }

    public long dataBytes() {
        return dataBytes;
    }

    public synchronized void write(byte[] pcm) throws IOException {
        if (closed) {
            throw new IOException("WAV writer for " + path + " is closed");
        }
        file.write(pcm);
        dataBytes += pcm.length;
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            int dataSize = (int) Math.min(dataBytes, Integer.MAX_VALUE - 36L);
            file.seek(0);
            file.write(header(dataSize));
        } finally {
            file.close();
        }
    }

    static byte[] header(int dataSize) throws IOException {
        ByteArrayOutputStream os = new ByteArrayOutputStream(HEADER_SIZE);
        os.write(new byte[] {'R', 'I', 'F', 'F'});
        writeLEInt(os, 36 + dataSize);
        os.write(new byte[] {'W', 'A', 'V', 'E'});

        os.write(new byte[] {'f', 'm', 't', ' '});
        writeLEInt(os, 16);
        writeLEShort(os, (short) 1);
        writeLEShort(os, (short) CHANNELS);
        writeLEInt(os, SAMPLE_RATE);
        writeLEInt(os, SAMPLE_RATE * CHANNELS * BYTES_PER_SAMPLE);
        writeLEShort(os, (short) (CHANNELS * BYTES_PER_SAMPLE));
        writeLEShort(os, (short) BITS_PER_SAMPLE);

        os.write(new byte[] {'d', 'a', 't', 'a'});
        writeLEInt(os, dataSize);
        return os.toByteArray();
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
