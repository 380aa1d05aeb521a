package com.questrail.keycode.keymap;

import java.util.ArrayList;
import java.util.List;

/**
 * One bounded read of the raw keymap: {@code length} bytes starting at
 * {@code offset}.
 */
public record KeymapChunk(int offset, int length)
{
    /** Largest keymap payload one device report carries. */
    public static final int DEFAULT_CHUNK_SIZE = 28;

    public KeymapChunk {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got " + offset);
        }
        if (length <= 0) {
            throw new IllegalArgumentException("length must be > 0, got " + length);
        }
    }

    public int end() {
        return offset + length;
    }

    /**
     * Covers {@code totalBytes} with consecutive chunks of at most
     * {@code chunkSize} bytes; only the last may be shorter.
     */
    public static List<KeymapChunk> plan(int totalBytes, int chunkSize) {
        if (totalBytes < 0) {
            throw new IllegalArgumentException("totalBytes must be >= 0, got " + totalBytes);
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0, got " + chunkSize);
        }
        List<KeymapChunk> chunks = new ArrayList<>((totalBytes + chunkSize - 1) / chunkSize);
        for (int offset = 0; offset < totalBytes; offset += chunkSize) {
            chunks.add(new KeymapChunk(offset, Math.min(chunkSize, totalBytes - offset)));
        }
        return List.copyOf(chunks);
    }

    public static List<KeymapChunk> plan(int totalBytes) {
        return plan(totalBytes, DEFAULT_CHUNK_SIZE);
    }
}
