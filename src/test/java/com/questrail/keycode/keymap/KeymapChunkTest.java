package com.questrail.keycode.keymap;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class KeymapChunkTest
{
    @Test
    void planCoversTotalWithShortTail() {
        List<KeymapChunk> chunks = KeymapChunk.plan(60, 28);

        assertEquals(List.of(
                new KeymapChunk(0, 28),
                new KeymapChunk(28, 28),
                new KeymapChunk(56, 4)
        ), chunks);
        assertEquals(60, chunks.get(2).end());
    }

    @Test
    void exactMultipleHasNoTail() {
        List<KeymapChunk> chunks = KeymapChunk.plan(56);
        assertEquals(2, chunks.size());
        assertEquals(28, chunks.get(1).length());
    }

    @Test
    void emptyKeymapNeedsNoReads() {
        assertTrue(KeymapChunk.plan(0).isEmpty());
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> KeymapChunk.plan(-1));
        assertThrows(IllegalArgumentException.class, () -> KeymapChunk.plan(10, 0));
        assertThrows(IllegalArgumentException.class, () -> new KeymapChunk(-1, 4));
        assertThrows(IllegalArgumentException.class, () -> new KeymapChunk(0, 0));
    }
}
