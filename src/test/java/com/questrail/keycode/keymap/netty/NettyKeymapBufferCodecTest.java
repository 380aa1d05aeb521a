package com.questrail.keycode.keymap.netty;

import com.questrail.keycode.keymap.KeymapBuffer;
import com.questrail.keycode.keymap.KeymapBufferCodec;
import com.questrail.keycode.keymap.KeymapChunk;
import com.questrail.keycode.keymap.KeymapGeometry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyKeymapBufferCodecTest
 * -----------------------------------------------------------------------------
 * Byte-level keymap encoding: big-endian 16-bit values, layer-major, with
 * chunked reads stitched back together.
 */
final class NettyKeymapBufferCodecTest
{
    private final KeymapBufferCodec codec = new NettyKeymapBufferCodec();

    @Test
    void decodesBigEndianValues() {
        KeymapGeometry geometry = new KeymapGeometry(1, 1, 3);
        byte[] raw = { 0x00, 0x04, 0x42, 0x04, (byte) 0xFF, (byte) 0xFF };

        KeymapBuffer buffer = codec.decode(geometry, raw);

        assertEquals(0x0004, buffer.keycodeAt(0, 0, 0));
        assertEquals(0x4204, buffer.keycodeAt(0, 0, 1));
        assertEquals(0xFFFF, buffer.keycodeAt(0, 0, 2));
    }

    @Test
    void encodesBigEndianValues() {
        KeymapGeometry geometry = new KeymapGeometry(1, 1, 2);
        KeymapBuffer buffer = KeymapBuffer.of(geometry, new int[] { 0x5221, 0x00E0 });

        assertArrayEquals(new byte[] { 0x52, 0x21, 0x00, (byte) 0xE0 }, codec.encode(buffer));
    }

    @Test
    void encodeThenDecodePreservesTheGrid() {
        KeymapGeometry geometry = new KeymapGeometry(4, 5, 14);
        int[] values = new int[geometry.keyCount()];
        for (int i = 0; i < values.length; i++) {
            values[i] = (i * 0x0101) & 0xFFFF;
        }
        KeymapBuffer buffer = KeymapBuffer.of(geometry, values);

        assertEquals(buffer, codec.decode(geometry, codec.encode(buffer)));
    }

    @Test
    void plannedChunksDecodeToTheSameBuffer() {
        KeymapGeometry geometry = new KeymapGeometry(2, 3, 7);
        int[] values = new int[geometry.keyCount()];
        Arrays.setAll(values, i -> 0x4000 + i);
        byte[] raw = codec.encode(KeymapBuffer.of(geometry, values));

        List<KeymapChunk> plan = codec.planReads(geometry);
        assertEquals(geometry.byteSize(), plan.get(plan.size() - 1).end());

        List<byte[]> chunks = new ArrayList<>();
        for (KeymapChunk chunk : plan) {
            chunks.add(Arrays.copyOfRange(raw, chunk.offset(), chunk.end()));
        }

        assertEquals(codec.decode(geometry, raw), codec.decodeChunks(geometry, chunks));
    }

    @Test
    void chunksMaySplitAKey() {
        KeymapGeometry geometry = new KeymapGeometry(1, 1, 2);
        List<byte[]> chunks = List.of(new byte[] { 0x12 }, new byte[] { 0x34, 0x56 }, new byte[] { 0x78 });

        KeymapBuffer buffer = codec.decodeChunks(geometry, chunks);

        assertEquals(0x1234, buffer.keycodeAt(0, 0, 0));
        assertEquals(0x5678, buffer.keycodeAt(0, 0, 1));
    }

    @Test
    void wrongSizeIsRejected() {
        KeymapGeometry geometry = new KeymapGeometry(1, 2, 2);

        assertThrows(IllegalArgumentException.class, () -> codec.decode(geometry, new byte[7]));
        assertThrows(IllegalArgumentException.class, () -> codec.decode(geometry, new byte[9]));
        assertThrows(IllegalArgumentException.class,
                () -> codec.decodeChunks(geometry, List.of(new byte[4], new byte[2])));
    }

    @Test
    void emptyGeometryRoundTrips() {
        KeymapGeometry geometry = new KeymapGeometry(0, 0, 0);

        assertEquals(0, codec.encode(KeymapBuffer.empty(geometry)).length);
        assertEquals(KeymapBuffer.empty(geometry), codec.decode(geometry, new byte[0]));
        assertEquals(KeymapBuffer.empty(geometry), codec.decodeChunks(geometry, List.of()));
    }
}
