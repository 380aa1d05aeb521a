package com.questrail.keycode.keymap;

import java.util.List;

/**
 * Converts between the raw keymap bytes a device stores and a
 * {@link KeymapBuffer}.
 *
 * <p>Each key is a big-endian unsigned 16-bit value. There is no header,
 * framing or checksum.</p>
 */
public interface KeymapBufferCodec
{
    /**
     * @throws IllegalArgumentException if {@code raw} is not exactly
     *         {@link KeymapGeometry#byteSize()} bytes
     */
    KeymapBuffer decode(KeymapGeometry geometry, byte[] raw);

    /**
     * Decodes the payloads of reads issued per {@link #planReads}, in order.
     *
     * @throws IllegalArgumentException if the payloads do not add up to
     *         {@link KeymapGeometry#byteSize()} bytes
     */
    KeymapBuffer decodeChunks(KeymapGeometry geometry, List<byte[]> chunks);

    byte[] encode(KeymapBuffer buffer);

    default List<KeymapChunk> planReads(KeymapGeometry geometry) {
        return KeymapChunk.plan(geometry.byteSize());
    }
}
