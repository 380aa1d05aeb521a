package com.questrail.keycode.keymap.netty;

import com.questrail.keycode.keymap.KeymapBuffer;
import com.questrail.keycode.keymap.KeymapBufferCodec;
import com.questrail.keycode.keymap.KeymapGeometry;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.CompositeByteBuf;
import io.netty.buffer.Unpooled;

import java.util.List;
import java.util.Objects;

/**
 * NettyKeymapBufferCodec
 * =============================================================================
 * {@link KeymapBufferCodec} backed by Netty {@link ByteBuf}s.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Callers exchange {@code byte[]}
 * and {@link KeymapBuffer} only; every buffer allocated here is released
 * before the method returns.
 *
 * <p>Chunked reads are stitched with a {@link CompositeByteBuf} over the
 * chunk arrays, so no intermediate copy of the whole keymap is made.</p>
 */
public final class NettyKeymapBufferCodec implements KeymapBufferCodec
{
    @Override
    public KeymapBuffer decode(KeymapGeometry geometry, byte[] raw) {
        Objects.requireNonNull(geometry, "geometry");
        Objects.requireNonNull(raw, "raw");

        ByteBuf buf = Unpooled.wrappedBuffer(raw);
        try {
            return read(geometry, buf);
        }
        finally {
            buf.release();
        }
    }

    @Override
    public KeymapBuffer decodeChunks(KeymapGeometry geometry, List<byte[]> chunks) {
        Objects.requireNonNull(geometry, "geometry");
        Objects.requireNonNull(chunks, "chunks");

        CompositeByteBuf composite = Unpooled.compositeBuffer(Math.max(chunks.size(), 2));
        try {
            for (byte[] chunk : chunks) {
                composite.addComponent(true, Unpooled.wrappedBuffer(Objects.requireNonNull(chunk, "chunk")));
            }
            return read(geometry, composite);
        }
        finally {
            composite.release();
        }
    }

    @Override
    public byte[] encode(KeymapBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer");

        int[] keycodes = buffer.keycodes();
        ByteBuf buf = Unpooled.buffer(buffer.geometry().byteSize());
        try {
            for (int keycode : keycodes) {
                buf.writeShort(keycode);
            }
            byte[] out = new byte[buf.readableBytes()];
            buf.readBytes(out);
            return out;
        }
        finally {
            buf.release();
        }
    }

    private static KeymapBuffer read(KeymapGeometry geometry, ByteBuf buf) {
        if (buf.readableBytes() != geometry.byteSize()) {
            throw new IllegalArgumentException(
                    "Keymap for " + geometry + " is " + geometry.byteSize()
                            + " bytes, got " + buf.readableBytes());
        }
        int[] keycodes = new int[geometry.keyCount()];
        for (int i = 0; i < keycodes.length; i++) {
            keycodes[i] = buf.readUnsignedShort();
        }
        return KeymapBuffer.of(geometry, keycodes);
    }
}
