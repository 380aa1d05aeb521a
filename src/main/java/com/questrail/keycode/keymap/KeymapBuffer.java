package com.questrail.keycode.keymap;

import com.questrail.keycode.api.KeycodeCodec;

import java.util.Arrays;
import java.util.Objects;

/**
 * KeymapBuffer
 * =============================================================================
 * Immutable grid of numeric keycodes, one per key of a {@link KeymapGeometry}.
 *
 * <p>Values are the 16-bit codes the device stores. Text access goes through
 * a {@link KeycodeCodec} supplied per call, so the same buffer can be viewed
 * under whichever registry snapshot is current.</p>
 */
public final class KeymapBuffer
{
    private static final int MAX_VALUE = KeycodeCodec.MAX_STORED_KEYCODE;

    private final KeymapGeometry geometry;
    private final int[] keycodes;

    private KeymapBuffer(KeymapGeometry geometry, int[] keycodes) {
        this.geometry = geometry;
        this.keycodes = keycodes;
    }

    /** Buffer of the given shape with every key {@link KeycodeCodec#NO_KEYCODE}. */
    public static KeymapBuffer empty(KeymapGeometry geometry) {
        Objects.requireNonNull(geometry, "geometry");
        return new KeymapBuffer(geometry, new int[geometry.keyCount()]);
    }

    /**
     * @param keycodes one value per key in layer-major order
     */
    public static KeymapBuffer of(KeymapGeometry geometry, int[] keycodes) {
        Objects.requireNonNull(geometry, "geometry");
        Objects.requireNonNull(keycodes, "keycodes");
        if (keycodes.length != geometry.keyCount()) {
            throw new IllegalArgumentException(
                    "Expected " + geometry.keyCount() + " keycodes, got " + keycodes.length);
        }
        for (int value : keycodes) {
            checkValue(value);
        }
        return new KeymapBuffer(geometry, keycodes.clone());
    }

    public KeymapGeometry geometry() {
        return geometry;
    }

    public int keycodeAt(int layer, int row, int col) {
        return keycodes[geometry.keyIndex(layer, row, col)];
    }

    public KeymapBuffer withKeycode(int layer, int row, int col, int value) {
        checkValue(value);
        int index = geometry.keyIndex(layer, row, col);
        int[] copy = keycodes.clone();
        copy[index] = value;
        return new KeymapBuffer(geometry, copy);
    }

    public String textAt(int layer, int row, int col, KeycodeCodec codec) {
        return codec.serialize(keycodeAt(layer, row, col));
    }

    /**
     * Stores the value of {@code text}; text the codec cannot parse, or whose
     * value does not fit 16 bits, stores {@link KeycodeCodec#NO_KEYCODE}.
     */
    public KeymapBuffer withText(int layer, int row, int col, String text, KeycodeCodec codec) {
        return withKeycode(layer, row, col, codec.deserializeStored(text));
    }

    /** Copy of all values in layer-major order. */
    public int[] keycodes() {
        return keycodes.clone();
    }

    private static void checkValue(int value) {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException(
                    "Keycode " + String.format("0x%x", value) + " does not fit in 16 bits");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeymapBuffer other)) return false;
        return geometry.equals(other.geometry) && Arrays.equals(keycodes, other.keycodes);
    }

    @Override
    public int hashCode() {
        return 31 * geometry.hashCode() + Arrays.hashCode(keycodes);
    }

    @Override
    public String toString() {
        return "KeymapBuffer[" + geometry + "]";
    }
}
