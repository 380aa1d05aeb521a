package com.questrail.keycode.keymap;

/**
 * Shape of a device keymap: layers of {@code rows x cols} keys, two bytes per
 * key, laid out layer-major then row-major.
 */
public record KeymapGeometry(int layers, int rows, int cols)
{
    public static final int BYTES_PER_KEY = 2;

    public KeymapGeometry {
        if (layers < 0 || rows < 0 || cols < 0) {
            throw new IllegalArgumentException(
                    "Keymap dimensions must be >= 0, got " + layers + "x" + rows + "x" + cols);
        }
    }

    public int keyCount() {
        return layers * rows * cols;
    }

    public int byteSize() {
        return keyCount() * BYTES_PER_KEY;
    }

    /** Index of a key in layer-major order. */
    public int keyIndex(int layer, int row, int col) {
        check("layer", layer, layers);
        check("row", row, rows);
        check("col", col, cols);
        return (layer * rows + row) * cols + col;
    }

    /** Byte offset of a key within the raw keymap. */
    public int offset(int layer, int row, int col) {
        return keyIndex(layer, row, col) * BYTES_PER_KEY;
    }

    private static void check(String name, int value, int bound) {
        if (value < 0 || value >= bound) {
            throw new IndexOutOfBoundsException(name + " " + value + " outside [0, " + bound + ")");
        }
    }
}
