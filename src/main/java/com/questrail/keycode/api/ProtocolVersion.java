package com.questrail.keycode.api;

/**
 * Firmware keycode protocol revision.
 *
 * <p>The two revisions lay out composite keycodes differently (layer-mod field
 * widths, base addresses of the layer and quantum ranges) while sharing the
 * basic HID usage codes and the modifier-mask encoding.</p>
 */
public enum ProtocolVersion
{
    V5(5),
    V6(6);

    private final int major;

    ProtocolVersion(int major) {
        this.major = major;
    }

    /**
     * @return the protocol major number as reported by the device handshake
     */
    public int major() {
        return major;
    }

    /**
     * Maps a reported protocol major number to a revision.
     *
     * <p>Only {@code 6} selects {@link #V6}. Every other value, including
     * {@code 0} reported by legacy firmware, selects {@link #V5}.</p>
     */
    public static ProtocolVersion fromMajor(int major) {
        return major == 6 ? V6 : V5;
    }
}
