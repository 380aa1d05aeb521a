package com.questrail.keycode.config;

/**
 * How much of the MIDI keycode set a device supports.
 */
public enum MidiLevel
{
    NONE,
    BASIC,
    ADVANCED;

    /**
     * Maps the device-definition setting ({@code "basic"}, {@code "advanced"})
     * to a level. Anything else, including {@code null}, means no MIDI.
     */
    public static MidiLevel fromSetting(String setting) {
        if (setting == null) {
            return NONE;
        }
        return switch (setting.trim().toLowerCase(java.util.Locale.ROOT)) {
            case "basic" -> BASIC;
            case "advanced" -> ADVANCED;
            default -> NONE;
        };
    }

    public boolean includesBasic() {
        return this != NONE;
    }

    public boolean includesAdvanced() {
        return this == ADVANCED;
    }
}
