package com.questrail.keycode.table;

/**
 * Protocol v5 values.
 *
 * <p>Quantum keycodes are laid out in the legacy firmware's enumeration order
 * starting at {@code 0x5C00}. Keycodes v5 firmware never had are parked at
 * placeholder addresses above {@code 0xFFFF}; no device can report them, so
 * they only exist to keep every catalog id resolvable.</p>
 */
final class LegacyKeycodeValues
{
    private LegacyKeycodeValues() {
    }

    static void define(KeycodeTable.Builder t) {
        t.define("QK_LAYER_TAP", 0x4000);
        t.define("QK_TO", 0x5000);
        t.define("QK_MOMENTARY", 0x5100);
        t.define("QK_DEF_LAYER", 0x5200);
        t.define("QK_TOGGLE_LAYER", 0x5300);
        t.define("QK_ONE_SHOT_LAYER", 0x5400);
        t.define("QK_ONE_SHOT_MOD", 0x5500);
        t.define("QK_TAP_DANCE", 0x5700);
        t.define("QK_LAYER_TAP_TOGGLE", 0x5800);
        t.define("QK_LAYER_MOD", 0x5900);
        t.define("QK_MOD_TAP", 0x6000);
        t.define("QK_MACRO", 0x5F12);
        t.define("QK_USER", 0x5F80);
        t.define("QK_SWAP_HANDS", 0x999D0);
        t.define("QK_PERSISTENT_DEF_LAYER", 0x99A40);

        t.define(ProtocolLayout.ON_PRESS, 1);
        t.define(ProtocolLayout.LAYER_MOD_SHIFT, 4);
        t.define(ProtocolLayout.LAYER_MOD_MASK, 0x0F);

        t.sequence(0xF0, SharedKeycodeValues.mouse());
        t.sequence(0xF9, SharedKeycodeValues.mouseWheelAndAcceleration());

        t.define("QK_BOOT", 0x5C00);
        t.sequence(0x5C02,
                "MAGIC_SWAP_CONTROL_CAPSLOCK", "MAGIC_CAPSLOCK_TO_CONTROL",
                "MAGIC_SWAP_LALT_LGUI", "MAGIC_SWAP_RALT_RGUI",
                "MAGIC_NO_GUI", "MAGIC_SWAP_GRAVE_ESC",
                "MAGIC_SWAP_BACKSLASH_BACKSPACE", "MAGIC_HOST_NKRO",
                "MAGIC_SWAP_ALT_GUI", "MAGIC_UNSWAP_CONTROL_CAPSLOCK",
                "MAGIC_UNCAPSLOCK_TO_CONTROL", "MAGIC_UNSWAP_LALT_LGUI",
                "MAGIC_UNSWAP_RALT_RGUI", "MAGIC_UNNO_GUI",
                "MAGIC_UNSWAP_GRAVE_ESC", "MAGIC_UNSWAP_BACKSLASH_BACKSPACE",
                "MAGIC_UNHOST_NKRO", "MAGIC_UNSWAP_ALT_GUI",
                "MAGIC_TOGGLE_NKRO", "MAGIC_TOGGLE_ALT_GUI",
                "KC_GESC");
        t.sequence(0x5C17, SharedKeycodeValues.autoShift());
        t.sequence(0x5C1D, "AU_ON", "AU_OFF", "AU_TOG", "CLICKY_TOGGLE");
        t.sequence(0x5C23, "CLICKY_UP", "CLICKY_DOWN", "CLICKY_RESET",
                "MU_ON", "MU_OFF", "MU_TOG", "MU_MOD");

        int midi = 0x5C2B;
        t.sequence(midi, "MI_ON", "MI_OFF", "MI_TOG");
        midi += 3;
        midi = sequence(t, midi, SharedKeycodeValues.midiNotes());
        midi = sequence(t, midi, SharedKeycodeValues.midiOctaves());
        midi = sequence(t, midi, "MI_OCTD", "MI_OCTU");
        midi = sequence(t, midi, SharedKeycodeValues.midiTranspositions());
        midi = sequence(t, midi, "MI_TRNSD", "MI_TRNSU");
        for (int i = 1; i <= 10; i++) {
            t.define("MI_VEL_" + i, midi++);
        }
        midi = sequence(t, midi, "MI_VELD", "MI_VELU");
        for (int i = 1; i <= 16; i++) {
            t.define("MI_CH" + i, midi++);
        }
        midi = sequence(t, midi, "MI_CHD", "MI_CHU");
        sequence(t, midi, SharedKeycodeValues.midiControls());

        t.sequence(0x5CBB, "BL_ON", "BL_OFF", "BL_DEC", "BL_INC", "BL_TOGG", "BL_STEP", "BL_BRTG");
        t.sequence(0x5CC2, SharedKeycodeValues.rgb());
        t.sequence(0x5CD7, "KC_LSPO", "KC_RSPC", "KC_SFTENT");
        t.define("QK_CLEAR_EEPROM", 0x5CDF);
        t.sequence(0x5CE0,
                "MAGIC_SWAP_LCTL_LGUI", "MAGIC_SWAP_RCTL_RGUI",
                "MAGIC_UNSWAP_LCTL_LGUI", "MAGIC_UNSWAP_RCTL_RGUI",
                "MAGIC_SWAP_CTL_GUI", "MAGIC_UNSWAP_CTL_GUI", "MAGIC_TOGGLE_CTL_GUI",
                "MAGIC_EE_HANDS_LEFT", "MAGIC_EE_HANDS_RIGHT");
        t.sequence(0x5CE9, SharedKeycodeValues.dynamicMacros());
        t.sequence(0x5CF3, "KC_LCPO", "KC_RCPC", "KC_LAPO", "KC_RAPC", "CMB_ON", "CMB_OFF", "CMB_TOG",
                "MAGIC_TOGGLE_GUI");
        t.sequence(0x5D00, SharedKeycodeValues.haptic());
        t.sequence(0x5F10, "FN_MO13", "FN_MO23");

        // Placeholders for keycodes v5 firmware does not implement.
        t.sequence(0x9990, SharedKeycodeValues.rgbMatrix());
        t.define("QK_REBOOT", 0x999D);
        t.define("QK_CAPS_WORD_TOGGLE", 0x999E);
        t.sequence(0x999C3, "QK_KEY_OVERRIDE_TOGGLE", "QK_KEY_OVERRIDE_ON", "QK_KEY_OVERRIDE_OFF");
        t.sequence(0x999D1, SharedKeycodeValues.swapHands());
        t.sequence(0x999E0, SharedKeycodeValues.sequencer());
        t.indexed("JS_%d", 0x999F0, 32);
        t.sequence(0x99A10, SharedKeycodeValues.ledMatrix());
        t.sequence(0x99A20, "QK_REPEAT_KEY", "QK_ALT_REPEAT_KEY", "QK_LAYER_LOCK");
    }

    private static int sequence(KeycodeTable.Builder t, int start, String... names) {
        t.sequence(start, names);
        return start + names.length;
    }
}
