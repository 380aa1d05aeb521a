package com.questrail.keycode.table;

/**
 * Protocol v6 values, matching the current firmware keycode ranges.
 */
final class CurrentKeycodeValues
{
    private CurrentKeycodeValues() {
    }

    static void define(KeycodeTable.Builder t) {
        t.define("QK_MOD_TAP", 0x2000);
        t.define("QK_LAYER_TAP", 0x4000);
        t.define("QK_LAYER_MOD", 0x5000);
        t.define("QK_TO", 0x5200);
        t.define("QK_MOMENTARY", 0x5220);
        t.define("QK_DEF_LAYER", 0x5240);
        t.define("QK_TOGGLE_LAYER", 0x5260);
        t.define("QK_ONE_SHOT_LAYER", 0x5280);
        t.define("QK_ONE_SHOT_MOD", 0x52A0);
        t.define("QK_LAYER_TAP_TOGGLE", 0x52C0);
        t.define("QK_PERSISTENT_DEF_LAYER", 0x52E0);
        t.define("QK_SWAP_HANDS", 0x5600);
        t.define("QK_TAP_DANCE", 0x5700);
        t.define("QK_MACRO", 0x7700);
        t.define("QK_USER", 0x7E00);

        t.define(ProtocolLayout.ON_PRESS, 0);
        t.define(ProtocolLayout.LAYER_MOD_SHIFT, 5);
        t.define(ProtocolLayout.LAYER_MOD_MASK, 0x1F);

        t.sequence(0xCD, SharedKeycodeValues.mouse());
        t.sequence(0xD9, SharedKeycodeValues.mouseWheelAndAcceleration());

        t.sequence(0x56F0, SharedKeycodeValues.swapHands());

        t.sequence(0x7000,
                "MAGIC_SWAP_CONTROL_CAPSLOCK", "MAGIC_UNSWAP_CONTROL_CAPSLOCK");
        t.sequence(0x7003,
                "MAGIC_UNCAPSLOCK_TO_CONTROL", "MAGIC_CAPSLOCK_TO_CONTROL",
                "MAGIC_SWAP_LALT_LGUI", "MAGIC_UNSWAP_LALT_LGUI",
                "MAGIC_SWAP_RALT_RGUI", "MAGIC_UNSWAP_RALT_RGUI",
                "MAGIC_UNNO_GUI", "MAGIC_NO_GUI", "MAGIC_TOGGLE_GUI",
                "MAGIC_SWAP_GRAVE_ESC", "MAGIC_UNSWAP_GRAVE_ESC",
                "MAGIC_SWAP_BACKSLASH_BACKSPACE", "MAGIC_UNSWAP_BACKSLASH_BACKSPACE");
        t.sequence(0x7011,
                "MAGIC_HOST_NKRO", "MAGIC_UNHOST_NKRO", "MAGIC_TOGGLE_NKRO",
                "MAGIC_SWAP_ALT_GUI", "MAGIC_UNSWAP_ALT_GUI", "MAGIC_TOGGLE_ALT_GUI",
                "MAGIC_SWAP_LCTL_LGUI", "MAGIC_UNSWAP_LCTL_LGUI",
                "MAGIC_SWAP_RCTL_RGUI", "MAGIC_UNSWAP_RCTL_RGUI",
                "MAGIC_SWAP_CTL_GUI", "MAGIC_UNSWAP_CTL_GUI", "MAGIC_TOGGLE_CTL_GUI",
                "MAGIC_EE_HANDS_LEFT", "MAGIC_EE_HANDS_RIGHT");

        t.sequence(0x7100, "MI_ON", "MI_OFF", "MI_TOG");
        t.sequence(0x7103, SharedKeycodeValues.midiNotes());
        t.sequence(0x714B, SharedKeycodeValues.midiOctaves());
        t.sequence(0x7155, "MI_OCTD", "MI_OCTU");
        t.sequence(0x7157, SharedKeycodeValues.midiTranspositions());
        t.sequence(0x7164, "MI_TRNSD", "MI_TRNSU");
        for (int i = 1; i <= 10; i++) {
            t.define("MI_VEL_" + i, 0x7166 + i);
        }
        t.sequence(0x7171, "MI_VELD", "MI_VELU");
        for (int i = 1; i <= 16; i++) {
            t.define("MI_CH" + i, 0x7172 + i);
        }
        t.sequence(0x7183, "MI_CHD", "MI_CHU");
        t.sequence(0x7185, SharedKeycodeValues.midiControls());

        t.sequence(0x7200, SharedKeycodeValues.sequencer());
        t.indexed("JS_%d", 0x7400, 32);

        t.sequence(0x7480, "AU_ON", "AU_OFF", "AU_TOG");
        t.sequence(0x748A, "CLICKY_TOGGLE");
        t.sequence(0x748D, "CLICKY_UP", "CLICKY_DOWN", "CLICKY_RESET",
                "MU_ON", "MU_OFF", "MU_TOG", "MU_MOD");

        t.sequence(0x7800, "BL_ON", "BL_OFF", "BL_DEC", "BL_INC", "BL_STEP", "BL_TOGG", "BL_BRTG");
        t.sequence(0x7810, SharedKeycodeValues.ledMatrix());
        t.sequence(0x7820, SharedKeycodeValues.rgb());
        t.sequence(0x7840, SharedKeycodeValues.rgbMatrix());

        t.sequence(0x7C00, "QK_BOOT", "QK_REBOOT");
        t.define("QK_CLEAR_EEPROM", 0x7C03);
        t.sequence(0x7C10, SharedKeycodeValues.autoShift());
        t.define("KC_GESC", 0x7C16);
        t.sequence(0x7C18,
                "KC_LCPO", "KC_RCPC", "KC_LSPO", "KC_RSPC", "KC_LAPO", "KC_RAPC", "KC_SFTENT");
        t.sequence(0x7C40, SharedKeycodeValues.haptic());
        t.sequence(0x7C50, "CMB_ON", "CMB_OFF", "CMB_TOG");
        t.sequence(0x7C53, SharedKeycodeValues.dynamicMacros());
        t.sequence(0x7C5D, "QK_KEY_OVERRIDE_TOGGLE", "QK_KEY_OVERRIDE_ON", "QK_KEY_OVERRIDE_OFF");
        t.define("QK_CAPS_WORD_TOGGLE", 0x7C73);
        t.sequence(0x7C77, "FN_MO13", "FN_MO23", "QK_REPEAT_KEY", "QK_ALT_REPEAT_KEY", "QK_LAYER_LOCK");
    }
}
