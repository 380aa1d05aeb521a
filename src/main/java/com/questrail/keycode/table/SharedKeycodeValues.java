package com.questrail.keycode.table;

import java.util.ArrayList;
import java.util.List;

/**
 * Values identical in every protocol revision: the HID usage page, the
 * modifier keys, the modifier masks and the {@code MOD_*} bits.
 */
final class SharedKeycodeValues
{
    private static final String[] NOTES = {
            "C", "Cs", "D", "Ds", "E", "F", "Fs", "G", "Gs", "A", "As", "B"
    };

    private SharedKeycodeValues() {
    }

    static void define(KeycodeTable.Builder t) {
        t.define("KC_NO", 0x00);
        t.define("KC_TRNS", 0x01);

        for (char c = 'A'; c <= 'Z'; c++) {
            t.define("KC_" + c, 0x04 + (c - 'A'));
        }
        t.sequence(0x1E, "KC_1", "KC_2", "KC_3", "KC_4", "KC_5", "KC_6", "KC_7", "KC_8", "KC_9", "KC_0");
        t.sequence(0x28,
                "KC_ENTER", "KC_ESCAPE", "KC_BSPACE", "KC_TAB", "KC_SPACE",
                "KC_MINUS", "KC_EQUAL", "KC_LBRACKET", "KC_RBRACKET", "KC_BSLASH",
                "KC_NONUS_HASH", "KC_SCOLON", "KC_QUOTE", "KC_GRAVE", "KC_COMMA",
                "KC_DOT", "KC_SLASH", "KC_CAPSLOCK");
        for (int i = 1; i <= 12; i++) {
            t.define("KC_F" + i, 0x3A + (i - 1));
        }
        t.sequence(0x46,
                "KC_PSCREEN", "KC_SCROLLLOCK", "KC_PAUSE", "KC_INSERT", "KC_HOME",
                "KC_PGUP", "KC_DELETE", "KC_END", "KC_PGDOWN", "KC_RIGHT",
                "KC_LEFT", "KC_DOWN", "KC_UP",
                "KC_NUMLOCK", "KC_KP_SLASH", "KC_KP_ASTERISK", "KC_KP_MINUS", "KC_KP_PLUS",
                "KC_KP_ENTER", "KC_KP_1", "KC_KP_2", "KC_KP_3", "KC_KP_4",
                "KC_KP_5", "KC_KP_6", "KC_KP_7", "KC_KP_8", "KC_KP_9",
                "KC_KP_0", "KC_KP_DOT", "KC_NONUS_BSLASH", "KC_APPLICATION");
        t.define("KC_KP_EQUAL", 0x67);
        for (int i = 13; i <= 24; i++) {
            t.define("KC_F" + i, 0x68 + (i - 13));
        }
        t.sequence(0x74, "KC_EXEC", "KC_HELP");
        t.sequence(0x77,
                "KC_SLCT", "KC_STOP", "KC_AGIN", "KC_UNDO", "KC_CUT",
                "KC_COPY", "KC_PSTE", "KC_FIND", "KC__MUTE", "KC__VOLUP",
                "KC__VOLDOWN", "KC_LCAP", "KC_LNUM", "KC_LSCR", "KC_KP_COMMA");
        t.sequence(0x87, "KC_RO", "KC_KANA", "KC_JYEN", "KC_HENK", "KC_MHEN");
        t.sequence(0x90, "KC_LANG1", "KC_LANG2");
        t.sequence(0xA5,
                "KC_PWR", "KC_SLEP", "KC_WAKE", "KC_MUTE", "KC_VOLU",
                "KC_VOLD", "KC_MNXT", "KC_MPRV", "KC_MSTP", "KC_MPLY",
                "KC_MSEL", "KC_EJCT", "KC_MAIL", "KC_CALC", "KC_MYCM",
                "KC_WSCH", "KC_WHOM", "KC_WBAK", "KC_WFWD", "KC_WSTP",
                "KC_WREF", "KC_WFAV", "KC_MFFD", "KC_MRWD", "KC_BRIU",
                "KC_BRID");
        t.sequence(0xE0,
                "KC_LCTRL", "KC_LSHIFT", "KC_LALT", "KC_LGUI",
                "KC_RCTRL", "KC_RSHIFT", "KC_RALT", "KC_RGUI");

        t.define("QK_LCTL", 0x0100);
        t.define("QK_LSFT", 0x0200);
        t.define("QK_LALT", 0x0400);
        t.define("QK_LGUI", 0x0800);
        t.define("QK_RCTL", 0x1100);
        t.define("QK_RSFT", 0x1200);
        t.define("QK_RALT", 0x1400);
        t.define("QK_RGUI", 0x1800);

        t.define("MOD_LCTL", ModifierCombo.Mods.LCTL);
        t.define("MOD_LSFT", ModifierCombo.Mods.LSFT);
        t.define("MOD_LALT", ModifierCombo.Mods.LALT);
        t.define("MOD_LGUI", ModifierCombo.Mods.LGUI);
        t.define("MOD_RCTL", ModifierCombo.Mods.RCTL);
        t.define("MOD_RSFT", ModifierCombo.Mods.RSFT);
        t.define("MOD_RALT", ModifierCombo.Mods.RALT);
        t.define("MOD_RGUI", ModifierCombo.Mods.RGUI);
        t.define("MOD_MEH", ModifierCombo.Mods.LCTL | ModifierCombo.Mods.LSFT | ModifierCombo.Mods.LALT);
        t.define("MOD_HYPR", ModifierCombo.Mods.LCTL | ModifierCombo.Mods.LSFT
                | ModifierCombo.Mods.LALT | ModifierCombo.Mods.LGUI);
    }

    /** {@code MI_C .. MI_B_5}: twelve notes over six octaves. */
    static String[] midiNotes() {
        List<String> names = new ArrayList<>(72);
        for (int octave = 0; octave <= 5; octave++) {
            for (String note : NOTES) {
                names.add(octave == 0 ? "MI_" + note : "MI_" + note + "_" + octave);
            }
        }
        return names.toArray(new String[0]);
    }

    /** {@code MI_OCT_N2 .. MI_OCT_7}. */
    static String[] midiOctaves() {
        List<String> names = new ArrayList<>(10);
        for (int i = -2; i <= 7; i++) {
            names.add(i < 0 ? "MI_OCT_N" + (-i) : "MI_OCT_" + i);
        }
        return names.toArray(new String[0]);
    }

    /** {@code MI_TRNS_N6 .. MI_TRNS_6}. */
    static String[] midiTranspositions() {
        List<String> names = new ArrayList<>(13);
        for (int i = -6; i <= 6; i++) {
            names.add(i < 0 ? "MI_TRNS_N" + (-i) : "MI_TRNS_" + i);
        }
        return names.toArray(new String[0]);
    }

    /** Sustain, portamento and the remaining controller keys, in firmware order. */
    static String[] midiControls() {
        return new String[] {
                "MI_ALLOFF", "MI_SUS", "MI_PORT", "MI_SOST", "MI_SOFT", "MI_LEG",
                "MI_MOD", "MI_MODSD", "MI_MODSU", "MI_BENDD", "MI_BENDU"
        };
    }

    static String[] sequencer() {
        return new String[] {
                "SQ_ON", "SQ_OFF", "SQ_TOGG", "SQ_TMPD", "SQ_TMPU",
                "SQ_RESD", "SQ_RESU", "SQ_SALL", "SQ_SCLR"
        };
    }

    static String[] haptic() {
        return new String[] {
                "HPT_ON", "HPT_OFF", "HPT_TOG", "HPT_RST", "HPT_FBK", "HPT_BUZ", "HPT_MODI",
                "HPT_MODD", "HPT_CONT", "HPT_CONI", "HPT_COND", "HPT_DWLI", "HPT_DWLD"
        };
    }

    static String[] rgb() {
        return new String[] {
                "RGB_TOG", "RGB_MOD", "RGB_RMOD", "RGB_HUI", "RGB_HUD", "RGB_SAI", "RGB_SAD",
                "RGB_VAI", "RGB_VAD", "RGB_SPI", "RGB_SPD", "RGB_M_P", "RGB_M_B", "RGB_M_R",
                "RGB_M_SW", "RGB_M_SN", "RGB_M_K", "RGB_M_X", "RGB_M_G", "RGB_M_T"
        };
    }

    static String[] rgbMatrix() {
        return new String[] {
                "RM_ON", "RM_OFF", "RM_TOGG", "RM_NEXT", "RM_PREV", "RM_HUEU", "RM_HUED",
                "RM_SATU", "RM_SATD", "RM_VALU", "RM_VALD", "RM_SPDU", "RM_SPDD"
        };
    }

    static String[] ledMatrix() {
        return new String[] {
                "LM_ON", "LM_OFF", "LM_TOGG", "LM_NEXT", "LM_PREV",
                "LM_BRIU", "LM_BRID", "LM_SPDU", "LM_SPDD"
        };
    }

    static String[] swapHands() {
        return new String[] { "SH_TOGG", "SH_TT", "SH_MON", "SH_MOFF", "SH_OFF", "SH_ON", "SH_OS" };
    }

    static String[] dynamicMacros() {
        return new String[] {
                "DYN_REC_START1", "DYN_REC_START2", "DYN_REC_STOP", "DYN_MACRO_PLAY1", "DYN_MACRO_PLAY2"
        };
    }

    static String[] mouse() {
        return new String[] {
                "KC_MS_U", "KC_MS_D", "KC_MS_L", "KC_MS_R",
                "KC_BTN1", "KC_BTN2", "KC_BTN3", "KC_BTN4", "KC_BTN5"
        };
    }

    static String[] mouseWheelAndAcceleration() {
        return new String[] { "KC_WH_U", "KC_WH_D", "KC_WH_L", "KC_WH_R", "KC_ACL0", "KC_ACL1", "KC_ACL2" };
    }

    static String[] autoShift() {
        return new String[] { "KC_ASDN", "KC_ASUP", "KC_ASRP", "KC_ASON", "KC_ASOFF", "KC_ASTG" };
    }
}
