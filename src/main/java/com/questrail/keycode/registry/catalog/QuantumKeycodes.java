package com.questrail.keycode.registry.catalog;

import com.questrail.keycode.api.Keycode;
import com.questrail.keycode.api.KeycodeCategory;

import java.util.List;

/**
 * Bootloader keys and firmware feature keycodes (magic, audio, haptic,
 * auto-shift, combos, key overrides, caps word, repeat, swap hands).
 */
public final class QuantumKeycodes
{
    /** Id of the bootloader-entry key; its value differs between protocol revisions. */
    public static final String RESET_KEYCODE = "QK_BOOT";

    public static final List<Keycode> BOOT = List.of(
            boot(RESET_KEYCODE, "Boot-\nloader").withTooltip("Put the keyboard into bootloader mode for flashing").withAliases("RESET").build(),
            boot("QK_REBOOT", "Reboot").withTooltip("Reboots the keyboard. Does not load the bootloader").build(),
            boot("QK_CLEAR_EEPROM", "Clear\nEEPROM").withTooltip("Reinitializes the keyboard's EEPROM (persistent memory)").withAliases("EE_CLR").build()
    );

    public static final List<Keycode> MAGIC = List.of(
            quantum("MAGIC_SWAP_CONTROL_CAPSLOCK", "Swap\nCtrl\nCaps").withTooltip("Swap Caps Lock and Left Control").withAliases("CL_SWAP").build(),
            quantum("MAGIC_UNSWAP_CONTROL_CAPSLOCK", "Unswap\nCtrl\nCaps").withTooltip("Unswap Caps Lock and Left Control").withAliases("CL_NORM").build(),
            quantum("MAGIC_CAPSLOCK_TO_CONTROL", "Caps\nto\nCtrl").withTooltip("Treat Caps Lock as Control").withAliases("CL_CTRL").build(),
            quantum("MAGIC_UNCAPSLOCK_TO_CONTROL", "Caps\nnot to\nCtrl").withTooltip("Stop treating Caps Lock as Control").withAliases("CL_CAPS").build(),
            quantum("MAGIC_SWAP_LCTL_LGUI", "Swap\nLCtl\nLGui").withTooltip("Swap Left Control and GUI").withAliases("LCG_SWP").build(),
            quantum("MAGIC_UNSWAP_LCTL_LGUI", "Unswap\nLCtl\nLGui").withTooltip("Unswap Left Control and GUI").withAliases("LCG_NRM").build(),
            quantum("MAGIC_SWAP_RCTL_RGUI", "Swap\nRCtl\nRGui").withTooltip("Swap Right Control and GUI").withAliases("RCG_SWP").build(),
            quantum("MAGIC_UNSWAP_RCTL_RGUI", "Unswap\nRCtl\nRGui").withTooltip("Unswap Right Control and GUI").withAliases("RCG_NRM").build(),
            quantum("MAGIC_SWAP_CTL_GUI", "Swap\nCtl\nGui").withTooltip("Swap Control and GUI on both sides").withAliases("CG_SWAP").build(),
            quantum("MAGIC_UNSWAP_CTL_GUI", "Unswap\nCtl\nGui").withTooltip("Unswap Control and GUI on both sides").withAliases("CG_NORM").build(),
            quantum("MAGIC_TOGGLE_CTL_GUI", "Toggle\nCtl\nGui").withTooltip("Toggle Control and GUI swap on both sides").withAliases("CG_TOGG").build(),
            quantum("MAGIC_SWAP_LALT_LGUI", "Swap\nLAlt\nLGui").withTooltip("Swap Left Alt and GUI").withAliases("LAG_SWP").build(),
            quantum("MAGIC_UNSWAP_LALT_LGUI", "Unswap\nLAlt\nLGui").withTooltip("Unswap Left Alt and GUI").withAliases("LAG_NRM").build(),
            quantum("MAGIC_SWAP_RALT_RGUI", "Swap\nRAlt\nRGui").withTooltip("Swap Right Alt and GUI").withAliases("RAG_SWP").build(),
            quantum("MAGIC_UNSWAP_RALT_RGUI", "Unswap\nRAlt\nRGui").withTooltip("Unswap Right Alt and GUI").withAliases("RAG_NRM").build(),
            quantum("MAGIC_SWAP_ALT_GUI", "Swap\nAlt\nGui").withTooltip("Swap Alt and GUI on both sides").withAliases("AG_SWAP").build(),
            quantum("MAGIC_UNSWAP_ALT_GUI", "Unswap\nAlt\nGui").withTooltip("Unswap Alt and GUI on both sides").withAliases("AG_NORM").build(),
            quantum("MAGIC_TOGGLE_ALT_GUI", "Toggle\nAlt\nGui").withTooltip("Toggle Alt and GUI swap on both sides").withAliases("AG_TOGG").build(),
            quantum("MAGIC_NO_GUI", "GUI\nOff").withTooltip("Disable the GUI keys").withAliases("GUI_OFF").build(),
            quantum("MAGIC_UNNO_GUI", "GUI\nOn").withTooltip("Enable the GUI keys").withAliases("GUI_ON").build(),
            quantum("MAGIC_TOGGLE_GUI", "GUI\nToggle").withTooltip("Toggle the GUI keys on and off").withAliases("GUI_TOGG").build(),
            quantum("MAGIC_SWAP_GRAVE_ESC", "Swap\n`\nEsc").withTooltip("Swap ` and Escape").withAliases("GE_SWAP").build(),
            quantum("MAGIC_UNSWAP_GRAVE_ESC", "Unswap\n`\nEsc").withTooltip("Unswap ` and Escape").withAliases("GE_NORM").build(),
            quantum("MAGIC_SWAP_BACKSLASH_BACKSPACE", "Swap\n\\\nBS").withTooltip("Swap \\ and Backspace").withAliases("BS_SWAP").build(),
            quantum("MAGIC_UNSWAP_BACKSLASH_BACKSPACE", "Unswap\n\\\nBS").withTooltip("Unswap \\ and Backspace").withAliases("BS_NORM").build(),
            quantum("MAGIC_HOST_NKRO", "NKRO\nOn").withTooltip("Enable N-key rollover").withAliases("NK_ON").build(),
            quantum("MAGIC_UNHOST_NKRO", "NKRO\nOff").withTooltip("Disable N-key rollover").withAliases("NK_OFF").build(),
            quantum("MAGIC_TOGGLE_NKRO", "NKRO\nToggle").withTooltip("Toggle N-key rollover").withAliases("NK_TOGG").build(),
            quantum("MAGIC_EE_HANDS_LEFT", "EEH\nLeft").withTooltip("Set the master half of a split keyboard as the left hand (for EE_HANDS)").withAliases("EH_LEFT").build(),
            quantum("MAGIC_EE_HANDS_RIGHT", "EEH\nRight").withTooltip("Set the master half of a split keyboard as the right hand (for EE_HANDS)").withAliases("EH_RGHT").build()
    );

    public static final List<Keycode> AUDIO = List.of(
            quantum("AU_ON", "Audio\nON").withTooltip("Audio mode on").build(),
            quantum("AU_OFF", "Audio\nOFF").withTooltip("Audio mode off").build(),
            quantum("AU_TOG", "Audio\nToggle").withTooltip("Toggles Audio mode").build(),
            quantum("CLICKY_TOGGLE", "Clicky\nToggle").withTooltip("Toggles Audio clicky mode").withAliases("CK_TOGG").build(),
            quantum("CLICKY_UP", "Clicky\nUp").withTooltip("Increases frequency of the clicks").withAliases("CK_UP").build(),
            quantum("CLICKY_DOWN", "Clicky\nDown").withTooltip("Decreases frequency of the clicks").withAliases("CK_DOWN").build(),
            quantum("CLICKY_RESET", "Clicky\nReset").withTooltip("Resets frequency to default").withAliases("CK_RST").build(),
            quantum("MU_ON", "Music\nOn").withTooltip("Turns on Music Mode").build(),
            quantum("MU_OFF", "Music\nOff").withTooltip("Turns off Music Mode").build(),
            quantum("MU_TOG", "Music\nToggle").withTooltip("Toggles Music Mode").build(),
            quantum("MU_MOD", "Music\nCycle").withTooltip("Cycles through the music modes").build()
    );

    public static final List<Keycode> HAPTIC = List.of(
            quantum("HPT_ON", "Haptic\nOn").withTooltip("Turn haptic feedback on").build(),
            quantum("HPT_OFF", "Haptic\nOff").withTooltip("Turn haptic feedback off").build(),
            quantum("HPT_TOG", "Haptic\nToggle").withTooltip("Toggle haptic feedback on/off").build(),
            quantum("HPT_RST", "Haptic\nReset").withTooltip("Reset haptic feedback config to default").build(),
            quantum("HPT_FBK", "Haptic\nFeed\nback").withTooltip("Toggle feedback to occur on keypress, release or both").build(),
            quantum("HPT_BUZ", "Haptic\nBuzz").withTooltip("Toggle solenoid buzz on/off").build(),
            quantum("HPT_MODI", "Haptic\nNext").withTooltip("Go to next DRV2605L waveform").build(),
            quantum("HPT_MODD", "Haptic\nPrev").withTooltip("Go to previous DRV2605L waveform").build(),
            quantum("HPT_CONT", "Haptic\nCont.").withTooltip("Toggle continuous haptic mode on/off").build(),
            quantum("HPT_CONI", "Haptic\n+").withTooltip("Increase DRV2605L continous haptic strength").build(),
            quantum("HPT_COND", "Haptic\n-").withTooltip("Decrease DRV2605L continous haptic strength").build(),
            quantum("HPT_DWLI", "Haptic\nDwell+").withTooltip("Increase Solenoid dwell time").build(),
            quantum("HPT_DWLD", "Haptic\nDwell-").withTooltip("Decrease Solenoid dwell time").build()
    );

    public static final List<Keycode> AUTOSHIFT = List.of(
            quantum("KC_ASDN", "Auto-\nshift\nDown").withTooltip("Lower the Auto Shift timeout variable (down)").build(),
            quantum("KC_ASUP", "Auto-\nshift\nUp").withTooltip("Raise the Auto Shift timeout variable (up)").build(),
            quantum("KC_ASRP", "Auto-\nshift\nReport").withTooltip("Report your current Auto Shift timeout value").build(),
            quantum("KC_ASON", "Auto-\nshift\nOn").withTooltip("Turns on the Auto Shift Function").build(),
            quantum("KC_ASOFF", "Auto-\nshift\nOff").withTooltip("Turns off the Auto Shift Function").build(),
            quantum("KC_ASTG", "Auto-\nshift\nToggle").withTooltip("Toggles the state of the Auto Shift feature").build()
    );

    public static final List<Keycode> COMBO = List.of(
            quantum("CMB_ON", "Combo\nOn").withTooltip("Turns on Combo feature").build(),
            quantum("CMB_OFF", "Combo\nOff").withTooltip("Turns off Combo feature").build(),
            quantum("CMB_TOG", "Combo\nToggle").withTooltip("Toggles Combo feature on and off").build()
    );

    public static final List<Keycode> KEY_OVERRIDE = List.of(
            quantum("QK_KEY_OVERRIDE_TOGGLE", "Key\nOverride\nToggle").withTooltip("Toggle key overrides").withAliases("KO_TOGG").build(),
            quantum("QK_KEY_OVERRIDE_ON", "Key\nOverride\nOn").withTooltip("Turn on key overrides").withAliases("KO_ON").build(),
            quantum("QK_KEY_OVERRIDE_OFF", "Key\nOverride\nOff").withTooltip("Turn off key overrides").withAliases("KO_OFF").build()
    );

    public static final List<Keycode> CAPS_WORD = List.of(
            quantum("QK_CAPS_WORD_TOGGLE", "Caps\nWord").withTooltip("Capitalizes until end of current word").withAliases("CW_TOGG").withRequiresFeature("caps_word").build()
    );

    public static final List<Keycode> REPEAT = List.of(
            quantum("QK_REPEAT_KEY", "Repeat").withTooltip("Repeats the last pressed key").withAliases("QK_REP").withRequiresFeature("repeat_key").build(),
            quantum("QK_ALT_REPEAT_KEY", "Alt\nRepeat").withTooltip("Alt repeats the last pressed key").withAliases("QK_AREP").withRequiresFeature("repeat_key").build()
    );

    public static final List<Keycode> SWAP_HANDS = List.of(
            quantum("SH_TOGG", "SH\nToggle").withTooltip("Toggle swap hands").build(),
            quantum("SH_TT", "SH\nTT").withTooltip("Momentary swap when held, toggle when tapped").build(),
            quantum("SH_MON", "SH\nMOn").withTooltip("Momentary swap hands on").build(),
            quantum("SH_MOFF", "SH\nMOff").withTooltip("Momentary swap hands off").build(),
            quantum("SH_OFF", "SH\nOff").withTooltip("Turn off swap hands").build(),
            quantum("SH_ON", "SH\nOn").withTooltip("Turn on swap hands").build(),
            quantum("SH_OS", "SH\nOS").withTooltip("One-shot swap hands").build()
    );

    public static final List<Keycode> SWAP_HANDS_TAP = List.of(
            quantum("SH_T(kc)", "SH_T\n(kc)").withTooltip("Swap hands when held, kc when tapped").masked().build()
    );

    public static final List<Keycode> ALL = Catalogs.concat(MAGIC, AUDIO, HAPTIC, AUTOSHIFT, COMBO, KEY_OVERRIDE, CAPS_WORD, REPEAT, SWAP_HANDS, SWAP_HANDS_TAP);

    private QuantumKeycodes() {
    }

    private static Keycode.Builder boot(String id, String label) {
        return Keycode.builder(id, label).withCategory(KeycodeCategory.BOOT);
    }

    private static Keycode.Builder quantum(String id, String label) {
        return Keycode.builder(id, label).withCategory(KeycodeCategory.QUANTUM);
    }
}
