package com.questrail.keycode.registry.catalog;

import com.questrail.keycode.api.Keycode;
import com.questrail.keycode.api.KeycodeCategory;

import java.util.ArrayList;
import java.util.List;

/** F13-F24, system and application keys, media playback, mouse and joystick. */
public final class MediaKeycodes
{
    public static final List<Keycode> FUNCTION_KEYS = List.of(
            media("KC_F13", "F13").build(),
            media("KC_F14", "F14").build(),
            media("KC_F15", "F15").build(),
            media("KC_F16", "F16").build(),
            media("KC_F17", "F17").build(),
            media("KC_F18", "F18").build(),
            media("KC_F19", "F19").build(),
            media("KC_F20", "F20").build(),
            media("KC_F21", "F21").build(),
            media("KC_F22", "F22").build(),
            media("KC_F23", "F23").build(),
            media("KC_F24", "F24").build()
    );

    public static final List<Keycode> SYSTEM = List.of(
            media("KC_PWR", "Power").withTooltip("System Power Down").withAliases("KC_SYSTEM_POWER").build(),
            media("KC_SLEP", "Sleep").withTooltip("System Sleep").withAliases("KC_SYSTEM_SLEEP").build(),
            media("KC_WAKE", "Wake").withTooltip("System Wake").withAliases("KC_SYSTEM_WAKE").build(),
            media("KC_EXEC", "Exec").withTooltip("Execute").withAliases("KC_EXECUTE").build(),
            media("KC_HELP", "Help").build(),
            media("KC_SLCT", "Select").withAliases("KC_SELECT").build(),
            media("KC_STOP", "Stop").build(),
            media("KC_AGIN", "Again").withAliases("KC_AGAIN").build(),
            media("KC_UNDO", "Undo").build(),
            media("KC_CUT", "Cut").build(),
            media("KC_COPY", "Copy").build(),
            media("KC_PSTE", "Paste").withAliases("KC_PASTE").build(),
            media("KC_FIND", "Find").build()
    );

    public static final List<Keycode> APPLICATIONS = List.of(
            media("KC_CALC", "Calc").withTooltip("Launch Calculator (Windows)").withAliases("KC_CALCULATOR").build(),
            media("KC_MAIL", "Mail").withTooltip("Launch Mail (Windows)").build(),
            media("KC_MSEL", "Media\nPlayer").withTooltip("Launch Media Player (Windows)").withAliases("KC_MEDIA_SELECT").build(),
            media("KC_MYCM", "My\nPC").withTooltip("Launch My Computer (Windows)").withAliases("KC_MY_COMPUTER").build(),
            media("KC_WSCH", "Browser\nSearch").withTooltip("Browser Search (Windows)").withAliases("KC_WWW_SEARCH").build(),
            media("KC_WHOM", "Browser\nHome").withTooltip("Browser Home (Windows)").withAliases("KC_WWW_HOME").build(),
            media("KC_WBAK", "Browser\nBack").withTooltip("Browser Back (Windows)").withAliases("KC_WWW_BACK").build(),
            media("KC_WFWD", "Browser\nForward").withTooltip("Browser Forward (Windows)").withAliases("KC_WWW_FORWARD").build(),
            media("KC_WSTP", "Browser\nStop").withTooltip("Browser Stop (Windows)").withAliases("KC_WWW_STOP").build(),
            media("KC_WREF", "Browser\nRefresh").withTooltip("Browser Refresh (Windows)").withAliases("KC_WWW_REFRESH").build(),
            media("KC_WFAV", "Browser\nFav.").withTooltip("Browser Favorites (Windows)").withAliases("KC_WWW_FAVORITES").build(),
            media("KC_BRIU", "Bright.\nUp").withTooltip("Increase the brightness of screen (Laptop)").withAliases("KC_BRIGHTNESS_UP").build(),
            media("KC_BRID", "Bright.\nDown").withTooltip("Decrease the brightness of screen (Laptop)").withAliases("KC_BRIGHTNESS_DOWN").build()
    );

    public static final List<Keycode> PLAYBACK = List.of(
            media("KC_MPRV", "Media\nPrev").withTooltip("Previous Track").withAliases("KC_MEDIA_PREV_TRACK").build(),
            media("KC_MNXT", "Media\nNext").withTooltip("Next Track").withAliases("KC_MEDIA_NEXT_TRACK").build(),
            media("KC_MUTE", "Mute").withTooltip("Mute Audio").withAliases("KC_AUDIO_MUTE").build(),
            media("KC_VOLD", "Vol -").withTooltip("Volume Down").withAliases("KC_AUDIO_VOL_DOWN").build(),
            media("KC_VOLU", "Vol +").withTooltip("Volume Up").withAliases("KC_AUDIO_VOL_UP").build(),
            media("KC__VOLDOWN", "Vol -\nAlt").withTooltip("Volume Down Alternate").build(),
            media("KC__VOLUP", "Vol +\nAlt").withTooltip("Volume Up Alternate").build(),
            media("KC_MSTP", "Media\nStop").withAliases("KC_MEDIA_STOP").build(),
            media("KC_MPLY", "Media\nPlay").withTooltip("Play/Pause").withAliases("KC_MEDIA_PLAY_PAUSE").build(),
            media("KC_MRWD", "Prev\nTrack\n(macOS)").withTooltip("Previous Track / Rewind (macOS)").withAliases("KC_MEDIA_REWIND").build(),
            media("KC_MFFD", "Next\nTrack\n(macOS)").withTooltip("Next Track / Fast Forward (macOS)").withAliases("KC_MEDIA_FAST_FORWARD").build(),
            media("KC_EJCT", "Eject").withTooltip("Eject (macOS)").withAliases("KC_MEDIA_EJECT").build()
    );

    public static final List<Keycode> MOUSE = List.of(
            media("KC_MS_U", "Mouse\nUp").withTooltip("Mouse Cursor Up").withAliases("KC_MS_UP").build(),
            media("KC_MS_D", "Mouse\nDown").withTooltip("Mouse Cursor Down").withAliases("KC_MS_DOWN").build(),
            media("KC_MS_L", "Mouse\nLeft").withTooltip("Mouse Cursor Left").withAliases("KC_MS_LEFT").build(),
            media("KC_MS_R", "Mouse\nRight").withTooltip("Mouse Cursor Right").withAliases("KC_MS_RIGHT").build(),
            media("KC_BTN1", "Mouse\n1").withTooltip("Mouse Button 1").withAliases("KC_MS_BTN1").build(),
            media("KC_BTN2", "Mouse\n2").withTooltip("Mouse Button 2").withAliases("KC_MS_BTN2").build(),
            media("KC_BTN3", "Mouse\n3").withTooltip("Mouse Button 3").withAliases("KC_MS_BTN3").build(),
            media("KC_BTN4", "Mouse\n4").withTooltip("Mouse Button 4").withAliases("KC_MS_BTN4").build(),
            media("KC_BTN5", "Mouse\n5").withTooltip("Mouse Button 5").withAliases("KC_MS_BTN5").build(),
            media("KC_WH_U", "Mouse\nWheel\nUp").withAliases("KC_MS_WH_UP").build(),
            media("KC_WH_D", "Mouse\nWheel\nDown").withAliases("KC_MS_WH_DOWN").build(),
            media("KC_WH_L", "Mouse\nWheel\nLeft").withAliases("KC_MS_WH_LEFT").build(),
            media("KC_WH_R", "Mouse\nWheel\nRight").withAliases("KC_MS_WH_RIGHT").build(),
            media("KC_ACL0", "Mouse\nAccel\n0").withTooltip("Set mouse acceleration to 0").withAliases("KC_MS_ACCEL0").build(),
            media("KC_ACL1", "Mouse\nAccel\n1").withTooltip("Set mouse acceleration to 1").withAliases("KC_MS_ACCEL1").build(),
            media("KC_ACL2", "Mouse\nAccel\n2").withTooltip("Set mouse acceleration to 2").withAliases("KC_MS_ACCEL2").build()
    );

    public static final List<Keycode> LOCKING = List.of(
            media("KC_LCAP", "Locking\nCaps").withTooltip("Locking Caps Lock").withAliases("KC_LOCKING_CAPS").build(),
            media("KC_LNUM", "Locking\nNum").withTooltip("Locking Num Lock").withAliases("KC_LOCKING_NUM").build(),
            media("KC_LSCR", "Locking\nScroll").withTooltip("Locking Scroll Lock").withAliases("KC_LOCKING_SCROLL").build()
    );

    public static final List<Keycode> JOYSTICK = joystick();

    public static final List<Keycode> ALL = Catalogs.concat(FUNCTION_KEYS, SYSTEM, APPLICATIONS, PLAYBACK, MOUSE, LOCKING, JOYSTICK);

    private MediaKeycodes() {
    }

    private static Keycode.Builder media(String id, String label) {
        return Keycode.builder(id, label).withCategory(KeycodeCategory.MEDIA);
    }

    private static List<Keycode> joystick() {
        List<Keycode> keys = new ArrayList<>(32);
        for (int i = 0; i < 32; i++) {
            keys.add(media("JS_" + i, "JS\n" + i).withTooltip("Joystick button " + i).build());
        }
        return List.copyOf(keys);
    }
}
